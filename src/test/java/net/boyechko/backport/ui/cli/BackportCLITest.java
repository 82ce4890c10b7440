/*
 * Tree-Backport - Version-gated source rewriting
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.backport.ui.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.backport.BackportTestBase;
import net.boyechko.backport.config.BuildConfig;
import net.boyechko.backport.core.VerbosityLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BackportCLITest extends BackportTestBase {
    private static final String SERVICE = TREES.resolve("service.yaml").toString();

    @TempDir Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void resetStreams() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return BackportCLI.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8).replace("\r", "");
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8).replace("\r", "");
    }

    @Test
    void helpExitsCleanly() {
        assertEquals(0, run("--help"));
        assertTrue(out().startsWith("Usage: "));
    }

    @Test
    void missingInputIsAnError() {
        assertEquals(1, run());
        assertTrue(err().startsWith("Error: No input file specified"));
    }

    @Test
    void unknownOptionIsAnError() {
        assertEquals(1, run("--bogus", SERVICE));
        assertEquals("Error: Unknown option: --bogus\n", err());
    }

    @Test
    void optionWithoutValueIsAnError() {
        assertEquals(1, run(SERVICE, "-t"));
        assertEquals("Error: Value not specified after -t\n", err());
    }

    @Test
    void badVersionIsAnError() {
        assertEquals(1, run("-t", "two", SERVICE));
        assertEquals("Error: target: Invalid version: two\n", err());
    }

    @Test
    void missingFileIsAnError() {
        assertEquals(1, run(tempDir.resolve("absent.yaml").toString()));
        assertTrue(err().startsWith("Error: File not found: "));
    }

    @Test
    void quietRunPrintsTheRewrittenSource() {
        assertEquals(0, run("-q", "--fixers=new_style_classes", SERVICE));
        assertTrue(out().startsWith("class Greeter(object):\n"), out());
    }

    @Test
    void defaultRunKeepsProgressOffStandardOutput() {
        assertEquals(0, run(SERVICE));
        assertEquals(
                "from __future__ import unicode_literals\n"
                        + "from __future__ import print_function\n"
                        + "from __future__ import absolute_import\n"
                        + "from __future__ import division\n"
                        + "str = getattr(__builtins__, 'unicode', str)\n"
                        + "class Greeter(object):\n"
                        + "    def greet(self, name):\n"
                        + "        return 'Hello, {0}'.format(name)\n",
                out());
        assertTrue(err().startsWith("┌─ service"), err());
    }

    @Test
    void diffShowsOnlyTheChange() {
        assertEquals(0, run("-q", "--diff", "--fixers", "NewStyleClassesFixer", SERVICE));

        String diff = out();
        assertTrue(diff.startsWith("--- a/service.py\n+++ b/service.py\n"), diff);
        assertTrue(diff.contains("\n-class Greeter:\n+class Greeter(object):\n"), diff);
        assertFalse(diff.contains("+from __future__"), diff);
    }

    @Test
    void writesModuleNamedFileIntoOutputDirectory() throws Exception {
        Path outputDir = tempDir.resolve("py27");

        assertEquals(0, run("-q", "-o", outputDir.toString(), SERVICE));

        Path written = outputDir.resolve("service.py");
        assertEquals(written + "\n", out());
        String source = Files.readString(written);
        assertTrue(source.startsWith("from __future__ import unicode_literals\n"), source);
        assertTrue(source.endsWith("        return 'Hello, {0}'.format(name)\n"), source);
    }

    @Test
    void failedModuleSetsExitStatus() {
        String starImport = TREES.resolve("star_import.yaml").toString();

        assertEquals(1, run("-q", starImport, SERVICE));
        assertTrue(out().startsWith("from __future__ import"), out());
        assertTrue(
                err().contains(
                                "\n✗ "
                                        + starImport
                                        + ": Prohibited from os.path import * (at ImportFrom@1)\n"),
                err());
        assertTrue(err().endsWith("✗ 1 of 2 module(s) failed\n"), err());
    }

    @Test
    void listsPassesInRegistryOrder() {
        assertEquals(0, run("--list-passes"));

        String listing = out();
        assertTrue(listing.startsWith("Checkers (registry order):\n  NoStarImports "), listing);
        int fixers = listing.indexOf("Fixers (registry order):");
        assertTrue(fixers > 0);
        assertTrue(listing.indexOf("AnnotationsFutureFixer") > fixers);
        assertTrue(
                listing.indexOf("NamedTupleClassToAssignFixer")
                        < listing.indexOf("RemoveAnnAssignFixer"));
    }

    @Test
    void flagsOverrideConfigFile() throws Exception {
        Path file = tempDir.resolve("backport.yaml");
        Files.writeString(file, "source_version: 3.7\ntarget_version: 3.4\nfixers: [x]\n");
        BackportCLI.CLIConfig config =
                new BackportCLI.CLIConfig(
                        List.of(),
                        file,
                        null,
                        "2.6",
                        null,
                        "new_style_classes",
                        null,
                        false,
                        true,
                        false,
                        VerbosityLevel.NORMAL);

        BuildConfig build = BackportCLI.resolveBuildConfig(config);

        assertEquals("3.7", build.sourceVersion().toString());
        assertEquals("2.6", build.targetVersion().toString());
        assertEquals(List.of("new_style_classes"), build.fixers());
    }

    @Test
    void identicalSourcesHaveNoDiff() {
        assertEquals("", BackportCLI.unifiedDiff("m", "x = 1\n", "x = 1\n"));
    }
}
