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
package net.boyechko.backport.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.backport.errors.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BuildConfigLoaderTest {

    @TempDir Path tempDir;

    @Test
    void bundledDefaultsBackportToPython27() {
        BuildConfig config = BuildConfigLoader.loadDefaults();

        assertEquals("3.6", config.sourceVersion().toString());
        assertEquals("2.7", config.targetVersion().toString());
        assertTrue(config.checkers().isEmpty());
        assertTrue(config.fixers().isEmpty());
    }

    @Test
    void fileValuesOverrideDefaults() throws Exception {
        Path file = tempDir.resolve("backport.yaml");
        Files.writeString(
                file,
                "target_version: 3.10\n"
                        + "fixers: fstring_to_str_format, unpacking_generalizations\n"
                        + "checkers:\n"
                        + "  - no_star_imports\n");

        BuildConfig config = BuildConfigLoader.load(file);

        assertEquals("3.6", config.sourceVersion().toString());
        assertEquals("3.10", config.targetVersion().toString());
        assertEquals(
                List.of("fstring_to_str_format", "unpacking_generalizations"), config.fixers());
        assertEquals(List.of("no_star_imports"), config.checkers());
    }

    @Test
    void emptyFileKeepsDefaults() throws Exception {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        BuildConfig config = BuildConfigLoader.load(file);

        assertEquals("2.7", config.targetVersion().toString());
    }

    @Test
    void badVersionNamesTheKey() throws Exception {
        Path file = tempDir.resolve("bad.yaml");
        Files.writeString(file, "source_version: three\n");

        var ex = assertThrows(ConfigurationException.class, () -> BuildConfigLoader.load(file));
        assertTrue(ex.getMessage().contains("source_version"), ex.getMessage());
        assertTrue(ex.getMessage().contains("Invalid version: three"), ex.getMessage());
    }

    @Test
    void topLevelMustBeAMapping() throws Exception {
        Path file = tempDir.resolve("list.yaml");
        Files.writeString(file, "- 3.6\n- 2.7\n");

        var ex = assertThrows(ConfigurationException.class, () -> BuildConfigLoader.load(file));
        assertTrue(ex.getMessage().endsWith("expected a mapping at the top level"));
    }

    @Test
    void missingFileIsAConfigurationError() {
        Path missing = tempDir.resolve("nope.yaml");

        assertThrows(ConfigurationException.class, () -> BuildConfigLoader.load(missing));
    }

    @Test
    void unknownPassNamesAreLeftForSelection() throws Exception {
        Path file = tempDir.resolve("typo.yaml");
        Files.writeString(file, "fixers: [no_such_fixer]\n");

        assertEquals(List.of("no_such_fixer"), BuildConfigLoader.load(file).fixers());
    }
}
