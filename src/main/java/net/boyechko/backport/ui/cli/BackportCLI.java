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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.backport.config.BuildConfig;
import net.boyechko.backport.config.BuildConfigLoader;
import net.boyechko.backport.core.TranspileListener;
import net.boyechko.backport.core.TranspileResult;
import net.boyechko.backport.core.TranspileService;
import net.boyechko.backport.core.VerbosityLevel;
import net.boyechko.backport.errors.BackportException;
import net.boyechko.backport.errors.ConfigurationException;
import net.boyechko.backport.errors.FixerContractViolation;
import net.boyechko.backport.pass.Checker;
import net.boyechko.backport.pass.Fixer;
import net.boyechko.backport.pass.PassRegistry;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.SourceRenderer;
import net.boyechko.backport.tree.TreeReader;
import net.boyechko.backport.ui.ConsoleReporter;
import net.boyechko.backport.ui.LoggingListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BackportCLI {
    private static final String OUTPUT_EXTENSION = ".py";
    private static final int DIFF_CONTEXT = 3;

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            List<Path> inputPaths,
            Path configPath,
            String sourceVersion,
            String targetVersion,
            String checkers,
            String fixers,
            Path outputDir,
            boolean diff,
            boolean listPasses,
            boolean logOutput,
            VerbosityLevel verbosity) {
        public CLIConfig {
            inputPaths = List.copyOf(inputPaths);
            if (inputPaths.isEmpty() && !listPasses) {
                throw new IllegalArgumentException("At least one input path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        final List<Path> inputPaths = new ArrayList<>();
        Path configPath;
        String sourceVersion;
        String targetVersion;
        String checkers;
        String fixers;
        Path outputDir;
        boolean diff;
        boolean listPasses;
        boolean logOutput;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPaths.isEmpty() && !listPasses) {
                throw new CLIException("No input file specified");
            }
            for (Path input : inputPaths) {
                if (!Files.exists(input)) {
                    throw new CLIException("File not found: " + input);
                }
            }
            if (configPath != null && !Files.exists(configPath)) {
                throw new CLIException("Config file not found: " + configPath);
            }
            if (outputDir != null && Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
                throw new CLIException("Output path is not a directory: " + outputDir);
            }
            return new CLIConfig(
                    inputPaths,
                    configPath,
                    sourceVersion,
                    targetVersion,
                    checkers,
                    fixers,
                    outputDir,
                    diff,
                    listPasses,
                    logOutput,
                    verbosity);
        }
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /** Runs the command line and returns the process exit status. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (isHelpRequested(args)) {
            out.println(usageMessage());
            return 0;
        }
        CLIConfig config;
        BuildConfig buildConfig;
        try {
            config = parseArguments(args);
            configureLogging(config.verbosity());
            buildConfig = resolveBuildConfig(config);
        } catch (CLIException | ConfigurationException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        // progress shares stdout only when modules are written to files
        PrintStream progress = config.outputDir() != null && !config.diff() ? out : err;
        TranspileListener listener =
                config.logOutput()
                        ? LoggingListener.withConsoleOutput()
                        : new ConsoleReporter(progress, config.verbosity());
        TranspileService service =
                new TranspileService.TranspileServiceBuilder().withListener(listener).build();

        if (config.listPasses()) {
            printPasses(service.registry(), out);
            return 0;
        }

        logger().info(
                        "Backporting {} module(s) from {} to {}",
                        config.inputPaths().size(),
                        buildConfig.sourceVersion(),
                        buildConfig.targetVersion());
        int failed = 0;
        for (Path input : config.inputPaths()) {
            if (!processModule(input, config, buildConfig, service, listener, out, err)) {
                failed++;
            }
        }
        if (failed > 0) {
            err.println(
                    "✗ " + failed + " of " + config.inputPaths().size() + " module(s) failed");
            return 1;
        }
        return 0;
    }

    private static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--checkers=")) {
                b.checkers = args[i].substring("--checkers=".length());
            } else if (args[i].startsWith("--fixers=")) {
                b.fixers = args[i].substring("--fixers=".length());
            } else {
                switch (args[i]) {
                    case "-s", "--source" -> b.sourceVersion = requireValue(args, ++i, "-s");
                    case "-t", "--target" -> b.targetVersion = requireValue(args, ++i, "-t");
                    case "-c", "--config" ->
                            b.configPath = Paths.get(requireValue(args, ++i, "-c"));
                    case "-o", "--output" -> b.outputDir = Paths.get(requireValue(args, ++i, "-o"));
                    case "--checkers" -> b.checkers = requireValue(args, ++i, "--checkers");
                    case "--fixers" -> b.fixers = requireValue(args, ++i, "--fixers");
                    case "--diff" -> b.diff = true;
                    case "--list-passes" -> b.listPasses = true;
                    case "--log" -> b.logOutput = true;
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        }
                        b.inputPaths.add(Paths.get(args[i]));
                    }
                }
            }
        }

        return b.build();
    }

    private static String requireValue(String[] args, int i, String option) throws CLIException {
        if (i >= args.length) {
            throw new CLIException("Value not specified after " + option);
        }
        return args[i];
    }

    /** Config file (or bundled defaults), then command-line overrides. */
    static BuildConfig resolveBuildConfig(CLIConfig config) {
        BuildConfig build =
                config.configPath() != null
                        ? BuildConfigLoader.load(config.configPath())
                        : BuildConfigLoader.loadDefaults();
        if (config.sourceVersion() != null) {
            build =
                    build.withSourceVersion(
                            BuildConfigLoader.parseVersion(config.sourceVersion(), "source"));
        }
        if (config.targetVersion() != null) {
            build =
                    build.withTargetVersion(
                            BuildConfigLoader.parseVersion(config.targetVersion(), "target"));
        }
        if (config.checkers() != null) {
            build = build.withCheckers(config.checkers());
        }
        if (config.fixers() != null) {
            build = build.withFixers(config.fixers());
        }
        return build;
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(verbosity.logLevel(), Level.WARN));
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(BackportCLI.class);
        }
        return logger;
    }

    /** Returns false when the module could not be read, checked, rewritten or written. */
    private static boolean processModule(
            Path input,
            CLIConfig config,
            BuildConfig buildConfig,
            TranspileService service,
            TranspileListener listener,
            PrintStream out,
            PrintStream err) {
        try {
            Node.Module module = TreeReader.read(input);
            // rendered before the run, which rewrites the tree in place
            String before = config.diff() ? SourceRenderer.render(module) : null;
            TranspileResult result = service.transpile(buildConfig, module);
            String after = result.render();

            if (config.diff()) {
                out.print(unifiedDiff(module.name(), before, after));
            }
            if (config.outputDir() != null) {
                Path written = writeOutput(config.outputDir(), module.name(), after);
                if (listener instanceof ConsoleReporter reporter) {
                    reporter.onOutputWritten(written.toString());
                } else {
                    listener.onInfo("Written to " + written);
                }
            } else if (!config.diff()) {
                out.print(after);
            }
            return true;
        } catch (IOException e) {
            logger().debug("Failed to read or write {}", input, e);
            err.println("✗ " + input + ": " + e.getMessage());
            return false;
        } catch (FixerContractViolation e) {
            err.println("✗ " + input + ": internal error in " + e.passName() + ", please report");
            return false;
        } catch (BackportException e) {
            err.println("✗ " + input + ": " + e.describe());
            return false;
        }
    }

    static String unifiedDiff(String name, String before, String after) {
        List<String> original = before.lines().toList();
        List<String> revised = after.lines().toList();
        Patch<String> patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> diff =
                UnifiedDiffUtils.generateUnifiedDiff(
                        "a/" + name + OUTPUT_EXTENSION,
                        "b/" + name + OUTPUT_EXTENSION,
                        original,
                        patch,
                        DIFF_CONTEXT);
        return String.join("\n", diff) + "\n";
    }

    private static Path writeOutput(Path outputDir, String moduleName, String source)
            throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(moduleName + OUTPUT_EXTENSION);
        logger().info("Writing {}", target);
        Files.writeString(target, source, StandardCharsets.UTF_8);
        return target;
    }

    private static void printPasses(PassRegistry registry, PrintStream out) {
        out.println("Checkers (registry order):");
        for (Checker checker : registry.allCheckers()) {
            out.printf(
                    "  %-36s prohibited %s%n", checker.name(), checker.prohibitionWindow());
        }
        out.println("Fixers (registry order):");
        for (Fixer fixer : registry.allFixers()) {
            out.printf("  %-36s %s%n", fixer.name(), fixer.versionWindow());
        }
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return "Usage: java BackportCLI [-s VERSION] [-t VERSION] [-c CONFIG] [-o DIR] [--diff]"
                + " [-q|-v|-vv] <tree.yaml>...\n"
                + "  -h, --help          Show this help message\n"
                + "  -s, --source        Version the input was written for (default 3.6)\n"
                + "  -t, --target        Version the output must run on (default 2.7)\n"
                + "  -c, --config        YAML build config; flags override its values\n"
                + "  --checkers <names>  Run only these checkers (comma-separated)\n"
                + "  --fixers <names>    Run only these fixers (comma-separated)\n"
                + "  -o, --output        Write <module>.py files into this directory\n"
                + "  --diff              Print a unified diff of each module instead\n"
                + "  --list-passes       List checkers and fixers with their windows and exit\n"
                + "  --log               Report progress through the log instead of boxes\n"
                + "  -q, --quiet         Only show errors and written files\n"
                + "  -v, --verbose       Show every pass that ran\n"
                + "  -vv, --debug        Show skipped passes and debug logs\n"
                + "Examples:\n"
                + "  java BackportCLI -t 2.7 -o build/py27 module.yaml\n"
                + "  java BackportCLI --fixers=unpacking_generalizations --diff module.yaml";
    }
}
