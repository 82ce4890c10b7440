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
package net.boyechko.backport.ui;

import java.io.PrintStream;
import net.boyechko.backport.core.TranspileListener;
import net.boyechko.backport.core.TranspileResult;
import net.boyechko.backport.core.VerbosityLevel;
import net.boyechko.backport.pass.Pass;

/** Human-readable progress for the command line, one box per module. */
public class ConsoleReporter implements TranspileListener {
    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "✗";
    private static final String SKIPPED = "○";
    private static final String INFO = "ℹ";

    private static final String INDENT = "│ ";
    private static final int HEADER_WIDTH = 68;

    private boolean boxOpen = false;

    public ConsoleReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
    }

    @Override
    public void onModuleStart(String moduleName) {
        if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            closeBoxIfOpen();
            int filler = Math.max(0, HEADER_WIDTH - moduleName.length() - 1);
            output.println("┌─ " + moduleName + " " + "─".repeat(filler) + "┐");
            boxOpen = true;
        }
    }

    @Override
    public void onPhaseStart(String phaseName) {
        printLine(phaseName, null, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onSuccess(String message) {
        printLine(message, SUCCESS, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onPassFinished(Pass pass) {
        printLine(pass.name(), SUCCESS, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onPassSkipped(Pass pass, String reason) {
        printLine(pass.name() + " (" + reason + ")", SKIPPED, VerbosityLevel.DEBUG);
    }

    @Override
    public void onError(String message) {
        printLine(message, ERROR, VerbosityLevel.QUIET);
        closeBoxIfOpen();
    }

    @Override
    public void onInfo(String message) {
        printLine(message, INFO, VerbosityLevel.NORMAL);
    }

    @Override
    public void onModuleComplete(TranspileResult result) {
        printLine(
                result.fixersApplied().size()
                        + " fixers applied, "
                        + result.effects().size()
                        + " imports/declarations added",
                SUCCESS,
                VerbosityLevel.NORMAL);
        closeBoxIfOpen();
    }

    /** Written output paths are the only thing shown in quiet mode. */
    public void onOutputWritten(String path) {
        if (verbosity == VerbosityLevel.QUIET) {
            output.println(path);
        } else if (verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            output.println(SUCCESS + " Written to " + path);
        }
    }

    private void closeBoxIfOpen() {
        if (boxOpen && verbosity.shouldShow(VerbosityLevel.NORMAL)) {
            output.println("└" + "─".repeat(HEADER_WIDTH + 2) + "┘");
            boxOpen = false;
        }
    }

    private void printLine(String message, String icon, VerbosityLevel level) {
        if (verbosity.shouldShow(level)) {
            output.println(icon == null ? INDENT + message : INDENT + icon + " " + message);
        }
    }
}
