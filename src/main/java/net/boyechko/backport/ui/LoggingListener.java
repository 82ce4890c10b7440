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

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import net.boyechko.backport.core.TranspileListener;
import net.boyechko.backport.core.TranspileResult;
import net.boyechko.backport.pass.Pass;
import org.slf4j.LoggerFactory;

/** A {@link TranspileListener} that routes all events through SLF4J. */
public class LoggingListener implements TranspileListener {

    private static final String CONSOLE_APPENDER_NAME = "BACKPORT_CONSOLE";

    private static final org.slf4j.Logger logger =
            LoggerFactory.getLogger("net.boyechko.backport.transpile");

    /**
     * Creates a {@link LoggingListener} and ensures logs are emitted to standard error, leaving
     * standard output to the rendered modules.
     */
    public static LoggingListener withConsoleOutput() {
        ensureConsoleAppender();
        return new LoggingListener();
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

        if (root.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-20logger{0} [%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setEncoder(encoder);
        console.setTarget("System.err");
        console.start();

        root.addAppender(console);
    }

    @Override
    public void onModuleStart(String moduleName) {
        logger.info("MODULE {}", moduleName);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        logger.info("PHASE {}", phaseName);
    }

    @Override
    public void onSuccess(String message) {
        logger.info("OK {}", message);
    }

    @Override
    public void onPassFinished(Pass pass) {
        logger.info("RAN {}", pass.name());
    }

    @Override
    public void onPassSkipped(Pass pass, String reason) {
        logger.debug("SKIPPED {}: {}", pass.name(), reason);
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onModuleComplete(TranspileResult result) {
        logger.info(
                "SUMMARY checkers={} fixers={} skipped={} imports={} declarations={}",
                result.checkersRun().size(),
                result.fixersApplied().size(),
                result.skipped().size(),
                result.effects().requiredImports().size(),
                result.effects().moduleDeclarations().size());
    }
}
