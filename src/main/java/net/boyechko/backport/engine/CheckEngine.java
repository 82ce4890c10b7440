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
package net.boyechko.backport.engine;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.backport.config.BuildConfig;
import net.boyechko.backport.pass.Checker;
import net.boyechko.backport.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs checkers over a module in the order given.
 *
 * <p>A checker runs only when its construct is prohibited for the target version; otherwise it
 * is reported as skipped. The first {@link net.boyechko.backport.errors.CheckViolation} ends the
 * run, and later checkers never see the module.
 */
public class CheckEngine {
    private static final Logger logger = LoggerFactory.getLogger(CheckEngine.class);

    private final List<Checker> checkers;

    public CheckEngine(List<? extends Checker> checkers) {
        this.checkers = List.copyOf(checkers);
    }

    public List<Checker> checkers() {
        return checkers;
    }

    public record Outcome(List<String> ran, List<String> skipped) {}

    public Outcome run(BuildConfig config, Node.Module module, PassObserver observer) {
        List<String> ran = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (Checker checker : checkers) {
            if (!checker.prohibitionWindow().isProhibitedFor(config.targetVersion())) {
                String reason = "allowed on target " + config.targetVersion();
                logger.debug("Skipping {}: {}", checker.name(), reason);
                skipped.add(checker.name());
                observer.onPassSkipped(checker, reason);
                continue;
            }
            observer.onPassStart(checker);
            checker.check(config, module);
            ran.add(checker.name());
            observer.onPassFinished(checker);
        }
        return new Outcome(List.copyOf(ran), List.copyOf(skipped));
    }
}
