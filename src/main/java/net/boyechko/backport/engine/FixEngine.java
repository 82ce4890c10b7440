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
import net.boyechko.backport.errors.FixerContractViolation;
import net.boyechko.backport.errors.FixerError;
import net.boyechko.backport.pass.EffectSet;
import net.boyechko.backport.pass.Fixer;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.version.Version;
import net.boyechko.backport.version.VersionWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs fixers over a module in the order given, each on the tree the previous one returned, and
 * merges their effects.
 *
 * <p>A fixer runs only when its window is applicable to the configured source and target. A
 * {@link FixerError} ends the run with the module attached; nothing already rewritten is undone.
 * A fixer that returns no tree breaks its contract and ends the run with a {@link
 * FixerContractViolation}.
 */
public class FixEngine {
    private static final Logger logger = LoggerFactory.getLogger(FixEngine.class);

    private final List<Fixer> fixers;

    public FixEngine(List<? extends Fixer> fixers) {
        this.fixers = List.copyOf(fixers);
    }

    public List<Fixer> fixers() {
        return fixers;
    }

    public record Outcome(
            Node.Module module, EffectSet effects, List<String> applied, List<String> skipped) {}

    public Outcome run(BuildConfig config, Node.Module module, PassObserver observer) {
        EffectSet effects = new EffectSet();
        List<String> applied = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Node.Module current = module;

        for (Fixer fixer : fixers) {
            String reason = skipReason(fixer.versionWindow(), config);
            if (reason != null) {
                logger.debug("Skipping {}: {}", fixer.name(), reason);
                skipped.add(fixer.name());
                observer.onPassSkipped(fixer, reason);
                continue;
            }

            observer.onPassStart(fixer);
            Node.Module result;
            try {
                result = fixer.apply(config, current);
            } catch (FixerError e) {
                throw e.attachModule(current);
            }
            if (result == null) {
                throw new FixerContractViolation(fixer.name(), "returned no module");
            }
            current = result;
            effects.addAll(fixer.effects());
            applied.add(fixer.name());
            logger.debug("{} done, {} effects so far", fixer.name(), effects.size());
            observer.onPassFinished(fixer);
        }
        return new Outcome(current, effects, List.copyOf(applied), List.copyOf(skipped));
    }

    /** Null when the fixer should run. */
    static String skipReason(VersionWindow window, BuildConfig config) {
        Version source = config.sourceVersion();
        Version target = config.targetVersion();
        if (!window.isRequiredFor(target)) {
            return "not required for target " + target;
        }
        if (!window.isSafeOnSource(source)) {
            return "source " + source + " outside " + window;
        }
        return null;
    }
}
