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
package net.boyechko.backport.core;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.backport.config.BuildConfig;
import net.boyechko.backport.engine.CheckEngine;
import net.boyechko.backport.engine.FixEngine;
import net.boyechko.backport.errors.BackportException;
import net.boyechko.backport.errors.FixerContractViolation;
import net.boyechko.backport.pass.Checker;
import net.boyechko.backport.pass.Fixer;
import net.boyechko.backport.pass.PassRegistry;
import net.boyechko.backport.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the rewrite of one module: selected checkers first, then selected fixers, each in
 * registry order.
 *
 * <p>Pass selection happens before the tree is touched, so an unknown pass name fails the run
 * with the module unchanged. Any failure after that aborts the run; the caller gets no partial
 * result. A service holds no per-run state and may be shared between modules.
 */
public class TranspileService {
    private static final Logger logger = LoggerFactory.getLogger(TranspileService.class);

    private final PassRegistry registry;
    private final TranspileListener listener;

    public static class TranspileServiceBuilder {
        private PassRegistry registry;
        private TranspileListener listener;

        public TranspileServiceBuilder withRegistry(PassRegistry registry) {
            this.registry = registry;
            return this;
        }

        public TranspileServiceBuilder withListener(TranspileListener listener) {
            this.listener = listener;
            return this;
        }

        public TranspileService build() {
            if (listener == null) {
                throw new IllegalStateException(
                        "TranspileListener must be provided via withListener(...) before building"
                                + " TranspileService");
            }
            return new TranspileService(this);
        }
    }

    private TranspileService(TranspileServiceBuilder builder) {
        this.registry = builder.registry != null ? builder.registry : PassDefaults.registry();
        this.listener = builder.listener;
    }

    public PassRegistry registry() {
        return registry;
    }

    /**
     * Checks and rewrites {@code module}, which the run owns and may modify in place.
     *
     * @throws net.boyechko.backport.errors.ConfigurationException for an unknown pass name
     * @throws net.boyechko.backport.errors.CheckViolation when a checker rejects the module
     * @throws net.boyechko.backport.errors.FixerError when a fixer cannot rewrite the module
     * @throws FixerContractViolation when a fixer misbehaves
     */
    public TranspileResult transpile(BuildConfig config, Node.Module module) {
        List<Checker> checkers = registry.selectCheckers(config.checkers());
        List<Fixer> fixers = registry.selectFixers(config.fixers());
        if (config.isUpgrade()) {
            logger.warn(
                    "Target {} is newer than source {}; fixers only rewrite for older targets",
                    config.targetVersion(),
                    config.sourceVersion());
        }

        listener.onModuleStart(module.name());
        try {
            listener.onPhaseStart("Checks");
            CheckEngine.Outcome checked = new CheckEngine(checkers).run(config, module, listener);
            listener.onSuccess("No prohibited constructs");

            listener.onPhaseStart("Fixes");
            FixEngine.Outcome fixed = new FixEngine(fixers).run(config, module, listener);

            List<String> skipped = new ArrayList<>(checked.skipped());
            skipped.addAll(fixed.skipped());
            TranspileResult result =
                    new TranspileResult(
                            fixed.module(),
                            fixed.effects(),
                            checked.ran(),
                            fixed.applied(),
                            List.copyOf(skipped));
            logger.info(
                    "Transpiled {}: {} passes run, {} skipped, {} effects",
                    module.name(),
                    result.passesRun(),
                    skipped.size(),
                    result.effects().size());
            listener.onModuleComplete(result);
            return result;
        } catch (FixerContractViolation e) {
            logger.error("Internal defect in fixer {}: {}", e.passName(), e.getMessage(), e);
            listener.onError("Internal defect: " + e.getMessage());
            throw e;
        } catch (BackportException e) {
            logger.error("Aborted {}: {}", module.name(), e.describe());
            listener.onError(e.describe());
            throw e;
        }
    }
}
