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
package net.boyechko.backport.pass;

import net.boyechko.backport.config.BuildConfig;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.version.VersionWindow;

/**
 * Rewriting pass. A fixer instance serves one module run: the effects it records accumulate for
 * that run and are merged into the run's aggregate afterwards.
 */
public abstract non-sealed class Fixer implements Pass {
    private final EffectSet effects = new EffectSet();

    public abstract VersionWindow versionWindow();

    /**
     * Rewrites {@code module} in place or returns a replacement. Must never return null.
     *
     * @throws net.boyechko.backport.errors.FixerError if a shape cannot be rewritten safely
     */
    public abstract Node.Module apply(BuildConfig config, Node.Module module);

    @Override
    public String name() {
        return getClass().getSimpleName();
    }

    public EffectSet effects() {
        return effects;
    }

    protected void requireImport(ImportDecl decl) {
        effects.requireImport(decl);
    }

    protected void declare(String declaration) {
        effects.declare(declaration);
    }

    @Override
    public String toString() {
        return name() + " (" + versionWindow() + ")";
    }
}
