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
package net.boyechko.backport.fixes;

import net.boyechko.backport.config.BuildConfig;
import net.boyechko.backport.errors.FixerError;
import net.boyechko.backport.pass.Fixer;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.TreeTransformer;

/**
 * Fixer whose work is a single {@link TreeTransformer} pass. Subclasses supply a fresh {@link
 * Rewriter} per run; a {@link FixerError} escaping the rewrite leaves with the module attached.
 */
public abstract class TransformingFixer extends Fixer {

    protected abstract Rewriter newRewriter();

    @Override
    public Node.Module apply(BuildConfig config, Node.Module module) {
        try {
            return newRewriter().transformModule(module);
        } catch (FixerError e) {
            throw e.attachModule(module);
        }
    }

    /** Rewrite walk that reports contract breaks under the owning fixer's name. */
    protected abstract class Rewriter extends TreeTransformer {
        @Override
        protected String transformerName() {
            return TransformingFixer.this.name();
        }
    }
}
