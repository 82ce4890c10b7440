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
package net.boyechko.backport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import net.boyechko.backport.config.BuildConfig;
import net.boyechko.backport.pass.Fixer;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.Node.Module;
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.tree.SourceRenderer;
import net.boyechko.backport.tree.Stmt;
import net.boyechko.backport.tree.TreeReader;

/** Base for tests that build, rewrite and render small trees. */
public abstract class BackportTestBase {
    protected static final Path TREES = Path.of("src/test/resources/trees");

    /** The usual run: code written for 3.6, output for 2.7. */
    protected static final BuildConfig PY36_TO_PY27 = BuildConfig.of("3.6", "2.7");

    // ── Tree helpers ────────────────────────────────────────────────

    protected static Module module(Stmt... body) {
        return Nodes.module("test", body);
    }

    /** A module holding the single expression statement {@code expr}. */
    protected static Module moduleOf(Expr expr) {
        return module(Nodes.exprStmt(expr));
    }

    protected static Module readTree(String fileName) {
        try {
            return TreeReader.read(TREES.resolve(fileName));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read test tree: " + fileName, e);
        }
    }

    // ── Fixer helpers ───────────────────────────────────────────────

    /** Applies {@code fixer} regardless of its window and renders the result with its effects. */
    protected static String applyAndRender(Fixer fixer, Module module) {
        Module result = fixer.apply(PY36_TO_PY27, module);
        return SourceRenderer.render(result, fixer.effects());
    }

    protected static String render(Module module) {
        return SourceRenderer.render(module);
    }

    protected static String render(Expr expr) {
        return SourceRenderer.render(expr);
    }
}
