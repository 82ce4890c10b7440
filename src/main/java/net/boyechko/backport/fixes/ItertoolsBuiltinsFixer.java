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

import java.util.Set;
import net.boyechko.backport.pass.ImportDecl;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.ExprContext;
import net.boyechko.backport.version.VersionWindow;

/**
 * Makes {@code map}, {@code zip} and {@code filter} lazy on older targets by rebinding them to
 * their {@code itertools} counterparts at module level. Only safe when the module does not shadow
 * those names, which NoOverriddenBuiltinsChecker verifies.
 */
public class ItertoolsBuiltinsFixer extends TransformingFixer {
    static final Set<String> LAZY_BUILTINS = Set.of("map", "zip", "filter");

    @Override
    public String description() {
        return "Use itertools.imap/izip/ifilter for map/zip/filter";
    }

    @Override
    public VersionWindow versionWindow() {
        // 2.3 introduced itertools
        return VersionWindow.of("2.3", "2.7").withWorksUntil("3.7");
    }

    @Override
    protected Rewriter newRewriter() {
        return new Rewriter() {
            @Override
            public Expr visitName(Expr.Name node) {
                if (node.ctx() == ExprContext.LOAD && LAZY_BUILTINS.contains(node.id())) {
                    requireImport(ImportDecl.module("itertools"));
                    declare(declaration(node.id()));
                }
                return node;
            }
        };
    }

    static String declaration(String name) {
        return name + " = getattr(itertools, 'i" + name + "', " + name + ")";
    }
}
