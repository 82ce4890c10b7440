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
package net.boyechko.backport.checks;

import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.ExprContext;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.NodeContext;
import net.boyechko.backport.tree.Stmt;

/**
 * Rejects rebinding of a protected name by a function or class definition, an assignment target,
 * an import or a parameter.
 */
public abstract class NameBindingChecker extends WalkingChecker {

    protected abstract boolean isProtected(String name);

    /**
     * Whether {@code import x} (without {@code as}) counts as binding {@code x}. A name imported
     * with {@code from m import x} always binds {@code x}.
     */
    protected abstract boolean countsPlainImports();

    protected abstract String describeOverride(String name);

    @Override
    public boolean enterNode(NodeContext ctx) {
        String bound = boundName(ctx.node(), ctx.parent());
        if (bound != null && isProtected(bound)) {
            throw violation(describeOverride(bound), ctx.node());
        }
        return true;
    }

    private String boundName(Node node, Node parent) {
        if (node instanceof Stmt.FunctionDef def) {
            return def.name();
        } else if (node instanceof Stmt.ClassDef cls) {
            return cls.name();
        } else if (node instanceof Expr.Name name && name.ctx() == ExprContext.STORE) {
            return name.id();
        } else if (node instanceof Node.Alias alias) {
            if (alias.asName() != null) {
                return alias.asName();
            }
            if (parent instanceof Stmt.ImportFrom) {
                return "*".equals(alias.name()) ? null : alias.name();
            }
            if (countsPlainImports()) {
                // import a.b binds a
                int dot = alias.name().indexOf('.');
                return dot < 0 ? alias.name() : alias.name().substring(0, dot);
            }
            return null;
        } else if (node instanceof Node.Arg arg) {
            return arg.name();
        }
        return null;
    }
}
