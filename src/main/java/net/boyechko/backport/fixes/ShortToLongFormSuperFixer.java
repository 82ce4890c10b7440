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

import java.util.List;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.tree.Stmt;
import net.boyechko.backport.tree.TreeWalker;
import net.boyechko.backport.version.VersionWindow;

/**
 * Gives zero-argument {@code super()} calls inside methods their explicit form, {@code
 * super(ClassName, self)}, where {@code self} is the method's first parameter.
 *
 * <p>Nested classes are rewritten first, so a call is always bound to its innermost class. A call
 * in a function nested inside a method binds to the method that encloses it.
 */
public class ShortToLongFormSuperFixer extends TransformingFixer {

    @Override
    public String description() {
        return "Expand super() to super(Class, self)";
    }

    @Override
    public VersionWindow versionWindow() {
        return VersionWindow.of("2.2", "2.7");
    }

    @Override
    protected Rewriter newRewriter() {
        return new Rewriter() {
            @Override
            public List<Stmt> visitClassDef(Stmt.ClassDef node) {
                super.visitClassDef(node);
                for (Node child : TreeWalker.descendants(node)) {
                    if (child instanceof Stmt.FunctionDef method
                            && !method.args().args().isEmpty()) {
                        bindSuperCalls(node.name(), method);
                    }
                }
                return List.of(node);
            }
        };
    }

    private static void bindSuperCalls(String className, Stmt.FunctionDef method) {
        String self = method.args().args().get(0).name();
        for (Node node : TreeWalker.descendants(method)) {
            if (node instanceof Expr.Call call
                    && call.isCallTo("super")
                    && call.args().isEmpty()
                    && call.keywords().isEmpty()) {
                call.setArgs(List.of(Nodes.name(className), Nodes.name(self)));
            }
        }
    }
}
