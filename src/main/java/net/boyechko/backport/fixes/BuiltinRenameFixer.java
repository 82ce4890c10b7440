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
import net.boyechko.backport.pass.Fixer;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.ExprContext;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.TreeWalker;
import net.boyechko.backport.version.VersionWindow;

/**
 * Makes a builtin that was renamed in Python 3 resolve to its old implementation on older
 * targets. Reading {@code range} records {@code range = getattr(__builtins__, 'xrange', range)}
 * as a module declaration; the tree is not changed.
 */
public class BuiltinRenameFixer extends Fixer {
    private static final VersionWindow WINDOW =
            VersionWindow.of("1.0", "2.7").withWorksUntil("3.7");

    private final String oldName;
    private final String newName;

    public BuiltinRenameFixer(String oldName, String newName) {
        this.oldName = oldName;
        this.newName = newName;
    }

    /** {@code raw_input -> input} is named {@code RawInputToInputFixer}. */
    @Override
    public String name() {
        return Names.camel(oldName) + "To" + Names.camel(newName) + "Fixer";
    }

    @Override
    public String description() {
        return "Use " + oldName + " where " + newName + " is read";
    }

    @Override
    public VersionWindow versionWindow() {
        return WINDOW;
    }

    String declaration() {
        return newName + " = getattr(__builtins__, '" + oldName + "', " + newName + ")";
    }

    @Override
    public Node.Module apply(BuildConfig config, Node.Module module) {
        for (Node node : TreeWalker.descendants(module)) {
            if (node instanceof Expr.Name name
                    && name.ctx() == ExprContext.LOAD
                    && name.id().equals(newName)) {
                declare(declaration());
                break;
            }
        }
        return module;
    }
}
