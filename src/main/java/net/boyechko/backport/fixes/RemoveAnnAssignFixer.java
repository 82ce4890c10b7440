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
import net.boyechko.backport.errors.FixerError;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.tree.Stmt;
import net.boyechko.backport.version.VersionWindow;

/** {@code x: T = v} becomes {@code x = v}; a bare {@code x: T} becomes {@code x = None}. */
public class RemoveAnnAssignFixer extends TransformingFixer {

    @Override
    public String description() {
        return "Replace annotated assignments with plain ones";
    }

    @Override
    public VersionWindow versionWindow() {
        return VersionWindow.of("1.0", "3.5");
    }

    @Override
    protected Rewriter newRewriter() {
        return new Rewriter() {
            @Override
            public List<Stmt> visitAnnAssign(Stmt.AnnAssign node) {
                super.visitAnnAssign(node);
                Expr target = node.target();
                if (!(target instanceof Expr.Name) && !(target instanceof Expr.Attribute)) {
                    throw new FixerError(
                            "Unexpected annotated assignment target " + target.kind().typeName(),
                            target);
                }
                Expr value = node.value() != null ? node.value() : Nodes.none();
                Stmt.Assign assign = new Stmt.Assign(List.of(target), value);
                assign.setLine(node.line());
                return List.of(assign);
            }
        };
    }
}
