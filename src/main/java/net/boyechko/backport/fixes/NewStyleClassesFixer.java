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
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.tree.Stmt;
import net.boyechko.backport.version.VersionWindow;

/** Classes declared without bases inherit {@code object}. */
public class NewStyleClassesFixer extends TransformingFixer {

    @Override
    public String description() {
        return "Make base-less classes inherit object";
    }

    @Override
    public VersionWindow versionWindow() {
        return VersionWindow.of("2.0", "2.7");
    }

    @Override
    protected Rewriter newRewriter() {
        return new Rewriter() {
            @Override
            public List<Stmt> visitClassDef(Stmt.ClassDef node) {
                super.visitClassDef(node);
                if (node.bases().isEmpty()) {
                    node.setBases(List.of(Nodes.name("object")));
                }
                return List.of(node);
            }
        };
    }
}
