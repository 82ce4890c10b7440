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
package net.boyechko.backport.tree;

/**
 * Immutable context passed to visitors during a tree walk: the current node, its position in the
 * tree, and its parent.
 */
public record NodeContext(
        Node node,
        /** Null for the module root. */
        Node parent,
        String path,
        /** Depth in the tree (0 = the module root). */
        int depth,
        /** Index in traversal order (1-based). */
        int globalIndex) {

    static NodeContext of(Node node, Node parent, String parentPath, int depth, int globalIndex) {
        String path = parentPath + node.kind().typeName() + "[" + globalIndex + "]";
        return new NodeContext(node, parent, path, depth, globalIndex);
    }

    public Node.Kind kind() {
        return node.kind();
    }
}
