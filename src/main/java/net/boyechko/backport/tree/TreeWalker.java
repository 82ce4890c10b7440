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

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a module tree once in pre-order, invoking multiple visitors at each node.
 *
 * <p>Exceptions thrown by a visitor abort the walk and propagate to the caller.
 */
public class TreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(TreeWalker.class);

    private final List<TreeVisitor> visitors = new ArrayList<>();
    private int globalIndex;

    public TreeWalker addVisitor(TreeVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public void walk(Node.Module module) {
        this.globalIndex = 0;

        for (TreeVisitor visitor : visitors) {
            visitor.beforeTraversal(module);
        }

        walkNode(module, null, "/", 0);

        for (TreeVisitor visitor : visitors) {
            visitor.afterTraversal();
        }
        logger.trace("Walked {} nodes of module {}", globalIndex, module.name());
    }

    private void walkNode(Node node, Node parent, String parentPath, int depth) {
        globalIndex++;

        NodeContext ctx = NodeContext.of(node, parent, parentPath, depth, globalIndex);

        // Call enterNode on all visitors; track if any want to skip children
        boolean continueToChildren = true;
        for (TreeVisitor visitor : visitors) {
            if (!visitor.enterNode(ctx)) {
                continueToChildren = false;
            }
        }

        if (continueToChildren) {
            for (Node child : node.children()) {
                walkNode(child, node, ctx.path() + ".", depth + 1);
            }
        }

        for (TreeVisitor visitor : visitors) {
            visitor.leaveNode(ctx);
        }
    }

    /** All nodes below {@code root} (excluding it) in pre-order. */
    public static List<Node> descendants(Node root) {
        List<Node> out = new ArrayList<>();
        collect(root, out);
        out.remove(0);
        return out;
    }

    private static void collect(Node node, List<Node> out) {
        out.add(node);
        for (Node child : node.children()) {
            collect(child, out);
        }
    }
}
