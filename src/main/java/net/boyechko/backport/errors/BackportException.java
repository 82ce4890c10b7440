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
package net.boyechko.backport.errors;

import net.boyechko.backport.tree.Node;

/** Base class of the user-facing failures of a backport run. */
public class BackportException extends RuntimeException {
    private final transient Node node;

    public BackportException(String message) {
        this(message, (Node) null);
    }

    public BackportException(String message, Node node) {
        super(message);
        this.node = node;
    }

    public BackportException(String message, Throwable cause) {
        super(message, cause);
        this.node = null;
    }

    /** The offending tree node, or null when the failure is not tied to one. */
    public Node node() {
        return node;
    }

    /** The message followed by the offending node's kind and line, when known. */
    public String describe() {
        return node != null ? getMessage() + " (at " + node + ")" : getMessage();
    }
}
