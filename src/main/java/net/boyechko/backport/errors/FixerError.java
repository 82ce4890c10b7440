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

/**
 * A fixer met a shape it cannot rewrite safely. The enclosing module is attached lazily by the
 * first catch site that knows it; later attachments are ignored.
 */
public class FixerError extends BackportException {
    private transient Node.Module module;
    private String moduleName;

    public FixerError(String message, Node node) {
        super(message, node);
    }

    /** Attaches the enclosing module unless one is already set. */
    public FixerError attachModule(Node.Module module) {
        if (this.module == null && module != null) {
            this.module = module;
            this.moduleName = module.name();
        }
        return this;
    }

    public Node.Module module() {
        return module;
    }

    public String moduleName() {
        return moduleName;
    }

    @Override
    public String describe() {
        String base = super.describe();
        return moduleName != null ? moduleName + ": " + base : base;
    }
}
