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

/** A checker found a construct the target version, or the tool's policy, forbids. */
public class CheckViolation extends BackportException {
    private final String checkerName;

    public CheckViolation(String checkerName, String message, Node node) {
        super(message, node);
        this.checkerName = checkerName;
    }

    public String checkerName() {
        return checkerName;
    }
}
