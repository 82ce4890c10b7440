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

public enum UnaryOperator {
    INVERT("Invert", "~", Precedence.UNARY),
    NOT("Not", "not ", Precedence.NOT),
    UADD("UAdd", "+", Precedence.UNARY),
    USUB("USub", "-", Precedence.UNARY);

    private final String typeName;
    private final String prefix;
    private final int precedence;

    UnaryOperator(String typeName, String prefix, int precedence) {
        this.typeName = typeName;
        this.prefix = prefix;
        this.precedence = precedence;
    }

    public String typeName() {
        return typeName;
    }

    public String prefix() {
        return prefix;
    }

    public int precedence() {
        return precedence;
    }

    public static UnaryOperator fromTypeName(String typeName) {
        for (UnaryOperator op : values()) {
            if (op.typeName.equals(typeName)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown unary operator: " + typeName);
    }
}
