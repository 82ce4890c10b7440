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

public enum CmpOperator {
    EQ("Eq", "=="),
    NOT_EQ("NotEq", "!="),
    LT("Lt", "<"),
    LT_E("LtE", "<="),
    GT("Gt", ">"),
    GT_E("GtE", ">="),
    IS("Is", "is"),
    IS_NOT("IsNot", "is not"),
    IN("In", "in"),
    NOT_IN("NotIn", "not in");

    private final String typeName;
    private final String symbol;

    CmpOperator(String typeName, String symbol) {
        this.typeName = typeName;
        this.symbol = symbol;
    }

    public String typeName() {
        return typeName;
    }

    public String symbol() {
        return symbol;
    }

    public static CmpOperator fromTypeName(String typeName) {
        for (CmpOperator op : values()) {
            if (op.typeName.equals(typeName)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + typeName);
    }
}
