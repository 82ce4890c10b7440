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

/** Binary arithmetic and bitwise operators. Leaf values: never visited by a walk. */
public enum Operator {
    ADD("Add", "+", Precedence.ARITH),
    SUB("Sub", "-", Precedence.ARITH),
    MULT("Mult", "*", Precedence.TERM),
    MAT_MULT("MatMult", "@", Precedence.TERM),
    DIV("Div", "/", Precedence.TERM),
    MOD("Mod", "%", Precedence.TERM),
    FLOOR_DIV("FloorDiv", "//", Precedence.TERM),
    POW("Pow", "**", Precedence.POWER),
    LSHIFT("LShift", "<<", Precedence.SHIFT),
    RSHIFT("RShift", ">>", Precedence.SHIFT),
    BIT_OR("BitOr", "|", Precedence.BIT_OR),
    BIT_XOR("BitXor", "^", Precedence.BIT_XOR),
    BIT_AND("BitAnd", "&", Precedence.BIT_AND);

    private final String typeName;
    private final String symbol;
    private final int precedence;

    Operator(String typeName, String symbol, int precedence) {
        this.typeName = typeName;
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String typeName() {
        return typeName;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public static Operator fromTypeName(String typeName) {
        for (Operator op : values()) {
            if (op.typeName.equals(typeName)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: " + typeName);
    }
}
