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

/** Expression binding strengths used when rendering. Higher binds tighter. */
final class Precedence {
    private Precedence() {}

    static final int YIELD = 0;
    static final int LAMBDA = 1;
    static final int IF_EXP = 2;
    static final int OR = 3;
    static final int AND = 4;
    static final int NOT = 5;
    static final int COMPARE = 6;
    static final int BIT_OR = 7;
    static final int BIT_XOR = 8;
    static final int BIT_AND = 9;
    static final int SHIFT = 10;
    static final int ARITH = 11;
    static final int TERM = 12;
    static final int UNARY = 13;
    static final int POWER = 14;
    static final int AWAIT = 15;
    static final int ATOM = 16;
}
