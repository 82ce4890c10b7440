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
package net.boyechko.backport.fixes.unpacking;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.tree.Operator;

/**
 * Flattens {@code *} spreads in an argument or element list into segments: runs of statically
 * known elements, and opaque iterables that must be materialized with {@code list(x)}.
 *
 * <p>{@code f(*x, *[1, 2], z)} has the segments {@code x} and {@code [1, 2, z]}, which fold to
 * {@code list(x) + [1, 2, z]}.
 */
final class PositionalSpreads {
    private PositionalSpreads() {}

    /** Either literal elements or one opaque iterable. */
    record Segment(List<Expr> elts, Expr opaque) {
        static Segment literal() {
            return new Segment(new ArrayList<>(), null);
        }

        static Segment opaque(Expr iterable) {
            return new Segment(null, iterable);
        }

        boolean isLiteral() {
            return opaque == null;
        }

        Expr asListOperand() {
            return isLiteral() ? Nodes.list(elts) : Nodes.call("list", opaque);
        }
    }

    /** True if some element follows a spread; a single trailing spread is legal everywhere. */
    static boolean hasInterleavedSpread(List<Expr> elts) {
        boolean seenSpread = false;
        for (Expr elt : elts) {
            if (seenSpread) {
                return true;
            }
            seenSpread = elt instanceof Expr.Starred;
        }
        return false;
    }

    static boolean hasSpread(List<Expr> elts) {
        return elts.stream().anyMatch(elt -> elt instanceof Expr.Starred);
    }

    static List<Segment> segments(List<Expr> elts) {
        List<Segment> segments = new ArrayList<>();
        Segment tail = Segment.literal();
        for (Expr elt : elts) {
            if (!(elt instanceof Expr.Starred starred)) {
                tail.elts().add(elt);
                continue;
            }
            Expr spread = starred.value();
            List<Expr> known = literalElements(spread);
            if (known != null) {
                tail.elts().addAll(known);
                continue;
            }
            if (!tail.elts().isEmpty()) {
                segments.add(tail);
            }
            segments.add(Segment.opaque(spread));
            tail = Segment.literal();
        }
        if (!tail.elts().isEmpty()) {
            segments.add(tail);
        }
        return segments;
    }

    /** Left fold with {@code +}; needs at least two segments. */
    static Expr concatenate(List<Segment> segments) {
        Expr result = segments.get(0).asListOperand();
        for (int i = 1; i < segments.size(); i++) {
            result = Nodes.binOp(result, Operator.ADD, segments.get(i).asListOperand());
        }
        return result;
    }

    /** Elements of a spread operand known at rewrite time, or null. */
    private static List<Expr> literalElements(Expr spread) {
        if (spread instanceof Expr.ListExpr list) {
            return list.elts();
        }
        if (spread instanceof Expr.TupleExpr tuple) {
            return tuple.elts();
        }
        if (spread instanceof Expr.SetExpr set) {
            return set.elts();
        }
        return null;
    }
}
