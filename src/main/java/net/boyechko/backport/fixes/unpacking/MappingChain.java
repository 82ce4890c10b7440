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
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.Nodes;

/**
 * The entries of a mapping display or the keywords of a call, as a sequence of mappings to merge
 * left to right. A {@code key: value} entry or {@code name=value} keyword contributes a
 * single-entry display, a {@code **spread} contributes its operand. Adjacent displays are merged,
 * so only spreads of unknown mappings keep the chain longer than one.
 *
 * <p>When one key appears in two merged displays the later entry wins, as it would at runtime.
 * When it appears in two opaque spreads the winner is whichever mapping the chain applies last.
 */
final class MappingChain {
    private MappingChain() {}

    static boolean hasInterleavedSpread(List<Node.Keyword> keywords) {
        boolean seenSpread = false;
        for (Node.Keyword keyword : keywords) {
            if (seenSpread) {
                return true;
            }
            seenSpread = keyword.isSpread();
        }
        return false;
    }

    static List<Expr> of(Expr.DictExpr dict) {
        List<Expr> chain = new ArrayList<>();
        for (int i = 0; i < dict.values().size(); i++) {
            Expr key = dict.keys().get(i);
            Expr value = dict.values().get(i);
            append(chain, key == null ? value : Nodes.entry(key, value));
        }
        return chain;
    }

    static List<Expr> of(List<Node.Keyword> keywords) {
        List<Expr> chain = new ArrayList<>();
        for (Node.Keyword keyword : keywords) {
            Expr value = keyword.value();
            append(
                    chain,
                    keyword.isSpread() ? value : Nodes.entry(Nodes.str(keyword.arg()), value));
        }
        return chain;
    }

    /** {@code dict(itertools.chain(a.items(), b.items(), ...))}. */
    static Expr chainCall(List<Expr> chain) {
        List<Expr> items = new ArrayList<>();
        for (Expr value : chain) {
            items.add(Nodes.call(Nodes.attr(value, "items")));
        }
        return Nodes.call(
                Nodes.name("dict"),
                Nodes.call(Nodes.dotted("itertools.chain"), items, List.of()));
    }

    static boolean isMapping(Expr value) {
        return value instanceof Expr.DictExpr
                || (value instanceof Expr.Call call && call.isCallTo("dict"));
    }

    private static void append(List<Expr> chain, Expr value) {
        if (!chain.isEmpty()
                && value instanceof Expr.DictExpr next
                && !next.hasSpread()
                && chain.get(chain.size() - 1) instanceof Expr.DictExpr previous
                && !previous.hasSpread()) {
            List<Expr> keys = new ArrayList<>(previous.keys());
            List<Expr> values = new ArrayList<>(previous.values());
            keys.addAll(next.keys());
            values.addAll(next.values());
            chain.set(chain.size() - 1, Nodes.dict(keys, values));
        } else {
            chain.add(value);
        }
    }
}
