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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.boyechko.backport.BackportTestBase;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.ExprContext;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.tree.Stmt;
import org.junit.jupiter.api.Test;

class UnpackingGeneralizationsFixerTest extends BackportTestBase {

    // ── Tree helpers ────────────────────────────────────────────────

    private static Expr.Starred spread(Expr value) {
        return Nodes.starred(value);
    }

    private static Expr.Name n(String id) {
        return Nodes.name(id);
    }

    private static Expr.DictExpr dict(Expr... keysAndValues) {
        List<Expr> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            keys.add(keysAndValues[i]);
            values.add(keysAndValues[i + 1]);
        }
        return Nodes.dict(keys, values);
    }

    private static Expr.Call callWithKeywords(String func, Node.Keyword... keywords) {
        return Nodes.call(Nodes.name(func), List.of(), Arrays.asList(keywords));
    }

    private static String rewrite(Expr expr) {
        return applyAndRender(new UnpackingGeneralizationsFixer(), moduleOf(expr));
    }

    // ── Positional spreads ──────────────────────────────────────────

    @Test
    void literalSpreadsInAListAreFlattened() {
        Expr list =
                Nodes.list(
                        spread(Nodes.list(Nodes.num(1), Nodes.num(2))),
                        Nodes.num(3),
                        spread(Nodes.list(Nodes.num(4), Nodes.num(5))));

        assertEquals("[1, 2, 3, 4, 5]\n", rewrite(list));
    }

    @Test
    void interleavedCallSpreadsAreConcatenated() {
        Expr call =
                Nodes.call(
                        "f",
                        spread(n("a")),
                        spread(Nodes.list(Nodes.num(1), Nodes.num(2))),
                        n("z"));

        assertEquals("f(*(list(a) + [1, 2, z]))\n", rewrite(call));
    }

    @Test
    void trailingSpreadIsAlreadyLegal() {
        UnpackingGeneralizationsFixer fixer = new UnpackingGeneralizationsFixer();
        Expr call = Nodes.call("f", n("a"), spread(n("b")));

        String out = applyAndRender(fixer, moduleOf(call));

        assertEquals("f(a, *b)\n", out);
        assertTrue(fixer.effects().isEmpty());
    }

    @Test
    void displaysRebuildTheirKind() {
        assertEquals("tuple(list(a) + [1])\n", rewrite(Nodes.tuple(spread(n("a")), Nodes.num(1))));
        assertEquals("set(a)\n", rewrite(Nodes.set(spread(n("a")))));
        assertEquals("list(a)\n", rewrite(Nodes.list(spread(n("a")))));
        assertEquals(
                "{1, 2, 3}\n",
                rewrite(Nodes.set(spread(Nodes.list(Nodes.num(1), Nodes.num(2))), Nodes.num(3))));
    }

    @Test
    void emptySpreadsVanish() {
        Expr call = Nodes.call("f", spread(Nodes.list()), spread(Nodes.tuple()));

        assertEquals("f()\n", rewrite(call));
        assertEquals("set()\n", rewrite(Nodes.set(spread(Nodes.tuple()))));
    }

    @Test
    void assignmentTargetsAreLeftAlone() {
        Expr.TupleExpr target =
                new Expr.TupleExpr(
                        List.of(
                                Nodes.store("a"),
                                new Expr.Starred(Nodes.store("rest"), ExprContext.STORE)),
                        ExprContext.STORE);
        Stmt.Assign assign = new Stmt.Assign(List.of(target), n("xs"));

        String out = applyAndRender(new UnpackingGeneralizationsFixer(), module(assign));

        assertEquals("(a, *rest) = xs\n", out);
    }

    // ── Mapping spreads ─────────────────────────────────────────────

    @Test
    void opaqueMappingsAreChained() {
        Expr display = dict(null, n("a"), null, n("b"), Nodes.str("x"), Nodes.num(1));

        assertEquals(
                "import itertools\n"
                        + "dict(itertools.chain(a.items(), b.items(), {'x': 1}.items()))\n",
                rewrite(display));
    }

    @Test
    void knownMappingsAreMergedWithoutImport() {
        UnpackingGeneralizationsFixer fixer = new UnpackingGeneralizationsFixer();
        Expr display =
                dict(
                        null, dict(Nodes.str("a"), Nodes.num(1)),
                        null, dict(Nodes.str("b"), Nodes.num(2)));

        String out = applyAndRender(fixer, moduleOf(display));

        assertEquals("{'a': 1, 'b': 2}\n", out);
        assertTrue(fixer.effects().isEmpty());
    }

    @Test
    void nestedDisplaysAreMergedInnermostFirst() {
        Expr inner = dict(Nodes.str("x"), Nodes.num(1), null, dict(Nodes.str("y"), Nodes.num(2)));
        Expr outer = dict(null, inner, Nodes.str("z"), Nodes.num(3));

        assertEquals("{'x': 1, 'y': 2, 'z': 3}\n", rewrite(outer));
    }

    @Test
    void singleOpaqueSpreadIsCopied() {
        assertEquals("dict(a)\n", rewrite(dict(null, n("a"))));
    }

    @Test
    void keywordsAfterASpreadAreFoldedIntoIt() {
        Expr call = callWithKeywords("f", Nodes.kwSpread(n("a")), Nodes.keyword("b", Nodes.num(1)));

        assertEquals(
                "import itertools\n"
                        + "f(**dict(itertools.chain(a.items(), {'b': 1}.items())))\n",
                rewrite(call));
    }

    @Test
    void keywordsBeforeASpreadAreLegal() {
        Expr call = callWithKeywords("f", Nodes.keyword("x", Nodes.num(1)), Nodes.kwSpread(n("a")));

        assertEquals("f(x=1, **a)\n", rewrite(call));
    }

    @Test
    void dictCallsCollapseToTheMergedMapping() {
        Expr opaque =
                callWithKeywords("dict", Nodes.kwSpread(n("a")), Nodes.keyword("b", Nodes.num(1)));
        Expr known =
                callWithKeywords(
                        "dict",
                        Nodes.kwSpread(dict(Nodes.str("a"), Nodes.num(1))),
                        Nodes.keyword("b", Nodes.num(2)));

        assertEquals(
                "import itertools\ndict(itertools.chain(a.items(), {'b': 1}.items()))\n",
                rewrite(opaque));
        assertEquals("{'a': 1, 'b': 2}\n", rewrite(known));
    }

    @Test
    void knownKeywordSpreadStaysAKeywordSpread() {
        Expr call =
                callWithKeywords(
                        "f",
                        Nodes.kwSpread(dict(Nodes.str("a"), Nodes.num(1))),
                        Nodes.keyword("b", Nodes.num(2)));

        assertEquals("f(**{'a': 1, 'b': 2})\n", rewrite(call));
    }

    // ── Fixed point ─────────────────────────────────────────────────

    @Test
    void secondApplicationChangesNothing() {
        UnpackingGeneralizationsFixer fixer = new UnpackingGeneralizationsFixer();
        Node.Module module =
                module(
                        Nodes.exprStmt(
                                Nodes.call("f", spread(n("a")), n("b"), spread(n("c")))),
                        Nodes.exprStmt(dict(null, n("d"), Nodes.str("k"), Nodes.num(1))));

        Node.Module once = fixer.apply(PY36_TO_PY27, module);
        String first = render(once);
        int effects = fixer.effects().size();
        Node.Module twice = fixer.apply(PY36_TO_PY27, once);

        assertEquals(first, render(twice));
        assertEquals(effects, fixer.effects().size());
        assertEquals("f(*(list(a) + [b] + list(c)))\n", first.lines().findFirst().get() + "\n");
    }
}
