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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.backport.BackportTestBase;
import net.boyechko.backport.pass.EffectSet;
import net.boyechko.backport.pass.ImportDecl;
import org.junit.jupiter.api.Test;

class SourceRendererTest extends BackportTestBase {

    private static Expr op(Expr left, Operator op, Expr right) {
        return Nodes.binOp(left, op, right);
    }

    @Test
    void parenthesizesOnlyWhereBindingRequires() {
        Expr a = Nodes.name("a");
        Expr b = Nodes.name("b");
        Expr c = Nodes.name("c");

        assertEquals("(a + b) * c", render(op(op(a, Operator.ADD, b), Operator.MULT, c)));
        assertEquals("a + b * c", render(op(a, Operator.ADD, op(b, Operator.MULT, c))));
        assertEquals("a - (b - c)", render(op(a, Operator.SUB, op(b, Operator.SUB, c))));
        assertEquals("a - b - c", render(op(op(a, Operator.SUB, b), Operator.SUB, c)));
        assertEquals("a ** b ** c", render(op(a, Operator.POW, op(b, Operator.POW, c))));
        assertEquals("(a ** b) ** c", render(op(op(a, Operator.POW, b), Operator.POW, c)));
    }

    @Test
    void quotesLikeRepr() {
        assertEquals("'plain'", render(Nodes.str("plain")));
        assertEquals("\"it's\"", render(Nodes.str("it's")));
        assertEquals("'say \"it\\'s\"'", render(Nodes.str("say \"it's\"")));
        assertEquals("'a\\nb'", render(Nodes.str("a\nb")));
    }

    @Test
    void displays() {
        assertEquals("(x,)", render(Nodes.tuple(Nodes.name("x"))));
        assertEquals("()", render(Nodes.tuple()));
        assertEquals("set()", render(Nodes.set()));
        Expr sum = op(Nodes.name("a"), Operator.ADD, Nodes.name("b"));
        assertEquals(
                "f(*(a + b), **kw)",
                render(
                        Nodes.call(
                                Nodes.name("f"),
                                List.of(Nodes.starred(sum)),
                                List.of(Nodes.kwSpread(Nodes.name("kw"))))));
    }

    @Test
    void elseIfChainsBecomeElif() {
        Stmt.If inner =
                new Stmt.If(
                        Nodes.name("b"),
                        List.of(Nodes.ret(Nodes.num(2))),
                        List.of(Nodes.ret(Nodes.num(3))));
        Stmt.If outer =
                new Stmt.If(Nodes.name("a"), List.of(Nodes.ret(Nodes.num(1))), List.of(inner));

        assertEquals(
                "if a:\n    return 1\nelif b:\n    return 2\nelse:\n    return 3\n",
                render(module(outer)));
    }

    @Test
    void tryWithHandlersAndFinally() {
        Stmt.Try stmt =
                new Stmt.Try(
                        List.of(Nodes.exprStmt(Nodes.call("work"))),
                        List.of(
                                new Node.ExceptHandler(
                                        Nodes.name("ValueError"), "e", List.of(Nodes.pass())),
                                new Node.ExceptHandler(null, null, List.of(Nodes.pass()))),
                        List.of(),
                        List.of(Nodes.exprStmt(Nodes.call("cleanup"))));

        assertEquals(
                "try:\n"
                        + "    work()\n"
                        + "except ValueError as e:\n"
                        + "    pass\n"
                        + "except:\n"
                        + "    pass\n"
                        + "finally:\n"
                        + "    cleanup()\n",
                render(module(stmt)));
    }

    @Test
    void effectsFollowDocstringAndExistingFutureImports() {
        EffectSet effects = new EffectSet();
        effects.requireImport(ImportDecl.module("itertools"));
        effects.requireImport(ImportDecl.from(ImportDecl.FUTURE, "division"));
        effects.declare("zip = getattr(itertools, 'izip', zip)");
        Node.Module module =
                module(
                        Nodes.exprStmt(Nodes.str("Docs.")),
                        Nodes.importFrom(ImportDecl.FUTURE, "print_function"),
                        Nodes.importModule("os"),
                        Nodes.assign("x", Nodes.num(1)));

        assertEquals(
                "'Docs.'\n"
                        + "from __future__ import print_function\n"
                        + "from __future__ import division\n"
                        + "import itertools\n"
                        + "zip = getattr(itertools, 'izip', zip)\n"
                        + "import os\n"
                        + "x = 1\n",
                SourceRenderer.render(module, effects));
    }
}
