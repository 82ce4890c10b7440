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
package net.boyechko.backport.fixes;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.backport.BackportTestBase;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.tree.Stmt;
import org.junit.jupiter.api.Test;

class ShortToLongFormSuperFixerTest extends BackportTestBase {

    private static Stmt superCall(String method, Expr... args) {
        return Nodes.exprStmt(Nodes.call(Nodes.attr(Nodes.call("super"), method), args));
    }

    @Test
    void bindsSuperToTheClassAndFirstParameter() {
        Stmt.ClassDef child =
                Nodes.classDef(
                        "Child",
                        List.of(Nodes.name("Base")),
                        Nodes.def(
                                "__init__",
                                Nodes.params("self", "x"),
                                superCall("__init__", Nodes.name("x"))));

        String out = applyAndRender(new ShortToLongFormSuperFixer(), module(child));

        assertEquals(
                "class Child(Base):\n"
                        + "    def __init__(self, x):\n"
                        + "        super(Child, self).__init__(x)\n",
                out);
    }

    @Test
    void nestedClassesBindToTheInnermostClass() {
        Stmt.ClassDef inner =
                Nodes.classDef(
                        "Inner",
                        List.of(Nodes.name("Base")),
                        Nodes.def("run", Nodes.params("self"), superCall("run")));
        Stmt.ClassDef outer =
                Nodes.classDef(
                        "Outer",
                        List.of(Nodes.name("Base")),
                        inner,
                        Nodes.def("run", Nodes.params("this"), superCall("run")));

        String out = applyAndRender(new ShortToLongFormSuperFixer(), module(outer));

        assertEquals(
                "class Outer(Base):\n"
                        + "    class Inner(Base):\n"
                        + "        def run(self):\n"
                        + "            super(Inner, self).run()\n"
                        + "    def run(this):\n"
                        + "        super(Outer, this).run()\n",
                out);
    }

    @Test
    void explicitSuperAndParameterlessFunctionsAreLeftAlone() {
        Stmt explicit =
                Nodes.exprStmt(
                        Nodes.call(
                                Nodes.attr(
                                        Nodes.call("super", Nodes.name("A"), Nodes.name("self")),
                                        "f")));
        Stmt.ClassDef cls =
                Nodes.classDef(
                        "A",
                        List.of(),
                        Nodes.def("f", Nodes.params("self"), explicit),
                        Nodes.def("g", Nodes.params(), superCall("g")));

        String out = applyAndRender(new ShortToLongFormSuperFixer(), module(cls));

        assertEquals(
                "class A:\n"
                        + "    def f(self):\n"
                        + "        super(A, self).f()\n"
                        + "    def g():\n"
                        + "        super().g()\n",
                out);
    }
}
