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

import java.util.Arrays;
import java.util.List;
import net.boyechko.backport.BackportTestBase;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.tree.Stmt;
import org.junit.jupiter.api.Test;

class RemoveFunctionDefAnnotationsFixerTest extends BackportTestBase {

    @Test
    void stripsEveryAnnotationIncludingNestedFunctions() {
        Node.Arguments args =
                new Node.Arguments(
                        List.of(new Node.Arg("x", Nodes.name("int"))),
                        List.of(Nodes.num(1)),
                        new Node.Arg("rest", Nodes.name("str")),
                        List.of(new Node.Arg("flag", Nodes.name("bool"))),
                        Arrays.asList((Expr) Nodes.bool(false)),
                        new Node.Arg("options", Nodes.name("dict")));
        Stmt.FunctionDef inner =
                new Stmt.FunctionDef(
                        "inner",
                        Nodes.params(),
                        List.of(Nodes.pass()),
                        List.of(),
                        Nodes.none(),
                        false);
        Stmt.FunctionDef outer =
                new Stmt.FunctionDef(
                        "outer", args, List.of(inner), List.of(), Nodes.name("str"), false);

        String before = render(module(outer));
        String out = applyAndRender(new RemoveFunctionDefAnnotationsFixer(), module(outer));

        assertEquals(
                "def outer(x: int = 1, *rest: str, flag: bool = False, **options: dict) -> str:\n"
                        + "    def inner() -> None:\n"
                        + "        pass\n",
                before);
        assertEquals(
                "def outer(x=1, *rest, flag=False, **options):\n"
                        + "    def inner():\n"
                        + "        pass\n",
                out);
    }
}
