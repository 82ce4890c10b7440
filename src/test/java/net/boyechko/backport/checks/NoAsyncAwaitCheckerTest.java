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
package net.boyechko.backport.checks;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.backport.BackportTestBase;
import net.boyechko.backport.errors.CheckViolation;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.tree.Stmt;
import net.boyechko.backport.version.Version;
import org.junit.jupiter.api.Test;

class NoAsyncAwaitCheckerTest extends BackportTestBase {
    private final NoAsyncAwaitChecker checker = new NoAsyncAwaitChecker();

    @Test
    void rejectsAsyncFunction() {
        Stmt.FunctionDef coroutine =
                new Stmt.FunctionDef(
                        "fetch",
                        Node.Arguments.empty(),
                        List.of(Nodes.pass()),
                        List.of(),
                        null,
                        true);

        var ex =
                assertThrows(
                        CheckViolation.class,
                        () -> checker.check(PY36_TO_PY27, module(coroutine)));
        assertEquals("NoAsyncAwait", ex.checkerName());
        assertSame(coroutine, ex.node());
    }

    @Test
    void rejectsAwaitNestedInAnExpression() {
        Expr.Await await = new Expr.Await(Nodes.call("fetch"));
        Stmt.FunctionDef def =
                Nodes.def("f", Nodes.params(), Nodes.assign("x", Nodes.call("g", await)));

        var ex = assertThrows(CheckViolation.class, () -> checker.check(PY36_TO_PY27, module(def)));
        assertSame(await, ex.node());
    }

    @Test
    void isProhibitedOnlyBefore35() {
        assertTrue(checker.prohibitionWindow().isProhibitedFor(Version.parse("3.4")));
        assertFalse(checker.prohibitionWindow().isProhibitedFor(Version.parse("3.5")));
    }
}
