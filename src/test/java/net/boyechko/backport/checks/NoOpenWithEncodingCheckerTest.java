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
import org.junit.jupiter.api.Test;

class NoOpenWithEncodingCheckerTest extends BackportTestBase {
    private final NoOpenWithEncodingChecker checker = new NoOpenWithEncodingChecker();

    private static Expr.Call open(List<Expr> args, Node.Keyword... keywords) {
        return Nodes.call(Nodes.name("open"), args, List.of(keywords));
    }

    private String violationFor(Expr.Call call) {
        var ex =
                assertThrows(
                        CheckViolation.class, () -> checker.check(PY36_TO_PY27, moduleOf(call)));
        return ex.getMessage();
    }

    @Test
    void binaryModesAreAllowed() {
        assertDoesNotThrow(
                () ->
                        checker.check(
                                PY36_TO_PY27,
                                moduleOf(open(List.of(Nodes.str("f"), Nodes.str("rb"))))));
        assertDoesNotThrow(
                () ->
                        checker.check(
                                PY36_TO_PY27,
                                moduleOf(
                                        open(
                                                List.of(Nodes.str("f")),
                                                Nodes.keyword("mode", Nodes.str("wb"))))));
    }

    @Test
    void defaultModeIsText() {
        assertTrue(violationFor(open(List.of(Nodes.str("f")))).contains("'r'"));
    }

    @Test
    void textOnlyKeywordsAreRejected() {
        String message =
                violationFor(
                        open(
                                List.of(Nodes.str("f"), Nodes.str("rb")),
                                Nodes.keyword("encoding", Nodes.str("utf-8"))));

        assertEquals("Prohibited keyword argument 'encoding' to builtin.open", message);
    }

    @Test
    void nonLiteralModeIsRejected() {
        String message = violationFor(open(List.of(Nodes.str("f"), Nodes.name("mode"))));

        assertTrue(message.endsWith("Expected a string literal, got: Name"), message);
    }

    @Test
    void morePositionalArgumentsThanBufferingAreRejected() {
        String message =
                violationFor(
                        open(
                                List.of(
                                        Nodes.str("f"),
                                        Nodes.str("rb"),
                                        Nodes.num(-1),
                                        Nodes.str("utf-8"))));

        assertEquals("Prohibited positional arguments to builtin.open", message);
    }

    @Test
    void qualifiedOpenIsNotTheBuiltin() {
        Expr.Call ioOpen = Nodes.call("io.open", Nodes.str("f"), Nodes.str("r"));

        assertDoesNotThrow(() -> checker.check(PY36_TO_PY27, moduleOf(ioOpen)));
    }
}
