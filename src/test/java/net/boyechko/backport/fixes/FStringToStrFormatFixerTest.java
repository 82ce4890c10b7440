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
import org.junit.jupiter.api.Test;

class FStringToStrFormatFixerTest extends BackportTestBase {

    private static Expr.JoinedStr fstring(Expr... parts) {
        return new Expr.JoinedStr(List.of(parts));
    }

    private static Expr.FormattedValue field(Expr value) {
        return new Expr.FormattedValue(value, Expr.FormattedValue.NO_CONVERSION, null);
    }

    @Test
    void fieldsGetExplicitIndexes() {
        Expr.JoinedStr f =
                fstring(
                        Nodes.str("x="),
                        field(Nodes.name("x")),
                        Nodes.str(", y="),
                        field(Nodes.name("y")));

        String out = applyAndRender(new FStringToStrFormatFixer(), moduleOf(f));

        assertEquals("'x={0}, y={1}'.format(x, y)\n", out);
    }

    @Test
    void conversionsAndNestedSpecsAreKept() {
        Expr.FormattedValue padded =
                new Expr.FormattedValue(
                        Nodes.name("a"), 'r', fstring(Nodes.str(">"), field(Nodes.name("w"))));
        Expr.JoinedStr f = fstring(padded, Nodes.str(" {}"));

        String out = applyAndRender(new FStringToStrFormatFixer(), moduleOf(f));

        assertEquals("'{0!r:>{1}} {{}}'.format(a, w)\n", out);
    }

    @Test
    void innerFStringsAreRewrittenFirst() {
        Expr.JoinedStr inner = fstring(field(Nodes.name("y")));
        Expr.JoinedStr outer = fstring(Nodes.str("["), field(inner), Nodes.str("]"));

        String out = applyAndRender(new FStringToStrFormatFixer(), moduleOf(outer));

        assertEquals("'[{0}]'.format('{0}'.format(y))\n", out);
    }

    @Test
    void escapesLiteralBraces() {
        assertEquals("{{a}}", FStringToStrFormatFixer.escapeBraces("{a}"));
    }
}
