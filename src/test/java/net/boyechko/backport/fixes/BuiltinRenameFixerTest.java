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

import net.boyechko.backport.BackportTestBase;
import net.boyechko.backport.tree.Nodes;
import org.junit.jupiter.api.Test;

class BuiltinRenameFixerTest extends BackportTestBase {

    @Test
    void readingTheNewNameDeclaresTheOldOne() {
        BuiltinRenameFixer fixer = new BuiltinRenameFixer("xrange", "range");

        String out =
                applyAndRender(
                        fixer,
                        module(
                                Nodes.assign("a", Nodes.call("range", Nodes.num(3))),
                                Nodes.assign("b", Nodes.call("range", Nodes.num(4)))));

        assertEquals(
                "range = getattr(__builtins__, 'xrange', range)\na = range(3)\nb = range(4)\n",
                out);
    }

    @Test
    void moduleThatNeverReadsTheNameIsLeftAlone() {
        BuiltinRenameFixer fixer = new BuiltinRenameFixer("raw_input", "input");

        applyAndRender(fixer, module(Nodes.assign("input_file", Nodes.str("a.txt"))));

        assertTrue(fixer.effects().isEmpty());
    }

    @Test
    void nameIsDerivedFromBothBuiltins() {
        assertEquals("RawInputToInputFixer", new BuiltinRenameFixer("raw_input", "input").name());
        assertEquals("UnichrToChrFixer", new BuiltinRenameFixer("unichr", "chr").name());
    }
}
