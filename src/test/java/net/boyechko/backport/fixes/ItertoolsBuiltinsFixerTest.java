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

class ItertoolsBuiltinsFixerTest extends BackportTestBase {

    @Test
    void lazyBuiltinsAreReboundToItertools() {
        String out =
                applyAndRender(
                        new ItertoolsBuiltinsFixer(),
                        module(
                                Nodes.assign(
                                        "pairs",
                                        Nodes.call("zip", Nodes.name("a"), Nodes.name("b"))),
                                Nodes.assign(
                                        "more",
                                        Nodes.call("zip", Nodes.name("c"), Nodes.name("d")))));

        assertEquals(
                "import itertools\n"
                        + "zip = getattr(itertools, 'izip', zip)\n"
                        + "pairs = zip(a, b)\n"
                        + "more = zip(c, d)\n",
                out);
    }

    @Test
    void otherNamesRecordNothing() {
        ItertoolsBuiltinsFixer fixer = new ItertoolsBuiltinsFixer();

        applyAndRender(fixer, module(Nodes.assign("n", Nodes.call("len", Nodes.name("xs")))));

        assertTrue(fixer.effects().isEmpty());
    }
}
