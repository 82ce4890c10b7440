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
import net.boyechko.backport.tree.Nodes;
import org.junit.jupiter.api.Test;

class NewStyleClassesFixerTest extends BackportTestBase {

    @Test
    void baselessClassesInheritObject() {
        String out =
                applyAndRender(
                        new NewStyleClassesFixer(),
                        module(
                                Nodes.classDef("A", List.of(), Nodes.pass()),
                                Nodes.classDef("B", List.of(Nodes.name("A")), Nodes.pass())));

        assertEquals("class A(object):\n    pass\nclass B(A):\n    pass\n", out);
    }
}
