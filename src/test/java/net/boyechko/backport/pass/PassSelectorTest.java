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
package net.boyechko.backport.pass;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PassSelectorTest {

    @ParameterizedTest(name = "normalize(\"{0}\")")
    @ValueSource(
            strings = {
                "RemoveAnnAssignFixer",
                "remove_ann_assign",
                "Remove-AnnAssign",
                "remove ann assign",
                "REMOVEANNASSIGN"
            })
    void spellingsOfOnePassNormalizeAlike(String spelling) {
        assertEquals("removeannassign", PassSelector.normalize(spelling));
    }

    @Test
    void stripsCheckerSuffix() {
        assertEquals("nostarimports", PassSelector.normalize("NoStarImportsChecker"));
        assertEquals("nostarimports", PassSelector.normalize("no_star_imports"));
    }

    @Test
    void parsesCommaSeparatedTokens() {
        assertEquals(
                List.of("a", "b_c", "d"), PassSelector.parse(" a, b_c ,,d, "));
        assertEquals(List.of(), PassSelector.parse(null));
        assertEquals(List.of(), PassSelector.parse(" , "));
    }

    @Test
    void blankSelectorSelectsAll() {
        assertTrue(PassSelector.selectsAll(null));
        assertTrue(PassSelector.selectsAll(List.of()));
        assertTrue(PassSelector.selectsAll(List.of(" ", "")));
        assertFalse(PassSelector.selectsAll(List.of("x")));
    }
}
