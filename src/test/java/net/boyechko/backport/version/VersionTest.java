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
package net.boyechko.backport.version;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class VersionTest {

    @Test
    void comparesNumericallyPerComponent() {
        assertTrue(Version.parse("3.10").compareTo(Version.parse("3.9")) > 0);
        assertTrue(Version.parse("2.7").compareTo(Version.parse("3.0")) < 0);
        assertTrue(Version.parse("2.7.18").isAtLeast(Version.parse("2.7")));
    }

    @Test
    void missingTrailingComponentsCountAsZero() {
        assertEquals(Version.parse("3"), Version.parse("3.0"));
        assertEquals(Version.parse("3").hashCode(), Version.parse("3.0.0").hashCode());
        assertEquals(0, Version.parse("3.0").compareTo(Version.parse("3")));
    }

    @Test
    void keepsTheTextItWasParsedFrom() {
        assertEquals("3.10", Version.parse(" 3.10 ").toString());
        assertEquals("2.7", Version.of(2, 7).toString());
        assertEquals(3, Version.parse("3.10").major());
        assertEquals(10, Version.parse("3.10").minor());
        assertEquals(0, Version.parse("3").minor());
    }

    @ParameterizedTest(name = "rejects \"{0}\"")
    @ValueSource(strings = {"", " ", "3.", ".7", "3..7", "3.x", "-1.0", "v3"})
    void rejectsMalformedVersions(String text) {
        assertThrows(IllegalArgumentException.class, () -> Version.parse(text));
    }
}
