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

class VersionWindowTest {
    private static Version v(String text) {
        return Version.parse(text);
    }

    @Test
    void requiredBoundsAreInclusive() {
        VersionWindow window = VersionWindow.of("2.6", "3.5");

        assertTrue(window.isRequiredFor(v("2.6")), "applySince itself is in range");
        assertFalse(window.isRequiredFor(v("2.5")), "predecessor of applySince is out");
        assertTrue(window.isRequiredFor(v("3.5")), "applyUntil itself is in range");
        assertFalse(window.isRequiredFor(v("3.6")), "successor of applyUntil is out");
    }

    @Test
    void worksSinceDefaultsToApplySince() {
        VersionWindow window = VersionWindow.of("2.6", "3.5");

        assertEquals(v("2.6"), window.worksSince());
        assertNull(window.worksUntil());
        assertTrue(window.isSafeOnSource(v("3.12")), "no worksUntil means unbounded");
        assertFalse(window.isSafeOnSource(v("2.5")));
    }

    @Test
    void sourceBeforeWorksSinceIsNeverApplicable() {
        VersionWindow window = VersionWindow.of("2.6", "3.5");

        assertTrue(window.isRequiredFor(v("2.7")));
        assertFalse(
                window.isApplicable(v("2.5"), v("2.7")),
                "required for the target but unsafe on the source");
        assertTrue(window.isApplicable(v("3.6"), v("2.7")));
    }

    @Test
    void worksUntilBoundsTheSource() {
        VersionWindow window = VersionWindow.of("1.0", "2.7").withWorksUntil("3.7");

        assertTrue(window.isApplicable(v("3.7"), v("2.7")));
        assertFalse(window.isApplicable(v("3.8"), v("2.7")));
        assertEquals("apply 1.0..2.7, works 1.0..3.7", window.toString());
    }

    @Test
    void rejectsInvertedApplyRange() {
        assertThrows(IllegalArgumentException.class, () -> VersionWindow.of("3.5", "2.6"));
    }

    @Test
    void prohibitionWithoutUpperBoundCoversEveryTarget() {
        ProhibitionWindow always = ProhibitionWindow.always();

        assertTrue(always.isProhibitedFor(v("2.7")));
        assertTrue(always.isProhibitedFor(v("3.12")));
        assertEquals("always", always.toString());
    }

    @Test
    void prohibitionUntilIsInclusive() {
        ProhibitionWindow window = ProhibitionWindow.until("3.4");

        assertTrue(window.isProhibitedFor(v("2.7")));
        assertTrue(window.isProhibitedFor(v("3.4")));
        assertFalse(window.isProhibitedFor(v("3.5")));
    }
}
