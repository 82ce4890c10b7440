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
package net.boyechko.backport.config;

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.backport.errors.ConfigurationException;
import org.junit.jupiter.api.Test;

class BuiltinNamesTest {

    @Test
    void bundledListsCoverBothDialects() {
        BuiltinNames names = BuiltinNames.loadDefault();

        assertTrue(names.isBuiltin("len"));
        assertTrue(names.isBuiltin("xrange"));
        assertTrue(names.isBuiltin("print"));
        assertTrue(names.isProtectedModule("itertools"));
        assertFalse(names.isBuiltin("itertools"));
        assertFalse(names.isProtectedModule("mymodule"));
    }

    @Test
    void defaultsAreLoadedOnce() {
        assertSame(BuiltinNames.loadDefault(), BuiltinNames.loadDefault());
    }

    @Test
    void missingResourceIsAConfigurationError() {
        var ex =
                assertThrows(
                        ConfigurationException.class,
                        () -> BuiltinNames.fromResource("/no-such-names.yaml"));
        assertEquals("Resource not found: /no-such-names.yaml", ex.getMessage());
    }
}
