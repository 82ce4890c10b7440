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

/**
 * Target versions for which a checker's construct is forbidden: those at or below {@code
 * prohibitedUntil}, or every version when it is null.
 */
public record ProhibitionWindow(Version prohibitedUntil) {

    public static ProhibitionWindow always() {
        return new ProhibitionWindow(null);
    }

    public static ProhibitionWindow until(String version) {
        return new ProhibitionWindow(Version.parse(version));
    }

    public boolean isProhibitedFor(Version target) {
        return prohibitedUntil == null || prohibitedUntil.isAtLeast(target);
    }

    @Override
    public String toString() {
        return prohibitedUntil == null ? "always" : "until " + prohibitedUntil;
    }
}
