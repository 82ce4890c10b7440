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

import java.util.Arrays;

/**
 * A dialect version such as {@code 2.7} or {@code 3.10}. Compared numerically per dotted
 * component; missing trailing components count as zero, so {@code 3} equals {@code 3.0}.
 */
public final class Version implements Comparable<Version> {
    private final int[] components;
    private final String text;

    private Version(int[] components, String text) {
        this.components = components;
        this.text = text;
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not a dotted list of non-negative
     *     integers
     */
    public static Version parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Version must not be blank");
        }
        String trimmed = text.trim();
        String[] parts = trimmed.split("\\.", -1);
        int[] components = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].isEmpty() || !parts[i].chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("Invalid version: " + text);
            }
            try {
                components[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid version: " + text, e);
            }
        }
        return new Version(components, trimmed);
    }

    public static Version of(int major, int minor) {
        return new Version(new int[] {major, minor}, major + "." + minor);
    }

    public int major() {
        return components[0];
    }

    public int minor() {
        return components.length > 1 ? components[1] : 0;
    }

    @Override
    public int compareTo(Version other) {
        int n = Math.max(components.length, other.components.length);
        for (int i = 0; i < n; i++) {
            int cmp = Integer.compare(component(i), other.component(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private int component(int i) {
        return i < components.length ? components[i] : 0;
    }

    public boolean isAtLeast(Version other) {
        return compareTo(other) >= 0;
    }

    public boolean isAtMost(Version other) {
        return compareTo(other) <= 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Version other && compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        int end = components.length;
        while (end > 1 && components[end - 1] == 0) {
            end--;
        }
        return Arrays.hashCode(Arrays.copyOf(components, end));
    }

    @Override
    public String toString() {
        return text;
    }
}
