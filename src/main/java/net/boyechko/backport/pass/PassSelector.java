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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Name matching for pass selectors such as {@code "unpacking_generalizations, NoStarImports"}. */
public final class PassSelector {
    private PassSelector() {}

    /**
     * Lowercases, drops separators ({@code _}, {@code -}, whitespace) and a trailing {@code
     * checker} or {@code fixer}, so {@code "Remove-AnnAssign"}, {@code "remove_ann_assign"} and
     * {@code "RemoveAnnAssignFixer"} all match.
     */
    public static String normalize(String name) {
        String n = name.toLowerCase(Locale.ROOT).replaceAll("[_\\-\\s]", "");
        if (n.endsWith("checker")) {
            n = n.substring(0, n.length() - "checker".length());
        } else if (n.endsWith("fixer")) {
            n = n.substring(0, n.length() - "fixer".length());
        }
        return n;
    }

    /** Splits a comma-separated selector into trimmed, non-blank tokens. */
    public static List<String> parse(String selector) {
        List<String> tokens = new ArrayList<>();
        if (selector == null) {
            return tokens;
        }
        for (String token : selector.split(",")) {
            if (!token.isBlank()) {
                tokens.add(token.trim());
            }
        }
        return tokens;
    }

    /** An empty or all-blank selector selects every pass. */
    public static boolean selectsAll(List<String> tokens) {
        return tokens == null || tokens.stream().allMatch(String::isBlank);
    }
}
