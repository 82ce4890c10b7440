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

import java.util.Objects;

/**
 * A required import: {@code import module} when {@code member} is null, otherwise {@code from
 * module import member}.
 */
public record ImportDecl(String module, String member) {
    public static final String FUTURE = "__future__";

    public ImportDecl {
        Objects.requireNonNull(module, "module");
    }

    public static ImportDecl module(String module) {
        return new ImportDecl(module, null);
    }

    public static ImportDecl from(String module, String member) {
        return new ImportDecl(module, Objects.requireNonNull(member, "member"));
    }

    public boolean isFuture() {
        return FUTURE.equals(module);
    }

    public String toSource() {
        return member == null ? "import " + module : "from " + module + " import " + member;
    }
}
