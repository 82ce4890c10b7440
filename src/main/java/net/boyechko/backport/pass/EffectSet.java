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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Imports and module-level declarations a rewritten module must carry. Both are sets kept in
 * first-recorded order, so recording the same effect twice has no effect.
 */
public final class EffectSet {
    private final Set<ImportDecl> requiredImports = new LinkedHashSet<>();
    private final Set<String> moduleDeclarations = new LinkedHashSet<>();

    public boolean requireImport(ImportDecl decl) {
        return requiredImports.add(decl);
    }

    public boolean declare(String declaration) {
        return moduleDeclarations.add(declaration);
    }

    /** Set union: adds every effect of {@code other} not already present. */
    public EffectSet addAll(EffectSet other) {
        requiredImports.addAll(other.requiredImports);
        moduleDeclarations.addAll(other.moduleDeclarations);
        return this;
    }

    public Set<ImportDecl> requiredImports() {
        return Collections.unmodifiableSet(requiredImports);
    }

    public Set<String> moduleDeclarations() {
        return Collections.unmodifiableSet(moduleDeclarations);
    }

    public boolean isEmpty() {
        return requiredImports.isEmpty() && moduleDeclarations.isEmpty();
    }

    public int size() {
        return requiredImports.size() + moduleDeclarations.size();
    }

    @Override
    public String toString() {
        return "EffectSet{imports="
                + requiredImports
                + ", declarations="
                + moduleDeclarations
                + "}";
    }
}
