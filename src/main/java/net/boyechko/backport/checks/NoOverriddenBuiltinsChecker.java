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
package net.boyechko.backport.checks;

import net.boyechko.backport.config.BuiltinNames;
import net.boyechko.backport.version.ProhibitionWindow;

/** Generated declarations assume builtins keep their meaning, so none may be rebound. */
public class NoOverriddenBuiltinsChecker extends NameBindingChecker {
    private final BuiltinNames names;

    public NoOverriddenBuiltinsChecker() {
        this(BuiltinNames.loadDefault());
    }

    public NoOverriddenBuiltinsChecker(BuiltinNames names) {
        this.names = names;
    }

    @Override
    public String description() {
        return "Builtin names must not be rebound";
    }

    @Override
    public ProhibitionWindow prohibitionWindow() {
        return ProhibitionWindow.always();
    }

    @Override
    protected boolean isProtected(String name) {
        return names.isBuiltin(name);
    }

    @Override
    protected boolean countsPlainImports() {
        return true;
    }

    @Override
    protected String describeOverride(String name) {
        return "Prohibited override of builtin '" + name + "'";
    }
}
