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

import net.boyechko.backport.config.BuildConfig;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.version.ProhibitionWindow;

/**
 * Read-only pass that rejects a forbidden construct. Implementations stop at the first violation
 * and never modify the tree.
 */
public non-sealed interface Checker extends Pass {

    ProhibitionWindow prohibitionWindow();

    /**
     * @throws net.boyechko.backport.errors.CheckViolation at the first forbidden construct
     */
    void check(BuildConfig config, Node.Module module);

    @Override
    default String name() {
        return getClass().getSimpleName();
    }
}
