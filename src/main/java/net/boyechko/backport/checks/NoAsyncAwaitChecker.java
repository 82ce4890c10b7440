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

import net.boyechko.backport.tree.NodeContext;
import net.boyechko.backport.version.ProhibitionWindow;

/** Coroutine syntax has no rewrite for targets before 3.5. */
public class NoAsyncAwaitChecker extends WalkingChecker {

    @Override
    public String name() {
        return "NoAsyncAwait";
    }

    @Override
    public String description() {
        return "async/await is not available";
    }

    @Override
    public ProhibitionWindow prohibitionWindow() {
        return ProhibitionWindow.until("3.4");
    }

    @Override
    public boolean enterNode(NodeContext ctx) {
        if (ctx.kind().isAsync()) {
            throw violation("Prohibited use of async/await", ctx.node());
        }
        return true;
    }
}
