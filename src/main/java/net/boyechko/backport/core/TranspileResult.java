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
package net.boyechko.backport.core;

import java.util.List;
import net.boyechko.backport.pass.EffectSet;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.SourceRenderer;

/** The rewritten module, the effects its output must carry, and what ran to produce it. */
public record TranspileResult(
        Node.Module module,
        EffectSet effects,
        List<String> checkersRun,
        List<String> fixersApplied,
        List<String> skipped) {

    /** Source text of the rewritten module, with required imports and declarations. */
    public String render() {
        return SourceRenderer.render(module, effects);
    }

    public int passesRun() {
        return checkersRun.size() + fixersApplied.size();
    }
}
