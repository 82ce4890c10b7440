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

import net.boyechko.backport.config.BuildConfig;
import net.boyechko.backport.errors.CheckViolation;
import net.boyechko.backport.pass.Checker;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.TreeVisitor;
import net.boyechko.backport.tree.TreeWalker;

/**
 * Base for checkers that inspect nodes one at a time during a {@link TreeWalker} pass.
 * Subclasses override {@link #enterNode} and throw {@link #violation} at the first match, which
 * ends the walk.
 */
public abstract class WalkingChecker implements Checker, TreeVisitor {
    private BuildConfig config;

    @Override
    public void check(BuildConfig config, Node.Module module) {
        this.config = config;
        new TreeWalker().addVisitor(this).walk(module);
    }

    protected BuildConfig config() {
        return config;
    }

    protected CheckViolation violation(String message, Node node) {
        return new CheckViolation(name(), message, node);
    }
}
