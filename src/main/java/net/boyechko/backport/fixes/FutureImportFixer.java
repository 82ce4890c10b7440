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
package net.boyechko.backport.fixes;

import net.boyechko.backport.config.BuildConfig;
import net.boyechko.backport.pass.Fixer;
import net.boyechko.backport.pass.ImportDecl;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.version.VersionWindow;

/**
 * Records {@code from __future__ import feature} for targets where the feature is optional. The
 * tree itself is left alone.
 */
public class FutureImportFixer extends Fixer {
    private final String feature;
    private final VersionWindow window;

    public FutureImportFixer(String feature, String applySince, String applyUntil) {
        this.feature = feature;
        this.window = VersionWindow.of(applySince, applyUntil);
    }

    public String feature() {
        return feature;
    }

    /** {@code generator_stop} is named {@code GeneratorStopFutureFixer}. */
    @Override
    public String name() {
        return Names.camel(feature) + "FutureFixer";
    }

    @Override
    public String description() {
        return "Add from __future__ import " + feature;
    }

    @Override
    public VersionWindow versionWindow() {
        return window;
    }

    @Override
    public Node.Module apply(BuildConfig config, Node.Module module) {
        requireImport(ImportDecl.from(ImportDecl.FUTURE, feature));
        return module;
    }
}
