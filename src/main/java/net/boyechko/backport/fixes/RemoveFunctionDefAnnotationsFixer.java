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
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.Stmt;
import net.boyechko.backport.tree.TreeWalker;
import net.boyechko.backport.version.VersionWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Drops return and parameter annotations from every function definition. */
public class RemoveFunctionDefAnnotationsFixer extends Fixer {
    private static final Logger logger =
            LoggerFactory.getLogger(RemoveFunctionDefAnnotationsFixer.class);

    @Override
    public String description() {
        return "Remove function annotations";
    }

    @Override
    public VersionWindow versionWindow() {
        return VersionWindow.of("1.0", "2.7");
    }

    @Override
    public Node.Module apply(BuildConfig config, Node.Module module) {
        int count = 0;
        for (Node node : TreeWalker.descendants(module)) {
            if (node instanceof Stmt.FunctionDef def) {
                def.setReturns(null);
                Node.Arguments args = def.args();
                args.args().forEach(arg -> arg.setAnnotation(null));
                args.kwOnlyArgs().forEach(arg -> arg.setAnnotation(null));
                if (args.vararg() != null) {
                    args.vararg().setAnnotation(null);
                }
                if (args.kwarg() != null) {
                    args.kwarg().setAnnotation(null);
                }
                count++;
            }
        }
        logger.trace("Stripped annotations from {} functions", count);
        return module;
    }
}
