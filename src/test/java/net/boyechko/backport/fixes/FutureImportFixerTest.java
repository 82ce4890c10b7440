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

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.backport.BackportTestBase;
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.tree.Stmt;
import org.junit.jupiter.api.Test;

class FutureImportFixerTest extends BackportTestBase {

    @Test
    void recordsTheFutureImportWithoutTouchingTheTree() {
        FutureImportFixer fixer = new FutureImportFixer("division", "2.2", "2.7");

        String out = applyAndRender(fixer, module(Nodes.assign("x", Nodes.num(1))));

        assertEquals("from __future__ import division\nx = 1\n", out);
        assertEquals("DivisionFutureFixer", fixer.name());
    }

    @Test
    void futureImportsFollowTheDocstring() {
        FutureImportFixer fixer = new FutureImportFixer("print_function", "2.6", "2.7");
        Stmt doc = Nodes.exprStmt(Nodes.str("Module docs."));

        String out = applyAndRender(fixer, module(doc, Nodes.pass()));

        assertEquals("'Module docs.'\nfrom __future__ import print_function\npass\n", out);
        assertEquals("PrintFunctionFutureFixer", fixer.name());
    }
}
