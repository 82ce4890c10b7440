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
package net.boyechko.backport.tree;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import net.boyechko.backport.BackportTestBase;
import net.boyechko.backport.errors.MalformedTreeException;
import net.boyechko.backport.tree.Node.Module;
import org.junit.jupiter.api.Test;

class TreeReaderTest extends BackportTestBase {

    @Test
    void readsModuleNamedAfterFile() {
        Module module = readTree("service.yaml");

        assertEquals("service", module.name());
        Stmt.ClassDef greeter = assertInstanceOf(Stmt.ClassDef.class, module.body().get(0));
        assertEquals(1, greeter.line());
        Stmt.FunctionDef greet = assertInstanceOf(Stmt.FunctionDef.class, greeter.body().get(0));
        assertEquals("greet", greet.name());
        assertEquals(2, greet.args().args().size());
        assertNotNull(greet.returns());
    }

    @Test
    void moduleNameDropsEveryExtension() {
        assertEquals("service", TreeReader.moduleName(Path.of("trees", "service.tree.yaml")));
        assertEquals("README", TreeReader.moduleName(Path.of("README")));
    }

    @Test
    void keepsMappingSpreadKeysAndContexts() {
        Module module = readTree("unpacking.yaml");

        Stmt.Assign assign = assertInstanceOf(Stmt.Assign.class, module.body().get(0));
        Expr.Name target = assertInstanceOf(Expr.Name.class, assign.targets().get(0));
        assertEquals(ExprContext.STORE, target.ctx());
        Expr.DictExpr dict = assertInstanceOf(Expr.DictExpr.class, assign.value());
        assertNull(dict.keys().get(0));
        assertTrue(dict.hasSpread());
        assertEquals("merged = {**defaults, 'x': 1}\nf(*a, b)\n", render(module));
    }

    @Test
    void scalarsStayText() {
        Module module =
                TreeReader.parse(
                        "m",
                        "kind: Module\n"
                                + "body:\n"
                                + "  - kind: Expr\n"
                                + "    value: {kind: Num, n: 0x1F}\n"
                                + "  - kind: Expr\n"
                                + "    value: {kind: NameConstant, value: True}\n");

        assertEquals("0x1F\nTrue\n", render(module));
    }

    @Test
    void acceptsContextAndOperatorAsNodes() {
        Module module =
                TreeReader.parse(
                        "m",
                        "kind: Module\n"
                                + "body:\n"
                                + "  - kind: AugAssign\n"
                                + "    target: {kind: Name, id: n, ctx: {kind: Store}}\n"
                                + "    op: {kind: Add}\n"
                                + "    value: {kind: Num, n: '2'}\n");

        assertEquals("n += 2\n", render(module));
    }

    @Test
    void rootMustBeAModule() {
        var ex = assertThrows(MalformedTreeException.class, () -> readTree("not_a_module.yaml"));
        assertEquals("not_a_module: root node must be a Module, got Expr", ex.getMessage());
    }

    @Test
    void unknownKindNamesItsPath() {
        var ex =
                assertThrows(
                        MalformedTreeException.class,
                        () -> TreeReader.parse("m", "kind: Module\nbody:\n  - kind: Walrus\n"));
        assertEquals("/Module.body[0]/: Unknown node kind: Walrus", ex.getMessage());
    }

    @Test
    void missingRequiredFieldIsMalformed() {
        var ex =
                assertThrows(
                        MalformedTreeException.class,
                        () -> TreeReader.parse("m", "kind: Module\nbody:\n  - kind: Expr\n"));
        assertEquals("/Module.body[0]/Expr.value/: expected a node mapping", ex.getMessage());
    }

    @Test
    void missingOperatorIsReportedAtItsField() {
        String yaml =
                "kind: Module\n"
                        + "body:\n"
                        + "  - kind: Expr\n"
                        + "    value:\n"
                        + "      kind: BinOp\n"
                        + "      left: {kind: Name, id: a}\n"
                        + "      right: {kind: Name, id: b}\n";
        var ex = assertThrows(MalformedTreeException.class, () -> TreeReader.parse("m", yaml));
        assertEquals("/Module.body[0]/Expr.value/BinOp.op: expected a string", ex.getMessage());
    }

    @Test
    void missingAnnotationIsReportedAtItsField() {
        String yaml =
                "kind: Module\n"
                        + "body:\n"
                        + "  - kind: AnnAssign\n"
                        + "    target: {kind: Name, id: x, ctx: Store}\n"
                        + "    value: {kind: Num, n: '1'}\n";
        var ex = assertThrows(MalformedTreeException.class, () -> TreeReader.parse("m", yaml));
        assertEquals(
                "/Module.body[0]/AnnAssign.annotation/: expected a node mapping", ex.getMessage());
        assertFalse(ex.getCause() instanceof NullPointerException);
    }

    @Test
    void invalidYamlIsMalformed() {
        var ex =
                assertThrows(
                        MalformedTreeException.class, () -> TreeReader.parse("m", "kind: [\n"));
        assertTrue(ex.getMessage().startsWith("m: not a valid YAML document"), ex.getMessage());
    }
}
