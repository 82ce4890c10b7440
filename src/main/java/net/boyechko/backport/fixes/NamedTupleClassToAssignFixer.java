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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.backport.errors.FixerError;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.tree.Stmt;
import net.boyechko.backport.version.VersionWindow;

/**
 * Rewrites class-syntax named tuples into the functional form.
 *
 * <pre>
 * class Point(NamedTuple):        Point = NamedTuple('Point', [('x', int), ('y', int)])
 *     x: int               =>
 *     y: int
 * </pre>
 *
 * A base is recognized only through an import seen earlier in the module: {@code from typing
 * import NamedTuple [as N]} or {@code import typing [as t]}. Fields with defaults and methods have
 * no functional equivalent and are rejected.
 */
public class NamedTupleClassToAssignFixer extends TransformingFixer {
    static final String TYPING = "typing";
    static final String NAMED_TUPLE = "NamedTuple";

    @Override
    public String description() {
        return "Replace NamedTuple classes with NamedTuple(...) calls";
    }

    @Override
    public VersionWindow versionWindow() {
        return VersionWindow.of("2.6", "3.4");
    }

    @Override
    protected Rewriter newRewriter() {
        return new NamedTupleRewriter();
    }

    private final class NamedTupleRewriter extends Rewriter {
        private String typingModuleName;
        private String namedTupleName;

        @Override
        public List<Stmt> visitImport(Stmt.Import node) {
            for (Node.Alias alias : node.names()) {
                if (TYPING.equals(alias.name())) {
                    typingModuleName = alias.boundName();
                }
            }
            return List.of(node);
        }

        @Override
        public List<Stmt> visitImportFrom(Stmt.ImportFrom node) {
            if (TYPING.equals(node.module())) {
                for (Node.Alias alias : node.names()) {
                    if (NAMED_TUPLE.equals(alias.name())) {
                        namedTupleName = alias.boundName();
                    }
                }
            }
            return List.of(node);
        }

        @Override
        public List<Stmt> visitClassDef(Stmt.ClassDef node) {
            super.visitClassDef(node);
            Expr base = namedTupleBase(node);
            if (base == null) {
                return List.of(node);
            }

            List<Expr> fields = new ArrayList<>();
            for (Stmt stmt : node.body()) {
                if (stmt instanceof Stmt.AnnAssign field && field.target() instanceof Expr.Name n) {
                    if (field.value() != null) {
                        throw new FixerError(
                                "Default for NamedTuple field '"
                                        + n.id()
                                        + "' of "
                                        + node.name()
                                        + " cannot be expressed",
                                field);
                    }
                    fields.add(Nodes.tuple(Nodes.str(n.id()), field.annotation()));
                } else if (!isDocstringOrPass(stmt)) {
                    throw new FixerError(
                            "Unsupported statement in NamedTuple class " + node.name(), stmt);
                }
            }

            Stmt.Assign assign =
                    Nodes.assign(
                            node.name(),
                            Nodes.call(base, Nodes.str(node.name()), Nodes.list(fields)));
            assign.setLine(node.line());
            return List.of(assign);
        }

        /** The callee for the functional form, or null if no base is a known NamedTuple. */
        private Expr namedTupleBase(Stmt.ClassDef node) {
            for (Expr base : node.bases()) {
                if (namedTupleName != null
                        && base instanceof Expr.Name name
                        && name.id().equals(namedTupleName)) {
                    return Nodes.name(namedTupleName);
                }
                if (typingModuleName != null
                        && base instanceof Expr.Attribute attr
                        && attr.attr().equals(NAMED_TUPLE)
                        && attr.value() instanceof Expr.Name module
                        && module.id().equals(typingModuleName)) {
                    return Nodes.attr(Nodes.name(typingModuleName), NAMED_TUPLE);
                }
            }
            return null;
        }
    }

    private static boolean isDocstringOrPass(Stmt stmt) {
        return stmt instanceof Stmt.Pass
                || (stmt instanceof Stmt.ExprStmt expr && expr.value() instanceof Expr.Str);
    }
}
