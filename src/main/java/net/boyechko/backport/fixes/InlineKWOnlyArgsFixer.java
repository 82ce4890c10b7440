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
 * Turns keyword-only parameters into reads from the {@code **kwargs} mapping.
 *
 * <pre>
 * def f(a, *, b, c=1):       def f(a, **kwargs):
 *     ...                 =>     b = kwargs['b']
 *                                c = kwargs.get('c', 1)
 *                                ...
 * </pre>
 *
 * The reads go after a leading docstring. An existing {@code **name} parameter is reused. Only
 * literal defaults are inlined, since any other expression would be evaluated per call instead of
 * once at definition time.
 */
public class InlineKWOnlyArgsFixer extends TransformingFixer {
    static final String DEFAULT_KWARG = "kwargs";

    @Override
    public String description() {
        return "Read keyword-only parameters from **kwargs";
    }

    @Override
    public VersionWindow versionWindow() {
        return VersionWindow.of("1.0", "3.5");
    }

    @Override
    protected Rewriter newRewriter() {
        return new Rewriter() {
            @Override
            public List<Stmt> visitFunctionDef(Stmt.FunctionDef node) {
                super.visitFunctionDef(node);
                inline(node);
                return List.of(node);
            }
        };
    }

    private static void inline(Stmt.FunctionDef def) {
        Node.Arguments args = def.args();
        if (args.kwOnlyArgs().isEmpty()) {
            return;
        }
        if (args.kwarg() == null) {
            args.setKwarg(new Node.Arg(DEFAULT_KWARG, null));
        }
        String kwName = args.kwarg().name();

        List<Stmt> reads = new ArrayList<>();
        for (int i = 0; i < args.kwOnlyArgs().size(); i++) {
            String argName = args.kwOnlyArgs().get(i).name();
            Expr defaultValue = args.kwDefaults().get(i);
            Expr read;
            if (defaultValue == null) {
                read = Nodes.subscript(Nodes.name(kwName), Nodes.str(argName));
            } else if (isLiteral(defaultValue)) {
                read = Nodes.call(
                        Nodes.attr(Nodes.name(kwName), "get"), Nodes.str(argName), defaultValue);
            } else {
                throw new FixerError(
                        "Keyword-only argument '"
                                + argName
                                + "' of "
                                + def.name()
                                + " must have a literal default, found "
                                + defaultValue.kind().typeName(),
                        def);
            }
            reads.add(Nodes.assign(argName, read));
        }

        List<Stmt> body = new ArrayList<>(def.body());
        int at = hasDocstring(body) ? 1 : 0;
        body.addAll(at, reads);
        def.setBody(body);
        args.setKwOnly(List.of(), List.of());
    }

    private static boolean isLiteral(Expr expr) {
        return switch (expr.kind()) {
            case NUM, STR, BYTES, NAME_CONSTANT -> true;
            default -> false;
        };
    }

    private static boolean hasDocstring(List<Stmt> body) {
        return !body.isEmpty()
                && body.get(0) instanceof Stmt.ExprStmt stmt
                && stmt.value() instanceof Expr.Str;
    }
}
