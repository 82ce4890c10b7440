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

import java.util.Set;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.ExprContext;
import net.boyechko.backport.tree.Node;
import net.boyechko.backport.tree.NodeContext;
import net.boyechko.backport.version.ProhibitionWindow;

/**
 * The builtin {@code open} of older targets only agrees with the newer one for binary modes. Text
 * modes, text-only keyword arguments and modes that cannot be read statically are rejected; {@code
 * io.open} is the portable alternative.
 */
public class NoOpenWithEncodingChecker extends WalkingChecker {
    static final Set<String> PROHIBITED_KEYWORDS =
            Set.of("encoding", "errors", "newline", "closefd", "opener");

    @Override
    public String description() {
        return "Builtin open() must use a literal binary mode";
    }

    @Override
    public ProhibitionWindow prohibitionWindow() {
        return ProhibitionWindow.until("2.7");
    }

    @Override
    public boolean enterNode(NodeContext ctx) {
        if (ctx.node() instanceof Expr.Call call
                && call.func() instanceof Expr.Name func
                && func.id().equals("open")
                && func.ctx() == ExprContext.LOAD) {
            checkOpen(call);
        }
        return true;
    }

    private void checkOpen(Expr.Call call) {
        String mode = "r";
        if (call.args().size() >= 2) {
            mode = literalMode(call.args().get(1));
        }
        if (call.args().size() > 3) {
            throw violation("Prohibited positional arguments to builtin.open", call);
        }
        for (Node.Keyword kw : call.keywords()) {
            if (kw.arg() != null && PROHIBITED_KEYWORDS.contains(kw.arg())) {
                throw violation(
                        "Prohibited keyword argument '" + kw.arg() + "' to builtin.open", call);
            }
            if ("mode".equals(kw.arg())) {
                mode = literalMode(kw.value());
            }
        }
        if (!mode.contains("b")) {
            throw violation(
                    "Prohibited value '"
                            + mode
                            + "' for argument 'mode' of builtin.open. "
                            + "Only binary modes are allowed, use io.open as an alternative.",
                    call);
        }
    }

    private String literalMode(Expr mode) {
        if (mode instanceof Expr.Str str) {
            return str.s();
        }
        throw violation(
                "Prohibited value for argument 'mode' of builtin.open. "
                        + "Expected a string literal, got: "
                        + mode.kind().typeName(),
                mode);
    }
}
