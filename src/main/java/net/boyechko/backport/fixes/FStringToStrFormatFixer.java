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
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.version.VersionWindow;

/**
 * Rewrites f-strings as {@code str.format} calls with explicit field indexes, which 2.6 requires.
 * {@code f"{a!r:>{w}} {{}}"} becomes {@code "{0!r:>{1}} {{}}".format(a, w)}. Arguments appear in
 * the order their fields open, so nested spec fields follow their owner.
 */
public class FStringToStrFormatFixer extends TransformingFixer {

    @Override
    public String description() {
        return "Replace f-strings with str.format";
    }

    @Override
    public VersionWindow versionWindow() {
        return VersionWindow.of("2.6", "3.5");
    }

    @Override
    protected Rewriter newRewriter() {
        return new Rewriter() {
            @Override
            public Expr visitJoinedStr(Expr.JoinedStr node) {
                super.visitJoinedStr(node);
                List<Expr> formatArgs = new ArrayList<>();
                String template = joined(node, formatArgs, false);
                Expr.Call call =
                        Nodes.call(
                                Nodes.attr(Nodes.str(template), "format"), formatArgs, List.of());
                call.setLine(node.line());
                return call;
            }
        };
    }

    private static String joined(Expr.JoinedStr node, List<Expr> formatArgs, boolean inSpec) {
        StringBuilder sb = new StringBuilder();
        for (Expr value : node.values()) {
            if (value instanceof Expr.Str str) {
                // braces in a spec belong to the spec
                sb.append(inSpec ? str.s() : escapeBraces(str.s()));
            } else if (value instanceof Expr.FormattedValue field) {
                sb.append(field(field, formatArgs));
            } else {
                throw new FixerError(
                        "Unexpected f-string part " + value.kind().typeName(), value);
            }
        }
        return sb.toString();
    }

    private static String field(Expr.FormattedValue field, List<Expr> formatArgs) {
        int index = formatArgs.size();
        formatArgs.add(field.value());
        StringBuilder sb = new StringBuilder("{").append(index);
        if (field.hasConversion()) {
            sb.append('!').append((char) field.conversion());
        }
        if (field.formatSpec() != null) {
            sb.append(':').append(joined(field.formatSpec(), formatArgs, true));
        }
        return sb.append('}').toString();
    }

    static String escapeBraces(String text) {
        return text.replace("{", "{{").replace("}", "}}");
    }
}
