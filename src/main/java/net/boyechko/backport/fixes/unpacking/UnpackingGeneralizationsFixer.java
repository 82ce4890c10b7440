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
package net.boyechko.backport.fixes.unpacking;

import java.util.List;
import net.boyechko.backport.fixes.TransformingFixer;
import net.boyechko.backport.fixes.unpacking.PositionalSpreads.Segment;
import net.boyechko.backport.pass.ImportDecl;
import net.boyechko.backport.tree.Expr;
import net.boyechko.backport.tree.ExprContext;
import net.boyechko.backport.tree.Nodes;
import net.boyechko.backport.version.VersionWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites PEP 448 unpacking into forms with at most one trailing spread.
 *
 * <ul>
 *   <li>{@code [*[1, 2], 3, *[4, 5]]} becomes {@code [1, 2, 3, 4, 5]}
 *   <li>{@code f(*a, *[1, 2], z)} becomes {@code f(*(list(a) + [1, 2, z]))}
 *   <li>{@code {**a, **b, 'x': 1}} becomes {@code dict(itertools.chain(a.items(), b.items(),
 *       {'x': 1}.items()))}
 *   <li>{@code {**{'a': 1}, **{'b': 2}}} becomes {@code {'a': 1, 'b': 2}}
 * </ul>
 *
 * Calls are rewritten only when something follows a spread. Displays are rewritten on any spread,
 * since older targets accept none inside them. Children are rewritten before their parents, so a
 * spread of a display that was just normalized is flattened too. Assignment targets such as
 * {@code a, *rest = xs} are left alone.
 *
 * <p>Output has no interleaved spreads, so running the fixer again changes nothing.
 */
public class UnpackingGeneralizationsFixer extends TransformingFixer {
    private static final Logger logger =
            LoggerFactory.getLogger(UnpackingGeneralizationsFixer.class);

    static final ImportDecl ITERTOOLS = ImportDecl.module("itertools");

    @Override
    public String description() {
        return "Rewrite generalized unpacking into single-spread forms";
    }

    @Override
    public VersionWindow versionWindow() {
        return VersionWindow.of("2.0", "3.4");
    }

    @Override
    protected Rewriter newRewriter() {
        return new Rewriter() {
            @Override
            public Expr visitCall(Expr.Call node) {
                super.visitCall(node);
                return rewriteCall(node);
            }

            @Override
            public Expr visitList(Expr.ListExpr node) {
                super.visitList(node);
                if (node.ctx() != ExprContext.LOAD || !PositionalSpreads.hasSpread(node.elts())) {
                    return node;
                }
                return rewriteDisplay(node, node.elts(), "list");
            }

            @Override
            public Expr visitTuple(Expr.TupleExpr node) {
                super.visitTuple(node);
                if (node.ctx() != ExprContext.LOAD || !PositionalSpreads.hasSpread(node.elts())) {
                    return node;
                }
                return rewriteDisplay(node, node.elts(), "tuple");
            }

            @Override
            public Expr visitSet(Expr.SetExpr node) {
                super.visitSet(node);
                if (!PositionalSpreads.hasSpread(node.elts())) {
                    return node;
                }
                return rewriteDisplay(node, node.elts(), "set");
            }

            @Override
            public Expr visitDict(Expr.DictExpr node) {
                super.visitDict(node);
                if (!node.hasSpread()) {
                    return node;
                }
                return rewriteMapping(node);
            }
        };
    }

    // == Positional spreads ===========================================

    /** {@code constructor} is the builtin that rebuilds the display kind from an iterable. */
    private Expr rewriteDisplay(Expr node, List<Expr> elts, String constructor) {
        List<Segment> segments = PositionalSpreads.segments(elts);
        logger.trace("{} display with {} segments", constructor, segments.size());
        if (segments.isEmpty()) {
            return display(constructor, List.of());
        }
        if (segments.size() == 1) {
            Segment only = segments.get(0);
            return only.isLiteral()
                    ? display(constructor, only.elts())
                    : Nodes.call(constructor, only.opaque());
        }
        Expr concatenated = PositionalSpreads.concatenate(segments);
        // the concatenation is already a list
        return "list".equals(constructor) ? concatenated : Nodes.call(constructor, concatenated);
    }

    private static Expr display(String constructor, List<Expr> elts) {
        return switch (constructor) {
            case "list" -> Nodes.list(elts);
            case "tuple" -> Nodes.tuple(elts);
            default -> elts.isEmpty() ? Nodes.call("set") : new Expr.SetExpr(elts);
        };
    }

    private Expr rewriteCall(Expr.Call call) {
        if (PositionalSpreads.hasInterleavedSpread(call.args())) {
            List<Segment> segments = PositionalSpreads.segments(call.args());
            logger.trace("Call with {} positional segments", segments.size());
            if (segments.isEmpty()) {
                call.setArgs(List.of());
            } else if (segments.size() == 1) {
                Segment only = segments.get(0);
                call.setArgs(
                        only.isLiteral()
                                ? only.elts()
                                : List.of(Nodes.starred(only.opaque())));
            } else {
                call.setArgs(List.of(Nodes.starred(PositionalSpreads.concatenate(segments))));
            }
        }
        if (MappingChain.hasInterleavedSpread(call.keywords())) {
            return rewriteKeywords(call);
        }
        return call;
    }

    // == Mapping spreads ==============================================

    private Expr rewriteMapping(Expr.DictExpr node) {
        List<Expr> chain = MappingChain.of(node);
        logger.trace("Mapping display with {} chain values", chain.size());
        if (chain.size() == 1) {
            Expr only = chain.get(0);
            // dict(x) keeps the copy a display would have made
            return MappingChain.isMapping(only) ? only : Nodes.call("dict", only);
        }
        return chained(chain);
    }

    private Expr rewriteKeywords(Expr.Call call) {
        List<Expr> chain = MappingChain.of(call.keywords());
        logger.trace("Call with {} keyword chain values", chain.size());
        boolean buildsDict = call.isCallTo("dict") && call.args().isEmpty();
        Expr merged;
        if (chain.size() == 1) {
            merged = chain.get(0);
            if (buildsDict && MappingChain.isMapping(merged)) {
                return merged;
            }
        } else {
            merged = chained(chain);
            if (buildsDict) {
                return merged;
            }
        }
        call.setKeywords(List.of(Nodes.kwSpread(merged)));
        return call;
    }

    private Expr chained(List<Expr> chain) {
        requireImport(ITERTOOLS);
        return MappingChain.chainCall(chain);
    }
}
