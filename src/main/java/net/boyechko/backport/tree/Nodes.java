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

import java.util.Arrays;
import java.util.List;
import net.boyechko.backport.tree.Expr.Attribute;
import net.boyechko.backport.tree.Expr.BinOp;
import net.boyechko.backport.tree.Expr.Call;
import net.boyechko.backport.tree.Expr.DictExpr;
import net.boyechko.backport.tree.Expr.ListExpr;
import net.boyechko.backport.tree.Expr.Name;
import net.boyechko.backport.tree.Expr.NameConstant;
import net.boyechko.backport.tree.Expr.Num;
import net.boyechko.backport.tree.Expr.SetExpr;
import net.boyechko.backport.tree.Expr.Starred;
import net.boyechko.backport.tree.Expr.Str;
import net.boyechko.backport.tree.Expr.Subscript;
import net.boyechko.backport.tree.Expr.TupleExpr;
import net.boyechko.backport.tree.Node.Keyword;
import net.boyechko.backport.tree.Node.Module;

/** Shorthand constructors for the nodes that rewrites and tests build most often. */
public final class Nodes {
    private Nodes() {}

    // == Expressions ==================================================

    public static Name name(String id) {
        return new Name(id, ExprContext.LOAD);
    }

    public static Name store(String id) {
        return new Name(id, ExprContext.STORE);
    }

    /** A dotted reference such as {@code itertools.chain}, read context. */
    public static Expr dotted(String path) {
        String[] parts = path.split("\\.");
        Expr result = name(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            result = attr(result, parts[i]);
        }
        return result;
    }

    public static Attribute attr(Expr value, String attr) {
        return new Attribute(value, attr, ExprContext.LOAD);
    }

    public static Subscript subscript(Expr value, Expr slice) {
        return new Subscript(value, slice, ExprContext.LOAD);
    }

    public static Str str(String s) {
        return new Str(s);
    }

    public static Num num(long value) {
        return new Num(Long.toString(value));
    }

    public static NameConstant none() {
        return new NameConstant("None");
    }

    public static NameConstant bool(boolean value) {
        return new NameConstant(value ? "True" : "False");
    }

    public static ListExpr list(List<? extends Expr> elts) {
        return new ListExpr(elts, ExprContext.LOAD);
    }

    public static ListExpr list(Expr... elts) {
        return list(Arrays.asList(elts));
    }

    public static SetExpr set(Expr... elts) {
        return new SetExpr(Arrays.asList(elts));
    }

    public static TupleExpr tuple(List<? extends Expr> elts) {
        return new TupleExpr(elts, ExprContext.LOAD);
    }

    public static TupleExpr tuple(Expr... elts) {
        return tuple(Arrays.asList(elts));
    }

    public static DictExpr dict(List<? extends Expr> keys, List<? extends Expr> values) {
        return new DictExpr(keys, values);
    }

    /** Single-entry mapping display. */
    public static DictExpr entry(Expr key, Expr value) {
        return new DictExpr(Arrays.asList(key), List.of(value));
    }

    public static Starred starred(Expr value) {
        return new Starred(value, ExprContext.LOAD);
    }

    public static Keyword keyword(String arg, Expr value) {
        return new Keyword(arg, value);
    }

    /** A {@code **value} call argument. */
    public static Keyword kwSpread(Expr value) {
        return new Keyword(null, value);
    }

    public static Call call(Expr func, List<? extends Expr> args, List<Keyword> keywords) {
        return new Call(func, args, keywords);
    }

    public static Call call(Expr func, Expr... args) {
        return new Call(func, Arrays.asList(args), List.of());
    }

    public static Call call(String func, Expr... args) {
        return call(dotted(func), args);
    }

    public static BinOp binOp(Expr left, Operator op, Expr right) {
        return new BinOp(left, op, right);
    }

    // == Statements ===================================================

    public static Stmt.Assign assign(String target, Expr value) {
        return new Stmt.Assign(List.of(store(target)), value);
    }

    public static Stmt.ExprStmt exprStmt(Expr value) {
        return new Stmt.ExprStmt(value);
    }

    public static Stmt.Pass pass() {
        return new Stmt.Pass();
    }

    public static Stmt.Return ret(Expr value) {
        return new Stmt.Return(value);
    }

    public static Stmt.Import importModule(String module) {
        return new Stmt.Import(List.of(new Node.Alias(module, null)));
    }

    public static Stmt.ImportFrom importFrom(String module, String... names) {
        return new Stmt.ImportFrom(
                module, Arrays.stream(names).map(n -> new Node.Alias(n, null)).toList(), 0);
    }

    public static Stmt.FunctionDef def(String name, Node.Arguments args, Stmt... body) {
        return new Stmt.FunctionDef(name, args, Arrays.asList(body), List.of(), null, false);
    }

    public static Stmt.ClassDef classDef(String name, List<? extends Expr> bases, Stmt... body) {
        return new Stmt.ClassDef(name, bases, List.of(), Arrays.asList(body), List.of());
    }

    /** Positional parameters without annotations or defaults. */
    public static Node.Arguments params(String... names) {
        Node.Arguments args = Node.Arguments.empty();
        args.setArgs(Arrays.stream(names).map(n -> new Node.Arg(n, null)).toList());
        return args;
    }

    public static Module module(String name, Stmt... body) {
        return new Module(name, Arrays.asList(body));
    }
}
