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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Expression nodes. */
public abstract class Expr extends Node {

    public abstract <R> R accept(Visitor<R> visitor);

    /** One method per expression kind; implementations must handle every kind. */
    public interface Visitor<R> {
        R visitBoolOp(BoolOp node);

        R visitBinOp(BinOp node);

        R visitUnaryOp(UnaryOp node);

        R visitIfExp(IfExp node);

        R visitLambda(Lambda node);

        R visitDict(DictExpr node);

        R visitSet(SetExpr node);

        R visitList(ListExpr node);

        R visitTuple(TupleExpr node);

        R visitCompare(Compare node);

        R visitCall(Call node);

        R visitAwait(Await node);

        R visitYield(Yield node);

        R visitNum(Num node);

        R visitStr(Str node);

        R visitBytes(Bytes node);

        R visitNameConstant(NameConstant node);

        R visitJoinedStr(JoinedStr node);

        R visitFormattedValue(FormattedValue node);

        R visitAttribute(Attribute node);

        R visitSubscript(Subscript node);

        R visitStarred(Starred node);

        R visitName(Name node);
    }

    public static final class BoolOp extends Expr {
        private final BoolOperator op;
        private List<Expr> values;

        public BoolOp(BoolOperator op, List<? extends Expr> values) {
            this.op = Objects.requireNonNull(op, "op");
            this.values = copyOf(values, "values");
        }

        @Override
        public Kind kind() {
            return Kind.BOOL_OP;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolOp(this);
        }

        public BoolOperator op() {
            return op;
        }

        public List<Expr> values() {
            return view(values);
        }

        public void setValues(List<? extends Expr> values) {
            this.values = copyOf(values, "values");
        }

        @Override
        public List<Node> children() {
            return nodes(values);
        }
    }

    public static final class BinOp extends Expr {
        private Expr left;
        private final Operator op;
        private Expr right;

        public BinOp(Expr left, Operator op, Expr right) {
            this.left = Objects.requireNonNull(left, "left");
            this.op = Objects.requireNonNull(op, "op");
            this.right = Objects.requireNonNull(right, "right");
        }

        @Override
        public Kind kind() {
            return Kind.BIN_OP;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinOp(this);
        }

        public Expr left() {
            return left;
        }

        public void setLeft(Expr left) {
            this.left = Objects.requireNonNull(left, "left");
        }

        public Operator op() {
            return op;
        }

        public Expr right() {
            return right;
        }

        public void setRight(Expr right) {
            this.right = Objects.requireNonNull(right, "right");
        }

        @Override
        public List<Node> children() {
            return nodes(left, right);
        }
    }

    public static final class UnaryOp extends Expr {
        private final UnaryOperator op;
        private Expr operand;

        public UnaryOp(UnaryOperator op, Expr operand) {
            this.op = Objects.requireNonNull(op, "op");
            this.operand = Objects.requireNonNull(operand, "operand");
        }

        @Override
        public Kind kind() {
            return Kind.UNARY_OP;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }

        public UnaryOperator op() {
            return op;
        }

        public Expr operand() {
            return operand;
        }

        public void setOperand(Expr operand) {
            this.operand = Objects.requireNonNull(operand, "operand");
        }

        @Override
        public List<Node> children() {
            return nodes(operand);
        }
    }

    /** Conditional expression {@code body if test else orElse}. */
    public static final class IfExp extends Expr {
        private Expr test;
        private Expr body;
        private Expr orElse;

        public IfExp(Expr test, Expr body, Expr orElse) {
            this.test = Objects.requireNonNull(test, "test");
            this.body = Objects.requireNonNull(body, "body");
            this.orElse = Objects.requireNonNull(orElse, "orElse");
        }

        @Override
        public Kind kind() {
            return Kind.IF_EXP;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfExp(this);
        }

        public Expr test() {
            return test;
        }

        public void setTest(Expr test) {
            this.test = Objects.requireNonNull(test, "test");
        }

        public Expr body() {
            return body;
        }

        public void setBody(Expr body) {
            this.body = Objects.requireNonNull(body, "body");
        }

        public Expr orElse() {
            return orElse;
        }

        public void setOrElse(Expr orElse) {
            this.orElse = Objects.requireNonNull(orElse, "orElse");
        }

        @Override
        public List<Node> children() {
            return nodes(test, body, orElse);
        }
    }

    public static final class Lambda extends Expr {
        private Arguments args;
        private Expr body;

        public Lambda(Arguments args, Expr body) {
            this.args = Objects.requireNonNull(args, "args");
            this.body = Objects.requireNonNull(body, "body");
        }

        @Override
        public Kind kind() {
            return Kind.LAMBDA;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLambda(this);
        }

        public Arguments args() {
            return args;
        }

        public void setArgs(Arguments args) {
            this.args = Objects.requireNonNull(args, "args");
        }

        public Expr body() {
            return body;
        }

        public void setBody(Expr body) {
            this.body = Objects.requireNonNull(body, "body");
        }

        @Override
        public List<Node> children() {
            return nodes(args, body);
        }
    }

    /**
     * A mapping display. Keys and values are aligned; a null key marks a mapping spread whose
     * value is the spread operand ({@code **value}).
     */
    public static final class DictExpr extends Expr {
        private List<Expr> keys;
        private List<Expr> values;

        public DictExpr(List<? extends Expr> keys, List<? extends Expr> values) {
            setEntries(keys, values);
        }

        @Override
        public Kind kind() {
            return Kind.DICT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDict(this);
        }

        public List<Expr> keys() {
            return view(keys);
        }

        public List<Expr> values() {
            return view(values);
        }

        public void setEntries(List<? extends Expr> keys, List<? extends Expr> values) {
            List<Expr> newKeys = copyAllowingNulls(keys, "keys");
            List<Expr> newValues = copyOf(values, "values");
            if (newKeys.size() != newValues.size()) {
                throw new IllegalArgumentException("keys and values must have the same size");
            }
            this.keys = newKeys;
            this.values = newValues;
        }

        public boolean hasSpread() {
            return keys.contains(null);
        }

        @Override
        public List<Node> children() {
            // keys and values interleaved, in source order
            List<Node> out = new ArrayList<>();
            for (int i = 0; i < values.size(); i++) {
                if (keys.get(i) != null) {
                    out.add(keys.get(i));
                }
                out.add(values.get(i));
            }
            return out;
        }
    }

    public static final class SetExpr extends Expr {
        private List<Expr> elts;

        public SetExpr(List<? extends Expr> elts) {
            this.elts = copyOf(elts, "elts");
        }

        @Override
        public Kind kind() {
            return Kind.SET;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSet(this);
        }

        public List<Expr> elts() {
            return view(elts);
        }

        public void setElts(List<? extends Expr> elts) {
            this.elts = copyOf(elts, "elts");
        }

        @Override
        public List<Node> children() {
            return nodes(elts);
        }
    }

    public static final class ListExpr extends Expr {
        private List<Expr> elts;
        private final ExprContext ctx;

        public ListExpr(List<? extends Expr> elts, ExprContext ctx) {
            this.elts = copyOf(elts, "elts");
            this.ctx = Objects.requireNonNull(ctx, "ctx");
        }

        @Override
        public Kind kind() {
            return Kind.LIST;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitList(this);
        }

        public List<Expr> elts() {
            return view(elts);
        }

        public void setElts(List<? extends Expr> elts) {
            this.elts = copyOf(elts, "elts");
        }

        public ExprContext ctx() {
            return ctx;
        }

        @Override
        public List<Node> children() {
            return nodes(elts);
        }
    }

    public static final class TupleExpr extends Expr {
        private List<Expr> elts;
        private final ExprContext ctx;

        public TupleExpr(List<? extends Expr> elts, ExprContext ctx) {
            this.elts = copyOf(elts, "elts");
            this.ctx = Objects.requireNonNull(ctx, "ctx");
        }

        @Override
        public Kind kind() {
            return Kind.TUPLE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuple(this);
        }

        public List<Expr> elts() {
            return view(elts);
        }

        public void setElts(List<? extends Expr> elts) {
            this.elts = copyOf(elts, "elts");
        }

        public ExprContext ctx() {
            return ctx;
        }

        @Override
        public List<Node> children() {
            return nodes(elts);
        }
    }

    public static final class Compare extends Expr {
        private Expr left;
        private final List<CmpOperator> ops;
        private List<Expr> comparators;

        public Compare(Expr left, List<CmpOperator> ops, List<? extends Expr> comparators) {
            this.left = Objects.requireNonNull(left, "left");
            this.ops = copyOf(ops, "ops");
            this.comparators = copyOf(comparators, "comparators");
            if (this.ops.isEmpty() || this.ops.size() != this.comparators.size()) {
                throw new IllegalArgumentException(
                        "comparison needs one comparator per operator");
            }
        }

        @Override
        public Kind kind() {
            return Kind.COMPARE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCompare(this);
        }

        public Expr left() {
            return left;
        }

        public void setLeft(Expr left) {
            this.left = Objects.requireNonNull(left, "left");
        }

        public List<CmpOperator> ops() {
            return view(ops);
        }

        public List<Expr> comparators() {
            return view(comparators);
        }

        public void setComparators(List<? extends Expr> comparators) {
            List<Expr> copy = copyOf(comparators, "comparators");
            if (copy.size() != ops.size()) {
                throw new IllegalArgumentException(
                        "comparison needs one comparator per operator");
            }
            this.comparators = copy;
        }

        @Override
        public List<Node> children() {
            return nodes(left, comparators);
        }
    }

    /** A call. Positional spreads are {@link Starred} args; keyword spreads have a null name. */
    public static final class Call extends Expr {
        private Expr func;
        private List<Expr> args;
        private List<Keyword> keywords;

        public Call(Expr func, List<? extends Expr> args, List<Keyword> keywords) {
            this.func = Objects.requireNonNull(func, "func");
            this.args = copyOf(args, "args");
            this.keywords = copyOf(keywords, "keywords");
        }

        @Override
        public Kind kind() {
            return Kind.CALL;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        public Expr func() {
            return func;
        }

        public void setFunc(Expr func) {
            this.func = Objects.requireNonNull(func, "func");
        }

        public List<Expr> args() {
            return view(args);
        }

        public void setArgs(List<? extends Expr> args) {
            this.args = copyOf(args, "args");
        }

        public List<Keyword> keywords() {
            return view(keywords);
        }

        public void setKeywords(List<Keyword> keywords) {
            this.keywords = copyOf(keywords, "keywords");
        }

        /** True if {@code func} is the bare name {@code id}. */
        public boolean isCallTo(String id) {
            return func instanceof Name name && name.id().equals(id);
        }

        @Override
        public List<Node> children() {
            return nodes(func, args, keywords);
        }
    }

    public static final class Await extends Expr {
        private Expr value;

        public Await(Expr value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.AWAIT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAwait(this);
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public static final class Yield extends Expr {
        private Expr value;

        public Yield(Expr value) {
            this.value = value;
        }

        @Override
        public Kind kind() {
            return Kind.YIELD;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitYield(this);
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = value;
        }

        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    /** A numeric literal, kept as its source text. */
    public static final class Num extends Expr {
        private final String text;

        public Num(String text) {
            this.text = Objects.requireNonNull(text, "text");
        }

        @Override
        public Kind kind() {
            return Kind.NUM;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNum(this);
        }

        public String text() {
            return text;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    public static final class Str extends Expr {
        private final String s;

        public Str(String s) {
            this.s = Objects.requireNonNull(s, "s");
        }

        @Override
        public Kind kind() {
            return Kind.STR;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStr(this);
        }

        public String s() {
            return s;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    public static final class Bytes extends Expr {
        private final String s;

        public Bytes(String s) {
            this.s = Objects.requireNonNull(s, "s");
        }

        @Override
        public Kind kind() {
            return Kind.BYTES;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBytes(this);
        }

        public String s() {
            return s;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /** {@code None}, {@code True} or {@code False}. */
    public static final class NameConstant extends Expr {
        private final String value;

        public NameConstant(String value) {
            if (!"None".equals(value) && !"True".equals(value) && !"False".equals(value)) {
                throw new IllegalArgumentException("Not a name constant: " + value);
            }
            this.value = value;
        }

        @Override
        public Kind kind() {
            return Kind.NAME_CONSTANT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNameConstant(this);
        }

        public String value() {
            return value;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /** A formatted string literal: {@link Str} parts and {@link FormattedValue} fields. */
    public static final class JoinedStr extends Expr {
        private List<Expr> values;

        public JoinedStr(List<? extends Expr> values) {
            this.values = copyOf(values, "values");
        }

        @Override
        public Kind kind() {
            return Kind.JOINED_STR;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitJoinedStr(this);
        }

        public List<Expr> values() {
            return view(values);
        }

        public void setValues(List<? extends Expr> values) {
            this.values = copyOf(values, "values");
        }

        @Override
        public List<Node> children() {
            return nodes(values);
        }
    }

    /** One replacement field of a {@link JoinedStr}. */
    public static final class FormattedValue extends Expr {
        public static final int NO_CONVERSION = -1;

        private Expr value;
        private final int conversion;
        private final JoinedStr formatSpec;

        /**
         * @param conversion the conversion character ({@code 's'}, {@code 'r'} or {@code 'a'}) or
         *     {@link #NO_CONVERSION}
         */
        public FormattedValue(Expr value, int conversion, JoinedStr formatSpec) {
            this.value = Objects.requireNonNull(value, "value");
            if (conversion != NO_CONVERSION
                    && conversion != 's'
                    && conversion != 'r'
                    && conversion != 'a') {
                throw new IllegalArgumentException("Unknown conversion: " + conversion);
            }
            this.conversion = conversion;
            this.formatSpec = formatSpec;
        }

        @Override
        public Kind kind() {
            return Kind.FORMATTED_VALUE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFormattedValue(this);
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public int conversion() {
            return conversion;
        }

        public boolean hasConversion() {
            return conversion != NO_CONVERSION;
        }

        public JoinedStr formatSpec() {
            return formatSpec;
        }

        @Override
        public List<Node> children() {
            return nodes(value, formatSpec);
        }
    }

    public static final class Attribute extends Expr {
        private Expr value;
        private final String attr;
        private final ExprContext ctx;

        public Attribute(Expr value, String attr, ExprContext ctx) {
            this.value = Objects.requireNonNull(value, "value");
            this.attr = Objects.requireNonNull(attr, "attr");
            this.ctx = Objects.requireNonNull(ctx, "ctx");
        }

        @Override
        public Kind kind() {
            return Kind.ATTRIBUTE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAttribute(this);
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public String attr() {
            return attr;
        }

        public ExprContext ctx() {
            return ctx;
        }

        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public static final class Subscript extends Expr {
        private Expr value;
        private Expr slice;
        private final ExprContext ctx;

        public Subscript(Expr value, Expr slice, ExprContext ctx) {
            this.value = Objects.requireNonNull(value, "value");
            this.slice = Objects.requireNonNull(slice, "slice");
            this.ctx = Objects.requireNonNull(ctx, "ctx");
        }

        @Override
        public Kind kind() {
            return Kind.SUBSCRIPT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubscript(this);
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public Expr slice() {
            return slice;
        }

        public void setSlice(Expr slice) {
            this.slice = Objects.requireNonNull(slice, "slice");
        }

        public ExprContext ctx() {
            return ctx;
        }

        @Override
        public List<Node> children() {
            return nodes(value, slice);
        }
    }

    /** A positional spread ({@code *value}) in a call or display. */
    public static final class Starred extends Expr {
        private Expr value;
        private final ExprContext ctx;

        public Starred(Expr value, ExprContext ctx) {
            this.value = Objects.requireNonNull(value, "value");
            this.ctx = Objects.requireNonNull(ctx, "ctx");
        }

        @Override
        public Kind kind() {
            return Kind.STARRED;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStarred(this);
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public ExprContext ctx() {
            return ctx;
        }

        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public static final class Name extends Expr {
        private final String id;
        private final ExprContext ctx;

        public Name(String id, ExprContext ctx) {
            this.id = Objects.requireNonNull(id, "id");
            this.ctx = Objects.requireNonNull(ctx, "ctx");
        }

        @Override
        public Kind kind() {
            return Kind.NAME;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitName(this);
        }

        public String id() {
            return id;
        }

        public ExprContext ctx() {
            return ctx;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }
}
