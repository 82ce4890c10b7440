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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of the mutable syntax tree.
 *
 * <p>Statements and expressions are the closed families {@link Stmt} and {@link Expr}, each with
 * its own visitor interface. The remaining node kinds (the module root and the auxiliary nodes
 * that only ever appear inside a statement or expression) are nested here.
 *
 * <p>Child fields are only replaced through typed setters, which copy the given lists and reject
 * null elements where the field does not allow them. Getters return read-only views.
 */
public abstract class Node {

    /** Node kind tag. */
    public enum Kind {
        MODULE("Module"),

        FUNCTION_DEF("FunctionDef"),
        ASYNC_FUNCTION_DEF("AsyncFunctionDef"),
        CLASS_DEF("ClassDef"),
        RETURN("Return"),
        ASSIGN("Assign"),
        ANN_ASSIGN("AnnAssign"),
        AUG_ASSIGN("AugAssign"),
        FOR("For"),
        ASYNC_FOR("AsyncFor"),
        WHILE("While"),
        IF("If"),
        WITH("With"),
        ASYNC_WITH("AsyncWith"),
        RAISE("Raise"),
        TRY("Try"),
        IMPORT("Import"),
        IMPORT_FROM("ImportFrom"),
        EXPR_STMT("Expr"),
        PASS("Pass"),
        BREAK("Break"),
        CONTINUE("Continue"),

        BOOL_OP("BoolOp"),
        BIN_OP("BinOp"),
        UNARY_OP("UnaryOp"),
        IF_EXP("IfExp"),
        LAMBDA("Lambda"),
        DICT("Dict"),
        SET("Set"),
        LIST("List"),
        TUPLE("Tuple"),
        COMPARE("Compare"),
        CALL("Call"),
        AWAIT("Await"),
        YIELD("Yield"),
        NUM("Num"),
        STR("Str"),
        BYTES("Bytes"),
        NAME_CONSTANT("NameConstant"),
        JOINED_STR("JoinedStr"),
        FORMATTED_VALUE("FormattedValue"),
        ATTRIBUTE("Attribute"),
        SUBSCRIPT("Subscript"),
        STARRED("Starred"),
        NAME("Name"),

        ARGUMENTS("arguments"),
        ARG("arg"),
        KEYWORD("keyword"),
        ALIAS("alias"),
        WITH_ITEM("withitem"),
        EXCEPT_HANDLER("ExceptHandler");

        private final String typeName;

        Kind(String typeName) {
            this.typeName = typeName;
        }

        /** The name used for this kind in the tree interchange format. */
        public String typeName() {
            return typeName;
        }

        public boolean isAsync() {
            return this == ASYNC_FUNCTION_DEF
                    || this == ASYNC_FOR
                    || this == ASYNC_WITH
                    || this == AWAIT;
        }

        public static Kind fromTypeName(String typeName) {
            for (Kind kind : values()) {
                if (kind.typeName.equals(typeName)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown node kind: " + typeName);
        }
    }

    /** 1-based source line, or 0 when the producer did not record one. */
    private int line;

    public abstract Kind kind();

    /** Direct child nodes in source order. Leaf values (operators, contexts) are not nodes. */
    public abstract List<Node> children();

    public int line() {
        return line;
    }

    public void setLine(int line) {
        this.line = line;
    }

    @Override
    public String toString() {
        return line > 0 ? kind().typeName() + "@" + line : kind().typeName();
    }

    // == Field helpers ================================================

    static <T> List<T> copyOf(List<? extends T> items, String field) {
        Objects.requireNonNull(items, field);
        List<T> copy = new ArrayList<>(items.size());
        for (T item : items) {
            copy.add(Objects.requireNonNull(item, () -> field + " must not contain null"));
        }
        return copy;
    }

    static <T> List<T> copyNonEmpty(List<? extends T> items, String field) {
        List<T> copy = copyOf(items, field);
        if (copy.isEmpty()) {
            throw new IllegalArgumentException(field + " must contain at least one statement");
        }
        return copy;
    }

    static <T> List<T> copyAllowingNulls(List<? extends T> items, String field) {
        Objects.requireNonNull(items, field);
        return new ArrayList<>(items);
    }

    static <T> List<T> view(List<T> items) {
        return Collections.unmodifiableList(items);
    }

    static List<Node> nodes(Object... parts) {
        List<Node> out = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                out.add(node);
            } else if (part instanceof List<?> list) {
                for (Object item : list) {
                    if (item instanceof Node node) {
                        out.add(node);
                    }
                }
            }
        }
        return out;
    }

    // == Module root ==================================================

    /** The root of one parsed module. */
    public static final class Module extends Node {
        private final String name;
        private List<Stmt> body;

        public Module(String name, List<? extends Stmt> body) {
            this.name = Objects.requireNonNull(name, "name");
            this.body = copyOf(body, "body");
        }

        @Override
        public Kind kind() {
            return Kind.MODULE;
        }

        /** Module name or path, used in diagnostics. */
        public String name() {
            return name;
        }

        public List<Stmt> body() {
            return view(body);
        }

        public void setBody(List<? extends Stmt> body) {
            this.body = copyOf(body, "body");
        }

        @Override
        public List<Node> children() {
            return nodes(body);
        }
    }

    // == Auxiliary nodes ==============================================

    /** Parameter list of a function or lambda. */
    public static final class Arguments extends Node {
        private List<Arg> args;
        private List<Expr> defaults;
        private Arg vararg;
        private List<Arg> kwOnlyArgs;
        /** One entry per keyword-only parameter; null where it has no default. */
        private List<Expr> kwDefaults;
        private Arg kwarg;

        public Arguments(
                List<Arg> args,
                List<Expr> defaults,
                Arg vararg,
                List<Arg> kwOnlyArgs,
                List<Expr> kwDefaults,
                Arg kwarg) {
            this.args = copyOf(args, "args");
            this.defaults = copyOf(defaults, "defaults");
            this.vararg = vararg;
            setKwOnly(kwOnlyArgs, kwDefaults);
            this.kwarg = kwarg;
        }

        public static Arguments empty() {
            return new Arguments(List.of(), List.of(), null, List.of(), List.of(), null);
        }

        @Override
        public Kind kind() {
            return Kind.ARGUMENTS;
        }

        public List<Arg> args() {
            return view(args);
        }

        public void setArgs(List<Arg> args) {
            this.args = copyOf(args, "args");
        }

        public List<Expr> defaults() {
            return view(defaults);
        }

        public void setDefaults(List<? extends Expr> defaults) {
            this.defaults = copyOf(defaults, "defaults");
        }

        public Arg vararg() {
            return vararg;
        }

        public void setVararg(Arg vararg) {
            this.vararg = vararg;
        }

        public List<Arg> kwOnlyArgs() {
            return view(kwOnlyArgs);
        }

        public List<Expr> kwDefaults() {
            return view(kwDefaults);
        }

        /** Replaces keyword-only parameters and their defaults together, keeping them aligned. */
        public void setKwOnly(List<Arg> kwOnlyArgs, List<? extends Expr> kwDefaults) {
            List<Arg> params = copyOf(kwOnlyArgs, "kwOnlyArgs");
            List<Expr> paramDefaults = copyAllowingNulls(kwDefaults, "kwDefaults");
            if (params.size() != paramDefaults.size()) {
                throw new IllegalArgumentException(
                        "kwDefaults must have one entry per keyword-only parameter");
            }
            this.kwOnlyArgs = params;
            this.kwDefaults = paramDefaults;
        }

        public Arg kwarg() {
            return kwarg;
        }

        public void setKwarg(Arg kwarg) {
            this.kwarg = kwarg;
        }

        public boolean isEmpty() {
            return args.isEmpty() && vararg == null && kwOnlyArgs.isEmpty() && kwarg == null;
        }

        @Override
        public List<Node> children() {
            return nodes(args, defaults, vararg, kwOnlyArgs, kwDefaults, kwarg);
        }
    }

    /** A single parameter. */
    public static final class Arg extends Node {
        private final String name;
        private Expr annotation;

        public Arg(String name, Expr annotation) {
            this.name = Objects.requireNonNull(name, "name");
            this.annotation = annotation;
        }

        @Override
        public Kind kind() {
            return Kind.ARG;
        }

        public String name() {
            return name;
        }

        public Expr annotation() {
            return annotation;
        }

        public void setAnnotation(Expr annotation) {
            this.annotation = annotation;
        }

        @Override
        public List<Node> children() {
            return nodes(annotation);
        }
    }

    /** A call keyword argument. A null {@code arg} marks a keyword spread ({@code **value}). */
    public static final class Keyword extends Node {
        private final String arg;
        private Expr value;

        public Keyword(String arg, Expr value) {
            this.arg = arg;
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.KEYWORD;
        }

        public String arg() {
            return arg;
        }

        public boolean isSpread() {
            return arg == null;
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

    /** An imported name, optionally renamed. */
    public static final class Alias extends Node {
        private final String name;
        private final String asName;

        public Alias(String name, String asName) {
            this.name = Objects.requireNonNull(name, "name");
            this.asName = asName;
        }

        @Override
        public Kind kind() {
            return Kind.ALIAS;
        }

        public String name() {
            return name;
        }

        public String asName() {
            return asName;
        }

        /** The name this import binds in the enclosing scope. */
        public String boundName() {
            return asName != null ? asName : name;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /** One context manager of a {@code with} statement. */
    public static final class WithItem extends Node {
        private Expr contextExpr;
        private Expr optionalVars;

        public WithItem(Expr contextExpr, Expr optionalVars) {
            this.contextExpr = Objects.requireNonNull(contextExpr, "contextExpr");
            this.optionalVars = optionalVars;
        }

        @Override
        public Kind kind() {
            return Kind.WITH_ITEM;
        }

        public Expr contextExpr() {
            return contextExpr;
        }

        public void setContextExpr(Expr contextExpr) {
            this.contextExpr = Objects.requireNonNull(contextExpr, "contextExpr");
        }

        public Expr optionalVars() {
            return optionalVars;
        }

        public void setOptionalVars(Expr optionalVars) {
            this.optionalVars = optionalVars;
        }

        @Override
        public List<Node> children() {
            return nodes(contextExpr, optionalVars);
        }
    }

    /** An {@code except} clause. */
    public static final class ExceptHandler extends Node {
        private Expr type;
        private final String name;
        private List<Stmt> body;

        public ExceptHandler(Expr type, String name, List<? extends Stmt> body) {
            this.type = type;
            this.name = name;
            this.body = copyNonEmpty(body, "body");
        }

        @Override
        public Kind kind() {
            return Kind.EXCEPT_HANDLER;
        }

        public Expr type() {
            return type;
        }

        public void setType(Expr type) {
            this.type = type;
        }

        public String name() {
            return name;
        }

        public List<Stmt> body() {
            return view(body);
        }

        public void setBody(List<? extends Stmt> body) {
            this.body = copyNonEmpty(body, "body");
        }

        @Override
        public List<Node> children() {
            return nodes(type, body);
        }
    }
}
