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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.boyechko.backport.config.Yamls;
import net.boyechko.backport.errors.MalformedTreeException;
import net.boyechko.backport.tree.Node.Alias;
import net.boyechko.backport.tree.Node.Arg;
import net.boyechko.backport.tree.Node.Arguments;
import net.boyechko.backport.tree.Node.ExceptHandler;
import net.boyechko.backport.tree.Node.Keyword;
import net.boyechko.backport.tree.Node.Kind;
import net.boyechko.backport.tree.Node.Module;
import net.boyechko.backport.tree.Node.WithItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the YAML tree interchange format written by the external parser.
 *
 * <p>Each node is a mapping with a {@code kind} key naming its type (as in {@link
 * Kind#typeName()}) and one key per field, using the parser's field names: {@code body}, {@code
 * orelse}, {@code decorator_list}, {@code kwonlyargs}, {@code kw_defaults} and so on. Absent list
 * fields are empty, absent optional fields are null, {@code ctx} defaults to {@code Load} and
 * {@code lineno} is optional.
 */
public final class TreeReader {
    private static final Logger logger = LoggerFactory.getLogger(TreeReader.class);

    private TreeReader() {}

    /** Reads a module; the module is named after the file, without its extensions. */
    public static Module read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(moduleName(path), reader);
        }
    }

    static String moduleName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.indexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    public static Module parse(String moduleName, String yaml) {
        return read(moduleName, new StringReader(yaml));
    }

    public static Module read(String moduleName, Reader reader) {
        Object doc;
        try {
            doc = Yamls.newYaml().load(reader);
        } catch (YAMLException e) {
            throw new MalformedTreeException(
                    moduleName + ": not a valid YAML document: " + e.getMessage(), e);
        }
        Fields root = Fields.of(doc, "/");
        if (root.kind != Kind.MODULE) {
            throw new MalformedTreeException(
                    moduleName + ": root node must be a Module, got " + root.kind.typeName());
        }
        Module module = new Module(moduleName, stmts(root, "body"));
        logger.debug(
                "Read module {} with {} top-level statements", moduleName, module.body().size());
        return module;
    }

    // == Field access =================================================

    /** One node mapping plus its path, for error messages. */
    private static final class Fields {
        final Map<?, ?> map;
        final String path;
        final Kind kind;

        private Fields(Map<?, ?> map, String path, Kind kind) {
            this.map = map;
            this.path = path;
            this.kind = kind;
        }

        static Fields of(Object node, String parentPath) {
            if (!(node instanceof Map<?, ?> map)) {
                throw new MalformedTreeException(parentPath + ": expected a node mapping");
            }
            Object kindName = map.get("kind");
            if (!(kindName instanceof String name)) {
                throw new MalformedTreeException(parentPath + ": node has no kind");
            }
            Kind kind;
            try {
                kind = Kind.fromTypeName(name);
            } catch (IllegalArgumentException e) {
                throw new MalformedTreeException(parentPath + ": " + e.getMessage(), e);
            }
            return new Fields(map, parentPath + name, kind);
        }

        Object get(String key) {
            return map.get(key);
        }

        boolean has(String key) {
            return map.get(key) != null;
        }

        String string(String key) {
            Object value = map.get(key);
            if (!(value instanceof String s)) {
                throw new MalformedTreeException(path + "." + key + ": expected a string");
            }
            return s;
        }

        String optString(String key) {
            return has(key) ? string(key) : null;
        }

        int integer(String key, int defaultValue) {
            if (!has(key)) {
                return defaultValue;
            }
            String text = string(key);
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException e) {
                throw new MalformedTreeException(path + "." + key + ": not an integer: " + text);
            }
        }

        boolean bool(String key) {
            return has(key) && Boolean.parseBoolean(string(key));
        }

        List<?> list(String key) {
            Object value = map.get(key);
            if (value == null) {
                return List.of();
            }
            if (!(value instanceof List<?> list)) {
                throw new MalformedTreeException(path + "." + key + ": expected a list");
            }
            return list;
        }

        Fields child(String key) {
            return Fields.of(map.get(key), path + "." + key + "/");
        }

        Fields element(String key, int index, Object item) {
            return Fields.of(item, path + "." + key + "[" + index + "]/");
        }

        ExprContext ctx() {
            if (!has("ctx")) {
                return ExprContext.LOAD;
            }
            Object ctx = get("ctx");
            // the parser may write the context as a bare name or as a {kind: Store} node
            String name =
                    ctx instanceof Map<?, ?> m ? String.valueOf(m.get("kind")) : string("ctx");
            try {
                return ExprContext.fromTypeName(name);
            } catch (IllegalArgumentException e) {
                throw new MalformedTreeException(path + ".ctx: " + e.getMessage(), e);
            }
        }

        MalformedTreeException unsupported(String what) {
            return new MalformedTreeException(path + ": " + what);
        }
    }

    private static <T extends Node> T at(Fields f, T node) {
        node.setLine(f.integer("lineno", 0));
        return node;
    }

    private static List<Stmt> stmts(Fields f, String key) {
        List<Stmt> out = new ArrayList<>();
        List<?> items = f.list(key);
        for (int i = 0; i < items.size(); i++) {
            out.add(stmt(f.element(key, i, items.get(i))));
        }
        return out;
    }

    private static List<Expr> exprs(Fields f, String key) {
        List<Expr> out = new ArrayList<>();
        List<?> items = f.list(key);
        for (int i = 0; i < items.size(); i++) {
            out.add(expr(f.element(key, i, items.get(i))));
        }
        return out;
    }

    /** A list in which null entries are kept (mapping-spread keys, missing kw-only defaults). */
    private static List<Expr> optExprs(Fields f, String key) {
        List<Expr> out = new ArrayList<>();
        List<?> items = f.list(key);
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            out.add(item == null ? null : expr(f.element(key, i, item)));
        }
        return out;
    }

    private static Expr expr(Fields f, String key) {
        return expr(f.child(key));
    }

    private static Expr optExpr(Fields f, String key) {
        return f.has(key) ? expr(f, key) : null;
    }

    private static Arg optArg(Fields f, String key) {
        return f.has(key) ? arg(f.child(key)) : null;
    }

    private static List<Keyword> keywords(Fields f, String key) {
        List<Keyword> out = new ArrayList<>();
        List<?> items = f.list(key);
        for (int i = 0; i < items.size(); i++) {
            Fields k = f.element(key, i, items.get(i));
            requireKind(k, Kind.KEYWORD);
            out.add(at(k, new Keyword(k.optString("arg"), expr(k, "value"))));
        }
        return out;
    }

    private static List<Alias> aliases(Fields f) {
        List<Alias> out = new ArrayList<>();
        List<?> items = f.list("names");
        for (int i = 0; i < items.size(); i++) {
            Fields a = f.element("names", i, items.get(i));
            requireKind(a, Kind.ALIAS);
            out.add(new Alias(a.string("name"), a.optString("asname")));
        }
        return out;
    }

    private static void requireKind(Fields f, Kind expected) {
        if (f.kind != expected) {
            throw f.unsupported("expected " + expected.typeName());
        }
    }

    private static Arg arg(Fields f) {
        requireKind(f, Kind.ARG);
        return at(f, new Arg(f.string("arg"), optExpr(f, "annotation")));
    }

    private static List<Arg> args(Fields f, String key) {
        List<Arg> out = new ArrayList<>();
        List<?> items = f.list(key);
        for (int i = 0; i < items.size(); i++) {
            out.add(arg(f.element(key, i, items.get(i))));
        }
        return out;
    }

    private static Arguments arguments(Fields parent) {
        if (!parent.has("args")) {
            return Arguments.empty();
        }
        Fields f = parent.child("args");
        requireKind(f, Kind.ARGUMENTS);
        try {
            return new Arguments(
                    args(f, "args"),
                    exprs(f, "defaults"),
                    optArg(f, "vararg"),
                    args(f, "kwonlyargs"),
                    optExprs(f, "kw_defaults"),
                    optArg(f, "kwarg"));
        } catch (IllegalArgumentException e) {
            throw new MalformedTreeException(f.path + ": " + e.getMessage(), e);
        }
    }

    // == Nodes ========================================================

    private static Stmt stmt(Fields f) {
        try {
            return at(f, buildStmt(f));
        } catch (IllegalArgumentException e) {
            throw new MalformedTreeException(f.path + ": " + e.getMessage(), e);
        }
    }

    private static Stmt buildStmt(Fields f) {
        return switch (f.kind) {
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF -> new Stmt.FunctionDef(
                    f.string("name"),
                    arguments(f),
                    stmts(f, "body"),
                    exprs(f, "decorator_list"),
                    optExpr(f, "returns"),
                    f.kind == Kind.ASYNC_FUNCTION_DEF);
            case CLASS_DEF -> new Stmt.ClassDef(
                    f.string("name"),
                    exprs(f, "bases"),
                    keywords(f, "keywords"),
                    stmts(f, "body"),
                    exprs(f, "decorator_list"));
            case RETURN -> new Stmt.Return(optExpr(f, "value"));
            case ASSIGN -> new Stmt.Assign(exprs(f, "targets"), expr(f, "value"));
            case ANN_ASSIGN -> new Stmt.AnnAssign(
                    expr(f, "target"), expr(f, "annotation"), optExpr(f, "value"));
            case AUG_ASSIGN -> new Stmt.AugAssign(
                    expr(f, "target"), Operator.fromTypeName(opName(f)), expr(f, "value"));
            case FOR, ASYNC_FOR -> new Stmt.For(
                    expr(f, "target"),
                    expr(f, "iter"),
                    stmts(f, "body"),
                    stmts(f, "orelse"),
                    f.kind == Kind.ASYNC_FOR);
            case WHILE -> new Stmt.While(expr(f, "test"), stmts(f, "body"), stmts(f, "orelse"));
            case IF -> new Stmt.If(expr(f, "test"), stmts(f, "body"), stmts(f, "orelse"));
            case WITH, ASYNC_WITH -> new Stmt.With(
                    withItems(f), stmts(f, "body"), f.kind == Kind.ASYNC_WITH);
            case RAISE -> new Stmt.Raise(optExpr(f, "exc"), optExpr(f, "cause"));
            case TRY -> new Stmt.Try(
                    stmts(f, "body"), handlers(f), stmts(f, "orelse"), stmts(f, "finalbody"));
            case IMPORT -> new Stmt.Import(aliases(f));
            case IMPORT_FROM -> new Stmt.ImportFrom(
                    f.optString("module"), aliases(f), f.integer("level", 0));
            case EXPR_STMT -> new Stmt.ExprStmt(expr(f, "value"));
            case PASS -> new Stmt.Pass();
            case BREAK -> new Stmt.Break();
            case CONTINUE -> new Stmt.Continue();
            default -> throw f.unsupported("not a statement kind");
        };
    }

    private static List<WithItem> withItems(Fields f) {
        List<WithItem> out = new ArrayList<>();
        List<?> items = f.list("items");
        for (int i = 0; i < items.size(); i++) {
            Fields w = f.element("items", i, items.get(i));
            requireKind(w, Kind.WITH_ITEM);
            out.add(new WithItem(expr(w, "context_expr"), optExpr(w, "optional_vars")));
        }
        return out;
    }

    private static List<ExceptHandler> handlers(Fields f) {
        List<ExceptHandler> out = new ArrayList<>();
        List<?> items = f.list("handlers");
        for (int i = 0; i < items.size(); i++) {
            Fields h = f.element("handlers", i, items.get(i));
            requireKind(h, Kind.EXCEPT_HANDLER);
            out.add(
                    at(
                            h,
                            new ExceptHandler(
                                    optExpr(h, "type"), h.optString("name"), stmts(h, "body"))));
        }
        return out;
    }

    /** Operators may be written as a bare name or as a {@code {kind: Add}} mapping. */
    private static String opName(Fields f) {
        Object op = f.get("op");
        if (op instanceof Map<?, ?> m) {
            return String.valueOf(m.get("kind"));
        }
        return f.string("op");
    }

    private static List<String> opNames(Fields f) {
        List<String> out = new ArrayList<>();
        for (Object op : f.list("ops")) {
            out.add(op instanceof Map<?, ?> m ? String.valueOf(m.get("kind")) : String.valueOf(op));
        }
        return out;
    }

    private static Expr expr(Fields f) {
        try {
            return at(f, buildExpr(f));
        } catch (IllegalArgumentException e) {
            throw new MalformedTreeException(f.path + ": " + e.getMessage(), e);
        }
    }

    private static Expr buildExpr(Fields f) {
        return switch (f.kind) {
            case BOOL_OP -> new Expr.BoolOp(
                    BoolOperator.fromTypeName(opName(f)), exprs(f, "values"));
            case BIN_OP -> new Expr.BinOp(
                    expr(f, "left"), Operator.fromTypeName(opName(f)), expr(f, "right"));
            case UNARY_OP -> new Expr.UnaryOp(
                    UnaryOperator.fromTypeName(opName(f)), expr(f, "operand"));
            case IF_EXP -> new Expr.IfExp(expr(f, "test"), expr(f, "body"), expr(f, "orelse"));
            case LAMBDA -> new Expr.Lambda(arguments(f), expr(f, "body"));
            case DICT -> new Expr.DictExpr(optExprs(f, "keys"), exprs(f, "values"));
            case SET -> new Expr.SetExpr(exprs(f, "elts"));
            case LIST -> new Expr.ListExpr(exprs(f, "elts"), f.ctx());
            case TUPLE -> new Expr.TupleExpr(exprs(f, "elts"), f.ctx());
            case COMPARE -> new Expr.Compare(
                    expr(f, "left"),
                    opNames(f).stream().map(CmpOperator::fromTypeName).toList(),
                    exprs(f, "comparators"));
            case CALL -> new Expr.Call(expr(f, "func"), exprs(f, "args"), keywords(f, "keywords"));
            case AWAIT -> new Expr.Await(expr(f, "value"));
            case YIELD -> new Expr.Yield(optExpr(f, "value"));
            case NUM -> new Expr.Num(f.string("n"));
            case STR -> new Expr.Str(f.string("s"));
            case BYTES -> new Expr.Bytes(f.string("s"));
            case NAME_CONSTANT -> new Expr.NameConstant(f.string("value"));
            case JOINED_STR -> new Expr.JoinedStr(exprs(f, "values"));
            case FORMATTED_VALUE -> new Expr.FormattedValue(
                    expr(f, "value"), conversion(f), formatSpec(f));
            case ATTRIBUTE -> new Expr.Attribute(expr(f, "value"), f.string("attr"), f.ctx());
            case SUBSCRIPT -> new Expr.Subscript(expr(f, "value"), slice(f), f.ctx());
            case STARRED -> new Expr.Starred(expr(f, "value"), f.ctx());
            case NAME -> new Expr.Name(f.string("id"), f.ctx());
            default -> throw f.unsupported("not an expression kind");
        };
    }

    /** Unwraps the parser's {@code Index} node around a plain subscript. */
    private static Expr slice(Fields f) {
        Object raw = f.get("slice");
        if (raw instanceof Map<?, ?> m && "Index".equals(m.get("kind"))) {
            return expr(Fields.of(m.get("value"), f.path + ".slice/Index/"));
        }
        return expr(f, "slice");
    }

    /** Conversions come as character codes (-1, 115, 114, 97) or as the letter itself. */
    private static int conversion(Fields f) {
        if (!f.has("conversion")) {
            return Expr.FormattedValue.NO_CONVERSION;
        }
        String text = f.string("conversion");
        if (text.length() == 1 && Character.isLetter(text.charAt(0))) {
            return text.charAt(0);
        }
        return f.integer("conversion", Expr.FormattedValue.NO_CONVERSION);
    }

    private static Expr.JoinedStr formatSpec(Fields f) {
        if (!f.has("format_spec")) {
            return null;
        }
        Expr spec = expr(f, "format_spec");
        if (!(spec instanceof Expr.JoinedStr joined)) {
            throw f.unsupported("format_spec must be a JoinedStr");
        }
        return joined;
    }
}
