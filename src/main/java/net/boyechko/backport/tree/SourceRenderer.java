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
import java.util.stream.Collectors;
import net.boyechko.backport.pass.EffectSet;
import net.boyechko.backport.pass.ImportDecl;
import net.boyechko.backport.tree.Expr.Attribute;
import net.boyechko.backport.tree.Expr.Await;
import net.boyechko.backport.tree.Expr.BinOp;
import net.boyechko.backport.tree.Expr.BoolOp;
import net.boyechko.backport.tree.Expr.Bytes;
import net.boyechko.backport.tree.Expr.Call;
import net.boyechko.backport.tree.Expr.Compare;
import net.boyechko.backport.tree.Expr.DictExpr;
import net.boyechko.backport.tree.Expr.FormattedValue;
import net.boyechko.backport.tree.Expr.IfExp;
import net.boyechko.backport.tree.Expr.JoinedStr;
import net.boyechko.backport.tree.Expr.Lambda;
import net.boyechko.backport.tree.Expr.ListExpr;
import net.boyechko.backport.tree.Expr.Name;
import net.boyechko.backport.tree.Expr.NameConstant;
import net.boyechko.backport.tree.Expr.Num;
import net.boyechko.backport.tree.Expr.SetExpr;
import net.boyechko.backport.tree.Expr.Starred;
import net.boyechko.backport.tree.Expr.Str;
import net.boyechko.backport.tree.Expr.Subscript;
import net.boyechko.backport.tree.Expr.TupleExpr;
import net.boyechko.backport.tree.Expr.UnaryOp;
import net.boyechko.backport.tree.Expr.Yield;
import net.boyechko.backport.tree.Node.Alias;
import net.boyechko.backport.tree.Node.Arg;
import net.boyechko.backport.tree.Node.Arguments;
import net.boyechko.backport.tree.Node.ExceptHandler;
import net.boyechko.backport.tree.Node.Keyword;
import net.boyechko.backport.tree.Node.Module;
import net.boyechko.backport.tree.Node.WithItem;
import net.boyechko.backport.tree.Stmt.AnnAssign;
import net.boyechko.backport.tree.Stmt.Assign;
import net.boyechko.backport.tree.Stmt.AugAssign;
import net.boyechko.backport.tree.Stmt.Break;
import net.boyechko.backport.tree.Stmt.ClassDef;
import net.boyechko.backport.tree.Stmt.Continue;
import net.boyechko.backport.tree.Stmt.ExprStmt;
import net.boyechko.backport.tree.Stmt.For;
import net.boyechko.backport.tree.Stmt.FunctionDef;
import net.boyechko.backport.tree.Stmt.If;
import net.boyechko.backport.tree.Stmt.Import;
import net.boyechko.backport.tree.Stmt.ImportFrom;
import net.boyechko.backport.tree.Stmt.Pass;
import net.boyechko.backport.tree.Stmt.Raise;
import net.boyechko.backport.tree.Stmt.Return;
import net.boyechko.backport.tree.Stmt.Try;
import net.boyechko.backport.tree.Stmt.While;
import net.boyechko.backport.tree.Stmt.With;

/**
 * Renders a tree back to source text.
 *
 * <p>A module rendered together with its {@link EffectSet} is laid out as: docstring, {@code
 * __future__} imports (those already in the module first), other required imports, module
 * declarations, then the rest of the body. Expressions are parenthesized only where binding
 * strength requires it; tuples and spread operands are always parenthesized.
 */
public final class SourceRenderer {
    private static final String INDENT = "    ";

    private SourceRenderer() {}

    public static String render(Module module) {
        return render(module, new EffectSet());
    }

    public static String render(Module module, EffectSet effects) {
        Printer printer = new Printer();
        List<Stmt> body = module.body();
        int start = 0;
        if (!body.isEmpty() && isDocstring(body.get(0))) {
            printer.stmt(body.get(0));
            start = 1;
        }
        while (start < body.size() && isFutureImport(body.get(start))) {
            printer.stmt(body.get(start));
            start++;
        }
        for (ImportDecl decl : effects.requiredImports()) {
            if (decl.isFuture()) {
                printer.line(decl.toSource());
            }
        }
        for (ImportDecl decl : effects.requiredImports()) {
            if (!decl.isFuture()) {
                printer.line(decl.toSource());
            }
        }
        for (String declaration : effects.moduleDeclarations()) {
            printer.line(declaration);
        }
        for (Stmt stmt : body.subList(start, body.size())) {
            printer.stmt(stmt);
        }
        return printer.out.toString();
    }

    public static String render(Stmt stmt) {
        Printer printer = new Printer();
        printer.stmt(stmt);
        return printer.out.toString();
    }

    public static String render(Expr expr) {
        return new Printer().expr(expr, 0);
    }

    private static boolean isDocstring(Stmt stmt) {
        return stmt instanceof ExprStmt e && e.value() instanceof Str;
    }

    private static boolean isFutureImport(Stmt stmt) {
        return stmt instanceof ImportFrom from && ImportDecl.FUTURE.equals(from.module());
    }

    // == String literals ===============================================

    /** Repr-style quoting: double quotes only when the text has a single quote but no double. */
    static String quote(String s) {
        char q = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        return q + escape(s, q, false) + q;
    }

    static String quoteBytes(String s) {
        char q = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        return "b" + q + escape(s, q, true) + q;
    }

    private static String escape(String s, char quote, boolean asciiOnly) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                sb.append("\\\\");
            } else if (c == quote) {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c < 0x20 || c == 0x7f || (asciiOnly && c > 0x7f)) {
                sb.append(String.format("\\x%02x", (int) c & 0xff));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    // == Printer ======================================================

    private record Piece(String text, int precedence) {}

    private static final class Printer implements Stmt.Visitor<Void>, Expr.Visitor<Piece> {
        private final StringBuilder out = new StringBuilder();
        private int depth;

        void line(String text) {
            out.append(INDENT.repeat(depth)).append(text).append('\n');
        }

        void stmt(Stmt stmt) {
            stmt.accept(this);
        }

        void block(List<Stmt> stmts) {
            depth++;
            for (Stmt stmt : stmts) {
                stmt.accept(this);
            }
            depth--;
        }

        String expr(Expr expr, int minPrecedence) {
            Piece piece = expr.accept(this);
            return piece.precedence() < minPrecedence ? "(" + piece.text() + ")" : piece.text();
        }

        String joined(List<Expr> exprs, int minPrecedence) {
            return exprs.stream()
                    .map(e -> expr(e, minPrecedence))
                    .collect(Collectors.joining(", "));
        }

        String arg(Arg arg) {
            return arg.annotation() == null
                    ? arg.name()
                    : arg.name() + ": " + expr(arg.annotation(), Precedence.LAMBDA);
        }

        String withDefault(Arg arg, Expr value) {
            String sep = arg.annotation() == null ? "=" : " = ";
            return arg(arg) + sep + expr(value, Precedence.LAMBDA);
        }

        String arguments(Arguments args) {
            List<String> parts = new ArrayList<>();
            int firstDefault = args.args().size() - args.defaults().size();
            for (int i = 0; i < args.args().size(); i++) {
                Arg arg = args.args().get(i);
                parts.add(
                        i >= firstDefault
                                ? withDefault(arg, args.defaults().get(i - firstDefault))
                                : arg(arg));
            }
            if (args.vararg() != null) {
                parts.add("*" + arg(args.vararg()));
            } else if (!args.kwOnlyArgs().isEmpty()) {
                parts.add("*");
            }
            for (int i = 0; i < args.kwOnlyArgs().size(); i++) {
                Arg arg = args.kwOnlyArgs().get(i);
                Expr value = args.kwDefaults().get(i);
                parts.add(value != null ? withDefault(arg, value) : arg(arg));
            }
            if (args.kwarg() != null) {
                parts.add("**" + arg(args.kwarg()));
            }
            return String.join(", ", parts);
        }

        String keyword(Keyword keyword) {
            return keyword.isSpread()
                    ? "**" + expr(keyword.value(), Precedence.ATOM)
                    : keyword.arg() + "=" + expr(keyword.value(), Precedence.LAMBDA);
        }

        String callArgs(List<Expr> args, List<Keyword> keywords) {
            List<String> parts = new ArrayList<>();
            for (Expr arg : args) {
                parts.add(expr(arg, Precedence.LAMBDA));
            }
            for (Keyword keyword : keywords) {
                parts.add(keyword(keyword));
            }
            return String.join(", ", parts);
        }

        // -- Statements -------------------------------------------------

        @Override
        public Void visitFunctionDef(FunctionDef node) {
            for (Expr decorator : node.decorators()) {
                line("@" + expr(decorator, 0));
            }
            String returns =
                    node.returns() != null ? " -> " + expr(node.returns(), Precedence.LAMBDA) : "";
            line(
                    (node.isAsync() ? "async def " : "def ")
                            + node.name()
                            + "("
                            + arguments(node.args())
                            + ")"
                            + returns
                            + ":");
            block(node.body());
            return null;
        }

        @Override
        public Void visitClassDef(ClassDef node) {
            for (Expr decorator : node.decorators()) {
                line("@" + expr(decorator, 0));
            }
            String bases = callArgs(node.bases(), node.keywords());
            line("class " + node.name() + (bases.isEmpty() ? "" : "(" + bases + ")") + ":");
            block(node.body());
            return null;
        }

        @Override
        public Void visitReturn(Return node) {
            line(node.value() == null ? "return" : "return " + expr(node.value(), 0));
            return null;
        }

        @Override
        public Void visitAssign(Assign node) {
            StringBuilder sb = new StringBuilder();
            for (Expr target : node.targets()) {
                sb.append(expr(target, 0)).append(" = ");
            }
            line(sb.append(expr(node.value(), 0)).toString());
            return null;
        }

        @Override
        public Void visitAnnAssign(AnnAssign node) {
            String text =
                    expr(node.target(), Precedence.ATOM)
                            + ": "
                            + expr(node.annotation(), Precedence.LAMBDA);
            if (node.value() != null) {
                text += " = " + expr(node.value(), 0);
            }
            line(text);
            return null;
        }

        @Override
        public Void visitAugAssign(AugAssign node) {
            line(
                    expr(node.target(), 0)
                            + " "
                            + node.op().symbol()
                            + "= "
                            + expr(node.value(), 0));
            return null;
        }

        @Override
        public Void visitFor(For node) {
            line(
                    (node.isAsync() ? "async for " : "for ")
                            + expr(node.target(), 0)
                            + " in "
                            + expr(node.iter(), 0)
                            + ":");
            block(node.body());
            elseBlock(node.orElse());
            return null;
        }

        @Override
        public Void visitWhile(While node) {
            line("while " + expr(node.test(), 0) + ":");
            block(node.body());
            elseBlock(node.orElse());
            return null;
        }

        @Override
        public Void visitIf(If node) {
            ifChain(node, "if ");
            return null;
        }

        private void ifChain(If node, String keyword) {
            line(keyword + expr(node.test(), 0) + ":");
            block(node.body());
            List<Stmt> orElse = node.orElse();
            if (orElse.size() == 1 && orElse.get(0) instanceof If elif) {
                ifChain(elif, "elif ");
            } else {
                elseBlock(orElse);
            }
        }

        private void elseBlock(List<Stmt> orElse) {
            if (!orElse.isEmpty()) {
                line("else:");
                block(orElse);
            }
        }

        @Override
        public Void visitWith(With node) {
            List<String> items = new ArrayList<>();
            for (WithItem item : node.items()) {
                String text = expr(item.contextExpr(), Precedence.LAMBDA);
                if (item.optionalVars() != null) {
                    text += " as " + expr(item.optionalVars(), Precedence.LAMBDA);
                }
                items.add(text);
            }
            line((node.isAsync() ? "async with " : "with ") + String.join(", ", items) + ":");
            block(node.body());
            return null;
        }

        @Override
        public Void visitRaise(Raise node) {
            String text = "raise";
            if (node.exc() != null) {
                text += " " + expr(node.exc(), 0);
            }
            if (node.cause() != null) {
                text += " from " + expr(node.cause(), 0);
            }
            line(text);
            return null;
        }

        @Override
        public Void visitTry(Try node) {
            line("try:");
            block(node.body());
            for (ExceptHandler handler : node.handlers()) {
                String text = "except";
                if (handler.type() != null) {
                    text += " " + expr(handler.type(), Precedence.LAMBDA);
                    if (handler.name() != null) {
                        text += " as " + handler.name();
                    }
                }
                line(text + ":");
                block(handler.body());
            }
            elseBlock(node.orElse());
            if (!node.finalBody().isEmpty()) {
                line("finally:");
                block(node.finalBody());
            }
            return null;
        }

        private String aliases(List<Alias> names) {
            return names.stream()
                    .map(a -> a.asName() == null ? a.name() : a.name() + " as " + a.asName())
                    .collect(Collectors.joining(", "));
        }

        @Override
        public Void visitImport(Import node) {
            line("import " + aliases(node.names()));
            return null;
        }

        @Override
        public Void visitImportFrom(ImportFrom node) {
            String module = ".".repeat(node.level()) + (node.module() == null ? "" : node.module());
            line("from " + module + " import " + aliases(node.names()));
            return null;
        }

        @Override
        public Void visitExprStmt(ExprStmt node) {
            line(expr(node.value(), 0));
            return null;
        }

        @Override
        public Void visitPass(Pass node) {
            line("pass");
            return null;
        }

        @Override
        public Void visitBreak(Break node) {
            line("break");
            return null;
        }

        @Override
        public Void visitContinue(Continue node) {
            line("continue");
            return null;
        }

        // -- Expressions ------------------------------------------------

        @Override
        public Piece visitBoolOp(BoolOp node) {
            int p = node.op().precedence();
            String text =
                    node.values().stream()
                            .map(v -> expr(v, p + 1))
                            .collect(Collectors.joining(" " + node.op().keyword() + " "));
            return new Piece(text, p);
        }

        @Override
        public Piece visitBinOp(BinOp node) {
            int p = node.op().precedence();
            boolean rightAssoc = node.op() == Operator.POW;
            String left = expr(node.left(), rightAssoc ? p + 1 : p);
            String right = expr(node.right(), rightAssoc ? p : p + 1);
            return new Piece(left + " " + node.op().symbol() + " " + right, p);
        }

        @Override
        public Piece visitUnaryOp(UnaryOp node) {
            int p = node.op().precedence();
            return new Piece(node.op().prefix() + expr(node.operand(), p), p);
        }

        @Override
        public Piece visitIfExp(IfExp node) {
            String text =
                    expr(node.body(), Precedence.IF_EXP + 1)
                            + " if "
                            + expr(node.test(), Precedence.IF_EXP + 1)
                            + " else "
                            + expr(node.orElse(), Precedence.IF_EXP);
            return new Piece(text, Precedence.IF_EXP);
        }

        @Override
        public Piece visitLambda(Lambda node) {
            String args = arguments(node.args());
            String head = args.isEmpty() ? "lambda" : "lambda " + args;
            return new Piece(
                    head + ": " + expr(node.body(), Precedence.LAMBDA), Precedence.LAMBDA);
        }

        @Override
        public Piece visitDict(DictExpr node) {
            List<String> entries = new ArrayList<>();
            for (int i = 0; i < node.values().size(); i++) {
                Expr key = node.keys().get(i);
                Expr value = node.values().get(i);
                entries.add(
                        key == null
                                ? "**" + expr(value, Precedence.ATOM)
                                : expr(key, Precedence.LAMBDA)
                                        + ": "
                                        + expr(value, Precedence.LAMBDA));
            }
            return new Piece("{" + String.join(", ", entries) + "}", Precedence.ATOM);
        }

        @Override
        public Piece visitSet(SetExpr node) {
            if (node.elts().isEmpty()) {
                return new Piece("set()", Precedence.ATOM);
            }
            return new Piece("{" + joined(node.elts(), Precedence.LAMBDA) + "}", Precedence.ATOM);
        }

        @Override
        public Piece visitList(ListExpr node) {
            return new Piece("[" + joined(node.elts(), Precedence.LAMBDA) + "]", Precedence.ATOM);
        }

        @Override
        public Piece visitTuple(TupleExpr node) {
            String inner = joined(node.elts(), Precedence.LAMBDA);
            if (node.elts().size() == 1) {
                inner += ",";
            }
            return new Piece("(" + inner + ")", Precedence.ATOM);
        }

        @Override
        public Piece visitCompare(Compare node) {
            StringBuilder sb = new StringBuilder(expr(node.left(), Precedence.COMPARE + 1));
            for (int i = 0; i < node.ops().size(); i++) {
                sb.append(' ')
                        .append(node.ops().get(i).symbol())
                        .append(' ')
                        .append(expr(node.comparators().get(i), Precedence.COMPARE + 1));
            }
            return new Piece(sb.toString(), Precedence.COMPARE);
        }

        @Override
        public Piece visitCall(Call node) {
            String text =
                    expr(node.func(), Precedence.ATOM)
                            + "("
                            + callArgs(node.args(), node.keywords())
                            + ")";
            return new Piece(text, Precedence.ATOM);
        }

        @Override
        public Piece visitAwait(Await node) {
            return new Piece("await " + expr(node.value(), Precedence.ATOM), Precedence.AWAIT);
        }

        @Override
        public Piece visitYield(Yield node) {
            String text =
                    node.value() == null
                            ? "yield"
                            : "yield " + expr(node.value(), Precedence.LAMBDA);
            return new Piece(text, Precedence.YIELD);
        }

        @Override
        public Piece visitNum(Num node) {
            String text = node.text();
            return new Piece(text, text.startsWith("-") ? Precedence.UNARY : Precedence.ATOM);
        }

        @Override
        public Piece visitStr(Str node) {
            return new Piece(quote(node.s()), Precedence.ATOM);
        }

        @Override
        public Piece visitBytes(Bytes node) {
            return new Piece(quoteBytes(node.s()), Precedence.ATOM);
        }

        @Override
        public Piece visitNameConstant(NameConstant node) {
            return new Piece(node.value(), Precedence.ATOM);
        }

        @Override
        public Piece visitJoinedStr(JoinedStr node) {
            List<String> fields = new ArrayList<>();
            collectFields(node, fields);
            char q = '\'';
            for (String field : fields) {
                if (field.indexOf('\'') >= 0) {
                    q = '"';
                }
            }
            return new Piece("f" + q + fString(node, q) + q, Precedence.ATOM);
        }

        @Override
        public Piece visitFormattedValue(FormattedValue node) {
            return visitJoinedStr(new JoinedStr(List.of(node)));
        }

        private void collectFields(JoinedStr node, List<String> fields) {
            for (Expr part : node.values()) {
                if (part instanceof FormattedValue fv) {
                    fields.add(expr(fv.value(), Precedence.IF_EXP));
                    if (fv.formatSpec() != null) {
                        collectFields(fv.formatSpec(), fields);
                    }
                }
            }
        }

        private String fString(JoinedStr node, char quote) {
            StringBuilder sb = new StringBuilder();
            for (Expr part : node.values()) {
                if (part instanceof Str str) {
                    sb.append(escape(str.s(), quote, false).replace("{", "{{").replace("}", "}}"));
                } else if (part instanceof FormattedValue fv) {
                    String value = expr(fv.value(), Precedence.IF_EXP);
                    sb.append(value.startsWith("{") ? "{ " : "{").append(value);
                    if (fv.hasConversion()) {
                        sb.append('!').append((char) fv.conversion());
                    }
                    if (fv.formatSpec() != null) {
                        sb.append(':').append(fString(fv.formatSpec(), quote));
                    }
                    sb.append('}');
                } else {
                    sb.append('{').append(expr(part, Precedence.IF_EXP)).append('}');
                }
            }
            return sb.toString();
        }

        @Override
        public Piece visitAttribute(Attribute node) {
            String value = expr(node.value(), Precedence.ATOM);
            if (node.value() instanceof Num num
                    && num.text().chars().allMatch(Character::isDigit)) {
                value = "(" + value + ")";
            }
            return new Piece(value + "." + node.attr(), Precedence.ATOM);
        }

        @Override
        public Piece visitSubscript(Subscript node) {
            return new Piece(
                    expr(node.value(), Precedence.ATOM) + "[" + expr(node.slice(), 0) + "]",
                    Precedence.ATOM);
        }

        @Override
        public Piece visitStarred(Starred node) {
            return new Piece("*" + expr(node.value(), Precedence.ATOM), Precedence.ATOM);
        }

        @Override
        public Piece visitName(Name node) {
            return new Piece(node.id(), Precedence.ATOM);
        }
    }
}
