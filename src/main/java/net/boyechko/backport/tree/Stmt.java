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

import java.util.List;
import java.util.Objects;

/** Statement nodes. */
public abstract class Stmt extends Node {

    public abstract <R> R accept(Visitor<R> visitor);

    /** One method per statement kind; implementations must handle every kind. */
    public interface Visitor<R> {
        R visitFunctionDef(FunctionDef node);

        R visitClassDef(ClassDef node);

        R visitReturn(Return node);

        R visitAssign(Assign node);

        R visitAnnAssign(AnnAssign node);

        R visitAugAssign(AugAssign node);

        R visitFor(For node);

        R visitWhile(While node);

        R visitIf(If node);

        R visitWith(With node);

        R visitRaise(Raise node);

        R visitTry(Try node);

        R visitImport(Import node);

        R visitImportFrom(ImportFrom node);

        R visitExprStmt(ExprStmt node);

        R visitPass(Pass node);

        R visitBreak(Break node);

        R visitContinue(Continue node);
    }

    /** A function definition; {@code async} selects {@link Kind#ASYNC_FUNCTION_DEF}. */
    public static final class FunctionDef extends Stmt {
        private final String name;
        private Arguments args;
        private List<Stmt> body;
        private List<Expr> decorators;
        private Expr returns;
        private final boolean async;

        public FunctionDef(
                String name,
                Arguments args,
                List<? extends Stmt> body,
                List<? extends Expr> decorators,
                Expr returns,
                boolean async) {
            this.name = Objects.requireNonNull(name, "name");
            this.args = Objects.requireNonNull(args, "args");
            this.body = copyNonEmpty(body, "body");
            this.decorators = copyOf(decorators, "decorators");
            this.returns = returns;
            this.async = async;
        }

        @Override
        public Kind kind() {
            return async ? Kind.ASYNC_FUNCTION_DEF : Kind.FUNCTION_DEF;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionDef(this);
        }

        public String name() {
            return name;
        }

        public Arguments args() {
            return args;
        }

        public void setArgs(Arguments args) {
            this.args = Objects.requireNonNull(args, "args");
        }

        public List<Stmt> body() {
            return view(body);
        }

        public void setBody(List<? extends Stmt> body) {
            this.body = copyNonEmpty(body, "body");
        }

        public List<Expr> decorators() {
            return view(decorators);
        }

        public void setDecorators(List<? extends Expr> decorators) {
            this.decorators = copyOf(decorators, "decorators");
        }

        public Expr returns() {
            return returns;
        }

        public void setReturns(Expr returns) {
            this.returns = returns;
        }

        public boolean isAsync() {
            return async;
        }

        @Override
        public List<Node> children() {
            return nodes(decorators, args, returns, body);
        }
    }

    public static final class ClassDef extends Stmt {
        private final String name;
        private List<Expr> bases;
        private List<Keyword> keywords;
        private List<Stmt> body;
        private List<Expr> decorators;

        public ClassDef(
                String name,
                List<? extends Expr> bases,
                List<Keyword> keywords,
                List<? extends Stmt> body,
                List<? extends Expr> decorators) {
            this.name = Objects.requireNonNull(name, "name");
            this.bases = copyOf(bases, "bases");
            this.keywords = copyOf(keywords, "keywords");
            this.body = copyNonEmpty(body, "body");
            this.decorators = copyOf(decorators, "decorators");
        }

        @Override
        public Kind kind() {
            return Kind.CLASS_DEF;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClassDef(this);
        }

        public String name() {
            return name;
        }

        public List<Expr> bases() {
            return view(bases);
        }

        public void setBases(List<? extends Expr> bases) {
            this.bases = copyOf(bases, "bases");
        }

        public List<Keyword> keywords() {
            return view(keywords);
        }

        public void setKeywords(List<Keyword> keywords) {
            this.keywords = copyOf(keywords, "keywords");
        }

        public List<Stmt> body() {
            return view(body);
        }

        public void setBody(List<? extends Stmt> body) {
            this.body = copyNonEmpty(body, "body");
        }

        public List<Expr> decorators() {
            return view(decorators);
        }

        public void setDecorators(List<? extends Expr> decorators) {
            this.decorators = copyOf(decorators, "decorators");
        }

        @Override
        public List<Node> children() {
            return nodes(decorators, bases, keywords, body);
        }
    }

    public static final class Return extends Stmt {
        private Expr value;

        public Return(Expr value) {
            this.value = value;
        }

        @Override
        public Kind kind() {
            return Kind.RETURN;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
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

    public static final class Assign extends Stmt {
        private List<Expr> targets;
        private Expr value;

        public Assign(List<? extends Expr> targets, Expr value) {
            this.targets = copyOf(targets, "targets");
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.ASSIGN;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }

        public List<Expr> targets() {
            return view(targets);
        }

        public void setTargets(List<? extends Expr> targets) {
            this.targets = copyOf(targets, "targets");
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public List<Node> children() {
            return nodes(targets, value);
        }
    }

    /** An annotated assignment; {@code value} is null for a bare declaration. */
    public static final class AnnAssign extends Stmt {
        private Expr target;
        private Expr annotation;
        private Expr value;

        public AnnAssign(Expr target, Expr annotation, Expr value) {
            this.target = Objects.requireNonNull(target, "target");
            this.annotation = Objects.requireNonNull(annotation, "annotation");
            this.value = value;
        }

        @Override
        public Kind kind() {
            return Kind.ANN_ASSIGN;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnnAssign(this);
        }

        public Expr target() {
            return target;
        }

        public void setTarget(Expr target) {
            this.target = Objects.requireNonNull(target, "target");
        }

        public Expr annotation() {
            return annotation;
        }

        public void setAnnotation(Expr annotation) {
            this.annotation = Objects.requireNonNull(annotation, "annotation");
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = value;
        }

        @Override
        public List<Node> children() {
            return nodes(target, annotation, value);
        }
    }

    public static final class AugAssign extends Stmt {
        private Expr target;
        private final Operator op;
        private Expr value;

        public AugAssign(Expr target, Operator op, Expr value) {
            this.target = Objects.requireNonNull(target, "target");
            this.op = Objects.requireNonNull(op, "op");
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.AUG_ASSIGN;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAugAssign(this);
        }

        public Expr target() {
            return target;
        }

        public void setTarget(Expr target) {
            this.target = Objects.requireNonNull(target, "target");
        }

        public Operator op() {
            return op;
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public List<Node> children() {
            return nodes(target, value);
        }
    }

    /** A for loop; {@code async} selects {@link Kind#ASYNC_FOR}. */
    public static final class For extends Stmt {
        private Expr target;
        private Expr iter;
        private List<Stmt> body;
        private List<Stmt> orElse;
        private final boolean async;

        public For(
                Expr target,
                Expr iter,
                List<? extends Stmt> body,
                List<? extends Stmt> orElse,
                boolean async) {
            this.target = Objects.requireNonNull(target, "target");
            this.iter = Objects.requireNonNull(iter, "iter");
            this.body = copyNonEmpty(body, "body");
            this.orElse = copyOf(orElse, "orElse");
            this.async = async;
        }

        @Override
        public Kind kind() {
            return async ? Kind.ASYNC_FOR : Kind.FOR;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFor(this);
        }

        public Expr target() {
            return target;
        }

        public void setTarget(Expr target) {
            this.target = Objects.requireNonNull(target, "target");
        }

        public Expr iter() {
            return iter;
        }

        public void setIter(Expr iter) {
            this.iter = Objects.requireNonNull(iter, "iter");
        }

        public List<Stmt> body() {
            return view(body);
        }

        public void setBody(List<? extends Stmt> body) {
            this.body = copyNonEmpty(body, "body");
        }

        public List<Stmt> orElse() {
            return view(orElse);
        }

        public void setOrElse(List<? extends Stmt> orElse) {
            this.orElse = copyOf(orElse, "orElse");
        }

        public boolean isAsync() {
            return async;
        }

        @Override
        public List<Node> children() {
            return nodes(target, iter, body, orElse);
        }
    }

    public static final class While extends Stmt {
        private Expr test;
        private List<Stmt> body;
        private List<Stmt> orElse;

        public While(Expr test, List<? extends Stmt> body, List<? extends Stmt> orElse) {
            this.test = Objects.requireNonNull(test, "test");
            this.body = copyNonEmpty(body, "body");
            this.orElse = copyOf(orElse, "orElse");
        }

        @Override
        public Kind kind() {
            return Kind.WHILE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }

        public Expr test() {
            return test;
        }

        public void setTest(Expr test) {
            this.test = Objects.requireNonNull(test, "test");
        }

        public List<Stmt> body() {
            return view(body);
        }

        public void setBody(List<? extends Stmt> body) {
            this.body = copyNonEmpty(body, "body");
        }

        public List<Stmt> orElse() {
            return view(orElse);
        }

        public void setOrElse(List<? extends Stmt> orElse) {
            this.orElse = copyOf(orElse, "orElse");
        }

        @Override
        public List<Node> children() {
            return nodes(test, body, orElse);
        }
    }

    public static final class If extends Stmt {
        private Expr test;
        private List<Stmt> body;
        private List<Stmt> orElse;

        public If(Expr test, List<? extends Stmt> body, List<? extends Stmt> orElse) {
            this.test = Objects.requireNonNull(test, "test");
            this.body = copyNonEmpty(body, "body");
            this.orElse = copyOf(orElse, "orElse");
        }

        @Override
        public Kind kind() {
            return Kind.IF;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        public Expr test() {
            return test;
        }

        public void setTest(Expr test) {
            this.test = Objects.requireNonNull(test, "test");
        }

        public List<Stmt> body() {
            return view(body);
        }

        public void setBody(List<? extends Stmt> body) {
            this.body = copyNonEmpty(body, "body");
        }

        public List<Stmt> orElse() {
            return view(orElse);
        }

        public void setOrElse(List<? extends Stmt> orElse) {
            this.orElse = copyOf(orElse, "orElse");
        }

        @Override
        public List<Node> children() {
            return nodes(test, body, orElse);
        }
    }

    /** A with statement; {@code async} selects {@link Kind#ASYNC_WITH}. */
    public static final class With extends Stmt {
        private List<WithItem> items;
        private List<Stmt> body;
        private final boolean async;

        public With(List<WithItem> items, List<? extends Stmt> body, boolean async) {
            this.items = copyOf(items, "items");
            this.body = copyNonEmpty(body, "body");
            this.async = async;
        }

        @Override
        public Kind kind() {
            return async ? Kind.ASYNC_WITH : Kind.WITH;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWith(this);
        }

        public List<WithItem> items() {
            return view(items);
        }

        public void setItems(List<WithItem> items) {
            this.items = copyOf(items, "items");
        }

        public List<Stmt> body() {
            return view(body);
        }

        public void setBody(List<? extends Stmt> body) {
            this.body = copyNonEmpty(body, "body");
        }

        public boolean isAsync() {
            return async;
        }

        @Override
        public List<Node> children() {
            return nodes(items, body);
        }
    }

    public static final class Raise extends Stmt {
        private Expr exc;
        private Expr cause;

        public Raise(Expr exc, Expr cause) {
            this.exc = exc;
            this.cause = cause;
        }

        @Override
        public Kind kind() {
            return Kind.RAISE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRaise(this);
        }

        public Expr exc() {
            return exc;
        }

        public void setExc(Expr exc) {
            this.exc = exc;
        }

        public Expr cause() {
            return cause;
        }

        public void setCause(Expr cause) {
            this.cause = cause;
        }

        @Override
        public List<Node> children() {
            return nodes(exc, cause);
        }
    }

    public static final class Try extends Stmt {
        private List<Stmt> body;
        private List<ExceptHandler> handlers;
        private List<Stmt> orElse;
        private List<Stmt> finalBody;

        public Try(
                List<? extends Stmt> body,
                List<ExceptHandler> handlers,
                List<? extends Stmt> orElse,
                List<? extends Stmt> finalBody) {
            this.body = copyNonEmpty(body, "body");
            this.handlers = copyOf(handlers, "handlers");
            this.orElse = copyOf(orElse, "orElse");
            this.finalBody = copyOf(finalBody, "finalBody");
        }

        @Override
        public Kind kind() {
            return Kind.TRY;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTry(this);
        }

        public List<Stmt> body() {
            return view(body);
        }

        public void setBody(List<? extends Stmt> body) {
            this.body = copyNonEmpty(body, "body");
        }

        public List<ExceptHandler> handlers() {
            return view(handlers);
        }

        public void setHandlers(List<ExceptHandler> handlers) {
            this.handlers = copyOf(handlers, "handlers");
        }

        public List<Stmt> orElse() {
            return view(orElse);
        }

        public void setOrElse(List<? extends Stmt> orElse) {
            this.orElse = copyOf(orElse, "orElse");
        }

        public List<Stmt> finalBody() {
            return view(finalBody);
        }

        public void setFinalBody(List<? extends Stmt> finalBody) {
            this.finalBody = copyOf(finalBody, "finalBody");
        }

        @Override
        public List<Node> children() {
            return nodes(body, handlers, orElse, finalBody);
        }
    }

    public static final class Import extends Stmt {
        private final List<Alias> names;

        public Import(List<Alias> names) {
            this.names = copyOf(names, "names");
        }

        @Override
        public Kind kind() {
            return Kind.IMPORT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImport(this);
        }

        public List<Alias> names() {
            return view(names);
        }

        @Override
        public List<Node> children() {
            return nodes(names);
        }
    }

    /** {@code from module import names}; {@code module} is null for a bare relative import. */
    public static final class ImportFrom extends Stmt {
        private final String module;
        private final List<Alias> names;
        private final int level;

        public ImportFrom(String module, List<Alias> names, int level) {
            this.module = module;
            this.names = copyOf(names, "names");
            this.level = level;
        }

        @Override
        public Kind kind() {
            return Kind.IMPORT_FROM;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImportFrom(this);
        }

        public String module() {
            return module;
        }

        public List<Alias> names() {
            return view(names);
        }

        public int level() {
            return level;
        }

        @Override
        public List<Node> children() {
            return nodes(names);
        }
    }

    /** An expression evaluated for its side effects. */
    public static final class ExprStmt extends Stmt {
        private Expr value;

        public ExprStmt(Expr value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.EXPR_STMT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExprStmt(this);
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

    public static final class Pass extends Stmt {
        @Override
        public Kind kind() {
            return Kind.PASS;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPass(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    public static final class Break extends Stmt {
        @Override
        public Kind kind() {
            return Kind.BREAK;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    public static final class Continue extends Stmt {
        @Override
        public Kind kind() {
            return Kind.CONTINUE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }
}
