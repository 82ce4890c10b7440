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
import net.boyechko.backport.errors.FixerContractViolation;
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
 * Depth-first rewrite walk over a module.
 *
 * <p>Every default {@code visitX} rewrites the node's children first and then returns the node
 * itself, so a subclass overrides only the kinds it cares about: call {@code super.visitX(node)}
 * to rewrite the children, then inspect or replace the result. Statement visits return the list
 * of statements that replaces the visited one (never empty); expression visits return the single
 * replacement expression (never null). Leaf kinds are returned without descent.
 *
 * <p>All child replacement goes through the nodes' typed setters, so a statement-list field can
 * only ever receive statements.
 */
public abstract class TreeTransformer implements Stmt.Visitor<List<Stmt>>, Expr.Visitor<Expr> {

    /** Name reported when a rewrite breaks the contract. */
    protected String transformerName() {
        return getClass().getSimpleName();
    }

    public Module transformModule(Module module) {
        module.setBody(statements(module.body()));
        return module;
    }

    // == Child rewriting helpers =======================================

    /** Rewrites each statement and splices the replacements in order. */
    protected final List<Stmt> statements(List<Stmt> stmts) {
        List<Stmt> out = new ArrayList<>(stmts.size());
        for (Stmt stmt : stmts) {
            List<Stmt> replacement = stmt.accept(this);
            if (replacement == null || replacement.isEmpty()) {
                throw new FixerContractViolation(
                        transformerName(), "rewrote " + stmt + " into no statements");
            }
            out.addAll(replacement);
        }
        return out;
    }

    /** Rewrites an optional expression; null stays null. */
    protected final Expr expr(Expr node) {
        if (node == null) {
            return null;
        }
        Expr replacement = node.accept(this);
        if (replacement == null) {
            throw new FixerContractViolation(transformerName(), "rewrote " + node + " into null");
        }
        return replacement;
    }

    /** Rewrites a list of expressions, keeping null entries (mapping spreads) in place. */
    protected final List<Expr> exprs(List<Expr> nodes) {
        List<Expr> out = new ArrayList<>(nodes.size());
        for (Expr node : nodes) {
            out.add(expr(node));
        }
        return out;
    }

    protected final List<Keyword> keywords(List<Keyword> nodes) {
        List<Keyword> out = new ArrayList<>(nodes.size());
        for (Keyword node : nodes) {
            out.add(visitKeyword(node));
        }
        return out;
    }

    // == Auxiliary nodes ==============================================

    public Arguments visitArguments(Arguments node) {
        List<Arg> args = new ArrayList<>();
        for (Arg arg : node.args()) {
            args.add(visitArg(arg));
        }
        node.setArgs(args);
        node.setDefaults(exprs(node.defaults()));
        if (node.vararg() != null) {
            node.setVararg(visitArg(node.vararg()));
        }
        List<Arg> kwOnly = new ArrayList<>();
        for (Arg arg : node.kwOnlyArgs()) {
            kwOnly.add(visitArg(arg));
        }
        node.setKwOnly(kwOnly, exprs(node.kwDefaults()));
        if (node.kwarg() != null) {
            node.setKwarg(visitArg(node.kwarg()));
        }
        return node;
    }

    public Arg visitArg(Arg node) {
        node.setAnnotation(expr(node.annotation()));
        return node;
    }

    public Keyword visitKeyword(Keyword node) {
        node.setValue(expr(node.value()));
        return node;
    }

    public WithItem visitWithItem(WithItem node) {
        node.setContextExpr(expr(node.contextExpr()));
        node.setOptionalVars(expr(node.optionalVars()));
        return node;
    }

    public ExceptHandler visitExceptHandler(ExceptHandler node) {
        node.setType(expr(node.type()));
        node.setBody(statements(node.body()));
        return node;
    }

    // == Statements ===================================================

    @Override
    public List<Stmt> visitFunctionDef(FunctionDef node) {
        node.setDecorators(exprs(node.decorators()));
        node.setArgs(visitArguments(node.args()));
        node.setReturns(expr(node.returns()));
        node.setBody(statements(node.body()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitClassDef(ClassDef node) {
        node.setDecorators(exprs(node.decorators()));
        node.setBases(exprs(node.bases()));
        node.setKeywords(keywords(node.keywords()));
        node.setBody(statements(node.body()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitReturn(Return node) {
        node.setValue(expr(node.value()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitAssign(Assign node) {
        node.setTargets(exprs(node.targets()));
        node.setValue(expr(node.value()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitAnnAssign(AnnAssign node) {
        node.setTarget(expr(node.target()));
        node.setAnnotation(expr(node.annotation()));
        node.setValue(expr(node.value()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitAugAssign(AugAssign node) {
        node.setTarget(expr(node.target()));
        node.setValue(expr(node.value()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitFor(For node) {
        node.setTarget(expr(node.target()));
        node.setIter(expr(node.iter()));
        node.setBody(statements(node.body()));
        node.setOrElse(statements(node.orElse()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitWhile(While node) {
        node.setTest(expr(node.test()));
        node.setBody(statements(node.body()));
        node.setOrElse(statements(node.orElse()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitIf(If node) {
        node.setTest(expr(node.test()));
        node.setBody(statements(node.body()));
        node.setOrElse(statements(node.orElse()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitWith(With node) {
        List<WithItem> items = new ArrayList<>();
        for (WithItem item : node.items()) {
            items.add(visitWithItem(item));
        }
        node.setItems(items);
        node.setBody(statements(node.body()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitRaise(Raise node) {
        node.setExc(expr(node.exc()));
        node.setCause(expr(node.cause()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitTry(Try node) {
        node.setBody(statements(node.body()));
        List<ExceptHandler> handlers = new ArrayList<>();
        for (ExceptHandler handler : node.handlers()) {
            handlers.add(visitExceptHandler(handler));
        }
        node.setHandlers(handlers);
        node.setOrElse(statements(node.orElse()));
        node.setFinalBody(statements(node.finalBody()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitImport(Import node) {
        return List.of(node);
    }

    @Override
    public List<Stmt> visitImportFrom(ImportFrom node) {
        return List.of(node);
    }

    @Override
    public List<Stmt> visitExprStmt(ExprStmt node) {
        node.setValue(expr(node.value()));
        return List.of(node);
    }

    @Override
    public List<Stmt> visitPass(Pass node) {
        return List.of(node);
    }

    @Override
    public List<Stmt> visitBreak(Break node) {
        return List.of(node);
    }

    @Override
    public List<Stmt> visitContinue(Continue node) {
        return List.of(node);
    }

    // == Expressions ==================================================

    @Override
    public Expr visitBoolOp(BoolOp node) {
        node.setValues(exprs(node.values()));
        return node;
    }

    @Override
    public Expr visitBinOp(BinOp node) {
        node.setLeft(expr(node.left()));
        node.setRight(expr(node.right()));
        return node;
    }

    @Override
    public Expr visitUnaryOp(UnaryOp node) {
        node.setOperand(expr(node.operand()));
        return node;
    }

    @Override
    public Expr visitIfExp(IfExp node) {
        node.setTest(expr(node.test()));
        node.setBody(expr(node.body()));
        node.setOrElse(expr(node.orElse()));
        return node;
    }

    @Override
    public Expr visitLambda(Lambda node) {
        node.setArgs(visitArguments(node.args()));
        node.setBody(expr(node.body()));
        return node;
    }

    @Override
    public Expr visitDict(DictExpr node) {
        node.setEntries(exprs(node.keys()), exprs(node.values()));
        return node;
    }

    @Override
    public Expr visitSet(SetExpr node) {
        node.setElts(exprs(node.elts()));
        return node;
    }

    @Override
    public Expr visitList(ListExpr node) {
        node.setElts(exprs(node.elts()));
        return node;
    }

    @Override
    public Expr visitTuple(TupleExpr node) {
        node.setElts(exprs(node.elts()));
        return node;
    }

    @Override
    public Expr visitCompare(Compare node) {
        node.setLeft(expr(node.left()));
        node.setComparators(exprs(node.comparators()));
        return node;
    }

    @Override
    public Expr visitCall(Call node) {
        node.setFunc(expr(node.func()));
        node.setArgs(exprs(node.args()));
        node.setKeywords(keywords(node.keywords()));
        return node;
    }

    @Override
    public Expr visitAwait(Await node) {
        node.setValue(expr(node.value()));
        return node;
    }

    @Override
    public Expr visitYield(Yield node) {
        node.setValue(expr(node.value()));
        return node;
    }

    @Override
    public Expr visitJoinedStr(JoinedStr node) {
        node.setValues(exprs(node.values()));
        return node;
    }

    @Override
    public Expr visitFormattedValue(FormattedValue node) {
        node.setValue(expr(node.value()));
        JoinedStr spec = node.formatSpec();
        if (spec != null) {
            // descend without offering the spec itself for replacement
            spec.setValues(exprs(spec.values()));
        }
        return node;
    }

    @Override
    public Expr visitAttribute(Attribute node) {
        node.setValue(expr(node.value()));
        return node;
    }

    @Override
    public Expr visitSubscript(Subscript node) {
        node.setValue(expr(node.value()));
        node.setSlice(expr(node.slice()));
        return node;
    }

    @Override
    public Expr visitStarred(Starred node) {
        node.setValue(expr(node.value()));
        return node;
    }

    // Leaf kinds: never descended into.

    @Override
    public Expr visitNum(Num node) {
        return node;
    }

    @Override
    public Expr visitStr(Str node) {
        return node;
    }

    @Override
    public Expr visitBytes(Bytes node) {
        return node;
    }

    @Override
    public Expr visitNameConstant(NameConstant node) {
        return node;
    }

    @Override
    public Expr visitName(Name node) {
        return node;
    }
}
