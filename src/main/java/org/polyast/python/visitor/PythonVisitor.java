package org.polyast.python.visitor;

import org.polyast.core.config.VisitorSettings;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;
import org.polyast.python.ast.Alias;
import org.polyast.python.ast.Any;
import org.polyast.python.ast.Comprehension;
import org.polyast.python.ast.ExceptHandler;
import org.polyast.python.ast.Expr;
import org.polyast.python.ast.Keyword;
import org.polyast.python.ast.Mod;
import org.polyast.python.ast.Number;
import org.polyast.python.ast.Parameters;
import org.polyast.python.ast.Slice;
import org.polyast.python.ast.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Traverses Python trees, handing expressions, statements, annotations, decorators, parameter
 * lists and tokens to the matching {@link PythonHooks} method.
 *
 * <p>Children are visited left to right in field order. Operators and expression contexts carry
 * no tokens and are not visited.</p>
 */
public final class PythonVisitor {

    private static final Logger log = LoggerFactory.getLogger(PythonVisitor.class);

    private final PythonHooks hooks;
    private final VisitorSettings settings;

    private final Consumer<Expr> exprK = this::exprChildren;
    private final Consumer<Stmt> stmtK = this::stmtChildren;
    private final Consumer<Expr> typeK = this::visitExpr;
    private final Consumer<Expr> decoratorK = this::visitExpr;
    private final Consumer<Parameters> parametersK = this::parametersChildren;
    private final Consumer<Token> infoK = token -> { };

    private PythonVisitor(PythonHooks hooks, VisitorSettings settings) {
        this.hooks = hooks;
        this.settings = settings;
        log.debug("Created Python visitor for hooks {} with {}", hooks.getClass().getName(), settings);
    }

    /**
     * Creates a visitor with the settings of the application's configuration.
     */
    public static PythonVisitor of(PythonHooks hooks) {
        return new PythonVisitor(hooks, VisitorSettings.load());
    }

    /**
     * Creates a visitor with explicit settings.
     */
    public static PythonVisitor of(PythonHooks hooks, VisitorSettings settings) {
        return new PythonVisitor(hooks, settings);
    }

    /**
     * Visits an expression through {@link PythonHooks#onExpr}.
     */
    public void visitExpr(Expr expr) {
        hooks.onExpr(expr, exprK, this);
    }

    /**
     * Visits a statement through {@link PythonHooks#onStmt}.
     */
    public void visitStmt(Stmt stmt) {
        hooks.onStmt(stmt, stmtK, this);
    }

    /**
     * Visits a type annotation through {@link PythonHooks#onType}, then as an expression.
     */
    public void visitType(Expr type) {
        hooks.onType(type, typeK, this);
    }

    /**
     * Visits a decorator through {@link PythonHooks#onDecorator}, then as an expression.
     */
    public void visitDecorator(Expr decorator) {
        hooks.onDecorator(decorator, decoratorK, this);
    }

    /**
     * Visits a parameter list through {@link PythonHooks#onParameters}.
     */
    public void visitParameters(Parameters parameters) {
        hooks.onParameters(parameters, parametersK, this);
    }

    /**
     * Hands a token to {@link PythonHooks#onInfo}, whatever the token setting says.
     */
    public void visitInfo(Token token) {
        hooks.onInfo(token, infoK, this);
    }

    /**
     * Visits the statements or the single expression of a module.
     */
    public void visitMod(Mod mod) {
        if (mod instanceof Mod.Module module) {
            stmts(module.body());
        } else if (mod instanceof Mod.Interactive interactive) {
            stmts(interactive.body());
        } else if (mod instanceof Mod.Expression expression) {
            visitExpr(expression.body());
        } else if (mod instanceof Mod.Suite suite) {
            stmts(suite.body());
        }
    }

    /**
     * Visits a whole parsed file.
     */
    public void visitProgram(Mod program) {
        visitMod(program);
    }

    /**
     * Visits whichever fragment {@code any} carries.
     */
    public void visitAny(Any any) {
        if (any instanceof Any.ExprAny a) {
            visitExpr(a.expr());
        } else if (any instanceof Any.StmtAny a) {
            visitStmt(a.stmt());
        } else if (any instanceof Any.ModAny a) {
            visitMod(a.mod());
        } else if (any instanceof Any.ProgramAny a) {
            visitProgram(a.program());
        }
    }

    private void exprChildren(Expr expr) {
        if (expr instanceof Expr.Num num) {
            number(num.number());
        } else if (expr instanceof Expr.Str str) {
            str.tokens().forEach(this::token);
        } else if (expr instanceof Expr.Name name) {
            wrap(name.id());
            if (name.type() != null) {
                visitType(name.type());
            }
        } else if (expr instanceof Expr.Tuple tuple) {
            exprs(tuple.elements());
        } else if (expr instanceof Expr.ListExpr list) {
            exprs(list.elements());
        } else if (expr instanceof Expr.Dict dict) {
            exprs(dict.keys());
            exprs(dict.values());
        } else if (expr instanceof Expr.ListComp comp) {
            visitExpr(comp.element());
            comp.generators().forEach(this::comprehension);
        } else if (expr instanceof Expr.BoolOp boolOp) {
            exprs(boolOp.values());
        } else if (expr instanceof Expr.BinOp binOp) {
            visitExpr(binOp.left());
            visitExpr(binOp.right());
        } else if (expr instanceof Expr.UnaryOp unaryOp) {
            visitExpr(unaryOp.operand());
        } else if (expr instanceof Expr.Compare compare) {
            visitExpr(compare.left());
            exprs(compare.comparators());
        } else if (expr instanceof Expr.Call call) {
            visitExpr(call.function());
            exprs(call.args());
            call.keywords().forEach(this::keyword);
            optExpr(call.starargs());
            optExpr(call.kwargs());
        } else if (expr instanceof Expr.Subscript subscript) {
            visitExpr(subscript.value());
            slice(subscript.slice());
        } else if (expr instanceof Expr.Lambda lambda) {
            visitParameters(lambda.parameters());
            visitExpr(lambda.body());
        } else if (expr instanceof Expr.IfExp ifExp) {
            visitExpr(ifExp.test());
            visitExpr(ifExp.body());
            visitExpr(ifExp.orElse());
        } else if (expr instanceof Expr.GeneratorExp generator) {
            visitExpr(generator.element());
            generator.generators().forEach(this::comprehension);
        } else if (expr instanceof Expr.Yield yieldExpr) {
            optExpr(yieldExpr.value());
        } else if (expr instanceof Expr.Repr repr) {
            visitExpr(repr.value());
        } else if (expr instanceof Expr.Attribute attribute) {
            visitExpr(attribute.value());
            wrap(attribute.attr());
        }
    }

    private void number(Number number) {
        if (number instanceof Number.Int value) {
            wrap(value.value());
        } else if (number instanceof Number.LongInt value) {
            wrap(value.value());
        } else if (number instanceof Number.Float value) {
            wrap(value.value());
        } else if (number instanceof Number.Imag value) {
            wrap(value.value());
        }
    }

    private void comprehension(Comprehension comprehension) {
        visitExpr(comprehension.target());
        visitExpr(comprehension.iter());
        exprs(comprehension.ifs());
    }

    private void keyword(Keyword keyword) {
        wrap(keyword.name());
        visitExpr(keyword.value());
    }

    private void slice(Slice slice) {
        if (slice instanceof Slice.SliceRange range) {
            optExpr(range.lower());
            optExpr(range.upper());
            optExpr(range.step());
        } else if (slice instanceof Slice.ExtSlice ext) {
            ext.dims().forEach(this::slice);
        } else if (slice instanceof Slice.Index index) {
            visitExpr(index.value());
        }
    }

    private void parametersChildren(Parameters parameters) {
        exprs(parameters.args());
        wrap(parameters.vararg());
        wrap(parameters.kwarg());
        exprs(parameters.defaults());
    }

    private void stmtChildren(Stmt stmt) {
        if (stmt instanceof Stmt.FunctionDef def) {
            wrap(def.name());
            visitParameters(def.parameters());
            if (def.returns() != null) {
                visitType(def.returns());
            }
            stmts(def.body());
            def.decorators().forEach(this::visitDecorator);
        } else if (stmt instanceof Stmt.ClassDef def) {
            wrap(def.name());
            exprs(def.bases());
            stmts(def.body());
            def.decorators().forEach(this::visitDecorator);
        } else if (stmt instanceof Stmt.Assign assign) {
            exprs(assign.targets());
            visitExpr(assign.value());
        } else if (stmt instanceof Stmt.AugAssign assign) {
            visitExpr(assign.target());
            visitExpr(assign.value());
        } else if (stmt instanceof Stmt.Return ret) {
            optExpr(ret.value());
        } else if (stmt instanceof Stmt.Delete delete) {
            exprs(delete.targets());
        } else if (stmt instanceof Stmt.Print print) {
            optExpr(print.destination());
            exprs(print.values());
        } else if (stmt instanceof Stmt.For forStmt) {
            visitExpr(forStmt.target());
            visitExpr(forStmt.iter());
            stmts(forStmt.body());
            stmts(forStmt.orElse());
        } else if (stmt instanceof Stmt.While whileStmt) {
            visitExpr(whileStmt.test());
            stmts(whileStmt.body());
            stmts(whileStmt.orElse());
        } else if (stmt instanceof Stmt.If ifStmt) {
            visitExpr(ifStmt.test());
            stmts(ifStmt.body());
            stmts(ifStmt.orElse());
        } else if (stmt instanceof Stmt.With with) {
            visitExpr(with.context());
            optExpr(with.target());
            stmts(with.body());
        } else if (stmt instanceof Stmt.Raise raise) {
            optExpr(raise.type());
            optExpr(raise.inst());
            optExpr(raise.traceback());
        } else if (stmt instanceof Stmt.TryExcept tryExcept) {
            stmts(tryExcept.body());
            tryExcept.handlers().forEach(this::exceptHandler);
            stmts(tryExcept.orElse());
        } else if (stmt instanceof Stmt.TryFinally tryFinally) {
            stmts(tryFinally.body());
            stmts(tryFinally.finalBody());
        } else if (stmt instanceof Stmt.Assert assertStmt) {
            visitExpr(assertStmt.test());
            optExpr(assertStmt.message());
        } else if (stmt instanceof Stmt.Import importStmt) {
            importStmt.names().forEach(this::alias);
        } else if (stmt instanceof Stmt.ImportFrom importFrom) {
            wrap(importFrom.module());
            importFrom.names().forEach(this::alias);
        } else if (stmt instanceof Stmt.Exec exec) {
            visitExpr(exec.body());
            optExpr(exec.globals());
            optExpr(exec.locals());
        } else if (stmt instanceof Stmt.Global global) {
            global.names().forEach(this::wrap);
        } else if (stmt instanceof Stmt.ExprStmt exprStmt) {
            visitExpr(exprStmt.value());
        }
    }

    private void exceptHandler(ExceptHandler handler) {
        if (handler.type() != null) {
            visitType(handler.type());
        }
        optExpr(handler.name());
        stmts(handler.body());
    }

    private void alias(Alias alias) {
        wrap(alias.name());
        wrap(alias.asName());
    }

    private void exprs(List<Expr> exprs) {
        exprs.forEach(this::visitExpr);
    }

    private void stmts(List<Stmt> stmts) {
        stmts.forEach(this::visitStmt);
    }

    private void optExpr(Expr expr) {
        if (expr != null) {
            visitExpr(expr);
        }
    }

    private void token(Token token) {
        if (token != null && settings.visitTokens()) {
            visitInfo(token);
        }
    }

    private void wrap(Wrap<?> wrap) {
        if (wrap != null) {
            token(wrap.token());
        }
    }
}
