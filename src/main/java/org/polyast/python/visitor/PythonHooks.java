package org.polyast.python.visitor;

import org.polyast.core.token.Token;
import org.polyast.python.ast.Expr;
import org.polyast.python.ast.Parameters;
import org.polyast.python.ast.Stmt;

import java.util.function.Consumer;

/**
 * Per-family interception points of a {@link PythonVisitor} traversal. Same contract as the C++
 * hooks: call {@code k} to recurse, skip it to prune.
 *
 * <p>{@link #onType} and {@link #onDecorator} see expressions in annotation and decorator
 * position before {@link #onExpr} does; their continuation visits the expression.</p>
 */
public interface PythonHooks {

    PythonHooks DEFAULT = new PythonHooks() {};

    default void onExpr(Expr expr, Consumer<Expr> k, PythonVisitor visitor) {
        k.accept(expr);
    }

    default void onStmt(Stmt stmt, Consumer<Stmt> k, PythonVisitor visitor) {
        k.accept(stmt);
    }

    default void onType(Expr type, Consumer<Expr> k, PythonVisitor visitor) {
        k.accept(type);
    }

    default void onDecorator(Expr decorator, Consumer<Expr> k, PythonVisitor visitor) {
        k.accept(decorator);
    }

    default void onParameters(Parameters parameters, Consumer<Parameters> k, PythonVisitor visitor) {
        k.accept(parameters);
    }

    default void onInfo(Token token, Consumer<Token> k, PythonVisitor visitor) {
        k.accept(token);
    }
}
