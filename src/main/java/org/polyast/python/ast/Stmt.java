package org.polyast.python.ast;

import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * Python statements, including the Python 2 only {@code print} and {@code exec}.
 */
public sealed interface Stmt {

    /**
     * @param returns The return annotation, or null.
     */
    record FunctionDef(Wrap<String> name, Parameters parameters, Expr returns, List<Stmt> body,
                       List<Expr> decorators) implements Stmt {}

    record ClassDef(Wrap<String> name, List<Expr> bases, List<Stmt> body, List<Expr> decorators)
        implements Stmt {}

    /** {@code t1 = t2 = value}. */
    record Assign(List<Expr> targets, Expr value) implements Stmt {}

    record AugAssign(Expr target, BinaryOperator op, Expr value) implements Stmt {}

    record Return(Expr value) implements Stmt {}

    record Delete(List<Expr> targets) implements Stmt {}

    /**
     * @param destination The {@code >>file} target, or null.
     * @param newline     false when the statement ends with a comma.
     */
    record Print(Expr destination, List<Expr> values, boolean newline) implements Stmt {}

    record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orElse) implements Stmt {}

    record While(Expr test, List<Stmt> body, List<Stmt> orElse) implements Stmt {}

    record If(Expr test, List<Stmt> body, List<Stmt> orElse) implements Stmt {}

    record With(Expr context, Expr target, List<Stmt> body) implements Stmt {}

    /** Python 2 {@code raise type, inst, tback}; every part may be null. */
    record Raise(Expr type, Expr inst, Expr traceback) implements Stmt {}

    record TryExcept(List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orElse) implements Stmt {}

    record TryFinally(List<Stmt> body, List<Stmt> finalBody) implements Stmt {}

    record Assert(Expr test, Expr message) implements Stmt {}

    record Import(List<Alias> names) implements Stmt {}

    /**
     * @param level The number of leading dots of a relative import, or null.
     */
    record ImportFrom(Wrap<String> module, List<Alias> names, Integer level) implements Stmt {}

    record Exec(Expr body, Expr globals, Expr locals) implements Stmt {}

    record Global(List<Wrap<String>> names) implements Stmt {}

    record ExprStmt(Expr value) implements Stmt {}

    record Pass() implements Stmt {}

    record Break() implements Stmt {}

    record Continue() implements Stmt {}
}
