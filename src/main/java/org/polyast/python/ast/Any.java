package org.polyast.python.ast;

/**
 * Any Python fragment a tool may want to visit or match on.
 */
public sealed interface Any {

    record ExprAny(Expr expr) implements Any {}

    record StmtAny(Stmt stmt) implements Any {}

    record ModAny(Mod mod) implements Any {}

    /** A whole parsed file. */
    record ProgramAny(Mod program) implements Any {}

    static Any expr(Expr expr) {
        return new ExprAny(expr);
    }

    static Any stmt(Stmt stmt) {
        return new StmtAny(stmt);
    }

    static Any mod(Mod mod) {
        return new ModAny(mod);
    }

    static Any program(Mod program) {
        return new ProgramAny(program);
    }
}
