package org.polyast.cpp.ast;

import org.polyast.core.token.Token;

/**
 * What sits between the parentheses of a {@code for}.
 */
public sealed interface ForHeader {

    /**
     * {@code for (init; cond; step)}; {@code cond} and {@code step} may be null.
     */
    record Classic(ForInit init, Expr condition, Expr step) implements ForHeader {}

    /**
     * C++11 {@code for (T x : range)}.
     */
    record Range(Entity entity, Type type, Token colon, Initialiser range) implements ForHeader {}

    /**
     * The first clause of a classic {@code for}: an expression statement or variable declarations.
     */
    sealed interface ForInit {

        record ExprInit(ExprStatement statement) implements ForInit {}

        record VarsInit(VarsDecl declarations) implements ForInit {}
    }
}
