package org.polyast.cpp.ast;

import org.polyast.core.token.Token;

/**
 * Builtin types.
 */
public sealed interface BaseType {

    record VoidType(Token token) implements BaseType {}

    record IntegerType(IntType kind, Token token) implements BaseType {}

    record FloatingType(FloatKind kind, Token token) implements BaseType {}

    /**
     * Integral types. {@code char} and {@code signed char} are different types.
     */
    sealed interface IntType {

        record PlainChar() implements IntType {}

        record Sized(Sign sign, IntBase base) implements IntType {}

        record Bool() implements IntType {}

        record WCharT() implements IntType {}
    }

    enum Sign {
        SIGNED,
        UNSIGNED
    }

    enum IntBase {
        CHAR,
        SHORT,
        INT,
        LONG,
        LONG_LONG
    }

    enum FloatKind {
        FLOAT,
        DOUBLE,
        LONG_DOUBLE
    }
}
