package org.polyast.python.ast;

public enum BinaryOperator {
    ADD,
    SUB,
    MULT,
    DIV,
    MOD,
    POW,
    FLOOR_DIV,
    LSHIFT,
    RSHIFT,
    BIT_OR,
    BIT_XOR,
    BIT_AND
}
