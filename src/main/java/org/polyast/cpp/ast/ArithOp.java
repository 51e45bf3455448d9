package org.polyast.cpp.ast;

public enum ArithOp {
    PLUS,
    MINUS,
    MUL,
    DIV,
    MOD,
    SHIFT_LEFT,
    SHIFT_RIGHT,
    AND,
    OR,
    XOR
}
