package org.polyast.cpp.ast;

/**
 * Increment and decrement, used both prefix and postfix.
 */
public enum FixOp {
    DEC,
    INC
}
