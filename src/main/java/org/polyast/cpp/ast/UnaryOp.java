package org.polyast.cpp.ast;

public enum UnaryOp {
    PLUS,
    MINUS,
    TILDE,
    NOT,
    GET_REF,
    DEREF,
    /** gcc {@code &&label}. */
    GET_REF_LABEL
}
