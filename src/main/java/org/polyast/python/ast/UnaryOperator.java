package org.polyast.python.ast;

public enum UnaryOperator {
    INVERT,
    NOT,
    UADD,
    USUB
}
