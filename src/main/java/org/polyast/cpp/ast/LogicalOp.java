package org.polyast.cpp.ast;

public enum LogicalOp {
    INF,
    SUP,
    INF_EQ,
    SUP_EQ,
    EQ,
    NOT_EQ,
    AND_LOG,
    OR_LOG
}
