package org.polyast.python.ast;

public enum BooleanOperator {
    AND,
    OR
}
