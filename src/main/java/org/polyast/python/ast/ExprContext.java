package org.polyast.python.ast;

/**
 * How an expression is used at its position: read, assigned, deleted or bound as a parameter.
 */
public enum ExprContext {
    LOAD,
    STORE,
    DEL,
    AUG_LOAD,
    AUG_STORE,
    PARAM
}
