package org.polyast.cpp.ast;

/**
 * The condition of an {@code if}, {@code switch} or {@code while}.
 */
public record ConditionClause(Expr expr) {
}
