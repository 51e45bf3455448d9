package org.polyast.cpp.ast;

/**
 * A position that accepts either a type or an expression, such as a template argument
 * ({@code array<int, 3>}) or the operand of {@code typeid}.
 */
public sealed interface TypeOrExpr {

    record OfType(Type type) implements TypeOrExpr {}

    record OfExpr(Expr expr) implements TypeOrExpr {}
}
