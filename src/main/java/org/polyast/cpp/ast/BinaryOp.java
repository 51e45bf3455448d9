package org.polyast.cpp.ast;

public sealed interface BinaryOp {

    record Arith(ArithOp op) implements BinaryOp {}

    record Logical(LogicalOp op) implements BinaryOp {}
}
