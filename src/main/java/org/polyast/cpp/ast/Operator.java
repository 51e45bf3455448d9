package org.polyast.cpp.ast;

/**
 * Operators that can be overloaded, as named by {@link IdentOrOp.IdOperator}.
 */
public sealed interface Operator {

    record BinaryOperator(BinaryOp op) implements Operator {}

    record AssignOperator(AssignOp op) implements Operator {}

    record FixOperator(FixOp op) implements Operator {}

    record PtrOperator(PtrOp op) implements Operator {}

    record AccessOperator(AccessOp op) implements Operator {}

    record AllocOperator(AllocOp op) implements Operator {}

    record UnaryTildeOperator() implements Operator {}

    record UnaryNotOperator() implements Operator {}

    record CommaOperator() implements Operator {}

    enum PtrOp {
        /** {@code ->*} */
        PTR_STAR,
        /** {@code ->} */
        PTR
    }

    enum AllocOp {
        NEW,
        DELETE,
        NEW_ARRAY,
        DELETE_ARRAY
    }

    enum AccessOp {
        /** {@code ()} */
        PAREN,
        /** {@code []} */
        ARRAY
    }
}
