package org.polyast.cpp.ast;

import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

public sealed interface AssignOp {

    record SimpleAssign(Token token) implements AssignOp {}

    /** Compound assignment such as {@code +=}. */
    record OpAssign(Wrap<ArithOp> op) implements AssignOp {}
}
