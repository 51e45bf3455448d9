package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * The terminal part of a {@link Name}.
 */
public sealed interface IdentOrOp {

    /**
     * Function, macro, variable, class, enum or namespace name.
     */
    record IdIdent(Wrap<String> ident) implements IdentOrOp {}

    /**
     * A template instantiation such as {@code list<int>}.
     */
    record IdTemplateId(Wrap<String> ident, Delimited<List<TypeOrExpr>> arguments) implements IdentOrOp {}

    record IdDestructor(Token tilde, Wrap<String> ident) implements IdentOrOp {}

    /**
     * An overloaded operator name such as {@code operator+=}.
     *
     * @param keyword        The {@code operator} keyword.
     * @param operator       The overloaded operator.
     * @param operatorTokens The tokens spelling the operator, e.g. both brackets of {@code []}.
     */
    record IdOperator(Token keyword, Operator operator, List<Token> operatorTokens) implements IdentOrOp {}

    /**
     * A conversion function name such as {@code operator bool}.
     */
    record IdConverter(Token keyword, Type type) implements IdentOrOp {}
}
