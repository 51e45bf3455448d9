package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;

import java.util.List;

/**
 * Exception specification of a function type.
 */
public sealed interface ExnSpec {

    record ThrowSpec(Token keyword, Delimited<List<Type>> types) implements ExnSpec {}

    /**
     * C++11 {@code noexcept}.
     *
     * @param condition The parenthesized condition, or null for a bare {@code noexcept};
     *                  the enclosed value is null for {@code noexcept()}.
     */
    record Noexcept(Token keyword, Delimited<Expr> condition) implements ExnSpec {}
}
