package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;

import java.util.List;

/**
 * The type of a function, also used for function definitions. Constructors and
 * destructors get a fake return type.
 *
 * @param returnType     The return type.
 * @param parameters     The parenthesized parameter list.
 * @param variadic       The trailing {@code , ...}, or null.
 * @param constQualifier The {@code const} of a const method, or null.
 * @param exnSpec        The exception specification, or null.
 */
public record FunctionType(Type returnType, Delimited<List<Parameter>> parameters, Variadic variadic,
                           Token constQualifier, ExnSpec exnSpec) {

    public record Variadic(Token comma, Token ellipsis) {}
}
