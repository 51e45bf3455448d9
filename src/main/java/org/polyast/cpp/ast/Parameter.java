package org.polyast.cpp.ast;

import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * A function, catch or template parameter.
 *
 * @param name             The parameter name, or null in prototypes such as {@code f(int)}.
 * @param type             The parameter type.
 * @param registerKeyword  The {@code register} keyword, or null.
 * @param specs            Specifiers in source order.
 * @param defaultEq        The {@code =} of a default value, or null.
 * @param defaultValue     The default value, or null.
 */
public record Parameter(Wrap<String> name, Type type, Token registerKeyword, List<Specifier> specs,
                        Token defaultEq, Expr defaultValue) {
}
