package org.polyast.cpp.ast;

import org.polyast.core.token.Token;

/**
 * An expression followed by a semicolon.
 *
 * @param expr      The expression, or null for the empty statement {@code ;}.
 * @param semicolon The terminating semicolon.
 */
public record ExprStatement(Expr expr, Token semicolon) {
}
