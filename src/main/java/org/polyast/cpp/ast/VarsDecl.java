package org.polyast.cpp.ast;

import org.polyast.core.token.Token;

import java.util.List;

/**
 * A declaration statement such as {@code int x = 1, *y;}.
 */
public record VarsDecl(List<OneDecl> declarations, Token semicolon) {
}
