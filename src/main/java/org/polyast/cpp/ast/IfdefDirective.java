package org.polyast.cpp.ast;

import org.polyast.core.token.Token;

/**
 * A conditional compilation marker. The markers stay flat in the enclosing list; matching
 * {@code #ifdef} with {@code #endif} is left to the tools that need it.
 */
public record IfdefDirective(Kind kind, Token token) {

    public enum Kind {
        IFDEF,
        ELSE,
        ELSEIF,
        ENDIF
    }
}
