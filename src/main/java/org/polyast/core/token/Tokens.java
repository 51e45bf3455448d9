package org.polyast.core.token;

import java.util.List;

/**
 * Static helpers over tokens and their wrappers.
 */
public final class Tokens {

    private Tokens() {
    }

    public static <T> T unwrap(Wrap<T> wrap) {
        return wrap.value();
    }

    public static <T> T unparen(Delimited<T> paren) {
        return paren.value();
    }

    public static <T> T unbrace(Delimited<T> brace) {
        return brace.value();
    }

    /**
     * Derives a token for a node synthesized while expanding a macro. The result keeps the
     * text and any scheduled transformation of {@code token}, points back at its original
     * location and sits at {@link SourceLocation#none()} itself.
     *
     * @param token The token the synthesized node stems from.
     * @return A new expanded token; {@code token} is left untouched.
     */
    public static Token makeExpanded(Token token) {
        Origin expanded = new Origin.Expanded(token.originalLocation(), List.of());
        Token copy = new Token(token.text(), SourceLocation.none(), expanded);
        copy.setTransformation(token.transformation());
        return copy;
    }

    /**
     * Copies {@code token} with a different origin, keeping text, location and any
     * scheduled transformation.
     */
    public static Token rewrap(Origin origin, Token token) {
        Token copy = new Token(token.text(), token.location(), origin);
        copy.setTransformation(token.transformation());
        return copy;
    }
}
