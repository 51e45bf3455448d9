package org.polyast.core.token;

/**
 * A value enclosed in a pair of delimiter tokens: parentheses, braces, brackets or angles.
 *
 * @param open  The opening delimiter.
 * @param value The enclosed value, may be null when the delimiters enclose nothing.
 * @param close The closing delimiter.
 * @param <T>   Type of the enclosed value.
 */
public record Delimited<T>(Token open, T value, Token close) {

    public static <T> Delimited<T> of(Token open, T value, Token close) {
        return new Delimited<>(open, value, close);
    }
}
