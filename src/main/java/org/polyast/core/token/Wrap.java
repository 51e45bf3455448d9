package org.polyast.core.token;

import java.util.Objects;

/**
 * A semantic leaf together with the token it was read from.
 *
 * @param value The leaf value (a name, a keyword kind, an operator, a literal).
 * @param token The token the value was read from.
 * @param <T>   Type of the wrapped value.
 */
public record Wrap<T>(T value, Token token) {

    public Wrap {
        Objects.requireNonNull(token, "token");
    }

    public static <T> Wrap<T> of(T value, Token token) {
        return new Wrap<>(value, token);
    }
}
