package org.polyast.cpp.ast;

import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * Literals. {@code -2} is not a constant but {@code MINUS} applied to {@code 2}, so integer
 * literals are never negative.
 */
public sealed interface Constant {

    /**
     * @param value The literal's value; the wrapped value is null when it does not fit a long.
     */
    record IntLit(Wrap<Long> value) implements Constant {}

    /**
     * @param value The literal's value; the wrapped value is null when it cannot be parsed.
     * @param kind  The literal's type as given by its suffix.
     */
    record FloatLit(Wrap<Double> value, BaseType.FloatKind kind) implements Constant {}

    record CharLit(Wrap<String> value, boolean wide) implements Constant {}

    record StringLit(Wrap<String> value, boolean wide) implements Constant {}

    /**
     * Adjacent string literals, which may include macros expanding to strings.
     */
    record MultiString(List<Wrap<String>> parts) implements Constant {}

    record BoolLit(Wrap<Boolean> value) implements Constant {}

    record Nullptr(Token token) implements Constant {}
}
