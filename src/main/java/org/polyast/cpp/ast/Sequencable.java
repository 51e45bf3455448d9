package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * An element of a list that can also hold preprocessor artifacts: directives, conditional
 * compilation markers and macros used as declarations. A list of sequencables preserves
 * source order exactly, including directives with no effect on the surrounding nodes.
 *
 * @param <T> The kind of node the list holds.
 */
public sealed interface Sequencable<T> {

    record Item<T>(T node) implements Sequencable<T> {}

    record Directive<T>(CppDirective directive) implements Sequencable<T> {}

    record Ifdef<T>(IfdefDirective directive) implements Sequencable<T> {}

    /**
     * A macro call used as a declaration, e.g. {@code EXPORT_SYMBOL(foo);}.
     *
     * @param semicolon The trailing semicolon, or null.
     */
    record MacroTop<T>(Wrap<String> macro, Delimited<List<Argument>> arguments,
                       Token semicolon) implements Sequencable<T> {}

    /** A macro name used as a declaration, e.g. {@code DEFINE_MUTEX;}. */
    record MacroVarTop<T>(Wrap<String> macro, Token semicolon) implements Sequencable<T> {}

    static <T> Sequencable<T> item(T node) {
        return new Item<>(node);
    }
}
