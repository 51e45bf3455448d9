package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

/**
 * One step of a designator chain such as {@code [2].y} or {@code .y[2]}.
 */
public sealed interface Designator {

    record DesignatorField(Token dot, Wrap<String> field) implements Designator {}

    record DesignatorIndex(Delimited<Expr> index) implements Designator {}

    /** gcc {@code [1 ... 5]}. */
    record DesignatorRange(Token open, Expr low, Token dots, Expr high, Token close) implements Designator {}
}
