package org.polyast.cpp.ast;

import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

public sealed interface Jump {

    record Goto(Token keyword, Wrap<String> label) implements Jump {}

    record Continue(Token keyword) implements Jump {}

    record Break(Token keyword) implements Jump {}

    /**
     * @param value null for a bare {@code return;}.
     */
    record Return(Token keyword, Expr value) implements Jump {}

    /** gcc {@code goto *e;}. */
    record GotoComputed(Token keyword, Token star, Expr target) implements Jump {}
}
