package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

public sealed interface Initialiser {

    record InitExpr(Expr expr) implements Initialiser {}

    record InitList(Delimited<List<Initialiser>> elements) implements Initialiser {}

    /** C99 designated initializer {@code [2].y = x}. */
    record InitDesignators(List<Designator> designators, Token eq, Initialiser value) implements Initialiser {}

    /** Old gcc style {@code y: x}. */
    record InitFieldOld(Wrap<String> field, Token colon, Initialiser value) implements Initialiser {}

    /** Old gcc style {@code [2] x}. */
    record InitIndexOld(Delimited<Expr> index, Initialiser value) implements Initialiser {}
}
