package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;

import java.util.List;

/**
 * The initializer part of a declarator.
 */
public sealed interface Init {

    record EqInit(Token eq, Initialiser value) implements Init {}

    /** C++ constructor call syntax {@code T x(1, 2)}. */
    record ObjInit(Delimited<List<Argument>> arguments) implements Init {}
}
