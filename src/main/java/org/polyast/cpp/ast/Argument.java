package org.polyast.cpp.ast;

import org.polyast.core.token.Token;

import java.util.List;

/**
 * A call argument. Macro calls may also take types or arbitrary token soup.
 */
public sealed interface Argument {

    record Arg(Expr expr) implements Argument {}

    record ArgType(Type type) implements Argument {}

    /**
     * Macro argument that could not be parsed as anything, kept as its raw tokens.
     */
    record ArgAction(List<Token> tokens) implements Argument {}
}
