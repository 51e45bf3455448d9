package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;

import java.util.List;

/**
 * A {@code catch} clause of a {@code try} block.
 */
public record Handler(Token catchKeyword, Delimited<List<ExceptionDeclaration>> declarations, Compound body) {

    public sealed interface ExceptionDeclaration {

        record ExnDecl(Parameter parameter) implements ExceptionDeclaration {}

        /** {@code catch (...)} */
        record ExnDeclEllipsis(Token ellipsis) implements ExceptionDeclaration {}
    }
}
