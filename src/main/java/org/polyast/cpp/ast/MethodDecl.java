package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * A member function declared, but not defined, inside a class body.
 */
public sealed interface MethodDecl {

    /**
     * @param pureEq   The {@code =} of a pure virtual {@code = 0}, or null.
     * @param pureZero The {@code 0} of a pure virtual {@code = 0}, or null.
     */
    record Method(OneDecl declaration, Token pureEq, Token pureZero, Token semicolon) implements MethodDecl {}

    record ConstructorDecl(Wrap<String> name, Delimited<List<Parameter>> parameters,
                           Token semicolon) implements MethodDecl {}

    /**
     * @param voidParameter The parentheses, enclosing an optional {@code void} token.
     * @param exnSpec       The exception specification, or null.
     */
    record DestructorDecl(Token tilde, Wrap<String> name, Delimited<Token> voidParameter, ExnSpec exnSpec,
                          Token semicolon) implements MethodDecl {}
}
