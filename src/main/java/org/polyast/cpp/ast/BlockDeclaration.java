package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * Declarations allowed inside blocks as well as at the top level.
 */
public sealed interface BlockDeclaration {

    /** Variables, prototypes, typedefs, struct/enum definitions. */
    record DeclList(VarsDecl vars) implements BlockDeclaration {}

    /** A macro used as a declaration, e.g. {@code DECLARE_BITMAP(bits, 64);}. */
    record MacroDecl(List<Token> storage, Wrap<String> macro, Delimited<List<Argument>> arguments,
                     Token semicolon) implements BlockDeclaration {}

    record UsingDecl(Using using) implements BlockDeclaration {}

    record NameSpaceAlias(Token namespaceKeyword, Wrap<String> alias, Token eq, Type target,
                          Token semicolon) implements BlockDeclaration {}

    /**
     * gcc inline assembly.
     *
     * @param volatileKeyword The {@code volatile} keyword, or null.
     */
    record Asm(Token keyword, Token volatileKeyword, Delimited<AsmBody> body,
               Token semicolon) implements BlockDeclaration {}

    record AsmBody(List<Wrap<String>> template, List<Colon> colons) {}

    record Colon(Token colon, List<ColonOption> options) {}

    sealed interface ColonOption {

        record ColonExpr(List<Token> constraint, Delimited<Expr> expr) implements ColonOption {}

        record ColonMisc(List<Token> tokens) implements ColonOption {}
    }
}
