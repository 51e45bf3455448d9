package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * Top-level declarations. Despite the name they can also appear nested inside namespaces,
 * {@code extern "C"} blocks and templates.
 */
public sealed interface Declaration {

    /** Struct, global and typedef definitions. */
    record BlockDecl(BlockDeclaration declaration) implements Declaration {}

    record Func(FuncOrElse function) implements Declaration {}

    record TemplateDecl(Token templateKeyword, Delimited<List<Parameter>> parameters,
                        Declaration declaration) implements Declaration {}

    /** {@code template<> ...}; the angles enclose nothing. */
    record TemplateSpecialization(Token templateKeyword, Delimited<Void> angles,
                                  Declaration declaration) implements Declaration {}

    record ExternC(Token externKeyword, Token linkage, Declaration declaration) implements Declaration {}

    /** {@code extern "C" { ... }}; the list can be empty. */
    record ExternCList(Token externKeyword, Token linkage,
                       Delimited<List<Sequencable<Declaration>>> declarations) implements Declaration {}

    /** The list can be empty. */
    record NameSpace(Token namespaceKeyword, Wrap<String> name,
                     Delimited<List<Sequencable<Declaration>>> declarations) implements Declaration {}

    /**
     * A namespace reopened elsewhere, introduced by analyses after parsing.
     */
    record NameSpaceExtend(String name, List<Sequencable<Declaration>> declarations) implements Declaration {}

    record NameSpaceAnon(Token namespaceKeyword,
                         Delimited<List<Sequencable<Declaration>>> declarations) implements Declaration {}

    /** A redundant {@code ;} accepted by gcc. */
    record EmptyDef(Token semicolon) implements Declaration {}

    /** A span the parser gave up on, kept as its raw tokens. */
    record NotParsedCorrectly(List<Token> tokens) implements Declaration {}

    /** A declaration construct recognized but not modeled. */
    record DeclTodo(Wrap<String> category) implements Declaration {}
}
