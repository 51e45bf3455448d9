package org.polyast.cpp.ast;

import org.polyast.core.token.Token;

import java.util.List;

/**
 * Any fragment of a C/C++ tree that a tool may be handed, such as the target of a pattern
 * or the result of parsing a snippet.
 */
public sealed interface Any {

    record ExprAny(Expr expr) implements Any {}

    record StmtAny(Stmt stmt) implements Any {}

    record StmtsAny(List<Stmt> stmts) implements Any {}

    record ToplevelAny(Sequencable<Declaration> toplevel) implements Any {}

    record ToplevelsAny(List<Sequencable<Declaration>> toplevels) implements Any {}

    record ProgramAny(Program program) implements Any {}

    record CppAny(CppDirective directive) implements Any {}

    record TypeAny(Type type) implements Any {}

    record NameAny(Name name) implements Any {}

    record OneDeclAny(OneDecl declaration) implements Any {}

    record InitAny(Initialiser initialiser) implements Any {}

    record BlockDeclAny(BlockDeclaration declaration) implements Any {}

    record ClassMemberAny(ClassMember member) implements Any {}

    record ConstantAny(Constant constant) implements Any {}

    record ArgumentAny(Argument argument) implements Any {}

    record ParameterAny(Parameter parameter) implements Any {}

    record BodyAny(Compound body) implements Any {}

    record InfoAny(Token token) implements Any {}

    record InfoListAny(List<Token> tokens) implements Any {}

    static Any expr(Expr expr) {
        return new ExprAny(expr);
    }

    static Any stmt(Stmt stmt) {
        return new StmtAny(stmt);
    }

    static Any stmts(List<Stmt> stmts) {
        return new StmtsAny(stmts);
    }

    static Any toplevel(Sequencable<Declaration> toplevel) {
        return new ToplevelAny(toplevel);
    }

    static Any toplevels(List<Sequencable<Declaration>> toplevels) {
        return new ToplevelsAny(toplevels);
    }

    static Any program(Program program) {
        return new ProgramAny(program);
    }

    static Any cpp(CppDirective directive) {
        return new CppAny(directive);
    }

    static Any type(Type type) {
        return new TypeAny(type);
    }

    static Any name(Name name) {
        return new NameAny(name);
    }

    static Any oneDecl(OneDecl declaration) {
        return new OneDeclAny(declaration);
    }

    static Any init(Initialiser initialiser) {
        return new InitAny(initialiser);
    }

    static Any blockDecl(BlockDeclaration declaration) {
        return new BlockDeclAny(declaration);
    }

    static Any classMember(ClassMember member) {
        return new ClassMemberAny(member);
    }

    static Any constant(Constant constant) {
        return new ConstantAny(constant);
    }

    static Any argument(Argument argument) {
        return new ArgumentAny(argument);
    }

    static Any parameter(Parameter parameter) {
        return new ParameterAny(parameter);
    }

    static Any body(Compound body) {
        return new BodyAny(body);
    }

    static Any info(Token token) {
        return new InfoAny(token);
    }

    static Any infoList(List<Token> tokens) {
        return new InfoListAny(tokens);
    }
}
