package org.polyast.cpp.visitor;

import org.polyast.core.token.Token;
import org.polyast.cpp.ast.BlockDeclaration;
import org.polyast.cpp.ast.ClassDefinition;
import org.polyast.cpp.ast.ClassMember;
import org.polyast.cpp.ast.Compound;
import org.polyast.cpp.ast.CppDirective;
import org.polyast.cpp.ast.Declaration;
import org.polyast.cpp.ast.Expr;
import org.polyast.cpp.ast.FuncDefinition;
import org.polyast.cpp.ast.Name;
import org.polyast.cpp.ast.OneDecl;
import org.polyast.cpp.ast.Parameter;
import org.polyast.cpp.ast.Stmt;
import org.polyast.cpp.ast.Type;

import java.util.function.Consumer;

/**
 * Per-family interception points of a {@link CppVisitor} traversal.
 *
 * <p>Each method receives the node, a continuation {@code k} that performs the default
 * structural recursion into that node's children, and the visitor itself so that a hook can
 * visit other fragments. Every default simply calls {@code k.accept(node)}; override only the
 * families a tool cares about.</p>
 *
 * <p>A hook decides what happens to the subtree: not calling {@code k} prunes it, calling it
 * once visits it, and calling it again visits it again, including every nested hook.</p>
 */
public interface CppHooks {

    /** Hooks that only recurse. */
    CppHooks DEFAULT = new CppHooks() {};

    default void onExpr(Expr expr, Consumer<Expr> k, CppVisitor visitor) {
        k.accept(expr);
    }

    default void onStmt(Stmt stmt, Consumer<Stmt> k, CppVisitor visitor) {
        k.accept(stmt);
    }

    default void onType(Type type, Consumer<Type> k, CppVisitor visitor) {
        k.accept(type);
    }

    default void onName(Name name, Consumer<Name> k, CppVisitor visitor) {
        k.accept(name);
    }

    default void onDeclaration(Declaration declaration, Consumer<Declaration> k, CppVisitor visitor) {
        k.accept(declaration);
    }

    default void onBlockDecl(BlockDeclaration declaration, Consumer<BlockDeclaration> k, CppVisitor visitor) {
        k.accept(declaration);
    }

    default void onOneDecl(OneDecl declaration, Consumer<OneDecl> k, CppVisitor visitor) {
        k.accept(declaration);
    }

    default void onFuncDef(FuncDefinition function, Consumer<FuncDefinition> k, CppVisitor visitor) {
        k.accept(function);
    }

    default void onClassDef(ClassDefinition definition, Consumer<ClassDefinition> k, CppVisitor visitor) {
        k.accept(definition);
    }

    default void onCompound(Compound compound, Consumer<Compound> k, CppVisitor visitor) {
        k.accept(compound);
    }

    default void onParameter(Parameter parameter, Consumer<Parameter> k, CppVisitor visitor) {
        k.accept(parameter);
    }

    default void onClassMember(ClassMember member, Consumer<ClassMember> k, CppVisitor visitor) {
        k.accept(member);
    }

    default void onCppDirective(CppDirective directive, Consumer<CppDirective> k, CppVisitor visitor) {
        k.accept(directive);
    }

    /**
     * Called for every leaf token, unless token visits are disabled in the
     * {@link org.polyast.core.config.VisitorSettings}. The continuation does nothing.
     */
    default void onInfo(Token token, Consumer<Token> k, CppVisitor visitor) {
        k.accept(token);
    }
}
