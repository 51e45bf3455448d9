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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Hooks that log every call as {@code family:NodeClass} (or {@code info:text} for tokens) and
 * then recurse.
 */
class RecordingHooks implements CppHooks {

    final List<String> events = new ArrayList<>();

    long count(String family) {
        return events.stream().filter(e -> e.startsWith(family + ":")).count();
    }

    private <T> void record(String family, T node, Consumer<T> k) {
        events.add(family + ":" + node.getClass().getSimpleName());
        k.accept(node);
    }

    @Override
    public void onExpr(Expr expr, Consumer<Expr> k, CppVisitor visitor) {
        record("expr", expr, k);
    }

    @Override
    public void onStmt(Stmt stmt, Consumer<Stmt> k, CppVisitor visitor) {
        record("stmt", stmt, k);
    }

    @Override
    public void onType(Type type, Consumer<Type> k, CppVisitor visitor) {
        record("type", type, k);
    }

    @Override
    public void onName(Name name, Consumer<Name> k, CppVisitor visitor) {
        record("name", name, k);
    }

    @Override
    public void onDeclaration(Declaration declaration, Consumer<Declaration> k, CppVisitor visitor) {
        record("declaration", declaration, k);
    }

    @Override
    public void onBlockDecl(BlockDeclaration declaration, Consumer<BlockDeclaration> k, CppVisitor visitor) {
        record("blockDecl", declaration, k);
    }

    @Override
    public void onOneDecl(OneDecl declaration, Consumer<OneDecl> k, CppVisitor visitor) {
        record("oneDecl", declaration, k);
    }

    @Override
    public void onFuncDef(FuncDefinition function, Consumer<FuncDefinition> k, CppVisitor visitor) {
        record("funcDef", function, k);
    }

    @Override
    public void onClassDef(ClassDefinition definition, Consumer<ClassDefinition> k, CppVisitor visitor) {
        record("classDef", definition, k);
    }

    @Override
    public void onCompound(Compound compound, Consumer<Compound> k, CppVisitor visitor) {
        record("compound", compound, k);
    }

    @Override
    public void onParameter(Parameter parameter, Consumer<Parameter> k, CppVisitor visitor) {
        record("parameter", parameter, k);
    }

    @Override
    public void onClassMember(ClassMember member, Consumer<ClassMember> k, CppVisitor visitor) {
        record("classMember", member, k);
    }

    @Override
    public void onCppDirective(CppDirective directive, Consumer<CppDirective> k, CppVisitor visitor) {
        record("cppDirective", directive, k);
    }

    @Override
    public void onInfo(Token token, Consumer<Token> k, CppVisitor visitor) {
        events.add("info:" + token.text());
        k.accept(token);
    }
}
