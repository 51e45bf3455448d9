package org.polyast.cpp.visitor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.polyast.core.config.VisitorSettings;
import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;
import org.polyast.cpp.ast.Argument;
import org.polyast.cpp.ast.ArithOp;
import org.polyast.cpp.ast.AssignOp;
import org.polyast.cpp.ast.BaseType;
import org.polyast.cpp.ast.BlockDeclaration;
import org.polyast.cpp.ast.CastOperator;
import org.polyast.cpp.ast.ClassMember;
import org.polyast.cpp.ast.Compound;
import org.polyast.cpp.ast.CppAst;
import org.polyast.cpp.ast.CppDirective;
import org.polyast.cpp.ast.Declaration;
import org.polyast.cpp.ast.Entity;
import org.polyast.cpp.ast.ExnSpec;
import org.polyast.cpp.ast.Expr;
import org.polyast.cpp.ast.ForHeader;
import org.polyast.cpp.ast.FunctionType;
import org.polyast.cpp.ast.Handler;
import org.polyast.cpp.ast.IdentOrOp;
import org.polyast.cpp.ast.Initialiser;
import org.polyast.cpp.ast.MethodDecl;
import org.polyast.cpp.ast.Name;
import org.polyast.cpp.ast.OneDecl;
import org.polyast.cpp.ast.Operator;
import org.polyast.cpp.ast.Parameter;
import org.polyast.cpp.ast.Qualifier;
import org.polyast.cpp.ast.Sequencable;
import org.polyast.cpp.ast.Stmt;
import org.polyast.cpp.ast.StorageOpt;
import org.polyast.cpp.ast.Type;
import org.polyast.cpp.ast.TypeC;
import org.polyast.cpp.ast.Using;
import org.polyast.fixtures.CppTrees;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CppVisitor} on C++ constructs and unmodeled fallbacks: templates,
 * namespaces, allocation, casts, range-for, exception handlers, member declarations,
 * operator names and using declarations.
 */
@Tag("unit")
class CppVisitorConstructsTest {

    private CppTrees trees;
    private RecordingHooks recorder;
    private CppVisitor visitor;

    @BeforeEach
    void setUp() {
        trees = new CppTrees();
        recorder = new RecordingHooks();
        visitor = CppVisitor.of(recorder, VisitorSettings.DEFAULTS);
    }

    private Type typeName(String name) {
        return Type.of(new TypeC.TypeName(CppAst.nameOfId(trees.ident(name))));
    }

    private Compound emptyBlock() {
        return trees.compound();
    }

    private Stmt usingNamespace(String namespace) {
        Using using = new Using(trees.tok("using"),
            new Using.Kind.UsingNamespace(trees.tok("namespace"), CppAst.nameOfId(trees.ident(namespace))),
            trees.tok(";"));
        return new Stmt.DeclStmt(new BlockDeclaration.UsingDecl(using));
    }

    /** {@code for (int v : xs) { }} */
    private Stmt rangeFor() {
        Entity entity = new Entity(CppAst.nameOfId(trees.ident("v")), List.of());
        ForHeader header = new ForHeader.Range(entity, trees.intType(), trees.tok(":"),
            new Initialiser.InitExpr(trees.id("xs")));
        return new Stmt.For(trees.tok("for"), Delimited.of(trees.tok("("), header, trees.tok(")")),
            new Stmt.CompoundStmt(emptyBlock()));
    }

    private Handler catchAll() {
        List<Handler.ExceptionDeclaration> declarations =
            List.of(new Handler.ExceptionDeclaration.ExnDeclEllipsis(trees.tok("...")));
        return new Handler(trees.tok("catch"), Delimited.of(trees.tok("("), declarations, trees.tok(")")),
            emptyBlock());
    }

    /** {@code delete[] q} */
    private Expr deleteArray() {
        Delimited<Void> brackets = new Delimited<>(trees.tok("["), null, trees.tok("]"));
        return new Expr.DeleteArray(null, trees.tok("delete"), brackets, trees.id("q"));
    }

    @Test
    void typeTodo_visitsCategoryThenEveryRecoveredType() {
        Type todo = Type.of(new TypeC.TypeTodo(trees.ident("decltype"), List.of(trees.intType(), typeName("T"))));

        CppVisitor.of(recorder, new VisitorSettings(true, true)).visitType(todo);

        assertThat(recorder.events).containsExactly(
            "type:Type", "info:decltype",
            "type:Type", "info:int",
            "type:Type", "name:Name", "info:T");
        assertThat(recorder.count("type")).isEqualTo(3);
        assertThat(recorder.count("name")).isEqualTo(1);
    }

    @Test
    void typeTodo_withoutChildren_visitsOnlyItsCategory() {
        Type todo = Type.of(new TypeC.TypeTodo(trees.ident("typeof-pack"), List.of()));

        visitor.visitType(todo);

        assertThat(recorder.events).containsExactly("type:Type", "info:typeof-pack");
    }

    @Test
    void declTodo_visitsCategoryToken() {
        visitor.visitDeclaration(new Declaration.DeclTodo(trees.ident("concept")));

        assertThat(recorder.events).containsExactly("declaration:DeclTodo", "info:concept");
    }

    @Test
    void defineTodo_visitsKeywordMacroAndCategory() {
        CppDirective define = new CppDirective.Define(trees.tok("#define"), trees.ident("ASM"),
            new CppDirective.DefineKind.DefineVar(), new CppDirective.DefineVal.DefineTodo(trees.ident("asm-body")));

        visitor.visitCppDirective(define);

        assertThat(recorder.events).containsExactly(
            "cppDirective:Define", "info:#define", "info:ASM", "info:asm-body");
    }

    @Test
    void templateDecl_visitsParametersThenInnerDeclaration() {
        Token template = trees.tok("template");
        Token open = trees.tok("<");
        Parameter n = trees.intParam("N");
        Token close = trees.tok(">");
        Declaration inner = CppTrees.toplevel(trees.intVar("v", 7));
        Declaration declaration = new Declaration.TemplateDecl(template,
            Delimited.of(open, List.of(n), close), inner);

        visitor.visitDeclaration(declaration);

        assertThat(recorder.events).containsExactly(
            "declaration:TemplateDecl", "info:template", "info:<",
            "parameter:Parameter", "info:N", "type:Type", "info:int",
            "info:>",
            "declaration:BlockDecl", "blockDecl:DeclList", "oneDecl:OneDecl",
            "name:Name", "info:v", "info:=", "expr:Literal", "info:7", "type:Type", "info:int",
            "info:;");
        assertThat(recorder.count("declaration")).isEqualTo(2);
        assertThat(recorder.count("parameter")).isEqualTo(1);
        assertThat(recorder.count("type")).isEqualTo(2);
    }

    @Test
    void namespace_visitsNestedExternCBlock() {
        Token namespaceKeyword = trees.tok("namespace");
        Wrap<String> name = trees.ident("ns");
        Token outerOpen = trees.tok("{");
        Token extern = trees.tok("extern");
        Token linkage = trees.tok("\"C\"");
        Token innerOpen = trees.tok("{");
        Declaration empty = new Declaration.EmptyDef(trees.tok(";"));
        Declaration externC = new Declaration.ExternCList(extern, linkage,
            Delimited.of(innerOpen, List.of(Sequencable.item(empty)), trees.tok("}")));
        Declaration namespace = new Declaration.NameSpace(namespaceKeyword, name,
            Delimited.of(outerOpen, List.of(Sequencable.item(externC)), trees.tok("}")));

        visitor.visitDeclaration(namespace);

        assertThat(recorder.events).containsExactly(
            "declaration:NameSpace", "info:namespace", "info:ns", "info:{",
            "declaration:ExternCList", "info:extern", "info:\"C\"", "info:{",
            "declaration:EmptyDef", "info:;",
            "info:}", "info:}");
        assertThat(recorder.count("declaration")).isEqualTo(3);
    }

    @Test
    void newExpr_visitsPlacementTypeAndInitializer() {
        Token keyword = trees.tok("new");
        Delimited<List<Argument>> placement =
            Delimited.of(trees.tok("("), List.of(CppAst.exprToArg(trees.id("buf"))), trees.tok(")"));
        Type type = typeName("T");
        Delimited<List<Argument>> initializer =
            Delimited.of(trees.tok("("), List.of(CppAst.exprToArg(trees.intLit(1))), trees.tok(")"));

        visitor.visitExpr(new Expr.New(null, keyword, placement, type, initializer));

        assertThat(recorder.events).containsExactly(
            "expr:New", "info:new",
            "info:(", "expr:Id", "name:Name", "info:buf", "info:)",
            "type:Type", "name:Name", "info:T",
            "info:(", "expr:Literal", "info:1", "info:)");
        assertThat(recorder.count("expr")).isEqualTo(3);
        assertThat(recorder.count("name")).isEqualTo(2);
    }

    @Test
    void globalDelete_visitsQualifierKeywordAndOperand() {
        Expr delete = new Expr.Delete(trees.tok("::"), trees.tok("delete"), trees.id("p"));

        visitor.visitExpr(delete);

        assertThat(recorder.events).containsExactly(
            "expr:Delete", "info:::", "info:delete", "expr:Id", "name:Name", "info:p");
    }

    @Test
    void deleteArray_visitsEmptyBrackets() {
        visitor.visitExpr(deleteArray());

        assertThat(recorder.events).containsExactly(
            "expr:DeleteArray", "info:delete", "info:[", "info:]", "expr:Id", "name:Name", "info:q");
    }

    @Test
    void cplusplusCast_visitsOperatorTypeAndOperand() {
        Wrap<CastOperator> op = Wrap.of(CastOperator.STATIC_CAST, trees.tok("static_cast"));
        Delimited<Type> type = Delimited.of(trees.tok("<"), trees.intType(), trees.tok(">"));
        Delimited<Expr> operand = Delimited.of(trees.tok("("), trees.id("x"), trees.tok(")"));

        visitor.visitExpr(new Expr.CplusplusCast(op, type, operand));

        assertThat(recorder.events).containsExactly(
            "expr:CplusplusCast", "info:static_cast",
            "info:<", "type:Type", "info:int", "info:>",
            "info:(", "expr:Id", "name:Name", "info:x", "info:)");
    }

    @Test
    void rangeFor_visitsEntityTypeColonAndRange() {
        visitor.visitStmt(rangeFor());

        assertThat(recorder.events).containsExactly(
            "stmt:For", "info:for", "info:(",
            "name:Name", "info:v", "type:Type", "info:int", "info::",
            "expr:Id", "name:Name", "info:xs",
            "info:)",
            "stmt:CompoundStmt", "compound:Compound", "info:{", "info:}");
    }

    @Test
    void tryStmt_visitsBodyThenEachHandler() {
        Token keyword = trees.tok("try");
        Compound body = emptyBlock();
        Token catchKeyword = trees.tok("catch");
        Token open = trees.tok("(");
        Parameter e = CppAst.basicParam(trees.ident("e"), trees.intType(), List.of());
        List<Handler.ExceptionDeclaration> declarations = List.of(new Handler.ExceptionDeclaration.ExnDecl(e));
        Handler typed = new Handler(catchKeyword, Delimited.of(open, declarations, trees.tok(")")), emptyBlock());
        Stmt tryStmt = new Stmt.Try(keyword, body, List.of(typed, catchAll()));

        visitor.visitStmt(tryStmt);

        assertThat(recorder.events).containsExactly(
            "stmt:Try", "info:try", "compound:Compound", "info:{", "info:}",
            "info:catch", "info:(", "parameter:Parameter", "info:e", "type:Type", "info:int", "info:)",
            "compound:Compound", "info:{", "info:}",
            "info:catch", "info:(", "info:...", "info:)",
            "compound:Compound", "info:{", "info:}");
        assertThat(recorder.count("compound")).isEqualTo(3);
        assertThat(recorder.count("parameter")).isEqualTo(1);
    }

    @Test
    void pureVirtualMethod_visitsDeclaratorThenPureSpecifier() {
        Type returnType = trees.intType();
        Wrap<String> name = trees.ident("size");
        FunctionType function = new FunctionType(returnType,
            Delimited.of(trees.tok("("), List.<Parameter>of(), trees.tok(")")), null, null, null);
        OneDecl declaration = new OneDecl(CppAst.nameOfId(name), null, Type.of(new TypeC.TFunction(function)),
            StorageOpt.NONE);
        ClassMember member = new ClassMember.MemberDecl(
            new MethodDecl.Method(declaration, trees.tok("="), trees.tok("0"), trees.tok(";")));

        visitor.visitClassMember(member);

        assertThat(recorder.events).containsExactly(
            "classMember:MemberDecl", "oneDecl:OneDecl", "name:Name", "info:size",
            "type:Type", "type:Type", "info:int", "info:(", "info:)",
            "info:=", "info:0", "info:;");
    }

    @Test
    void constructorDecl_visitsNameAndParameters() {
        Wrap<String> name = trees.ident("Stack");
        Delimited<List<Parameter>> parameters =
            Delimited.of(trees.tok("("), List.of(trees.intParam("n")), trees.tok(")"));
        ClassMember member = new ClassMember.MemberDecl(
            new MethodDecl.ConstructorDecl(name, parameters, trees.tok(";")));

        visitor.visitClassMember(member);

        assertThat(recorder.events).containsExactly(
            "classMember:MemberDecl", "info:Stack", "info:(",
            "parameter:Parameter", "info:n", "type:Type", "info:int",
            "info:)", "info:;");
    }

    @Test
    void destructorDecl_visitsVoidParameterAndThrowSpec() {
        Token tilde = trees.tok("~");
        Wrap<String> name = trees.ident("Stack");
        Delimited<Token> voidParameter = Delimited.of(trees.tok("("), trees.tok("void"), trees.tok(")"));
        ExnSpec throwSpec = new ExnSpec.ThrowSpec(trees.tok("throw"),
            Delimited.of(trees.tok("("), List.<Type>of(), trees.tok(")")));
        ClassMember member = new ClassMember.MemberDecl(
            new MethodDecl.DestructorDecl(tilde, name, voidParameter, throwSpec, trees.tok(";")));

        visitor.visitClassMember(member);

        assertThat(recorder.events).containsExactly(
            "classMember:MemberDecl", "info:~", "info:Stack", "info:(", "info:void", "info:)",
            "info:throw", "info:(", "info:)", "info:;");
    }

    @Test
    void assignOperatorName_visitsQualifiersKeywordAndOperator() {
        Token global = trees.tok("::");
        Qualifier stack = new Qualifier.QClassname(trees.ident("Stack"));
        Token operator = trees.tok("operator");
        Operator plusAssign = new Operator.AssignOperator(new AssignOp.OpAssign(Wrap.of(ArithOp.PLUS, trees.tok("+="))));
        Name name = new Name(global, List.of(stack), new IdentOrOp.IdOperator(operator, plusAssign, List.of()));

        visitor.visitName(name);

        assertThat(recorder.events).containsExactly(
            "name:Name", "info:::", "info:Stack", "info:operator", "info:+=");
    }

    @Test
    void subscriptOperatorName_visitsItsSpellingTokens() {
        Token operator = trees.tok("operator");
        List<Token> spelling = List.of(trees.tok("["), trees.tok("]"));
        Name name = new Name(null, CppAst.noQualifier(),
            new IdentOrOp.IdOperator(operator, new Operator.AccessOperator(Operator.AccessOp.ARRAY), spelling));

        visitor.visitName(name);

        assertThat(recorder.events).containsExactly("name:Name", "info:operator", "info:[", "info:]");
    }

    @Test
    void converterName_visitsKeywordThenTargetType() {
        Token operator = trees.tok("operator");
        Type bool = Type.of(new TypeC.TBase(new BaseType.IntegerType(new BaseType.IntType.Bool(), trees.tok("bool"))));
        Name name = new Name(null, CppAst.noQualifier(), new IdentOrOp.IdConverter(operator, bool));

        visitor.visitName(name);

        assertThat(recorder.events).containsExactly("name:Name", "info:operator", "type:Type", "info:bool");
    }

    @Test
    void usingName_visitsQualifiedName() {
        Token usingKeyword = trees.tok("using");
        Name vector = new Name(null, List.of(new Qualifier.QClassname(trees.ident("std"))),
            new IdentOrOp.IdIdent(trees.ident("vector")));
        Using using = new Using(usingKeyword, new Using.Kind.UsingName(vector), trees.tok(";"));

        visitor.visitBlockDecl(new BlockDeclaration.UsingDecl(using));

        assertThat(recorder.events).containsExactly(
            "blockDecl:UsingDecl", "info:using", "name:Name", "info:std", "info:vector", "info:;");
    }

    @Test
    void usingNamespace_visitsNamespaceKeywordAndName() {
        visitor.visitStmt(usingNamespace("std"));

        assertThat(recorder.events).containsExactly(
            "stmt:DeclStmt", "blockDecl:UsingDecl", "info:using", "info:namespace", "name:Name", "info:std",
            "info:;");
    }

    @Test
    void usingAlias_visitsAliasAndType() {
        Token usingKeyword = trees.tok("using");
        Using.Kind alias = new Using.Kind.UsingAlias(trees.ident("Int"), trees.tok("="), trees.intType());
        Using using = new Using(usingKeyword, alias, trees.tok(";"));

        visitor.visitBlockDecl(new BlockDeclaration.UsingDecl(using));

        assertThat(recorder.events).containsExactly(
            "blockDecl:UsingDecl", "info:using", "info:Int", "info:=", "type:Type", "info:int", "info:;");
    }

    @Test
    void mixedBlock_countsEveryFamily() {
        Compound block = trees.compound(
            () -> usingNamespace("std"),
            this::rangeFor,
            () -> new Stmt.Try(trees.tok("try"), emptyBlock(), List.of(catchAll())),
            () -> trees.exprStmt(deleteArray()));

        visitor.visitCompound(block);

        assertThat(recorder.count("compound")).isEqualTo(4);
        assertThat(recorder.count("stmt")).isEqualTo(5);
        assertThat(recorder.count("blockDecl")).isEqualTo(1);
        assertThat(recorder.count("name")).isEqualTo(4);
        assertThat(recorder.count("type")).isEqualTo(1);
        assertThat(recorder.count("expr")).isEqualTo(3);
        assertThat(recorder.count("parameter")).isZero();
        assertThat(recorder.count("info")).isEqualTo(29);
        assertThat(recorder.events).hasSize(47);
        assertThat(recorder.events).startsWith("compound:Compound", "info:{", "stmt:DeclStmt");
        assertThat(recorder.events).endsWith("expr:Id", "name:Name", "info:q", "info:;", "info:}");
    }
}
