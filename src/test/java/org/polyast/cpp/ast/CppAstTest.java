package org.polyast.cpp.ast;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.polyast.core.resolution.ResolvedName;
import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;
import org.polyast.fixtures.CppTrees;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link CppAst} construction and name helpers.
 */
@Tag("unit")
class CppAstTest {

    private CppTrees trees;

    @BeforeEach
    void setUp() {
        trees = new CppTrees();
    }

    @Test
    void nameOfId_isUnqualifiedPlainIdentifier() {
        Wrap<String> foo = trees.ident("foo");

        Name name = CppAst.nameOfId(foo);

        assertThat(name.globalQualifier()).isNull();
        assertThat(name.qualifiers()).isEmpty();
        assertThat(name.isQualified()).isFalse();
        assertThat(name.id()).isEqualTo(new IdentOrOp.IdIdent(foo));
        assertThat(CppAst.stringOfName(name)).isEqualTo("foo");
    }

    @Test
    void exprOfId_getsFreshUnresolvedCellEachTime() {
        Wrap<String> foo = trees.ident("foo");

        Expr.Id first = (Expr.Id) CppAst.exprOfId(foo);
        Expr.Id second = (Expr.Id) CppAst.exprOfId(foo);
        first.resolution().resolve(ResolvedName.LOCAL_VAR);

        assertThat(first.resolution()).isNotSameAs(second.resolution());
        assertThat(second.resolution().get()).isEqualTo(ResolvedName.NOT_RESOLVED);
    }

    @Test
    void exprToArg_wrapsExpression() {
        Expr a = trees.id("a");

        assertThat(CppAst.exprToArg(a)).isEqualTo(new Argument.Arg(a));
    }

    @Test
    void basicParam_hasNoDefaultAndNoRegister() {
        Type type = trees.intType();
        Parameter parameter = CppAst.basicParam(trees.ident("n"), type, List.of());

        assertThat(parameter.name().value()).isEqualTo("n");
        assertThat(parameter.type()).isSameAs(type);
        assertThat(parameter.registerKeyword()).isNull();
        assertThat(parameter.defaultValue()).isNull();
        assertThat(CppAst.unwrapTypeC(type)).isInstanceOf(TypeC.TBase.class);
    }

    @Test
    void stringOfName_ignoresQualifiers() {
        Name qualified = new Name(trees.tok("::"),
            List.of(new Qualifier.QClassname(trees.ident("std"))),
            new IdentOrOp.IdIdent(trees.ident("vector")));

        assertThat(qualified.isQualified()).isTrue();
        assertThat(CppAst.stringOfName(qualified)).isEqualTo("vector");
    }

    @Test
    void stringOfName_rejectsDestructorName() {
        Name destructor = new Name(null, CppAst.noQualifier(),
            new IdentOrOp.IdDestructor(trees.tok("~"), trees.ident("Foo")));

        assertThatThrownBy(() -> CppAst.stringOfName(destructor))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessageContaining("IdDestructor");
    }

    @Test
    void tokensOfIdName_destructor_returnsTildeAndIdentifier() {
        Token tilde = trees.tok("~");
        Wrap<String> foo = trees.ident("Foo");
        Name destructor = new Name(null, CppAst.noQualifier(), new IdentOrOp.IdDestructor(tilde, foo));

        assertThat(CppAst.tokensOfIdName(destructor)).containsExactly(tilde, foo.token());
        assertThat(CppAst.tokenOfName(destructor)).isSameAs(tilde);
    }

    @Test
    void tokensOfIdName_operator_returnsOperatorTokens() {
        Token keyword = trees.tok("operator");
        Token plus = trees.tok("+");
        Name op = new Name(null, CppAst.noQualifier(),
            new IdentOrOp.IdOperator(keyword, new Operator.BinaryOperator(new BinaryOp.Arith(ArithOp.PLUS)), List.of(plus)));

        assertThat(CppAst.tokensOfIdName(op)).containsExactly(plus);
        assertThat(CppAst.tokenOfName(op)).isSameAs(plus);
    }

    @Test
    void tokensOfIdName_converter_isUnsupported() {
        Token keyword = trees.tok("operator");
        Name converter = new Name(null, CppAst.noQualifier(), new IdentOrOp.IdConverter(keyword, trees.intType()));

        assertThatThrownBy(() -> CppAst.tokensOfIdName(converter))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(CppAst.tokenOfName(converter)).isSameAs(keyword);
    }

    @Test
    void templateId_tokenOfName_isIdentifier() {
        Wrap<String> vector = trees.ident("vector");
        Name template = new Name(null, CppAst.noQualifier(), new IdentOrOp.IdTemplateId(vector,
            Delimited.of(trees.tok("<"),
                List.of(new TypeOrExpr.OfType(trees.intType())), trees.tok(">"))));

        assertThat(CppAst.tokenOfName(template)).isSameAs(vector.token());
        assertThat(CppAst.tokensOfIdName(template)).containsExactly(vector.token());
    }

    @Test
    void classAndBaseNames_builtFromHelpers_arePlainIdentifiers() {
        Wrap<ClassKey> key = Wrap.of(ClassKey.STRUCT, trees.tok("struct"));
        Name name = CppAst.nameOfId(trees.ident("Point"));
        ClassDefinition.BaseClause base = new ClassDefinition.BaseClause(CppAst.nameOfId(trees.ident("Shape")), null, null);
        ClassDefinition definition = new ClassDefinition(name, key, List.of(base), null);

        assertThat(definition.name().id()).isInstanceOf(IdentOrOp.IdIdent.class);
        assertThat(definition.bases()).allSatisfy(b -> assertThat(b.name().id()).isInstanceOf(IdentOrOp.IdIdent.class));
    }
}
