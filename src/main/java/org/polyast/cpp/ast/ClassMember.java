package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

public sealed interface ClassMember {

    /** {@code public:} and friends. */
    record Access(Wrap<AccessSpec> spec, Token colon) implements ClassMember {}

    record MemberField(List<FieldKind> fields, Token semicolon) implements ClassMember {}

    record MemberFunc(FuncOrElse function) implements ClassMember {}

    record MemberDecl(MethodDecl declaration) implements ClassMember {}

    record QualifiedIdInClass(Name name, Token semicolon) implements ClassMember {}

    record TemplateDeclInClass(Token templateKeyword, Delimited<List<Parameter>> parameters,
                               Declaration declaration) implements ClassMember {}

    record UsingDeclInClass(Using using) implements ClassMember {}

    /** A stray {@code ;}. */
    record EmptyField(Token semicolon) implements ClassMember {}

    sealed interface FieldKind {

        record FieldDecl(OneDecl declaration) implements FieldKind {}

        /**
         * @param name  The field name, or null for an unnamed padding field.
         * @param width The bit width.
         */
        record BitField(Wrap<String> name, Token colon, Type type, Expr width) implements FieldKind {}
    }
}
