package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * Attributes, modifiers, qualifiers and storage classes attached to an entity.
 */
public sealed interface Specifier {

    record AttributeSpec(Attribute attribute) implements Specifier {}

    record ModifierSpec(Modifier modifier) implements Specifier {}

    record QualifierSpec(Wrap<TypeQualifier> qualifier) implements Specifier {}

    record StorageSpec(Wrap<Storage> storage) implements Specifier {}

    sealed interface Attribute {

        /** gcc {@code __attribute__((...))}. */
        record UnderscoresAttr(Token keyword, Delimited<Delimited<List<Argument>>> arguments) implements Attribute {}

        /** C++11 {@code [[...]]}; the delimiters are the outer brackets. */
        record BracketsAttr(Delimited<List<Expr>> exprs) implements Attribute {}

        /** msvc {@code __declspec(id)}. */
        record DeclSpec(Token keyword, Delimited<Wrap<String>> id) implements Attribute {}
    }

    sealed interface Modifier {

        record Inline(Token keyword) implements Modifier {}

        record Virtual(Token keyword) implements Modifier {}

        record Final(Token keyword) implements Modifier {}

        record Override(Token keyword) implements Modifier {}

        /** msvc calling convention such as {@code __cdecl}. */
        record MsCall(Wrap<String> convention) implements Modifier {}

        /**
         * @param condition C++20 {@code explicit(cond)}, or null.
         */
        record Explicit(Token keyword, Delimited<Expr> condition) implements Modifier {}
    }
}
