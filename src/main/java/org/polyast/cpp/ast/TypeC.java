package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * Type constructors.
 */
public sealed interface TypeC {

    record TBase(BaseType base) implements TypeC {}

    record TPointer(Token star, Type pointee, List<PointerModifier> modifiers) implements TypeC {}

    /** C++ lvalue reference. */
    record TReference(Token ampersand, Type referee) implements TypeC {}

    /** C++11 rvalue reference. */
    record TRefRef(Token ampersands, Type referee) implements TypeC {}

    /**
     * @param size    The bracketed size expression; the enclosed value is null for {@code []}.
     * @param element The element type.
     */
    record TArray(Delimited<Expr> size, Type element) implements TypeC {}

    record TFunction(FunctionType function) implements TypeC {}

    record EnumName(Token enumKeyword, Wrap<String> name) implements TypeC {}

    /**
     * An elaborated class type such as {@code struct stat}.
     */
    record ClassName(Wrap<ClassKey> key, Wrap<String> name) implements TypeC {}

    /**
     * A typedef, class or enum name; may be qualified and templated.
     */
    record TypeName(Name name) implements TypeC {}

    record TypenameKwd(Token typenameKeyword, Type type) implements TypeC {}

    record EnumDef(EnumDefinition definition) implements TypeC {}

    record ClassDef(ClassDefinition definition) implements TypeC {}

    /** gcc {@code __typeof__}. */
    record TypeOf(Token keyword, Delimited<TypeOrExpr> operand) implements TypeC {}

    record TAuto(Token autoKeyword) implements TypeC {}

    record ParenType(Delimited<Type> type) implements TypeC {}

    /**
     * A type construct recognized but not modeled, such as {@code decltype}.
     *
     * @param category The construct's category, located at its first token.
     * @param types    The sub-types the parser still built.
     */
    record TypeTodo(Wrap<String> category, List<Type> types) implements TypeC {}
}
