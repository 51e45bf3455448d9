package org.polyast.cpp.ast;

/**
 * A function definition classified by its role in a class.
 */
public sealed interface FuncOrElse {

    FuncDefinition definition();

    record FunctionOrMethod(FuncDefinition definition) implements FuncOrElse {}

    record Constructor(FuncDefinition definition) implements FuncOrElse {}

    record Destructor(FuncDefinition definition) implements FuncOrElse {}
}
