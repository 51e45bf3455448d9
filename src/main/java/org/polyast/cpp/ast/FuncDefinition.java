package org.polyast.cpp.ast;

/**
 * A function or method definition.
 *
 * @param entity  The function's name and specifiers.
 * @param type    Return type, parameters and qualifiers.
 * @param storage The storage class.
 * @param body    The function body.
 */
public record FuncDefinition(Entity entity, FunctionType type, StorageOpt storage, Compound body) {
}
