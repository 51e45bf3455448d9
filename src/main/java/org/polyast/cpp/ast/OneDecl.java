package org.polyast.cpp.ast;

/**
 * One declarator of a declaration. Covers variables, prototypes, typedefs, struct tag
 * declarations and, in C++, fields.
 *
 * @param name    The declared name, or null for an anonymous declaration such as
 *                {@code struct s { ... };} or an anonymous field.
 * @param init    The initializer, or null. Only present together with a name.
 * @param type    The declared type.
 * @param storage The storage class.
 */
public record OneDecl(Name name, Init init, Type type, StorageOpt storage) {
}
