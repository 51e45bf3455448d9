package org.polyast.cpp.ast;

import java.util.List;

/**
 * The name of something being defined together with its specifiers.
 *
 * @param name  Usually a plain identifier; an operator name for overloaded operators.
 * @param specs Attributes, modifiers, qualifiers and storage classes in source order.
 */
public record Entity(Name name, List<Specifier> specs) {
}
