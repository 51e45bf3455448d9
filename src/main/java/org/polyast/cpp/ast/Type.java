package org.polyast.cpp.ast;

import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * A full type: the type constructor together with its cv-qualifiers.
 *
 * <p>Arrays and function types also carry qualifiers so that all types share one shape,
 * although the grammar never allows qualifying them directly.</p>
 *
 * @param qualifiers The qualifiers in source order, possibly empty.
 * @param typeC      The type constructor.
 */
public record Type(List<Wrap<TypeQualifier>> qualifiers, TypeC typeC) {

    public static Type of(TypeC typeC) {
        return new Type(List.of(), typeC);
    }
}
