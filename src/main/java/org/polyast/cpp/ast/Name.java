package org.polyast.cpp.ast;

import org.polyast.core.token.Token;

import java.util.List;

/**
 * A possibly qualified C++ name, from a plain identifier to something like
 * {@code ::std::vector<int>::~vector} or {@code A::operator+}.
 *
 * <p>Qualifiers are ordered outer to inner: the leftmost qualifier is resolved first.
 * Positions that hold a class or plain identifier name only ever carry an
 * {@link IdentOrOp.IdIdent} or {@link IdentOrOp.IdTemplateId} terminal; this is a
 * convention of the producing parsers and is not checked here.</p>
 *
 * @param globalQualifier The leading {@code ::} token, or null when the name is not
 *                        explicitly global.
 * @param qualifiers      The qualifier path, outer to inner, possibly empty.
 * @param id              The terminal part of the name.
 */
public record Name(Token globalQualifier, List<Qualifier> qualifiers, IdentOrOp id) {

    public boolean isQualified() {
        return globalQualifier != null || !qualifiers.isEmpty();
    }
}
