package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * @param enumKeyword The {@code enum} keyword.
 * @param name        The enum tag, or null for an anonymous enum.
 * @param elements    The braced enumerators.
 */
public record EnumDefinition(Token enumKeyword, Wrap<String> name, Delimited<List<EnumElem>> elements) {

    /**
     * @param eq    The {@code =} of an explicit value, or null.
     * @param value The explicit value, or null.
     */
    public record EnumElem(Wrap<String> name, Token eq, Expr value) {}
}
