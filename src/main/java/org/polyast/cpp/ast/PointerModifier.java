package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;

import java.util.List;

/**
 * Microsoft pointer modifiers, only allowed in declarators.
 */
public sealed interface PointerModifier {

    record Based(Token keyword, Delimited<List<Argument>> arguments) implements PointerModifier {}

    record PtrRestrict(Token keyword) implements PointerModifier {}

    record Uptr(Token keyword) implements PointerModifier {}

    record Sptr(Token keyword) implements PointerModifier {}

    record Unaligned(Token keyword) implements PointerModifier {}
}
