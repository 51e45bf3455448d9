package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * One step of a qualifier path, i.e. what precedes a {@code ::}.
 */
public sealed interface Qualifier {

    /**
     * A class or namespace name.
     */
    record QClassname(Wrap<String> ident) implements Qualifier {}

    record QTemplateId(Wrap<String> ident, Delimited<List<TypeOrExpr>> arguments) implements Qualifier {}
}
