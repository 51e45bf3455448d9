package org.polyast.python.ast;

import org.polyast.core.token.Wrap;

/** A {@code name=value} call argument. */
public record Keyword(Wrap<String> name, Expr value) {
}
