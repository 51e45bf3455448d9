package org.polyast.python.ast;

import org.polyast.core.token.Wrap;

/** An imported name and its {@code as} rename, which may be null. */
public record Alias(Wrap<String> name, Wrap<String> asName) {
}
