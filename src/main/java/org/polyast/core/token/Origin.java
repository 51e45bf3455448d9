package org.polyast.core.token;

import java.util.List;

/**
 * Where a token comes from: straight from the source text, or from the expansion of a macro.
 */
public sealed interface Origin {

    /**
     * The token appears literally in the source.
     */
    record Original() implements Origin {}

    /**
     * The token was synthesized while expanding a macro.
     *
     * @param source  The location of the token the expansion started from.
     * @param markers Replacement markers recorded by the expansion, outermost first.
     */
    record Expanded(SourceLocation source, List<String> markers) implements Origin {}

    Origin ORIGINAL = new Original();
}
