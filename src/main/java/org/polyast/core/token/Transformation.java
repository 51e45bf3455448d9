package org.polyast.core.token;

/**
 * An edit scheduled on a token by a rewriting tool. The AST core never writes these.
 */
public sealed interface Transformation {

    record None() implements Transformation {}

    record Remove() implements Transformation {}

    record AddBefore(String text) implements Transformation {}

    record AddAfter(String text) implements Transformation {}

    record Replace(String text) implements Transformation {}

    Transformation NONE = new None();
}
