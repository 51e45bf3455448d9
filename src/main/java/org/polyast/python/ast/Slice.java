package org.polyast.python.ast;

import java.util.List;

public sealed interface Slice {

    record Ellipsis() implements Slice {}

    /**
     * {@code lower:upper:step}; every part may be null.
     */
    record SliceRange(Expr lower, Expr upper, Expr step) implements Slice {}

    record ExtSlice(List<Slice> dims) implements Slice {}

    record Index(Expr value) implements Slice {}
}
