package org.polyast.python.ast;

import java.util.List;

/**
 * One {@code for target in iter if cond...} clause of a list comprehension or generator.
 */
public record Comprehension(Expr target, Expr iter, List<Expr> ifs) {
}
