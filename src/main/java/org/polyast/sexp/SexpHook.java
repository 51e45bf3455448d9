package org.polyast.sexp;

import java.util.function.Consumer;

/**
 * The single hook of a {@link SexpVisitor} traversal. Calling {@code k} visits the children of
 * {@code node}; it does nothing for a {@link Sexp.Leaf}.
 */
@FunctionalInterface
public interface SexpHook {

    void visit(Sexp node, Consumer<Sexp> k);
}
