package org.polyast.sexp;

import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * A bracket-structured tree with no typing beyond the bracket kind, as produced by compilers
 * that dump their own AST as text, e.g. {@code clang -Xclang -ast-dump}.
 */
public sealed interface Sexp {

    /**
     * {@code ( ... )}.
     *
     * @param kind The node kind named by the first atom (e.g. {@code FunctionDecl}), or null.
     */
    record Paren(String kind, List<Sexp> children) implements Sexp {}

    /** {@code < ... >}. */
    record Angle(List<Sexp> children) implements Sexp {}

    /** {@code { ... }}. */
    record Anchor(List<Sexp> children) implements Sexp {}

    /** {@code [ ... ]}. */
    record Bracket(List<Sexp> children) implements Sexp {}

    record Leaf(Wrap<String> atom) implements Sexp {}
}
