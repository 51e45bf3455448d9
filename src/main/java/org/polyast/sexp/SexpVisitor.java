package org.polyast.sexp;

import java.util.List;
import java.util.function.Consumer;

/**
 * Walks a {@link Sexp} tree, letting one hook intercept every node.
 */
public final class SexpVisitor {

    private final SexpHook hook;
    private final Consumer<Sexp> k = this::children;

    private SexpVisitor(SexpHook hook) {
        this.hook = hook;
    }

    /**
     * Visits {@code node} and, as far as {@code hook} continues, its descendants in order.
     */
    public static void visit(SexpHook hook, Sexp node) {
        new SexpVisitor(hook).sexp(node);
    }

    private void sexp(Sexp node) {
        hook.visit(node, k);
    }

    private void children(Sexp node) {
        List<Sexp> children = List.of();
        if (node instanceof Sexp.Paren paren) {
            children = paren.children();
        } else if (node instanceof Sexp.Angle angle) {
            children = angle.children();
        } else if (node instanceof Sexp.Anchor anchor) {
            children = anchor.children();
        } else if (node instanceof Sexp.Bracket bracket) {
            children = bracket.children();
        }
        children.forEach(this::sexp);
    }
}
