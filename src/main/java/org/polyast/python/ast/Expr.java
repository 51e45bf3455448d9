package org.polyast.python.ast;

import org.polyast.core.resolution.ResolutionCell;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * Python expressions. Type annotations and decorators are expressions too; the visitor reaches
 * them through dedicated hooks.
 */
public sealed interface Expr {

    record Num(Number number) implements Expr {}

    /**
     * A string literal. Adjacent literals are concatenated into one value, so the node keeps
     * one token per source fragment.
     */
    record Str(String value, List<Token> tokens) implements Expr {}

    /**
     * @param id         The identifier.
     * @param context    How the name is used.
     * @param type       The annotation of a parameter, or null.
     * @param resolution Filled by a resolution pass after parsing; never read by traversal.
     */
    record Name(Wrap<String> id, ExprContext context, Expr type, ResolutionCell resolution) implements Expr {}

    record Tuple(List<Expr> elements, ExprContext context) implements Expr {}

    record ListExpr(List<Expr> elements, ExprContext context) implements Expr {}

    record Dict(List<Expr> keys, List<Expr> values) implements Expr {}

    record ListComp(Expr element, List<Comprehension> generators) implements Expr {}

    record BoolOp(BooleanOperator op, List<Expr> values) implements Expr {}

    record BinOp(Expr left, BinaryOperator op, Expr right) implements Expr {}

    record UnaryOp(UnaryOperator op, Expr operand) implements Expr {}

    /** A chained comparison: {@code left op1 c1 op2 c2 ...}. */
    record Compare(Expr left, List<CompareOperator> ops, List<Expr> comparators) implements Expr {}

    /**
     * @param starargs The {@code *args} argument, or null.
     * @param kwargs   The {@code **kwargs} argument, or null.
     */
    record Call(Expr function, List<Expr> args, List<Keyword> keywords, Expr starargs, Expr kwargs)
        implements Expr {}

    record Subscript(Expr value, Slice slice, ExprContext context) implements Expr {}

    record Lambda(Parameters parameters, Expr body) implements Expr {}

    record IfExp(Expr test, Expr body, Expr orElse) implements Expr {}

    record GeneratorExp(Expr element, List<Comprehension> generators) implements Expr {}

    /** @param value null for a bare {@code yield}. */
    record Yield(Expr value) implements Expr {}

    /** Python 2 backquotes. */
    record Repr(Expr value) implements Expr {}

    record Attribute(Expr value, Wrap<String> attr, ExprContext context) implements Expr {}
}
