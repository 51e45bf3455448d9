package org.polyast.python.ast;

import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * The formal parameters of a function or lambda.
 *
 * @param args     Positional parameters, usually {@link Expr.Name}s in {@link ExprContext#PARAM}
 *                 context; Python 2 also allows tuple patterns here.
 * @param vararg   The {@code *args} name, or null.
 * @param kwarg    The {@code **kwargs} name, or null.
 * @param defaults Default values, aligned with the last parameters of {@code args}.
 */
public record Parameters(List<Expr> args, Wrap<String> vararg, Wrap<String> kwarg, List<Expr> defaults) {
}
