package org.polyast.python.ast;

import java.util.List;

/**
 * An {@code except type, name:} clause.
 *
 * @param type The exception type, or null for a bare {@code except:}.
 * @param name The target bound to the exception, or null.
 */
public record ExceptHandler(Expr type, Expr name, List<Stmt> body) {
}
