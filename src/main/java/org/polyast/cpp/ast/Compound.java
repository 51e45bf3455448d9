package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;

import java.util.List;

/**
 * A brace-enclosed block. Declarations and statements mix freely in C++; preprocessor
 * directives between statements are kept in place as {@link Sequencable} entries.
 *
 * @param body The braces and the statements between them.
 */
public record Compound(Delimited<List<Sequencable<Stmt>>> body) {

    public List<Sequencable<Stmt>> statements() {
        return body.value();
    }
}
