package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * A struct, union or class body.
 *
 * @param name    The class name, or null for an anonymous class. Only ever an
 *                {@link IdentOrOp.IdIdent}, or an {@link IdentOrOp.IdTemplateId} for a
 *                template specialization.
 * @param key     {@code struct}, {@code union} or {@code class}.
 * @param bases   The base clauses, possibly empty.
 * @param members The braced members.
 */
public record ClassDefinition(Name name, Wrap<ClassKey> key, List<BaseClause> bases,
                              Delimited<List<Sequencable<ClassMember>>> members) {

    /**
     * @param name           The base class; only ever an {@link IdentOrOp.IdIdent} or
     *                       {@link IdentOrOp.IdTemplateId}.
     * @param virtualKeyword The {@code virtual} keyword, or null.
     * @param access         The access specifier, or null.
     */
    public record BaseClause(Name name, Token virtualKeyword, Wrap<AccessSpec> access) {}
}
