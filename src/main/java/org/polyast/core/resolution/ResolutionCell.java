package org.polyast.core.resolution;

import java.util.Objects;

/**
 * Mutable back-reference attached to identifier leaves, the only mutable part of an otherwise
 * immutable tree besides token transformations.
 *
 * <p>A cell starts out {@link ResolvedName#NOT_RESOLVED} and is written at most once, by a single
 * resolution pass that runs after the tree is built. Readers must accept {@code NOT_RESOLVED} at
 * any time; traversal never consults the cell. Writes are not synchronized, so resolution should
 * complete before concurrent analysis passes start reading.</p>
 */
public final class ResolutionCell {

    private ResolvedName value = ResolvedName.NOT_RESOLVED;

    public static ResolutionCell unresolved() {
        return new ResolutionCell();
    }

    public ResolvedName get() {
        return value;
    }

    public boolean isResolved() {
        return value != ResolvedName.NOT_RESOLVED;
    }

    /**
     * Records what the identifier refers to.
     *
     * @param resolved The resolved kind, never {@link ResolvedName#NOT_RESOLVED}.
     * @throws IllegalArgumentException if {@code resolved} is {@code NOT_RESOLVED}.
     * @throws IllegalStateException    if the cell was already written.
     */
    public void resolve(ResolvedName resolved) {
        Objects.requireNonNull(resolved, "resolved");
        if (resolved == ResolvedName.NOT_RESOLVED) {
            throw new IllegalArgumentException("Cannot resolve an identifier to NOT_RESOLVED");
        }
        if (isResolved()) {
            throw new IllegalStateException("Identifier already resolved to " + value + ", refusing " + resolved);
        }
        this.value = resolved;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
