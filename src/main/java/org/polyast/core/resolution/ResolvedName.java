package org.polyast.core.resolution;

/**
 * What an identifier occurrence was found to refer to by a resolution pass.
 */
public enum ResolvedName {
    /** No resolution pass has looked at the identifier yet, or none could classify it. */
    NOT_RESOLVED,
    LOCAL_VAR,
    PARAMETER,
    IMPORTED_MODULE,
    IMPORTED_GLOBAL
}
