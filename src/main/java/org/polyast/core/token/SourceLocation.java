package org.polyast.core.token;

/**
 * A position in a source file.
 *
 * @param file    The path of the file the position belongs to.
 * @param line    1-based line number, 0 for synthesized positions.
 * @param column  0-based column.
 * @param charPos 0-based byte offset from the start of the file, -1 when unknown.
 */
public record SourceLocation(String file, int line, int column, int charPos) {

    private static final SourceLocation NONE = new SourceLocation("", 0, 0, -1);

    /**
     * Returns the location used for tokens that have no position of their own,
     * such as tokens produced by macro expansion.
     */
    public static SourceLocation none() {
        return NONE;
    }

    /**
     * Whether this location points into a real file.
     */
    public boolean isReal() {
        return charPos >= 0 && !file.isEmpty();
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
