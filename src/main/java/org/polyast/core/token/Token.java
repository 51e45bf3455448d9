package org.polyast.core.token;

import java.util.Objects;

/**
 * A located terminal. Every leaf value of every tree carries exactly one token.
 *
 * <p>A token is immutable except for its {@link Transformation} slot, which belongs to
 * downstream rewriting tools. The slot is not synchronized: tools that schedule edits
 * while other threads read the tree must coordinate themselves.</p>
 */
public final class Token {

    private final String text;
    private final SourceLocation location;
    private final Origin origin;
    private Transformation transformation = Transformation.NONE;

    public Token(String text, SourceLocation location) {
        this(text, location, Origin.ORIGINAL);
    }

    public Token(String text, SourceLocation location, Origin origin) {
        this.text = Objects.requireNonNull(text, "text");
        this.location = Objects.requireNonNull(location, "location");
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    public String text() {
        return text;
    }

    public SourceLocation location() {
        return location;
    }

    public Origin origin() {
        return origin;
    }

    /**
     * Returns the location of the text this token stands for. For an expanded token this
     * is the location of the token the expansion originated from.
     */
    public SourceLocation originalLocation() {
        if (origin instanceof Origin.Expanded expanded) {
            return expanded.source();
        }
        return location;
    }

    public boolean isExpanded() {
        return origin instanceof Origin.Expanded;
    }

    public Transformation transformation() {
        return transformation;
    }

    public void setTransformation(Transformation transformation) {
        this.transformation = Objects.requireNonNull(transformation, "transformation");
    }

    @Override
    public String toString() {
        return "'" + text + "'@" + location;
    }
}
