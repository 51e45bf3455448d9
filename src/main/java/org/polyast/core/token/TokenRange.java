package org.polyast.core.token;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The first and last original tokens of a fragment, by file offset.
 *
 * @param first The token with the smallest {@code charPos}.
 * @param last  The token with the largest {@code charPos}.
 */
public record TokenRange(Token first, Token last) {

    private static final Comparator<Token> BY_POSITION = Comparator.comparingInt(t -> t.location().charPos());

    /**
     * Computes the range of {@code tokens}, skipping expanded tokens and tokens without a
     * real location.
     *
     * @return The range, or empty when no token qualifies.
     */
    public static Optional<TokenRange> of(Collection<Token> tokens) {
        List<Token> real = tokens.stream()
            .filter(t -> !t.isExpanded() && t.location().isReal())
            .collect(Collectors.toList());
        if (real.isEmpty()) {
            return Optional.empty();
        }
        Token first = real.stream().min(BY_POSITION).orElseThrow();
        Token last = real.stream().max(BY_POSITION).orElseThrow();
        return Optional.of(new TokenRange(first, last));
    }
}
