package org.polyast.cpp.visitor;

import org.polyast.core.config.VisitorSettings;
import org.polyast.core.token.Token;
import org.polyast.core.token.TokenRange;
import org.polyast.cpp.ast.Any;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Token-level queries over C/C++ fragments, built on the {@code info} hook.
 */
public final class CppTokens {

    private CppTokens() {
    }

    /**
     * Collects every token of {@code any} in traversal order. Tokens are visited regardless of
     * the configured {@code visit-tokens} setting.
     */
    public static List<Token> of(Any any) {
        List<Token> tokens = new ArrayList<>();
        CppHooks collector = new CppHooks() {
            @Override
            public void onInfo(Token token, Consumer<Token> k, CppVisitor visitor) {
                tokens.add(token);
            }
        };
        CppVisitor.of(collector, VisitorSettings.DEFAULTS).visitAny(any);
        return tokens;
    }

    /**
     * Returns the first and last original tokens of {@code any}, or empty if it has none.
     */
    public static Optional<TokenRange> range(Any any) {
        return TokenRange.of(of(any));
    }
}
