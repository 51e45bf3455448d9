package org.polyast.python.visitor;

import org.polyast.core.config.VisitorSettings;
import org.polyast.core.token.Token;
import org.polyast.core.token.TokenRange;
import org.polyast.python.ast.Any;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Token-level queries over Python fragments.
 */
public final class PythonTokens {

    private PythonTokens() {
    }

    /**
     * Collects every token of {@code any} in traversal order.
     */
    public static List<Token> of(Any any) {
        List<Token> tokens = new ArrayList<>();
        PythonHooks collector = new PythonHooks() {
            @Override
            public void onInfo(Token token, Consumer<Token> k, PythonVisitor visitor) {
                tokens.add(token);
            }
        };
        PythonVisitor.of(collector, VisitorSettings.DEFAULTS).visitAny(any);
        return tokens;
    }

    public static Optional<TokenRange> range(Any any) {
        return TokenRange.of(of(any));
    }
}
