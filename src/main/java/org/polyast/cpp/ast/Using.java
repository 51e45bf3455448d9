package org.polyast.cpp.ast;

import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

public record Using(Token usingKeyword, Kind kind, Token semicolon) {

    public sealed interface Kind {

        record UsingName(Name name) implements Kind {}

        /**
         * @param namespace Only ever an {@link IdentOrOp.IdIdent}.
         */
        record UsingNamespace(Token namespaceKeyword, Name namespace) implements Kind {}

        record UsingAlias(Wrap<String> alias, Token eq, Type type) implements Kind {}
    }
}
