package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * Preprocessor directives other than conditional compilation, see {@link IfdefDirective}.
 */
public sealed interface CppDirective {

    record Define(Token keyword, Wrap<String> macro, DefineKind kind, DefineVal body) implements CppDirective {}

    record Include(Token keyword, IncludeKind target) implements CppDirective {}

    record Undef(Wrap<String> macro) implements CppDirective {}

    /** {@code #pragma}, {@code #line} and other directives kept as a single token. */
    record PragmaAndCo(Token token) implements CppDirective {}

    sealed interface DefineKind {

        record DefineVar() implements DefineKind {}

        record DefineMacro(Delimited<List<Wrap<String>>> parameters) implements DefineKind {}
    }

    /**
     * What a macro body was recognized as.
     */
    sealed interface DefineVal {

        record DefineExpr(Expr expr) implements DefineVal {}

        record DefineStmt(Stmt stmt) implements DefineVal {}

        record DefineType(Type type) implements DefineVal {}

        record DefineFunction(FuncDefinition function) implements DefineVal {}

        /** In practice only a braced list, possibly with a trailing comma. */
        record DefineInit(Initialiser initialiser) implements DefineVal {}

        /** {@code do { ... } while (0)} */
        record DefineDoWhileZero(Token doKeyword, Stmt body, Token whileKeyword,
                                 Delimited<Token> zero) implements DefineVal {}

        record DefinePrintWrapper(Token ifKeyword, Delimited<Expr> condition, Name printer) implements DefineVal {}

        record DefineEmpty() implements DefineVal {}

        /** A macro body recognized but not modeled; its content is not kept. */
        record DefineTodo(Wrap<String> category) implements DefineVal {}
    }

    sealed interface IncludeKind {

        /** {@code #include "x.h"}; the wrapped path excludes the quotes. */
        record IncLocal(Wrap<String> path) implements IncludeKind {}

        /** {@code #include <x.h>}; the wrapped path excludes the angles. */
        record IncSystem(Wrap<String> path) implements IncludeKind {}

        /** Computed include such as {@code #include SYSTEM_H}. */
        record IncOther(Expr expr) implements IncludeKind {}
    }
}
