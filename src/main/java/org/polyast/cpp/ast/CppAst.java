package org.polyast.cpp.ast;

import org.polyast.core.resolution.ResolutionCell;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.ArrayList;
import java.util.List;

/**
 * Constructors and accessors that spare front ends the boilerplate of building minimal names,
 * expressions and arguments.
 */
public final class CppAst {

    private CppAst() {
    }

    /**
     * Returns an empty qualifier path.
     */
    public static List<Qualifier> noQualifier() {
        return List.of();
    }

    /**
     * Builds the unqualified, non-global name made of {@code id} alone.
     */
    public static Name nameOfId(Wrap<String> id) {
        return new Name(null, noQualifier(), new IdentOrOp.IdIdent(id));
    }

    /**
     * Builds an identifier expression for {@code id} with a fresh, unresolved resolution cell.
     */
    public static Expr exprOfId(Wrap<String> id) {
        return new Expr.Id(nameOfId(id), ResolutionCell.unresolved());
    }

    /**
     * Wraps {@code expr} as a plain call argument.
     */
    public static Argument exprToArg(Expr expr) {
        return new Argument.Arg(expr);
    }

    /**
     * Returns the type constructor of {@code type}, dropping its qualifiers.
     */
    public static TypeC unwrapTypeC(Type type) {
        return type.typeC();
    }

    /**
     * Builds a named parameter with no default value and no {@code register} keyword.
     */
    public static Parameter basicParam(Wrap<String> id, Type type, List<Specifier> specs) {
        return new Parameter(id, type, null, specs, null, null);
    }

    /**
     * Returns the identifier of a plain name, ignoring any qualifier.
     *
     * @throws UnsupportedOperationException if the terminal is not an {@link IdentOrOp.IdIdent}.
     */
    public static String stringOfName(Name name) {
        if (name.id() instanceof IdentOrOp.IdIdent ident) {
            return ident.ident().value();
        }
        throw new UnsupportedOperationException("Not a plain identifier: " + name.id().getClass().getSimpleName());
    }

    /**
     * Returns the tokens spelling the terminal part of {@code name}.
     *
     * @throws UnsupportedOperationException for a conversion function name, whose terminal
     *                                       spans a whole type.
     */
    public static List<Token> tokensOfIdName(Name name) {
        IdentOrOp id = name.id();
        if (id instanceof IdentOrOp.IdIdent ident) {
            return List.of(ident.ident().token());
        }
        if (id instanceof IdentOrOp.IdOperator op) {
            return op.operatorTokens();
        }
        if (id instanceof IdentOrOp.IdDestructor destructor) {
            List<Token> tokens = new ArrayList<>(2);
            tokens.add(destructor.tilde());
            tokens.add(destructor.ident().token());
            return tokens;
        }
        if (id instanceof IdentOrOp.IdTemplateId template) {
            return List.of(template.ident().token());
        }
        throw new UnsupportedOperationException("Conversion function names have no identifier tokens");
    }

    /**
     * Returns the first token of the terminal part of {@code name}.
     */
    public static Token tokenOfName(Name name) {
        IdentOrOp id = name.id();
        if (id instanceof IdentOrOp.IdIdent ident) {
            return ident.ident().token();
        }
        if (id instanceof IdentOrOp.IdOperator op) {
            return op.operatorTokens().isEmpty() ? op.keyword() : op.operatorTokens().get(0);
        }
        if (id instanceof IdentOrOp.IdConverter converter) {
            return converter.keyword();
        }
        if (id instanceof IdentOrOp.IdDestructor destructor) {
            return destructor.tilde();
        }
        return ((IdentOrOp.IdTemplateId) id).ident().token();
    }
}
