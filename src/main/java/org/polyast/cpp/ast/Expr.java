package org.polyast.cpp.ast;

import org.polyast.core.resolution.ResolutionCell;
import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * C/C++ expressions. gcc statement expressions make this family mutually recursive with
 * {@link Stmt}; C++ templates make it mutually recursive with {@link Type}.
 */
public sealed interface Expr {

    /**
     * An identifier occurrence: variable, function, enum constant, macro or operator name.
     *
     * @param name       The possibly qualified name.
     * @param resolution Filled by a resolution pass after parsing; never read by traversal.
     */
    record Id(Name name, ResolutionCell resolution) implements Expr {}

    record Literal(Constant constant) implements Expr {}

    record IdSpecial(Wrap<Special> special) implements Expr {}

    record Call(Expr function, Delimited<List<Argument>> arguments) implements Expr {}

    /**
     * @param thenExpr null for the gcc shorthand {@code x ?: y}.
     */
    record CondExpr(Expr condition, Token question, Expr thenExpr, Token colon, Expr elseExpr) implements Expr {}

    /** The comma operator. */
    record Sequence(Expr first, Token comma, Expr second) implements Expr {}

    record Assign(Expr lhs, AssignOp op, Expr rhs) implements Expr {}

    record Prefix(Wrap<FixOp> op, Expr operand) implements Expr {}

    record Postfix(Expr operand, Wrap<FixOp> op) implements Expr {}

    record Unary(Wrap<UnaryOp> op, Expr operand) implements Expr {}

    record Binary(Expr left, Wrap<BinaryOp> op, Expr right) implements Expr {}

    record ArrayAccess(Expr array, Delimited<Expr> index) implements Expr {}

    /** {@code e.name} */
    record RecordAccess(Expr target, Token dot, Name name) implements Expr {}

    /** {@code e->name} */
    record RecordPtAccess(Expr target, Token arrow, Name name) implements Expr {}

    /** {@code e.*member} */
    record RecordStarAccess(Expr target, Token dotStar, Expr member) implements Expr {}

    /** {@code e->*member} */
    record RecordPtStarAccess(Expr target, Token arrowStar, Expr member) implements Expr {}

    record SizeOfExpr(Token keyword, Expr operand) implements Expr {}

    record SizeOfType(Token keyword, Delimited<Type> type) implements Expr {}

    record Cast(Delimited<Type> type, Expr operand) implements Expr {}

    /** gcc {@code ({ ... })}. */
    record StatementExpr(Delimited<Compound> body) implements Expr {}

    /** gcc compound literal {@code (struct point){ 1, 2 }}. */
    record GccConstructor(Delimited<Type> type, Delimited<List<Initialiser>> initialisers) implements Expr {}

    record ConstructedObject(Type type, Delimited<List<Argument>> arguments) implements Expr {}

    record TypeId(Token keyword, Delimited<TypeOrExpr> operand) implements Expr {}

    record CplusplusCast(Wrap<CastOperator> op, Delimited<Type> type, Delimited<Expr> operand) implements Expr {}

    /**
     * @param globalQualifier The leading {@code ::}, or null.
     * @param placement       Placement arguments, or null.
     * @param initializer     Constructor arguments, or null.
     */
    record New(Token globalQualifier, Token keyword, Delimited<List<Argument>> placement, Type type,
               Delimited<List<Argument>> initializer) implements Expr {}

    record Delete(Token globalQualifier, Token keyword, Expr operand) implements Expr {}

    record DeleteArray(Token globalQualifier, Token keyword, Delimited<Void> brackets, Expr operand) implements Expr {}

    /**
     * @param operand null for a rethrow.
     */
    record Throw(Token keyword, Expr operand) implements Expr {}

    record ParenExpr(Delimited<Expr> expr) implements Expr {}

    /** Pattern ellipsis {@code ...}. */
    record Ellipses(Token token) implements Expr {}

    /** Pattern deep ellipsis {@code <... e ...>}. */
    record DeepEllipsis(Delimited<Expr> expr) implements Expr {}

    /** Pattern metavariable constrained by a type, e.g. {@code (int $X)}. */
    record TypedMetavar(Wrap<String> metavar, Type type) implements Expr {}

    /**
     * An expression construct recognized but not modeled.
     *
     * @param category The construct's category, located at its first token.
     * @param exprs    The sub-expressions the parser still built.
     */
    record ExprTodo(Wrap<String> category, List<Expr> exprs) implements Expr {}

    enum Special {
        THIS,
        /** {@code defined} inside a preprocessor condition. */
        DEFINED
    }
}
