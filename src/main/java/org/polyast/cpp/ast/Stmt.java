package org.polyast.cpp.ast;

import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

import java.util.List;

/**
 * C/C++ statements. Assignment is an expression, not a statement.
 */
public sealed interface Stmt {

    record CompoundStmt(Compound compound) implements Stmt {}

    record ExprStmt(ExprStatement statement) implements Stmt {}

    /**
     * @param constexprKeyword C++17 {@code constexpr}, or null.
     * @param elseKeyword      null when there is no else branch.
     * @param elseBranch       null when there is no else branch.
     */
    record If(Token keyword, Token constexprKeyword, Delimited<ConditionClause> condition, Stmt thenBranch,
              Token elseKeyword, Stmt elseBranch) implements Stmt {}

    record Switch(Token keyword, Delimited<ConditionClause> condition, Stmt body) implements Stmt {}

    record While(Token keyword, Delimited<ConditionClause> condition, Stmt body) implements Stmt {}

    record DoWhile(Token doKeyword, Stmt body, Token whileKeyword, Delimited<Expr> condition,
                   Token semicolon) implements Stmt {}

    record For(Token keyword, Delimited<ForHeader> header, Stmt body) implements Stmt {}

    /**
     * A macro used as a loop header, e.g. {@code list_for_each(pos, head) { ... }}.
     */
    record MacroIteration(Wrap<String> macro, Delimited<List<Argument>> arguments, Stmt body) implements Stmt {}

    record JumpStmt(Jump jump, Token semicolon) implements Stmt {}

    record Label(Wrap<String> label, Token colon, Stmt body) implements Stmt {}

    record Case(Token keyword, Expr value, Token colon, Stmt body) implements Stmt {}

    /** gcc {@code case 1 ... 5:}. */
    record CaseRange(Token keyword, Expr low, Token dots, Expr high, Token colon, Stmt body) implements Stmt {}

    record Default(Token keyword, Token colon, Stmt body) implements Stmt {}

    record DeclStmt(BlockDeclaration declaration) implements Stmt {}

    record Try(Token keyword, Compound body, List<Handler> handlers) implements Stmt {}

    /** gcc nested function. */
    record NestedFunc(FuncDefinition function) implements Stmt {}

    /** A lone macro used as a statement. */
    record MacroStmt(Token token) implements Stmt {}

    /**
     * A statement construct recognized but not modeled.
     *
     * @param category The construct's category, located at its first token.
     * @param stmts    The sub-statements the parser still built.
     */
    record StmtTodo(Wrap<String> category, List<Stmt> stmts) implements Stmt {}
}
