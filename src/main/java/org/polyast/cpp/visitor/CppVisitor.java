package org.polyast.cpp.visitor;

import org.polyast.core.config.VisitorSettings;
import org.polyast.core.token.Delimited;
import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;
import org.polyast.cpp.ast.Any;
import org.polyast.cpp.ast.Argument;
import org.polyast.cpp.ast.AssignOp;
import org.polyast.cpp.ast.BaseType;
import org.polyast.cpp.ast.BlockDeclaration;
import org.polyast.cpp.ast.ClassDefinition;
import org.polyast.cpp.ast.ClassMember;
import org.polyast.cpp.ast.Compound;
import org.polyast.cpp.ast.Constant;
import org.polyast.cpp.ast.CppDirective;
import org.polyast.cpp.ast.Declaration;
import org.polyast.cpp.ast.Designator;
import org.polyast.cpp.ast.EnumDefinition;
import org.polyast.cpp.ast.Entity;
import org.polyast.cpp.ast.ExnSpec;
import org.polyast.cpp.ast.Expr;
import org.polyast.cpp.ast.ExprStatement;
import org.polyast.cpp.ast.ForHeader;
import org.polyast.cpp.ast.FuncDefinition;
import org.polyast.cpp.ast.FuncOrElse;
import org.polyast.cpp.ast.FunctionType;
import org.polyast.cpp.ast.Handler;
import org.polyast.cpp.ast.IdentOrOp;
import org.polyast.cpp.ast.Init;
import org.polyast.cpp.ast.Initialiser;
import org.polyast.cpp.ast.Jump;
import org.polyast.cpp.ast.MethodDecl;
import org.polyast.cpp.ast.Name;
import org.polyast.cpp.ast.OneDecl;
import org.polyast.cpp.ast.Operator;
import org.polyast.cpp.ast.Parameter;
import org.polyast.cpp.ast.PointerModifier;
import org.polyast.cpp.ast.Program;
import org.polyast.cpp.ast.Qualifier;
import org.polyast.cpp.ast.Sequencable;
import org.polyast.cpp.ast.Specifier;
import org.polyast.cpp.ast.Stmt;
import org.polyast.cpp.ast.StorageOpt;
import org.polyast.cpp.ast.Type;
import org.polyast.cpp.ast.TypeC;
import org.polyast.cpp.ast.TypeOrExpr;
import org.polyast.cpp.ast.Using;
import org.polyast.cpp.ast.VarsDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Traverses C/C++ trees, handing every node of a hooked family to the matching
 * {@link CppHooks} method before (or instead of) recursing into it.
 *
 * <p>The default recursion of each family visits the node's children left to right in source
 * order and goes through this visitor's public entry points whenever a child belongs to another
 * family, so a hook installed for one family fires wherever that family is reached from. Every
 * node is visited exactly once unless a hook prunes or repeats. The traversal itself has no
 * effect and never fails; all results are accumulated by the hooks.</p>
 *
 * <p>Instances hold no traversal state and may be reused for any number of trees.</p>
 */
public final class CppVisitor {

    private static final Logger log = LoggerFactory.getLogger(CppVisitor.class);

    private final CppHooks hooks;
    private final VisitorSettings settings;

    private final Consumer<Expr> exprK = this::exprChildren;
    private final Consumer<Stmt> stmtK = this::stmtChildren;
    private final Consumer<Type> typeK = this::typeChildren;
    private final Consumer<Name> nameK = this::nameChildren;
    private final Consumer<Declaration> declarationK = this::declarationChildren;
    private final Consumer<BlockDeclaration> blockDeclK = this::blockDeclChildren;
    private final Consumer<OneDecl> oneDeclK = this::oneDeclChildren;
    private final Consumer<FuncDefinition> funcDefK = this::funcDefChildren;
    private final Consumer<ClassDefinition> classDefK = this::classDefChildren;
    private final Consumer<Compound> compoundK = this::compoundChildren;
    private final Consumer<Parameter> parameterK = this::parameterChildren;
    private final Consumer<ClassMember> classMemberK = this::classMemberChildren;
    private final Consumer<CppDirective> cppDirectiveK = this::cppDirectiveChildren;
    private final Consumer<Token> infoK = token -> { };

    private CppVisitor(CppHooks hooks, VisitorSettings settings) {
        this.hooks = hooks;
        this.settings = settings;
        log.debug("Created C++ visitor for hooks {} with {}", hooks.getClass().getName(), settings);
    }

    /**
     * Creates a visitor with the settings of the application's configuration.
     *
     * @param hooks The hooks to run; use {@link CppHooks#DEFAULT} for a plain walk.
     */
    public static CppVisitor of(CppHooks hooks) {
        return new CppVisitor(hooks, VisitorSettings.load());
    }

    /**
     * Creates a visitor with explicit settings, ignoring the application's configuration.
     */
    public static CppVisitor of(CppHooks hooks, VisitorSettings settings) {
        return new CppVisitor(hooks, settings);
    }

    /**
     * Returns the settings this visitor was created with.
     */
    public VisitorSettings settings() {
        return settings;
    }

    // === Hooked families ===

    /**
     * Visits an expression through {@link CppHooks#onExpr}.
     */
    public void visitExpr(Expr expr) {
        hooks.onExpr(expr, exprK, this);
    }

    /**
     * Visits a statement through {@link CppHooks#onStmt}.
     */
    public void visitStmt(Stmt stmt) {
        hooks.onStmt(stmt, stmtK, this);
    }

    /**
     * Visits a type through {@link CppHooks#onType}.
     */
    public void visitType(Type type) {
        hooks.onType(type, typeK, this);
    }

    /**
     * Visits a possibly qualified name through {@link CppHooks#onName}.
     */
    public void visitName(Name name) {
        hooks.onName(name, nameK, this);
    }

    /**
     * Visits a top-level declaration through {@link CppHooks#onDeclaration}.
     */
    public void visitDeclaration(Declaration declaration) {
        hooks.onDeclaration(declaration, declarationK, this);
    }

    /**
     * Visits a block declaration through {@link CppHooks#onBlockDecl}.
     */
    public void visitBlockDecl(BlockDeclaration declaration) {
        hooks.onBlockDecl(declaration, blockDeclK, this);
    }

    /**
     * Visits a single declarator through {@link CppHooks#onOneDecl}.
     */
    public void visitOneDecl(OneDecl declaration) {
        hooks.onOneDecl(declaration, oneDeclK, this);
    }

    /**
     * Visits a function definition through {@link CppHooks#onFuncDef}.
     */
    public void visitFuncDef(FuncDefinition function) {
        hooks.onFuncDef(function, funcDefK, this);
    }

    /**
     * Visits a class definition through {@link CppHooks#onClassDef}.
     */
    public void visitClassDef(ClassDefinition definition) {
        hooks.onClassDef(definition, classDefK, this);
    }

    /**
     * Visits a braced block through {@link CppHooks#onCompound}.
     */
    public void visitCompound(Compound compound) {
        hooks.onCompound(compound, compoundK, this);
    }

    /**
     * Visits a parameter through {@link CppHooks#onParameter}.
     */
    public void visitParameter(Parameter parameter) {
        hooks.onParameter(parameter, parameterK, this);
    }

    /**
     * Visits a class member through {@link CppHooks#onClassMember}.
     */
    public void visitClassMember(ClassMember member) {
        hooks.onClassMember(member, classMemberK, this);
    }

    /**
     * Visits a preprocessor directive through {@link CppHooks#onCppDirective}.
     */
    public void visitCppDirective(CppDirective directive) {
        hooks.onCppDirective(directive, cppDirectiveK, this);
    }

    /**
     * Hands a token to {@link CppHooks#onInfo}, whatever the token setting says.
     */
    public void visitInfo(Token token) {
        hooks.onInfo(token, infoK, this);
    }

    // === Entry points without a hook of their own ===

    /**
     * Visits every top-level element of {@code program} in order.
     */
    public void visitProgram(Program program) {
        program.toplevels().forEach(this::visitToplevel);
    }

    /**
     * Visits a top-level element, which is a declaration or a preprocessor item.
     */
    public void visitToplevel(Sequencable<Declaration> toplevel) {
        sequencable(toplevel, this::visitDeclaration);
    }

    /**
     * Visits the tokens of a literal.
     */
    public void visitConstant(Constant constant) {
        if (constant instanceof Constant.IntLit lit) {
            wrap(lit.value());
        } else if (constant instanceof Constant.FloatLit lit) {
            wrap(lit.value());
        } else if (constant instanceof Constant.CharLit lit) {
            wrap(lit.value());
        } else if (constant instanceof Constant.StringLit lit) {
            wrap(lit.value());
        } else if (constant instanceof Constant.MultiString multi) {
            multi.parts().forEach(this::wrap);
        } else if (constant instanceof Constant.BoolLit lit) {
            wrap(lit.value());
        } else if (constant instanceof Constant.Nullptr nullptr) {
            token(nullptr.token());
        }
    }

    /**
     * Visits a call or macro argument.
     */
    public void visitArgument(Argument argument) {
        if (argument instanceof Argument.Arg arg) {
            visitExpr(arg.expr());
        } else if (argument instanceof Argument.ArgType arg) {
            visitType(arg.type());
        } else if (argument instanceof Argument.ArgAction action) {
            action.tokens().forEach(this::token);
        }
    }

    /**
     * Visits an initialiser, including nested brace lists and designators.
     */
    public void visitInitialiser(Initialiser initialiser) {
        if (initialiser instanceof Initialiser.InitExpr init) {
            visitExpr(init.expr());
        } else if (initialiser instanceof Initialiser.InitList list) {
            delimited(list.elements(), elements -> elements.forEach(this::visitInitialiser));
        } else if (initialiser instanceof Initialiser.InitDesignators init) {
            init.designators().forEach(this::designator);
            token(init.eq());
            visitInitialiser(init.value());
        } else if (initialiser instanceof Initialiser.InitFieldOld init) {
            wrap(init.field());
            token(init.colon());
            visitInitialiser(init.value());
        } else if (initialiser instanceof Initialiser.InitIndexOld init) {
            delimited(init.index(), this::visitExpr);
            visitInitialiser(init.value());
        }
    }

    /**
     * Visits whichever fragment {@code any} carries.
     */
    public void visitAny(Any any) {
        if (any instanceof Any.ExprAny a) {
            visitExpr(a.expr());
        } else if (any instanceof Any.StmtAny a) {
            visitStmt(a.stmt());
        } else if (any instanceof Any.StmtsAny a) {
            a.stmts().forEach(this::visitStmt);
        } else if (any instanceof Any.ToplevelAny a) {
            visitToplevel(a.toplevel());
        } else if (any instanceof Any.ToplevelsAny a) {
            a.toplevels().forEach(this::visitToplevel);
        } else if (any instanceof Any.ProgramAny a) {
            visitProgram(a.program());
        } else if (any instanceof Any.CppAny a) {
            visitCppDirective(a.directive());
        } else if (any instanceof Any.TypeAny a) {
            visitType(a.type());
        } else if (any instanceof Any.NameAny a) {
            visitName(a.name());
        } else if (any instanceof Any.OneDeclAny a) {
            visitOneDecl(a.declaration());
        } else if (any instanceof Any.InitAny a) {
            visitInitialiser(a.initialiser());
        } else if (any instanceof Any.BlockDeclAny a) {
            visitBlockDecl(a.declaration());
        } else if (any instanceof Any.ClassMemberAny a) {
            visitClassMember(a.member());
        } else if (any instanceof Any.ConstantAny a) {
            visitConstant(a.constant());
        } else if (any instanceof Any.ArgumentAny a) {
            visitArgument(a.argument());
        } else if (any instanceof Any.ParameterAny a) {
            visitParameter(a.parameter());
        } else if (any instanceof Any.BodyAny a) {
            visitCompound(a.body());
        } else if (any instanceof Any.InfoAny a) {
            visitInfo(a.token());
        } else if (any instanceof Any.InfoListAny a) {
            a.tokens().forEach(this::visitInfo);
        }
    }

    // === Default recursion: expressions ===

    private void exprChildren(Expr expr) {
        if (expr instanceof Expr.Id id) {
            visitName(id.name());
        } else if (expr instanceof Expr.Literal literal) {
            visitConstant(literal.constant());
        } else if (expr instanceof Expr.IdSpecial special) {
            wrap(special.special());
        } else if (expr instanceof Expr.Call call) {
            visitExpr(call.function());
            arguments(call.arguments());
        } else if (expr instanceof Expr.CondExpr cond) {
            visitExpr(cond.condition());
            token(cond.question());
            optExpr(cond.thenExpr());
            token(cond.colon());
            visitExpr(cond.elseExpr());
        } else if (expr instanceof Expr.Sequence sequence) {
            visitExpr(sequence.first());
            token(sequence.comma());
            visitExpr(sequence.second());
        } else if (expr instanceof Expr.Assign assign) {
            visitExpr(assign.lhs());
            assignOp(assign.op());
            visitExpr(assign.rhs());
        } else if (expr instanceof Expr.Prefix prefix) {
            wrap(prefix.op());
            visitExpr(prefix.operand());
        } else if (expr instanceof Expr.Postfix postfix) {
            visitExpr(postfix.operand());
            wrap(postfix.op());
        } else if (expr instanceof Expr.Unary unary) {
            wrap(unary.op());
            visitExpr(unary.operand());
        } else if (expr instanceof Expr.Binary binary) {
            visitExpr(binary.left());
            wrap(binary.op());
            visitExpr(binary.right());
        } else if (expr instanceof Expr.ArrayAccess access) {
            visitExpr(access.array());
            delimited(access.index(), this::visitExpr);
        } else if (expr instanceof Expr.RecordAccess access) {
            visitExpr(access.target());
            token(access.dot());
            visitName(access.name());
        } else if (expr instanceof Expr.RecordPtAccess access) {
            visitExpr(access.target());
            token(access.arrow());
            visitName(access.name());
        } else if (expr instanceof Expr.RecordStarAccess access) {
            visitExpr(access.target());
            token(access.dotStar());
            visitExpr(access.member());
        } else if (expr instanceof Expr.RecordPtStarAccess access) {
            visitExpr(access.target());
            token(access.arrowStar());
            visitExpr(access.member());
        } else if (expr instanceof Expr.SizeOfExpr sizeOf) {
            token(sizeOf.keyword());
            visitExpr(sizeOf.operand());
        } else if (expr instanceof Expr.SizeOfType sizeOf) {
            token(sizeOf.keyword());
            delimited(sizeOf.type(), this::visitType);
        } else if (expr instanceof Expr.Cast cast) {
            delimited(cast.type(), this::visitType);
            visitExpr(cast.operand());
        } else if (expr instanceof Expr.StatementExpr statementExpr) {
            delimited(statementExpr.body(), this::visitCompound);
        } else if (expr instanceof Expr.GccConstructor constructor) {
            delimited(constructor.type(), this::visitType);
            delimited(constructor.initialisers(), inits -> inits.forEach(this::visitInitialiser));
        } else if (expr instanceof Expr.ConstructedObject constructed) {
            visitType(constructed.type());
            arguments(constructed.arguments());
        } else if (expr instanceof Expr.TypeId typeId) {
            token(typeId.keyword());
            delimited(typeId.operand(), this::typeOrExpr);
        } else if (expr instanceof Expr.CplusplusCast cast) {
            wrap(cast.op());
            delimited(cast.type(), this::visitType);
            delimited(cast.operand(), this::visitExpr);
        } else if (expr instanceof Expr.New newExpr) {
            token(newExpr.globalQualifier());
            token(newExpr.keyword());
            arguments(newExpr.placement());
            visitType(newExpr.type());
            arguments(newExpr.initializer());
        } else if (expr instanceof Expr.Delete delete) {
            token(delete.globalQualifier());
            token(delete.keyword());
            visitExpr(delete.operand());
        } else if (expr instanceof Expr.DeleteArray delete) {
            token(delete.globalQualifier());
            token(delete.keyword());
            delimited(delete.brackets(), nothing -> { });
            visitExpr(delete.operand());
        } else if (expr instanceof Expr.Throw throwExpr) {
            token(throwExpr.keyword());
            optExpr(throwExpr.operand());
        } else if (expr instanceof Expr.ParenExpr paren) {
            delimited(paren.expr(), this::visitExpr);
        } else if (expr instanceof Expr.Ellipses ellipses) {
            token(ellipses.token());
        } else if (expr instanceof Expr.DeepEllipsis deep) {
            delimited(deep.expr(), this::visitExpr);
        } else if (expr instanceof Expr.TypedMetavar metavar) {
            wrap(metavar.metavar());
            visitType(metavar.type());
        } else if (expr instanceof Expr.ExprTodo todo) {
            traceTodo("expression", todo.category(), todo.exprs().size());
            wrap(todo.category());
            todo.exprs().forEach(this::visitExpr);
        }
    }

    private void assignOp(AssignOp op) {
        if (op instanceof AssignOp.SimpleAssign simple) {
            token(simple.token());
        } else if (op instanceof AssignOp.OpAssign opAssign) {
            wrap(opAssign.op());
        }
    }

    private void arguments(Delimited<List<Argument>> arguments) {
        delimited(arguments, args -> args.forEach(this::visitArgument));
    }

    private void typeOrExpr(TypeOrExpr typeOrExpr) {
        if (typeOrExpr instanceof TypeOrExpr.OfType ofType) {
            visitType(ofType.type());
        } else if (typeOrExpr instanceof TypeOrExpr.OfExpr ofExpr) {
            visitExpr(ofExpr.expr());
        }
    }

    private void designator(Designator designator) {
        if (designator instanceof Designator.DesignatorField field) {
            token(field.dot());
            wrap(field.field());
        } else if (designator instanceof Designator.DesignatorIndex index) {
            delimited(index.index(), this::visitExpr);
        } else if (designator instanceof Designator.DesignatorRange range) {
            token(range.open());
            visitExpr(range.low());
            token(range.dots());
            visitExpr(range.high());
            token(range.close());
        }
    }

    // === Default recursion: statements ===

    private void stmtChildren(Stmt stmt) {
        if (stmt instanceof Stmt.CompoundStmt compound) {
            visitCompound(compound.compound());
        } else if (stmt instanceof Stmt.ExprStmt exprStmt) {
            exprStatement(exprStmt.statement());
        } else if (stmt instanceof Stmt.If ifStmt) {
            token(ifStmt.keyword());
            token(ifStmt.constexprKeyword());
            delimited(ifStmt.condition(), clause -> visitExpr(clause.expr()));
            visitStmt(ifStmt.thenBranch());
            token(ifStmt.elseKeyword());
            optStmt(ifStmt.elseBranch());
        } else if (stmt instanceof Stmt.Switch switchStmt) {
            token(switchStmt.keyword());
            delimited(switchStmt.condition(), clause -> visitExpr(clause.expr()));
            visitStmt(switchStmt.body());
        } else if (stmt instanceof Stmt.While whileStmt) {
            token(whileStmt.keyword());
            delimited(whileStmt.condition(), clause -> visitExpr(clause.expr()));
            visitStmt(whileStmt.body());
        } else if (stmt instanceof Stmt.DoWhile doWhile) {
            token(doWhile.doKeyword());
            visitStmt(doWhile.body());
            token(doWhile.whileKeyword());
            delimited(doWhile.condition(), this::visitExpr);
            token(doWhile.semicolon());
        } else if (stmt instanceof Stmt.For forStmt) {
            token(forStmt.keyword());
            delimited(forStmt.header(), this::forHeader);
            visitStmt(forStmt.body());
        } else if (stmt instanceof Stmt.MacroIteration iteration) {
            wrap(iteration.macro());
            arguments(iteration.arguments());
            visitStmt(iteration.body());
        } else if (stmt instanceof Stmt.JumpStmt jumpStmt) {
            jump(jumpStmt.jump());
            token(jumpStmt.semicolon());
        } else if (stmt instanceof Stmt.Label label) {
            wrap(label.label());
            token(label.colon());
            visitStmt(label.body());
        } else if (stmt instanceof Stmt.Case caseStmt) {
            token(caseStmt.keyword());
            visitExpr(caseStmt.value());
            token(caseStmt.colon());
            visitStmt(caseStmt.body());
        } else if (stmt instanceof Stmt.CaseRange range) {
            token(range.keyword());
            visitExpr(range.low());
            token(range.dots());
            visitExpr(range.high());
            token(range.colon());
            visitStmt(range.body());
        } else if (stmt instanceof Stmt.Default defaultStmt) {
            token(defaultStmt.keyword());
            token(defaultStmt.colon());
            visitStmt(defaultStmt.body());
        } else if (stmt instanceof Stmt.DeclStmt declStmt) {
            visitBlockDecl(declStmt.declaration());
        } else if (stmt instanceof Stmt.Try tryStmt) {
            token(tryStmt.keyword());
            visitCompound(tryStmt.body());
            tryStmt.handlers().forEach(this::handler);
        } else if (stmt instanceof Stmt.NestedFunc nested) {
            visitFuncDef(nested.function());
        } else if (stmt instanceof Stmt.MacroStmt macro) {
            token(macro.token());
        } else if (stmt instanceof Stmt.StmtTodo todo) {
            traceTodo("statement", todo.category(), todo.stmts().size());
            wrap(todo.category());
            todo.stmts().forEach(this::visitStmt);
        }
    }

    private void exprStatement(ExprStatement statement) {
        optExpr(statement.expr());
        token(statement.semicolon());
    }

    private void forHeader(ForHeader header) {
        if (header instanceof ForHeader.Classic classic) {
            ForHeader.ForInit init = classic.init();
            if (init instanceof ForHeader.ForInit.ExprInit exprInit) {
                exprStatement(exprInit.statement());
            } else if (init instanceof ForHeader.ForInit.VarsInit varsInit) {
                varsDecl(varsInit.declarations());
            }
            optExpr(classic.condition());
            optExpr(classic.step());
        } else if (header instanceof ForHeader.Range range) {
            entity(range.entity());
            visitType(range.type());
            token(range.colon());
            visitInitialiser(range.range());
        }
    }

    private void jump(Jump jump) {
        if (jump instanceof Jump.Goto gotoJump) {
            token(gotoJump.keyword());
            wrap(gotoJump.label());
        } else if (jump instanceof Jump.Continue continueJump) {
            token(continueJump.keyword());
        } else if (jump instanceof Jump.Break breakJump) {
            token(breakJump.keyword());
        } else if (jump instanceof Jump.Return returnJump) {
            token(returnJump.keyword());
            optExpr(returnJump.value());
        } else if (jump instanceof Jump.GotoComputed computed) {
            token(computed.keyword());
            token(computed.star());
            visitExpr(computed.target());
        }
    }

    private void handler(Handler handler) {
        token(handler.catchKeyword());
        delimited(handler.declarations(), declarations -> declarations.forEach(declaration -> {
            if (declaration instanceof Handler.ExceptionDeclaration.ExnDecl exnDecl) {
                visitParameter(exnDecl.parameter());
            } else if (declaration instanceof Handler.ExceptionDeclaration.ExnDeclEllipsis ellipsis) {
                token(ellipsis.ellipsis());
            }
        }));
        visitCompound(handler.body());
    }

    private void compoundChildren(Compound compound) {
        delimited(compound.body(), stmts -> stmts.forEach(stmt -> sequencable(stmt, this::visitStmt)));
    }

    private <T> void sequencable(Sequencable<T> sequencable, Consumer<T> item) {
        if (sequencable instanceof Sequencable.Item<T> node) {
            item.accept(node.node());
        } else if (sequencable instanceof Sequencable.Directive<T> directive) {
            visitCppDirective(directive.directive());
        } else if (sequencable instanceof Sequencable.Ifdef<T> ifdef) {
            token(ifdef.directive().token());
        } else if (sequencable instanceof Sequencable.MacroTop<T> macro) {
            wrap(macro.macro());
            arguments(macro.arguments());
            token(macro.semicolon());
        } else if (sequencable instanceof Sequencable.MacroVarTop<T> macro) {
            wrap(macro.macro());
            token(macro.semicolon());
        }
    }

    // === Default recursion: types and names ===

    private void typeChildren(Type type) {
        type.qualifiers().forEach(this::wrap);
        typeC(type.typeC());
    }

    private void typeC(TypeC typeC) {
        if (typeC instanceof TypeC.TBase base) {
            baseType(base.base());
        } else if (typeC instanceof TypeC.TPointer pointer) {
            token(pointer.star());
            visitType(pointer.pointee());
            pointer.modifiers().forEach(this::pointerModifier);
        } else if (typeC instanceof TypeC.TReference reference) {
            token(reference.ampersand());
            visitType(reference.referee());
        } else if (typeC instanceof TypeC.TRefRef reference) {
            token(reference.ampersands());
            visitType(reference.referee());
        } else if (typeC instanceof TypeC.TArray array) {
            delimited(array.size(), this::visitExpr);
            visitType(array.element());
        } else if (typeC instanceof TypeC.TFunction function) {
            functionType(function.function());
        } else if (typeC instanceof TypeC.EnumName enumName) {
            token(enumName.enumKeyword());
            wrap(enumName.name());
        } else if (typeC instanceof TypeC.ClassName className) {
            wrap(className.key());
            wrap(className.name());
        } else if (typeC instanceof TypeC.TypeName typeName) {
            visitName(typeName.name());
        } else if (typeC instanceof TypeC.TypenameKwd typename) {
            token(typename.typenameKeyword());
            visitType(typename.type());
        } else if (typeC instanceof TypeC.EnumDef enumDef) {
            enumDefinition(enumDef.definition());
        } else if (typeC instanceof TypeC.ClassDef classDef) {
            visitClassDef(classDef.definition());
        } else if (typeC instanceof TypeC.TypeOf typeOf) {
            token(typeOf.keyword());
            delimited(typeOf.operand(), this::typeOrExpr);
        } else if (typeC instanceof TypeC.TAuto auto) {
            token(auto.autoKeyword());
        } else if (typeC instanceof TypeC.ParenType paren) {
            delimited(paren.type(), this::visitType);
        } else if (typeC instanceof TypeC.TypeTodo todo) {
            traceTodo("type", todo.category(), todo.types().size());
            wrap(todo.category());
            todo.types().forEach(this::visitType);
        }
    }

    private void baseType(BaseType base) {
        if (base instanceof BaseType.VoidType voidType) {
            token(voidType.token());
        } else if (base instanceof BaseType.IntegerType integer) {
            token(integer.token());
        } else if (base instanceof BaseType.FloatingType floating) {
            token(floating.token());
        }
    }

    private void pointerModifier(PointerModifier modifier) {
        if (modifier instanceof PointerModifier.Based based) {
            token(based.keyword());
            arguments(based.arguments());
        } else if (modifier instanceof PointerModifier.PtrRestrict restrict) {
            token(restrict.keyword());
        } else if (modifier instanceof PointerModifier.Uptr uptr) {
            token(uptr.keyword());
        } else if (modifier instanceof PointerModifier.Sptr sptr) {
            token(sptr.keyword());
        } else if (modifier instanceof PointerModifier.Unaligned unaligned) {
            token(unaligned.keyword());
        }
    }

    private void functionType(FunctionType function) {
        visitType(function.returnType());
        delimited(function.parameters(), params -> params.forEach(this::visitParameter));
        if (function.variadic() != null) {
            token(function.variadic().comma());
            token(function.variadic().ellipsis());
        }
        token(function.constQualifier());
        exnSpec(function.exnSpec());
    }

    private void exnSpec(ExnSpec exnSpec) {
        if (exnSpec instanceof ExnSpec.ThrowSpec throwSpec) {
            token(throwSpec.keyword());
            delimited(throwSpec.types(), types -> types.forEach(this::visitType));
        } else if (exnSpec instanceof ExnSpec.Noexcept noexcept) {
            token(noexcept.keyword());
            delimited(noexcept.condition(), this::visitExpr);
        }
    }

    private void nameChildren(Name name) {
        token(name.globalQualifier());
        name.qualifiers().forEach(this::qualifier);
        identOrOp(name.id());
    }

    private void qualifier(Qualifier qualifier) {
        if (qualifier instanceof Qualifier.QClassname classname) {
            wrap(classname.ident());
        } else if (qualifier instanceof Qualifier.QTemplateId template) {
            wrap(template.ident());
            templateArguments(template.arguments());
        }
    }

    private void identOrOp(IdentOrOp id) {
        if (id instanceof IdentOrOp.IdIdent ident) {
            wrap(ident.ident());
        } else if (id instanceof IdentOrOp.IdTemplateId template) {
            wrap(template.ident());
            templateArguments(template.arguments());
        } else if (id instanceof IdentOrOp.IdDestructor destructor) {
            token(destructor.tilde());
            wrap(destructor.ident());
        } else if (id instanceof IdentOrOp.IdOperator op) {
            token(op.keyword());
            operator(op.operator());
            op.operatorTokens().forEach(this::token);
        } else if (id instanceof IdentOrOp.IdConverter converter) {
            token(converter.keyword());
            visitType(converter.type());
        }
    }

    private void operator(Operator operator) {
        if (operator instanceof Operator.AssignOperator assign) {
            assignOp(assign.op());
        }
    }

    private void templateArguments(Delimited<List<TypeOrExpr>> arguments) {
        delimited(arguments, args -> args.forEach(this::typeOrExpr));
    }

    // === Default recursion: declarations ===

    private void declarationChildren(Declaration declaration) {
        if (declaration instanceof Declaration.BlockDecl blockDecl) {
            visitBlockDecl(blockDecl.declaration());
        } else if (declaration instanceof Declaration.Func func) {
            funcOrElse(func.function());
        } else if (declaration instanceof Declaration.TemplateDecl template) {
            token(template.templateKeyword());
            delimited(template.parameters(), params -> params.forEach(this::visitParameter));
            visitDeclaration(template.declaration());
        } else if (declaration instanceof Declaration.TemplateSpecialization specialization) {
            token(specialization.templateKeyword());
            delimited(specialization.angles(), nothing -> { });
            visitDeclaration(specialization.declaration());
        } else if (declaration instanceof Declaration.ExternC externC) {
            token(externC.externKeyword());
            token(externC.linkage());
            visitDeclaration(externC.declaration());
        } else if (declaration instanceof Declaration.ExternCList externC) {
            token(externC.externKeyword());
            token(externC.linkage());
            delimited(externC.declarations(), decls -> decls.forEach(this::visitToplevel));
        } else if (declaration instanceof Declaration.NameSpace namespace) {
            token(namespace.namespaceKeyword());
            wrap(namespace.name());
            delimited(namespace.declarations(), decls -> decls.forEach(this::visitToplevel));
        } else if (declaration instanceof Declaration.NameSpaceExtend extend) {
            extend.declarations().forEach(this::visitToplevel);
        } else if (declaration instanceof Declaration.NameSpaceAnon namespace) {
            token(namespace.namespaceKeyword());
            delimited(namespace.declarations(), decls -> decls.forEach(this::visitToplevel));
        } else if (declaration instanceof Declaration.EmptyDef empty) {
            token(empty.semicolon());
        } else if (declaration instanceof Declaration.NotParsedCorrectly notParsed) {
            notParsed.tokens().forEach(this::token);
        } else if (declaration instanceof Declaration.DeclTodo todo) {
            traceTodo("declaration", todo.category(), 0);
            wrap(todo.category());
        }
    }

    private void funcOrElse(FuncOrElse function) {
        visitFuncDef(function.definition());
    }

    private void funcDefChildren(FuncDefinition function) {
        entity(function.entity());
        functionType(function.type());
        storage(function.storage());
        visitCompound(function.body());
    }

    private void entity(Entity entity) {
        visitName(entity.name());
        entity.specs().forEach(this::specifier);
    }

    private void storage(StorageOpt storage) {
        if (storage instanceof StorageOpt.StoTypedef typedef) {
            token(typedef.typedefKeyword());
        } else if (storage instanceof StorageOpt.Sto sto) {
            wrap(sto.storage());
        }
    }

    private void parameterChildren(Parameter parameter) {
        wrap(parameter.name());
        visitType(parameter.type());
        token(parameter.registerKeyword());
        parameter.specs().forEach(this::specifier);
        token(parameter.defaultEq());
        optExpr(parameter.defaultValue());
    }

    private void blockDeclChildren(BlockDeclaration declaration) {
        if (declaration instanceof BlockDeclaration.DeclList declList) {
            varsDecl(declList.vars());
        } else if (declaration instanceof BlockDeclaration.MacroDecl macro) {
            macro.storage().forEach(this::token);
            wrap(macro.macro());
            arguments(macro.arguments());
            token(macro.semicolon());
        } else if (declaration instanceof BlockDeclaration.UsingDecl usingDecl) {
            using(usingDecl.using());
        } else if (declaration instanceof BlockDeclaration.NameSpaceAlias alias) {
            token(alias.namespaceKeyword());
            wrap(alias.alias());
            token(alias.eq());
            visitType(alias.target());
            token(alias.semicolon());
        } else if (declaration instanceof BlockDeclaration.Asm asm) {
            token(asm.keyword());
            token(asm.volatileKeyword());
            delimited(asm.body(), this::asmBody);
            token(asm.semicolon());
        }
    }

    private void asmBody(BlockDeclaration.AsmBody body) {
        body.template().forEach(this::wrap);
        for (BlockDeclaration.Colon colon : body.colons()) {
            token(colon.colon());
            for (BlockDeclaration.ColonOption option : colon.options()) {
                if (option instanceof BlockDeclaration.ColonOption.ColonExpr colonExpr) {
                    colonExpr.constraint().forEach(this::token);
                    delimited(colonExpr.expr(), this::visitExpr);
                } else if (option instanceof BlockDeclaration.ColonOption.ColonMisc misc) {
                    misc.tokens().forEach(this::token);
                }
            }
        }
    }

    private void varsDecl(VarsDecl vars) {
        vars.declarations().forEach(this::visitOneDecl);
        token(vars.semicolon());
    }

    private void oneDeclChildren(OneDecl declaration) {
        if (declaration.name() != null) {
            visitName(declaration.name());
        }
        init(declaration.init());
        visitType(declaration.type());
        storage(declaration.storage());
    }

    private void init(Init init) {
        if (init instanceof Init.EqInit eqInit) {
            token(eqInit.eq());
            visitInitialiser(eqInit.value());
        } else if (init instanceof Init.ObjInit objInit) {
            arguments(objInit.arguments());
        }
    }

    private void using(Using using) {
        token(using.usingKeyword());
        Using.Kind kind = using.kind();
        if (kind instanceof Using.Kind.UsingName usingName) {
            visitName(usingName.name());
        } else if (kind instanceof Using.Kind.UsingNamespace usingNamespace) {
            token(usingNamespace.namespaceKeyword());
            visitName(usingNamespace.namespace());
        } else if (kind instanceof Using.Kind.UsingAlias alias) {
            wrap(alias.alias());
            token(alias.eq());
            visitType(alias.type());
        }
        token(using.semicolon());
    }

    private void enumDefinition(EnumDefinition definition) {
        token(definition.enumKeyword());
        wrap(definition.name());
        delimited(definition.elements(), elements -> elements.forEach(element -> {
            wrap(element.name());
            token(element.eq());
            optExpr(element.value());
        }));
    }

    private void classDefChildren(ClassDefinition definition) {
        if (definition.name() != null) {
            visitName(definition.name());
        }
        wrap(definition.key());
        for (ClassDefinition.BaseClause base : definition.bases()) {
            visitName(base.name());
            token(base.virtualKeyword());
            wrap(base.access());
        }
        delimited(definition.members(), members ->
            members.forEach(member -> sequencable(member, this::visitClassMember)));
    }

    private void classMemberChildren(ClassMember member) {
        if (member instanceof ClassMember.Access access) {
            wrap(access.spec());
            token(access.colon());
        } else if (member instanceof ClassMember.MemberField field) {
            field.fields().forEach(this::fieldKind);
            token(field.semicolon());
        } else if (member instanceof ClassMember.MemberFunc func) {
            funcOrElse(func.function());
        } else if (member instanceof ClassMember.MemberDecl decl) {
            methodDecl(decl.declaration());
        } else if (member instanceof ClassMember.QualifiedIdInClass qualified) {
            visitName(qualified.name());
            token(qualified.semicolon());
        } else if (member instanceof ClassMember.TemplateDeclInClass template) {
            token(template.templateKeyword());
            delimited(template.parameters(), params -> params.forEach(this::visitParameter));
            visitDeclaration(template.declaration());
        } else if (member instanceof ClassMember.UsingDeclInClass usingDecl) {
            using(usingDecl.using());
        } else if (member instanceof ClassMember.EmptyField empty) {
            token(empty.semicolon());
        }
    }

    private void fieldKind(ClassMember.FieldKind field) {
        if (field instanceof ClassMember.FieldKind.FieldDecl decl) {
            visitOneDecl(decl.declaration());
        } else if (field instanceof ClassMember.FieldKind.BitField bitField) {
            wrap(bitField.name());
            token(bitField.colon());
            visitType(bitField.type());
            visitExpr(bitField.width());
        }
    }

    private void methodDecl(MethodDecl decl) {
        if (decl instanceof MethodDecl.Method method) {
            visitOneDecl(method.declaration());
            token(method.pureEq());
            token(method.pureZero());
            token(method.semicolon());
        } else if (decl instanceof MethodDecl.ConstructorDecl constructor) {
            wrap(constructor.name());
            delimited(constructor.parameters(), params -> params.forEach(this::visitParameter));
            token(constructor.semicolon());
        } else if (decl instanceof MethodDecl.DestructorDecl destructor) {
            token(destructor.tilde());
            wrap(destructor.name());
            delimited(destructor.voidParameter(), this::token);
            exnSpec(destructor.exnSpec());
            token(destructor.semicolon());
        }
    }

    private void specifier(Specifier specifier) {
        if (specifier instanceof Specifier.AttributeSpec attributeSpec) {
            attribute(attributeSpec.attribute());
        } else if (specifier instanceof Specifier.ModifierSpec modifierSpec) {
            modifier(modifierSpec.modifier());
        } else if (specifier instanceof Specifier.QualifierSpec qualifierSpec) {
            wrap(qualifierSpec.qualifier());
        } else if (specifier instanceof Specifier.StorageSpec storageSpec) {
            wrap(storageSpec.storage());
        }
    }

    private void attribute(Specifier.Attribute attribute) {
        if (attribute instanceof Specifier.Attribute.UnderscoresAttr underscores) {
            token(underscores.keyword());
            delimited(underscores.arguments(), this::arguments);
        } else if (attribute instanceof Specifier.Attribute.BracketsAttr brackets) {
            delimited(brackets.exprs(), exprs -> exprs.forEach(this::visitExpr));
        } else if (attribute instanceof Specifier.Attribute.DeclSpec declSpec) {
            token(declSpec.keyword());
            delimited(declSpec.id(), this::wrap);
        }
    }

    private void modifier(Specifier.Modifier modifier) {
        if (modifier instanceof Specifier.Modifier.Inline inline) {
            token(inline.keyword());
        } else if (modifier instanceof Specifier.Modifier.Virtual virtual) {
            token(virtual.keyword());
        } else if (modifier instanceof Specifier.Modifier.Final finalModifier) {
            token(finalModifier.keyword());
        } else if (modifier instanceof Specifier.Modifier.Override override) {
            token(override.keyword());
        } else if (modifier instanceof Specifier.Modifier.MsCall msCall) {
            wrap(msCall.convention());
        } else if (modifier instanceof Specifier.Modifier.Explicit explicit) {
            token(explicit.keyword());
            delimited(explicit.condition(), this::visitExpr);
        }
    }

    // === Default recursion: preprocessor ===

    private void cppDirectiveChildren(CppDirective directive) {
        if (directive instanceof CppDirective.Define define) {
            token(define.keyword());
            wrap(define.macro());
            if (define.kind() instanceof CppDirective.DefineKind.DefineMacro macro) {
                delimited(macro.parameters(), params -> params.forEach(this::wrap));
            }
            defineVal(define.body());
        } else if (directive instanceof CppDirective.Include include) {
            token(include.keyword());
            CppDirective.IncludeKind target = include.target();
            if (target instanceof CppDirective.IncludeKind.IncLocal local) {
                wrap(local.path());
            } else if (target instanceof CppDirective.IncludeKind.IncSystem system) {
                wrap(system.path());
            } else if (target instanceof CppDirective.IncludeKind.IncOther other) {
                visitExpr(other.expr());
            }
        } else if (directive instanceof CppDirective.Undef undef) {
            wrap(undef.macro());
        } else if (directive instanceof CppDirective.PragmaAndCo pragma) {
            token(pragma.token());
        }
    }

    private void defineVal(CppDirective.DefineVal body) {
        if (body instanceof CppDirective.DefineVal.DefineExpr defineExpr) {
            visitExpr(defineExpr.expr());
        } else if (body instanceof CppDirective.DefineVal.DefineStmt defineStmt) {
            visitStmt(defineStmt.stmt());
        } else if (body instanceof CppDirective.DefineVal.DefineType defineType) {
            visitType(defineType.type());
        } else if (body instanceof CppDirective.DefineVal.DefineFunction defineFunction) {
            visitFuncDef(defineFunction.function());
        } else if (body instanceof CppDirective.DefineVal.DefineInit defineInit) {
            visitInitialiser(defineInit.initialiser());
        } else if (body instanceof CppDirective.DefineVal.DefineDoWhileZero doWhile) {
            token(doWhile.doKeyword());
            visitStmt(doWhile.body());
            token(doWhile.whileKeyword());
            delimited(doWhile.zero(), this::token);
        } else if (body instanceof CppDirective.DefineVal.DefinePrintWrapper wrapper) {
            token(wrapper.ifKeyword());
            delimited(wrapper.condition(), this::visitExpr);
            visitName(wrapper.printer());
        } else if (body instanceof CppDirective.DefineVal.DefineTodo todo) {
            traceTodo("macro body", todo.category(), 0);
            wrap(todo.category());
        }
    }

    // === Leaves ===

    private void token(Token token) {
        if (token != null && settings.visitTokens()) {
            visitInfo(token);
        }
    }

    private void wrap(Wrap<?> wrap) {
        if (wrap != null) {
            token(wrap.token());
        }
    }

    private <T> void delimited(Delimited<T> delimited, Consumer<T> inner) {
        if (delimited == null) {
            return;
        }
        token(delimited.open());
        if (delimited.value() != null) {
            inner.accept(delimited.value());
        }
        token(delimited.close());
    }

    private void optExpr(Expr expr) {
        if (expr != null) {
            visitExpr(expr);
        }
    }

    private void optStmt(Stmt stmt) {
        if (stmt != null) {
            visitStmt(stmt);
        }
    }

    private void traceTodo(String family, Wrap<String> category, int children) {
        if (settings.traceTodo()) {
            log.debug("Visiting unmodeled {} '{}' at {} with {} recovered children",
                family, category.value(), category.token().location(), children);
        }
    }
}
