package ast;

import ast.expr.BinaryExpr;
import ast.expr.BoolLiteral;
import ast.expr.CallExpr;
import ast.expr.Expression;
import ast.expr.IntLiteral;
import ast.expr.UnaryExpr;
import ast.expr.VarRef;
import ast.stmt.AssignStatement;
import ast.stmt.BlockStatement;
import ast.stmt.BreakStatement;
import ast.stmt.DoWhileStatement;
import ast.stmt.ExpressionStatement;
import ast.stmt.IfStatement;
import ast.stmt.ReturnStatement;
import ast.stmt.Statement;
import ast.stmt.WhileStatement;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Factory for statements and expressions of one {@link ASTContext}. Rewrite
 * rules fabricate nodes only through this class so that derived expressions
 * always inherit provenance.
 */
public class Builder {
    private final ASTContext ctx;
    private final Provenance provenance;

    public Builder(ASTContext ctx, Provenance provenance) {
        this.ctx = ctx;
        this.provenance = provenance;
    }

    public ASTContext getContext() {
        return ctx;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    // --- statements ---

    public BlockStatement createBlock(List<? extends Statement> stmts) {
        List<Integer> slots = new ArrayList<>(stmts.size());
        for (Statement stmt : stmts) {
            slots.add(ctx.slotOf(stmt));
        }
        return new BlockStatement(ctx, slots);
    }

    public BlockStatement createBlock(Statement... stmts) {
        return createBlock(Arrays.asList(stmts));
    }

    /**
     * @param otherwise else branch, may be null
     */
    public IfStatement createIf(Expression cond, Statement then, Statement otherwise) {
        int elseSlot = otherwise == null ? -1 : ctx.slotOf(otherwise);
        return new IfStatement(ctx, cond, ctx.slotOf(then), elseSlot);
    }

    /**
     * Builds {@code while (cond) body}; a body that is not a block is wrapped in one.
     */
    public WhileStatement createWhile(Expression cond, Statement body) {
        return new WhileStatement(ctx, cond, ctx.slotOf(asBlock(body)));
    }

    /**
     * Builds {@code do body while (cond);}; a body that is not a block is wrapped in one.
     */
    public DoWhileStatement createDoWhile(Expression cond, Statement body) {
        return new DoWhileStatement(ctx, cond, ctx.slotOf(asBlock(body)));
    }

    public BreakStatement createBreak() {
        return new BreakStatement(ctx);
    }

    public AssignStatement createAssign(String target, Expression value) {
        return new AssignStatement(ctx, target, value);
    }

    public ExpressionStatement createExpressionStatement(Expression expr) {
        return new ExpressionStatement(ctx, expr);
    }

    public ReturnStatement createReturn(Expression value) {
        return new ReturnStatement(ctx, value);
    }

    private BlockStatement asBlock(Statement stmt) {
        return stmt instanceof BlockStatement block ? block : createBlock(stmt);
    }

    // --- expressions ---

    /**
     * Logical negation of {@code cond}. The result is a new expression carrying
     * every origin of {@code cond}.
     */
    public Expression createNot(Expression cond) {
        Expression not = new UnaryExpr(UnaryExpr.Op.NOT, cond);
        provenance.copyUse(cond, not);
        return not;
    }

    public BoolLiteral createBool(boolean value) {
        return new BoolLiteral(value);
    }

    public IntLiteral createInt(long value) {
        return new IntLiteral(value);
    }

    public VarRef createVar(String name) {
        return new VarRef(name);
    }

    public UnaryExpr createUnary(UnaryExpr.Op op, Expression operand) {
        return new UnaryExpr(op, operand);
    }

    public BinaryExpr createBinary(BinaryExpr.Op op, Expression lhs, Expression rhs) {
        return new BinaryExpr(op, lhs, rhs);
    }

    public CallExpr createCall(String callee, List<Expression> args) {
        return new CallExpr(callee, args);
    }
}
