package ast.stmt;

import ast.ASTContext;
import ast.expr.BoolLiteral;
import ast.expr.Expression;
import ast.expr.IntLiteral;

import java.util.List;

/**
 * Common base of the two loop forms. A {@code break} exits the nearest
 * enclosing loop.
 */
public abstract class LoopStatement extends Statement {
    private final Expression condition;
    private final int bodySlot;

    protected LoopStatement(ASTContext ctx, Expression condition, int bodySlot) {
        super(ctx);
        this.condition = condition;
        this.bodySlot = bodySlot;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getBody() {
        return ctx.get(bodySlot);
    }

    /**
     * @return true for {@code while (true)} and {@code while (1)}
     */
    public boolean isInfinite() {
        return false;
    }

    protected boolean hasTrueCondition() {
        if (condition instanceof BoolLiteral b) {
            return b.getValue();
        }
        return condition instanceof IntLiteral i && i.getValue() == 1;
    }

    @Override
    public List<Statement> children() {
        return List.of(getBody());
    }
}
