package ast.stmt;

import ast.ASTContext;
import ast.StatementVisitor;
import ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * if (condition) then [else otherwise]
 */
public class IfStatement extends Statement {
    private static final int NO_ELSE = -1;

    private final Expression condition;
    private final int thenSlot;
    private final int elseSlot;

    public IfStatement(ASTContext ctx, Expression condition, int thenSlot, int elseSlot) {
        super(ctx);
        this.condition = condition;
        this.thenSlot = thenSlot;
        this.elseSlot = elseSlot < 0 ? NO_ELSE : elseSlot;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getThen() {
        return ctx.get(thenSlot);
    }

    /**
     * @return the else branch, or null if there is none
     */
    public Statement getElse() {
        return hasElse() ? ctx.get(elseSlot) : null;
    }

    public boolean hasElse() {
        return elseSlot != NO_ELSE;
    }

    @Override
    public List<Statement> children() {
        List<Statement> result = new ArrayList<>(2);
        result.add(getThen());
        if (hasElse()) {
            result.add(getElse());
        }
        return result;
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
