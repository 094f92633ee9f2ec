package ast.stmt;

import ast.ASTContext;
import ast.StatementVisitor;
import ast.expr.Expression;

public class WhileStatement extends LoopStatement {
    public WhileStatement(ASTContext ctx, Expression condition, int bodySlot) {
        super(ctx, condition, bodySlot);
    }

    @Override
    public boolean isInfinite() {
        return hasTrueCondition();
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
