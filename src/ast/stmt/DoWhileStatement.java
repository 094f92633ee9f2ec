package ast.stmt;

import ast.ASTContext;
import ast.StatementVisitor;
import ast.expr.Expression;

public class DoWhileStatement extends LoopStatement {
    public DoWhileStatement(ASTContext ctx, Expression condition, int bodySlot) {
        super(ctx, condition, bodySlot);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
