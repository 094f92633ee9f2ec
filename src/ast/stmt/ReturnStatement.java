package ast.stmt;

import ast.ASTContext;
import ast.StatementVisitor;
import ast.expr.Expression;

public class ReturnStatement extends Statement {
    private final Expression value;

    public ReturnStatement(ASTContext ctx, Expression value) {
        super(ctx);
        this.value = value;
    }

    /**
     * @return the returned value, or null for a bare return
     */
    public Expression getValue() {
        return value;
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
