package ast.stmt;

import ast.ASTContext;
import ast.StatementVisitor;
import ast.expr.Expression;

/**
 * target = value;
 */
public class AssignStatement extends Statement {
    private final String target;
    private final Expression value;

    public AssignStatement(ASTContext ctx, String target, Expression value) {
        super(ctx);
        this.target = target;
        this.value = value;
    }

    public String getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
