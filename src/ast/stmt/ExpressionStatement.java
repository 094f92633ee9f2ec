package ast.stmt;

import ast.ASTContext;
import ast.StatementVisitor;
import ast.expr.Expression;

/**
 * An expression evaluated for its side effects, typically a call.
 */
public class ExpressionStatement extends Statement {
    private final Expression expression;

    public ExpressionStatement(ASTContext ctx, Expression expression) {
        super(ctx);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
