package ast.stmt;

import ast.ASTContext;
import ast.StatementVisitor;

/**
 * Unlabeled break, exits the nearest enclosing loop.
 */
public class BreakStatement extends Statement {
    public BreakStatement(ASTContext ctx) {
        super(ctx);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
