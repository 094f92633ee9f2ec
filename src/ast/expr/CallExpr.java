package ast.expr;

import java.util.List;

/**
 * Call of an external function. Its effect is unknown to the structurer.
 */
public class CallExpr extends Expression {
    private final String callee;
    private final List<Expression> args;

    public CallExpr(String callee, List<Expression> args) {
        this.callee = callee;
        this.args = List.copyOf(args);
    }

    public String getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public boolean isBoolean() {
        return false;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
