package ast.expr;

public class UnaryExpr extends Expression {
    public enum Op {
        NOT("!"),
        NEG("-");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Op op;
    private final Expression operand;

    public UnaryExpr(Op op, Expression operand) {
        this.op = op;
        this.operand = operand;
    }

    public Op getOp() {
        return op;
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isNot() {
        return op == Op.NOT;
    }

    @Override
    public boolean isBoolean() {
        return op == Op.NOT;
    }

    @Override
    public int precedence() {
        return PREC_UNARY;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
