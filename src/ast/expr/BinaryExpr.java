package ast.expr;

public class BinaryExpr extends Expression {
    /**
     * Binary operators with C precedence.
     */
    public enum Op {
        MUL("*", 10),
        DIV("/", 10),
        REM("%", 10),
        ADD("+", 9),
        SUB("-", 9),
        LT("<", 7),
        LE("<=", 7),
        GT(">", 7),
        GE(">=", 7),
        EQ("==", 6),
        NE("!=", 6),
        BITAND("&", 5),
        BITXOR("^", 4),
        BITOR("|", 3),
        LAND("&&", 2),
        LOR("||", 1);

        private final String symbol;
        private final int precedence;

        Op(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String getSymbol() {
            return symbol;
        }

        public int getPrecedence() {
            return precedence;
        }

        public boolean isComparison() {
            return this == LT || this == LE || this == GT || this == GE || this == EQ || this == NE;
        }

        public boolean isLogical() {
            return this == LAND || this == LOR;
        }

        public static Op fromSymbol(String symbol) {
            for (Op op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("unknown binary operator " + symbol);
        }
    }

    private final Op op;
    private final Expression lhs;
    private final Expression rhs;

    public BinaryExpr(Op op, Expression lhs, Expression rhs) {
        this.op = op;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public Op getOp() {
        return op;
    }

    public Expression getLhs() {
        return lhs;
    }

    public Expression getRhs() {
        return rhs;
    }

    @Override
    public boolean isBoolean() {
        return op.isComparison() || op.isLogical();
    }

    @Override
    public int precedence() {
        return op.getPrecedence();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
