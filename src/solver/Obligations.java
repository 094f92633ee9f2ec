package solver;

import ast.expr.BinaryExpr;
import ast.expr.BoolLiteral;
import ast.expr.Expression;
import ast.expr.UnaryExpr;

import java.util.List;

/**
 * Builds the proof goals handed to an {@link Oracle}. Goals are transient: they
 * reuse the guard objects but are never inserted into the AST, so they carry
 * no provenance.
 */
public final class Obligations {
    private Obligations() {
    }

    /**
     * Reads an integer-valued expression as a truth value ({@code !!e}), so
     * that both oracles see the same atom {@code e} wherever it is tested.
     */
    public static Expression truth(Expression e) {
        if (e.isBoolean()) {
            return e;
        }
        return new UnaryExpr(UnaryExpr.Op.NOT, new UnaryExpr(UnaryExpr.Op.NOT, e));
    }

    public static Expression not(Expression e) {
        return new UnaryExpr(UnaryExpr.Op.NOT, e);
    }

    public static Expression and(List<Expression> conjuncts) {
        Expression result = null;
        for (Expression c : conjuncts) {
            result = result == null ? truth(c) : new BinaryExpr(BinaryExpr.Op.LAND, result, truth(c));
        }
        return result == null ? new BoolLiteral(true) : result;
    }

    public static Expression iff(Expression a, Expression b) {
        return new BinaryExpr(BinaryExpr.Op.EQ, truth(a), truth(b));
    }

    public static Expression implies(Expression a, Expression b) {
        return new BinaryExpr(BinaryExpr.Op.LOR, not(a), truth(b));
    }

    /**
     * @return {@code !g1 && !g2 && ...}
     */
    public static Expression noneOf(List<Expression> guards) {
        return and(guards.stream().map(Obligations::not).toList());
    }
}
