package solver;

import ast.ASTPrinter;
import ast.expr.BinaryExpr;
import ast.expr.BoolLiteral;
import ast.expr.CallExpr;
import ast.expr.Expression;
import ast.expr.ExpressionVisitor;
import ast.expr.IntLiteral;
import ast.expr.UnaryExpr;
import ast.expr.VarRef;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;

/**
 * Translates guard expressions into Z3 terms. Integers are 32-bit two's
 * complement bit-vectors with signed comparisons and division; a call is an
 * unconstrained constant, one per distinct call text.
 */
public class Z3ConvVisitor implements ExpressionVisitor<Expr<?>> {
    public static final int INT_WIDTH = 32;

    private final Context z3;

    public Z3ConvVisitor(Context z3) {
        this.z3 = z3;
    }

    public BoolExpr toBool(Expression expr) {
        return asBool(expr.accept(this));
    }

    public Expr<BitVecSort> toBitVec(Expression expr) {
        return asBitVec(expr.accept(this));
    }

    private BoolExpr asBool(Expr<?> term) {
        if (term instanceof BoolExpr b) {
            return b;
        }
        return z3.mkNot(z3.mkEq(asBitVec(term), z3.mkBV(0, INT_WIDTH)));
    }

    @SuppressWarnings("unchecked")
    private Expr<BitVecSort> asBitVec(Expr<?> term) {
        if (term instanceof BoolExpr b) {
            return z3.mkITE(b, z3.mkBV(1, INT_WIDTH), z3.mkBV(0, INT_WIDTH));
        }
        return (Expr<BitVecSort>) term;
    }

    @Override
    public Expr<?> visit(BoolLiteral expr) {
        return z3.mkBool(expr.getValue());
    }

    @Override
    public Expr<?> visit(IntLiteral expr) {
        return z3.mkBV(expr.getValue(), INT_WIDTH);
    }

    @Override
    public Expr<?> visit(VarRef expr) {
        return z3.mkBVConst(expr.getName(), INT_WIDTH);
    }

    @Override
    public Expr<?> visit(UnaryExpr expr) {
        return switch (expr.getOp()) {
            case NOT -> z3.mkNot(toBool(expr.getOperand()));
            case NEG -> z3.mkBVNeg(toBitVec(expr.getOperand()));
        };
    }

    @Override
    public Expr<?> visit(BinaryExpr expr) {
        Expression lhs = expr.getLhs();
        Expression rhs = expr.getRhs();
        return switch (expr.getOp()) {
            case MUL -> z3.mkBVMul(toBitVec(lhs), toBitVec(rhs));
            case DIV -> z3.mkBVSDiv(toBitVec(lhs), toBitVec(rhs));
            case REM -> z3.mkBVSRem(toBitVec(lhs), toBitVec(rhs));
            case ADD -> z3.mkBVAdd(toBitVec(lhs), toBitVec(rhs));
            case SUB -> z3.mkBVSub(toBitVec(lhs), toBitVec(rhs));
            case LT -> z3.mkBVSLT(toBitVec(lhs), toBitVec(rhs));
            case LE -> z3.mkBVSLE(toBitVec(lhs), toBitVec(rhs));
            case GT -> z3.mkBVSGT(toBitVec(lhs), toBitVec(rhs));
            case GE -> z3.mkBVSGE(toBitVec(lhs), toBitVec(rhs));
            case EQ -> equality(lhs, rhs);
            case NE -> z3.mkNot(equality(lhs, rhs));
            case BITAND -> z3.mkBVAND(toBitVec(lhs), toBitVec(rhs));
            case BITXOR -> z3.mkBVXOR(toBitVec(lhs), toBitVec(rhs));
            case BITOR -> z3.mkBVOR(toBitVec(lhs), toBitVec(rhs));
            case LAND -> z3.mkAnd(toBool(lhs), toBool(rhs));
            case LOR -> z3.mkOr(toBool(lhs), toBool(rhs));
        };
    }

    private BoolExpr equality(Expression lhs, Expression rhs) {
        if (lhs.isBoolean() && rhs.isBoolean()) {
            return z3.mkEq(toBool(lhs), toBool(rhs));
        }
        return z3.mkEq(toBitVec(lhs), toBitVec(rhs));
    }

    @Override
    public Expr<?> visit(CallExpr expr) {
        return z3.mkBVConst("call!" + ASTPrinter.print(expr), INT_WIDTH);
    }
}
