package solver;

import ast.ASTPrinter;
import ast.expr.BinaryExpr;
import ast.expr.BoolLiteral;
import ast.expr.Expression;
import ast.expr.IntLiteral;
import ast.expr.UnaryExpr;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Truth-table oracle. Every boolean sub-expression that is not a connective
 * ({@code ! && || ==} over truth values) becomes an opaque atom, keyed by its
 * printed text, and the goal is evaluated under every assignment of the atoms.
 * Proves exactly the propositional tautologies, which is sound for any
 * interpretation of the atoms.
 */
public class PropositionalOracle implements Oracle {
    public static final int MAX_ATOMS = 16;

    @Override
    public boolean prove(Expression expr) {
        Map<String, Integer> atoms = new LinkedHashMap<>();
        collectAtoms(expr, atoms);
        if (atoms.size() > MAX_ATOMS) {
            return false;
        }
        long assignments = 1L << atoms.size();
        for (long bits = 0; bits < assignments; bits++) {
            if (!evaluate(expr, atoms, bits)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isConnective(Expression expr) {
        if (expr instanceof BoolLiteral || expr instanceof IntLiteral) {
            return true;
        }
        if (expr instanceof UnaryExpr u) {
            return u.isNot();
        }
        if (expr instanceof BinaryExpr b) {
            BinaryExpr.Op op = b.getOp();
            if (op.isLogical()) {
                return true;
            }
            return (op == BinaryExpr.Op.EQ || op == BinaryExpr.Op.NE)
                    && b.getLhs().isBoolean() && b.getRhs().isBoolean();
        }
        return false;
    }

    private static void collectAtoms(Expression expr, Map<String, Integer> atoms) {
        if (!isConnective(expr)) {
            atoms.putIfAbsent(ASTPrinter.print(expr), atoms.size());
            return;
        }
        if (expr instanceof UnaryExpr u) {
            collectAtoms(u.getOperand(), atoms);
        } else if (expr instanceof BinaryExpr b) {
            collectAtoms(b.getLhs(), atoms);
            collectAtoms(b.getRhs(), atoms);
        }
    }

    private static boolean evaluate(Expression expr, Map<String, Integer> atoms, long bits) {
        if (!isConnective(expr)) {
            int index = atoms.get(ASTPrinter.print(expr));
            return ((bits >>> index) & 1L) != 0;
        }
        if (expr instanceof BoolLiteral lit) {
            return lit.getValue();
        }
        if (expr instanceof IntLiteral lit) {
            return lit.getValue() != 0;
        }
        if (expr instanceof UnaryExpr u) {
            return !evaluate(u.getOperand(), atoms, bits);
        }
        BinaryExpr b = (BinaryExpr) expr;
        boolean lhs = evaluate(b.getLhs(), atoms, bits);
        return switch (b.getOp()) {
            case LAND -> lhs && evaluate(b.getRhs(), atoms, bits);
            case LOR -> lhs || evaluate(b.getRhs(), atoms, bits);
            case EQ -> lhs == evaluate(b.getRhs(), atoms, bits);
            case NE -> lhs != evaluate(b.getRhs(), atoms, bits);
            default -> throw new IllegalStateException("not a connective: " + b.getOp());
        };
    }
}
