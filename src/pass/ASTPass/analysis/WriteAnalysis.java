package pass.ASTPass.analysis;

import ast.expr.BinaryExpr;
import ast.expr.CallExpr;
import ast.expr.Expression;
import ast.expr.UnaryExpr;
import ast.expr.VarRef;
import ast.stmt.AssignStatement;
import ast.stmt.ExpressionStatement;
import ast.stmt.IfStatement;
import ast.stmt.LoopStatement;
import ast.stmt.ReturnStatement;
import ast.stmt.Statement;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which variables a statement may write and which variables an expression
 * reads. Variables are locals: a call can read or write the state it
 * encapsulates but no variable of the listing.
 */
public final class WriteAnalysis {
    private WriteAnalysis() {
    }

    public static Set<String> assignedVariables(Statement stmt) {
        Set<String> result = new LinkedHashSet<>();
        collectAssigned(stmt, result);
        return result;
    }

    private static void collectAssigned(Statement stmt, Set<String> result) {
        if (stmt instanceof AssignStatement assign) {
            result.add(assign.getTarget());
        }
        for (Statement child : stmt.children()) {
            collectAssigned(child, result);
        }
    }

    public static Set<String> readVariables(Expression expr) {
        Set<String> result = new LinkedHashSet<>();
        collectRead(expr, result);
        return result;
    }

    private static void collectRead(Expression expr, Set<String> result) {
        if (expr instanceof VarRef var) {
            result.add(var.getName());
        } else if (expr instanceof UnaryExpr unary) {
            collectRead(unary.getOperand(), result);
        } else if (expr instanceof BinaryExpr binary) {
            collectRead(binary.getLhs(), result);
            collectRead(binary.getRhs(), result);
        } else if (expr instanceof CallExpr call) {
            for (Expression arg : call.getArgs()) {
                collectRead(arg, result);
            }
        }
    }

    public static boolean hasCall(Expression expr) {
        if (expr == null) {
            return false;
        }
        if (expr instanceof CallExpr) {
            return true;
        }
        if (expr instanceof UnaryExpr unary) {
            return hasCall(unary.getOperand());
        }
        if (expr instanceof BinaryExpr binary) {
            return hasCall(binary.getLhs()) || hasCall(binary.getRhs());
        }
        return false;
    }

    /**
     * @return true if executing {@code stmt} evaluates a call somewhere
     */
    public static boolean hasCall(Statement stmt) {
        boolean own = false;
        if (stmt instanceof AssignStatement assign) {
            own = hasCall(assign.getValue());
        } else if (stmt instanceof ExpressionStatement es) {
            own = hasCall(es.getExpression());
        } else if (stmt instanceof ReturnStatement ret) {
            own = hasCall(ret.getValue());
        } else if (stmt instanceof IfStatement ifStmt) {
            own = hasCall(ifStmt.getCondition());
        } else if (stmt instanceof LoopStatement loop) {
            own = hasCall(loop.getCondition());
        }
        if (own) {
            return true;
        }
        for (Statement child : stmt.children()) {
            if (hasCall(child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if running {@code stmt} may change the value of {@code guard}
     */
    public static boolean mayAffect(Statement stmt, Expression guard) {
        if (hasCall(guard) && hasCall(stmt)) {
            return true;
        }
        Set<String> written = assignedVariables(stmt);
        for (String var : readVariables(guard)) {
            if (written.contains(var)) {
                return true;
            }
        }
        return false;
    }
}
