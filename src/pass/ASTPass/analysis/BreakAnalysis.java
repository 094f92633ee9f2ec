package pass.ASTPass.analysis;

import ast.stmt.BlockStatement;
import ast.stmt.BreakStatement;
import ast.stmt.IfStatement;
import ast.stmt.LoopStatement;
import ast.stmt.Statement;

import java.util.List;

/**
 * Queries about {@code break} statements relative to one loop. A break inside a
 * nested loop exits that nested loop, so every search here stops at loop
 * boundaries.
 */
public final class BreakAnalysis {
    private BreakAnalysis() {
    }

    /**
     * @return true if executing {@code stmt} may exit the loop enclosing it
     */
    public static boolean hasLoopBreak(Statement stmt) {
        if (stmt instanceof BreakStatement) {
            return true;
        }
        if (stmt instanceof LoopStatement) {
            return false;
        }
        if (stmt instanceof BlockStatement || stmt instanceof IfStatement) {
            for (Statement child : stmt.children()) {
                if (hasLoopBreak(child)) {
                    return true;
                }
            }
        }
        return false;
    }

    public static boolean hasLoopBreak(List<Statement> stmts) {
        for (Statement stmt : stmts) {
            if (hasLoopBreak(stmt)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A block's statements, or the statement itself when it is not a block.
     */
    public static List<Statement> statementsOf(Statement stmt) {
        if (stmt instanceof BlockStatement block) {
            return block.getStatements();
        }
        return List.of(stmt);
    }

    /**
     * @return true for {@code break;} and {@code { break; }}
     */
    public static boolean isBreakOnly(Statement stmt) {
        if (stmt instanceof BreakStatement) {
            return true;
        }
        return stmt instanceof BlockStatement block && block.size() == 1 && isBreakOnly(block.get(0));
    }

    /**
     * Index of the first {@code break} among {@code stmts} themselves, -1 if none.
     */
    public static int firstDirectBreak(List<Statement> stmts) {
        for (int i = 0; i < stmts.size(); i++) {
            if (stmts.get(i) instanceof BreakStatement) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the first direct {@code break} of {@code stmt}, provided nothing
     * before it may exit the loop; -1 otherwise.
     */
    public static int cleanBreakIndex(Statement stmt) {
        List<Statement> stmts = statementsOf(stmt);
        int index = firstDirectBreak(stmts);
        if (index < 0 || hasLoopBreak(stmts.subList(0, index))) {
            return -1;
        }
        return index;
    }
}
