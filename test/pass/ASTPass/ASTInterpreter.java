package pass.ASTPass;

import ast.Function;
import ast.StatementVisitor;
import ast.expr.BinaryExpr;
import ast.expr.BoolLiteral;
import ast.expr.CallExpr;
import ast.expr.Expression;
import ast.expr.ExpressionVisitor;
import ast.expr.IntLiteral;
import ast.expr.UnaryExpr;
import ast.expr.VarRef;
import ast.stmt.AssignStatement;
import ast.stmt.BlockStatement;
import ast.stmt.BreakStatement;
import ast.stmt.DoWhileStatement;
import ast.stmt.ExpressionStatement;
import ast.stmt.IfStatement;
import ast.stmt.ReturnStatement;
import ast.stmt.Statement;
import ast.stmt.WhileStatement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Executes a function of the listing language with 32-bit integers. Calls are
 * recorded in a trace and return a value that depends only on the callee and
 * on how often it was called before, so two equivalent programs see the same
 * results.
 */
public class ASTInterpreter {
    public static final int DEFAULT_STEP_LIMIT = 10_000;

    /**
     * Everything observable about one execution.
     */
    public record Outcome(List<String> trace, Map<String, Long> variables, String exit) {
    }

    private static final class BreakSignal extends RuntimeException {
        BreakSignal() {
            super(null, null, false, false);
        }
    }

    private static final class ReturnSignal extends RuntimeException {
        final Long value;

        ReturnSignal(Long value) {
            super(null, null, false, false);
            this.value = value;
        }
    }

    private static final class StepLimitExceeded extends RuntimeException {
        StepLimitExceeded() {
            super(null, null, false, false);
        }
    }

    private final Map<String, Long> variables;
    private final List<String> trace = new ArrayList<>();
    private final Map<String, Integer> callCounts = new HashMap<>();
    private final int stepLimit;
    private int steps = 0;

    public ASTInterpreter(Map<String, Long> inputs, int stepLimit) {
        this.variables = new TreeMap<>(inputs);
        this.stepLimit = stepLimit;
    }

    public static Outcome execute(Function f, Map<String, Long> inputs) {
        return new ASTInterpreter(inputs, DEFAULT_STEP_LIMIT).run(f);
    }

    public Outcome run(Function f) {
        String exit;
        try {
            exec(f.getBody());
            exit = "fallthrough";
        } catch (ReturnSignal r) {
            exit = "return " + r.value;
        } catch (BreakSignal b) {
            exit = "dangling break";
        } catch (StepLimitExceeded e) {
            exit = "diverged";
        }
        return new Outcome(trace, variables, exit);
    }

    private void exec(Statement stmt) {
        stmt.accept(executor);
    }

    private void tick() {
        if (++steps > stepLimit) {
            throw new StepLimitExceeded();
        }
    }

    private boolean test(Expression cond) {
        return eval(cond) != 0;
    }

    private long eval(Expression expr) {
        return expr.accept(evaluator);
    }

    private static long wrap(long value) {
        return (int) value;
    }

    private long call(CallExpr expr) {
        List<Long> args = new ArrayList<>();
        for (Expression arg : expr.getArgs()) {
            args.add(eval(arg));
        }
        int n = callCounts.merge(expr.getCallee(), 1, Integer::sum);
        trace.add(expr.getCallee() + args);
        return Math.floorMod(expr.getCallee().hashCode() * 31 + n, 3) - 1;
    }

    private final StatementVisitor<Void> executor = new StatementVisitor<>() {
        @Override
        public Void visit(BlockStatement stmt) {
            for (Statement child : stmt.getStatements()) {
                exec(child);
            }
            return null;
        }

        @Override
        public Void visit(IfStatement stmt) {
            tick();
            if (test(stmt.getCondition())) {
                exec(stmt.getThen());
            } else if (stmt.hasElse()) {
                exec(stmt.getElse());
            }
            return null;
        }

        @Override
        public Void visit(WhileStatement stmt) {
            while (true) {
                tick();
                if (!test(stmt.getCondition())) {
                    return null;
                }
                try {
                    exec(stmt.getBody());
                } catch (BreakSignal b) {
                    return null;
                }
            }
        }

        @Override
        public Void visit(DoWhileStatement stmt) {
            while (true) {
                tick();
                try {
                    exec(stmt.getBody());
                } catch (BreakSignal b) {
                    return null;
                }
                if (!test(stmt.getCondition())) {
                    return null;
                }
            }
        }

        @Override
        public Void visit(BreakStatement stmt) {
            throw new BreakSignal();
        }

        @Override
        public Void visit(AssignStatement stmt) {
            tick();
            variables.put(stmt.getTarget(), eval(stmt.getValue()));
            return null;
        }

        @Override
        public Void visit(ExpressionStatement stmt) {
            tick();
            eval(stmt.getExpression());
            return null;
        }

        @Override
        public Void visit(ReturnStatement stmt) {
            throw new ReturnSignal(stmt.getValue() == null ? null : eval(stmt.getValue()));
        }
    };

    private final ExpressionVisitor<Long> evaluator = new ExpressionVisitor<>() {
        @Override
        public Long visit(BoolLiteral expr) {
            return expr.getValue() ? 1L : 0L;
        }

        @Override
        public Long visit(IntLiteral expr) {
            return wrap(expr.getValue());
        }

        @Override
        public Long visit(VarRef expr) {
            return variables.getOrDefault(expr.getName(), 0L);
        }

        @Override
        public Long visit(UnaryExpr expr) {
            long v = eval(expr.getOperand());
            return expr.isNot() ? (v == 0 ? 1L : 0L) : wrap(-v);
        }

        @Override
        public Long visit(BinaryExpr expr) {
            long l = eval(expr.getLhs());
            if (expr.getOp() == BinaryExpr.Op.LAND) {
                return l != 0 && eval(expr.getRhs()) != 0 ? 1L : 0L;
            }
            if (expr.getOp() == BinaryExpr.Op.LOR) {
                return l != 0 || eval(expr.getRhs()) != 0 ? 1L : 0L;
            }
            long r = eval(expr.getRhs());
            return switch (expr.getOp()) {
                case MUL -> wrap(l * r);
                case DIV -> r == 0 ? 0L : wrap(l / r);
                case REM -> r == 0 ? 0L : wrap(l % r);
                case ADD -> wrap(l + r);
                case SUB -> wrap(l - r);
                case LT -> l < r ? 1L : 0L;
                case LE -> l <= r ? 1L : 0L;
                case GT -> l > r ? 1L : 0L;
                case GE -> l >= r ? 1L : 0L;
                case EQ -> l == r ? 1L : 0L;
                case NE -> l != r ? 1L : 0L;
                case BITAND -> l & r;
                case BITXOR -> l ^ r;
                case BITOR -> l | r;
                default -> throw new IllegalStateException("unexpected " + expr.getOp());
            };
        }

        @Override
        public Long visit(CallExpr expr) {
            return call(expr);
        }
    };
}
