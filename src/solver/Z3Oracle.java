package solver;

import ast.expr.Expression;
import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Tactic;
import com.microsoft.z3.Z3Exception;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Proves a goal by asking Z3 whether its negation is unsatisfiable. Anything
 * but UNSAT (a model, a timeout, a solver error) is reported as "not proved".
 */
public class Z3Oracle implements Oracle {
    private static final Logger log = LoggingManager.getLogger(Z3Oracle.class);

    private final Context z3;
    private final Tactic tactic;
    private final Z3ConvVisitor converter;

    public Z3Oracle(int timeoutMs) {
        this.z3 = new Context();
        Tactic pipeline = z3.andThen(z3.mkTactic("simplify"), z3.mkTactic("aig"), z3.mkTactic("smt"));
        this.tactic = z3.tryFor(pipeline, timeoutMs);
        this.converter = new Z3ConvVisitor(z3);
    }

    /**
     * Falls back to the propositional oracle when the native Z3 library cannot
     * be loaded on this platform.
     */
    public static Oracle createOrFallback(int timeoutMs) {
        try {
            return new Z3Oracle(timeoutMs);
        } catch (LinkageError | Z3Exception e) {
            log.warn("Z3 unavailable ({}), using the propositional oracle", e.getMessage());
            return new PropositionalOracle();
        }
    }

    @Override
    public boolean prove(Expression expr) {
        try {
            Solver solver = z3.mkSolver(tactic);
            solver.add(z3.mkNot(converter.toBool(expr)));
            Status status = solver.check();
            log.debug("prove {} -> {}", expr, status);
            if (status == Status.UNKNOWN) {
                log.warn("solver gave up on {}: {}", expr, solver.getReasonUnknown());
            }
            return status == Status.UNSATISFIABLE;
        } catch (Z3Exception e) {
            log.warn("solver failed on {}: {}", expr, e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        z3.close();
    }
}
