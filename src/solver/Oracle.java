package solver;

import ast.expr.Expression;

/**
 * Decides whether a boolean expression is a tautology.
 * <p>
 * Sound but incomplete: {@code true} means "proved", {@code false} means
 * "not proved", either because the expression can be false or because the
 * decision procedure gave up. Callers must never read {@code false} as a
 * disproof.
 */
public interface Oracle extends AutoCloseable {
    boolean prove(Expression expr);

    @Override
    default void close() {
    }
}
