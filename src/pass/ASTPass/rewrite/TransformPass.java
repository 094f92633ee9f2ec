package pass.ASTPass.rewrite;

import ast.ASTContext;
import ast.Builder;
import ast.Function;
import ast.Provenance;
import ast.stmt.Statement;
import pass.Pass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Base of the rewriting passes. Walks every function body post-order, lets
 * {@link #visit} record substitutions, and commits them together once the walk
 * is over, so no pattern is ever matched against a half-rewritten tree.
 * <p>
 * A substitution recorded for a child is installed into the child's slot. If a
 * parent's replacement still refers to that slot it picks up the rewritten
 * child; if it was built from the child's pieces instead, the child's
 * replacement is dropped and the next run redoes it.
 */
public abstract class TransformPass implements Pass.ASTPass {
    protected final Logger log = LoggingManager.getLogger(getClass());

    protected Builder builder;
    private SubstitutionMap substitutions;
    private int lastSubstitutionCount = 0;

    @Override
    public final boolean run(ASTContext ast, Provenance provenance) {
        builder = new Builder(ast, provenance);
        substitutions = new SubstitutionMap(ast);
        for (Function function : ast.getFunctions()) {
            walk(function.getBody());
        }
        lastSubstitutionCount = substitutions.commit(provenance);
        if (lastSubstitutionCount > 0) {
            log.debug("{}: {} substitutions, {} live statements", getType().getName(),
                    lastSubstitutionCount, ast.liveCount());
        }
        return lastSubstitutionCount > 0;
    }

    private void walk(Statement stmt) {
        for (Statement child : stmt.children()) {
            walk(child);
        }
        visit(stmt);
    }

    /**
     * Hook called once for every statement, children first.
     */
    protected abstract void visit(Statement stmt);

    protected void substitute(Statement old, Statement replacement) {
        if (old != replacement) {
            substitutions.put(old, replacement);
        }
    }

    public int getLastSubstitutionCount() {
        return lastSubstitutionCount;
    }
}
