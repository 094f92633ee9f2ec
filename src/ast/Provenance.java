package ast;

import ast.expr.Expression;
import ast.stmt.Statement;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Many-to-many association between AST nodes and the low-level constructs they
 * were derived from. Statements and expression uses are tracked separately and
 * keyed by identity; the reverse direction answers "what did this construct
 * become".
 */
public class Provenance {
    private final Map<Statement, Set<Origin>> stmtProvenance = new IdentityHashMap<>();
    private final Map<Origin, Set<Statement>> stmtsByOrigin = new HashMap<>();
    private final Map<Expression, Set<Origin>> useProvenance = new IdentityHashMap<>();
    private final Map<Origin, Set<Expression>> usesByOrigin = new HashMap<>();

    public void addStatement(Statement stmt, Origin origin) {
        stmtProvenance.computeIfAbsent(stmt, s -> new LinkedHashSet<>()).add(origin);
        stmtsByOrigin.computeIfAbsent(origin, o -> identitySet()).add(stmt);
    }

    public void addUse(Expression expr, Origin origin) {
        useProvenance.computeIfAbsent(expr, e -> new LinkedHashSet<>()).add(origin);
        usesByOrigin.computeIfAbsent(origin, o -> identitySet()).add(expr);
    }

    /**
     * Gives {@code to} every origin of {@code from}. Used whenever a statement
     * replaces another one.
     */
    public void copyStatement(Statement from, Statement to) {
        if (from == to) {
            return;
        }
        for (Origin origin : getStatementOrigins(from)) {
            addStatement(to, origin);
        }
    }

    /**
     * Gives {@code to} every origin of {@code from}. Used whenever an expression
     * is derived from another one, e.g. by negation.
     */
    public void copyUse(Expression from, Expression to) {
        if (from == to) {
            return;
        }
        for (Origin origin : getUseOrigins(from)) {
            addUse(to, origin);
        }
    }

    /**
     * Forgets a statement that left the tree, in both directions.
     */
    public void removeStatement(Statement stmt) {
        Set<Origin> origins = stmtProvenance.remove(stmt);
        if (origins == null) {
            return;
        }
        for (Origin origin : origins) {
            Set<Statement> stmts = stmtsByOrigin.get(origin);
            stmts.remove(stmt);
            if (stmts.isEmpty()) {
                stmtsByOrigin.remove(origin);
            }
        }
    }

    public Set<Origin> getStatementOrigins(Statement stmt) {
        Set<Origin> origins = stmtProvenance.get(stmt);
        return origins == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(origins));
    }

    public Set<Origin> getUseOrigins(Expression expr) {
        Set<Origin> origins = useProvenance.get(expr);
        return origins == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(origins));
    }

    public Set<Statement> getStatements(Origin origin) {
        Set<Statement> stmts = stmtsByOrigin.get(origin);
        return stmts == null ? Set.of() : Collections.unmodifiableSet(stmts);
    }

    public Set<Expression> getUses(Origin origin) {
        Set<Expression> uses = usesByOrigin.get(origin);
        return uses == null ? Set.of() : Collections.unmodifiableSet(uses);
    }

    public boolean hasUse(Expression expr) {
        Set<Origin> origins = useProvenance.get(expr);
        return origins != null && !origins.isEmpty();
    }

    public boolean hasStatement(Statement stmt) {
        Set<Origin> origins = stmtProvenance.get(stmt);
        return origins != null && !origins.isEmpty();
    }

    private static <T> Set<T> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
