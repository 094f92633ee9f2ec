package pass.ASTPass.rewrite;

import ast.ASTContext;
import ast.Provenance;
import ast.stmt.Statement;
import exception.StructureException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Old slot to replacement bindings collected during one traversal. Committed
 * exactly once, at the end of the traversal that filled it.
 */
public class SubstitutionMap {
    private final ASTContext ctx;
    // statements built after this mark belong to the current pass
    private final int watermark;
    private final Map<Integer, Statement> bySlot = new LinkedHashMap<>();
    private boolean committed = false;

    public SubstitutionMap(ASTContext ctx) {
        this.ctx = ctx;
        this.watermark = ctx.size();
    }

    public void put(Statement old, Statement replacement) {
        if (committed) {
            throw StructureException.doubleCommit();
        }
        if (!isFresh(replacement)) {
            throw StructureException.foreignReplacement("slot " + ctx.slotOf(replacement)
                    + " offered for slot " + old.getId());
        }
        int slot = old.getId();
        if (bySlot.putIfAbsent(slot, replacement) != null) {
            throw StructureException.duplicateSubstitution(slot);
        }
    }

    public boolean isEmpty() {
        return bySlot.isEmpty();
    }

    public int size() {
        return bySlot.size();
    }

    /**
     * Installs every replacement into the slot of the statement it replaces.
     * Each replacement, and every fresh statement inside it that has no origin
     * of its own, inherits the origins of the replaced statement. Statements
     * left unreachable afterwards are dropped from the arena and from
     * {@code provenance}.
     *
     * @return the number of substitutions performed
     */
    public int commit(Provenance provenance) {
        if (committed) {
            throw StructureException.doubleCommit();
        }
        committed = true;
        for (Map.Entry<Integer, Statement> entry : bySlot.entrySet()) {
            Statement old = ctx.get(entry.getKey());
            provenance.copyStatement(old, entry.getValue());
            inheritOrigins(provenance, old, entry.getValue());
        }
        for (Map.Entry<Integer, Statement> entry : bySlot.entrySet()) {
            provenance.removeStatement(ctx.install(entry.getKey(), entry.getValue()));
        }
        for (Statement dead : ctx.collectGarbage()) {
            provenance.removeStatement(dead);
        }
        return bySlot.size();
    }

    private void inheritOrigins(Provenance provenance, Statement old, Statement parent) {
        for (Statement child : parent.children()) {
            if (!isFresh(child)) {
                continue;
            }
            if (!provenance.hasStatement(child)) {
                provenance.copyStatement(old, child);
            }
            inheritOrigins(provenance, old, child);
        }
    }

    private boolean isFresh(Statement stmt) {
        return ctx.slotOf(stmt) >= watermark;
    }
}
