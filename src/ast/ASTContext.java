package ast;

import ast.stmt.Statement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Arena owning every statement of one translation unit. Each statement gets a
 * stable slot when it is built; parents refer to children by slot. Committing
 * a rewrite installs the replacement into the slot of the statement it
 * replaces, so the old statement becomes unreachable in one write; its slot
 * and those of its dropped descendants are freed by {@link #collectGarbage()}.
 */
public class ASTContext {
    private final String name;
    private final List<Statement> slots = new ArrayList<>();
    private final Map<Statement, Integer> slotOf = new IdentityHashMap<>();
    private final List<Function> functions = new ArrayList<>();

    public ASTContext(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Called by every statement constructor.
     * @return the slot assigned to {@code stmt}
     */
    public int register(Statement stmt) {
        int slot = slots.size();
        slots.add(stmt);
        slotOf.put(stmt, slot);
        return slot;
    }

    public Statement get(int slot) {
        Statement stmt = slot >= 0 && slot < slots.size() ? slots.get(slot) : null;
        if (stmt == null) {
            throw new IllegalStateException("No statement in slot " + slot + " of " + name);
        }
        return stmt;
    }

    public int slotOf(Statement stmt) {
        Integer slot = slotOf.get(stmt);
        if (slot == null) {
            throw new IllegalStateException("Statement is not live in " + name);
        }
        return slot;
    }

    /**
     * @return true if {@code stmt} currently occupies a slot of this arena
     */
    public boolean isLive(Statement stmt) {
        return slotOf.containsKey(stmt);
    }

    /**
     * Number of slots handed out so far. Statements built later get a slot at or
     * above this mark.
     */
    public int size() {
        return slots.size();
    }

    /**
     * Moves {@code replacement} into {@code slot}, dropping the statement that
     * lived there. The slot {@code replacement} was born in is freed.
     *
     * @return the statement that was replaced
     */
    public Statement install(int slot, Statement replacement) {
        Statement old = get(slot);
        int birthSlot = slotOf(replacement);
        slots.set(birthSlot, null);
        slots.set(slot, replacement);
        slotOf.remove(old);
        slotOf.put(replacement, slot);
        return old;
    }

    /**
     * Frees the slot of every statement that can no longer be reached from a
     * function body.
     *
     * @return the statements that were dropped, in slot order
     */
    public List<Statement> collectGarbage() {
        Set<Statement> reachable = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Statement> worklist = new ArrayDeque<>();
        for (Function f : functions) {
            worklist.push(f.getBody());
        }
        while (!worklist.isEmpty()) {
            Statement stmt = worklist.pop();
            if (reachable.add(stmt)) {
                stmt.children().forEach(worklist::push);
            }
        }

        List<Statement> dropped = new ArrayList<>();
        for (int slot = 0; slot < slots.size(); slot++) {
            Statement stmt = slots.get(slot);
            if (stmt != null && !reachable.contains(stmt)) {
                slots.set(slot, null);
                slotOf.remove(stmt);
                dropped.add(stmt);
            }
        }
        return dropped;
    }

    /**
     * Number of statements currently occupying a slot.
     */
    public int liveCount() {
        return slotOf.size();
    }

    public void addFunction(Function function) {
        functions.add(function);
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public Function getFunction(String functionName) {
        for (Function f : functions) {
            if (f.getName().equals(functionName)) {
                return f;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return ASTPrinter.print(this);
    }
}
