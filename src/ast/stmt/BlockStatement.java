package ast.stmt;

import ast.ASTContext;
import ast.StatementVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered sequence of statements.
 */
public class BlockStatement extends Statement {
    private final List<Integer> slots;

    public BlockStatement(ASTContext ctx, List<Integer> slots) {
        super(ctx);
        this.slots = List.copyOf(slots);
    }

    public List<Statement> getStatements() {
        List<Statement> result = new ArrayList<>(slots.size());
        for (int slot : slots) {
            result.add(ctx.get(slot));
        }
        return result;
    }

    public int size() {
        return slots.size();
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public Statement get(int index) {
        return ctx.get(slots.get(index));
    }

    public Statement first() {
        return isEmpty() ? null : get(0);
    }

    public Statement last() {
        return isEmpty() ? null : get(slots.size() - 1);
    }

    @Override
    public List<Statement> children() {
        return getStatements();
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
