package ast.stmt;

import ast.ASTContext;
import ast.ASTPrinter;
import ast.StatementVisitor;

import java.util.List;

/**
 * Base class of all statements. A statement lives in one slot of its
 * {@link ASTContext}; compound statements refer to their children by slot, so
 * installing a replacement into a slot updates every parent at once.
 */
public abstract class Statement {
    protected final ASTContext ctx;

    protected Statement(ASTContext ctx) {
        this.ctx = ctx;
        ctx.register(this);
    }

    public ASTContext getContext() {
        return ctx;
    }

    /**
     * @return the slot this statement currently occupies
     */
    public int getId() {
        return ctx.slotOf(this);
    }

    /**
     * Direct child statements in source order.
     */
    public List<Statement> children() {
        return List.of();
    }

    public abstract <T> T accept(StatementVisitor<T> visitor);

    @Override
    public String toString() {
        return ASTPrinter.print(this);
    }
}
