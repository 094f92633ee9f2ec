package ast.expr;

import ast.ASTPrinter;

/**
 * Guard and value expressions. Expressions are immutable and compared by
 * identity: provenance is attached to each object, so a negated guard is a new
 * object even when its text equals an existing one.
 */
public abstract class Expression {
    public static final int PREC_PRIMARY = 12;
    public static final int PREC_UNARY = 11;

    public abstract <T> T accept(ExpressionVisitor<T> visitor);

    /**
     * @return true if the expression denotes a truth value rather than an integer
     */
    public abstract boolean isBoolean();

    /**
     * Binding strength used when printing, higher binds tighter.
     */
    public int precedence() {
        return PREC_PRIMARY;
    }

    @Override
    public String toString() {
        return ASTPrinter.print(this);
    }
}
