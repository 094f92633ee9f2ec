package ast.expr;

/**
 * Read of a named integer variable.
 */
public class VarRef extends Expression {
    private final String name;

    public VarRef(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean isBoolean() {
        return false;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
