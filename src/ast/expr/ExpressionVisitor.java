package ast.expr;

public interface ExpressionVisitor<T> {
    T visit(BoolLiteral expr);

    T visit(IntLiteral expr);

    T visit(VarRef expr);

    T visit(UnaryExpr expr);

    T visit(BinaryExpr expr);

    T visit(CallExpr expr);
}
