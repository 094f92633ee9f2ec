package ast;

import ast.stmt.*;

public interface StatementVisitor<T> {
    T visit(BlockStatement stmt);

    T visit(IfStatement stmt);

    T visit(WhileStatement stmt);

    T visit(DoWhileStatement stmt);

    T visit(BreakStatement stmt);

    T visit(AssignStatement stmt);

    T visit(ExpressionStatement stmt);

    T visit(ReturnStatement stmt);
}
