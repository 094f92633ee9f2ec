package ast;

import ast.stmt.BlockStatement;
import ast.stmt.Statement;

/**
 * A function of the unit: the root of one statement tree.
 */
public class Function {
    private final ASTContext ctx;
    private final String name;
    private final String returnType;
    private final int bodySlot;

    public Function(ASTContext ctx, String name, String returnType, BlockStatement body) {
        this.ctx = ctx;
        this.name = name;
        this.returnType = returnType;
        this.bodySlot = body.getId();
    }

    public String getName() {
        return name;
    }

    public String getReturnType() {
        return returnType;
    }

    public Statement getBody() {
        return ctx.get(bodySlot);
    }

    @Override
    public String toString() {
        return ASTPrinter.print(this);
    }
}
