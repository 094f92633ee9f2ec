package pass.ASTPass;

import ast.stmt.BlockStatement;
import ast.stmt.Statement;

import java.util.ArrayList;
import java.util.List;
import pass.ASTPass.rewrite.TransformPass;
import pass.ASTPassType;

/**
 * Splices a block that sits directly inside another block into its parent:
 * { a; { b; c; } d; } -> { a; b; c; d; }
 */
public class NestedScopeCombinePass extends TransformPass {
    @Override
    public ASTPassType getType() {
        return ASTPassType.NestedScopeCombine;
    }

    @Override
    protected void visit(Statement stmt) {
        if (!(stmt instanceof BlockStatement block)) {
            return;
        }
        List<Statement> stmts = block.getStatements();
        if (stmts.stream().noneMatch(s -> s instanceof BlockStatement)) {
            return;
        }
        List<Statement> flat = new ArrayList<>();
        for (Statement s : stmts) {
            if (s instanceof BlockStatement inner) {
                flat.addAll(inner.getStatements());
            } else {
                flat.add(s);
            }
        }
        substitute(block, builder.createBlock(flat));
    }
}
