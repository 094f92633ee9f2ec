package pass.ASTPass;

import ast.ASTContext;
import ast.Function;
import ast.Provenance;
import ast.stmt.BreakStatement;
import ast.stmt.LoopStatement;
import ast.stmt.Statement;
import exception.StructureException;
import pass.ASTPassType;
import pass.Pass;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Lightweight AST verifier, run after each stage:
 * - every break has an enclosing loop
 * - no statement is reachable along two paths
 * Never changes the tree.
 */
public class VerifyASTPass implements Pass.ASTPass {
    @Override
    public ASTPassType getType() {
        return ASTPassType.VerifyAST;
    }

    @Override
    public boolean run(ASTContext ast, Provenance provenance) {
        for (Function f : ast.getFunctions()) {
            Set<Statement> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            verify(f, f.getBody(), 0, seen);
        }
        return false;
    }

    private void verify(Function f, Statement stmt, int loopDepth, Set<Statement> seen) {
        if (!seen.add(stmt)) {
            throw StructureException.sharedStatement(f.getName(), stmt.getId());
        }
        if (stmt instanceof BreakStatement && loopDepth == 0) {
            throw StructureException.danglingBreak("in function " + f.getName() + ", slot " + stmt.getId());
        }
        int childDepth = stmt instanceof LoopStatement ? loopDepth + 1 : loopDepth;
        for (Statement child : stmt.children()) {
            verify(f, child, childDepth, seen);
        }
    }
}
