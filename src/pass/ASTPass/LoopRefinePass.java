package pass.ASTPass;

import ast.stmt.Statement;
import ast.stmt.WhileStatement;

import java.util.List;
import pass.ASTPass.rewrite.RewriteRule;
import pass.ASTPass.rewrite.RuleEngine;
import pass.ASTPass.rewrite.TransformPass;
import pass.ASTPass.rewrite.rules.*;
import pass.ASTPassType;

/**
 * Turns {@code while (true)} loops guarded by breaks into conditioned loops or
 * plain sequences. At most one rule fires per loop and run.
 */
public class LoopRefinePass extends TransformPass {
    @Override
    public ASTPassType getType() {
        return ASTPassType.LoopRefine;
    }

    /** rules in priority order: the first one that matches wins */
    private final List<RewriteRule<WhileStatement>> rules = List.of(
            new CondToSeqRule(),
            new CondToSeqNegRule(),
            new NestedDoWhileRule(),
            new LoopToSeqRule(),
            new WhileRule(),
            new DoWhileRule()
    );

    @Override
    protected void visit(Statement stmt) {
        if (stmt instanceof WhileStatement loop && loop.isInfinite()) {
            substitute(loop, RuleEngine.applyFirstMatchingRule(builder, loop, rules));
        }
    }
}
