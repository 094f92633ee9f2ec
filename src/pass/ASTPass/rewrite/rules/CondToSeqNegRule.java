package pass.ASTPass.rewrite.rules;

import ast.Builder;
import ast.stmt.IfStatement;
import ast.stmt.Statement;
import ast.stmt.WhileStatement;
import pass.ASTPass.rewrite.RewriteRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static pass.ASTPass.analysis.BreakAnalysis.hasLoopBreak;
import static pass.ASTPass.analysis.BreakAnalysis.statementsOf;

/**
 * Mirror of {@link CondToSeqRule}:
 * while (true) { if (c) { T } else { E } }     T can exit the loop, E cannot
 * -> while (true) { while (!c) { E } T }
 */
public class CondToSeqNegRule implements RewriteRule<WhileStatement> {
    @Override
    public Optional<Statement> apply(Builder builder, WhileStatement loop) {
        if (!loop.isInfinite()) {
            return Optional.empty();
        }
        List<Statement> body = statementsOf(loop.getBody());
        if (body.size() != 1 || !(body.get(0) instanceof IfStatement ifStmt) || !ifStmt.hasElse()) {
            return Optional.empty();
        }
        if (!hasLoopBreak(ifStmt.getThen()) || hasLoopBreak(ifStmt.getElse())) {
            return Optional.empty();
        }

        List<Statement> outer = new ArrayList<>();
        outer.add(builder.createWhile(builder.createNot(ifStmt.getCondition()), ifStmt.getElse()));
        outer.addAll(statementsOf(ifStmt.getThen()));
        return Optional.of(builder.createWhile(loop.getCondition(), builder.createBlock(outer)));
    }
}
