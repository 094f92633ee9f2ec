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
 * while (true) { if (c) { T } else { E } }     T cannot exit the loop, E can
 * -> while (true) { while (c) { T } E }
 */
public class CondToSeqRule implements RewriteRule<WhileStatement> {
    @Override
    public Optional<Statement> apply(Builder builder, WhileStatement loop) {
        if (!loop.isInfinite()) {
            return Optional.empty();
        }
        List<Statement> body = statementsOf(loop.getBody());
        if (body.size() != 1 || !(body.get(0) instanceof IfStatement ifStmt) || !ifStmt.hasElse()) {
            return Optional.empty();
        }
        if (hasLoopBreak(ifStmt.getThen()) || !hasLoopBreak(ifStmt.getElse())) {
            return Optional.empty();
        }

        List<Statement> outer = new ArrayList<>();
        outer.add(builder.createWhile(ifStmt.getCondition(), ifStmt.getThen()));
        outer.addAll(statementsOf(ifStmt.getElse()));
        return Optional.of(builder.createWhile(loop.getCondition(), builder.createBlock(outer)));
    }
}
