package pass.ASTPass.rewrite.rules;

import ast.Builder;
import ast.stmt.IfStatement;
import ast.stmt.Statement;
import ast.stmt.WhileStatement;
import pass.ASTPass.rewrite.RewriteRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static pass.ASTPass.analysis.BreakAnalysis.isBreakOnly;
import static pass.ASTPass.analysis.BreakAnalysis.statementsOf;

/**
 * while (true) { if (c) { break; } [else { E }] S }
 * -> while (!c) { E S }
 */
public class WhileRule implements RewriteRule<WhileStatement> {
    @Override
    public Optional<Statement> apply(Builder builder, WhileStatement loop) {
        if (!loop.isInfinite()) {
            return Optional.empty();
        }
        List<Statement> body = statementsOf(loop.getBody());
        if (body.isEmpty() || !(body.get(0) instanceof IfStatement first) || !isBreakOnly(first.getThen())) {
            return Optional.empty();
        }

        List<Statement> newBody = new ArrayList<>();
        if (first.hasElse()) {
            newBody.addAll(statementsOf(first.getElse()));
        }
        newBody.addAll(body.subList(1, body.size()));
        return Optional.of(builder.createWhile(builder.createNot(first.getCondition()),
                builder.createBlock(newBody)));
    }
}
