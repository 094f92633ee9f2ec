package pass.ASTPass.rewrite.rules;

import ast.Builder;
import ast.stmt.IfStatement;
import ast.stmt.Statement;
import ast.stmt.WhileStatement;
import pass.ASTPass.rewrite.RewriteRule;

import java.util.List;
import java.util.Optional;

import static pass.ASTPass.analysis.BreakAnalysis.isBreakOnly;
import static pass.ASTPass.analysis.BreakAnalysis.statementsOf;

/**
 * while (true) { S if (c) { break; } }
 * -> do { S } while (!c);
 * <p>
 * Moving an else-branch into the body would run it before the test instead of
 * after it, so a trailing if/else is left alone.
 */
public class DoWhileRule implements RewriteRule<WhileStatement> {
    @Override
    public Optional<Statement> apply(Builder builder, WhileStatement loop) {
        if (!loop.isInfinite()) {
            return Optional.empty();
        }
        List<Statement> body = statementsOf(loop.getBody());
        if (body.isEmpty() || !(body.get(body.size() - 1) instanceof IfStatement last)
                || last.hasElse() || !isBreakOnly(last.getThen())) {
            return Optional.empty();
        }

        return Optional.of(builder.createDoWhile(builder.createNot(last.getCondition()),
                builder.createBlock(body.subList(0, body.size() - 1))));
    }
}
