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
 * while (true) { S; if (c) { T } }     T may exit the loop, S may not
 * -> while (true) { do { S } while (!c); T }
 * <p>
 * The break in T may sit anywhere inside it. An else-branch or a break in S
 * would change meaning once S moves into the inner loop, so both are refused.
 */
public class NestedDoWhileRule implements RewriteRule<WhileStatement> {
    @Override
    public Optional<Statement> apply(Builder builder, WhileStatement loop) {
        if (!loop.isInfinite()) {
            return Optional.empty();
        }
        List<Statement> body = statementsOf(loop.getBody());
        if (body.isEmpty() || !(body.get(body.size() - 1) instanceof IfStatement last) || last.hasElse()) {
            return Optional.empty();
        }
        List<Statement> prefix = body.subList(0, body.size() - 1);
        if (!hasLoopBreak(last.getThen()) || hasLoopBreak(prefix)) {
            return Optional.empty();
        }

        List<Statement> outer = new ArrayList<>();
        outer.add(builder.createDoWhile(builder.createNot(last.getCondition()), builder.createBlock(prefix)));
        outer.addAll(statementsOf(last.getThen()));
        return Optional.of(builder.createWhile(loop.getCondition(), builder.createBlock(outer)));
    }
}
