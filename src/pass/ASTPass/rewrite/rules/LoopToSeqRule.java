package pass.ASTPass.rewrite.rules;

import ast.Builder;
import ast.stmt.BreakStatement;
import ast.stmt.IfStatement;
import ast.stmt.Statement;
import ast.stmt.WhileStatement;
import pass.ASTPass.rewrite.RewriteRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static pass.ASTPass.analysis.BreakAnalysis.cleanBreakIndex;
import static pass.ASTPass.analysis.BreakAnalysis.hasLoopBreak;
import static pass.ASTPass.analysis.BreakAnalysis.statementsOf;

/**
 * An infinite loop whose body always leaves on its first iteration is just its
 * body. The body ends at the first statement that always breaks: a bare
 * {@code break}, or an if/else whose branches both break directly.
 * <pre>
 * while (true) { S; break; U }                         -> { S }
 * while (true) { S; if (c) { A; break; } else { B; break; } U }
 *                                                      -> { S; if (c) { A } else { B } }
 * </pre>
 * Nothing before the terminating statement may break, and neither may A nor B.
 * U is unreachable and dropped.
 */
public class LoopToSeqRule implements RewriteRule<WhileStatement> {
    @Override
    public Optional<Statement> apply(Builder builder, WhileStatement loop) {
        if (!loop.isInfinite()) {
            return Optional.empty();
        }
        List<Statement> body = statementsOf(loop.getBody());
        for (int i = 0; i < body.size(); i++) {
            Statement stmt = body.get(i);
            if (stmt instanceof BreakStatement) {
                return Optional.of(builder.createBlock(body.subList(0, i)));
            }
            if (stmt instanceof IfStatement ifStmt && alwaysBreaks(ifStmt)) {
                List<Statement> seq = new ArrayList<>(body.subList(0, i));
                seq.add(builder.createIf(ifStmt.getCondition(),
                        truncate(builder, ifStmt.getThen()), truncate(builder, ifStmt.getElse())));
                return Optional.of(builder.createBlock(seq));
            }
            if (hasLoopBreak(stmt)) {
                // a conditional break ahead of the terminator
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static boolean alwaysBreaks(IfStatement ifStmt) {
        return ifStmt.hasElse() && cleanBreakIndex(ifStmt.getThen()) >= 0
                && cleanBreakIndex(ifStmt.getElse()) >= 0;
    }

    private static Statement truncate(Builder builder, Statement branch) {
        List<Statement> stmts = statementsOf(branch);
        return builder.createBlock(stmts.subList(0, cleanBreakIndex(branch)));
    }
}
