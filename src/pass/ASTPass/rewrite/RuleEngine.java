package pass.ASTPass.rewrite;

import ast.Builder;
import ast.stmt.Statement;
import exception.StructureException;
import util.LoggingManager;
import util.logging.Logger;

import java.util.List;
import java.util.Optional;

public final class RuleEngine {
    private static final Logger log = LoggingManager.getLogger(RuleEngine.class);

    private RuleEngine() {
    }

    /**
     * Tries {@code rules} in order against {@code node}.
     *
     * @return the replacement built by the first matching rule, or {@code node}
     *         itself if none matches
     */
    public static <T extends Statement> Statement applyFirstMatchingRule(
            Builder builder, T node, List<? extends RewriteRule<? super T>> rules) {
        for (RewriteRule<? super T> rule : rules) {
            Optional<Statement> replacement = rule.apply(builder, node);
            if (replacement.isEmpty()) {
                continue;
            }
            Statement result = replacement.get();
            if (result == node) {
                throw StructureException.ruleMismatch(rule.getName() + " returned its own input");
            }
            log.debug("{} matched slot {}", rule.getName(), node.getId());
            return result;
        }
        return node;
    }
}
