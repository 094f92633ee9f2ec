package pass.ASTPass.rewrite;

import ast.Builder;
import ast.stmt.Statement;

import java.util.Optional;

/**
 * One structuring rule: pattern check and rewrite in a single step.
 * <p>
 * A rule only looks at {@code node} and its descendants. When the pattern
 * holds it returns a replacement built with {@code builder}; the replacement
 * must be a freshly built node, never {@code node} itself. Otherwise it returns
 * {@link Optional#empty()} and must not have built anything the caller could
 * observe.
 */
public interface RewriteRule<T extends Statement> {
    Optional<Statement> apply(Builder builder, T node);

    default String getName() {
        return getClass().getSimpleName();
    }
}
