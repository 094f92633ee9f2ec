package solver;

import ast.expr.Expression;
import frontend.ListingLoader;
import ast.stmt.ExpressionStatement;
import ast.stmt.BlockStatement;

/**
 * Parses guard text into an expression for the oracle tests.
 */
final class OracleTestSupport {
    private OracleTestSupport() {
    }

    static Expression expr(String text) {
        var listing = ListingLoader.loadSnippet(text + ";", "guard.lst");
        BlockStatement body = (BlockStatement) listing.ast().getFunction(ListingLoader.SNIPPET_FUNCTION).getBody();
        return ((ExpressionStatement) body.first()).getExpression();
    }
}
