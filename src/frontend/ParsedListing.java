package frontend;

import ast.ASTContext;
import ast.Builder;
import ast.Provenance;

/**
 * A freshly generated unit together with the provenance covering it.
 */
public record ParsedListing(ASTContext ast, Provenance provenance) {
    public Builder builder() {
        return new Builder(ast, provenance);
    }
}
