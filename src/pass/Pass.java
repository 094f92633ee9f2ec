package pass;

import ast.ASTContext;
import ast.Provenance;

public interface Pass {
    // just a mark class, every family of passes nests its own interface here

    public interface ASTPass extends Pass {
        ASTPassType getType();

        /**
         * Runs one complete traversal of every function of {@code ast}.
         *
         * @return true if the tree was changed
         */
        boolean run(ASTContext ast, Provenance provenance);
    }
}
