package pass;

import java.util.function.Supplier;
import pass.ASTPass.*;
import pass.Pass.ASTPass;

/**
 * ASTPassFactory: create the ASTPass here
 */
public enum ASTPassType implements PassType<ASTPass> {
    CondBasedRefine(CondBasedRefinePass::new),
    LoopRefine(LoopRefinePass::new),
    NestedScopeCombine(NestedScopeCombinePass::new),
    VerifyAST(VerifyASTPass::new),
    // add more astpass here
    ;

    private final Supplier<ASTPass> supplier;

    ASTPassType(Supplier<ASTPass> constructor) {
        this.supplier = constructor;
    }

    @Override
    public Supplier<ASTPass> constructor() {
        return supplier;
    }
}
