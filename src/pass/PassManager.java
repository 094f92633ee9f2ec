package pass;

import ast.ASTContext;
import ast.Provenance;
import driver.Config;
import exception.StructureException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import pass.ASTPass.rewrite.TransformPass;
import pass.Pass.ASTPass;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Pipeline driver. Runs the stages in order, each to its fixpoint:
 * condition refinement, then loop refinement, then a final cleanup. A stage
 * is never revisited once the next one has started.
 */
public class PassManager {
    private final List<ASTPass> condPipeline = new ArrayList<>();
    private final List<ASTPass> loopPipeline = new ArrayList<>();
    private final List<ASTPass> finalPipeline = new ArrayList<>();
    private final ASTPass verifier = ASTPassType.VerifyAST.create();

    private final Set<String> enabledAST;

    private final Logger log = LoggingManager.getLogger(PassManager.class);

    private static PassManager INSTANCE = null;

    public static PassManager getInstance() {
        if (INSTANCE == null) {
            INSTANCE = new PassManager();
        }
        return INSTANCE;
    }

    private PassManager() {
        // read the system property
        // eg: -Dast.passes=looprefine,nestedscopecombine
        enabledAST = loadEnabled("ast.passes");

        setPipeline(condPipeline, ASTPassType.CondBasedRefine, ASTPassType.NestedScopeCombine);
        setPipeline(loopPipeline, ASTPassType.LoopRefine, ASTPassType.NestedScopeCombine);
        setPipeline(finalPipeline, ASTPassType.NestedScopeCombine);
    }

    /**
     * Reset the singleton instance (used for testing different configurations)
     */
    public static void resetInstance() {
        if (INSTANCE != null) {
            INSTANCE.close();
        }
        INSTANCE = null;
    }

    /** read "a,b,c" from system property and convert them to Set */
    private Set<String> loadEnabled(String propName) {
        String raw = System.getProperty(propName, "").trim();
        if (raw.isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .map(String::toLowerCase)
                .collect(Collectors.toSet());
    }

    /**
     * set a stage in order (clears it first)
     */
    private void setPipeline(List<ASTPass> stage, ASTPassType... types) {
        stage.clear();
        for (ASTPassType type : types) {
            if (type.isSelectedBy(enabledAST)) {
                stage.add(type.create());
            }
        }
    }

    public void run(ASTContext ast, Provenance provenance) {
        runStage("cond", condPipeline, true, ast, provenance);
        runStage("loop", loopPipeline, true, ast, provenance);
        runStage("final", finalPipeline, false, ast, provenance);
    }

    /**
     * Runs {@code passes} round after round while any of them reports a change,
     * or once if {@code fixpoint} is false.
     */
    private void runStage(String stage, List<ASTPass> passes, boolean fixpoint,
                          ASTContext ast, Provenance provenance) {
        int maxIterations = Config.getInstance().maxIterations;
        log.info("[AST] stage {}: {}", stage,
                passes.stream().map(p -> p.getType().getName()).collect(Collectors.joining(", ")));

        int rounds = 0;
        int changedPasses;
        int substitutions = 0;
        do {
            changedPasses = 0;
            for (ASTPass p : passes) {
                if (p.run(ast, provenance)) {
                    changedPasses++;
                    if (p instanceof TransformPass t) {
                        substitutions += t.getLastSubstitutionCount();
                    }
                    if (log.isDebugEnabled()) {
                        log.debug("[AST] {} changed the tree in round {}", p.getType().getName(), rounds + 1);
                    }
                }
            }
            rounds++;
            if (fixpoint && changedPasses > 0 && rounds >= maxIterations) {
                log.error("[AST] stage {} still changing after {} rounds: {} passes, {} substitutions so far",
                        stage, rounds, changedPasses, substitutions);
                throw StructureException.noConvergence(stage, rounds, changedPasses);
            }
        } while (fixpoint && changedPasses > 0);

        log.info("[AST] stage {} done after {} rounds, {} substitutions", stage, rounds, substitutions);

        if (Config.getInstance().verify) {
            verifier.run(ast, provenance);
        }
    }

    // look up a pass of the pipeline by class
    @SuppressWarnings("unchecked")
    public <T extends Pass> T getPass(Class<T> cls) {
        for (List<ASTPass> stage : List.of(condPipeline, loopPipeline, finalPipeline)) {
            for (Pass p : stage) {
                if (cls.isInstance(p)) {
                    return (T) p;
                }
            }
        }
        throw StructureException.unSupported("no pass of type " + cls.getName() + " in the pipeline");
    }

    /**
     * Releases passes holding native resources (the solver context).
     */
    public void close() {
        for (List<ASTPass> stage : List.of(condPipeline, loopPipeline, finalPipeline)) {
            for (ASTPass p : stage) {
                if (p instanceof AutoCloseable closeable) {
                    try {
                        closeable.close();
                    } catch (Exception e) {
                        log.warn("failed to close {}: {}", p.getType().getName(), e.getMessage());
                    }
                }
            }
        }
    }
}
