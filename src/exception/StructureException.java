package exception;

/**
 * Fatal error of the structuring pipeline. Every factory below names an
 * invariant whose violation means the rewritten tree can no longer be trusted.
 */
public class StructureException extends RuntimeException {
    public StructureException(String message) {
        super(message);
    }

    public StructureException(String message, Throwable cause) {
        super(message, cause);
    }

    public static StructureException noArgs() {
        return new StructureException("need args to process");
    }

    public static StructureException wrongArgs(String msg) {
        return new StructureException("Unexpected args: " + msg);
    }

    public static StructureException parseError(String msg) {
        return new StructureException("Parse error: " + msg);
    }

    public static StructureException ruleMismatch(String msg) {
        return new StructureException("Rule applied to a node it did not match: " + msg);
    }

    public static StructureException danglingBreak(String msg) {
        return new StructureException("Break outside of any loop: " + msg);
    }

    public static StructureException sharedStatement(String function, int slot) {
        return new StructureException("Slot " + slot + " reachable twice in function " + function);
    }

    public static StructureException duplicateSubstitution(int slot) {
        return new StructureException("Slot " + slot + " substituted twice in one pass");
    }

    public static StructureException doubleCommit() {
        return new StructureException("Substitution map committed twice");
    }

    public static StructureException foreignReplacement(String msg) {
        return new StructureException("Replacement was not built in the current pass: " + msg);
    }

    public static StructureException noConvergence(String stage, int iterations, int changed) {
        return new StructureException("Stage '" + stage + "' did not reach a fixpoint after "
                + iterations + " iterations (" + changed + " passes still changing)");
    }

    public static StructureException unSupported(String msg) {
        return new StructureException("UnSupported: " + msg);
    }
}
