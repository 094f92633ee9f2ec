package solver;

import driver.Config;

import java.util.function.Supplier;

/**
 * OracleFactory: create the Oracle here
 */
public enum OracleType {
    Z3(() -> Z3Oracle.createOrFallback(Config.getInstance().solverTimeoutMs)),
    PROPOSITIONAL(PropositionalOracle::new),
    // never proves anything, turns condition-based refinement into a no-op
    DISABLED(() -> expr -> false),
    ;

    private final Supplier<Oracle> supplier;

    OracleType(Supplier<Oracle> supplier) {
        this.supplier = supplier;
    }

    public Oracle create() {
        return supplier.get();
    }

    public String getName() {
        return name().toLowerCase();
    }

    public static OracleType fromName(String name, OracleType fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        for (OracleType type : values()) {
            if (type.getName().equals(name.trim().toLowerCase())) {
                return type;
            }
        }
        return fallback;
    }
}
