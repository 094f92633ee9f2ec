package pass;

import java.util.Set;
import java.util.function.Supplier;

/**
 * pass type factory, implemented by the enums listing the available passes
 */
public interface PassType<T extends Pass> {
    Supplier<T> constructor();

    /** a fresh instance of the pass */
    default T create() {
        return constructor().get();
    }

    /** lower-case enum name, as used by {@code -Dast.passes} */
    default String getName() {
        return ((Enum<?>) this).name().toLowerCase();
    }

    /** an empty filter selects every pass */
    default boolean isSelectedBy(Set<String> filter) {
        return filter.isEmpty() || filter.contains(getName());
    }
}
