package work.lcod.bridge.coerce;

import work.lcod.bridge.types.TypeDescriptor;

/**
 * One link of the coercion chain. Converters with a higher priority are consulted first.
 */
public interface ValueConverter {
    int priority();

    boolean canConvert(Object value, TypeDescriptor target);

    /**
     * Converts a non-null value that does not already satisfy {@code target}.
     * Nested values go back through {@code engine}.
     */
    Object convert(Object value, TypeDescriptor target, CoercionEngine engine) throws Exception;

    default String name() {
        return getClass().getSimpleName();
    }
}
