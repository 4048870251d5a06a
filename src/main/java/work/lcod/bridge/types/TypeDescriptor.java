package work.lcod.bridge.types;

/**
 * Statically-known shape a member requires. Implementations are immutable and built once at startup.
 */
public interface TypeDescriptor {
    /**
     * Human-readable name used in diagnostics and failure messages.
     */
    String displayName();

    /**
     * Java type values of this descriptor are stored as.
     */
    Class<?> javaType();

    /**
     * Whether {@code value} already satisfies this shape and can be used unchanged.
     */
    boolean accepts(Object value);

    /**
     * Zero/default value for value kinds, {@code null} otherwise.
     */
    Object defaultValue();
}
