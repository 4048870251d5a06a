package work.lcod.bridge.types;

import java.util.Objects;

/**
 * Any Java type without a dedicated converter. Coerced through a structural round trip.
 */
public final class OpaqueType implements TypeDescriptor {
    private final Class<?> javaType;

    private OpaqueType(Class<?> javaType) {
        this.javaType = Objects.requireNonNull(javaType, "javaType");
    }

    public static OpaqueType of(Class<?> javaType) {
        return new OpaqueType(javaType);
    }

    @Override
    public String displayName() {
        return javaType.getSimpleName();
    }

    @Override
    public Class<?> javaType() {
        return javaType;
    }

    @Override
    public boolean accepts(Object value) {
        return javaType.isInstance(value);
    }

    @Override
    public Object defaultValue() {
        return null;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof OpaqueType that && javaType.equals(that.javaType);
    }

    @Override
    public int hashCode() {
        return javaType.hashCode();
    }

    @Override
    public String toString() {
        return "OpaqueType[" + javaType.getName() + "]";
    }
}
