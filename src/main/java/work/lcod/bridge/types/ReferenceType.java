package work.lcod.bridge.types;

import java.util.Objects;

/**
 * Member holding a live object owned by the external graph.
 */
public final class ReferenceType implements TypeDescriptor {
    private final Class<?> kind;

    private ReferenceType(Class<?> kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static ReferenceType of(Class<?> kind) {
        return new ReferenceType(kind);
    }

    public Class<?> kind() {
        return kind;
    }

    @Override
    public String displayName() {
        return "ref<" + kind.getSimpleName() + ">";
    }

    @Override
    public Class<?> javaType() {
        return kind;
    }

    @Override
    public boolean accepts(Object value) {
        return kind.isInstance(value);
    }

    @Override
    public Object defaultValue() {
        return null;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ReferenceType that && kind.equals(that.kind);
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }

    @Override
    public String toString() {
        return "ReferenceType[" + kind.getName() + "]";
    }
}
