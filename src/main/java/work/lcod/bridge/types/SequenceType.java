package work.lcod.bridge.types;

import java.lang.reflect.Array;
import java.util.List;
import java.util.Objects;

/**
 * Ordered collection member, either a {@link List} or a Java array.
 * The element type may be unknown, in which case coercion yields an empty collection.
 */
public final class SequenceType implements TypeDescriptor {
    public enum Kind {
        LIST,
        ARRAY
    }

    private final TypeDescriptor element;
    private final Kind kind;

    private SequenceType(TypeDescriptor element, Kind kind) {
        this.element = element;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static SequenceType listOf(TypeDescriptor element) {
        return new SequenceType(element, Kind.LIST);
    }

    public static SequenceType arrayOf(TypeDescriptor element) {
        return new SequenceType(element, Kind.ARRAY);
    }

    public TypeDescriptor element() {
        return element;
    }

    public Kind kind() {
        return kind;
    }

    public Class<?> elementJavaType() {
        return element == null ? Object.class : element.javaType();
    }

    @Override
    public String displayName() {
        String inner = element == null ? "?" : element.displayName();
        return kind == Kind.LIST ? "list<" + inner + ">" : inner + "[]";
    }

    @Override
    public Class<?> javaType() {
        return kind == Kind.LIST ? List.class : Array.newInstance(elementJavaType(), 0).getClass();
    }

    @Override
    public boolean accepts(Object value) {
        if (element == null || value == null) {
            return false;
        }
        if (kind == Kind.LIST) {
            if (!(value instanceof List<?> list)) {
                return false;
            }
            for (Object item : list) {
                if (!acceptsItem(item)) {
                    return false;
                }
            }
            return true;
        }
        if (!javaType().isInstance(value)) {
            return false;
        }
        int length = Array.getLength(value);
        for (int i = 0; i < length; i++) {
            Object item = Array.get(value, i);
            if (!acceptsItem(item)) {
                return false;
            }
        }
        return true;
    }

    private boolean acceptsItem(Object item) {
        // a null item survives only where the element default is null too
        return item == null ? element.defaultValue() == null : element.accepts(item);
    }

    @Override
    public Object defaultValue() {
        return null;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SequenceType that && kind == that.kind && Objects.equals(element, that.element);
    }

    @Override
    public int hashCode() {
        return Objects.hash(element, kind);
    }

    @Override
    public String toString() {
        return "SequenceType[" + displayName() + "]";
    }
}
