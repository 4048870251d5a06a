package work.lcod.bridge.types;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * One entry of a composite type's member table.
 *
 * <p>Properties are visible when they have a setter. Fields are visible only when declared
 * {@code serialized}; unmarked fields exist on the instance but stay hidden from payloads.
 */
public record MemberDescriptor(
    String name,
    TypeDescriptor type,
    Kind kind,
    boolean serialized,
    Function<Object, Object> getter,
    BiConsumer<Object, Object> setter
) {
    public enum Kind {
        PROPERTY,
        FIELD
    }

    public MemberDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Member name is required");
        }
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(kind, "kind");
    }

    public boolean isWritableProperty() {
        return kind == Kind.PROPERTY && setter != null;
    }

    public boolean isVisibleField() {
        return kind == Kind.FIELD && serialized && setter != null;
    }

    /**
     * Members a payload may write to.
     */
    public boolean isWritable() {
        return isWritableProperty() || isVisibleField();
    }

    /**
     * Members an inspection may read from.
     */
    public boolean isReadable() {
        return getter != null && (kind == Kind.PROPERTY || serialized);
    }

    public Object read(Object target) {
        if (getter == null) {
            throw new IllegalStateException("Member '" + name + "' is not readable");
        }
        return getter.apply(target);
    }

    public void write(Object target, Object value) {
        if (setter == null) {
            throw new IllegalStateException("Member '" + name + "' is not writable");
        }
        setter.accept(target, value);
    }
}
