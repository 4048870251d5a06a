package work.lcod.bridge.types;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Boolean, numeric and string members. Values are stored boxed.
 */
public final class PrimitiveType implements TypeDescriptor {
    private static final Map<PrimitiveKind, PrimitiveType> CACHE = new EnumMap<>(PrimitiveKind.class);

    static {
        for (PrimitiveKind kind : PrimitiveKind.values()) {
            CACHE.put(kind, new PrimitiveType(kind));
        }
    }

    public static final PrimitiveType BOOL = of(PrimitiveKind.BOOL);
    public static final PrimitiveType INT = of(PrimitiveKind.INT);
    public static final PrimitiveType LONG = of(PrimitiveKind.LONG);
    public static final PrimitiveType FLOAT = of(PrimitiveKind.FLOAT);
    public static final PrimitiveType DOUBLE = of(PrimitiveKind.DOUBLE);
    public static final PrimitiveType STRING = of(PrimitiveKind.STRING);

    private final PrimitiveKind kind;

    private PrimitiveType(PrimitiveKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static PrimitiveType of(PrimitiveKind kind) {
        return CACHE.get(kind);
    }

    public PrimitiveKind kind() {
        return kind;
    }

    @Override
    public String displayName() {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public Class<?> javaType() {
        return kind.boxed();
    }

    @Override
    public boolean accepts(Object value) {
        return value != null && value.getClass() == kind.boxed();
    }

    @Override
    public Object defaultValue() {
        return kind.zero();
    }

    @Override
    public String toString() {
        return "PrimitiveType[" + displayName() + "]";
    }
}
