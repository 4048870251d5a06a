package work.lcod.bridge.types;

import java.util.Locale;

public enum PrimitiveKind {
    BOOL(Boolean.class, false),
    BYTE(Byte.class, (byte) 0),
    SHORT(Short.class, (short) 0),
    INT(Integer.class, 0),
    LONG(Long.class, 0L),
    FLOAT(Float.class, 0f),
    DOUBLE(Double.class, 0d),
    STRING(String.class, null);

    private final Class<?> boxed;
    private final Object zero;

    PrimitiveKind(Class<?> boxed, Object zero) {
        this.boxed = boxed;
        this.zero = zero;
    }

    public Class<?> boxed() {
        return boxed;
    }

    public Object zero() {
        return zero;
    }

    public boolean isNumeric() {
        return this != BOOL && this != STRING;
    }

    public static PrimitiveKind from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Primitive kind is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "BOOLEAN" -> BOOL;
            case "INTEGER" -> INT;
            default -> {
                try {
                    yield PrimitiveKind.valueOf(normalized);
                } catch (IllegalArgumentException ex) {
                    throw new IllegalArgumentException("Unsupported primitive kind: " + value);
                }
            }
        };
    }
}
