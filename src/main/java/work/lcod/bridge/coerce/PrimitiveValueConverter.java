package work.lcod.bridge.coerce;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import work.lcod.bridge.error.ConversionException;
import work.lcod.bridge.types.EnumValue;
import work.lcod.bridge.types.PrimitiveKind;
import work.lcod.bridge.types.PrimitiveType;
import work.lcod.bridge.types.TypeDescriptor;

/**
 * Numeric widening/narrowing (fractions truncate), strict boolean parsing, and textual form for strings.
 */
public final class PrimitiveValueConverter implements ValueConverter {
    private static final double TWO_POW_63 = 0x1p63;

    private final ObjectMapper json;

    public PrimitiveValueConverter(ObjectMapper json) {
        this.json = Objects.requireNonNull(json, "json");
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public boolean canConvert(Object value, TypeDescriptor target) {
        return target instanceof PrimitiveType;
    }

    @Override
    public Object convert(Object value, TypeDescriptor target, CoercionEngine engine) {
        PrimitiveKind kind = ((PrimitiveType) target).kind();
        if (kind == PrimitiveKind.STRING) {
            return textOf(value);
        }
        Object raw = value instanceof EnumValue ev ? ev.value() : value;
        if (kind == PrimitiveKind.BOOL) {
            return toBool(raw);
        }
        return narrow(toNumber(raw, kind), kind);
    }

    String textOf(Object value) {
        if (value instanceof String str) {
            return str;
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return json.writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                throw new ConversionException("Unable to render " + value.getClass().getSimpleName() + " as text", ex);
            }
        }
        return String.valueOf(value);
    }

    private static Boolean toBool(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number num) {
            return num.doubleValue() != 0d;
        }
        if (value instanceof String str) {
            String trimmed = str.trim();
            if ("true".equalsIgnoreCase(trimmed)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(trimmed)) {
                return Boolean.FALSE;
            }
            throw new ConversionException("'" + str + "' is not a valid bool");
        }
        throw new ConversionException("Cannot convert " + typeName(value) + " to bool");
    }

    private static Number toNumber(Object value, PrimitiveKind kind) {
        if (value instanceof Number num) {
            return num;
        }
        if (value instanceof Boolean bool) {
            return bool ? 1 : 0;
        }
        if (value instanceof String str && !str.isBlank()) {
            String trimmed = str.trim();
            try {
                if (kind == PrimitiveKind.FLOAT || kind == PrimitiveKind.DOUBLE) {
                    return Double.parseDouble(trimmed);
                }
                return Long.parseLong(trimmed);
            } catch (NumberFormatException ex) {
                try {
                    return Double.parseDouble(trimmed);
                } catch (NumberFormatException nested) {
                    throw new ConversionException("'" + str + "' is not a valid " + kind.name().toLowerCase(Locale.ROOT), nested);
                }
            }
        }
        throw new ConversionException("Cannot convert " + typeName(value) + " to " + kind.name().toLowerCase(Locale.ROOT));
    }

    private static Object narrow(Number number, PrimitiveKind kind) {
        return switch (kind) {
            case BYTE -> (byte) integral(number, kind, Byte.MIN_VALUE, Byte.MAX_VALUE);
            case SHORT -> (short) integral(number, kind, Short.MIN_VALUE, Short.MAX_VALUE);
            case INT -> (int) integral(number, kind, Integer.MIN_VALUE, Integer.MAX_VALUE);
            case LONG -> integral(number, kind, Long.MIN_VALUE, Long.MAX_VALUE);
            case FLOAT -> number.floatValue();
            case DOUBLE -> number.doubleValue();
            default -> throw new ConversionException("Unsupported numeric kind: " + kind);
        };
    }

    /**
     * Truncates fractions toward zero, then rejects anything outside {@code [min, max]}.
     */
    private static long integral(Number number, PrimitiveKind kind, long min, long max) {
        long value;
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            value = number.longValue();
        } else if (number instanceof BigInteger big) {
            if (big.bitLength() > 63) {
                throw outOfRange(number, kind);
            }
            value = big.longValue();
        } else {
            double real = number.doubleValue();
            if (Double.isNaN(real) || real < -TWO_POW_63 || real >= TWO_POW_63) {
                throw outOfRange(number, kind);
            }
            value = (long) real;
        }
        if (value < min || value > max) {
            throw outOfRange(number, kind);
        }
        return value;
    }

    private static ConversionException outOfRange(Number number, PrimitiveKind kind) {
        return new ConversionException("Value " + number + " is out of range for " + kind.name().toLowerCase(Locale.ROOT));
    }

    static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
