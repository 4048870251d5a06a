package work.lcod.bridge.coerce;

import work.lcod.bridge.error.ConversionException;
import work.lcod.bridge.types.EnumType;
import work.lcod.bridge.types.EnumValue;
import work.lcod.bridge.types.TypeDescriptor;

/**
 * Accepts case-insensitive symbol names or underlying integers. Integers outside the declared
 * symbol set are stored as raw values without validation.
 */
public final class EnumValueConverter implements ValueConverter {
    @Override
    public int priority() {
        return 150;
    }

    @Override
    public boolean canConvert(Object value, TypeDescriptor target) {
        return target instanceof EnumType;
    }

    @Override
    public Object convert(Object value, TypeDescriptor target, CoercionEngine engine) {
        EnumType type = (EnumType) target;
        if (value instanceof EnumValue other) {
            return other.symbol().flatMap(type::parse).orElseGet(() -> type.raw(other.value()));
        }
        if (value instanceof Enum<?> constant) {
            return fromSymbol(type, constant.name());
        }
        if (value instanceof String str) {
            String trimmed = str.trim();
            if (isIntegral(trimmed)) {
                return type.raw(toInt(Long.parseLong(trimmed), type));
            }
            return fromSymbol(type, trimmed);
        }
        if (value instanceof Number num) {
            double asDouble = num.doubleValue();
            if (asDouble != Math.rint(asDouble) || Double.isInfinite(asDouble)) {
                throw new ConversionException(num + " is not an integral value of " + type.name());
            }
            return type.raw(toInt(num.longValue(), type));
        }
        throw new ConversionException("Cannot convert " + PrimitiveValueConverter.typeName(value) + " to " + type.name());
    }

    private static EnumValue fromSymbol(EnumType type, String symbol) {
        return type.parse(symbol).orElseThrow(
            () -> new ConversionException("'" + symbol + "' is not a member of " + type.name() + " " + type.symbols().keySet())
        );
    }

    private static int toInt(long value, EnumType type) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ConversionException(value + " exceeds the underlying int range of " + type.name());
        }
        return (int) value;
    }

    private static boolean isIntegral(String text) {
        if (text.isEmpty()) {
            return false;
        }
        int start = text.charAt(0) == '-' || text.charAt(0) == '+' ? 1 : 0;
        if (start == text.length() || text.length() - start > 18) {
            return false;
        }
        for (int i = start; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
