package work.lcod.bridge.coerce;

/**
 * Outcome of {@link CoercionEngine#tryConvert}. A failed conversion still carries the default value.
 */
public record Conversion(boolean succeeded, Object value, String error) {
    public static Conversion ok(Object value) {
        return new Conversion(true, value, null);
    }

    public static Conversion failed(Object fallback, String error) {
        return new Conversion(false, fallback, error);
    }
}
