package work.lcod.bridge.error;

/**
 * A single value failed coercion. The engine absorbs these; they only surface as per-field failures.
 */
public final class ConversionException extends BridgeException {
    public ConversionException(String message) {
        super(ErrorKind.CONVERSION, message);
    }

    public ConversionException(String message, Throwable cause) {
        super(ErrorKind.CONVERSION, message, cause);
    }
}
