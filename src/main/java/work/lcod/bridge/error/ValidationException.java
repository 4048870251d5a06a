package work.lcod.bridge.error;

/**
 * Malformed or missing payload fields.
 */
public final class ValidationException extends BridgeException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
