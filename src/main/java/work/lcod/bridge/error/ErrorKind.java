package work.lcod.bridge.error;

/**
 * Error taxonomy surfaced in the {@code errorType} field of failure envelopes.
 */
public enum ErrorKind {
    VALIDATION("ValidationError"),
    UNSUPPORTED_OPERATION("UnsupportedOperationError"),
    TARGET_NOT_FOUND("TargetNotFoundError"),
    CONVERSION("ConversionError"),
    HANDLER_EXECUTION("HandlerExecutionError");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
