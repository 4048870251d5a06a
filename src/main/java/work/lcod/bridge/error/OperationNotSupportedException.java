package work.lcod.bridge.error;

/**
 * Raised when an operation is not part of the handler's supported set.
 */
public final class OperationNotSupportedException extends BridgeException {
    public OperationNotSupportedException(String message) {
        super(ErrorKind.UNSUPPORTED_OPERATION, message);
    }
}
