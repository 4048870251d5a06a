package work.lcod.bridge.error;

import java.util.Objects;

/**
 * Exception carrying the bridge error kind for handlers and converters.
 */
public class BridgeException extends RuntimeException {
    private final ErrorKind kind;

    public BridgeException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public BridgeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
