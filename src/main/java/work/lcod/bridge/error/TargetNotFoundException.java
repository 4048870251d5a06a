package work.lcod.bridge.error;

/**
 * A resolver returned nothing for a reference the operation requires.
 */
public final class TargetNotFoundException extends BridgeException {
    private final String identifier;

    public TargetNotFoundException(String message, String identifier) {
        super(ErrorKind.TARGET_NOT_FOUND, message);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
