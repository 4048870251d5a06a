package work.lcod.bridge.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the uniform {@code {success:false, error, errorType, category}} failure envelope.
 */
public final class ErrorEnvelopes {
    private ErrorEnvelopes() {}

    public static Map<String, Object> fromThrowable(Throwable error, String category) {
        return failure(kindOf(error), messageOf(error), category);
    }

    public static Map<String, Object> failure(ErrorKind kind, String message, String category) {
        var map = new LinkedHashMap<String, Object>();
        map.put("success", false);
        map.put("error", message == null || message.isBlank() ? "Unexpected error" : message);
        map.put("errorType", kind.wireName());
        map.put("category", category);
        return map;
    }

    public static ErrorKind kindOf(Throwable error) {
        if (error instanceof BridgeException be) {
            return be.kind();
        }
        return ErrorKind.HANDLER_EXECUTION;
    }

    public static String messageOf(Throwable error) {
        if (error == null) {
            return "Unexpected error";
        }
        if (error.getMessage() != null && !error.getMessage().isBlank()) {
            return error.getMessage();
        }
        return error.getClass().getSimpleName();
    }
}
