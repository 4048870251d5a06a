package work.lcod.bridge.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.bridge.error.ValidationException;

/**
 * A named operation on a named tool with its untyped payload.
 */
public record OperationRequest(String toolName, String operationName, Map<String, Object> payload) {
    public OperationRequest {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Request whose operation name is read from the payload's {@code operation} entry.
     */
    public static OperationRequest of(String toolName, Map<String, Object> payload) {
        Object operation = payload == null ? null : payload.get("operation");
        return new OperationRequest(toolName, operation == null ? null : operation.toString(), payload);
    }

    /**
     * Payload handed to the handler: carries {@code operation}, filled in from
     * {@link #operationName()} when absent.
     */
    public Map<String, Object> dispatchPayload() {
        var copy = new LinkedHashMap<String, Object>(payload);
        Object declared = copy.get("operation");
        if (operationName == null || operationName.isBlank()) {
            return copy;
        }
        if (declared == null || declared.toString().isBlank()) {
            copy.put("operation", operationName);
        } else if (!operationName.equals(declared.toString())) {
            throw new ValidationException(
                "Operation mismatch: request names '" + operationName + "' but payload carries '" + declared + "'"
            );
        }
        return copy;
    }
}
