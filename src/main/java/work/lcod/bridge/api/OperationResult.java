package work.lcod.bridge.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response envelope returned to the remote caller. Always carries {@code success}.
 */
public record OperationResult(Map<String, Object> response) {
    private static final ObjectWriter WRITER = new ObjectMapper().writer();

    public OperationResult {
        var copy = new LinkedHashMap<String, Object>(response == null ? Map.of() : response);
        copy.putIfAbsent("success", false);
        response = Collections.unmodifiableMap(copy);
    }

    public boolean success() {
        return Boolean.TRUE.equals(response.get("success"));
    }

    public boolean partialSuccess() {
        return Boolean.TRUE.equals(response.get("partialSuccess"));
    }

    public String error() {
        Object error = response.get("error");
        return error == null ? null : error.toString();
    }

    public String errorType() {
        Object type = response.get("errorType");
        return type == null ? null : type.toString();
    }

    public Object get(String key) {
        return response.get(key);
    }

    public String toJson() {
        try {
            return WRITER.writeValueAsString(response);
        } catch (JsonProcessingException ex) {
            return "{\"success\":false,\"error\":\"Unable to serialize response: " + ex.getOriginalMessage().replace("\"", "'")
                + "\",\"errorType\":\"HandlerExecutionError\"}";
        }
    }
}
