package work.lcod.bridge.handler;

import java.util.List;
import java.util.Map;

/**
 * Outcome of payload validation. A non-null {@code normalizedPayload} replaces the matching
 * entries of the working payload.
 */
public record ValidationResult(boolean valid, List<String> errors, Map<String, Object> normalizedPayload) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of(), null);
    }

    public static ValidationResult ok(Map<String, Object> normalizedPayload) {
        return new ValidationResult(true, List.of(), normalizedPayload);
    }

    public static ValidationResult invalid(List<String> errors) {
        return new ValidationResult(false, errors, null);
    }

    public static ValidationResult invalid(String error) {
        return invalid(List.of(error));
    }
}
