package work.lcod.bridge.handler;

import java.util.Map;

@FunctionalInterface
public interface PayloadValidator {
    PayloadValidator ACCEPT_ALL = (payload, operation) -> ValidationResult.ok();

    ValidationResult validate(Map<String, Object> payload, String operation);
}
