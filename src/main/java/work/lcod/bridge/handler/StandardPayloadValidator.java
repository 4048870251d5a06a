package work.lcod.bridge.handler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import work.lcod.bridge.handler.OperationSchema.ParamType;

/**
 * Schema-driven validator. Operations without a registered schema pass through unchanged;
 * registered ones get required-parameter checks, wire-number normalization and defaults.
 */
public final class StandardPayloadValidator implements PayloadValidator {
    private final Map<String, OperationSchema> schemas = new ConcurrentHashMap<>();

    public StandardPayloadValidator register(String operation, OperationSchema schema) {
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("Operation name is required");
        }
        schemas.put(operation, Objects.requireNonNull(schema, "schema"));
        return this;
    }

    @Override
    public ValidationResult validate(Map<String, Object> payload, String operation) {
        if (payload == null) {
            return ValidationResult.invalid("Payload cannot be null");
        }
        var schema = operation == null ? null : schemas.get(operation);
        if (schema == null) {
            return ValidationResult.ok();
        }
        var errors = new ArrayList<String>();
        var normalized = new LinkedHashMap<String, Object>(payload);
        for (String name : schema.required()) {
            if (!payload.containsKey(name)) {
                errors.add("Required parameter '" + name + "' is missing");
            } else if (payload.get(name) == null) {
                errors.add("Required parameter '" + name + "' cannot be null");
            }
        }
        for (Map.Entry<String, ParamType> entry : schema.types().entrySet()) {
            String name = entry.getKey();
            if (!payload.containsKey(name)) {
                if (schema.defaults().containsKey(name)) {
                    normalized.put(name, schema.defaults().get(name));
                }
                continue;
            }
            Object value = payload.get(name);
            if (value == null) {
                continue;
            }
            try {
                normalized.put(name, normalize(value, entry.getValue()));
            } catch (IllegalArgumentException ex) {
                errors.add("Parameter '" + name + "' type error: " + ex.getMessage());
            }
        }
        for (var check : schema.checks()) {
            try {
                check.accept(normalized, errors);
            } catch (RuntimeException ex) {
                errors.add("Custom validation error: " + ex.getMessage());
            }
        }
        return errors.isEmpty() ? ValidationResult.ok(normalized) : ValidationResult.invalid(errors);
    }

    static Object normalize(Object value, ParamType type) {
        return switch (type) {
            case ANY -> value;
            case STRING -> value instanceof String ? value : value.toString();
            case BOOL -> toBool(value);
            case INT -> toInt(value);
            case FLOAT -> value instanceof Float ? value : (float) toDouble(value, "float");
            case DOUBLE -> value instanceof Double ? value : toDouble(value, "double");
            case MAP -> {
                if (value instanceof Map) {
                    yield value;
                }
                throw new IllegalArgumentException("Cannot convert '" + value + "' to map");
            }
            case LIST -> {
                if (value instanceof List) {
                    yield value;
                }
                if (value instanceof Object[] array) {
                    yield new ArrayList<>(Arrays.asList(array));
                }
                throw new IllegalArgumentException("Cannot convert '" + value + "' to list");
            }
        };
    }

    private static Boolean toBool(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new IllegalArgumentException("Cannot convert '" + value + "' to bool");
    }

    private static Integer toInt(Object value) {
        if (value instanceof Integer num) {
            return num;
        }
        if (value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Cannot convert '" + value + "' to int");
        }
    }

    private static double toDouble(Object value, String label) {
        if (value instanceof Number num) {
            return num.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Cannot convert '" + value + "' to " + label);
        }
    }
}
