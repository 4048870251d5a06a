package work.lcod.bridge.shared;

import java.util.List;
import java.util.Map;

/**
 * Lenient readers for untyped payload maps. Missing or unparsable entries yield the fallback.
 */
public final class Payloads {
    private Payloads() {}

    public static String getString(Map<String, Object> payload, String key, String fallback) {
        if (payload == null || !payload.containsKey(key)) {
            return fallback;
        }
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }

    public static boolean getBool(Map<String, Object> payload, String key, boolean fallback) {
        if (payload == null || !payload.containsKey(key)) {
            return fallback;
        }
        Object value = payload.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String str) {
            String trimmed = str.trim();
            if ("true".equalsIgnoreCase(trimmed)) {
                return true;
            }
            if ("false".equalsIgnoreCase(trimmed)) {
                return false;
            }
        }
        return fallback;
    }

    public static int getInt(Map<String, Object> payload, String key, int fallback) {
        if (payload == null || !payload.containsKey(key)) {
            return fallback;
        }
        Object value = payload.get(key);
        if (value instanceof Number num) {
            return num.intValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }

    public static double getDouble(Map<String, Object> payload, String key, double fallback) {
        if (payload == null || !payload.containsKey(key)) {
            return fallback;
        }
        Object value = payload.get(key);
        if (value instanceof Number num) {
            return num.doubleValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Double.parseDouble(str.trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, Object> payload, String key) {
        if (payload != null && payload.get(key) instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> getList(Map<String, Object> payload, String key) {
        if (payload != null && payload.get(key) instanceof List<?> list) {
            return (List<Object>) list;
        }
        return null;
    }
}
