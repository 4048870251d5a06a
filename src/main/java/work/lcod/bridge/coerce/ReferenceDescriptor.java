package work.lcod.bridge.coerce;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Locator path and/or opaque id extracted from a reference payload.
 *
 * <p>Accepted shapes: a bare string path, {@code {"$ref": path}}, {@code {"$type": "reference", "$path": path}},
 * {@code {"$id": id}}, the common keys {@code path}, {@code objectPath}, {@code target}, {@code reference},
 * {@code id}, {@code guid}, {@code globalObjectId}, or a map holding a single string value.
 */
public record ReferenceDescriptor(String path, String id) {
    private static final List<String> PATH_KEYS = List.of("$ref", "_path", "path", "objectPath", "target", "reference");
    private static final List<String> ID_KEYS = List.of("$id", "id", "guid", "globalObjectId");

    public boolean hasPath() {
        return path != null && !path.isBlank();
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    public static Optional<ReferenceDescriptor> parse(Object value) {
        if (value instanceof String str) {
            return str.isBlank() ? Optional.empty() : Optional.of(new ReferenceDescriptor(str.trim(), null));
        }
        if (!(value instanceof Map<?, ?> map) || map.isEmpty()) {
            return Optional.empty();
        }
        String path = null;
        if ("reference".equals(stringAt(map, "$type"))) {
            path = stringAt(map, "$path");
        }
        if (path == null) {
            path = firstString(map, PATH_KEYS);
        }
        String id = firstString(map, ID_KEYS);
        if (path == null && id == null && map.size() == 1) {
            Object single = map.values().iterator().next();
            if (single instanceof String str && !str.isBlank()) {
                path = str.trim();
            }
        }
        if (path == null && id == null) {
            return Optional.empty();
        }
        return Optional.of(new ReferenceDescriptor(path, id));
    }

    private static String firstString(Map<?, ?> map, List<String> keys) {
        for (String key : keys) {
            String value = stringAt(map, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String stringAt(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value instanceof String str && !str.isBlank()) {
            return str.trim();
        }
        if (value instanceof Number num) {
            return num.toString();
        }
        return null;
    }
}
