package work.lcod.bridge.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * In-memory live object graph keyed by {@code /}-separated locator paths with optional opaque ids.
 * Enumeration follows insertion order.
 */
public final class InMemoryObjectGraph implements LiveObjectResolver {
    private final Map<String, Node> byPath = new LinkedHashMap<>();
    private final Map<String, Node> byId = new LinkedHashMap<>();
    private final Map<Object, Node> byInstance = new IdentityHashMap<>();

    public InMemoryObjectGraph add(String path, Object instance) {
        return add(path, null, instance);
    }

    public InMemoryObjectGraph add(String path, String id, Object instance) {
        String normalized = normalize(path);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Object path is required");
        }
        Objects.requireNonNull(instance, "instance");
        remove(normalized);
        var node = new Node(normalized, id, instance);
        byPath.put(normalized, node);
        if (id != null && !id.isBlank()) {
            byId.put(id, node);
        }
        byInstance.put(instance, node);
        return this;
    }

    public boolean remove(String path) {
        var node = byPath.remove(normalize(path));
        if (node == null) {
            return false;
        }
        if (node.id() != null) {
            byId.remove(node.id());
        }
        byInstance.remove(node.instance());
        return true;
    }

    public int size() {
        return byPath.size();
    }

    public List<String> paths() {
        return Collections.unmodifiableList(new ArrayList<>(byPath.keySet()));
    }

    @Override
    public Optional<Object> tryResolve(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        var node = byPath.get(normalize(identifier));
        return node == null ? Optional.empty() : Optional.of(node.instance());
    }

    @Override
    public Optional<Object> tryResolveById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        var node = byId.get(id.trim());
        return node == null ? Optional.empty() : Optional.of(node.instance());
    }

    @Override
    public List<Object> findMatching(Pattern pattern) {
        var matches = new ArrayList<Object>();
        if (pattern == null) {
            return matches;
        }
        for (Node node : byPath.values()) {
            if (pattern.matcher(node.path()).find() || pattern.matcher(node.name()).find()) {
                matches.add(node.instance());
            }
        }
        return matches;
    }

    @Override
    public Optional<String> pathOf(Object instance) {
        var node = instance == null ? null : byInstance.get(instance);
        return node == null ? Optional.empty() : Optional.of(node.path());
    }

    private static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String trimmed = path.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private record Node(String path, String id, Object instance) {
        String name() {
            int slash = path.lastIndexOf('/');
            return slash < 0 ? path : path.substring(slash + 1);
        }
    }
}
