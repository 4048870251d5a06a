package work.lcod.bridge.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.bridge.handler.CommandHandler;

/**
 * Stores command handlers by tool name.
 */
public final class CommandRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, Entry> handlers = new ConcurrentHashMap<>();

    /**
     * Inserts or replaces the handler for {@code name}; the last registration wins.
     */
    public CommandRegistry register(String name, CommandHandler handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name is required");
        }
        Objects.requireNonNull(handler, "handler");
        var entry = new Entry(name, handler, handler.category(), handler.version());
        var previous = handlers.put(name, entry);
        if (previous != null && previous.handler() != handler) {
            LOG.warn("Handler for tool '{}' replaced ({} -> {})", name,
                previous.handler().getClass().getSimpleName(), handler.getClass().getSimpleName());
        }
        return this;
    }

    public Optional<Entry> tryGet(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(name));
    }

    public boolean isRegistered(String name) {
        return name != null && handlers.containsKey(name);
    }

    public void clear() {
        handlers.clear();
    }

    public int size() {
        return handlers.size();
    }

    /**
     * Registered tool names in ascending order.
     */
    public List<String> names() {
        return List.copyOf(new TreeSet<>(handlers.keySet()));
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(handlers);
    }

    public Map<String, Object> statistics() {
        var entries = new ArrayList<Map<String, Object>>();
        for (String name : names()) {
            var entry = handlers.get(name);
            if (entry == null) {
                continue;
            }
            var item = new LinkedHashMap<String, Object>();
            item.put("name", entry.name());
            item.put("category", entry.category());
            item.put("version", entry.version());
            item.put("supportedOperations", List.copyOf(entry.handler().supportedOperations()));
            entries.add(item);
        }
        var stats = new LinkedHashMap<String, Object>();
        stats.put("totalHandlers", entries.size());
        stats.put("entries", entries);
        return stats;
    }

    public record Entry(String name, CommandHandler handler, String category, String version) {}
}
