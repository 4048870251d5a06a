package work.lcod.bridge.resolve;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Locates objects of the external live graph by locator path (identifier of {@link #tryResolve})
 * or by opaque id, and enumerates them for batch operations.
 */
public interface LiveObjectResolver extends ResourceResolver<Object> {
    LiveObjectResolver NONE = new LiveObjectResolver() {
        @Override
        public Optional<Object> tryResolve(String identifier) {
            return Optional.empty();
        }

        @Override
        public List<Object> findMatching(Pattern pattern) {
            return List.of();
        }
    };

    @Override
    default String resourceName() {
        return "Live object";
    }

    default Optional<Object> tryResolveById(String id) {
        return Optional.empty();
    }

    /**
     * Every object whose path or name contains a match of {@code pattern}, in enumeration order.
     */
    List<Object> findMatching(Pattern pattern);

    /**
     * Locator path of an instance owned by this graph.
     */
    default Optional<String> pathOf(Object instance) {
        return Optional.empty();
    }
}
