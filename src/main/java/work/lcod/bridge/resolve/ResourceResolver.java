package work.lcod.bridge.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.bridge.error.TargetNotFoundException;

/**
 * Resolves resources (live objects, assets, types) from identifiers such as paths, ids or names.
 */
public interface ResourceResolver<T> {
    /**
     * Resolves the identifier, or returns empty when nothing matches. Never throws for misses.
     */
    Optional<T> tryResolve(String identifier);

    /**
     * Resource label used in "not found" messages.
     */
    default String resourceName() {
        return "Resource";
    }

    default T resolve(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new TargetNotFoundException(resourceName() + " identifier is required", identifier);
        }
        return tryResolve(identifier).orElseThrow(
            () -> new TargetNotFoundException(resourceName() + " not found: '" + identifier + "'", identifier)
        );
    }

    default boolean exists(String identifier) {
        return identifier != null && !identifier.isBlank() && tryResolve(identifier).isPresent();
    }

    /**
     * Resolves every identifier that matches, skipping misses.
     */
    default List<T> resolveMany(String... identifiers) {
        var resolved = new ArrayList<T>();
        if (identifiers == null) {
            return resolved;
        }
        for (String identifier : identifiers) {
            if (identifier == null || identifier.isBlank()) {
                continue;
            }
            tryResolve(identifier).ifPresent(resolved::add);
        }
        return resolved;
    }
}
