package work.lcod.bridge.handler;

import java.util.Map;
import java.util.Optional;

/**
 * Hook invoked after a mutating operation to wait for host side effects (recompilation, reimport).
 * Implementations must not block the caller.
 */
@FunctionalInterface
public interface SideEffectWaiter {
    SideEffectWaiter NONE = operation -> Optional.empty();

    Optional<Map<String, Object>> await(String operation);
}
