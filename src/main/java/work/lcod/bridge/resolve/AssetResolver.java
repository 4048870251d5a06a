package work.lcod.bridge.resolve;

import java.util.Optional;

/**
 * Resolves assets by path ({@link #tryResolve}) or by stable guid.
 */
public interface AssetResolver extends ResourceResolver<Object> {
    AssetResolver NONE = identifier -> Optional.empty();

    @Override
    default String resourceName() {
        return "Asset";
    }

    default Optional<Object> tryResolveByGuid(String guid) {
        return tryResolve(guid);
    }
}
