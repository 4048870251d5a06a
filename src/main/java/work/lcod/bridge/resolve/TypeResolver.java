package work.lcod.bridge.resolve;

import java.util.Collection;
import java.util.Optional;
import work.lcod.bridge.types.CompositeType;
import work.lcod.bridge.types.TypeDescriptor;

/**
 * Resolves type names to descriptors and instances to their member tables.
 */
public interface TypeResolver extends ResourceResolver<TypeDescriptor> {
    @Override
    default String resourceName() {
        return "Type";
    }

    Optional<CompositeType> describe(Class<?> javaType);

    Collection<String> typeNames();
}
