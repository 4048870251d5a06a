package work.lcod.bridge.resolve;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.bridge.types.CompositeType;
import work.lcod.bridge.types.PrimitiveKind;
import work.lcod.bridge.types.PrimitiveType;
import work.lcod.bridge.types.TypeDescriptor;

/**
 * Descriptor table keyed by type name and, for composites, by Java class.
 * Populated once at startup; lookups never reflect over classes.
 */
public final class TypeCatalog implements TypeResolver {
    private final Map<String, TypeDescriptor> byName = new LinkedHashMap<>();
    private final Map<Class<?>, CompositeType> byClass = new LinkedHashMap<>();

    public TypeCatalog register(TypeDescriptor type) {
        Objects.requireNonNull(type, "type");
        byName.put(type.displayName(), type);
        if (type instanceof CompositeType composite) {
            byClass.put(composite.javaType(), composite);
        }
        return this;
    }

    public TypeCatalog register(String alias, TypeDescriptor type) {
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("Type alias is required");
        }
        byName.put(alias, Objects.requireNonNull(type, "type"));
        return this;
    }

    @Override
    public Optional<TypeDescriptor> tryResolve(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        String name = identifier.trim();
        var registered = byName.get(name);
        if (registered != null) {
            return Optional.of(registered);
        }
        return primitive(name);
    }

    @Override
    public Optional<CompositeType> describe(Class<?> javaType) {
        for (Class<?> current = javaType; current != null; current = current.getSuperclass()) {
            var composite = byClass.get(current);
            if (composite != null) {
                return Optional.of(composite);
            }
        }
        return Optional.empty();
    }

    @Override
    public Collection<String> typeNames() {
        return Collections.unmodifiableCollection(byName.keySet());
    }

    private static Optional<TypeDescriptor> primitive(String name) {
        try {
            return Optional.of(PrimitiveType.of(PrimitiveKind.from(name.toLowerCase(Locale.ROOT))));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
