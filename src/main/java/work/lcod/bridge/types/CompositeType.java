package work.lcod.bridge.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Composite type described by an explicit member table, built once at startup.
 *
 * <p>Struct-like composites ({@code valueSemantics}) default to a fresh instance from the factory;
 * object-like composites default to {@code null}.
 */
public final class CompositeType implements TypeDescriptor {
    private final String name;
    private final Class<?> javaType;
    private final Supplier<?> factory;
    private final boolean valueSemantics;
    private final Map<String, MemberDescriptor> members;

    private CompositeType(String name, Class<?> javaType, Supplier<?> factory, boolean valueSemantics, List<MemberDescriptor> members) {
        this.name = name;
        this.javaType = javaType;
        this.factory = factory;
        this.valueSemantics = valueSemantics;
        var table = new LinkedHashMap<String, MemberDescriptor>();
        for (MemberDescriptor member : members) {
            if (table.put(member.name() + "#" + member.kind(), member) != null) {
                throw new IllegalArgumentException("Duplicate " + member.kind().name().toLowerCase(Locale.ROOT) + " '" + member.name() + "' on " + name);
            }
        }
        this.members = Collections.unmodifiableMap(table);
    }

    public static <T> Builder<T> builder(String name, Class<T> javaType, Supplier<T> factory) {
        return new Builder<>(name, javaType, factory);
    }

    public String name() {
        return name;
    }

    public boolean valueSemantics() {
        return valueSemantics;
    }

    public List<MemberDescriptor> members() {
        return List.copyOf(members.values());
    }

    public Optional<MemberDescriptor> property(String memberName) {
        return Optional.ofNullable(members.get(memberName + "#" + MemberDescriptor.Kind.PROPERTY));
    }

    public Optional<MemberDescriptor> field(String memberName) {
        return Optional.ofNullable(members.get(memberName + "#" + MemberDescriptor.Kind.FIELD));
    }

    public boolean canInstantiate() {
        return factory != null;
    }

    public Object newInstance() {
        if (factory == null) {
            throw new IllegalStateException("Composite type " + name + " has no factory");
        }
        return factory.get();
    }

    @Override
    public String displayName() {
        return name;
    }

    @Override
    public Class<?> javaType() {
        return javaType;
    }

    @Override
    public boolean accepts(Object value) {
        return javaType.isInstance(value);
    }

    @Override
    public Object defaultValue() {
        return valueSemantics && factory != null ? factory.get() : null;
    }

    @Override
    public String toString() {
        return "CompositeType[" + name + "]";
    }

    public static final class Builder<T> {
        private final String name;
        private final Class<T> javaType;
        private final Supplier<T> factory;
        private final List<MemberDescriptor> members = new ArrayList<>();
        private boolean valueSemantics;

        private Builder(String name, Class<T> javaType, Supplier<T> factory) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Composite type name is required");
            }
            this.name = name;
            this.javaType = Objects.requireNonNull(javaType, "javaType");
            this.factory = factory;
        }

        public Builder<T> valueSemantics(boolean valueSemantics) {
            this.valueSemantics = valueSemantics;
            return this;
        }

        public <V> Builder<T> property(String member, TypeDescriptor type, Function<T, V> getter, BiConsumer<T, V> setter) {
            members.add(new MemberDescriptor(member, type, MemberDescriptor.Kind.PROPERTY, false, adaptGetter(getter), adaptSetter(setter)));
            return this;
        }

        public <V> Builder<T> readOnlyProperty(String member, TypeDescriptor type, Function<T, V> getter) {
            members.add(new MemberDescriptor(member, type, MemberDescriptor.Kind.PROPERTY, false, adaptGetter(getter), null));
            return this;
        }

        public <V> Builder<T> field(String member, TypeDescriptor type, boolean serialized, Function<T, V> getter, BiConsumer<T, V> setter) {
            members.add(new MemberDescriptor(member, type, MemberDescriptor.Kind.FIELD, serialized, adaptGetter(getter), adaptSetter(setter)));
            return this;
        }

        public <V> Builder<T> serializedField(String member, TypeDescriptor type, Function<T, V> getter, BiConsumer<T, V> setter) {
            return field(member, type, true, getter, setter);
        }

        public CompositeType build() {
            return new CompositeType(name, javaType, factory, valueSemantics, members);
        }

        private <V> Function<Object, Object> adaptGetter(Function<T, V> getter) {
            if (getter == null) {
                return null;
            }
            return target -> getter.apply(javaType.cast(target));
        }

        @SuppressWarnings("unchecked")
        private <V> BiConsumer<Object, Object> adaptSetter(BiConsumer<T, V> setter) {
            if (setter == null) {
                return null;
            }
            return (target, value) -> setter.accept(javaType.cast(target), (V) value);
        }
    }
}
