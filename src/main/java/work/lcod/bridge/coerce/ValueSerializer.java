package work.lcod.bridge.coerce;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.bridge.resolve.LiveObjectResolver;
import work.lcod.bridge.resolve.TypeResolver;
import work.lcod.bridge.types.CompositeType;
import work.lcod.bridge.types.EnumValue;
import work.lcod.bridge.types.MemberDescriptor;
import work.lcod.bridge.types.OpaqueType;
import work.lcod.bridge.types.PrimitiveType;
import work.lcod.bridge.types.ReferenceType;
import work.lcod.bridge.types.SequenceType;
import work.lcod.bridge.types.TypeDescriptor;

/**
 * Reverse of the coercion engine: renders typed member values as plain maps, lists and scalars
 * for inspection responses. References become {@code {"$ref": path}}.
 */
public final class ValueSerializer {
    private static final int MAX_DEPTH = 16;

    private final LiveObjectResolver liveObjects;
    private final TypeResolver types;
    private final ObjectMapper json;

    public ValueSerializer(LiveObjectResolver liveObjects, TypeResolver types, ObjectMapper json) {
        this.liveObjects = liveObjects == null ? LiveObjectResolver.NONE : liveObjects;
        this.types = Objects.requireNonNull(types, "types");
        this.json = json == null ? new ObjectMapper() : json;
    }

    /**
     * Serializes every readable member of a composite instance.
     */
    public Map<String, Object> serializeMembers(Object instance, CompositeType type) {
        return serializeComposite(instance, type, 0);
    }

    public Object serialize(Object value, TypeDescriptor type) {
        return serialize(value, type, 0);
    }

    private Object serialize(Object value, TypeDescriptor type, int depth) {
        if (value == null) {
            return null;
        }
        if (depth > MAX_DEPTH) {
            return String.valueOf(value);
        }
        if (value instanceof EnumValue ev) {
            return ev.symbol().<Object>map(symbol -> symbol).orElse(ev.value());
        }
        if (type instanceof PrimitiveType) {
            return value;
        }
        if (type instanceof ReferenceType) {
            return reference(value);
        }
        if (type instanceof SequenceType sequence) {
            return sequence(value, sequence.element(), depth);
        }
        if (type instanceof CompositeType composite && composite.accepts(value)) {
            return serializeComposite(value, composite, depth);
        }
        if (type instanceof OpaqueType || type == null) {
            return untyped(value, depth);
        }
        return untyped(value, depth);
    }

    private Map<String, Object> serializeComposite(Object instance, CompositeType type, int depth) {
        var result = new LinkedHashMap<String, Object>();
        for (MemberDescriptor member : type.members()) {
            if (!member.isReadable() || result.containsKey(member.name())) {
                continue;
            }
            result.put(member.name(), serialize(member.read(instance), member.type(), depth + 1));
        }
        return result;
    }

    private Object reference(Object value) {
        var ref = new LinkedHashMap<String, Object>();
        var path = liveObjects.pathOf(value);
        if (path.isPresent()) {
            ref.put("$ref", path.get());
        } else {
            ref.put("$type", "reference");
            ref.put("kind", value.getClass().getSimpleName());
        }
        return ref;
    }

    private List<Object> sequence(Object value, TypeDescriptor element, int depth) {
        var items = new ArrayList<Object>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                items.add(serialize(item, element, depth + 1));
            }
        } else if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                items.add(serialize(Array.get(value, i), element, depth + 1));
            }
        }
        return items;
    }

    private Object untyped(Object value, int depth) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        var described = types.describe(value.getClass());
        if (described.isPresent()) {
            return serializeComposite(value, described.get(), depth);
        }
        if (value instanceof List<?> || value.getClass().isArray()) {
            return sequence(value, null, depth);
        }
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), serialize(entry.getValue(), null, depth + 1));
            }
            return copy;
        }
        if (liveObjects.pathOf(value).isPresent()) {
            return reference(value);
        }
        try {
            return json.convertValue(value, Object.class);
        } catch (IllegalArgumentException ex) {
            return String.valueOf(value);
        }
    }
}
