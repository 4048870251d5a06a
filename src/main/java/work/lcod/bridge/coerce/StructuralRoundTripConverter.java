package work.lcod.bridge.coerce;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;
import work.lcod.bridge.types.CompositeType;
import work.lcod.bridge.types.OpaqueType;
import work.lcod.bridge.types.TypeDescriptor;

/**
 * Last resort for composite and opaque targets: encode the value to Jackson's tree model and
 * decode it into the target's Java type.
 */
public final class StructuralRoundTripConverter implements ValueConverter {
    private final ObjectMapper json;

    public StructuralRoundTripConverter(ObjectMapper json) {
        this.json = Objects.requireNonNull(json, "json");
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public boolean canConvert(Object value, TypeDescriptor target) {
        return target instanceof CompositeType || target instanceof OpaqueType;
    }

    @Override
    public Object convert(Object value, TypeDescriptor target, CoercionEngine engine) {
        return json.convertValue(value, target.javaType());
    }
}
