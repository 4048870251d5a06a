package work.lcod.bridge.coerce;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.bridge.resolve.AssetResolver;
import work.lcod.bridge.resolve.LiveObjectResolver;
import work.lcod.bridge.types.TypeDescriptor;

/**
 * Converts untyped payload values into the statically-declared shape of a member.
 *
 * <p>Null values short-circuit to the target default and values that already satisfy the target are
 * returned unchanged. Everything else goes through the converters in descending priority; the first
 * applicable converter that succeeds wins. When every applicable converter throws, the failure is
 * logged and the target default is returned instead of propagating.
 *
 * <p>The engine holds no per-call state and may be shared.
 */
public final class CoercionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(CoercionEngine.class);

    private final List<ValueConverter> converters;

    private CoercionEngine(List<ValueConverter> converters) {
        var sorted = new ArrayList<>(converters);
        sorted.sort(Comparator.comparingInt(ValueConverter::priority).reversed());
        this.converters = List.copyOf(sorted);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CoercionEngine standard(LiveObjectResolver liveObjects, AssetResolver assets) {
        return builder().liveObjects(liveObjects).assets(assets).build();
    }

    public List<ValueConverter> converters() {
        return converters;
    }

    /**
     * Lenient conversion: failures degrade to the target's default value.
     */
    public Object convert(Object value, TypeDescriptor target) {
        return tryConvert(value, target).value();
    }

    public Conversion tryConvert(Object value, TypeDescriptor target) {
        Objects.requireNonNull(target, "target");
        if (value == null) {
            return Conversion.ok(target.defaultValue());
        }
        if (target.accepts(value)) {
            return Conversion.ok(value);
        }
        var failures = new ArrayList<String>();
        for (ValueConverter converter : converters) {
            if (!converter.canConvert(value, target)) {
                continue;
            }
            try {
                return Conversion.ok(converter.convert(value, target, this));
            } catch (Exception ex) {
                failures.add(converter.name() + ": " + describe(ex));
            }
        }
        String message = failures.isEmpty()
            ? "No converter can turn " + PrimitiveValueConverter.typeName(value) + " into " + target.displayName()
            : "Cannot convert " + PrimitiveValueConverter.typeName(value) + " to " + target.displayName() + " (" + String.join("; ", failures) + ")";
        LOG.warn("Coercion failed, using default for {}: {}", target.displayName(), message);
        return Conversion.failed(target.defaultValue(), message);
    }

    private static String describe(Exception ex) {
        var message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    public static final class Builder {
        private LiveObjectResolver liveObjects = LiveObjectResolver.NONE;
        private AssetResolver assets = AssetResolver.NONE;
        private ObjectMapper json;
        private final List<ValueConverter> extra = new ArrayList<>();

        public Builder liveObjects(LiveObjectResolver liveObjects) {
            this.liveObjects = liveObjects == null ? LiveObjectResolver.NONE : liveObjects;
            return this;
        }

        public Builder assets(AssetResolver assets) {
            this.assets = assets == null ? AssetResolver.NONE : assets;
            return this;
        }

        public Builder objectMapper(ObjectMapper json) {
            this.json = json;
            return this;
        }

        public Builder converter(ValueConverter converter) {
            extra.add(Objects.requireNonNull(converter, "converter"));
            return this;
        }

        public CoercionEngine build() {
            var mapper = json == null ? new ObjectMapper() : json;
            var chain = new ArrayList<ValueConverter>();
            chain.add(new ReferenceValueConverter(liveObjects, assets));
            chain.add(new SequenceValueConverter());
            chain.add(new CompositeValueConverter());
            chain.add(new EnumValueConverter());
            chain.add(new PrimitiveValueConverter(mapper));
            chain.add(new StructuralRoundTripConverter(mapper));
            chain.addAll(extra);
            return new CoercionEngine(chain);
        }
    }
}
