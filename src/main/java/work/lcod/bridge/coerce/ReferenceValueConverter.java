package work.lcod.bridge.coerce;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.bridge.error.ConversionException;
import work.lcod.bridge.resolve.AssetResolver;
import work.lcod.bridge.resolve.LiveObjectResolver;
import work.lcod.bridge.types.ReferenceType;
import work.lcod.bridge.types.TypeDescriptor;

/**
 * Resolves reference descriptors to live objects. Locator paths are tried first (live graph, then
 * assets), opaque ids second. An unresolved reference converts to {@code null}.
 */
public final class ReferenceValueConverter implements ValueConverter {
    private static final Logger LOG = LoggerFactory.getLogger(ReferenceValueConverter.class);

    private final LiveObjectResolver liveObjects;
    private final AssetResolver assets;

    public ReferenceValueConverter(LiveObjectResolver liveObjects, AssetResolver assets) {
        this.liveObjects = Objects.requireNonNull(liveObjects, "liveObjects");
        this.assets = Objects.requireNonNull(assets, "assets");
    }

    @Override
    public int priority() {
        return 300;
    }

    @Override
    public boolean canConvert(Object value, TypeDescriptor target) {
        return target instanceof ReferenceType;
    }

    @Override
    public Object convert(Object value, TypeDescriptor target, CoercionEngine engine) {
        ReferenceType reference = (ReferenceType) target;
        var descriptor = ReferenceDescriptor.parse(value).orElseThrow(
            () -> new ConversionException(
                "Cannot read a reference from " + PrimitiveValueConverter.typeName(value)
                    + ". Expected a path string, {\"$ref\": path} or {\"$id\": id}"
            )
        );
        if (descriptor.hasPath()) {
            var found = accept(liveObjects.tryResolve(descriptor.path()), reference, descriptor.path());
            if (found == null) {
                found = accept(assets.tryResolve(descriptor.path()), reference, descriptor.path());
            }
            if (found != null) {
                return found;
            }
        }
        if (descriptor.hasId()) {
            var found = accept(liveObjects.tryResolveById(descriptor.id()), reference, descriptor.id());
            if (found == null) {
                found = accept(assets.tryResolveByGuid(descriptor.id()), reference, descriptor.id());
            }
            if (found != null) {
                return found;
            }
        }
        LOG.debug("Reference {} did not resolve to a {}", descriptor, reference.kind().getSimpleName());
        return null;
    }

    private static Object accept(Optional<Object> candidate, ReferenceType reference, String identifier) {
        if (candidate.isEmpty()) {
            return null;
        }
        Object resolved = candidate.get();
        if (reference.accepts(resolved)) {
            return resolved;
        }
        LOG.warn(
            "'{}' resolved to a {} but a {} is required",
            identifier,
            resolved.getClass().getSimpleName(),
            reference.kind().getSimpleName()
        );
        return null;
    }
}
