package work.lcod.bridge.member;

import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.bridge.coerce.CoercionEngine;
import work.lcod.bridge.resolve.TypeResolver;
import work.lcod.bridge.types.CompositeType;
import work.lcod.bridge.types.MemberDescriptor;

/**
 * Writes payload entries onto live objects through their registered member tables.
 *
 * <p>A writable property wins over a like-named field; fields are only reachable when marked
 * serialized. Every entry is applied independently, so one bad value never blocks the others.
 */
public final class MemberApplier {
    private static final Logger LOG = LoggerFactory.getLogger(MemberApplier.class);

    private final TypeResolver types;
    private final CoercionEngine coercion;

    public MemberApplier(TypeResolver types, CoercionEngine coercion) {
        this.types = Objects.requireNonNull(types, "types");
        this.coercion = Objects.requireNonNull(coercion, "coercion");
    }

    public MemberOutcome applyMember(Object target, String name, Object raw) {
        if (name == null || name.isBlank()) {
            return MemberOutcome.failed(String.valueOf(name), "Member name is required");
        }
        if (target == null) {
            return MemberOutcome.failed(name, "Target is null");
        }
        var type = types.describe(target.getClass());
        if (type.isEmpty()) {
            return MemberOutcome.unsupported(name, "Type " + target.getClass().getSimpleName() + " has no registered member table");
        }
        var member = locate(type.get(), name);
        if (member.isEmpty()) {
            return MemberOutcome.notFound(name, type.get().displayName());
        }
        var descriptor = member.get();
        var conversion = coercion.tryConvert(raw, descriptor.type());
        if (!conversion.succeeded()) {
            return MemberOutcome.failed(name, conversion.error());
        }
        try {
            descriptor.write(target, conversion.value());
        } catch (RuntimeException ex) {
            LOG.debug("Setter for {}.{} threw", type.get().displayName(), name, ex);
            return MemberOutcome.failed(name, ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
        }
        return MemberOutcome.applied(name, conversion.value());
    }

    public MemberApplyResult applyMembers(Object target, Map<String, Object> changes) {
        var outcomes = new ArrayList<MemberOutcome>();
        if (changes != null) {
            for (Map.Entry<String, Object> entry : changes.entrySet()) {
                outcomes.add(applyMember(target, entry.getKey(), entry.getValue()));
            }
        }
        return MemberApplyResult.of(outcomes);
    }

    static Optional<MemberDescriptor> locate(CompositeType type, String name) {
        var property = type.property(name).filter(MemberDescriptor::isWritableProperty);
        if (property.isPresent()) {
            return property;
        }
        return type.field(name).filter(MemberDescriptor::isVisibleField);
    }
}
