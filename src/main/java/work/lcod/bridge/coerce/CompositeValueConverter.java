package work.lcod.bridge.coerce;

import java.util.HashSet;
import java.util.Map;
import work.lcod.bridge.types.CompositeType;
import work.lcod.bridge.types.MemberDescriptor;
import work.lcod.bridge.types.TypeDescriptor;

/**
 * Populates a fresh composite instance from a mapping, one member at a time.
 * Unknown keys are ignored and absent members keep the instance defaults.
 */
public final class CompositeValueConverter implements ValueConverter {
    @Override
    public int priority() {
        return 200;
    }

    @Override
    public boolean canConvert(Object value, TypeDescriptor target) {
        return target instanceof CompositeType composite && composite.canInstantiate() && value instanceof Map<?, ?>;
    }

    @Override
    public Object convert(Object value, TypeDescriptor target, CoercionEngine engine) {
        CompositeType composite = (CompositeType) target;
        Map<?, ?> source = (Map<?, ?>) value;
        Object instance = composite.newInstance();
        var written = new HashSet<String>();
        for (MemberDescriptor member : composite.members()) {
            if (!member.isWritable() || !source.containsKey(member.name()) || written.contains(member.name())) {
                continue;
            }
            if (member.kind() == MemberDescriptor.Kind.FIELD && composite.property(member.name()).filter(MemberDescriptor::isWritableProperty).isPresent()) {
                continue;
            }
            member.write(instance, engine.convert(source.get(member.name()), member.type()));
            written.add(member.name());
        }
        return instance;
    }
}
