package work.lcod.bridge.coerce;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.bridge.types.SequenceType;
import work.lcod.bridge.types.TypeDescriptor;

/**
 * Converts lists and arrays element by element into the collection kind the target declares.
 */
public final class SequenceValueConverter implements ValueConverter {
    private static final Logger LOG = LoggerFactory.getLogger(SequenceValueConverter.class);

    @Override
    public int priority() {
        return 250;
    }

    @Override
    public boolean canConvert(Object value, TypeDescriptor target) {
        return target instanceof SequenceType && (value instanceof List<?> || (value != null && value.getClass().isArray()));
    }

    @Override
    public Object convert(Object value, TypeDescriptor target, CoercionEngine engine) {
        SequenceType sequence = (SequenceType) target;
        if (sequence.element() == null) {
            LOG.warn("Cannot determine element type for {}; producing an empty collection", sequence.displayName());
            return empty(sequence);
        }
        List<?> items = toList(value);
        if (sequence.kind() == SequenceType.Kind.LIST) {
            var converted = new ArrayList<Object>(items.size());
            for (Object item : items) {
                converted.add(engine.convert(item, sequence.element()));
            }
            return converted;
        }
        Object array = Array.newInstance(sequence.elementJavaType(), items.size());
        for (int i = 0; i < items.size(); i++) {
            Array.set(array, i, engine.convert(items.get(i), sequence.element()));
        }
        return array;
    }

    private static Object empty(SequenceType sequence) {
        if (sequence.kind() == SequenceType.Kind.LIST) {
            return new ArrayList<>();
        }
        return Array.newInstance(sequence.elementJavaType(), 0);
    }

    private static List<?> toList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        int length = Array.getLength(value);
        var list = new ArrayList<Object>(length);
        for (int i = 0; i < length; i++) {
            list.add(Array.get(value, i));
        }
        return list;
    }
}
