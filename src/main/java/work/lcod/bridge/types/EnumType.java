package work.lcod.bridge.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Weak enumeration: a named symbol set over an underlying {@code int}. Values outside the
 * declared set are legal and keep their raw integer.
 */
public final class EnumType implements TypeDescriptor {
    private final String name;
    private final Map<String, Integer> symbols;
    private final Map<String, String> lookup;

    public EnumType(String name, Map<String, Integer> symbols) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Enum type name is required");
        }
        this.name = name;
        this.symbols = symbols == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
        var index = new LinkedHashMap<String, String>();
        for (String symbol : this.symbols.keySet()) {
            index.put(symbol.toLowerCase(Locale.ROOT), symbol);
        }
        this.lookup = Collections.unmodifiableMap(index);
    }

    /**
     * Declares symbols in order, numbered from zero.
     */
    public static EnumType sequential(String name, String... symbols) {
        var map = new LinkedHashMap<String, Integer>();
        for (int i = 0; i < symbols.length; i++) {
            map.put(symbols[i], i);
        }
        return new EnumType(name, map);
    }

    public String name() {
        return name;
    }

    public Map<String, Integer> symbols() {
        return symbols;
    }

    /**
     * Case-insensitive symbol lookup.
     */
    public Optional<EnumValue> parse(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String declared = lookup.get(symbol.trim().toLowerCase(Locale.ROOT));
        if (declared == null) {
            return Optional.empty();
        }
        return Optional.of(new EnumValue(this, symbols.get(declared)));
    }

    public EnumValue raw(int value) {
        return new EnumValue(this, value);
    }

    public Optional<String> symbolOf(int value) {
        for (Map.Entry<String, Integer> entry : symbols.entrySet()) {
            if (entry.getValue() == value) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    @Override
    public String displayName() {
        return name;
    }

    @Override
    public Class<?> javaType() {
        return EnumValue.class;
    }

    @Override
    public boolean accepts(Object value) {
        return value instanceof EnumValue ev && ev.type().equals(this);
    }

    @Override
    public Object defaultValue() {
        return new EnumValue(this, 0);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof EnumType that)) {
            return false;
        }
        return name.equals(that.name) && symbols.equals(that.symbols);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, symbols);
    }

    @Override
    public String toString() {
        return "EnumType[" + name + "]";
    }
}
