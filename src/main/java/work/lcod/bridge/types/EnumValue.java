package work.lcod.bridge.types;

import java.util.Objects;
import java.util.Optional;

/**
 * Stored value of a weak enumeration.
 */
public record EnumValue(EnumType type, int value) {
    public EnumValue {
        Objects.requireNonNull(type, "type");
    }

    public Optional<String> symbol() {
        return type.symbolOf(value);
    }

    public boolean isDeclared() {
        return symbol().isPresent();
    }

    @Override
    public String toString() {
        return symbol().orElse(Integer.toString(value));
    }
}
