package work.lcod.bridge.handler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Declared parameters of one operation: required names, expected wire types, defaults and
 * extra checks that append error messages.
 */
public final class OperationSchema {
    public enum ParamType {
        STRING,
        BOOL,
        INT,
        FLOAT,
        DOUBLE,
        MAP,
        LIST,
        ANY
    }

    private final String description;
    private final Set<String> required;
    private final Map<String, ParamType> types;
    private final Map<String, Object> defaults;
    private final List<BiConsumer<Map<String, Object>, List<String>>> checks;

    private OperationSchema(Builder builder) {
        this.description = builder.description;
        this.required = Collections.unmodifiableSet(new LinkedHashSet<>(builder.required));
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(builder.types));
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaults));
        this.checks = List.copyOf(builder.checks);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String description() {
        return description;
    }

    public Set<String> required() {
        return required;
    }

    public Map<String, ParamType> types() {
        return types;
    }

    public Map<String, Object> defaults() {
        return defaults;
    }

    public List<BiConsumer<Map<String, Object>, List<String>>> checks() {
        return checks;
    }

    public static final class Builder {
        private String description;
        private final Set<String> required = new LinkedHashSet<>();
        private final Map<String, ParamType> types = new LinkedHashMap<>();
        private final Map<String, Object> defaults = new LinkedHashMap<>();
        private final List<BiConsumer<Map<String, Object>, List<String>>> checks = new ArrayList<>();

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder require(String name) {
            return require(name, ParamType.ANY);
        }

        public Builder require(String name, ParamType type) {
            required.add(Objects.requireNonNull(name, "name"));
            types.put(name, type == null ? ParamType.ANY : type);
            return this;
        }

        public Builder optional(String name, ParamType type) {
            return optional(name, type, null);
        }

        public Builder optional(String name, ParamType type, Object defaultValue) {
            types.put(Objects.requireNonNull(name, "name"), type == null ? ParamType.ANY : type);
            if (defaultValue != null) {
                defaults.put(name, defaultValue);
            }
            return this;
        }

        public Builder check(BiConsumer<Map<String, Object>, List<String>> check) {
            checks.add(Objects.requireNonNull(check, "check"));
            return this;
        }

        public OperationSchema build() {
            return new OperationSchema(this);
        }
    }
}
