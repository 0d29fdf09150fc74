package io.github.eutro.stackless.env;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Named configuration values attached to a module or a function specification.
 * Values are booleans, numbers or strings.
 */
public final class Pragmas {
    public static final Pragmas EMPTY = new Pragmas(Collections.emptyMap());

    private final Map<String, Object> values;

    private Pragmas(Map<String, Object> values) {
        this.values = values;
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Get a pragma only if it is set to a boolean.
     *
     * @param name The name of the pragma.
     * @return The value, or empty if the pragma is absent or not a boolean.
     */
    public Optional<Boolean> getBool(String name) {
        Object value = values.get(name);
        return value instanceof Boolean ? Optional.of((Boolean) value) : Optional.empty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Object> values = new TreeMap<>();

        public Builder set(String name, boolean value) {
            values.put(name, value);
            return this;
        }

        public Builder set(String name, long value) {
            values.put(name, value);
            return this;
        }

        public Builder set(String name, String value) {
            values.put(name, value);
            return this;
        }

        public Pragmas build() {
            return values.isEmpty() ? EMPTY : new Pragmas(Collections.unmodifiableMap(new TreeMap<>(values)));
        }
    }
}
