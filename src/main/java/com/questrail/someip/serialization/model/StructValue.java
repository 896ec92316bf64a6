package com.questrail.someip.serialization.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * StructValue
 * -----------------------------------------------------------------------------
 * Immutable value of a struct: member name to member value.
 *
 * <p>An absent optional member is simply not present in the map; there is no
 * null member value. Iteration order is insertion order on encode and wire
 * order on decode.</p>
 */
public final class StructValue
{
    private final Map<String, Object> fields;

    private StructValue(Map<String, Object> fields)
    {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StructValue of(Map<String, ?> fields) {
        Builder b = builder();
        Objects.requireNonNull(fields, "fields").forEach(b::set);
        return b.build();
    }

    /**
     * @throws NoSuchElementException if the member is absent
     */
    public Object get(String name) {
        Object v = fields.get(name);
        if (v == null) {
            throw new NoSuchElementException("No field '" + name + "'");
        }
        return v;
    }

    public Optional<Object> find(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * Equality by encoded value: an {@code Integer} member equals a decoded
     * {@code Short} of the same value, and a {@code byte[]} member equals the
     * decoded list of its unsigned bytes.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StructValue other)) {
            return false;
        }
        if (!fields.keySet().equals(other.fields.keySet())) {
            return false;
        }
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            if (!Values.equivalent(e.getValue(), other.fields.get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return fields.keySet().hashCode();
    }

    @Override
    public String toString() {
        return "StructValue" + fields;
    }

    public static final class Builder
    {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder set(String name, Object value) {
            fields.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, name));
            return this;
        }

        public StructValue build() {
            return new StructValue(fields);
        }
    }
}
