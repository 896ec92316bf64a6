package com.questrail.someip.serialization.model;

import java.util.Objects;

/**
 * Value of a union: the selected variant and its payload.
 *
 * <p>Payloads compare by encoded value, as struct members do.</p>
 *
 * @param variant variant name as declared by the union schema
 * @param payload payload value, or {@code null} for a variant without payload
 */
public record UnionValue(String variant, Object payload) {

    public UnionValue {
        Objects.requireNonNull(variant, "variant");
    }

    public static UnionValue of(String variant) {
        return new UnionValue(variant, null);
    }

    public static UnionValue of(String variant, Object payload) {
        return new UnionValue(variant, Objects.requireNonNull(payload, "payload"));
    }

    public boolean hasPayload() {
        return payload != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UnionValue other)) {
            return false;
        }
        return variant.equals(other.variant) && Values.equivalent(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variant, payload != null);
    }
}
