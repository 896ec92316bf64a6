package com.questrail.someip.serialization.schema;

import java.util.Objects;

/**
 * One alternative of a {@link UnionType}.
 *
 * @param name         variant name, unique within the union
 * @param discriminant value carried by the type field (or the encoded value for treat-as unions)
 * @param payloadType  payload type, or {@code null} for a variant without payload
 */
public record UnionVariant(String name, long discriminant, SchemaType payloadType)
{
    public UnionVariant {
        Objects.requireNonNull(name, "name");
    }

    public static UnionVariant of(String name, long discriminant, SchemaType payloadType) {
        return new UnionVariant(name, discriminant, Objects.requireNonNull(payloadType, "payloadType"));
    }

    public static UnionVariant empty(String name, long discriminant) {
        return new UnionVariant(name, discriminant, null);
    }

    public boolean hasPayload() {
        return payloadType != null;
    }
}
