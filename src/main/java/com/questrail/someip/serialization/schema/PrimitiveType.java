package com.questrail.someip.serialization.schema;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A fixed-width primitive.
 *
 * <p>Instances are interned per {@link PrimitiveKind}; use the constants or
 * {@link #of(PrimitiveKind)}.</p>
 */
public record PrimitiveType(PrimitiveKind kind) implements SchemaType
{
    private static final Map<PrimitiveKind, PrimitiveType> INSTANCES = new EnumMap<>(PrimitiveKind.class);

    static {
        for (PrimitiveKind k : PrimitiveKind.values()) {
            INSTANCES.put(k, new PrimitiveType(k));
        }
    }

    public static final PrimitiveType BOOL = of(PrimitiveKind.BOOL);
    public static final PrimitiveType U8 = of(PrimitiveKind.U8);
    public static final PrimitiveType U16 = of(PrimitiveKind.U16);
    public static final PrimitiveType U32 = of(PrimitiveKind.U32);
    public static final PrimitiveType U64 = of(PrimitiveKind.U64);
    public static final PrimitiveType I8 = of(PrimitiveKind.I8);
    public static final PrimitiveType I16 = of(PrimitiveKind.I16);
    public static final PrimitiveType I32 = of(PrimitiveKind.I32);
    public static final PrimitiveType I64 = of(PrimitiveKind.I64);
    public static final PrimitiveType F32 = of(PrimitiveKind.F32);
    public static final PrimitiveType F64 = of(PrimitiveKind.F64);

    public PrimitiveType {
        Objects.requireNonNull(kind, "kind");
    }

    public static PrimitiveType of(PrimitiveKind kind) {
        return INSTANCES.get(Objects.requireNonNull(kind, "kind"));
    }

    @Override
    public boolean isStaticSize() {
        return true;
    }

    @Override
    public OptionalInt lengthFieldWidth() {
        return OptionalInt.empty();
    }

    @Override
    public String describe() {
        return kind.name().toLowerCase();
    }
}
