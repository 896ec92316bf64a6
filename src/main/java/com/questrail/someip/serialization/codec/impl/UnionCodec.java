package com.questrail.someip.serialization.codec.impl;

import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.codec.WireErrorKind;
import com.questrail.someip.serialization.model.UnionValue;
import com.questrail.someip.serialization.schema.LengthFieldWidths;
import com.questrail.someip.serialization.schema.PrimitiveKind;
import com.questrail.someip.serialization.schema.UnionType;
import com.questrail.someip.serialization.schema.UnionVariant;

import java.nio.ByteOrder;
import java.util.OptionalInt;

/**
 * UnionCodec
 * -----------------------------------------------------------------------------
 * Union bodies: a type field holding the discriminant, then the payload.
 *
 * <p>The type field is unsigned and written in the payload byte order. A
 * treat-as union is written as a bare integer of its treat-as kind instead,
 * whose value is the discriminant.</p>
 */
final class UnionCodec
{
    private UnionCodec() {}

    static void encode(WireWriter out, UnionType type, Object value, CodecContext ctx)
            throws SomeIpWireException
    {
        if (!(value instanceof UnionValue union)) {
            throw new IllegalArgumentException("Expected a UnionValue for " + type.describe()
                    + " but got " + PrimitiveCodec.typeName(value));
        }
        final UnionVariant variant = type.variantByName(union.variant()).orElseThrow(
                () -> new IllegalArgumentException(type.describe() + " has no variant '" + union.variant() + "'"));
        if (variant.hasPayload() != union.hasPayload()) {
            throw new IllegalArgumentException("Variant '" + variant.name() + "' of " + type.describe()
                    + (variant.hasPayload() ? " requires" : " takes no") + " payload");
        }
        final ByteOrder order = ctx.options().byteOrder();

        if (type.isTreatAs()) {
            out.writeInteger(variant.discriminant(), type.treatAs().get().width(), order);
            return;
        }

        ctx.enter(type.describe());
        try {
            final int typeFieldWidth = ctx.options().unionTypeFieldWidth();
            if (variant.discriminant() > LengthFieldWidths.maxLength(typeFieldWidth)) {
                throw new SomeIpWireException(WireErrorKind.VALUE_TOO_LARGE,
                        "Discriminant " + variant.discriminant() + " of " + type.describe()
                                + " does not fit a " + typeFieldWidth + "-byte type field");
            }
            out.writeInteger(variant.discriminant(), typeFieldWidth, order);
            if (variant.hasPayload()) {
                SchemaCodec.encodeValue(out, variant.payloadType(), union.payload(), OptionalInt.empty(), ctx);
            }
        } finally {
            ctx.exit();
        }
    }

    static UnionValue decode(WireReader in, UnionType type, CodecContext ctx) throws SomeIpWireException
    {
        final ByteOrder order = ctx.options().byteOrder();

        if (type.isTreatAs()) {
            final PrimitiveKind kind = type.treatAs().get();
            final long value = PrimitiveCodec.signExtend(kind, in.readUnsigned(kind.width(), order));
            final UnionVariant variant = type.variantByDiscriminant(value).orElseThrow(
                    () -> new SomeIpWireException(WireErrorKind.UNKNOWN_TREAT_AS_VALUE,
                            "Value " + value + " matches no variant of " + type.describe()));
            return UnionValue.of(variant.name());
        }

        ctx.enter(type.describe());
        try {
            final long discriminant = in.readUnsigned(ctx.options().unionTypeFieldWidth(), order);
            final UnionVariant variant = type.variantByDiscriminant(discriminant).orElseThrow(
                    () -> new SomeIpWireException(WireErrorKind.UNKNOWN_DISCRIMINANT,
                            "Discriminant " + discriminant + " matches no variant of " + type.describe()));
            if (!variant.hasPayload()) {
                return UnionValue.of(variant.name());
            }
            return UnionValue.of(variant.name(),
                    SchemaCodec.decodeValue(in, variant.payloadType(), OptionalInt.empty(), ctx));
        } finally {
            ctx.exit();
        }
    }
}
