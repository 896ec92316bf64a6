package com.questrail.someip.serialization.codec.impl;

import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.codec.WireErrorKind;
import com.questrail.someip.serialization.codec.WireTag;
import com.questrail.someip.serialization.codec.WireType;
import com.questrail.someip.serialization.config.LengthFieldSelection;
import com.questrail.someip.serialization.model.StructValue;
import com.questrail.someip.serialization.observability.UnknownFieldSkippedEvent;
import com.questrail.someip.serialization.schema.LengthFieldWidths;
import com.questrail.someip.serialization.schema.PrimitiveKind;
import com.questrail.someip.serialization.schema.PrimitiveType;
import com.questrail.someip.serialization.schema.SchemaField;
import com.questrail.someip.serialization.schema.SchemaType;
import com.questrail.someip.serialization.schema.StructType;
import com.questrail.someip.serialization.schema.UnionType;

import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * StructCodec
 * -----------------------------------------------------------------------------
 * Struct bodies in both layouts.
 *
 * <p><strong>Fixed layout</strong>: members back-to-back in declaration order,
 * each encoded as a value with its own length field where configured.</p>
 *
 * <p><strong>TLV</strong>: each present member is written as</p>
 * <pre>
 *   tag (2 bytes, big endian) [length field (1/2/4 bytes)] body
 * </pre>
 * <p>Fixed-width members use wire types 0 to 3 and no length field. All other
 * members get a length field whose width is announced by wire types 4 to 6;
 * wire type 7 is accepted on decode for statically sized members but never
 * written. Decode accepts members in any order, skips unknown ids and fails
 * if a mandatory member is missing once the body is exhausted.</p>
 */
final class StructCodec
{
    private StructCodec() {}

    static void encode(WireWriter out, StructType type, Object value, CodecContext ctx)
            throws SomeIpWireException
    {
        if (!(value instanceof StructValue struct)) {
            throw new IllegalArgumentException("Expected a StructValue for " + type.describe()
                    + " but got " + PrimitiveCodec.typeName(value));
        }
        for (String name : struct.fields().keySet()) {
            if (type.fieldByName(name).isEmpty()) {
                throw new IllegalArgumentException(type.describe() + " declares no field '" + name + "'");
            }
        }

        ctx.enter(type.describe());
        try {
            for (SchemaField field : type.fields()) {
                final Optional<Object> member = struct.find(field.name());
                if (member.isEmpty()) {
                    if (field.optional()) {
                        continue;
                    }
                    throw new IllegalArgumentException(
                            "Mandatory field '" + field.name() + "' of " + type.describe() + " has no value");
                }
                if (type.isTlv()) {
                    encodeTlvMember(out, field, member.get(), ctx);
                } else {
                    SchemaCodec.encodeValue(out, field.type(), member.get(), field.lengthFieldWidth(), ctx);
                }
            }
        } finally {
            ctx.exit();
        }
    }

    private static void encodeTlvMember(WireWriter out, SchemaField field, Object value, CodecContext ctx)
            throws SomeIpWireException
    {
        final SchemaType type = field.type();
        final PrimitiveKind fixedKind = fixedKindOf(type);
        if (fixedKind != null) {
            writeTag(out, WireType.forFixedSize(fixedKind.width()), field.id());
            SchemaCodec.encodeBody(out, type, value, ctx);
            return;
        }

        try (WireWriter body = new WireWriter()) {
            SchemaCodec.encodeBody(body, type, value, ctx);
            final int length = body.size();

            int width = LengthFields.resolve(type, field.lengthFieldWidth(), ctx.options());
            if (width == 0 || ctx.options().lengthFieldSelection() == LengthFieldSelection.SMALLEST) {
                width = LengthFieldWidths.smallestFor(length);
            }
            writeTag(out, WireType.forLengthFieldWidth(width), field.id());
            LengthFields.write(out, length, width);
            out.writeBytes(body);
        }
    }

    private static void writeTag(WireWriter out, WireType wireType, int dataId) {
        out.writeUnsignedBigEndian(new WireTag(wireType, dataId).bits(), WireTag.SIZE);
    }

    static StructValue decode(WireReader in, StructType type, CodecContext ctx) throws SomeIpWireException
    {
        ctx.enter(type.describe());
        try {
            return type.isTlv() ? decodeTlv(in, type, ctx) : decodeFixed(in, type, ctx);
        } finally {
            ctx.exit();
        }
    }

    private static StructValue decodeFixed(WireReader in, StructType type, CodecContext ctx)
            throws SomeIpWireException
    {
        final StructValue.Builder b = StructValue.builder();
        for (SchemaField field : type.fields()) {
            b.set(field.name(), SchemaCodec.decodeValue(in, field.type(), field.lengthFieldWidth(), ctx));
        }
        return b.build();
    }

    private static StructValue decodeTlv(WireReader in, StructType type, CodecContext ctx)
            throws SomeIpWireException
    {
        final StructValue.Builder b = StructValue.builder();
        final Set<Integer> seen = new HashSet<>();

        while (!in.isExhausted()) {
            final WireTag tag = WireTag.fromBits((int) in.readUnsignedBigEndian(WireTag.SIZE));
            final Optional<SchemaField> declared = type.fieldById(tag.dataId());
            if (declared.isEmpty()) {
                skipUnknown(in, type, tag, ctx);
                continue;
            }
            final SchemaField field = declared.get();
            if (!seen.add(field.id())) {
                throw new SomeIpWireException(WireErrorKind.DUPLICATE_FIELD,
                        "Field '" + field.name() + "' (id " + field.id() + ") of " + type.describe() + " appears twice");
            }
            b.set(field.name(), decodeTlvMember(in, type, field, tag.wireType(), ctx));
        }

        for (SchemaField field : type.fields()) {
            if (!field.optional() && !seen.contains(field.id())) {
                throw new SomeIpWireException(WireErrorKind.MISSING_MANDATORY_FIELD,
                        "Mandatory field '" + field.name() + "' (id " + field.id() + ") of " + type.describe() + " is missing");
            }
        }
        return b.build();
    }

    private static Object decodeTlvMember(WireReader in, StructType owner, SchemaField field, WireType wireType,
                                          CodecContext ctx)
            throws SomeIpWireException
    {
        final SchemaType type = field.type();
        final PrimitiveKind fixedKind = fixedKindOf(type);
        if (fixedKind != null) {
            if (wireType != WireType.forFixedSize(fixedKind.width())) {
                throw mismatch(owner, field, wireType);
            }
            return SchemaCodec.decodeBody(in, type, false, ctx);
        }
        if (wireType.isLengthDelimited()) {
            final long length = LengthFields.read(in, wireType.lengthFieldWidth());
            final WireReader window = in.window(length);
            final Object value = SchemaCodec.decodeBody(window, type, true, ctx);
            window.requireFullyConsumed("field '" + field.name() + "' of " + owner.describe());
            return value;
        }
        if (wireType == WireType.COMPLEX && type.isStaticSize()) {
            return SchemaCodec.decodeBody(in, type, false, ctx);
        }
        throw mismatch(owner, field, wireType);
    }

    private static void skipUnknown(WireReader in, StructType owner, WireTag tag, CodecContext ctx)
            throws SomeIpWireException
    {
        final WireType wireType = tag.wireType();
        final long skipped;
        if (wireType.isFixed()) {
            in.skip(wireType.fixedSize());
            skipped = wireType.fixedSize();
        } else if (wireType.isLengthDelimited()) {
            final long length = LengthFields.read(in, wireType.lengthFieldWidth());
            in.skip(length);
            skipped = wireType.lengthFieldWidth() + length;
        } else {
            throw new SomeIpWireException(WireErrorKind.UNSUPPORTED_WIRE_TYPE,
                    "Unknown field id " + tag.dataId() + " in " + owner.describe()
                            + " uses wire type " + wireType.code() + " and cannot be skipped");
        }
        ctx.sink().onUnknownFieldSkipped(new UnknownFieldSkippedEvent(
                Instant.now(), owner.name(), tag.dataId(), wireType, (int) skipped));
    }

    private static SomeIpWireException mismatch(StructType owner, SchemaField field, WireType wireType)
    {
        return new SomeIpWireException(WireErrorKind.WIRE_TYPE_MISMATCH,
                "Field '" + field.name() + "' of " + owner.describe() + " is " + field.type().describe()
                        + " but arrived with wire type " + wireType.code());
    }

    /** The fixed-width kind a member is encoded as, or null if it is length delimited. */
    private static PrimitiveKind fixedKindOf(SchemaType type)
    {
        if (type instanceof PrimitiveType p) {
            return p.kind();
        }
        if (type instanceof UnionType u) {
            return u.treatAs().orElse(null);
        }
        return null;
    }
}
