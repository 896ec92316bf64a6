package com.questrail.someip.serialization.codec.impl;

import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.schema.PrimitiveType;
import com.questrail.someip.serialization.schema.SchemaType;
import com.questrail.someip.serialization.schema.SequenceType;
import com.questrail.someip.serialization.schema.StringType;
import com.questrail.someip.serialization.schema.StructType;
import com.questrail.someip.serialization.schema.UnionType;

import java.util.OptionalInt;

/**
 * SchemaCodec
 * -----------------------------------------------------------------------------
 * Dispatches a value to the codec for its schema type.
 *
 * <p>Two levels are distinguished:</p>
 * <ul>
 *   <li><strong>value</strong>: a type as it appears outside a TLV struct,
 *       including its own length field when its resolved width is non-zero;</li>
 *   <li><strong>body</strong>: the type's content without any length field.
 *       Inside a TLV struct the tag announces the length field width, so the
 *       struct codec writes the length itself and calls into the body.</li>
 * </ul>
 *
 * <p>Primitives and treat-as unions never carry a length field; their value
 * and body are identical.</p>
 */
final class SchemaCodec
{
    private SchemaCodec() {}

    /**
     * A root struct is the message payload and is written without length field.
     */
    static void encodeRoot(WireWriter out, SchemaType type, Object value, CodecContext ctx)
            throws SomeIpWireException
    {
        if (type instanceof StructType) {
            encodeBody(out, type, value, ctx);
        } else {
            encodeValue(out, type, value, OptionalInt.empty(), ctx);
        }
    }

    static Object decodeRoot(WireReader in, SchemaType type, CodecContext ctx) throws SomeIpWireException
    {
        if (type instanceof StructType) {
            return decodeBody(in, type, false, ctx);
        }
        return decodeValue(in, type, OptionalInt.empty(), ctx);
    }

    static void encodeValue(WireWriter out, SchemaType type, Object value, OptionalInt widthOverride, CodecContext ctx)
            throws SomeIpWireException
    {
        if (isFixed(type)) {
            encodeBody(out, type, value, ctx);
            return;
        }
        final int width = LengthFields.resolveOutsideTlv(type, widthOverride, ctx.options());
        if (width == 0) {
            encodeBody(out, type, value, ctx);
            return;
        }
        try (WireWriter scratch = new WireWriter()) {
            encodeBody(scratch, type, value, ctx);
            LengthFields.write(out, scratch.size(), width);
            out.writeBytes(scratch);
        }
    }

    static Object decodeValue(WireReader in, SchemaType type, OptionalInt widthOverride, CodecContext ctx)
            throws SomeIpWireException
    {
        if (isFixed(type)) {
            return decodeBody(in, type, false, ctx);
        }
        final int width = LengthFields.resolveOutsideTlv(type, widthOverride, ctx.options());
        if (width == 0) {
            return decodeBody(in, type, false, ctx);
        }
        final long length = LengthFields.read(in, width);
        final WireReader window = in.window(length);
        final Object value = decodeBody(window, type, true, ctx);
        window.requireFullyConsumed(type.describe());
        return value;
    }

    static void encodeBody(WireWriter out, SchemaType type, Object value, CodecContext ctx)
            throws SomeIpWireException
    {
        if (type instanceof PrimitiveType p) {
            PrimitiveCodec.encode(out, p.kind(), value, ctx.options().byteOrder());
            return;
        }
        if (type instanceof StringType s) {
            out.writeBytes(StringCodec.encode(value, s, ctx.options()));
            return;
        }
        if (type instanceof SequenceType s) {
            SequenceCodec.encode(out, s, value, ctx);
            return;
        }
        if (type instanceof StructType s) {
            StructCodec.encode(out, s, value, ctx);
            return;
        }
        if (type instanceof UnionType u) {
            UnionCodec.encode(out, u, value, ctx);
            return;
        }
        // Unreachable while SchemaType stays sealed.
        throw new IllegalArgumentException("Unsupported schema type: " + type.getClass().getName());
    }

    /**
     * @param windowed true if {@code in} is a window holding exactly this body;
     *                 false if the body is statically sized or self-delimiting
     */
    static Object decodeBody(WireReader in, SchemaType type, boolean windowed, CodecContext ctx)
            throws SomeIpWireException
    {
        if (type instanceof PrimitiveType p) {
            return PrimitiveCodec.decode(in, p.kind(), ctx.options().byteOrder());
        }
        if (type instanceof StringType s) {
            final byte[] bytes = in.readBytes(windowed ? in.remaining() : s.minSize());
            return StringCodec.decode(bytes, s, ctx.options());
        }
        if (type instanceof SequenceType s) {
            return SequenceCodec.decode(in, s, windowed, ctx);
        }
        if (type instanceof StructType s) {
            return StructCodec.decode(in, s, ctx);
        }
        if (type instanceof UnionType u) {
            return UnionCodec.decode(in, u, ctx);
        }
        // Unreachable while SchemaType stays sealed.
        throw new IllegalArgumentException("Unsupported schema type: " + type.getClass().getName());
    }

    /** True for types encoded as a bare fixed-width integer, float or boolean. */
    static boolean isFixed(SchemaType type) {
        return type instanceof PrimitiveType || type instanceof UnionType u && u.isTreatAs();
    }
}
