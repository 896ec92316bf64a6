package com.questrail.someip.serialization.codec.impl;

import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.codec.WireErrorKind;
import com.questrail.someip.serialization.config.ActionOnTooMuchData;
import com.questrail.someip.serialization.schema.PrimitiveType;
import com.questrail.someip.serialization.schema.SequenceType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * SequenceCodec
 * -----------------------------------------------------------------------------
 * Homogeneous element runs.
 *
 * <p>The enclosing length field, when present, holds the byte length of the
 * encoded elements. Elements are always encoded as values outside a TLV
 * struct, so a dynamic element carries its own configured length field.</p>
 */
final class SequenceCodec
{
    private SequenceCodec() {}

    static void encode(WireWriter out, SequenceType type, Object value, CodecContext ctx)
            throws SomeIpWireException
    {
        final boolean rawBytes = value instanceof byte[] && type.element().equals(PrimitiveType.U8);
        if (!rawBytes && !(value instanceof List<?>)) {
            throw new IllegalArgumentException("Expected a List for " + type.describe()
                    + " but got " + PrimitiveCodec.typeName(value));
        }

        ctx.enter(type.describe());
        try {
            if (rawBytes) {
                final byte[] bytes = (byte[]) value;
                checkEncodeCount(bytes.length, type);
                out.writeBytes(bytes);
                return;
            }
            final List<?> elements = (List<?>) value;
            checkEncodeCount(elements.size(), type);
            for (Object element : elements) {
                SchemaCodec.encodeValue(out, type.element(), element, OptionalInt.empty(), ctx);
            }
        } finally {
            ctx.exit();
        }
    }

    /**
     * @param windowed true to decode elements until {@code in} is exhausted;
     *                 false to decode exactly {@code minElements} elements
     */
    static List<Object> decode(WireReader in, SequenceType type, boolean windowed, CodecContext ctx)
            throws SomeIpWireException
    {
        ctx.enter(type.describe());
        try {
            final List<Object> elements = new ArrayList<>();
            if (windowed) {
                final ActionOnTooMuchData action = ctx.options().actionOnTooMuchData();
                while (!in.isExhausted()) {
                    if (elements.size() >= type.maxElements()) {
                        if (action == ActionOnTooMuchData.FAIL) {
                            throw outOfBounds(elements.size() + 1, type);
                        }
                        if (action == ActionOnTooMuchData.DISCARD) {
                            in.skip(in.remaining());
                            break;
                        }
                    }
                    final int before = in.remaining();
                    elements.add(SchemaCodec.decodeValue(in, type.element(), OptionalInt.empty(), ctx));
                    if (in.remaining() == before) {
                        throw new SomeIpWireException(WireErrorKind.LENGTH_MISMATCH,
                                in.remaining() + " bytes left over in " + type.describe()
                                        + " whose elements occupy no bytes");
                    }
                }
            } else {
                for (int i = 0; i < type.minElements(); i++) {
                    elements.add(SchemaCodec.decodeValue(in, type.element(), OptionalInt.empty(), ctx));
                }
            }
            if (elements.size() < type.minElements()) {
                throw outOfBounds(elements.size(), type);
            }
            return Collections.unmodifiableList(elements);
        } finally {
            ctx.exit();
        }
    }

    /**
     * Too many elements do not fit the schema's size; too few are a value
     * that does not match the schema.
     */
    private static void checkEncodeCount(int count, SequenceType type) throws SomeIpWireException
    {
        if (count > type.maxElements()) {
            throw new SomeIpWireException(WireErrorKind.VALUE_TOO_LARGE,
                    count + " elements exceed the maximum of " + type.maxElements() + " for " + type.describe());
        }
        if (count < type.minElements()) {
            throw new IllegalArgumentException(
                    count + " elements are fewer than the minimum of " + type.minElements() + " for " + type.describe());
        }
    }

    private static SomeIpWireException outOfBounds(int count, SequenceType type)
    {
        return new SomeIpWireException(WireErrorKind.SEQUENCE_SIZE_OUT_OF_BOUNDS,
                count + " elements outside " + type.minElements() + ".." + type.maxElements()
                        + " for " + type.describe());
    }
}
