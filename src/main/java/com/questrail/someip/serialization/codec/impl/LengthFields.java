package com.questrail.someip.serialization.codec.impl;

import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.codec.WireErrorKind;
import com.questrail.someip.serialization.config.LengthFieldCategory;
import com.questrail.someip.serialization.config.SomeIpOptions;
import com.questrail.someip.serialization.schema.LengthFieldWidths;
import com.questrail.someip.serialization.schema.PrimitiveType;
import com.questrail.someip.serialization.schema.SchemaException;
import com.questrail.someip.serialization.schema.SchemaType;
import com.questrail.someip.serialization.schema.SequenceType;
import com.questrail.someip.serialization.schema.StringType;
import com.questrail.someip.serialization.schema.StructType;
import com.questrail.someip.serialization.schema.UnionType;

import java.util.OptionalInt;

/**
 * LengthFields
 * -----------------------------------------------------------------------------
 * Resolution, writing and reading of length fields.
 *
 * <p>Width resolution order is field override, then type override, then the
 * options default for the type's category. Length fields are always unsigned
 * big endian.</p>
 */
final class LengthFields
{
    private LengthFields() {}

    static int resolve(SchemaType type, OptionalInt fieldOverride, SomeIpOptions options)
    {
        if (fieldOverride.isPresent()) {
            return fieldOverride.getAsInt();
        }
        if (type.lengthFieldWidth().isPresent()) {
            return type.lengthFieldWidth().getAsInt();
        }
        return options.lengthFieldWidth(categoryOf(type));
    }

    /**
     * Resolves the width of a value encoded outside a TLV struct, where no tag
     * announces the width and 0 means the value is written unprefixed.
     *
     * @throws SchemaException if the value cannot be delimited without a length field
     */
    static int resolveOutsideTlv(SchemaType type, OptionalInt fieldOverride, SomeIpOptions options)
    {
        final int width = resolve(type, fieldOverride, options);
        if (width != 0) {
            return width;
        }
        if (LengthFieldWidths.requiresLengthField(type)) {
            throw new SchemaException(type.describe() + " is encoded outside a TLV struct without a length field"
                    + " but cannot be delimited without one");
        }
        return 0;
    }

    static void write(WireWriter out, long length, int width) throws SomeIpWireException
    {
        if (length > LengthFieldWidths.maxLength(width)) {
            throw new SomeIpWireException(WireErrorKind.VALUE_TOO_LARGE,
                    "Length " + length + " does not fit a " + width + "-byte length field");
        }
        out.writeUnsignedBigEndian(length, width);
    }

    static long read(WireReader in, int width) throws SomeIpWireException {
        return in.readUnsignedBigEndian(width);
    }

    private static LengthFieldCategory categoryOf(SchemaType type)
    {
        if (type instanceof StringType) {
            return LengthFieldCategory.STRING;
        }
        if (type instanceof SequenceType) {
            return LengthFieldCategory.ARRAY;
        }
        if (type instanceof StructType) {
            return LengthFieldCategory.STRUCT;
        }
        if (type instanceof UnionType) {
            return LengthFieldCategory.UNION;
        }
        if (type instanceof PrimitiveType) {
            throw new IllegalArgumentException("Primitives have no length field");
        }
        // Unreachable while SchemaType stays sealed.
        throw new IllegalArgumentException("Unsupported schema type: " + type.getClass().getName());
    }
}
