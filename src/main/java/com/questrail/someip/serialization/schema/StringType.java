package com.questrail.someip.serialization.schema;

import java.util.OptionalInt;

/**
 * A string whose size bounds are expressed in encoded bytes.
 *
 * <p>The bounds include the byte order mark and the terminator when the
 * options require them. A string with {@code minSize == maxSize} is statically
 * sized and may be declared without a length field.</p>
 *
 * @param minSize          minimum encoded size in bytes
 * @param maxSize          maximum encoded size in bytes
 * @param lengthFieldWidth type-level length field width override
 */
public record StringType(int minSize, int maxSize, OptionalInt lengthFieldWidth) implements SchemaType
{
    public StringType {
        if (minSize < 0) {
            throw new SchemaException("String minSize must be non-negative (was " + minSize + ")");
        }
        if (maxSize < minSize) {
            throw new SchemaException(
                    "String maxSize must be >= minSize (was maxSize=" + maxSize + ", minSize=" + minSize + ")");
        }
        lengthFieldWidth = LengthFieldWidths.requireOverride(lengthFieldWidth, "String length field width");
        if (lengthFieldWidth.isPresent() && lengthFieldWidth.getAsInt() == 0 && minSize != maxSize) {
            throw new SchemaException("Only fixed-size strings may omit the length field");
        }
    }

    /** A string of up to {@code maxSize} encoded bytes. */
    public static StringType bounded(int maxSize) {
        return new StringType(0, maxSize, OptionalInt.empty());
    }

    public static StringType of(int minSize, int maxSize) {
        return new StringType(minSize, maxSize, OptionalInt.empty());
    }

    /** A string of exactly {@code size} encoded bytes, without length field. */
    public static StringType fixed(int size) {
        return new StringType(size, size, OptionalInt.of(0));
    }

    public StringType withLengthFieldWidth(int width) {
        return new StringType(minSize, maxSize, OptionalInt.of(width));
    }

    @Override
    public boolean isStaticSize() {
        return minSize == maxSize;
    }

    @Override
    public String describe() {
        return "string[" + minSize + ".." + maxSize + "]";
    }
}
