package com.questrail.someip.serialization.schema;

import java.util.OptionalInt;

/**
 * Validation helpers for length field widths.
 *
 * <p>SOME/IP length fields are 1, 2 or 4 bytes wide. A width of 0 denotes the
 * absence of a length field and is only usable for statically sized types.</p>
 */
public final class LengthFieldWidths
{
    private LengthFieldWidths() {}

    public static boolean isValid(int width) {
        return width == 0 || width == 1 || width == 2 || width == 4;
    }

    /**
     * @throws SchemaException if {@code width} is not one of 0, 1, 2 or 4
     */
    public static int require(int width, String what) {
        if (!isValid(width)) {
            throw new SchemaException(
                    what + " must be 0, 1, 2 or 4 bytes (was " + width + ")");
        }
        return width;
    }

    static OptionalInt requireOverride(OptionalInt width, String what) {
        if (width == null) {
            return OptionalInt.empty();
        }
        if (width.isPresent()) {
            require(width.getAsInt(), what);
        }
        return width;
    }

    /**
     * Returns true if a value of {@code type} cannot be delimited outside a
     * TLV struct without a length field: a string or sequence that is not
     * statically sized, or a TLV struct.
     */
    public static boolean requiresLengthField(SchemaType type) {
        if ((type instanceof StringType || type instanceof SequenceType) && !type.isStaticSize()) {
            return true;
        }
        return type instanceof StructType s && s.isTlv();
    }

    /**
     * Largest length representable by a length field of the given width.
     */
    public static long maxLength(int width) {
        return switch (width) {
            case 1 -> 0xFFL;
            case 2 -> 0xFFFFL;
            case 4 -> 0xFFFF_FFFFL;
            default -> throw new IllegalArgumentException("No length field of width " + width);
        };
    }

    /**
     * Smallest non-zero width able to hold {@code length}.
     */
    public static int smallestFor(long length) {
        if (length <= 0xFFL) {
            return 1;
        }
        if (length <= 0xFFFFL) {
            return 2;
        }
        return 4;
    }
}
