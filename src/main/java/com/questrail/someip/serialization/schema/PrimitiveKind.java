package com.questrail.someip.serialization.schema;

/**
 * The fixed-width primitives defined by SOME/IP.
 */
public enum PrimitiveKind
{
    BOOL(1, false, false),
    U8(1, true, false),
    U16(2, true, false),
    U32(4, true, false),
    U64(8, true, false),
    I8(1, true, true),
    I16(2, true, true),
    I32(4, true, true),
    I64(8, true, true),
    F32(4, false, true),
    F64(8, false, true);

    private final int width;
    private final boolean integer;
    private final boolean signed;

    PrimitiveKind(int width, boolean integer, boolean signed) {
        this.width = width;
        this.integer = integer;
        this.signed = signed;
    }

    /** Encoded width in bytes. */
    public int width() {
        return width;
    }

    public boolean isInteger() {
        return integer;
    }

    public boolean isSigned() {
        return signed;
    }

    /**
     * Smallest value representable by this integer kind.
     * {@link #U64} reports 0; its upper half is carried as negative {@code long} bits.
     */
    public long minValue() {
        return switch (this) {
            case I8 -> Byte.MIN_VALUE;
            case I16 -> Short.MIN_VALUE;
            case I32 -> Integer.MIN_VALUE;
            case I64 -> Long.MIN_VALUE;
            default -> 0L;
        };
    }

    /**
     * Largest value representable by this integer kind as a signed {@code long}.
     */
    public long maxValue() {
        return switch (this) {
            case BOOL -> 1L;
            case U8 -> 0xFFL;
            case U16 -> 0xFFFFL;
            case U32 -> 0xFFFF_FFFFL;
            case I8 -> Byte.MAX_VALUE;
            case I16 -> Short.MAX_VALUE;
            case I32 -> Integer.MAX_VALUE;
            case U64, I64 -> Long.MAX_VALUE;
            case F32, F64 -> throw new UnsupportedOperationException(this + " has no integer range");
        };
    }

    /**
     * Returns true if {@code value} lies in this kind's integer range.
     * Every {@code long} is accepted for {@link #U64}, as raw 64-bit pattern.
     */
    public boolean accepts(long value) {
        if (this == U64 || this == I64) {
            return true;
        }
        return value >= minValue() && value <= maxValue();
    }
}
