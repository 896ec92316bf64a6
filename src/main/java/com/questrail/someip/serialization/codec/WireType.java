package com.questrail.someip.serialization.codec;

/**
 * The 4-bit wire type carried in the upper bits of a TLV tag.
 *
 * <p>Codes 0 to 3 announce a fixed-size value of 1, 2, 4 or 8 bytes. Codes 4
 * to 6 announce a value preceded by a 1, 2 or 4 byte length field. Code 7
 * announces a complex value without length field whose size follows from the
 * schema. Codes 8 to 15 are reserved.</p>
 */
public enum WireType
{
    FIXED_8(0, 1, 0),
    FIXED_16(1, 2, 0),
    FIXED_32(2, 4, 0),
    FIXED_64(3, 8, 0),
    LENGTH_8(4, 0, 1),
    LENGTH_16(5, 0, 2),
    LENGTH_32(6, 0, 4),
    COMPLEX(7, 0, 0);

    private static final WireType[] BY_CODE = values();

    private final int code;
    private final int fixedSize;
    private final int lengthFieldWidth;

    WireType(int code, int fixedSize, int lengthFieldWidth) {
        this.code = code;
        this.fixedSize = fixedSize;
        this.lengthFieldWidth = lengthFieldWidth;
    }

    public int code() {
        return code;
    }

    /** Size of the value for fixed wire types, otherwise 0. */
    public int fixedSize() {
        return fixedSize;
    }

    /** Width of the length field for length-delimited wire types, otherwise 0. */
    public int lengthFieldWidth() {
        return lengthFieldWidth;
    }

    public boolean isFixed() {
        return fixedSize > 0;
    }

    public boolean isLengthDelimited() {
        return lengthFieldWidth > 0;
    }

    /**
     * @throws SomeIpWireException with {@link WireErrorKind#UNSUPPORTED_WIRE_TYPE} for reserved codes
     */
    public static WireType fromCode(int code) throws SomeIpWireException {
        if (code < 0 || code >= BY_CODE.length) {
            throw new SomeIpWireException(WireErrorKind.UNSUPPORTED_WIRE_TYPE, "Reserved wire type " + code);
        }
        return BY_CODE[code];
    }

    public static WireType forFixedSize(int size) {
        return switch (size) {
            case 1 -> FIXED_8;
            case 2 -> FIXED_16;
            case 4 -> FIXED_32;
            case 8 -> FIXED_64;
            default -> throw new IllegalArgumentException("No fixed wire type of size " + size);
        };
    }

    public static WireType forLengthFieldWidth(int width) {
        return switch (width) {
            case 1 -> LENGTH_8;
            case 2 -> LENGTH_16;
            case 4 -> LENGTH_32;
            default -> throw new IllegalArgumentException("No length-delimited wire type of width " + width);
        };
    }
}
