package com.questrail.someip.serialization.codec;

import java.util.Objects;

/**
 * WireTag
 * -----------------------------------------------------------------------------
 * The 16-bit tag preceding every member of a TLV struct.
 *
 * <pre>
 *   bit 15 .. 12   wire type
 *   bit 11 ..  0   data id
 * </pre>
 *
 * <p>The tag is always transmitted big endian, independent of the payload
 * byte order.</p>
 */
public record WireTag(WireType wireType, int dataId)
{
    public static final int SIZE = 2;
    public static final int MAX_DATA_ID = 0x0FFF;

    public WireTag {
        Objects.requireNonNull(wireType, "wireType");
        if (dataId < 0 || dataId > MAX_DATA_ID) {
            throw new IllegalArgumentException("Data id must be within 0.." + MAX_DATA_ID + " (was " + dataId + ")");
        }
    }

    /** The tag as an unsigned 16-bit value. */
    public int bits() {
        return (wireType.code() << 12) | dataId;
    }

    /**
     * @throws SomeIpWireException with {@link WireErrorKind#UNSUPPORTED_WIRE_TYPE} if the wire type is reserved
     */
    public static WireTag fromBits(int bits) throws SomeIpWireException {
        return new WireTag(WireType.fromCode((bits >>> 12) & 0x0F), bits & MAX_DATA_ID);
    }

    public static byte[] pack(WireType wireType, int dataId) {
        int bits = new WireTag(wireType, dataId).bits();
        return new byte[] {(byte) (bits >>> 8), (byte) bits};
    }

    /**
     * @throws IllegalArgumentException if {@code bytes} is not exactly two bytes long
     */
    public static WireTag unpack(byte[] bytes) throws SomeIpWireException {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != SIZE) {
            throw new IllegalArgumentException("A tag is " + SIZE + " bytes (was " + bytes.length + ")");
        }
        return fromBits(((bytes[0] & 0xFF) << 8) | (bytes[1] & 0xFF));
    }
}
