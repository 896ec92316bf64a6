package com.questrail.someip.serialization.codec.impl;

import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.codec.WireErrorKind;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.ByteOrder;

/**
 * WireReader
 * -----------------------------------------------------------------------------
 * Forward-only cursor over a read-only Netty {@link ByteBuf}.
 *
 * <p>A reader is either the <em>root</em> reader over the whole payload or a
 * <em>window</em> sliced off for a length-delimited region. Reading past the
 * end fails with:</p>
 * <ul>
 *   <li>{@link WireErrorKind#UNEXPECTED_END_OF_INPUT} at the root, where the
 *       input simply ended;</li>
 *   <li>{@link WireErrorKind#LENGTH_MISMATCH} inside a window, where the
 *       announced length disagrees with the content.</li>
 * </ul>
 *
 * <p>Windows are never rewound; consuming a window advances its parent.</p>
 */
final class WireReader
{
    private final ByteBuf buf;
    private final boolean window;

    private WireReader(ByteBuf buf, boolean window)
    {
        this.buf = buf;
        this.window = window;
    }

    static WireReader of(byte[] payload) {
        return new WireReader(Unpooled.wrappedBuffer(payload).asReadOnly(), false);
    }

    int remaining() {
        return buf.readableBytes();
    }

    boolean isExhausted() {
        return !buf.isReadable();
    }

    private void require(int count) throws SomeIpWireException
    {
        if (buf.readableBytes() < count) {
            throw overrun(count);
        }
    }

    private SomeIpWireException overrun(long count)
    {
        if (window) {
            return new SomeIpWireException(WireErrorKind.LENGTH_MISMATCH,
                    "Value needs " + count + " bytes but only " + buf.readableBytes() + " remain in its length-delimited region");
        }
        return new SomeIpWireException(WireErrorKind.UNEXPECTED_END_OF_INPUT,
                "Value needs " + count + " bytes but only " + buf.readableBytes() + " remain");
    }

    /**
     * Slice off the next {@code length} bytes as a bounded window.
     */
    WireReader window(long length) throws SomeIpWireException
    {
        if (length > buf.readableBytes()) {
            throw overrun(length);
        }
        return new WireReader(buf.readSlice((int) length), true);
    }

    /**
     * @throws SomeIpWireException with {@link WireErrorKind#LENGTH_MISMATCH} if bytes remain
     */
    void requireFullyConsumed(String what) throws SomeIpWireException
    {
        if (buf.isReadable()) {
            throw new SomeIpWireException(WireErrorKind.LENGTH_MISMATCH,
                    buf.readableBytes() + " unconsumed bytes at the end of " + what);
        }
    }

    long readUnsignedBigEndian(int width) throws SomeIpWireException
    {
        require(width);
        return switch (width) {
            case 1 -> buf.readUnsignedByte();
            case 2 -> buf.readUnsignedShort();
            case 4 -> buf.readUnsignedInt();
            default -> throw new IllegalArgumentException("Unsupported field width " + width);
        };
    }

    /** Raw integer bits of 1, 2, 4 or 8 bytes, zero-extended into a {@code long}. */
    long readUnsigned(int width, ByteOrder order) throws SomeIpWireException
    {
        require(width);
        final boolean little = order == ByteOrder.LITTLE_ENDIAN;
        return switch (width) {
            case 1 -> buf.readUnsignedByte();
            case 2 -> little ? buf.readUnsignedShortLE() : buf.readUnsignedShort();
            case 4 -> little ? buf.readUnsignedIntLE() : buf.readUnsignedInt();
            case 8 -> little ? buf.readLongLE() : buf.readLong();
            default -> throw new IllegalArgumentException("Unsupported integer width " + width);
        };
    }

    byte[] readBytes(int count) throws SomeIpWireException
    {
        require(count);
        byte[] out = new byte[count];
        buf.readBytes(out);
        return out;
    }

    void skip(long count) throws SomeIpWireException
    {
        if (count > buf.readableBytes()) {
            throw overrun(count);
        }
        buf.skipBytes((int) count);
    }
}
