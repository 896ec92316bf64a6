package com.questrail.someip.serialization.codec.impl;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.nio.ByteOrder;

/**
 * WireWriter
 * -----------------------------------------------------------------------------
 * Append-only output buffer backed by a Netty {@link ByteBuf}.
 *
 * <p>Nothing written is ever revisited. A length-delimited value is encoded
 * into its own scratch writer first, so its size is known before the length
 * field is written to the enclosing writer.</p>
 *
 * <p>Writers are single-use and must be closed to release the buffer.</p>
 */
final class WireWriter implements AutoCloseable
{
    private final ByteBuf buf;

    WireWriter()
    {
        this.buf = Unpooled.buffer();
    }

    int size() {
        return buf.readableBytes();
    }

    void writeByte(int b) {
        buf.writeByte(b);
    }

    void writeBytes(byte[] bytes) {
        buf.writeBytes(bytes);
    }

    void writeBytes(WireWriter other) {
        buf.writeBytes(other.buf, other.buf.readerIndex(), other.buf.readableBytes());
    }

    /** Unsigned big-endian integer of 1, 2 or 4 bytes; used for tags and length fields. */
    void writeUnsignedBigEndian(long value, int width)
    {
        switch (width) {
            case 1 -> buf.writeByte((int) value);
            case 2 -> buf.writeShort((int) value);
            case 4 -> buf.writeInt((int) value);
            default -> throw new IllegalArgumentException("Unsupported field width " + width);
        }
    }

    /** Integer of 1, 2, 4 or 8 bytes in the given order; the low {@code width} bytes of {@code value} are written. */
    void writeInteger(long value, int width, ByteOrder order)
    {
        final boolean little = order == ByteOrder.LITTLE_ENDIAN;
        switch (width) {
            case 1 -> buf.writeByte((int) value);
            case 2 -> {
                if (little) {
                    buf.writeShortLE((int) value);
                } else {
                    buf.writeShort((int) value);
                }
            }
            case 4 -> {
                if (little) {
                    buf.writeIntLE((int) value);
                } else {
                    buf.writeInt((int) value);
                }
            }
            case 8 -> {
                if (little) {
                    buf.writeLongLE(value);
                } else {
                    buf.writeLong(value);
                }
            }
            default -> throw new IllegalArgumentException("Unsupported integer width " + width);
        }
    }

    byte[] toByteArray() {
        return ByteBufUtil.getBytes(buf);
    }

    @Override
    public void close() {
        buf.release();
    }
}
