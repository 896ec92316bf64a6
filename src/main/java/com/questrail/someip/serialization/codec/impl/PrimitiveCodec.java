package com.questrail.someip.serialization.codec.impl;

import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.codec.WireErrorKind;
import com.questrail.someip.serialization.schema.PrimitiveKind;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteOrder;

/**
 * PrimitiveCodec
 * -----------------------------------------------------------------------------
 * Fixed-width integers, floats and booleans in the configured byte order.
 *
 * <p>Decoded values use the narrowest Java type holding the full range:
 * {@code U8} decodes to {@code Short}, {@code U16} to {@code Integer},
 * {@code U32} to {@code Long}. {@code U64} decodes to a {@code Long} carrying
 * the raw two's complement bits.</p>
 *
 * <p>Booleans are strict: only {@code 0x00} and {@code 0x01} are accepted.</p>
 */
final class PrimitiveCodec
{
    private static final BigInteger TWO_TO_64 = BigInteger.ONE.shiftLeft(64);

    private PrimitiveCodec() {}

    static void encode(WireWriter out, PrimitiveKind kind, Object value, ByteOrder order)
    {
        switch (kind) {
            case BOOL -> {
                if (!(value instanceof Boolean b)) {
                    throw new IllegalArgumentException("Expected Boolean for bool but got " + typeName(value));
                }
                out.writeByte(b ? 1 : 0);
            }
            case F32 -> out.writeInteger(Float.floatToRawIntBits(number(kind, value).floatValue()), 4, order);
            case F64 -> out.writeInteger(Double.doubleToRawLongBits(number(kind, value).doubleValue()), 8, order);
            default -> out.writeInteger(integerBits(kind, value), kind.width(), order);
        }
    }

    static Object decode(WireReader in, PrimitiveKind kind, ByteOrder order) throws SomeIpWireException
    {
        final long bits = in.readUnsigned(kind.width(), order);
        return switch (kind) {
            case BOOL -> {
                if (bits == 0) {
                    yield Boolean.FALSE;
                }
                if (bits == 1) {
                    yield Boolean.TRUE;
                }
                throw new SomeIpWireException(WireErrorKind.INVALID_BOOLEAN_VALUE,
                        String.format("Invalid boolean byte 0x%02X", bits));
            }
            case U8 -> (short) bits;
            case U16 -> (int) bits;
            case U32, U64, I64 -> bits;
            case I8 -> (byte) bits;
            case I16 -> (short) bits;
            case I32 -> (int) bits;
            case F32 -> Float.intBitsToFloat((int) bits);
            case F64 -> Double.longBitsToDouble(bits);
        };
    }

    /**
     * Validates an integer value against {@code kind} and returns it as a
     * {@code long}. For {@code U64} values above {@link Long#MAX_VALUE} the
     * result is the raw bit pattern.
     *
     * @throws IllegalArgumentException if the value is not an integer or out of range
     */
    static long integerBits(PrimitiveKind kind, Object value)
    {
        Number n = number(kind, value);
        if (n instanceof Float || n instanceof Double || n instanceof BigDecimal) {
            throw new IllegalArgumentException("Expected an integer for " + kind + " but got " + typeName(value));
        }
        final long v;
        if (n instanceof BigInteger big) {
            if (kind == PrimitiveKind.U64) {
                if (big.signum() < 0 || big.compareTo(TWO_TO_64) >= 0) {
                    throw new IllegalArgumentException(big + " is out of range for " + kind);
                }
                return big.longValue();
            }
            if (big.bitLength() > 63) {
                throw new IllegalArgumentException(big + " is out of range for " + kind);
            }
            v = big.longValue();
        } else {
            v = n.longValue();
        }
        if (!kind.accepts(v)) {
            throw new IllegalArgumentException(v + " is out of range for " + kind);
        }
        return v;
    }

    /**
     * Interprets raw bits read for {@code kind} as a signed value, so decoded
     * enumeration values compare with declared discriminants.
     */
    static long signExtend(PrimitiveKind kind, long bits)
    {
        return switch (kind) {
            case I8 -> (byte) bits;
            case I16 -> (short) bits;
            case I32 -> (int) bits;
            default -> bits;
        };
    }

    private static Number number(PrimitiveKind kind, Object value)
    {
        if (!(value instanceof Number n)) {
            throw new IllegalArgumentException("Expected a Number for " + kind + " but got " + typeName(value));
        }
        return n;
    }

    static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
