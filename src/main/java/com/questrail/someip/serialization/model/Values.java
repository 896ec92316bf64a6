package com.questrail.someip.serialization.model;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Value equality across the Java types the codec accepts and returns.
 *
 * <p>The encoder accepts any {@code Number} in range and {@code byte[]} for
 * {@code U8} sequences; the decoder returns the canonical boxed type and
 * lists. Two member values are equal when they encode to the same bytes:</p>
 * <ul>
 *   <li>integers compare by value, whatever their boxed type;</li>
 *   <li>floats compare at {@code float} precision when either side is a
 *       {@code Float}, otherwise at {@code double} precision;</li>
 *   <li>a {@code byte[]} equals a list of the same unsigned byte values;</li>
 *   <li>lists compare element by element under these rules.</li>
 * </ul>
 */
final class Values
{
    private Values() {}

    static boolean equivalent(Object a, Object b)
    {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number x && b instanceof Number y) {
            return numbersEqual(x, y);
        }
        if (a instanceof byte[] x && b instanceof byte[] y) {
            return Arrays.equals(x, y);
        }
        if (a instanceof byte[] x && b instanceof List<?> y) {
            return bytesEqualList(x, y);
        }
        if (a instanceof List<?> x && b instanceof byte[] y) {
            return bytesEqualList(y, x);
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            if (x.size() != y.size()) {
                return false;
            }
            for (int i = 0; i < x.size(); i++) {
                if (!equivalent(x.get(i), y.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof CharSequence x && b instanceof CharSequence y) {
            return x.toString().contentEquals(y);
        }
        return Objects.equals(a, b);
    }

    private static boolean bytesEqualList(byte[] bytes, List<?> list)
    {
        if (bytes.length != list.size()) {
            return false;
        }
        for (int i = 0; i < bytes.length; i++) {
            if (!(list.get(i) instanceof Number n) || !isIntegral(n) || n.longValue() != (bytes[i] & 0xFF)) {
                return false;
            }
        }
        return true;
    }

    private static boolean numbersEqual(Number x, Number y)
    {
        final boolean xi = isIntegral(x);
        final boolean yi = isIntegral(y);
        if (xi && yi) {
            if (isWide(x) || isWide(y)) {
                return toBigInteger(x).equals(toBigInteger(y));
            }
            return x.longValue() == y.longValue();
        }
        if (xi || yi) {
            return false;
        }
        if (x instanceof Float || y instanceof Float) {
            return Float.compare(x.floatValue(), y.floatValue()) == 0;
        }
        return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Byte || n instanceof Short || n instanceof Integer || n instanceof Long
                || n instanceof BigInteger;
    }

    /** A BigInteger beyond 64 bits; anything narrower is compared as raw {@code long} bits. */
    private static boolean isWide(Number n) {
        return n instanceof BigInteger big && big.bitLength() > 64;
    }

    private static BigInteger toBigInteger(Number n) {
        return n instanceof BigInteger big ? big : BigInteger.valueOf(n.longValue());
    }
}
