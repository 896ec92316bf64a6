package com.questrail.someip.serialization.codec.impl;

import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.codec.WireErrorKind;
import com.questrail.someip.serialization.config.ActionOnTooMuchData;
import com.questrail.someip.serialization.config.SomeIpOptions;
import com.questrail.someip.serialization.config.StringEncoding;
import com.questrail.someip.serialization.schema.StringType;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * StringCodec
 * -----------------------------------------------------------------------------
 * Text to string bytes and back, excluding the length field.
 *
 * <p>The string bytes are, in order:</p>
 * <ol>
 *   <li>the byte order mark, when {@code stringWithBom} is set</li>
 *   <li>the text in the configured encoding</li>
 *   <li>a NUL code unit, when {@code stringWithTerminator} is set</li>
 * </ol>
 *
 * <p>Size bounds apply to the total. On decode, bytes above the maximum are
 * handled per {@link SomeIpOptions#actionOnTooMuchData()}, and a UTF-16
 * string carrying a BOM is read in the order the BOM announces, whichever
 * UTF-16 variant is configured.</p>
 */
final class StringCodec
{
    private StringCodec() {}

    static byte[] encode(Object value, StringType type, SomeIpOptions options) throws SomeIpWireException
    {
        if (!(value instanceof CharSequence text)) {
            throw new IllegalArgumentException("Expected a String but got " + PrimitiveCodec.typeName(value));
        }
        final StringEncoding encoding = options.stringEncoding();

        final ByteBuffer encoded;
        try {
            encoded = encoding.charset().newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(text));
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Text cannot be encoded as " + encoding, e);
        }

        final byte[] bom = options.stringWithBom() ? encoding.byteOrderMark() : new byte[0];
        final int terminator = options.stringWithTerminator() ? encoding.codeUnitSize() : 0;
        final int size = bom.length + encoded.remaining() + terminator;
        if (size > type.maxSize()) {
            throw new SomeIpWireException(WireErrorKind.VALUE_TOO_LARGE,
                    "String of " + size + " bytes exceeds the maximum of " + type.maxSize());
        }
        if (size < type.minSize()) {
            throw new IllegalArgumentException(
                    "String of " + size + " bytes is shorter than the minimum of " + type.minSize());
        }

        // Trailing terminator bytes are left zero.
        final byte[] out = new byte[size];
        System.arraycopy(bom, 0, out, 0, bom.length);
        encoded.get(out, bom.length, encoded.remaining());
        return out;
    }

    static String decode(byte[] received, StringType type, SomeIpOptions options) throws SomeIpWireException
    {
        final byte[] bytes = limitSize(received, type, options.actionOnTooMuchData());
        final StringEncoding encoding = options.stringEncoding();
        if (encoding.isUtf16() && bytes.length % 2 != 0) {
            throw new SomeIpWireException(WireErrorKind.INVALID_STRING_ENCODING,
                    "UTF-16 string has odd byte length " + bytes.length);
        }

        int start = 0;
        int end = bytes.length;
        Charset charset = encoding.charset();

        if (options.stringWithBom()) {
            if (encoding.isUtf16()) {
                if (startsWith(bytes, StringEncoding.UTF_16BE.byteOrderMark())) {
                    charset = StandardCharsets.UTF_16BE;
                } else if (startsWith(bytes, StringEncoding.UTF_16LE.byteOrderMark())) {
                    charset = StandardCharsets.UTF_16LE;
                } else {
                    throw missingBom();
                }
                start = 2;
            } else {
                if (!startsWith(bytes, encoding.byteOrderMark())) {
                    throw missingBom();
                }
                start = 3;
            }
        }

        if (options.stringWithTerminator()) {
            final int unit = encoding.codeUnitSize();
            if (end - start < unit || !isZero(bytes, end - unit, end)) {
                throw new SomeIpWireException(WireErrorKind.INVALID_STRING_ENCODING,
                        "String must end with a NUL terminator");
            }
            end -= unit;
        }

        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, start, end - start))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new SomeIpWireException(WireErrorKind.INVALID_STRING_ENCODING,
                    "String is not valid " + charset.name(), e);
        }
    }

    /**
     * Applies the size bounds to received string bytes. Bytes above the
     * maximum are rejected, cut off or kept, as {@code action} says.
     */
    private static byte[] limitSize(byte[] bytes, StringType type, ActionOnTooMuchData action)
            throws SomeIpWireException
    {
        if (bytes.length < type.minSize()
                || bytes.length > type.maxSize() && action == ActionOnTooMuchData.FAIL) {
            throw new SomeIpWireException(WireErrorKind.STRING_SIZE_OUT_OF_BOUNDS,
                    "String of " + bytes.length + " bytes outside " + type.minSize() + ".." + type.maxSize());
        }
        if (bytes.length > type.maxSize() && action == ActionOnTooMuchData.DISCARD) {
            return Arrays.copyOf(bytes, type.maxSize());
        }
        return bytes;
    }

    private static SomeIpWireException missingBom() {
        return new SomeIpWireException(WireErrorKind.INVALID_STRING_ENCODING, "String must begin with a byte order mark");
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        return bytes.length >= prefix.length && Arrays.equals(bytes, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static boolean isZero(byte[] bytes, int from, int to)
    {
        for (int i = from; i < to; i++) {
            if (bytes[i] != 0) {
                return false;
            }
        }
        return true;
    }
}
