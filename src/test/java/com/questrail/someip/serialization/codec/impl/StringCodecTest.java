package com.questrail.someip.serialization.codec.impl;

import com.questrail.someip.serialization.Hex;
import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.codec.WireErrorKind;
import com.questrail.someip.serialization.config.ActionOnTooMuchData;
import com.questrail.someip.serialization.config.SomeIpOptions;
import com.questrail.someip.serialization.config.StringEncoding;
import com.questrail.someip.serialization.schema.StringType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StringCodecTest
 * -----------------------------------------------------------------------------
 * String bytes excluding the length field: BOM, text and terminator.
 */
final class StringCodecTest
{
    private static final StringType ANY = StringType.bounded(64);

    private static SomeIpOptions options(StringEncoding encoding, boolean bom, boolean terminator)
    {
        return SomeIpOptions.builder()
                .withStringEncoding(encoding)
                .withStringWithBom(bom)
                .withStringWithTerminator(terminator)
                .build();
    }

    // -------------------------------------------------------------------------
    // UTF-8
    // -------------------------------------------------------------------------

    @Test
    void utf8Plain() throws SomeIpWireException
    {
        SomeIpOptions o = options(StringEncoding.UTF_8, false, false);
        assertArrayEquals(Hex.bytes("48 69"), StringCodec.encode("Hi", ANY, o));
        assertEquals("Hi", StringCodec.decode(Hex.bytes("48 69"), ANY, o));
    }

    @Test
    void utf8WithBomAndTerminator() throws SomeIpWireException
    {
        SomeIpOptions o = options(StringEncoding.UTF_8, true, true);
        byte[] expected = Hex.bytes("EF BB BF 48 69 00");
        assertArrayEquals(expected, StringCodec.encode("Hi", ANY, o));
        assertEquals("Hi", StringCodec.decode(expected, ANY, o));
    }

    @Test
    void utf8MultiByteText() throws SomeIpWireException
    {
        SomeIpOptions o = SomeIpOptions.reference();
        assertArrayEquals(Hex.bytes("C3 A4"), StringCodec.encode("\u00E4", ANY, o));
        assertEquals("\u00E4", StringCodec.decode(Hex.bytes("C3 A4"), ANY, o));
    }

    @Test
    void emptyString() throws SomeIpWireException
    {
        assertArrayEquals(new byte[0], StringCodec.encode("", ANY, SomeIpOptions.reference()));
        assertEquals("", StringCodec.decode(new byte[0], ANY, SomeIpOptions.reference()));
    }

    // -------------------------------------------------------------------------
    // UTF-16
    // -------------------------------------------------------------------------

    @Test
    void utf16BigEndian() throws SomeIpWireException
    {
        SomeIpOptions o = options(StringEncoding.UTF_16BE, false, true);
        byte[] expected = Hex.bytes("00 48 00 69 00 00");
        assertArrayEquals(expected, StringCodec.encode("Hi", ANY, o));
        assertEquals("Hi", StringCodec.decode(expected, ANY, o));
    }

    @Test
    void utf16LittleEndianWithBom() throws SomeIpWireException
    {
        SomeIpOptions o = options(StringEncoding.UTF_16LE, true, false);
        byte[] expected = Hex.bytes("FF FE 48 00 69 00");
        assertArrayEquals(expected, StringCodec.encode("Hi", ANY, o));
        assertEquals("Hi", StringCodec.decode(expected, ANY, o));
    }

    @Test
    void utf16BomSelectsByteOrderOnDecode() throws SomeIpWireException
    {
        SomeIpOptions o = options(StringEncoding.UTF_16LE, true, false);
        assertEquals("Hi", StringCodec.decode(Hex.bytes("FE FF 00 48 00 69"), ANY, o));
    }

    @Test
    void utf16OddLengthIsInvalid()
    {
        SomeIpOptions o = options(StringEncoding.UTF_16BE, false, false);
        assertKind(WireErrorKind.INVALID_STRING_ENCODING, () -> StringCodec.decode(Hex.bytes("00 48 00"), ANY, o));
    }

    @Test
    void utf16LoneSurrogateIsInvalid()
    {
        SomeIpOptions o = options(StringEncoding.UTF_16BE, false, false);
        assertKind(WireErrorKind.INVALID_STRING_ENCODING, () -> StringCodec.decode(Hex.bytes("D8 00"), ANY, o));
    }

    // -------------------------------------------------------------------------
    // Failures
    // -------------------------------------------------------------------------

    @Test
    void missingBomIsInvalid()
    {
        SomeIpOptions utf8 = options(StringEncoding.UTF_8, true, false);
        assertKind(WireErrorKind.INVALID_STRING_ENCODING, () -> StringCodec.decode(Hex.bytes("48 69"), ANY, utf8));

        SomeIpOptions utf16 = options(StringEncoding.UTF_16BE, true, false);
        assertKind(WireErrorKind.INVALID_STRING_ENCODING, () -> StringCodec.decode(Hex.bytes("00 48"), ANY, utf16));
    }

    @Test
    void missingTerminatorIsInvalid()
    {
        SomeIpOptions o = options(StringEncoding.UTF_8, false, true);
        assertKind(WireErrorKind.INVALID_STRING_ENCODING, () -> StringCodec.decode(Hex.bytes("48 69"), ANY, o));
        assertKind(WireErrorKind.INVALID_STRING_ENCODING, () -> StringCodec.decode(new byte[0], ANY, o));
    }

    @Test
    void malformedUtf8IsInvalid()
    {
        assertKind(WireErrorKind.INVALID_STRING_ENCODING,
                () -> StringCodec.decode(Hex.bytes("C3 28"), ANY, SomeIpOptions.reference()));
    }

    @Test
    void unencodableTextIsProgrammingError()
    {
        assertThrows(IllegalArgumentException.class,
                () -> StringCodec.encode("\uD800", ANY, SomeIpOptions.reference()));
        assertThrows(IllegalArgumentException.class,
                () -> StringCodec.encode(42, ANY, SomeIpOptions.reference()));
    }

    @Test
    void sizeBoundsCountBomAndTerminator()
    {
        StringType upTo4 = StringType.bounded(4);
        SomeIpOptions o = options(StringEncoding.UTF_8, true, false);

        assertKind(WireErrorKind.VALUE_TOO_LARGE, () -> StringCodec.encode("Hi", upTo4, o));
        assertDoesNotThrow(() -> StringCodec.encode("H", upTo4, o));
        assertThrows(IllegalArgumentException.class,
                () -> StringCodec.encode("", StringType.of(4, 8), o));
    }

    @Test
    void sizeBoundsOnDecode()
    {
        StringType atLeast2 = StringType.of(2, 4);
        assertKind(WireErrorKind.STRING_SIZE_OUT_OF_BOUNDS,
                () -> StringCodec.decode(Hex.bytes("48"), atLeast2, SomeIpOptions.reference()));
        assertKind(WireErrorKind.STRING_SIZE_OUT_OF_BOUNDS,
                () -> StringCodec.decode(Hex.bytes("48 48 48 48 48"), atLeast2, SomeIpOptions.reference()));
    }

    @Test
    void oversizeTextFailsByDefault()
    {
        assertKind(WireErrorKind.STRING_SIZE_OUT_OF_BOUNDS,
                () -> StringCodec.decode(Hex.bytes("48 69 21"), StringType.of(0, 2), SomeIpOptions.reference()));
    }

    @Test
    void oversizeTextIsCutToMaximum() throws SomeIpWireException
    {
        SomeIpOptions discard = SomeIpOptions.builder().withActionOnTooMuchData(ActionOnTooMuchData.DISCARD).build();
        assertEquals("Hi", StringCodec.decode(Hex.bytes("48 69 21"), StringType.of(0, 2), discard));
    }

    @Test
    void oversizeTextIsKept() throws SomeIpWireException
    {
        SomeIpOptions keep = SomeIpOptions.builder().withActionOnTooMuchData(ActionOnTooMuchData.KEEP).build();
        assertEquals("Hi!", StringCodec.decode(Hex.bytes("48 69 21"), StringType.of(0, 2), keep));
        assertKind(WireErrorKind.STRING_SIZE_OUT_OF_BOUNDS,
                () -> StringCodec.decode(Hex.bytes("48"), StringType.of(2, 4), keep));
    }

    private static void assertKind(WireErrorKind kind, org.junit.jupiter.api.function.Executable call)
    {
        SomeIpWireException e = assertThrows(SomeIpWireException.class, call);
        assertEquals(kind, e.kind());
    }
}
