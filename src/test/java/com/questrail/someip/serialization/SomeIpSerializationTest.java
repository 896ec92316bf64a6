package com.questrail.someip.serialization;

import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.codec.impl.DefaultSomeIpDecoder;
import com.questrail.someip.serialization.config.LengthFieldCategory;
import com.questrail.someip.serialization.config.LengthFieldSelection;
import com.questrail.someip.serialization.config.SomeIpOptions;
import com.questrail.someip.serialization.model.StructValue;
import com.questrail.someip.serialization.model.UnionValue;
import com.questrail.someip.serialization.observability.RecordingObservabilitySink;
import com.questrail.someip.serialization.observability.UnknownFieldSkippedEvent;
import com.questrail.someip.serialization.schema.PrimitiveKind;
import com.questrail.someip.serialization.schema.PrimitiveType;
import com.questrail.someip.serialization.schema.SequenceType;
import com.questrail.someip.serialization.schema.StringType;
import com.questrail.someip.serialization.schema.StructType;
import com.questrail.someip.serialization.schema.UnionType;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SomeIpSerializationTest
 * -----------------------------------------------------------------------------
 * End-to-end behaviour through the static facade: round trips under several
 * option bundles, forward compatibility and optional member omission.
 */
final class SomeIpSerializationTest
{
    private static final UnionType GEAR = UnionType.enumeration("Gear", PrimitiveKind.U8)
            .variant("park", 0)
            .variant("drive", 1)
            .variant("reverse", 2)
            .build();

    private static final UnionType SHAPE = UnionType.builder("Shape")
            .variant("circle", 1, PrimitiveType.U8)
            .variant("none", 2)
            .build();

    private static final StructType POSITION = StructType.fixed("Position")
            .field("lat", PrimitiveType.F64)
            .field("lon", PrimitiveType.F64)
            .build();

    private static final StructType VEHICLE_V1 = StructType.tlv("VehicleStatus")
            .field("speed", 1, PrimitiveType.U16)
            .field("odometer", 2, PrimitiveType.U32)
            .field("name", 3, StringType.bounded(32))
            .optional("tags", 4, SequenceType.of(StringType.bounded(8), 4))
            .field("gear", 5, GEAR)
            .optional("position", 6, POSITION)
            .field("shape", 7, SHAPE)
            .field("active", 8, PrimitiveType.BOOL)
            .field("temps", 9, SequenceType.of(PrimitiveType.I16, 8))
            .build();

    private static final StructType VEHICLE_V2 = StructType.tlv("VehicleStatus")
            .field("speed", 1, PrimitiveType.U16)
            .field("odometer", 2, PrimitiveType.U32)
            .field("name", 3, StringType.bounded(32))
            .optional("tags", 4, SequenceType.of(StringType.bounded(8), 4))
            .field("gear", 5, GEAR)
            .optional("position", 6, POSITION)
            .field("shape", 7, SHAPE)
            .field("active", 8, PrimitiveType.BOOL)
            .field("temps", 9, SequenceType.of(PrimitiveType.I16, 8))
            .field("firmware", 10, StringType.bounded(16))
            .field("voltage", 11, PrimitiveType.F32)
            .build();

    private static StructValue.Builder vehicle()
    {
        return StructValue.builder()
                .set("speed", 120)
                .set("odometer", 123_456L)
                .set("name", "Car\u00E4")
                .set("tags", List.of("a", "bb"))
                .set("gear", UnionValue.of("drive"))
                .set("position", StructValue.builder().set("lat", 48.1d).set("lon", 11.5d).build())
                .set("shape", UnionValue.of("circle", (short) 3))
                .set("active", true)
                .set("temps", List.of((short) -5, (short) 20));
    }

    @Test
    void roundTripsUnderReferenceOptions() throws SomeIpWireException
    {
        assertRoundTrip(vehicle().build(), VEHICLE_V1, SomeIpOptions.reference());
    }

    @Test
    void roundTripsUnderLittleEndianUtf16() throws SomeIpWireException
    {
        assertRoundTrip(vehicle().build(), VEHICLE_V1, SomeIpOptions.littleEndianUtf16());
    }

    @Test
    void roundTripsWithSmallestWidthsAndTerminators() throws SomeIpWireException
    {
        SomeIpOptions o = SomeIpOptions.builder()
                .withLengthFieldSelection(LengthFieldSelection.SMALLEST)
                .withStringWithTerminator(true)
                .withLengthFieldWidth(LengthFieldCategory.STRING, 1)
                .withLengthFieldWidth(LengthFieldCategory.ARRAY, 2)
                .withUnionTypeFieldWidth(1)
                .withLengthFieldWidth(LengthFieldCategory.UNION, 2)
                .build();
        assertRoundTrip(vehicle().build(), VEHICLE_V1, o);
    }

    @Test
    void roundTripsFixedLayoutFrame() throws SomeIpWireException
    {
        StructType frame = StructType.fixed("Frame")
                .field("id", PrimitiveType.U32)
                .field("payload", SequenceType.of(PrimitiveType.U8, 16))
                .field("label", StringType.bounded(16))
                .field("position", POSITION)
                .field("gear", GEAR)
                .build();
        StructValue value = StructValue.builder()
                .set("id", 0xFFFF_FFFFL)
                .set("payload", List.of((short) 0, (short) 255))
                .set("label", "front")
                .set("position", StructValue.builder().set("lat", -1.0d).set("lon", 0.0d).build())
                .set("gear", UnionValue.of("reverse"))
                .build();

        assertRoundTrip(value, frame, SomeIpOptions.reference());
        assertRoundTrip(value, frame, SomeIpOptions.littleEndianUtf16());
    }

    @Test
    void roundTripsNativeInputTypes() throws SomeIpWireException
    {
        StructType blob = StructType.tlv("Blob")
                .field("b", 0, SequenceType.of(PrimitiveType.U8, 8))
                .field("u", 1, PrimitiveType.U8)
                .field("f", 2, PrimitiveType.F32)
                .field("n", 3, PrimitiveType.U64)
                .build();
        StructValue value = StructValue.builder()
                .set("b", new byte[] { 1, 2, (byte) 0xFF })
                .set("u", 7)
                .set("f", 0.1d)
                .set("n", 5)
                .build();

        assertRoundTrip(value, blob, SomeIpOptions.reference());
        assertRoundTrip(value, blob, SomeIpOptions.littleEndianUtf16());
    }

    // -------------------------------------------------------------------------
    // Evolution
    // -------------------------------------------------------------------------

    @Test
    void newerSenderDecodesUnderOlderSchema() throws SomeIpWireException
    {
        StructValue v2 = vehicle().set("firmware", "1.2.3").set("voltage", 12.5f).build();
        byte[] bytes = SomeIpSerialization.encode(v2, VEHICLE_V2, SomeIpOptions.reference());

        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        StructValue v1 = new DefaultSomeIpDecoder(sink).decodeStruct(bytes, VEHICLE_V1, SomeIpOptions.reference());

        assertEquals(vehicle().build(), v1);
        List<UnknownFieldSkippedEvent> skipped = sink.getSkippedFields();
        assertEquals(2, skipped.size());
        assertEquals(10, skipped.get(0).dataId());
        assertEquals(11, skipped.get(1).dataId());
    }

    @Test
    void olderSenderMissingMandatoryFieldIsRejected()
    {
        byte[] bytes = assertDoesNotThrow(
                () -> SomeIpSerialization.encode(vehicle().build(), VEHICLE_V1, SomeIpOptions.reference()));
        assertThrows(SomeIpWireException.class,
                () -> SomeIpSerialization.decodeStruct(bytes, VEHICLE_V2, SomeIpOptions.reference()));
    }

    @Test
    void omissionIsDistinctFromPresence() throws SomeIpWireException
    {
        StructValue without = StructValue.builder()
                .set("speed", 0)
                .set("odometer", 0L)
                .set("name", "")
                .set("gear", UnionValue.of("park"))
                .set("shape", UnionValue.of("none"))
                .set("active", false)
                .set("temps", List.of())
                .build();
        StructValue with = StructValue.builder()
                .set("speed", 0)
                .set("odometer", 0L)
                .set("name", "")
                .set("tags", List.of())
                .set("gear", UnionValue.of("park"))
                .set("shape", UnionValue.of("none"))
                .set("active", false)
                .set("temps", List.of())
                .build();

        byte[] a = SomeIpSerialization.encode(without, VEHICLE_V1, SomeIpOptions.reference());
        byte[] b = SomeIpSerialization.encode(with, VEHICLE_V1, SomeIpOptions.reference());

        assertFalse(Arrays.equals(a, b));
        assertFalse(SomeIpSerialization.decodeStruct(a, VEHICLE_V1, SomeIpOptions.reference()).has("tags"));
        assertEquals(List.of(), SomeIpSerialization.decodeStruct(b, VEHICLE_V1, SomeIpOptions.reference()).get("tags"));
    }

    @Test
    void littleEndianOptionsChangePayloadOnly() throws SomeIpWireException
    {
        StructType point = StructType.tlv("Point").field("x", 0, PrimitiveType.I32).build();
        StructValue value = StructValue.builder().set("x", 1).build();

        byte[] be = SomeIpSerialization.encode(value, point, SomeIpOptions.reference());
        byte[] le = SomeIpSerialization.encode(value, point,
                SomeIpOptions.builder().withByteOrder(ByteOrder.LITTLE_ENDIAN).build());

        assertArrayEquals(Hex.bytes("20 00 00 00 00 01"), be);
        assertArrayEquals(Hex.bytes("20 00 01 00 00 00"), le);
    }

    private static void assertRoundTrip(StructValue value, StructType schema, SomeIpOptions options)
            throws SomeIpWireException
    {
        byte[] bytes = SomeIpSerialization.encode(value, schema, options);
        StructValue decoded = SomeIpSerialization.decodeStruct(bytes, schema, options);
        assertEquals(value, decoded, () -> "round trip of " + Hex.string(bytes));
    }
}
