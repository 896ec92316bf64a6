package com.questrail.someip.serialization.schema;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class StructTypeTest
{
    @Test
    void fixedBuilderAssignsIdsByPosition()
    {
        StructType s = StructType.fixed("Point")
                .field("x", PrimitiveType.I32)
                .field("y", PrimitiveType.I32)
                .build();

        assertEquals(0, s.fieldByName("x").orElseThrow().id());
        assertEquals(1, s.fieldByName("y").orElseThrow().id());
        assertFalse(s.isTlv());
        assertTrue(s.isStaticSize());
    }

    @Test
    void lookupById()
    {
        StructType s = StructType.tlv("Status")
                .field("speed", 3, PrimitiveType.U16)
                .optional("label", 9, StringType.bounded(32))
                .build();

        assertEquals("label", s.fieldById(9).orElseThrow().name());
        assertTrue(s.fieldById(4).isEmpty());
        assertFalse(s.isStaticSize());
    }

    @Test
    void rejectsDuplicateId()
    {
        StructType.Builder b = StructType.tlv("Dup")
                .field("a", 1, PrimitiveType.U8)
                .field("b", 1, PrimitiveType.U8);
        assertThrows(SchemaException.class, b::build);
    }

    @Test
    void rejectsDuplicateName()
    {
        StructType.Builder b = StructType.tlv("Dup")
                .field("a", 1, PrimitiveType.U8)
                .field("a", 2, PrimitiveType.U8);
        assertThrows(SchemaException.class, b::build);
    }

    @Test
    void rejectsOptionalFieldInFixedLayout()
    {
        StructType.Builder b = StructType.fixed("Fixed")
                .optional("a", 0, PrimitiveType.U8);
        assertThrows(SchemaException.class, b::build);
    }

    @Test
    void rejectsIdBeyondTwelveBits()
    {
        assertThrows(SchemaException.class, () -> SchemaField.required("a", 4096, PrimitiveType.U8));
        assertDoesNotThrow(() -> SchemaField.required("a", 4095, PrimitiveType.U8));
        assertThrows(SchemaException.class, () -> SchemaField.required("a", -1, PrimitiveType.U8));
    }

    @Test
    void rejectsInvalidLengthFieldWidth()
    {
        assertThrows(SchemaException.class,
                () -> SchemaField.required("a", 0, StringType.bounded(4)).withLengthFieldWidth(3));
        assertThrows(SchemaException.class,
                () -> StructType.tlv("S").withLengthFieldWidth(8).build());
    }

    @Test
    void nullOverrideIsTreatedAsAbsent()
    {
        SchemaField f = new SchemaField("a", 0, PrimitiveType.U8, false, null);
        assertEquals(OptionalInt.empty(), f.lengthFieldWidth());
    }

    @Test
    void fixedLayoutWithDynamicMemberIsNotStatic()
    {
        StructType s = new StructType("S",
                List.of(SchemaField.required("name", 0, StringType.bounded(8))), false, OptionalInt.empty());
        assertFalse(s.isStaticSize());
    }

    @Test
    void fixedLayoutRejectsDynamicMemberWithoutLengthField()
    {
        StructType.Builder string = StructType.fixed("F")
                .field(SchemaField.required("s", 0, StringType.bounded(8)).withLengthFieldWidth(0));
        assertThrows(SchemaException.class, string::build);

        StructType.Builder sequence = StructType.fixed("F")
                .field(SchemaField.required("v", 0, SequenceType.of(PrimitiveType.U8, 4)).withLengthFieldWidth(0));
        assertThrows(SchemaException.class, sequence::build);
    }

    @Test
    void fixedLayoutRejectsTlvMemberWithoutLengthField()
    {
        StructType inner = StructType.tlv("Inner").field("x", 1, PrimitiveType.U8).build();

        StructType.Builder byField = StructType.fixed("F")
                .field(SchemaField.required("inner", 0, inner).withLengthFieldWidth(0));
        assertThrows(SchemaException.class, byField::build);

        StructType zeroWidthInner = StructType.tlv("Inner").field("x", 1, PrimitiveType.U8).withLengthFieldWidth(0).build();
        assertThrows(SchemaException.class, () -> StructType.fixed("F").field("inner", zeroWidthInner).build());
    }

    @Test
    void memberWithoutLengthFieldAcceptedWhereDelimited()
    {
        assertDoesNotThrow(() -> StructType.fixed("F")
                .field(SchemaField.required("code", 0, StringType.fixed(3)).withLengthFieldWidth(0))
                .build());
        StructType fixedInner = StructType.fixed("Inner").field("x", PrimitiveType.U8).build();
        assertDoesNotThrow(() -> StructType.fixed("F")
                .field(SchemaField.required("inner", 0, fixedInner).withLengthFieldWidth(0))
                .build());
        // Inside TLV a width of 0 is replaced by the smallest width that fits.
        assertDoesNotThrow(() -> StructType.tlv("T")
                .field(SchemaField.required("s", 0, StringType.bounded(8)).withLengthFieldWidth(0))
                .build());
    }

    @Test
    void equalStructuresAreEqual()
    {
        StructType a = StructType.tlv("S").field("x", 0, PrimitiveType.I32).build();
        StructType b = StructType.tlv("S").field("x", 0, PrimitiveType.I32).build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
