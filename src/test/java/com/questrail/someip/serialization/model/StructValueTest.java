package com.questrail.someip.serialization.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

final class StructValueTest
{
    @Test
    void absentMemberIsNotPresent()
    {
        StructValue v = StructValue.builder().set("x", 1).build();

        assertTrue(v.has("x"));
        assertFalse(v.has("y"));
        assertTrue(v.find("y").isEmpty());
        assertThrows(NoSuchElementException.class, () -> v.get("y"));
    }

    @Test
    void rejectsNullMemberValue()
    {
        assertThrows(NullPointerException.class, () -> StructValue.builder().set("x", null));
    }

    @Test
    void equalityIgnoresMemberOrder()
    {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("y", 2);
        m.put("x", 1);

        StructValue a = StructValue.of(m);
        StructValue b = StructValue.builder().set("x", 1).set("y", 2).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(List.of("y", "x"), List.copyOf(a.fields().keySet()));
    }

    @Test
    void byteArraysCompareByContent()
    {
        StructValue a = StructValue.builder().set("data", new byte[] { 1, 2 }).build();
        StructValue b = StructValue.builder().set("data", new byte[] { 1, 2 }).build();
        assertEquals(a, b);
    }

    @Test
    void integersCompareByValueAcrossBoxedTypes()
    {
        StructValue given = StructValue.builder().set("u", 7).set("big", 5L).build();
        StructValue decoded = StructValue.builder().set("u", (short) 7).set("big", BigInteger.valueOf(5)).build();

        assertEquals(given, decoded);
        assertEquals(given.hashCode(), decoded.hashCode());
        assertNotEquals(given, StructValue.builder().set("u", 8).set("big", 5L).build());
    }

    @Test
    void byteArrayEqualsListOfUnsignedBytes()
    {
        StructValue given = StructValue.builder().set("data", new byte[] { 1, (byte) 0xFF }).build();

        assertEquals(given, StructValue.builder().set("data", List.of((short) 1, (short) 255)).build());
        assertNotEquals(given, StructValue.builder().set("data", List.of((short) 1, (short) -1)).build());
        assertNotEquals(given, StructValue.builder().set("data", List.of((short) 1)).build());
    }

    @Test
    void floatsCompareAtTheNarrowerPrecision()
    {
        StructValue asFloat = StructValue.builder().set("f", 0.1f).build();

        assertEquals(asFloat, StructValue.builder().set("f", (double) 0.1f).build());
        assertNotEquals(asFloat, StructValue.builder().set("f", 0.2d).build());
        assertNotEquals(StructValue.builder().set("f", 1).build(), StructValue.builder().set("f", 1.0d).build());
    }

    @Test
    void nestedValuesCompareByValue()
    {
        StructValue given = StructValue.builder()
                .set("inner", StructValue.builder().set("x", 1).build())
                .set("list", List.of(1, 2))
                .build();
        StructValue decoded = StructValue.builder()
                .set("inner", StructValue.builder().set("x", (byte) 1).build())
                .set("list", List.of((short) 1, (short) 2))
                .build();

        assertEquals(given, decoded);
    }

    @Test
    void fieldsAreUnmodifiable()
    {
        StructValue v = StructValue.builder().set("x", 1).build();
        assertThrows(UnsupportedOperationException.class, () -> v.fields().put("y", 2));
    }

    @Test
    void unionValuePayload()
    {
        assertFalse(UnionValue.of("none").hasPayload());
        assertTrue(UnionValue.of("circle", 5).hasPayload());
        assertThrows(NullPointerException.class, () -> UnionValue.of("circle", null));
    }

    @Test
    void unionPayloadComparesByValue()
    {
        assertEquals(UnionValue.of("radius", 5), UnionValue.of("radius", (short) 5));
        assertEquals(UnionValue.of("raw", new byte[] { 2 }), UnionValue.of("raw", List.of((short) 2)));
        assertEquals(UnionValue.of("radius", 5).hashCode(), UnionValue.of("radius", 5L).hashCode());
        assertNotEquals(UnionValue.of("radius", 5), UnionValue.of("diameter", 5));
        assertNotEquals(UnionValue.of("none"), UnionValue.of("none", 0));
    }
}
