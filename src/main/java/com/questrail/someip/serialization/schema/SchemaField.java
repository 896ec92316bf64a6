package com.questrail.someip.serialization.schema;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One member of a {@link StructType}.
 *
 * @param name             member name, unique within the struct
 * @param id               12-bit data id used by TLV tags
 * @param type             member type
 * @param optional         true if the member may be absent (TLV structs only)
 * @param lengthFieldWidth field-level length field width override
 */
public record SchemaField(String name,
                          int id,
                          SchemaType type,
                          boolean optional,
                          OptionalInt lengthFieldWidth)
{
    public static final int MAX_ID = 0x0FFF;

    public SchemaField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isEmpty()) {
            throw new SchemaException("Field name must not be empty");
        }
        if (id < 0 || id > MAX_ID) {
            throw new SchemaException("Field '" + name + "' id must be within 0.." + MAX_ID + " (was " + id + ")");
        }
        lengthFieldWidth = LengthFieldWidths.requireOverride(lengthFieldWidth, "Field '" + name + "' length field width");
    }

    public static SchemaField required(String name, int id, SchemaType type) {
        return new SchemaField(name, id, type, false, OptionalInt.empty());
    }

    public static SchemaField optional(String name, int id, SchemaType type) {
        return new SchemaField(name, id, type, true, OptionalInt.empty());
    }

    public SchemaField withLengthFieldWidth(int width) {
        return new SchemaField(name, id, type, optional, OptionalInt.of(width));
    }
}
