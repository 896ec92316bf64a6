package com.questrail.someip.serialization.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * StructType
 * -----------------------------------------------------------------------------
 * A record of named members, encoded either back-to-back or as TLV entries.
 *
 * <p><strong>Fixed layout</strong> ({@code tlv == false}): members are written in
 * declaration order with no tags. Every member is mandatory.</p>
 *
 * <p><strong>TLV</strong> ({@code tlv == true}): each member is preceded by a
 * 16-bit tag carrying its data id and wire type. Members may be optional, may
 * arrive in any order, and unknown ids are skipped on decode.</p>
 *
 * <p>Instances are immutable and validated at construction. Use
 * {@link #tlv(String)} or {@link #fixed(String)} to obtain a builder.</p>
 */
public final class StructType implements SchemaType
{
    private final String name;
    private final List<SchemaField> fields;
    private final boolean tlv;
    private final OptionalInt lengthFieldWidth;
    private final Map<Integer, SchemaField> byId;
    private final Map<String, SchemaField> byName;

    public StructType(String name, List<SchemaField> fields, boolean tlv, OptionalInt lengthFieldWidth)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
        this.tlv = tlv;
        this.lengthFieldWidth = LengthFieldWidths.requireOverride(lengthFieldWidth, "Struct '" + name + "' length field width");

        Map<Integer, SchemaField> ids = new HashMap<>();
        Map<String, SchemaField> names = new HashMap<>();
        for (SchemaField f : this.fields) {
            if (ids.putIfAbsent(f.id(), f) != null) {
                throw new SchemaException("Struct '" + name + "' declares data id " + f.id() + " twice");
            }
            if (names.putIfAbsent(f.name(), f) != null) {
                throw new SchemaException("Struct '" + name + "' declares field '" + f.name() + "' twice");
            }
            if (f.optional() && !tlv) {
                throw new SchemaException(
                        "Struct '" + name + "' is not TLV encoded; field '" + f.name() + "' cannot be optional");
            }
            if (!tlv && declaresNoLengthField(f) && LengthFieldWidths.requiresLengthField(f.type())) {
                throw new SchemaException("Struct '" + name + "' is not TLV encoded; field '" + f.name()
                        + "' of " + f.type().describe() + " cannot drop its length field");
            }
        }
        this.byId = Collections.unmodifiableMap(ids);
        this.byName = Collections.unmodifiableMap(names);
    }

    /** True if the field, or failing that its type, declares a width of 0. */
    private static boolean declaresNoLengthField(SchemaField f)
    {
        final OptionalInt width = f.lengthFieldWidth().isPresent() ? f.lengthFieldWidth() : f.type().lengthFieldWidth();
        return width.isPresent() && width.getAsInt() == 0;
    }

    /** Builder for a TLV encoded struct. */
    public static Builder tlv(String name) {
        return new Builder(name, true);
    }

    /** Builder for a fixed-layout struct. Data ids are assigned by position. */
    public static Builder fixed(String name) {
        return new Builder(name, false);
    }

    public String name() {
        return name;
    }

    public List<SchemaField> fields() {
        return fields;
    }

    public boolean isTlv() {
        return tlv;
    }

    @Override
    public OptionalInt lengthFieldWidth() {
        return lengthFieldWidth;
    }

    public Optional<SchemaField> fieldById(int id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Optional<SchemaField> fieldByName(String fieldName) {
        return Optional.ofNullable(byName.get(fieldName));
    }

    /**
     * A fixed-layout struct is static when all its members are. A TLV struct
     * never is, since members may be omitted or appear with varying length
     * field widths.
     */
    @Override
    public boolean isStaticSize() {
        if (tlv) {
            return false;
        }
        for (SchemaField f : fields) {
            if (!f.type().isStaticSize()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String describe() {
        return (tlv ? "tlv struct " : "struct ") + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StructType other)) {
            return false;
        }
        return tlv == other.tlv
                && name.equals(other.name)
                && fields.equals(other.fields)
                && lengthFieldWidth.equals(other.lengthFieldWidth);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fields, tlv, lengthFieldWidth);
    }

    @Override
    public String toString() {
        return "StructType[" + describe() + ", fields=" + fields.size() + "]";
    }

    public static final class Builder
    {
        private final String name;
        private final boolean tlv;
        private final List<SchemaField> fields = new ArrayList<>();
        private OptionalInt lengthFieldWidth = OptionalInt.empty();

        private Builder(String name, boolean tlv) {
            this.name = Objects.requireNonNull(name, "name");
            this.tlv = tlv;
        }

        public Builder field(SchemaField field) {
            fields.add(Objects.requireNonNull(field, "field"));
            return this;
        }

        /** Mandatory member with an explicit data id. */
        public Builder field(String fieldName, int id, SchemaType type) {
            return field(SchemaField.required(fieldName, id, type));
        }

        /** Mandatory member whose data id is its position. */
        public Builder field(String fieldName, SchemaType type) {
            return field(SchemaField.required(fieldName, fields.size(), type));
        }

        public Builder optional(String fieldName, int id, SchemaType type) {
            return field(SchemaField.optional(fieldName, id, type));
        }

        public Builder withLengthFieldWidth(int width) {
            this.lengthFieldWidth = OptionalInt.of(width);
            return this;
        }

        public StructType build() {
            return new StructType(name, fields, tlv, lengthFieldWidth);
        }
    }
}
