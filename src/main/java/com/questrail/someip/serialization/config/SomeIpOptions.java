package com.questrail.someip.serialization.config;

import com.questrail.someip.serialization.schema.LengthFieldWidths;
import com.questrail.someip.serialization.schema.SchemaException;

import java.nio.ByteOrder;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Wire-format policy for one encode or decode call.
 *
 * <p>Options are immutable and validated at construction. Every byte order
 * and length field decision made by the codec is taken from here or from an
 * explicit override on the schema.</p>
 *
 * @param byteOrder              byte order of primitive payload values (tags and length fields are always big endian)
 * @param stringEncoding         character encoding of strings
 * @param stringWithBom          whether strings start with a byte order mark
 * @param stringWithTerminator   whether strings end with a NUL code unit
 * @param arrayLengthFieldWidth  default length field width for sequences
 * @param stringLengthFieldWidth default length field width for strings
 * @param structLengthFieldWidth default length field width for nested structs
 * @param unionLengthFieldWidth  default length field width for unions
 * @param unionTypeFieldWidth    width of the union type field
 * @param lengthFieldSelection   width selection inside TLV structs
 * @param actionOnTooMuchData    decoder behaviour for strings and sequences above their maximum size
 * @param maxDepth               maximum nesting depth of structs, sequences and unions
 */
public record SomeIpOptions(
    ByteOrder byteOrder,
    StringEncoding stringEncoding,
    boolean stringWithBom,
    boolean stringWithTerminator,
    int arrayLengthFieldWidth,
    int stringLengthFieldWidth,
    int structLengthFieldWidth,
    int unionLengthFieldWidth,
    int unionTypeFieldWidth,
    LengthFieldSelection lengthFieldSelection,
    ActionOnTooMuchData actionOnTooMuchData,
    int maxDepth
) {
    public static final String PREFIX = "someip.";

    static final String KEY_BYTE_ORDER = "someip.byte-order";
    static final String KEY_STRING_ENCODING = "someip.string.encoding";
    static final String KEY_STRING_BOM = "someip.string.bom";
    static final String KEY_STRING_TERMINATOR = "someip.string.terminator";
    static final String KEY_ARRAY_WIDTH = "someip.length-field.array";
    static final String KEY_STRING_WIDTH = "someip.length-field.string";
    static final String KEY_STRUCT_WIDTH = "someip.length-field.struct";
    static final String KEY_UNION_WIDTH = "someip.length-field.union";
    static final String KEY_UNION_TYPE_FIELD = "someip.union.type-field";
    static final String KEY_SELECTION = "someip.length-field.selection";
    static final String KEY_TOO_MUCH_DATA = "someip.decode.too-much-data";
    static final String KEY_MAX_DEPTH = "someip.max-depth";

    private static final Set<String> KNOWN_KEYS = Set.of(
        KEY_BYTE_ORDER, KEY_STRING_ENCODING, KEY_STRING_BOM, KEY_STRING_TERMINATOR,
        KEY_ARRAY_WIDTH, KEY_STRING_WIDTH, KEY_STRUCT_WIDTH, KEY_UNION_WIDTH,
        KEY_UNION_TYPE_FIELD, KEY_SELECTION, KEY_TOO_MUCH_DATA, KEY_MAX_DEPTH);

    private static final SomeIpOptions REFERENCE = builder().build();

    public SomeIpOptions {
        Objects.requireNonNull(byteOrder, "byteOrder");
        Objects.requireNonNull(stringEncoding, "stringEncoding");
        Objects.requireNonNull(lengthFieldSelection, "lengthFieldSelection");
        Objects.requireNonNull(actionOnTooMuchData, "actionOnTooMuchData");
        LengthFieldWidths.require(arrayLengthFieldWidth, "Array length field width");
        LengthFieldWidths.require(stringLengthFieldWidth, "String length field width");
        LengthFieldWidths.require(structLengthFieldWidth, "Struct length field width");
        LengthFieldWidths.require(unionLengthFieldWidth, "Union length field width");
        if (unionTypeFieldWidth != 1 && unionTypeFieldWidth != 2 && unionTypeFieldWidth != 4) {
            throw new SchemaException("Union type field width must be 1, 2 or 4 bytes (was " + unionTypeFieldWidth + ")");
        }
        if (maxDepth < 1) {
            throw new SchemaException("maxDepth must be at least 1 (was " + maxDepth + ")");
        }
    }

    /**
     * Big endian, UTF-8 without BOM or terminator, 4-byte array and string
     * length fields, no struct or union length fields, 4-byte union type
     * field, configured widths, oversize data rejected, depth 32.
     */
    public static SomeIpOptions reference() {
        return REFERENCE;
    }

    /** {@link #reference()} with little endian payload values and UTF-16LE strings carrying a BOM. */
    public static SomeIpOptions littleEndianUtf16() {
        return builder()
            .withByteOrder(ByteOrder.LITTLE_ENDIAN)
            .withStringEncoding(StringEncoding.UTF_16LE)
            .withStringWithBom(true)
            .build();
    }

    public int lengthFieldWidth(LengthFieldCategory category) {
        return switch (Objects.requireNonNull(category, "category")) {
            case ARRAY -> arrayLengthFieldWidth;
            case STRING -> stringLengthFieldWidth;
            case STRUCT -> structLengthFieldWidth;
            case UNION -> unionLengthFieldWidth;
        };
    }

    /**
     * Loads options from {@code someip.*} properties. Missing keys take the
     * reference defaults; keys outside the {@code someip.} prefix are ignored.
     *
     * @throws SchemaException on an unknown {@code someip.} key or an unparseable value
     */
    public static SomeIpOptions fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(PREFIX) && !KNOWN_KEYS.contains(key)) {
                throw new SchemaException("Unknown SOME/IP option '" + key + "'");
            }
        }

        Builder b = builder();
        String v;
        if ((v = value(props, KEY_BYTE_ORDER)) != null) {
            b.withByteOrder(parseByteOrder(v));
        }
        if ((v = value(props, KEY_STRING_ENCODING)) != null) {
            b.withStringEncoding(parseEnum(StringEncoding.class, KEY_STRING_ENCODING, v.replace('-', '_')));
        }
        if ((v = value(props, KEY_STRING_BOM)) != null) {
            b.withStringWithBom(parseBoolean(KEY_STRING_BOM, v));
        }
        if ((v = value(props, KEY_STRING_TERMINATOR)) != null) {
            b.withStringWithTerminator(parseBoolean(KEY_STRING_TERMINATOR, v));
        }
        if ((v = value(props, KEY_ARRAY_WIDTH)) != null) {
            b.withLengthFieldWidth(LengthFieldCategory.ARRAY, parseInt(KEY_ARRAY_WIDTH, v));
        }
        if ((v = value(props, KEY_STRING_WIDTH)) != null) {
            b.withLengthFieldWidth(LengthFieldCategory.STRING, parseInt(KEY_STRING_WIDTH, v));
        }
        if ((v = value(props, KEY_STRUCT_WIDTH)) != null) {
            b.withLengthFieldWidth(LengthFieldCategory.STRUCT, parseInt(KEY_STRUCT_WIDTH, v));
        }
        if ((v = value(props, KEY_UNION_WIDTH)) != null) {
            b.withLengthFieldWidth(LengthFieldCategory.UNION, parseInt(KEY_UNION_WIDTH, v));
        }
        if ((v = value(props, KEY_UNION_TYPE_FIELD)) != null) {
            b.withUnionTypeFieldWidth(parseInt(KEY_UNION_TYPE_FIELD, v));
        }
        if ((v = value(props, KEY_SELECTION)) != null) {
            b.withLengthFieldSelection(parseEnum(LengthFieldSelection.class, KEY_SELECTION, v));
        }
        if ((v = value(props, KEY_TOO_MUCH_DATA)) != null) {
            b.withActionOnTooMuchData(parseEnum(ActionOnTooMuchData.class, KEY_TOO_MUCH_DATA, v));
        }
        if ((v = value(props, KEY_MAX_DEPTH)) != null) {
            b.withMaxDepth(parseInt(KEY_MAX_DEPTH, v));
        }
        return b.build();
    }

    private static String value(Properties props, String key) {
        String v = props.getProperty(key);
        return v == null ? null : v.trim();
    }

    private static ByteOrder parseByteOrder(String v) {
        switch (v.toLowerCase(Locale.ROOT)) {
            case "big", "big-endian", "big_endian":
                return ByteOrder.BIG_ENDIAN;
            case "little", "little-endian", "little_endian":
                return ByteOrder.LITTLE_ENDIAN;
            default:
                throw new SchemaException("Invalid value for " + KEY_BYTE_ORDER + ": '" + v + "'");
        }
    }

    private static boolean parseBoolean(String key, String v) {
        if ("true".equalsIgnoreCase(v)) {
            return true;
        }
        if ("false".equalsIgnoreCase(v)) {
            return false;
        }
        throw new SchemaException("Invalid value for " + key + ": '" + v + "'");
    }

    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new SchemaException("Invalid value for " + key + ": '" + v + "'", e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String v) {
        try {
            return Enum.valueOf(type, v.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SchemaException("Invalid value for " + key + ": '" + v + "'", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder seeded with this instance's values. */
    public Builder toBuilder() {
        return new Builder()
            .withByteOrder(byteOrder)
            .withStringEncoding(stringEncoding)
            .withStringWithBom(stringWithBom)
            .withStringWithTerminator(stringWithTerminator)
            .withLengthFieldWidth(LengthFieldCategory.ARRAY, arrayLengthFieldWidth)
            .withLengthFieldWidth(LengthFieldCategory.STRING, stringLengthFieldWidth)
            .withLengthFieldWidth(LengthFieldCategory.STRUCT, structLengthFieldWidth)
            .withLengthFieldWidth(LengthFieldCategory.UNION, unionLengthFieldWidth)
            .withUnionTypeFieldWidth(unionTypeFieldWidth)
            .withLengthFieldSelection(lengthFieldSelection)
            .withActionOnTooMuchData(actionOnTooMuchData)
            .withMaxDepth(maxDepth);
    }

    public static final class Builder {
        private ByteOrder byteOrder = ByteOrder.BIG_ENDIAN;
        private StringEncoding stringEncoding = StringEncoding.UTF_8;
        private boolean stringWithBom = false;
        private boolean stringWithTerminator = false;
        private int arrayLengthFieldWidth = 4;
        private int stringLengthFieldWidth = 4;
        private int structLengthFieldWidth = 0;
        private int unionLengthFieldWidth = 0;
        private int unionTypeFieldWidth = 4;
        private LengthFieldSelection lengthFieldSelection = LengthFieldSelection.CONFIGURED;
        private ActionOnTooMuchData actionOnTooMuchData = ActionOnTooMuchData.FAIL;
        private int maxDepth = 32;

        public Builder withByteOrder(ByteOrder byteOrder) {
            this.byteOrder = byteOrder;
            return this;
        }

        public Builder withStringEncoding(StringEncoding stringEncoding) {
            this.stringEncoding = stringEncoding;
            return this;
        }

        public Builder withStringWithBom(boolean stringWithBom) {
            this.stringWithBom = stringWithBom;
            return this;
        }

        public Builder withStringWithTerminator(boolean stringWithTerminator) {
            this.stringWithTerminator = stringWithTerminator;
            return this;
        }

        public Builder withLengthFieldWidth(LengthFieldCategory category, int width) {
            switch (Objects.requireNonNull(category, "category")) {
                case ARRAY -> this.arrayLengthFieldWidth = width;
                case STRING -> this.stringLengthFieldWidth = width;
                case STRUCT -> this.structLengthFieldWidth = width;
                case UNION -> this.unionLengthFieldWidth = width;
            }
            return this;
        }

        public Builder withUnionTypeFieldWidth(int width) {
            this.unionTypeFieldWidth = width;
            return this;
        }

        public Builder withLengthFieldSelection(LengthFieldSelection selection) {
            this.lengthFieldSelection = selection;
            return this;
        }

        public Builder withActionOnTooMuchData(ActionOnTooMuchData action) {
            this.actionOnTooMuchData = action;
            return this;
        }

        public Builder withMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public SomeIpOptions build() {
            return new SomeIpOptions(
                byteOrder, stringEncoding, stringWithBom, stringWithTerminator,
                arrayLengthFieldWidth, stringLengthFieldWidth, structLengthFieldWidth, unionLengthFieldWidth,
                unionTypeFieldWidth, lengthFieldSelection, actionOnTooMuchData, maxDepth);
        }
    }
}
