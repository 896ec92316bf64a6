package com.questrail.someip.serialization.codec;

/**
 * Classification of wire-level failures.
 */
public enum WireErrorKind
{
    /** Fewer bytes remain than the value or length field requires. */
    UNEXPECTED_END_OF_INPUT,
    /** A TLV tag's wire type is incompatible with the declared member type. */
    WIRE_TYPE_MISMATCH,
    /** A mandatory TLV member was not present. */
    MISSING_MANDATORY_FIELD,
    /** Malformed text, missing or wrong BOM, or missing terminator. */
    INVALID_STRING_ENCODING,
    /** A length or discriminant does not fit its field. */
    VALUE_TOO_LARGE,
    /** A length-bounded region was over-read or not fully consumed. */
    LENGTH_MISMATCH,
    UNKNOWN_DISCRIMINANT,
    /** Nesting exceeded the configured maximum depth. */
    SCHEMA_TOO_DEEP,
    /** A boolean byte other than 0 or 1. */
    INVALID_BOOLEAN_VALUE,
    UNKNOWN_TREAT_AS_VALUE,
    /** Reserved wire type, or wire type 7 on a member that cannot be skipped. */
    UNSUPPORTED_WIRE_TYPE,
    DUPLICATE_FIELD,
    STRING_SIZE_OUT_OF_BOUNDS,
    SEQUENCE_SIZE_OUT_OF_BOUNDS,
    /** Bytes left over after the root value. */
    TRAILING_BYTES
}
