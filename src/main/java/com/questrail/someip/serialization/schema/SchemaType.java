package com.questrail.someip.serialization.schema;

import java.util.OptionalInt;

/**
 * Structural description of a SOME/IP data type.
 *
 * <h2>Purpose</h2>
 * <p>
 * A {@code SchemaType} tells the codec how a value is laid out on the wire.
 * It is produced once by whatever layer knows the host types (hand-written
 * builders, generated code) and then reused across any number of independent
 * encode and decode calls, on any number of threads.
 * </p>
 *
 * <h2>Closed type space</h2>
 * <p>
 * The interface is sealed so the codec can match the five SOME/IP type
 * categories exhaustively:
 * </p>
 * <ul>
 *   <li>{@link PrimitiveType}: fixed-width integers, floats and booleans</li>
 *   <li>{@link StringType}: length-prefixed text</li>
 *   <li>{@link SequenceType}: homogeneous repeated elements</li>
 *   <li>{@link StructType}: records, fixed layout or TLV</li>
 *   <li>{@link UnionType}: discriminated unions and enumerations</li>
 * </ul>
 *
 * <p>All implementations are immutable.</p>
 */
public sealed interface SchemaType
        permits PrimitiveType, StringType, SequenceType, StructType, UnionType {

    /**
     * Returns true if every value of this type encodes to the same number of
     * bytes, so that no length field is needed to delimit it.
     */
    boolean isStaticSize();

    /**
     * Type-level length field width override, if any.
     *
     * <p>When absent the width is taken from the options default for this
     * type's category. A field-level override takes precedence over both.</p>
     */
    OptionalInt lengthFieldWidth();

    /**
     * Short human-readable description used in error messages.
     */
    String describe();
}
