package com.questrail.someip.serialization.codec;

import java.util.Objects;

/**
 * Raised when bytes cannot be decoded, or a value cannot be encoded, under
 * the given schema and options.
 *
 * <p>This is a recoverable condition: the input is rejected and the caller
 * decides what to do with it. Schema defects are reported separately via
 * {@link com.questrail.someip.serialization.schema.SchemaException}.</p>
 */
public final class SomeIpWireException extends Exception
{
    private final WireErrorKind kind;

    public SomeIpWireException(WireErrorKind kind, String message)
    {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public SomeIpWireException(WireErrorKind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public WireErrorKind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "SomeIpWireException[" + kind + "]: " + getMessage();
    }
}
