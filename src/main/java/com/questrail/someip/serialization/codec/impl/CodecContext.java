package com.questrail.someip.serialization.codec.impl;

import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.codec.WireErrorKind;
import com.questrail.someip.serialization.config.SomeIpOptions;
import com.questrail.someip.serialization.observability.SerializationObservabilitySink;

import java.util.Objects;

/**
 * Per-call state: the options, the observability sink and the current nesting
 * depth. A new context is created for every encode or decode call.
 */
final class CodecContext
{
    private final SomeIpOptions options;
    private final SerializationObservabilitySink sink;
    private int depth;

    CodecContext(SomeIpOptions options, SerializationObservabilitySink sink)
    {
        this.options = Objects.requireNonNull(options, "options");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    SomeIpOptions options() {
        return options;
    }

    SerializationObservabilitySink sink() {
        return sink;
    }

    void enter(String what) throws SomeIpWireException
    {
        if (depth >= options.maxDepth()) {
            throw new SomeIpWireException(WireErrorKind.SCHEMA_TOO_DEEP,
                    "Nesting of " + what + " exceeds the maximum depth of " + options.maxDepth());
        }
        depth++;
    }

    void exit() {
        depth--;
    }
}
