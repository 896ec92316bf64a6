package com.questrail.someip.serialization.codec.impl;

import com.questrail.someip.serialization.codec.SomeIpDecoder;
import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.codec.WireErrorKind;
import com.questrail.someip.serialization.config.SomeIpOptions;
import com.questrail.someip.serialization.observability.DecodeFailureEvent;
import com.questrail.someip.serialization.observability.NullObservabilitySink;
import com.questrail.someip.serialization.observability.SerializationObservabilitySink;
import com.questrail.someip.serialization.schema.SchemaType;

import java.time.Instant;
import java.util.Objects;

/**
 * DefaultSomeIpDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SomeIpDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Wrap the payload in a read-only root reader</li>
 *   <li>Decode the root value (a root struct has no length field)</li>
 *   <li>Reject any bytes left over after the root value</li>
 * </ol>
 *
 * <p>Every failure is reported to the observability sink before it is
 * rethrown; skipped unknown TLV members are reported as they are skipped.</p>
 */
public final class DefaultSomeIpDecoder implements SomeIpDecoder
{
    private final SerializationObservabilitySink sink;

    public DefaultSomeIpDecoder()
    {
        this(NullObservabilitySink.INSTANCE);
    }

    public DefaultSomeIpDecoder(SerializationObservabilitySink sink)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public Object decode(byte[] payload, SchemaType schema, SomeIpOptions options) throws SomeIpWireException
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(options, "options");

        try {
            final WireReader in = WireReader.of(payload);
            final Object value = SchemaCodec.decodeRoot(in, schema, new CodecContext(options, sink));
            if (!in.isExhausted()) {
                throw new SomeIpWireException(WireErrorKind.TRAILING_BYTES,
                        in.remaining() + " bytes left over after " + schema.describe());
            }
            return value;
        }
        catch (SomeIpWireException e) {
            sink.onDecodeFailure(new DecodeFailureEvent(Instant.now(), schema.describe(), payload.length, e));
            throw e;
        }
    }
}
