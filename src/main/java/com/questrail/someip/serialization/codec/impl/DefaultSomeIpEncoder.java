package com.questrail.someip.serialization.codec.impl;

import com.questrail.someip.serialization.codec.SomeIpEncoder;
import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.config.SomeIpOptions;
import com.questrail.someip.serialization.observability.NullObservabilitySink;
import com.questrail.someip.serialization.schema.SchemaType;

import java.util.Objects;

/**
 * DefaultSomeIpEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SomeIpEncoder}.
 *
 * <p>Instances are stateless and may be shared across threads. Each call
 * encodes into a fresh buffer that is released before returning.</p>
 */
public final class DefaultSomeIpEncoder implements SomeIpEncoder
{
    @Override
    public byte[] encode(Object value, SchemaType schema, SomeIpOptions options) throws SomeIpWireException
    {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(options, "options");

        final CodecContext ctx = new CodecContext(options, NullObservabilitySink.INSTANCE);
        try (WireWriter out = new WireWriter()) {
            SchemaCodec.encodeRoot(out, schema, value, ctx);
            return out.toByteArray();
        }
    }
}
