package com.questrail.someip.serialization;

import com.questrail.someip.serialization.codec.SomeIpDecoder;
import com.questrail.someip.serialization.codec.SomeIpEncoder;
import com.questrail.someip.serialization.codec.SomeIpWireException;
import com.questrail.someip.serialization.codec.impl.DefaultSomeIpDecoder;
import com.questrail.someip.serialization.codec.impl.DefaultSomeIpEncoder;
import com.questrail.someip.serialization.config.SomeIpOptions;
import com.questrail.someip.serialization.model.StructValue;
import com.questrail.someip.serialization.schema.SchemaType;
import com.questrail.someip.serialization.schema.StructType;

/**
 * Static entry points for one-shot encoding and decoding.
 *
 * <p>Uses a shared {@link DefaultSomeIpEncoder} and a {@link DefaultSomeIpDecoder}
 * without observability. Construct a decoder directly to attach a sink.</p>
 */
public final class SomeIpSerialization
{
    private static final SomeIpEncoder ENCODER = new DefaultSomeIpEncoder();
    private static final SomeIpDecoder DECODER = new DefaultSomeIpDecoder();

    private SomeIpSerialization() {}

    public static byte[] encode(Object value, SchemaType schema, SomeIpOptions options) throws SomeIpWireException {
        return ENCODER.encode(value, schema, options);
    }

    public static Object decode(byte[] payload, SchemaType schema, SomeIpOptions options) throws SomeIpWireException {
        return DECODER.decode(payload, schema, options);
    }

    public static StructValue decodeStruct(byte[] payload, StructType schema, SomeIpOptions options)
            throws SomeIpWireException {
        return DECODER.decodeStruct(payload, schema, options);
    }
}
