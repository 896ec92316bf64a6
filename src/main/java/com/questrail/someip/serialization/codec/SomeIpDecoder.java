package com.questrail.someip.serialization.codec;

import com.questrail.someip.serialization.config.SomeIpOptions;
import com.questrail.someip.serialization.model.StructValue;
import com.questrail.someip.serialization.schema.SchemaType;
import com.questrail.someip.serialization.schema.StructType;

/**
 * SomeIpDecoder
 * -----------------------------------------------------------------------------
 * Schema-driven decoder from SOME/IP payload bytes to values.
 *
 * <p>The input is treated as one complete payload: the root value must
 * consume all of it. Streaming or accumulation across calls is not
 * supported.</p>
 */
public interface SomeIpDecoder
{
    /**
     * Decode one value.
     *
     * @throws SomeIpWireException if the bytes are not a valid encoding of {@code schema}
     */
    Object decode(byte[] payload, SchemaType schema, SomeIpOptions options) throws SomeIpWireException;

    /**
     * Decode a root struct.
     */
    default StructValue decodeStruct(byte[] payload, StructType schema, SomeIpOptions options)
            throws SomeIpWireException
    {
        return (StructValue) decode(payload, schema, options);
    }
}
