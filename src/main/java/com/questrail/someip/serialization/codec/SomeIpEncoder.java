package com.questrail.someip.serialization.codec;

import com.questrail.someip.serialization.config.SomeIpOptions;
import com.questrail.someip.serialization.schema.SchemaType;

/**
 * SomeIpEncoder
 * -----------------------------------------------------------------------------
 * Schema-driven encoder from values to SOME/IP payload bytes.
 *
 * <p>The encoder is responsible only for the payload. It does not write the
 * SOME/IP header and knows nothing of message or session ids.</p>
 *
 * <p>A root struct is written without length field; it is the message
 * payload and its length is carried by the header.</p>
 */
public interface SomeIpEncoder
{
    /**
     * Encode one value.
     *
     * @param value   value matching {@code schema}
     * @param schema  type of the value
     * @param options wire-format policy
     * @return the encoded payload
     * @throws SomeIpWireException if a length, discriminant or size bound cannot be honoured,
     *                             or nesting exceeds {@link SomeIpOptions#maxDepth()}
     * @throws IllegalArgumentException if {@code value} does not match {@code schema}
     */
    byte[] encode(Object value, SchemaType schema, SomeIpOptions options) throws SomeIpWireException;
}
