package com.questrail.someip.serialization.observability;

import com.questrail.someip.serialization.codec.SomeIpWireException;

import java.time.Instant;

/**
 * Record describing a rejected payload.
 *
 * @param schema       description of the root schema
 * @param payloadSize  size of the rejected payload in bytes
 * @param cause        the failure
 */
public record DecodeFailureEvent(
    Instant timestamp,
    String schema,
    int payloadSize,
    SomeIpWireException cause
) {
}
