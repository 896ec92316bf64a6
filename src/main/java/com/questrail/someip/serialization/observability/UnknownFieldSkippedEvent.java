package com.questrail.someip.serialization.observability;

import com.questrail.someip.serialization.codec.WireType;

import java.time.Instant;

/**
 * Record describing a TLV member skipped because its data id is not declared
 * by the receiving schema.
 */
public record UnknownFieldSkippedEvent(
    Instant timestamp,
    String structName,
    int dataId,
    WireType wireType,
    int skippedBytes
) {
}
