package com.questrail.someip.serialization.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SerializationObservabilitySink that emits logs via SLF4J.
 * Payload contents are never logged.
 */
public final class Slf4jSerializationObservabilitySink implements SerializationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSerializationObservabilitySink.class);

    @Override
    public void onUnknownFieldSkipped(UnknownFieldSkippedEvent event) {
        log.debug("SOME/IP skipped unknown field {} ({}, {} bytes) in {}",
            event.dataId(),
            event.wireType(),
            event.skippedBytes(),
            event.structName());
    }

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {
        log.warn("SOME/IP decode of {} failed ({} bytes): {} {}",
            event.schema(),
            event.payloadSize(),
            event.cause().kind(),
            event.cause().getMessage());
    }
}
