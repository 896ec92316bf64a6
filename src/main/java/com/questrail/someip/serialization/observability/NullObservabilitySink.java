package com.questrail.someip.serialization.observability;

/**
 * No-op implementation of SerializationObservabilitySink.
 */
public final class NullObservabilitySink implements SerializationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onUnknownFieldSkipped(UnknownFieldSkippedEvent event) {}

    @Override
    public void onDecodeFailure(DecodeFailureEvent event) {}
}
