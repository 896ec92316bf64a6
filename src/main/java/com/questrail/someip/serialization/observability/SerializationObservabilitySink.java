package com.questrail.someip.serialization.observability;

/**
 * Receives serialization observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are invoked synchronously on the decoding thread and must not
 * throw.</p>
 */
public interface SerializationObservabilitySink {
    /**
     * Called when a TLV member with an unknown data id is skipped.
     * @param event the skipped member
     */
    void onUnknownFieldSkipped(UnknownFieldSkippedEvent event);

    /**
     * Called when a payload is rejected.
     * @param event the failure details
     */
    void onDecodeFailure(DecodeFailureEvent event);
}
