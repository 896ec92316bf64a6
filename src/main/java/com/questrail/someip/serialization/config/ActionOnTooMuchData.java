package com.questrail.someip.serialization.config;

/**
 * What the decoder does with a string or sequence holding more data than its
 * schema's maximum allows.
 */
public enum ActionOnTooMuchData {
    /** Reject the payload with a size-bound error. */
    FAIL,
    /**
     * Keep the value up to the maximum and skip the rest of its region. A
     * string cut inside a character, or before its terminator, still fails
     * string validation.
     */
    DISCARD,
    /** Keep all of it, so values may exceed the declared maximum. */
    KEEP
}
