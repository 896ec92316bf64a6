package com.questrail.someip.serialization.config;

/**
 * How the encoder picks a length field width for members of a TLV struct.
 */
public enum LengthFieldSelection {
    /** Always use the resolved width; a length that does not fit fails. */
    CONFIGURED,
    /**
     * Use the smallest width that holds the length. The tag's wire type
     * announces the width, so the receiver needs no configuration.
     */
    SMALLEST
}
