package com.questrail.someip.serialization.config;

/**
 * Categories of dynamically sized types that carry their own default length
 * field width in {@link SomeIpOptions}.
 */
public enum LengthFieldCategory {
    /** Sequences (dynamic and fixed-size arrays). */
    ARRAY,
    STRING,
    STRUCT,
    UNION
}
