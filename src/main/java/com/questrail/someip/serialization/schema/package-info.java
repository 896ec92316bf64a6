/**
 * Schema description of SOME/IP data types.
 *
 * <p>A schema is an immutable tree of {@link com.questrail.someip.serialization.schema.SchemaType}
 * nodes built once, typically at startup, and then shared by every encode and
 * decode call. Invalid schemas are rejected at construction with
 * {@link com.questrail.someip.serialization.schema.SchemaException}; the codec
 * never has to re-validate structure on the hot path.</p>
 *
 * <p>This package has no dependency on the codec or on any buffer library.</p>
 */
package com.questrail.someip.serialization.schema;
