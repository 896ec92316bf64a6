package com.questrail.someip.serialization.schema;

/**
 * Indicates that a schema description or an options bundle is structurally
 * invalid.
 *
 * <p>This is a construction-time, fatal condition. It reflects a defect in the
 * code that assembled the schema (or the configuration that produced the
 * options), never a defect in received bytes. Typical causes:</p>
 * <ul>
 *   <li>A data id outside {@code 0..4095}, or a duplicate id within a struct</li>
 *   <li>An optional field declared in a non-TLV struct</li>
 *   <li>A length field width outside {@code {0, 1, 2, 4}}</li>
 *   <li>A width of 0 resolved for a type whose size is not statically known</li>
 * </ul>
 *
 * <p>Wire-level failures are reported through
 * {@link com.questrail.someip.serialization.codec.SomeIpWireException} instead.</p>
 */
public final class SchemaException extends RuntimeException
{
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
