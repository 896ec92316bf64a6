/**
 * SOME/IP Payload Codec
 * =============================================================================
 *
 * <p>This package defines the public boundary of the serialization layer:</p>
 *
 * <ul>
 *   <li>{@link com.questrail.someip.serialization.codec.SomeIpEncoder} and
 *       {@link com.questrail.someip.serialization.codec.SomeIpDecoder}</li>
 *   <li>the TLV tag model ({@link com.questrail.someip.serialization.codec.WireTag},
 *       {@link com.questrail.someip.serialization.codec.WireType})</li>
 *   <li>the wire error model ({@link com.questrail.someip.serialization.codec.SomeIpWireException},
 *       {@link com.questrail.someip.serialization.codec.WireErrorKind})</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   value + SchemaType + SomeIpOptions
 *        → SomeIpEncoder
 *            → byte[] payload
 *                → SOME/IP header / transport (not part of this library)
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The codec never sees message, session or service ids.</li>
 *   <li>Tags and length fields are always big endian; only primitive payload
 *       values follow {@code SomeIpOptions.byteOrder()}.</li>
 *   <li>Buffer mechanics live exclusively in {@code codec.impl}; no buffer
 *       library type appears in this package.</li>
 * </ul>
 */
package com.questrail.someip.serialization.codec;
