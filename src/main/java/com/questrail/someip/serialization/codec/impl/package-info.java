/**
 * SOME/IP Codec Implementation
 * =============================================================================
 *
 * <p>This package contains the concrete encoder and decoder and the per-type
 * codecs they dispatch to.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   DefaultSomeIpEncoder / DefaultSomeIpDecoder
 *        → SchemaCodec          (value vs. body, length field resolution)
 *            → StructCodec      (fixed layout, TLV tags, unknown-id skip)
 *            → UnionCodec       (type field, treat-as)
 *            → SequenceCodec    (element runs)
 *            → StringCodec      (BOM, terminator, charset)
 *            → PrimitiveCodec   (fixed-width values)
 *        → WireWriter / WireReader
 * </pre>
 *
 * <h2>Netty containment rule</h2>
 * <p>Netty's {@code ByteBuf} backs {@link com.questrail.someip.serialization.codec.impl.WireWriter}
 * and {@link com.questrail.someip.serialization.codec.impl.WireReader} and
 * must not appear in any signature outside this package. The public boundary
 * is {@code byte[]}.</p>
 *
 * <p>Everything here is synchronous and holds no state across calls.</p>
 */
package com.questrail.someip.serialization.codec.impl;
