/**
 * Schema-neutral values exchanged with the codec.
 *
 * <p>Primitives, strings and sequences use plain JDK types ({@code Number},
 * {@code Boolean}, {@code String}, {@code List}). Structs and unions use the
 * two immutable holders in this package.</p>
 */
package com.questrail.someip.serialization.model;
