package com.questrail.someip.serialization.schema;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A homogeneous run of elements.
 *
 * <p>On the wire a sequence is preceded by a length field holding the
 * <em>encoded byte length</em> of its elements, not their count. A sequence
 * with a fixed element count and a statically sized element type may be
 * declared without a length field.</p>
 *
 * @param element          element type
 * @param minElements      minimum element count
 * @param maxElements      maximum element count
 * @param lengthFieldWidth type-level length field width override
 */
public record SequenceType(SchemaType element,
                           int minElements,
                           int maxElements,
                           OptionalInt lengthFieldWidth) implements SchemaType
{
    public SequenceType {
        Objects.requireNonNull(element, "element");
        if (minElements < 0) {
            throw new SchemaException("Sequence minElements must be non-negative (was " + minElements + ")");
        }
        if (maxElements < minElements) {
            throw new SchemaException("Sequence maxElements must be >= minElements (was maxElements="
                    + maxElements + ", minElements=" + minElements + ")");
        }
        lengthFieldWidth = LengthFieldWidths.requireOverride(lengthFieldWidth, "Sequence length field width");
        if (lengthFieldWidth.isPresent() && lengthFieldWidth.getAsInt() == 0
                && !(minElements == maxElements && element.isStaticSize())) {
            throw new SchemaException("Only statically sized sequences may omit the length field");
        }
    }

    /** A dynamic sequence of up to {@code maxElements} elements. */
    public static SequenceType of(SchemaType element, int maxElements) {
        return new SequenceType(element, 0, maxElements, OptionalInt.empty());
    }

    public static SequenceType bounded(SchemaType element, int minElements, int maxElements) {
        return new SequenceType(element, minElements, maxElements, OptionalInt.empty());
    }

    /** A statically sized sequence of exactly {@code count} elements, without length field. */
    public static SequenceType fixed(SchemaType element, int count) {
        return new SequenceType(element, count, count, OptionalInt.of(0));
    }

    public SequenceType withLengthFieldWidth(int width) {
        return new SequenceType(element, minElements, maxElements, OptionalInt.of(width));
    }

    @Override
    public boolean isStaticSize() {
        return minElements == maxElements && element.isStaticSize();
    }

    @Override
    public String describe() {
        return "sequence<" + element.describe() + ">[" + minElements + ".." + maxElements + "]";
    }
}
