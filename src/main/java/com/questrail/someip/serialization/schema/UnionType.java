package com.questrail.someip.serialization.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * UnionType
 * -----------------------------------------------------------------------------
 * A discriminated union, or an enumeration when a treat-as kind is set.
 *
 * <p><strong>Default encoding</strong>: an optional length field, a type field
 * holding the selected variant's discriminant, then that variant's payload.</p>
 *
 * <p><strong>Treat-as encoding</strong>: the union is written as a bare integer
 * of kind {@link #treatAs()}, whose value is the selected variant's
 * discriminant. Variants of a treat-as union carry no payload. This is how
 * SOME/IP enumerations are expressed.</p>
 */
public final class UnionType implements SchemaType
{
    private final String name;
    private final List<UnionVariant> variants;
    private final PrimitiveKind treatAs;
    private final OptionalInt lengthFieldWidth;
    private final Map<String, UnionVariant> byName;
    private final Map<Long, UnionVariant> byDiscriminant;

    public UnionType(String name, List<UnionVariant> variants, PrimitiveKind treatAs, OptionalInt lengthFieldWidth)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.variants = List.copyOf(Objects.requireNonNull(variants, "variants"));
        this.treatAs = treatAs;
        this.lengthFieldWidth = LengthFieldWidths.requireOverride(lengthFieldWidth, "Union '" + name + "' length field width");

        if (this.variants.isEmpty()) {
            throw new SchemaException("Union '" + name + "' declares no variants");
        }
        if (treatAs != null && !treatAs.isInteger()) {
            throw new SchemaException("Union '" + name + "' cannot be treated as " + treatAs + "; an integer kind is required");
        }
        if (treatAs != null && this.lengthFieldWidth.isPresent() && this.lengthFieldWidth.getAsInt() != 0) {
            throw new SchemaException("Union '" + name + "' is treated as " + treatAs + " and cannot carry a length field");
        }

        Map<String, UnionVariant> names = new HashMap<>();
        Map<Long, UnionVariant> discriminants = new HashMap<>();
        for (UnionVariant v : this.variants) {
            if (names.putIfAbsent(v.name(), v) != null) {
                throw new SchemaException("Union '" + name + "' declares variant '" + v.name() + "' twice");
            }
            if (discriminants.putIfAbsent(v.discriminant(), v) != null) {
                throw new SchemaException("Union '" + name + "' declares discriminant " + v.discriminant() + " twice");
            }
            if (v.discriminant() < 0 && treatAs == null) {
                throw new SchemaException("Union '" + name + "' variant '" + v.name() + "' has a negative discriminant");
            }
            if (treatAs != null) {
                if (v.hasPayload()) {
                    throw new SchemaException("Union '" + name + "' is treated as " + treatAs
                            + "; variant '" + v.name() + "' cannot carry a payload");
                }
                if (!treatAs.accepts(v.discriminant())) {
                    throw new SchemaException("Union '" + name + "' variant '" + v.name() + "' value "
                            + v.discriminant() + " does not fit " + treatAs);
                }
            }
        }
        this.byName = Collections.unmodifiableMap(names);
        this.byDiscriminant = Collections.unmodifiableMap(discriminants);
    }

    /** Builder for a union with type field and payloads. */
    public static Builder builder(String name) {
        return new Builder(name, null);
    }

    /** Builder for an enumeration encoded as a bare integer of {@code kind}. */
    public static Builder enumeration(String name, PrimitiveKind kind) {
        return new Builder(name, Objects.requireNonNull(kind, "kind"));
    }

    public String name() {
        return name;
    }

    public List<UnionVariant> variants() {
        return variants;
    }

    public Optional<PrimitiveKind> treatAs() {
        return Optional.ofNullable(treatAs);
    }

    public boolean isTreatAs() {
        return treatAs != null;
    }

    @Override
    public OptionalInt lengthFieldWidth() {
        return lengthFieldWidth;
    }

    public Optional<UnionVariant> variantByName(String variantName) {
        return Optional.ofNullable(byName.get(variantName));
    }

    public Optional<UnionVariant> variantByDiscriminant(long discriminant) {
        return Optional.ofNullable(byDiscriminant.get(discriminant));
    }

    /**
     * Treat-as unions are always static. Otherwise the union is static only
     * when every variant's payload is static and of the same size, which the
     * schema cannot tell; such unions are treated as dynamic.
     */
    @Override
    public boolean isStaticSize() {
        return treatAs != null;
    }

    @Override
    public String describe() {
        return treatAs != null ? "enum " + name + " as " + treatAs : "union " + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UnionType other)) {
            return false;
        }
        return name.equals(other.name)
                && variants.equals(other.variants)
                && treatAs == other.treatAs
                && lengthFieldWidth.equals(other.lengthFieldWidth);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, variants, treatAs, lengthFieldWidth);
    }

    @Override
    public String toString() {
        return "UnionType[" + describe() + ", variants=" + variants.size() + "]";
    }

    public static final class Builder
    {
        private final String name;
        private final PrimitiveKind treatAs;
        private final List<UnionVariant> variants = new ArrayList<>();
        private OptionalInt lengthFieldWidth = OptionalInt.empty();

        private Builder(String name, PrimitiveKind treatAs) {
            this.name = Objects.requireNonNull(name, "name");
            this.treatAs = treatAs;
        }

        public Builder variant(String variantName, long discriminant, SchemaType payloadType) {
            variants.add(UnionVariant.of(variantName, discriminant, payloadType));
            return this;
        }

        public Builder variant(String variantName, long discriminant) {
            variants.add(UnionVariant.empty(variantName, discriminant));
            return this;
        }

        public Builder withLengthFieldWidth(int width) {
            this.lengthFieldWidth = OptionalInt.of(width);
            return this;
        }

        public UnionType build() {
            return new UnionType(name, variants, treatAs, lengthFieldWidth);
        }
    }
}
