package io.formgen.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Immutable description of one field's shape. Implementations are a sealed hierarchy; every
 * variant is known at compile time and reports its {@link SchemaKind}.
 *
 * <p>
 * Wrapper variants ({@link Wrapper} and {@link LazySchema}) modify exactly one inner node; leaf and
 * composite variants describe the value itself. Each node carries author {@link Metadata}.
 *
 * <p>
 * Trees are built once and never mutated. Self-reference is only possible through
 * {@link LazySchema}.
 */
public sealed interface SchemaNode {

    SchemaKind kind();

    Metadata metadata();

    /** Returns a copy of this node carrying the given metadata. */
    SchemaNode withMetadata(Metadata metadata);

    default SchemaNode optional() {
        return new OptionalSchema(this, Metadata.EMPTY);
    }

    default SchemaNode nullable() {
        return new NullableSchema(this, Metadata.EMPTY);
    }

    default SchemaNode readonly() {
        return new ReadonlySchema(this, Metadata.EMPTY);
    }

    default SchemaNode nonOptional() {
        return new NonOptionalSchema(this, Metadata.EMPTY);
    }

    /** Wraps this node with a fixed default value (copied on every use). */
    default SchemaNode withDefault(JsonNode value) {
        Objects.requireNonNull(value, "default value must not be null");
        return new DefaultSchema(this, value::deepCopy, false, Metadata.EMPTY);
    }

    /** Wraps this node with a default computed on every use. */
    default SchemaNode withDefault(Supplier<JsonNode> producer) {
        return new DefaultSchema(this, producer, false, Metadata.EMPTY);
    }

    /** Wraps this node with a pre-parse default (same synthesis behaviour as a default). */
    default SchemaNode withPrefault(JsonNode value) {
        Objects.requireNonNull(value, "prefault value must not be null");
        return new DefaultSchema(this, value::deepCopy, true, Metadata.EMPTY);
    }

    // ── Wrappers ──

    /** A node that wraps exactly one inner node without changing its structural kind. */
    sealed interface Wrapper extends SchemaNode {
        SchemaNode inner();
    }

    record OptionalSchema(SchemaNode inner, Metadata metadata) implements Wrapper {
        public OptionalSchema {
            Objects.requireNonNull(inner, "inner must not be null");
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.OPTIONAL;
        }

        @Override
        public OptionalSchema withMetadata(Metadata metadata) {
            return new OptionalSchema(inner, metadata);
        }
    }

    record NullableSchema(SchemaNode inner, Metadata metadata) implements Wrapper {
        public NullableSchema {
            Objects.requireNonNull(inner, "inner must not be null");
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.NULLABLE;
        }

        @Override
        public NullableSchema withMetadata(Metadata metadata) {
            return new NullableSchema(inner, metadata);
        }
    }

    /**
     * Declares a default value. With {@code prefault} set the kind is {@link SchemaKind#PREFAULT};
     * both synthesize the same way.
     *
     * @param producer supplies a fresh default on every call; may throw
     */
    record DefaultSchema(SchemaNode inner, Supplier<JsonNode> producer, boolean prefault, Metadata metadata)
            implements Wrapper {
        public DefaultSchema {
            Objects.requireNonNull(inner, "inner must not be null");
            Objects.requireNonNull(producer, "producer must not be null");
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return prefault ? SchemaKind.PREFAULT : SchemaKind.DEFAULT;
        }

        @Override
        public DefaultSchema withMetadata(Metadata metadata) {
            return new DefaultSchema(inner, producer, prefault, metadata);
        }
    }

    record ReadonlySchema(SchemaNode inner, Metadata metadata) implements Wrapper {
        public ReadonlySchema {
            Objects.requireNonNull(inner, "inner must not be null");
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.READONLY;
        }

        @Override
        public ReadonlySchema withMetadata(Metadata metadata) {
            return new ReadonlySchema(inner, metadata);
        }
    }

    record NonOptionalSchema(SchemaNode inner, Metadata metadata) implements Wrapper {
        public NonOptionalSchema {
            Objects.requireNonNull(inner, "inner must not be null");
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.NON_OPTIONAL;
        }

        @Override
        public NonOptionalSchema withMetadata(Metadata metadata) {
            return new NonOptionalSchema(inner, metadata);
        }
    }

    /**
     * Deferred reference, resolved by invoking {@code getter} each time it is peeled. The only way to
     * build a self-referential schema.
     */
    record LazySchema(Supplier<SchemaNode> getter, String name, Metadata metadata) implements SchemaNode {
        public LazySchema {
            Objects.requireNonNull(getter, "getter must not be null");
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.LAZY;
        }

        @Override
        public LazySchema withMetadata(Metadata metadata) {
            return new LazySchema(getter, name, metadata);
        }

        // Identity semantics: cycle detection tracks individual reference sites.
        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(this);
        }

        @Override
        public String toString() {
            return "LazySchema[" + (name != null ? name : "anonymous") + "]";
        }
    }

    // ── Leaves ──

    /**
     * @param format    {@code email}, {@code url}, {@code date}, {@code date-time}, ... or {@code null}
     * @param minLength minimum length, or {@code null}
     * @param maxLength maximum length, or {@code null}
     */
    record StringSchema(String format, Integer minLength, Integer maxLength, Metadata metadata)
            implements SchemaNode {
        public StringSchema {
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.STRING;
        }

        @Override
        public StringSchema withMetadata(Metadata metadata) {
            return new StringSchema(format, minLength, maxLength, metadata);
        }
    }

    /**
     * A floating point or, with {@code integer} set, an integer-tagged number.
     *
     * @param minimum inclusive lower bound, or {@code null}
     * @param maximum inclusive upper bound, or {@code null}
     */
    record NumberSchema(boolean integer, Double minimum, Double maximum, Metadata metadata) implements SchemaNode {
        public NumberSchema {
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return integer ? SchemaKind.INTEGER : SchemaKind.NUMBER;
        }

        @Override
        public NumberSchema withMetadata(Metadata metadata) {
            return new NumberSchema(integer, minimum, maximum, metadata);
        }

        public boolean isBounded() {
            return minimum != null && maximum != null;
        }
    }

    record BooleanSchema(Metadata metadata) implements SchemaNode {
        public BooleanSchema {
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.BOOLEAN;
        }

        @Override
        public BooleanSchema withMetadata(Metadata metadata) {
            return new BooleanSchema(metadata);
        }
    }

    record BigIntegerSchema(BigInteger minimum, BigInteger maximum, Metadata metadata) implements SchemaNode {
        public BigIntegerSchema {
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.BIG_INTEGER;
        }

        @Override
        public BigIntegerSchema withMetadata(Metadata metadata) {
            return new BigIntegerSchema(minimum, maximum, metadata);
        }

        public boolean isBounded() {
            return minimum != null && maximum != null;
        }
    }

    record DateSchema(Instant minimum, Instant maximum, Metadata metadata) implements SchemaNode {
        public DateSchema {
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.DATE;
        }

        @Override
        public DateSchema withMetadata(Metadata metadata) {
            return new DateSchema(minimum, maximum, metadata);
        }

        public boolean isBounded() {
            return minimum != null && maximum != null;
        }
    }

    /** The null type: the null member of a nullable pair. */
    record NullSchema(Metadata metadata) implements SchemaNode {
        public NullSchema {
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.NULL;
        }

        @Override
        public NullSchema withMetadata(Metadata metadata) {
            return new NullSchema(metadata);
        }
    }

    /**
     * One or more interchangeable literal values; the first is canonical.
     *
     * @param values literal values, never empty
     */
    record LiteralSchema(List<JsonNode> values, Metadata metadata) implements SchemaNode {
        public LiteralSchema {
            Objects.requireNonNull(values, "values must not be null");
            if (values.isEmpty()) {
                throw new IllegalArgumentException("literal requires at least one value");
            }
            values = List.copyOf(values);
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.LITERAL;
        }

        @Override
        public LiteralSchema withMetadata(Metadata metadata) {
            return new LiteralSchema(values, metadata);
        }
    }

    /**
     * Ordered key to value map; declaration order is significant.
     *
     * @param entries enum entries, never empty
     */
    record EnumSchema(Map<String, JsonNode> entries, Metadata metadata) implements SchemaNode {
        public EnumSchema {
            Objects.requireNonNull(entries, "entries must not be null");
            if (entries.isEmpty()) {
                throw new IllegalArgumentException("enum requires at least one entry");
            }
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.ENUM;
        }

        @Override
        public EnumSchema withMetadata(Metadata metadata) {
            return new EnumSchema(entries, metadata);
        }
    }

    /**
     * A schema kind outside the modelled set, kept so the form can show a placeholder for it.
     *
     * @param typeName the author's name for the kind, e.g. {@code allOf}
     */
    record OpaqueSchema(String typeName, Metadata metadata) implements SchemaNode {
        public OpaqueSchema {
            Objects.requireNonNull(typeName, "typeName must not be null");
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.OPAQUE;
        }

        @Override
        public OpaqueSchema withMetadata(Metadata metadata) {
            return new OpaqueSchema(typeName, metadata);
        }
    }

    // ── Composites ──

    /**
     * @param minSize minimum number of elements, or {@code null}
     * @param maxSize maximum number of elements, or {@code null}
     */
    record ArraySchema(SchemaNode element, Integer minSize, Integer maxSize, Metadata metadata)
            implements SchemaNode {
        public ArraySchema {
            Objects.requireNonNull(element, "element must not be null");
            if (minSize != null && minSize < 0) {
                throw new IllegalArgumentException("minSize must not be negative, got: " + minSize);
            }
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.ARRAY;
        }

        @Override
        public ArraySchema withMetadata(Metadata metadata) {
            return new ArraySchema(element, minSize, maxSize, metadata);
        }
    }

    /**
     * @param properties    ordered field schemas
     * @param requiredNames fields that must be present
     */
    record ObjectSchema(Map<String, SchemaNode> properties, Set<String> requiredNames, Metadata metadata)
            implements SchemaNode {
        public ObjectSchema {
            Objects.requireNonNull(properties, "properties must not be null");
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
            requiredNames = requiredNames == null
                    ? Set.of()
                    : Collections.unmodifiableSet(new LinkedHashSet<>(requiredNames));
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.OBJECT;
        }

        @Override
        public ObjectSchema withMetadata(Metadata metadata) {
            return new ObjectSchema(properties, requiredNames, metadata);
        }
    }

    record TupleSchema(List<SchemaNode> items, Metadata metadata) implements SchemaNode {
        public TupleSchema {
            Objects.requireNonNull(items, "items must not be null");
            items = List.copyOf(items);
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.TUPLE;
        }

        @Override
        public TupleSchema withMetadata(Metadata metadata) {
            return new TupleSchema(items, metadata);
        }
    }

    /** Ordered alternatives; declaration order is significant for default synthesis. */
    record UnionSchema(List<SchemaNode> options, Metadata metadata) implements SchemaNode {
        public UnionSchema {
            Objects.requireNonNull(options, "options must not be null");
            options = List.copyOf(options);
            metadata = metadata == null ? Metadata.EMPTY : metadata;
        }

        @Override
        public SchemaKind kind() {
            return SchemaKind.UNION;
        }

        @Override
        public UnionSchema withMetadata(Metadata metadata) {
            return new UnionSchema(options, metadata);
        }
    }
}
