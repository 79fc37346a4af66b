package io.formgen.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.formgen.core.schema.SchemaNode.ArraySchema;
import io.formgen.core.schema.SchemaNode.BigIntegerSchema;
import io.formgen.core.schema.SchemaNode.BooleanSchema;
import io.formgen.core.schema.SchemaNode.DateSchema;
import io.formgen.core.schema.SchemaNode.EnumSchema;
import io.formgen.core.schema.SchemaNode.LazySchema;
import io.formgen.core.schema.SchemaNode.LiteralSchema;
import io.formgen.core.schema.SchemaNode.NullSchema;
import io.formgen.core.schema.SchemaNode.NumberSchema;
import io.formgen.core.schema.SchemaNode.ObjectSchema;
import io.formgen.core.schema.SchemaNode.OpaqueSchema;
import io.formgen.core.schema.SchemaNode.StringSchema;
import io.formgen.core.schema.SchemaNode.TupleSchema;
import io.formgen.core.schema.SchemaNode.UnionSchema;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Authoring shortcuts for building schema trees in Java.
 *
 * <pre>{@code
 * SchemaNode person = Schemas.object()
 *         .field("name", Schemas.string())
 *         .field("nickname", Schemas.string().optional())
 *         .field("role", Schemas.enumOf("admin", "user"))
 *         .build();
 * }</pre>
 */
public final class Schemas {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Schemas() {}

    /** Converts a plain Java value (String, Number, Boolean, Map, List, ...) to a JSON tree. */
    public static JsonNode value(Object value) {
        return value == null ? NullNode.getInstance() : MAPPER.valueToTree(value);
    }

    public static StringSchema string() {
        return new StringSchema(null, null, null, Metadata.EMPTY);
    }

    public static StringSchema string(String format) {
        return new StringSchema(format, null, null, Metadata.EMPTY);
    }

    public static StringSchema string(String format, Integer minLength, Integer maxLength) {
        return new StringSchema(format, minLength, maxLength, Metadata.EMPTY);
    }

    public static NumberSchema number() {
        return new NumberSchema(false, null, null, Metadata.EMPTY);
    }

    public static NumberSchema number(Double minimum, Double maximum) {
        return new NumberSchema(false, minimum, maximum, Metadata.EMPTY);
    }

    public static NumberSchema integer() {
        return new NumberSchema(true, null, null, Metadata.EMPTY);
    }

    public static NumberSchema integer(Double minimum, Double maximum) {
        return new NumberSchema(true, minimum, maximum, Metadata.EMPTY);
    }

    public static BooleanSchema bool() {
        return new BooleanSchema(Metadata.EMPTY);
    }

    public static BigIntegerSchema bigInteger() {
        return new BigIntegerSchema(null, null, Metadata.EMPTY);
    }

    public static BigIntegerSchema bigInteger(BigInteger minimum, BigInteger maximum) {
        return new BigIntegerSchema(minimum, maximum, Metadata.EMPTY);
    }

    public static DateSchema date() {
        return new DateSchema(null, null, Metadata.EMPTY);
    }

    public static DateSchema date(Instant minimum, Instant maximum) {
        return new DateSchema(minimum, maximum, Metadata.EMPTY);
    }

    public static NullSchema nullType() {
        return new NullSchema(Metadata.EMPTY);
    }

    public static LiteralSchema literal(Object... values) {
        List<JsonNode> nodes = new ArrayList<>(values.length);
        for (Object v : values) {
            nodes.add(value(v));
        }
        return new LiteralSchema(nodes, Metadata.EMPTY);
    }

    /** String enum whose keys are its values, in the given order. */
    public static EnumSchema enumOf(String... values) {
        Map<String, JsonNode> entries = new LinkedHashMap<>();
        for (String v : values) {
            entries.put(v, value(v));
        }
        return new EnumSchema(entries, Metadata.EMPTY);
    }

    /** Enum with explicit key to value bindings; iteration order of {@code entries} is kept. */
    public static EnumSchema enumOf(Map<String, ?> entries) {
        Map<String, JsonNode> converted = new LinkedHashMap<>();
        entries.forEach((k, v) -> converted.put(k, value(v)));
        return new EnumSchema(converted, Metadata.EMPTY);
    }

    public static ArraySchema array(SchemaNode element) {
        return new ArraySchema(element, null, null, Metadata.EMPTY);
    }

    public static ArraySchema array(SchemaNode element, int minSize) {
        return new ArraySchema(element, minSize, null, Metadata.EMPTY);
    }

    public static TupleSchema tuple(SchemaNode... items) {
        return new TupleSchema(List.of(items), Metadata.EMPTY);
    }

    public static UnionSchema union(SchemaNode... options) {
        return new UnionSchema(List.of(options), Metadata.EMPTY);
    }

    public static LazySchema lazy(Supplier<SchemaNode> getter) {
        return new LazySchema(getter, null, Metadata.EMPTY);
    }

    public static LazySchema lazy(String name, Supplier<SchemaNode> getter) {
        return new LazySchema(getter, name, Metadata.EMPTY);
    }

    public static OpaqueSchema opaque(String typeName) {
        return new OpaqueSchema(typeName, Metadata.EMPTY);
    }

    public static ObjectBuilder object() {
        return new ObjectBuilder();
    }

    /**
     * Builds an {@link ObjectSchema} whose required names are derived from each field's own wrapper
     * chain: a field is required unless it is declared optional.
     */
    public static final class ObjectBuilder {
        private final Map<String, SchemaNode> properties = new LinkedHashMap<>();

        ObjectBuilder() {}

        public ObjectBuilder field(String name, SchemaNode schema) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(schema, "schema must not be null");
            properties.put(name, schema);
            return this;
        }

        public ObjectSchema build() {
            return build(Metadata.EMPTY);
        }

        public ObjectSchema build(Metadata metadata) {
            Set<String> required = new LinkedHashSet<>();
            properties.forEach((name, schema) -> {
                if (!WrapperChain.declaresOptional(schema)) {
                    required.add(name);
                }
            });
            return new ObjectSchema(properties, required, metadata);
        }
    }
}
