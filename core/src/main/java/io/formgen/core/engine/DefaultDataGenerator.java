package io.formgen.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.formgen.core.error.MalformedDefaultProducerException;
import io.formgen.core.error.UnresolvableReferenceException;
import io.formgen.core.error.UnsupportedSchemaKindException;
import io.formgen.core.model.DocumentPath;
import io.formgen.core.schema.SchemaKind;
import io.formgen.core.schema.SchemaNode;
import io.formgen.core.schema.SchemaNode.ArraySchema;
import io.formgen.core.schema.SchemaNode.DefaultSchema;
import io.formgen.core.schema.SchemaNode.EnumSchema;
import io.formgen.core.schema.SchemaNode.LazySchema;
import io.formgen.core.schema.SchemaNode.LiteralSchema;
import io.formgen.core.schema.SchemaNode.ObjectSchema;
import io.formgen.core.schema.SchemaNode.OpaqueSchema;
import io.formgen.core.schema.SchemaNode.TupleSchema;
import io.formgen.core.schema.SchemaNode.UnionSchema;
import io.formgen.core.schema.WrapperChain;
import io.formgen.core.spi.DiagnosticListener;
import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthesizes a plausible initial document from a schema. Resolution order per node:
 *
 * <ol>
 * <li>a declared default (looking through nullable and readonly layers) wins</li>
 * <li>an optional field is absent</li>
 * <li>otherwise the concrete kind decides: containers recurse, enums and literals take their first
 * value, scalars are absent</li>
 * </ol>
 *
 * <p>
 * Never throws for a schema problem: a failing default producer, an unresolvable or recursive lazy
 * reference and an opaque kind each degrade that one field to absent, are logged at WARN and are
 * reported to the {@link DiagnosticListener}.
 *
 * <p>
 * Thread-safe if the listener is. No mutable state survives a call.
 */
public final class DefaultDataGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultDataGenerator.class);

    private static final Set<SchemaKind> DEFAULT_TRANSPARENT =
            Set.copyOf(EnumSet.of(SchemaKind.NULLABLE, SchemaKind.READONLY));

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final DiagnosticListener listener;

    public DefaultDataGenerator() {
        this(DiagnosticListener.NONE);
    }

    public DefaultDataGenerator(DiagnosticListener listener) {
        this.listener = listener != null ? listener : DiagnosticListener.NONE;
    }

    /**
     * Returns the synthesized default for {@code node}; absent ({@code MissingNode}) when there is
     * none. The result is a fresh tree the caller may mutate.
     */
    public JsonNode generateDefault(SchemaNode node) {
        return generate(node, DocumentPath.root(), Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /**
     * Returns the value declared by the nearest default or prefault layer, looking only through
     * nullable and readonly layers. A producer returning {@code null} or absent declares nothing.
     *
     * @throws MalformedDefaultProducerException if the producer throws
     */
    public Optional<JsonNode> defaultValueOf(SchemaNode node) {
        return declaredDefault(node, DocumentPath.root());
    }

    private JsonNode generate(SchemaNode node, DocumentPath path, Set<LazySchema> active) {
        try {
            Optional<JsonNode> declared = declaredDefault(node, path);
            if (declared.isPresent()) {
                return declared.get();
            }
        } catch (MalformedDefaultProducerException e) {
            Diagnostics.report(LOG, listener, path, e);
            return JsonNodeUtils.absent();
        }
        if (RequirednessResolver.isOptional(node)) {
            return JsonNodeUtils.absent();
        }
        SchemaNode current = node;
        while (current.kind().isWrapper()) {
            if (current instanceof LazySchema lazy) {
                return generateLazy(lazy, path, active);
            }
            current = WrapperChain.peel(current);
        }
        return generateConcrete(current, path, active);
    }

    // The resolved node goes through the full resolution order again, so defaults and optionality
    // declared behind a reference still apply.
    private JsonNode generateLazy(LazySchema lazy, DocumentPath path, Set<LazySchema> active) {
        if (!active.add(lazy)) {
            Diagnostics.report(
                    LOG,
                    listener,
                    path,
                    new UnresolvableReferenceException(
                            "Recursive reference " + lazy + " revisited while synthesizing defaults",
                            path.toString()));
            return JsonNodeUtils.absent();
        }
        try {
            SchemaNode resolved;
            try {
                resolved = WrapperChain.resolve(lazy);
            } catch (UnresolvableReferenceException e) {
                Diagnostics.report(
                        LOG, listener, path, new UnresolvableReferenceException(e.getMessage(), e, path.toString()));
                return JsonNodeUtils.absent();
            }
            return generate(resolved, path, active);
        } finally {
            active.remove(lazy);
        }
    }

    private JsonNode generateConcrete(SchemaNode concrete, DocumentPath path, Set<LazySchema> active) {
        return switch (concrete.kind()) {
            case STRING, NUMBER, INTEGER, BOOLEAN, BIG_INTEGER, DATE -> JsonNodeUtils.absent();
            case NULL -> NullNode.getInstance();
            case LITERAL -> ((LiteralSchema) concrete).values().get(0).deepCopy();
            case ENUM -> firstEntry((EnumSchema) concrete);
            case ARRAY -> generateArray((ArraySchema) concrete, path, active);
            case OBJECT -> generateObject((ObjectSchema) concrete, path, active);
            case TUPLE -> generateTuple((TupleSchema) concrete, path, active);
            case UNION -> generateUnion((UnionSchema) concrete, path, active);
            case OPAQUE -> {
                OpaqueSchema opaque = (OpaqueSchema) concrete;
                Diagnostics.report(
                        LOG, listener, path, new UnsupportedSchemaKindException(opaque.typeName(), path.toString()));
                yield JsonNodeUtils.absent();
            }
            case OPTIONAL, NULLABLE, DEFAULT, PREFAULT, READONLY, NON_OPTIONAL, LAZY -> throw new IllegalStateException(
                    "Wrapper " + concrete.kind() + " reached concrete synthesis at " + path);
        };
    }

    private JsonNode generateArray(ArraySchema array, DocumentPath path, Set<LazySchema> active) {
        ArrayNode out = NODES.arrayNode();
        int minSize = array.minSize() == null ? 0 : array.minSize();
        for (int i = 0; i < minSize; i++) {
            out.add(generate(array.element(), path.child(i), active));
        }
        return out;
    }

    private JsonNode generateObject(ObjectSchema object, DocumentPath path, Set<LazySchema> active) {
        ObjectNode out = NODES.objectNode();
        for (Map.Entry<String, SchemaNode> field : object.properties().entrySet()) {
            JsonNode value = generate(field.getValue(), path.child(field.getKey()), active);
            if (!JsonNodeUtils.isAbsent(value)) {
                out.set(field.getKey(), value);
            }
        }
        return out;
    }

    private JsonNode generateTuple(TupleSchema tuple, DocumentPath path, Set<LazySchema> active) {
        ArrayNode out = NODES.arrayNode();
        for (int i = 0; i < tuple.items().size(); i++) {
            out.add(generate(tuple.items().get(i), path.child(i), active));
        }
        return out;
    }

    private JsonNode generateUnion(UnionSchema union, DocumentPath path, Set<LazySchema> active) {
        if (union.options().isEmpty()) {
            return JsonNodeUtils.absent();
        }
        return generate(union.options().get(0), path, active);
    }

    private static JsonNode firstEntry(EnumSchema enumSchema) {
        return enumSchema.entries().values().iterator().next().deepCopy();
    }

    private static Optional<JsonNode> declaredDefault(SchemaNode node, DocumentPath path) {
        SchemaNode hit = WrapperChain.walk(node, DEFAULT_TRANSPARENT);
        if (!(hit instanceof DefaultSchema declared)) {
            return Optional.empty();
        }
        JsonNode value;
        try {
            value = declared.producer().get();
        } catch (RuntimeException e) {
            throw new MalformedDefaultProducerException(
                    "Default producer failed: " + e.getMessage(), e, path.toString());
        }
        return JsonNodeUtils.isAbsent(value) ? Optional.empty() : Optional.of(value);
    }
}
