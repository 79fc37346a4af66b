package io.formgen.jsonschema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.formgen.core.error.UnresolvableReferenceException;
import io.formgen.core.schema.Metadata;
import io.formgen.core.schema.PresentationHint;
import io.formgen.core.schema.SchemaNode;
import io.formgen.core.schema.SchemaNode.ArraySchema;
import io.formgen.core.schema.SchemaNode.BooleanSchema;
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
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a JSON Schema document (draft-07 or 2020-12 vocabulary) into a {@link SchemaNode} tree.
 *
 * <p>
 * Mapping:
 * <ul>
 * <li>{@code type} string, number, integer, boolean, null, array, object → the matching kind; a
 * type array → union of the per-type schemas</li>
 * <li>{@code enum} → enum keyed by each value's text; {@code const} → literal</li>
 * <li>{@code oneOf} / {@code anyOf} → union</li>
 * <li>{@code items} object → array, {@code items} array or {@code prefixItems} → tuple</li>
 * <li>properties not listed in {@code required} → wrapped optional</li>
 * <li>{@code readOnly: true} → readonly wrapper, {@code default} → default wrapper</li>
 * <li>{@code $ref} to a location inside the same document → lazy reference, compiled once per
 * target</li>
 * <li>{@code title}, {@code description} and {@code uiSchema {component, props}} → metadata</li>
 * <li>anything else ({@code allOf}, {@code not}, unknown types) → opaque</li>
 * </ul>
 *
 * <p>
 * Thread-safe and stateless; every {@code read} compiles into its own reference cache.
 */
public final class JsonSchemaReader {

    private static final Logger LOG = LoggerFactory.getLogger(JsonSchemaReader.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> PROPS_TYPE = new TypeReference<>() {};

    private JsonSchemaReader() {}

    /**
     * Compiles an already-parsed schema document.
     *
     * @throws SchemaLoadException if {@code schema} is not a JSON object or boolean
     */
    public static SchemaNode read(JsonNode schema) {
        if (schema == null || schema.isMissingNode()) {
            throw new SchemaLoadException("Schema document must not be empty");
        }
        return new Compilation(schema).compileField(schema, "#", true);
    }

    /**
     * Loads and compiles a schema file; {@code .yaml} and {@code .yml} are parsed as YAML, anything
     * else as JSON.
     *
     * @throws SchemaLoadException if the file is missing or unparseable
     */
    public static SchemaNode read(Path file) {
        return read(readTree(file));
    }

    /**
     * Parses a JSON or YAML file into a tree without compiling it.
     *
     * @throws SchemaLoadException if the file is missing or unparseable
     */
    public static JsonNode readTree(Path file) {
        if (!Files.exists(file)) {
            throw new SchemaLoadException("Schema file not found: " + file);
        }
        ObjectMapper mapper = isYaml(file) ? YAML_MAPPER : JSON_MAPPER;
        try (InputStream in = Files.newInputStream(file)) {
            JsonNode tree = mapper.readTree(in);
            if (tree == null || tree.isMissingNode()) {
                throw new SchemaLoadException("Schema file is empty: " + file);
            }
            LOG.debug("Read schema document {}", file);
            return tree;
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to parse schema file: " + file, e);
        }
    }

    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    /** One compilation: the document root plus the references compiled so far. */
    private static final class Compilation {
        private final JsonNode root;
        private final Map<String, SchemaNode> targets = new HashMap<>();
        private final Map<String, LazySchema> references = new HashMap<>();

        Compilation(JsonNode root) {
            this.root = root;
        }

        SchemaNode compile(JsonNode node, String pointer) {
            if (node.isBoolean()) {
                return new OpaqueSchema(node.asBoolean() ? "true" : "false", Metadata.EMPTY);
            }
            if (!node.isObject()) {
                throw new SchemaLoadException(
                        "Schema at " + pointer + " must be an object or boolean, got " + node.getNodeType());
            }
            return decorate(compileBase(node, pointer), node);
        }

        // Metadata on the concrete node, then readonly, then default outermost.
        private SchemaNode decorate(SchemaNode base, JsonNode node) {
            SchemaNode out = base;
            Metadata metadata = metadataOf(node);
            if (metadata != Metadata.EMPTY) {
                out = out.withMetadata(metadata);
            }
            if (node.path("readOnly").asBoolean(false)) {
                out = out.readonly();
            }
            return out;
        }

        private SchemaNode withDefault(SchemaNode compiled, JsonNode node) {
            return node.has("default") ? compiled.withDefault(node.get("default")) : compiled;
        }

        private SchemaNode compileBase(JsonNode node, String pointer) {
            if (node.has("$ref")) {
                return reference(node.get("$ref").asText());
            }
            if (node.has("enum")) {
                return enumOf(node.get("enum"), pointer);
            }
            if (node.has("const")) {
                return new LiteralSchema(List.of(node.get("const").deepCopy()), Metadata.EMPTY);
            }
            if (node.has("oneOf")) {
                return union(node.get("oneOf"), pointer + "/oneOf");
            }
            if (node.has("anyOf")) {
                return union(node.get("anyOf"), pointer + "/anyOf");
            }
            if (node.has("allOf") || node.has("not")) {
                LOG.debug("Composition keyword at {} is not modelled; compiling as opaque", pointer);
                return new OpaqueSchema(node.has("allOf") ? "allOf" : "not", Metadata.EMPTY);
            }
            JsonNode type = node.path("type");
            if (type.isTextual()) {
                return typed(node, type.asText(), pointer);
            }
            if (type.isArray()) {
                List<SchemaNode> options = new ArrayList<>();
                for (JsonNode t : type) {
                    options.add(typed(node, t.asText(), pointer));
                }
                return new UnionSchema(options, Metadata.EMPTY);
            }
            if (node.has("properties")) {
                return typed(node, "object", pointer);
            }
            if (node.has("items") || node.has("prefixItems")) {
                return typed(node, "array", pointer);
            }
            return new OpaqueSchema("any", Metadata.EMPTY);
        }

        private SchemaNode typed(JsonNode node, String type, String pointer) {
            return switch (type) {
                case "string" -> new StringSchema(
                        text(node, "format"), integer(node, "minLength"), integer(node, "maxLength"), Metadata.EMPTY);
                case "number", "integer" -> new NumberSchema(
                        "integer".equals(type), number(node, "minimum"), number(node, "maximum"), Metadata.EMPTY);
                case "boolean" -> new BooleanSchema(Metadata.EMPTY);
                case "null" -> new NullSchema(Metadata.EMPTY);
                case "array" -> array(node, pointer);
                case "object" -> object(node, pointer);
                default -> new OpaqueSchema(type, Metadata.EMPTY);
            };
        }

        private SchemaNode array(JsonNode node, String pointer) {
            JsonNode prefix = node.has("prefixItems") ? node.get("prefixItems") : node.path("items");
            if (prefix.isArray()) {
                String base = node.has("prefixItems") ? pointer + "/prefixItems" : pointer + "/items";
                List<SchemaNode> items = new ArrayList<>();
                for (int i = 0; i < prefix.size(); i++) {
                    items.add(compileField(prefix.get(i), base + "/" + i, true));
                }
                return new TupleSchema(items, Metadata.EMPTY);
            }
            SchemaNode element = node.has("items")
                    ? compileField(node.get("items"), pointer + "/items", true)
                    : new OpaqueSchema("any", Metadata.EMPTY);
            return new ArraySchema(element, integer(node, "minItems"), integer(node, "maxItems"), Metadata.EMPTY);
        }

        private SchemaNode object(JsonNode node, String pointer) {
            Set<String> declaredRequired = new LinkedHashSet<>();
            node.path("required").forEach(name -> declaredRequired.add(name.asText()));
            Map<String, SchemaNode> properties = new LinkedHashMap<>();
            Set<String> required = new LinkedHashSet<>();
            node.path("properties").fields().forEachRemaining(entry -> {
                String name = entry.getKey();
                boolean isRequired = declaredRequired.contains(name);
                properties.put(
                        name, compileField(entry.getValue(), pointer + "/properties/" + escape(name), isRequired));
                if (isRequired) {
                    required.add(name);
                }
            });
            return new ObjectSchema(properties, required, Metadata.EMPTY);
        }

        // A default declared on a non-required property still seeds the document, so it sits
        // outside the optional wrapper.
        private SchemaNode compileField(JsonNode node, String pointer, boolean required) {
            SchemaNode compiled = compile(node, pointer);
            if (!required) {
                compiled = compiled.optional();
            }
            return node.isObject() ? withDefault(compiled, node) : compiled;
        }

        private SchemaNode enumOf(JsonNode values, String pointer) {
            if (!values.isArray() || values.isEmpty()) {
                LOG.debug("Empty or malformed enum at {}; compiling as opaque", pointer);
                return new OpaqueSchema("enum", Metadata.EMPTY);
            }
            Map<String, JsonNode> entries = new LinkedHashMap<>();
            for (JsonNode value : values) {
                entries.putIfAbsent(value.isNull() ? "null" : value.asText(), value.deepCopy());
            }
            return new EnumSchema(entries, Metadata.EMPTY);
        }

        private SchemaNode union(JsonNode options, String pointer) {
            List<SchemaNode> compiled = new ArrayList<>();
            for (int i = 0; i < options.size(); i++) {
                compiled.add(compileField(options.get(i), pointer + "/" + i, true));
            }
            return new UnionSchema(compiled, Metadata.EMPTY);
        }

        private LazySchema reference(String ref) {
            LazySchema existing = references.get(ref);
            if (existing != null) {
                return existing;
            }
            LazySchema lazy = new LazySchema(() -> target(ref), ref, Metadata.EMPTY);
            references.put(ref, lazy);
            return lazy;
        }

        private SchemaNode target(String ref) {
            SchemaNode cached = targets.get(ref);
            if (cached != null) {
                return cached;
            }
            if (!ref.startsWith("#")) {
                throw new UnresolvableReferenceException("External $ref '" + ref + "' is not supported", null);
            }
            JsonNode target = root.at(ref.substring(1));
            if (target.isMissingNode()) {
                throw new UnresolvableReferenceException("$ref '" + ref + "' points to nothing in the document", null);
            }
            SchemaNode compiled = withDefault(compile(target, ref), target);
            targets.put(ref, compiled);
            LOG.debug("Compiled $ref target {}", ref);
            return compiled;
        }

        private static Metadata metadataOf(JsonNode node) {
            String title = text(node, "title");
            String description = text(node, "description");
            PresentationHint hint = null;
            JsonNode ui = node.path("uiSchema");
            if (ui.path("component").isTextual() && !ui.path("component").asText().isBlank()) {
                Map<String, Object> props = ui.path("props").isObject()
                        ? JSON_MAPPER.convertValue(ui.get("props"), PROPS_TYPE)
                        : Map.of();
                hint = new PresentationHint(ui.get("component").asText(), props);
            }
            if (title == null && description == null && hint == null) {
                return Metadata.EMPTY;
            }
            return new Metadata(title, description, hint);
        }

        private static String escape(String name) {
            return name.replace("~", "~0").replace("/", "~1");
        }

        private static String text(JsonNode node, String field) {
            return node.path(field).isTextual() ? node.get(field).asText() : null;
        }

        private static Integer integer(JsonNode node, String field) {
            return node.path(field).isNumber() ? node.get(field).asInt() : null;
        }

        private static Double number(JsonNode node, String field) {
            return node.path(field).isNumber() ? node.get(field).asDouble() : null;
        }
    }
}
