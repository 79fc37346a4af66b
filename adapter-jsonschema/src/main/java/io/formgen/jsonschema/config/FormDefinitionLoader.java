package io.formgen.jsonschema.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.SpecVersion;
import io.formgen.core.model.FormMode;
import io.formgen.core.model.ValidationTrigger;
import io.formgen.core.schema.SchemaNode;
import io.formgen.jsonschema.JsonSchemaDocumentValidator;
import io.formgen.jsonschema.JsonSchemaReader;
import io.formgen.jsonschema.SchemaLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link FormDefinition} from a YAML file with an optional environment variable overlay.
 *
 * <pre>{@code
 * schema: person.schema.json      # path relative to this file, or an inline schema object
 * initial-data: person.json       # optional
 * mode: edit                      # edit | readonly
 * validation:
 *   trigger: submit               # submit | change
 *   spec-version: draft-07        # draft-04 | draft-06 | draft-07 | 2019-09 | 2020-12
 * }</pre>
 *
 * <p>
 * Environment overlay: {@code FORMGEN_MODE}, {@code FORMGEN_VALIDATION_TRIGGER} and
 * {@code FORMGEN_VALIDATION_SPEC_VERSION} take precedence over the YAML values. A variable counts as
 * set only if it is defined and non-blank after trimming.
 */
public final class FormDefinitionLoader {

    private static final Logger LOG = LoggerFactory.getLogger(FormDefinitionLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_MODE = "FORMGEN_MODE";
    static final String ENV_TRIGGER = "FORMGEN_VALIDATION_TRIGGER";
    static final String ENV_SPEC_VERSION = "FORMGEN_VALIDATION_SPEC_VERSION";

    private FormDefinitionLoader() {
        // utility class
    }

    /**
     * Loads a form definition, applying overrides from {@link System#getenv}.
     *
     * @throws FormDefinitionException if the file is missing, unparseable or incomplete
     */
    public static FormDefinition load(Path definitionPath) {
        return load(definitionPath, System::getenv);
    }

    /**
     * Loads a form definition, applying overrides from the supplied lookup. Returning {@code null}
     * from {@code envLookup} means the variable is not defined.
     *
     * @throws FormDefinitionException if the file is missing, unparseable or incomplete
     */
    public static FormDefinition load(Path definitionPath, Function<String, String> envLookup) {
        if (!Files.exists(definitionPath)) {
            throw new FormDefinitionException("Form definition not found: " + definitionPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(definitionPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new FormDefinitionException("Failed to parse YAML form definition: " + definitionPath, e);
        }
        if (root == null || !root.isObject()) {
            throw new FormDefinitionException("Form definition must be a YAML mapping: " + definitionPath);
        }
        try {
            FormDefinition definition = toDefinition(root, baseDir(definitionPath), envLookup);
            LOG.info(
                    "Loaded form definition {} (mode={}, trigger={}, spec-version={})",
                    definitionPath,
                    definition.mode(),
                    definition.trigger(),
                    definition.specVersion());
            return definition;
        } catch (SchemaLoadException e) {
            throw new FormDefinitionException(
                    "Failed to load schema for form definition " + definitionPath + ": " + e.getMessage(), e);
        }
    }

    private static FormDefinition toDefinition(JsonNode root, Path baseDir, Function<String, String> envLookup) {
        JsonNode schemaEntry = root.path("schema");
        JsonNode schemaDocument;
        if (schemaEntry.isTextual()) {
            schemaDocument = JsonSchemaReader.readTree(baseDir.resolve(schemaEntry.asText()));
        } else if (schemaEntry.isObject()) {
            schemaDocument = schemaEntry;
        } else {
            throw new FormDefinitionException("Form definition is missing required key 'schema'");
        }
        SchemaNode schema = JsonSchemaReader.read(schemaDocument);

        JsonNode initialData = null;
        JsonNode initialEntry = root.path("initial-data");
        if (initialEntry.isTextual()) {
            initialData = JsonSchemaReader.readTree(baseDir.resolve(initialEntry.asText()));
        } else if (!initialEntry.isMissingNode() && !initialEntry.isNull()) {
            initialData = initialEntry;
        }

        JsonNode validation = root.path("validation");
        String mode = envOrDefault(envLookup, ENV_MODE, textOrNull(root, "mode"));
        String trigger = envOrDefault(envLookup, ENV_TRIGGER, textOrNull(validation, "trigger"));
        String specVersion = envOrDefault(envLookup, ENV_SPEC_VERSION, textOrNull(validation, "spec-version"));

        return new FormDefinition(
                schemaDocument,
                schema,
                initialData,
                parseMode(mode),
                parseTrigger(trigger),
                parseSpecVersion(specVersion));
    }

    static FormMode parseMode(String value) {
        if (value == null) {
            return FormMode.EDIT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "edit" -> FormMode.EDIT;
            case "readonly", "read-only" -> FormMode.READONLY;
            default -> throw new FormDefinitionException(
                    "Invalid mode '" + value + "'. Expected one of: edit, readonly");
        };
    }

    static ValidationTrigger parseTrigger(String value) {
        if (value == null) {
            return ValidationTrigger.ON_SUBMIT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "submit", "on-submit" -> ValidationTrigger.ON_SUBMIT;
            case "change", "on-change" -> ValidationTrigger.ON_CHANGE;
            default -> throw new FormDefinitionException(
                    "Invalid validation.trigger '" + value + "'. Expected one of: submit, change");
        };
    }

    static SpecVersion.VersionFlag parseSpecVersion(String value) {
        if (value == null) {
            return null;
        }
        try {
            return JsonSchemaDocumentValidator.parseSpecVersion(value);
        } catch (IllegalArgumentException e) {
            throw new FormDefinitionException("Invalid validation.spec-version: " + e.getMessage(), e);
        }
    }

    private static Path baseDir(Path definitionPath) {
        Path parent = definitionPath.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".");
    }

    /** Returns {@code true} if the env var is defined and non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static String envOrDefault(Function<String, String> envLookup, String envVar, String yamlValue) {
        return isSet(envLookup, envVar) ? envLookup.apply(envVar).trim() : yamlValue;
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.has(field) && !node.get(field).isNull() ? node.get(field).asText() : null;
    }
}
