package io.formgen.jsonschema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.networknt.schema.JsonNodePath;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.formgen.core.model.DocumentPath;
import io.formgen.core.model.ValidationIssue;
import io.formgen.core.spi.DocumentValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DocumentValidator} backed by the networknt {@code json-schema-validator}. Each
 * {@link ValidationMessage} becomes one {@link ValidationIssue}: the path comes from the message's
 * instance location, the code from its keyword, and for {@code required} the missing property name
 * from the message's property.
 *
 * <p>
 * The schema is compiled once at construction. Thread-safe.
 */
public final class JsonSchemaDocumentValidator implements DocumentValidator {

    private static final Logger LOG = LoggerFactory.getLogger(JsonSchemaDocumentValidator.class);

    /** Draft used when the caller does not pick one. */
    public static final SpecVersion.VersionFlag DEFAULT_SPEC_VERSION = SpecVersion.VersionFlag.V7;

    private final JsonSchema schema;
    private final SpecVersion.VersionFlag specVersion;

    public JsonSchemaDocumentValidator(JsonNode schemaDocument) {
        this(schemaDocument, DEFAULT_SPEC_VERSION);
    }

    /**
     * @param schemaDocument the raw JSON Schema document
     * @param specVersion    the draft to validate under
     * @throws SchemaLoadException if networknt rejects the schema document
     */
    public JsonSchemaDocumentValidator(JsonNode schemaDocument, SpecVersion.VersionFlag specVersion) {
        Objects.requireNonNull(schemaDocument, "schemaDocument must not be null");
        this.specVersion = Objects.requireNonNull(specVersion, "specVersion must not be null");
        try {
            this.schema = JsonSchemaFactory.getInstance(specVersion).getSchema(schemaDocument);
        } catch (RuntimeException e) {
            throw new SchemaLoadException("Failed to compile JSON Schema for validation: " + e.getMessage(), e);
        }
    }

    /**
     * Maps a draft name as written in configuration ({@code draft-07}, {@code 2019-09},
     * {@code 2020-12}, ...) to a networknt version flag.
     *
     * @throws IllegalArgumentException for an unknown draft
     */
    public static SpecVersion.VersionFlag parseSpecVersion(String text) {
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "draft-04", "draft4", "4" -> SpecVersion.VersionFlag.V4;
            case "draft-06", "draft6", "6" -> SpecVersion.VersionFlag.V6;
            case "draft-07", "draft7", "7" -> SpecVersion.VersionFlag.V7;
            case "2019-09", "draft-2019-09" -> SpecVersion.VersionFlag.V201909;
            case "2020-12", "draft-2020-12" -> SpecVersion.VersionFlag.V202012;
            default -> throw new IllegalArgumentException("Unknown JSON Schema version: '" + text
                    + "'. Expected one of draft-04, draft-06, draft-07, 2019-09, 2020-12");
        };
    }

    public SpecVersion.VersionFlag specVersion() {
        return specVersion;
    }

    @Override
    public List<ValidationIssue> validate(JsonNode document) {
        JsonNode instance = document == null || document.isMissingNode() ? NullNode.getInstance() : document;
        Set<ValidationMessage> messages = schema.validate(instance);
        List<ValidationIssue> issues = new ArrayList<>(messages.size());
        for (ValidationMessage message : messages) {
            issues.add(toIssue(message));
        }
        LOG.debug("Validated document under {}: {} issue(s)", specVersion, issues.size());
        return issues;
    }

    static ValidationIssue toIssue(ValidationMessage message) {
        DocumentPath path = toPath(message.getInstanceLocation());
        String code = message.getType();
        if (ValidationIssue.REQUIRED.equals(code) && message.getProperty() != null) {
            return ValidationIssue.missingRequired(path, message.getProperty(), message.getMessage());
        }
        return ValidationIssue.of(path, message.getMessage(), code);
    }

    static DocumentPath toPath(JsonNodePath location) {
        if (location == null) {
            return DocumentPath.root();
        }
        List<Object> keys = new ArrayList<>(location.getNameCount());
        for (int i = 0; i < location.getNameCount(); i++) {
            Object element = location.getElement(i);
            keys.add(element instanceof Integer ? element : String.valueOf(element));
        }
        return DocumentPath.of(keys);
    }
}
