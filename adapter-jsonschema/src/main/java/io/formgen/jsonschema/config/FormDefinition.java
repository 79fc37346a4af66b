package io.formgen.jsonschema.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.SpecVersion;
import io.formgen.core.engine.FormConfig;
import io.formgen.core.model.FormMode;
import io.formgen.core.model.ValidationTrigger;
import io.formgen.core.schema.SchemaNode;
import io.formgen.core.spi.DiagnosticListener;
import io.formgen.jsonschema.JsonSchemaDocumentValidator;
import java.util.Objects;

/**
 * A loaded form definition: the raw and compiled schema plus the form's settings.
 *
 * @param schemaDocument the JSON Schema document as read
 * @param schema         the compiled schema tree
 * @param initialData    starting document, or {@code null} to synthesize defaults
 * @param mode           edit or read-only
 * @param trigger        when validation runs
 * @param specVersion    the JSON Schema draft used for validation
 */
public record FormDefinition(
        JsonNode schemaDocument,
        SchemaNode schema,
        JsonNode initialData,
        FormMode mode,
        ValidationTrigger trigger,
        SpecVersion.VersionFlag specVersion) {

    public FormDefinition {
        Objects.requireNonNull(schemaDocument, "schemaDocument must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        mode = mode == null ? FormMode.EDIT : mode;
        trigger = trigger == null ? ValidationTrigger.ON_SUBMIT : trigger;
        specVersion = specVersion == null ? JsonSchemaDocumentValidator.DEFAULT_SPEC_VERSION : specVersion;
    }

    /** Builds a {@link FormConfig} validating with networknt under {@link #specVersion()}. */
    public FormConfig toConfig() {
        return toConfig(DiagnosticListener.NONE);
    }

    public FormConfig toConfig(DiagnosticListener diagnostics) {
        return FormConfig.builder(schema)
                .initialData(initialData)
                .validator(new JsonSchemaDocumentValidator(schemaDocument, specVersion))
                .mode(mode)
                .trigger(trigger)
                .diagnostics(diagnostics)
                .build();
    }
}
