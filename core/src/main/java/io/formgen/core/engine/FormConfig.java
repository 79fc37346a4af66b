package io.formgen.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.formgen.core.model.FormMode;
import io.formgen.core.model.ValidationTrigger;
import io.formgen.core.schema.SchemaNode;
import io.formgen.core.spi.DiagnosticListener;
import io.formgen.core.spi.DocumentValidator;
import java.util.Objects;

/**
 * Everything a {@link FormController} needs. Immutable.
 *
 * @param schema      the form's schema (required)
 * @param initialData starting document; {@code null} or absent means "synthesize defaults"
 * @param validator   external validator; {@code null} treats every document as valid
 * @param mode        edit or read-only (default {@link FormMode#EDIT})
 * @param trigger     when validation runs (default {@link ValidationTrigger#ON_SUBMIT})
 * @param diagnostics receives non-fatal schema conditions (default {@link DiagnosticListener#NONE})
 */
public record FormConfig(
        SchemaNode schema,
        JsonNode initialData,
        DocumentValidator validator,
        FormMode mode,
        ValidationTrigger trigger,
        DiagnosticListener diagnostics) {

    public FormConfig {
        Objects.requireNonNull(schema, "schema must not be null");
        mode = mode == null ? FormMode.EDIT : mode;
        trigger = trigger == null ? ValidationTrigger.ON_SUBMIT : trigger;
        diagnostics = diagnostics == null ? DiagnosticListener.NONE : diagnostics;
    }

    public static Builder builder(SchemaNode schema) {
        return new Builder(schema);
    }

    public boolean hasInitialData() {
        return !JsonNodeUtils.isAbsent(initialData);
    }

    /** Builder for {@link FormConfig}. */
    public static final class Builder {
        private final SchemaNode schema;
        private JsonNode initialData;
        private DocumentValidator validator;
        private FormMode mode = FormMode.EDIT;
        private ValidationTrigger trigger = ValidationTrigger.ON_SUBMIT;
        private DiagnosticListener diagnostics = DiagnosticListener.NONE;

        private Builder(SchemaNode schema) {
            this.schema = schema;
        }

        public Builder initialData(JsonNode initialData) {
            this.initialData = initialData;
            return this;
        }

        public Builder validator(DocumentValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder mode(FormMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder trigger(ValidationTrigger trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder diagnostics(DiagnosticListener diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public FormConfig build() {
            return new FormConfig(schema, initialData, validator, mode, trigger, diagnostics);
        }
    }
}
