package io.formgen.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.formgen.core.schema.SchemaNode;
import java.util.Objects;

/**
 * Snapshot of everything a form holds. Stores replace snapshots wholesale; they are never mutated.
 *
 * @param schema   the form's schema
 * @param document the current document ({@code MissingNode} when absent)
 * @param errors   issues from the last validation pass
 * @param mode     edit or read-only
 */
public record FormState(SchemaNode schema, JsonNode document, ErrorIndex errors, FormMode mode) {

    public FormState {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(document, "document must not be null");
        errors = errors == null ? ErrorIndex.EMPTY : errors;
        mode = mode == null ? FormMode.EDIT : mode;
    }

    public FormState withDocument(JsonNode document) {
        return new FormState(schema, document, errors, mode);
    }

    public FormState withErrors(ErrorIndex errors) {
        return new FormState(schema, document, errors, mode);
    }
}
