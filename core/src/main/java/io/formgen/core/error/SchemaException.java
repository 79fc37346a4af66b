package io.formgen.core.error;

/**
 * Abstract parent for problems found while interpreting a schema tree. These are localized to a
 * single field: the engine reports them as diagnostics and degrades that field to an absent value
 * or a placeholder, the rest of the form keeps working.
 */
public abstract class SchemaException extends FormException {

    private static final long serialVersionUID = 1L;

    protected SchemaException(String message, String location) {
        super(message, location, Origin.SCHEMA);
    }

    protected SchemaException(String message, Throwable cause, String location) {
        super(message, cause, location, Origin.SCHEMA);
    }
}
