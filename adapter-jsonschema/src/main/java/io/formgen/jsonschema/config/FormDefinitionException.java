package io.formgen.jsonschema.config;

/**
 * Thrown when a form definition cannot be loaded: missing file, invalid YAML, a missing
 * {@code schema} key or an unknown enumerated value. The message names the offending file and key.
 */
public class FormDefinitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FormDefinitionException(String message) {
        super(message);
    }

    public FormDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
