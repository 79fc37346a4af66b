package io.formgen.jsonschema;

/**
 * Thrown when a JSON Schema document cannot be read: missing file, unparseable JSON or YAML, or a
 * node that is not a schema at all.
 */
public class SchemaLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SchemaLoadException(String message) {
        super(message);
    }

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
