package io.formgen.core.error;

/**
 * Thrown when a lazy reference cannot be resolved: its getter fails or returns nothing, or the
 * resolution chain revisits a reference it is already resolving.
 */
public final class UnresolvableReferenceException extends SchemaException {

    private static final long serialVersionUID = 1L;

    public UnresolvableReferenceException(String message, String location) {
        super(message, location);
    }

    public UnresolvableReferenceException(String message, Throwable cause, String location) {
        super(message, cause, location);
    }
}
