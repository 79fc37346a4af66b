package io.formgen.core.error;

/**
 * Abstract base for all formgen exceptions. Never thrown directly; use the concrete subclasses
 * under {@link SchemaException} or {@link DocumentException}.
 */
public abstract class FormException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Where the problem originates. */
    public enum Origin {
        SCHEMA,
        DOCUMENT
    }

    private final String location;
    private final Origin origin;

    protected FormException(String message, String location, Origin origin) {
        super(message);
        this.location = location;
        this.origin = origin;
    }

    protected FormException(String message, Throwable cause, String location, Origin origin) {
        super(message, cause);
        this.location = location;
        this.origin = origin;
    }

    /**
     * The canonical document path ({@code /a/0/b}) the error relates to, or {@code null} if the
     * throw site does not know it.
     */
    public String location() {
        return location;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** Whether the schema or the document is at fault. */
    public Origin origin() {
        return origin;
    }
}
