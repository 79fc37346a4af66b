package io.formgen.core.error;

/**
 * Abstract parent for caller contract violations against a form document. These are surfaced to the
 * caller immediately and never recovered silently.
 */
public abstract class DocumentException extends FormException {

    private static final long serialVersionUID = 1L;

    protected DocumentException(String message, String location) {
        super(message, location, Origin.DOCUMENT);
    }

    protected DocumentException(String message, Throwable cause, String location) {
        super(message, cause, location, Origin.DOCUMENT);
    }
}
