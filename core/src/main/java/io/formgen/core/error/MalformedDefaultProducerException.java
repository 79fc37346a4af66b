package io.formgen.core.error;

/** Wraps a failure thrown by a schema's default-value producer. */
public final class MalformedDefaultProducerException extends SchemaException {

    private static final long serialVersionUID = 1L;

    public MalformedDefaultProducerException(String message, Throwable cause, String location) {
        super(message, cause, location);
    }
}
