package io.formgen.core.error;

/** Thrown when a path traverses through a value that cannot hold the next segment. */
public final class InvalidPathException extends DocumentException {

    private static final long serialVersionUID = 1L;

    public InvalidPathException(String message, String location) {
        super(message, location);
    }
}
