package io.formgen.core.model;

import java.util.Objects;

/**
 * One validation failure reported by an external validator, tagged with the document path it was
 * reported against. Immutable once created.
 *
 * @param path            location the validator reported the failure at
 * @param message         human-readable message
 * @param code            validator-specific failure code (e.g. {@code required}, {@code minLength}),
 *                        or {@code null}
 * @param missingProperty for a missing-required-field failure reported against the parent object,
 *                        the name of the missing field; {@code null} otherwise
 */
public record ValidationIssue(DocumentPath path, String message, String code, String missingProperty) {

    /** Code marking a missing-required-field failure. */
    public static final String REQUIRED = "required";

    public ValidationIssue {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ValidationIssue of(DocumentPath path, String message) {
        return new ValidationIssue(path, message, null, null);
    }

    public static ValidationIssue of(DocumentPath path, String message, String code) {
        return new ValidationIssue(path, message, code, null);
    }

    /** A missing-required-field failure reported against the parent object's path. */
    public static ValidationIssue missingRequired(DocumentPath parent, String property, String message) {
        Objects.requireNonNull(property, "property must not be null");
        return new ValidationIssue(parent, message, REQUIRED, property);
    }

    /** Returns {@code true} if this issue names a missing field of the object at {@link #path()}. */
    public boolean isMissingRequired() {
        return REQUIRED.equals(code) && missingProperty != null;
    }
}
