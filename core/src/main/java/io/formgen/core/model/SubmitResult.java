package io.formgen.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of submitting a form. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#VALID}: the validator reported nothing; {@code document} holds the submitted
 * data.</li>
 * <li>{@link Type#INVALID}: {@code issues} holds every reported issue in validator order and
 * {@code document} the data that failed.</li>
 * </ul>
 */
public final class SubmitResult {

    /** The type of submit outcome. */
    public enum Type {
        VALID,
        INVALID
    }

    private final Type type;
    private final JsonNode document;
    private final List<ValidationIssue> issues;

    private SubmitResult(Type type, JsonNode document, List<ValidationIssue> issues) {
        this.type = type;
        this.document = document;
        this.issues = issues;
    }

    public static SubmitResult valid(JsonNode document) {
        Objects.requireNonNull(document, "document must not be null for VALID");
        return new SubmitResult(Type.VALID, document, List.of());
    }

    public static SubmitResult invalid(JsonNode document, List<ValidationIssue> issues) {
        Objects.requireNonNull(document, "document must not be null for INVALID");
        Objects.requireNonNull(issues, "issues must not be null for INVALID");
        if (issues.isEmpty()) {
            throw new IllegalArgumentException("INVALID requires at least one issue");
        }
        return new SubmitResult(Type.INVALID, document, List.copyOf(issues));
    }

    public Type type() {
        return type;
    }

    public JsonNode document() {
        return document;
    }

    /** Reported issues; empty when {@code type() == VALID}. */
    public List<ValidationIssue> issues() {
        return issues;
    }

    public boolean isValid() {
        return type == Type.VALID;
    }

    @Override
    public String toString() {
        return switch (type) {
            case VALID -> "SubmitResult[VALID]";
            case INVALID -> "SubmitResult[INVALID, issues=" + issues.size() + "]";
        };
    }
}
