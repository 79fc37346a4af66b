package io.formgen.core.schema;

/**
 * Opaque metadata bag a schema author attaches to a node. The engine only reads it.
 *
 * @param title       display title, or {@code null}
 * @param description help text, or {@code null}
 * @param hint        presentation hint, or {@code null}
 */
public record Metadata(String title, String description, PresentationHint hint) {

    public static final Metadata EMPTY = new Metadata(null, null, null);

    public static Metadata titled(String title) {
        return new Metadata(title, null, null);
    }

    public static Metadata hinted(String hintKind) {
        return new Metadata(null, null, PresentationHint.of(hintKind));
    }

    public Metadata withHint(PresentationHint hint) {
        return new Metadata(title, description, hint);
    }

    public Metadata withDescription(String description) {
        return new Metadata(title, description, hint);
    }

    public boolean hasHint() {
        return hint != null;
    }
}
