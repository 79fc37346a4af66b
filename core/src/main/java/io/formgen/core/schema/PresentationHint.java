package io.formgen.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Author-supplied request for a specific editor, e.g. {@code range} for a bounded number or
 * {@code textarea} for a long string. Overrides structural detection when it applies.
 *
 * @param kind    editor name, never blank
 * @param options free-form options for the editor (read-only)
 */
public record PresentationHint(String kind, Map<String, Object> options) {

    public PresentationHint {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind.isBlank()) {
            throw new IllegalArgumentException("presentation hint kind must not be blank");
        }
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static PresentationHint of(String kind) {
        return new PresentationHint(kind, Map.of());
    }

    /** Returns {@code true} if this hint names the given editor. */
    public boolean is(String editor) {
        return kind.equals(editor);
    }
}
