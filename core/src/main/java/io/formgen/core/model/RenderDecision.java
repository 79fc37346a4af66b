package io.formgen.core.model;

import io.formgen.core.schema.SchemaNode;
import java.util.Objects;

/**
 * Outcome of render dispatch for one schema node.
 *
 * @param kind       the template kind to render
 * @param variant    the editor chosen within that kind
 * @param resolved   the concrete (unwrapped) node the decision was made on; {@code null} when the
 *                   node could not be resolved
 * @param diagnostic why the node is unsupported, or {@code null} when it is supported
 */
public record RenderDecision(TemplateKind kind, EditorVariant variant, SchemaNode resolved, String diagnostic) {

    public RenderDecision {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(variant, "variant must not be null");
    }

    public static RenderDecision of(TemplateKind kind, EditorVariant variant, SchemaNode resolved) {
        return new RenderDecision(kind, variant, resolved, null);
    }

    public static RenderDecision unsupported(SchemaNode resolved, String diagnostic) {
        return new RenderDecision(TemplateKind.UNSUPPORTED, EditorVariant.PLACEHOLDER, resolved, diagnostic);
    }

    public boolean isSupported() {
        return kind != TemplateKind.UNSUPPORTED;
    }
}
