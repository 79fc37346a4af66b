package io.formgen.core.spi;

import io.formgen.core.model.DocumentPath;
import io.formgen.core.model.RenderDecision;
import io.formgen.core.schema.SchemaNode;

/**
 * SPI for one concrete renderer of a {@link io.formgen.core.model.TemplateKind}.
 *
 * @param <R> whatever the rendering layer produces (a widget, markup, a view model, ...)
 */
@FunctionalInterface
public interface TemplateRenderer<R> {

    /**
     * @param schema   the schema node as declared (wrappers included)
     * @param path     where the field lives in the document
     * @param decision the dispatch outcome, including the chosen editor variant
     */
    R render(SchemaNode schema, DocumentPath path, RenderDecision decision);
}
