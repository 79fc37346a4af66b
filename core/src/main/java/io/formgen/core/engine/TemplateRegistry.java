package io.formgen.core.engine;

import io.formgen.core.model.DocumentPath;
import io.formgen.core.model.RenderDecision;
import io.formgen.core.model.TemplateKind;
import io.formgen.core.schema.SchemaNode;
import io.formgen.core.spi.TemplateRenderer;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Closed set of renderers, one per {@link TemplateKind}. A registry cannot be built with a kind left
 * unregistered, so dispatch always has somewhere to go.
 *
 * <p>
 * Thread-safe: immutable after {@link Builder#build()}; rendering is as thread-safe as the
 * registered renderers.
 *
 * @param <R> the rendering layer's output type
 */
public final class TemplateRegistry<R> {

    private final Map<TemplateKind, TemplateRenderer<R>> renderers;
    private final RenderDispatcher dispatcher;

    private TemplateRegistry(Map<TemplateKind, TemplateRenderer<R>> renderers, RenderDispatcher dispatcher) {
        this.renderers = Collections.unmodifiableMap(new EnumMap<>(renderers));
        this.dispatcher = dispatcher;
    }

    public static <R> Builder<R> builder() {
        return new Builder<>();
    }

    /**
     * Dispatches {@code schema} and invokes the renderer registered for the resulting kind.
     *
     * @param schema the declared schema of the field
     * @param path   where the field lives in the document
     */
    public R render(SchemaNode schema, DocumentPath path) {
        RenderDecision decision = dispatcher.decide(schema, path);
        return renderers.get(decision.kind()).render(schema, path, decision);
    }

    public TemplateRenderer<R> rendererFor(TemplateKind kind) {
        return renderers.get(kind);
    }

    public RenderDispatcher dispatcher() {
        return dispatcher;
    }

    /** Builder for {@link TemplateRegistry}. */
    public static final class Builder<R> {

        private final Map<TemplateKind, TemplateRenderer<R>> renderers = new EnumMap<>(TemplateKind.class);
        private RenderDispatcher dispatcher;

        private Builder() {}

        /** Registers the renderer for {@code kind}; a second registration replaces the first. */
        public Builder<R> register(TemplateKind kind, TemplateRenderer<R> renderer) {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(renderer, "renderer must not be null");
            renderers.put(kind, renderer);
            return this;
        }

        /** Dispatcher to use; defaults to one without a diagnostics listener. */
        public Builder<R> dispatcher(RenderDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * @throws IllegalStateException if any template kind has no renderer
         */
        public TemplateRegistry<R> build() {
            Set<TemplateKind> missing = EnumSet.allOf(TemplateKind.class);
            missing.removeAll(renderers.keySet());
            if (!missing.isEmpty()) {
                throw new IllegalStateException("No renderer registered for template kinds: " + missing);
            }
            return new TemplateRegistry<>(renderers, dispatcher != null ? dispatcher : new RenderDispatcher());
        }
    }
}
