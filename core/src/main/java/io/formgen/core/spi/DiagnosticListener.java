package io.formgen.core.spi;

import io.formgen.core.error.SchemaException;
import io.formgen.core.model.DocumentPath;

/**
 * SPI for non-fatal conditions the engine degrades around: unsupported schema kinds, failing
 * default producers and unresolvable references. The engine always logs these through SLF4J;
 * a listener lets a host surface them elsewhere (a developer overlay, a test assertion).
 *
 * <p>
 * Exceptions thrown by listeners are caught by the engine and logged; they never affect the
 * operation that reported the diagnostic.
 */
@FunctionalInterface
public interface DiagnosticListener {

    /** Listener that ignores every diagnostic. */
    DiagnosticListener NONE = diagnostic -> {};

    void onDiagnostic(Diagnostic diagnostic);

    /**
     * A degraded field.
     *
     * @param path  document path of the affected field
     * @param cause the condition, never thrown
     */
    record Diagnostic(DocumentPath path, SchemaException cause) {}
}
