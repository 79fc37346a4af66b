package io.formgen.core.engine;

import io.formgen.core.error.SchemaException;
import io.formgen.core.model.DocumentPath;
import io.formgen.core.spi.DiagnosticListener;
import org.slf4j.Logger;

/** Logs a non-fatal condition and forwards it to the configured listener. */
final class Diagnostics {

    private Diagnostics() {}

    static void report(Logger log, DiagnosticListener listener, DocumentPath path, SchemaException cause) {
        if (cause.getCause() != null) {
            log.warn("Degraded field at {}: {}", path, cause.getMessage(), cause.getCause());
        } else {
            log.warn("Degraded field at {}: {}", path, cause.getMessage());
        }
        if (listener == null) {
            return;
        }
        try {
            listener.onDiagnostic(new DiagnosticListener.Diagnostic(path, cause));
        } catch (Exception e) {
            log.warn("DiagnosticListener.onDiagnostic failed", e);
        }
    }
}
