package io.formgen.core.error;

/**
 * Reported when a schema node has a kind the engine can neither render nor synthesize a default for.
 * Non-fatal: it travels to {@link io.formgen.core.spi.DiagnosticListener} rather than up the stack.
 */
public final class UnsupportedSchemaKindException extends SchemaException {

    private static final long serialVersionUID = 1L;

    private final String kindName;

    public UnsupportedSchemaKindException(String kindName, String location) {
        super("Unsupported schema kind '" + kindName + "'" + (location != null ? " at " + location : ""), location);
        this.kindName = kindName;
    }

    /** The unsupported kind, as the schema author named it. */
    public String kindName() {
        return kindName;
    }
}
