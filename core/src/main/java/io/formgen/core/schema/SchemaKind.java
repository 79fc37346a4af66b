package io.formgen.core.schema;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of schema node kinds. Every algorithm that branches on a node switches over this enum,
 * so adding a kind breaks compilation at each switch until it is handled.
 */
public enum SchemaKind {
    // wrappers
    OPTIONAL,
    NULLABLE,
    DEFAULT,
    PREFAULT,
    READONLY,
    NON_OPTIONAL,
    LAZY,

    // leaves
    STRING,
    NUMBER,
    INTEGER,
    BOOLEAN,
    BIG_INTEGER,
    DATE,
    NULL,
    LITERAL,
    ENUM,

    // composites
    ARRAY,
    OBJECT,
    TUPLE,
    UNION,

    /** A kind the engine does not model (e.g. {@code allOf}, or an unknown JSON Schema type). */
    OPAQUE;

    /** All kinds that wrap exactly one inner node (lazy references included). */
    public static final Set<SchemaKind> WRAPPERS =
            Set.copyOf(EnumSet.of(OPTIONAL, NULLABLE, DEFAULT, PREFAULT, READONLY, NON_OPTIONAL, LAZY));

    public boolean isWrapper() {
        return WRAPPERS.contains(this);
    }
}
