package io.formgen.core.model;

/**
 * Closed set of rendering capabilities. A rendering layer supplies exactly one renderer for each
 * constant; {@link #UNSUPPORTED} renders an inert placeholder with a visible diagnostic.
 */
public enum TemplateKind {
    STRING,
    NUMBER,
    BOOLEAN,
    BIG_INTEGER,
    DATE,
    ARRAY,
    OBJECT,
    UNION,
    TUPLE,
    ENUM,
    UNSUPPORTED
}
