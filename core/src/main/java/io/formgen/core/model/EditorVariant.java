package io.formgen.core.model;

/**
 * Concrete editor chosen inside a {@link TemplateKind}. Presentation-only: it never changes how the
 * value is stored. {@link #RANGE} serves numbers, big integers and dates; {@link #RADIO} serves
 * booleans and enums.
 */
public enum EditorVariant {
    INPUT,
    TEXTAREA,
    EMAIL_INPUT,
    URL_INPUT,
    DATE_INPUT,
    DATETIME_INPUT,
    NUMBER_INPUT,
    BIG_INTEGER_INPUT,
    RANGE,
    CHECKBOX,
    RADIO,
    SELECT,
    LIST,
    MULTI_SELECT,
    CHECKBOX_GROUP,
    FIELDSET,
    TUPLE,
    LITERAL_CHOICE,
    COMPLEX_UNION,
    PLACEHOLDER
}
