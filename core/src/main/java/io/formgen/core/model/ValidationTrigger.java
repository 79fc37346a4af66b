package io.formgen.core.model;

/**
 * When the form controller runs the external validator.
 *
 * <ul>
 * <li>{@link #ON_SUBMIT}: only on submit or explicit validate; errors stay until then
 * (default).</li>
 * <li>{@link #ON_CHANGE}: after every document mutation as well.</li>
 * </ul>
 */
public enum ValidationTrigger {
    ON_SUBMIT,
    ON_CHANGE
}
