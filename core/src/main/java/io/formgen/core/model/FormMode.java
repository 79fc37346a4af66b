package io.formgen.core.model;

/**
 * Whether a form may be edited.
 *
 * <ul>
 * <li>{@link #EDIT}: fields are editable (default).</li>
 * <li>{@link #READONLY}: fields render as viewers; document mutations are rejected.</li>
 * </ul>
 */
public enum FormMode {
    EDIT,
    READONLY
}
