package io.formgen.core.model;

/** Direction for reordering an array element: {@link #UP} towards index 0, {@link #DOWN} away. */
public enum MoveDirection {
    UP,
    DOWN
}
