package com.example.demo.deckgen.autofit;

/**
 * How text must fit its shape.
 */
public enum FitConstraint {
    /** No autofit, the shape's own size applies. */
    NONE,
    /** Single line that must fit the width, e.g. titles. */
    HORIZONTAL,
    /** Wrapped text that must fit the height, e.g. bodies. */
    VERTICAL
}
