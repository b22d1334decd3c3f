package com.example.demo.deckgen.model;

/**
 * Lifecycle of a slide during rendering. A slide is CREATED once the create pass
 * has assigned it an object id, POPULATED once its content requests were built.
 */
public enum SlideState {
    PENDING,
    CREATED,
    POPULATED
}
