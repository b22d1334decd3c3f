package com.example.demo.deckgen.exception;

/**
 * A style run or list marker range does not lie within its text. This is an
 * upstream contract violation and aborts the run.
 */
public class MalformedTextRangeException extends DeckGenerationException {
    public MalformedTextRangeException(String description) {
        super("MALFORMED_TEXT_RANGE", description);
    }
}
