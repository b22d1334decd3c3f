package com.example.demo.deckgen.exception;

public class UnsupportedContentException extends DeckGenerationException {
    public UnsupportedContentException(String description) {
        super("UNSUPPORTED_CONTENT", description);
    }
}
