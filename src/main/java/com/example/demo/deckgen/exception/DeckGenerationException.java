package com.example.demo.deckgen.exception;

/**
 * Base exception for deck generation failures. Carries a machine readable code
 * (e.g. LAYOUT_NOT_FOUND, BATCH_REJECTED) and a human readable description so the
 * controller can translate it into a structured response.
 */
public class DeckGenerationException extends RuntimeException {
    private final String code;
    private final String description;

    public DeckGenerationException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public DeckGenerationException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
