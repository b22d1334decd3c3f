package com.example.demo.deckgen.exception;

public class ImageUploadException extends DeckGenerationException {
    public ImageUploadException(String description) {
        super("IMAGE_UPLOAD_FAILED", description);
    }

    public ImageUploadException(String description, Throwable cause) {
        super("IMAGE_UPLOAD_FAILED", description, cause);
    }
}
