package com.example.demo.deckgen.client;

import java.nio.file.Path;

/**
 * Makes a local image reachable by the remote service.
 */
public interface ImageUploader {

    /**
     * @return public URL of the uploaded copy
     * @throws com.example.demo.deckgen.exception.ImageUploadException if the upload fails
     * @throws com.example.demo.deckgen.exception.RateLimitExceededException if the host throttles us
     */
    String upload(Path file);
}
