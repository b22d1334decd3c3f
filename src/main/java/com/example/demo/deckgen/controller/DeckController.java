package com.example.demo.deckgen.controller;

import com.example.demo.deckgen.exception.DeckGenerationException;
import com.example.demo.deckgen.model.DeckRenderRequest;
import com.example.demo.deckgen.model.DeckRenderResponse;
import com.example.demo.deckgen.service.DeckRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * REST API for deck rendering
 */
@Slf4j
@RestController
@RequestMapping("/api/decks")
@RequiredArgsConstructor
public class DeckController {
    private final DeckRenderer deckRenderer;

    /**
     * Render a parsed deck into a presentation.
     *
     * POST /api/decks/render
     * {
     *   "presentationId": "1AbC...",
     *   "slides": [
     *     { "index": 0, "title": { "rawText": "Hello" } }
     *   ]
     * }
     *
     * Failures come back as {"code": ..., "description": ...}.
     */
    @PostMapping("/render")
    public ResponseEntity<?> render(@RequestBody DeckRenderRequest request) {
        log.info("Received render request for {} slides", request.getSlides() == null ? 0 : request.getSlides().size());
        try {
            DeckRenderResponse response = deckRenderer.render(request);
            return ResponseEntity.ok(response);
        } catch (DeckGenerationException e) {
            Map<String, String> body = new HashMap<>();
            body.put("code", e.getCode());
            body.put("description", e.getDescription());
            return new ResponseEntity<>(body, statusFor(e.getCode()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Deck generation service is running");
    }

    static HttpStatus statusFor(String code) {
        if (code == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        switch (code) {
            case "LAYOUT_NOT_FOUND":
                return HttpStatus.NOT_FOUND;
            case "INVALID_REQUEST":
            case "MALFORMED_TEXT_RANGE":
            case "UNSUPPORTED_CONTENT":
            case "IMAGE_UPLOAD_FAILED":
                return HttpStatus.BAD_REQUEST;
            case "RATE_LIMITED":
                return HttpStatus.TOO_MANY_REQUESTS;
            case "BATCH_REJECTED":
            case "REMOTE_CALL_FAILED":
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
