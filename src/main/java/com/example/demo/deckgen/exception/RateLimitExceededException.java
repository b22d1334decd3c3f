package com.example.demo.deckgen.exception;

/**
 * A remote service refused the call because too many requests were sent.
 * Never retried automatically; the description tells the caller what to do.
 */
public class RateLimitExceededException extends DeckGenerationException {
    public static final String GUIDANCE =
            "Too many requests per second. Someone else may be using the same key right now; "
                    + "wait a few seconds and try again.";

    private final String service;

    public RateLimitExceededException(String service, Throwable cause) {
        super("RATE_LIMITED", service + " rejected the request: " + GUIDANCE, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
