package com.example.demo.deckgen.exception;

/**
 * The remote service rejected a dispatched chunk. {@code requestIndex} is the
 * position of the offending mutation in the whole batch (not in the chunk), or
 * -1 when the service did not name one.
 */
public class BatchRejectedException extends DeckGenerationException {
    private final int requestIndex;
    private final String failedRequest;

    public BatchRejectedException(String remoteMessage, int requestIndex, String failedRequest, Throwable cause) {
        super("BATCH_REJECTED", describe(remoteMessage, requestIndex, failedRequest), cause);
        this.requestIndex = requestIndex;
        this.failedRequest = failedRequest;
    }

    private static String describe(String remoteMessage, int requestIndex, String failedRequest) {
        StringBuilder sb = new StringBuilder("Unable to generate slides: ").append(remoteMessage);
        if (requestIndex >= 0 && failedRequest != null) {
            sb.append("\nThe request that failed (#").append(requestIndex).append(") was:\n").append(failedRequest);
        }
        return sb.toString();
    }

    public int getRequestIndex() {
        return requestIndex;
    }

    public String getFailedRequest() {
        return failedRequest;
    }
}
