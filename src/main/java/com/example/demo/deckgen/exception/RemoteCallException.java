package com.example.demo.deckgen.exception;

/**
 * Low level failure of a call to the remote presentation service. Carries the
 * HTTP status and the structured error fields the service returned, if any.
 */
public class RemoteCallException extends DeckGenerationException {
    private final int httpStatus;
    private final String errorStatus;
    private final String remoteMessage;

    public RemoteCallException(int httpStatus, String errorStatus, String remoteMessage, Throwable cause) {
        super("REMOTE_CALL_FAILED", "Remote call failed with HTTP " + httpStatus
                + (errorStatus != null ? " (" + errorStatus + ")" : "") + ": " + remoteMessage, cause);
        this.httpStatus = httpStatus;
        this.errorStatus = errorStatus;
        this.remoteMessage = remoteMessage;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getErrorStatus() {
        return errorStatus;
    }

    public String getRemoteMessage() {
        return remoteMessage;
    }

    /**
     * The service is throttling this caller rather than rejecting the call itself.
     */
    public boolean isRateLimited() {
        return httpStatus == 429
                || "RESOURCE_EXHAUSTED".equals(errorStatus)
                || "TOO_MANY_REQUESTS".equals(errorStatus);
    }
}
