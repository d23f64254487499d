package com.ctfportal.sdk.auth;

/**
 * Thrown when a fresh access token cannot be obtained. The session is over once
 * this is raised: the token store has already been cleared.
 */
public class RefreshException extends RuntimeException {

    /**
     * Why the refresh failed.
     */
    public enum Reason {
        /** No refresh token was stored, so no exchange was attempted. */
        NO_REFRESH_TOKEN,
        /** The refresh endpoint was called and did not return a usable token. */
        EXCHANGE_FAILED
    }

    private final Reason reason;
    private final int statusCode;

    public RefreshException(Reason reason, String message) {
        this(reason, message, 0, null);
    }

    public RefreshException(Reason reason, String message, Throwable cause) {
        this(reason, message, 0, cause);
    }

    public RefreshException(Reason reason, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * HTTP status of the refresh response, or 0 if none was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
