package com.ctfportal.sdk.exceptions;

import com.ctfportal.sdk.errors.ClassifiedError;
import com.ctfportal.sdk.errors.ErrorKind;

import java.util.List;

/**
 * Base exception for all portal API errors.
 *
 * <p>{@link #getMessage()} is always safe to show to a user when the exception
 * was built from a {@link ClassifiedError}.</p>
 */
public class PortalException extends RuntimeException {

    private final ErrorKind kind;
    private final int statusCode;
    private final boolean silent;
    private final List<String> messages;

    public PortalException(String message) {
        this(message, null);
    }

    public PortalException(String message, Throwable cause) {
        super(message, cause);
        this.kind = ErrorKind.UNKNOWN;
        this.statusCode = 0;
        this.silent = false;
        this.messages = message != null ? List.of(message) : List.of();
    }

    public PortalException(ClassifiedError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.kind = error.getKind();
        this.statusCode = error.getStatusCode();
        this.silent = error.isSilent();
        this.messages = error.getMessages();
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * HTTP status, or 0 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isSilent() {
        return silent;
    }

    public List<String> getMessages() {
        return messages;
    }

    public boolean isUnauthorized() {
        return kind == ErrorKind.UNAUTHORIZED;
    }

    public boolean isForbidden() {
        return kind == ErrorKind.FORBIDDEN;
    }

    public boolean isNotFound() {
        return kind == ErrorKind.NOT_FOUND;
    }

    public boolean isRateLimited() {
        return kind == ErrorKind.RATE_LIMITED;
    }

    public boolean isServerError() {
        return kind == ErrorKind.SERVER_ERROR;
    }

    public boolean isCancelled() {
        return kind == ErrorKind.CANCELLED;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('{');
        sb.append("kind=").append(kind);
        if (statusCode > 0) {
            sb.append(", statusCode=").append(statusCode);
        }
        sb.append(", message='").append(getMessage()).append('\'');
        sb.append('}');
        return sb.toString();
    }
}
