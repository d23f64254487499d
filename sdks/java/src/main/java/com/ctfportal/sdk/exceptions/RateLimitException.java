package com.ctfportal.sdk.exceptions;

import com.ctfportal.sdk.errors.ClassifiedError;

/**
 * Exception thrown when rate limited (429 Too Many Requests).
 */
public class RateLimitException extends PortalException {

    private final Long retryAfter;

    public RateLimitException(ClassifiedError error) {
        this(error, null);
    }

    public RateLimitException(ClassifiedError error, Long retryAfter) {
        super(error, null);
        this.retryAfter = retryAfter;
    }

    /**
     * Returns the number of seconds to wait before retrying, from the
     * {@code Retry-After} header, or {@code null}.
     */
    public Long getRetryAfter() {
        return retryAfter;
    }

    public static Long parseRetryAfter(String header) {
        if (header == null) {
            return null;
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            // HTTP-date form is not supported
            return null;
        }
    }
}
