package com.ctfportal.sdk.exceptions;

import com.ctfportal.sdk.auth.RefreshException;
import com.ctfportal.sdk.errors.ClassifiedError;

/**
 * Exception thrown when the session could not be renewed. The token store has
 * been cleared; the user has to log in again.
 */
public class SessionExpiredException extends AuthenticationException {

    private final RefreshException.Reason reason;

    public SessionExpiredException(ClassifiedError error, RefreshException cause) {
        super(error, cause);
        this.reason = cause.getReason();
    }

    public RefreshException.Reason getReason() {
        return reason;
    }
}
