package com.ctfportal.sdk.exceptions;

import com.ctfportal.sdk.errors.ClassifiedError;

/**
 * Exception thrown when a request is still unauthorized (401) after the one
 * token refresh and replay.
 */
public class AuthenticationException extends PortalException {

    public AuthenticationException(ClassifiedError error) {
        super(error, null);
    }

    public AuthenticationException(ClassifiedError error, Throwable cause) {
        super(error, cause);
    }
}
