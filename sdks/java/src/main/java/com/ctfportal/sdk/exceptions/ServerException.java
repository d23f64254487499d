package com.ctfportal.sdk.exceptions;

import com.ctfportal.sdk.errors.ClassifiedError;

/**
 * Exception thrown when a server error occurs (5xx).
 */
public class ServerException extends PortalException {

    public ServerException(ClassifiedError error) {
        super(error, null);
    }
}
