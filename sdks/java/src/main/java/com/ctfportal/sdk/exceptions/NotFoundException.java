package com.ctfportal.sdk.exceptions;

import com.ctfportal.sdk.errors.ClassifiedError;

/**
 * Exception thrown when a resource is not found (404 Not Found).
 */
public class NotFoundException extends PortalException {

    public NotFoundException(ClassifiedError error) {
        super(error, null);
    }
}
