package com.ctfportal.sdk.errors;

/**
 * Machine-usable category of a failed request.
 */
public enum ErrorKind {
    NETWORK,
    TIMEOUT,
    CANCELLED,
    UNAUTHORIZED,
    FORBIDDEN,
    NOT_FOUND,
    RATE_LIMITED,
    SERVER_ERROR,
    CLIENT_ERROR,
    UNKNOWN;

    /**
     * Maps an HTTP status to its kind.
     */
    public static ErrorKind fromStatus(int status) {
        switch (status) {
            case 401:
                return UNAUTHORIZED;
            case 403:
                return FORBIDDEN;
            case 404:
                return NOT_FOUND;
            case 408:
                return TIMEOUT;
            case 413:
                return CLIENT_ERROR;
            case 429:
                return RATE_LIMITED;
            default:
                if (status >= 500 && status < 600) {
                    return SERVER_ERROR;
                }
                if (status >= 400 && status < 500) {
                    return CLIENT_ERROR;
                }
                return UNKNOWN;
        }
    }
}
