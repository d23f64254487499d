package com.ctfportal.sdk.errors;

import com.ctfportal.sdk.http.ApiResponse;
import com.ctfportal.sdk.http.RequestDescriptor;

/**
 * An unclassified failure: the request plus either the response that was
 * received or the throwable raised when none was.
 */
public final class RawFailure {

    private final RequestDescriptor request;
    private final ApiResponse response;
    private final Throwable error;

    private RawFailure(RequestDescriptor request, ApiResponse response, Throwable error) {
        this.request = request;
        this.response = response;
        this.error = error;
    }

    public static RawFailure ofResponse(RequestDescriptor request, ApiResponse response) {
        return new RawFailure(request, response, null);
    }

    public static RawFailure ofError(RequestDescriptor request, Throwable error) {
        return new RawFailure(request, null, error);
    }

    /**
     * The originating request; may be {@code null}.
     */
    public RequestDescriptor getRequest() {
        return request;
    }

    /**
     * The response, or {@code null} if none was received.
     */
    public ApiResponse getResponse() {
        return response;
    }

    public Throwable getError() {
        return error;
    }

    public boolean hasResponse() {
        return response != null;
    }
}
