package com.ctfportal.sdk.http;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A fully read HTTP response.
 */
public final class ApiResponse {

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;

    public ApiResponse(int statusCode, Map<String, List<String>> headers, String body) {
        this.statusCode = statusCode;
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body != null ? body : "";
    }

    public ApiResponse(int statusCode, String body) {
        this(statusCode, Map.of(), body);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    /**
     * Returns the first value of the named header, or {@code null}.
     */
    public String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public String toString() {
        return "ApiResponse{statusCode=" + statusCode + ", bodyLength=" + body.length() + '}';
    }
}
