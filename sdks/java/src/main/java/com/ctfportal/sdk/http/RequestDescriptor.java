package com.ctfportal.sdk.http;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable description of one outbound call.
 *
 * <p>Header names are case-insensitive. The {@code retried} flag can be set once,
 * through {@link #markRetried()}, which returns a new descriptor; the pipeline
 * uses it to replay a request at most once after a token refresh.</p>
 */
public final class RequestDescriptor {

    public static final String AUTHORIZATION = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    private final String method;
    private final String url;
    private final Map<String, String> headers;
    private final String body;
    private final String contentType;
    private final boolean silent;
    private final boolean retried;

    private RequestDescriptor(Builder builder) {
        this.method = builder.method;
        this.url = builder.url;
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(builder.headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.body = builder.body;
        this.contentType = builder.contentType;
        this.silent = builder.silent;
        this.retried = builder.retried;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RequestDescriptor get(String url) {
        return builder().method("GET").url(url).build();
    }

    public static RequestDescriptor post(String url, String jsonBody) {
        return builder().method("POST").url(url).body(jsonBody).build();
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Returns the value of the named header, or {@code null}.
     */
    public String header(String name) {
        return headers.get(name);
    }

    public String getBody() {
        return body;
    }

    public String getContentType() {
        return contentType;
    }

    /**
     * Whether the caller opted out of user-visible failure notifications.
     */
    public boolean isSilent() {
        return silent;
    }

    public boolean isRetried() {
        return retried;
    }

    /**
     * Returns the bearer token carried in the {@code Authorization} header, or {@code null}.
     */
    public String bearerToken() {
        String value = headers.get(AUTHORIZATION);
        if (value == null || !value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        return value.substring(BEARER_PREFIX.length());
    }

    public RequestDescriptor withHeader(String name, String value) {
        return toBuilder().header(name, value).build();
    }

    public RequestDescriptor withBearer(String token) {
        return withHeader(AUTHORIZATION, BEARER_PREFIX + token);
    }

    /**
     * Returns a copy flagged as retried.
     *
     * @throws IllegalStateException if this descriptor was already retried
     */
    public RequestDescriptor markRetried() {
        if (retried) {
            throw new IllegalStateException("Request " + method + " " + url + " was already retried");
        }
        return toBuilder().retried(true).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .method(method)
                .url(url)
                .body(body)
                .contentType(contentType)
                .silent(silent)
                .retried(retried);
        builder.headers.putAll(headers);
        return builder;
    }

    @Override
    public String toString() {
        return "RequestDescriptor{" +
                "method='" + method + '\'' +
                ", url='" + url + '\'' +
                ", silent=" + silent +
                ", retried=" + retried +
                '}';
    }

    /**
     * Builder for creating RequestDescriptor instances.
     */
    public static class Builder {
        private String method = "GET";
        private String url;
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private String body;
        private String contentType = "application/json";
        private boolean silent;
        private boolean retried;

        public Builder method(String method) {
            this.method = Objects.requireNonNull(method, "method must not be null").toUpperCase();
            return this;
        }

        public Builder url(String url) {
            this.url = Objects.requireNonNull(url, "url must not be null");
            return this;
        }

        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "header name must not be null");
            if (value == null) {
                headers.remove(name);
            } else {
                headers.put(name, value);
            }
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder silent(boolean silent) {
            this.silent = silent;
            return this;
        }

        Builder retried(boolean retried) {
            this.retried = retried;
            return this;
        }

        public RequestDescriptor build() {
            Objects.requireNonNull(url, "url must not be null");
            return new RequestDescriptor(this);
        }
    }
}
