package com.ctfportal.sdk.client;

import com.ctfportal.sdk.errors.ErrorClassifier;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the portal client.
 */
public class PortalClientConfig {

    private final String baseUrl;
    private final Duration timeout;
    private final String refreshPath;
    private final String silentHeader;
    private final String accessToken;
    private final String refreshToken;

    private PortalClientConfig(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.timeout = builder.timeout;
        this.refreshPath = builder.refreshPath;
        this.silentHeader = builder.silentHeader;
        this.accessToken = builder.accessToken;
        this.refreshToken = builder.refreshToken;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PortalClientConfig defaultConfig() {
        return builder().build();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getRefreshPath() {
        return refreshPath;
    }

    public String getSilentHeader() {
        return silentHeader;
    }

    /**
     * Access token handed over by the login flow, or {@code null}.
     */
    public String getAccessToken() {
        return accessToken;
    }

    /**
     * Refresh token handed over by the login flow, or {@code null}.
     */
    public String getRefreshToken() {
        return refreshToken;
    }

    /**
     * Builder for creating PortalClientConfig instances.
     */
    public static class Builder {
        private String baseUrl = "http://localhost:8000";
        private Duration timeout = Duration.ofSeconds(15);
        private String refreshPath = "/users/token/refresh/";
        private String silentHeader = ErrorClassifier.DEFAULT_SILENT_HEADER;
        private String accessToken;
        private String refreshToken;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
            return this;
        }

        public Builder refreshPath(String refreshPath) {
            this.refreshPath = Objects.requireNonNull(refreshPath, "refreshPath must not be null");
            return this;
        }

        public Builder silentHeader(String silentHeader) {
            this.silentHeader = Objects.requireNonNull(silentHeader, "silentHeader must not be null");
            return this;
        }

        public Builder accessToken(String accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public Builder refreshToken(String refreshToken) {
            this.refreshToken = refreshToken;
            return this;
        }

        public PortalClientConfig build() {
            return new PortalClientConfig(this);
        }
    }
}
