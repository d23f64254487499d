package com.ctfportal.sdk.client;

import com.ctfportal.sdk.auth.HttpTokenRefresher;
import com.ctfportal.sdk.auth.InMemoryTokenStore;
import com.ctfportal.sdk.auth.RefreshCoordinator;
import com.ctfportal.sdk.auth.TokenStore;
import com.ctfportal.sdk.errors.ErrorClassifier;
import com.ctfportal.sdk.exceptions.PortalException;
import com.ctfportal.sdk.http.ApiResponse;
import com.ctfportal.sdk.http.LoggingNotificationSink;
import com.ctfportal.sdk.http.NotificationSink;
import com.ctfportal.sdk.http.OkHttpTransport;
import com.ctfportal.sdk.http.RequestDescriptor;
import com.ctfportal.sdk.http.RequestPipeline;
import com.ctfportal.sdk.models.TokenPair;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Main client for the CTF portal API.
 *
 * <p>Every call goes through one {@link RequestPipeline}: the stored access token
 * is attached, an expired token is refreshed once for all concurrent callers and
 * the affected requests are replayed. Failures surface as
 * {@link PortalException}s carrying a message that is safe to display.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * PortalClient client = PortalClient.builder()
 *     .baseUrl("https://portal.example.com/api")
 *     .accessToken(login.getAccess())
 *     .refreshToken(login.getRefresh())
 *     .notificationSink((kind, message) -> toaster.error(message))
 *     .build();
 *
 * List<Challenge> challenges = client.get("/practice/", new TypeReference<List<Challenge>>() {});
 *
 * client.close();
 * }</pre>
 */
public class PortalClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PortalClient.class);

    private final PortalClientConfig config;
    private final OkHttpTransport transport;
    private final ObjectMapper objectMapper;
    private final TokenStore tokenStore;
    private final RefreshCoordinator refreshCoordinator;
    private final RequestPipeline pipeline;

    private PortalClient(PortalClientConfig config, TokenStore tokenStore, NotificationSink notificationSink) {
        this.config = config;
        this.tokenStore = tokenStore;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.transport = new OkHttpTransport(config.getBaseUrl(), config.getTimeout());

        if (config.getAccessToken() != null || config.getRefreshToken() != null) {
            tokenStore.store(new TokenPair(config.getAccessToken(), config.getRefreshToken()));
        }

        this.refreshCoordinator = new RefreshCoordinator(tokenStore,
                new HttpTokenRefresher(transport, objectMapper, config.getRefreshPath()));
        this.pipeline = new RequestPipeline(transport, tokenStore, refreshCoordinator,
                new ErrorClassifier(objectMapper, config.getSilentHeader()), notificationSink);
    }

    /**
     * Creates a new client builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a new client with a token pair obtained from the login flow.
     */
    public static PortalClient withTokens(String baseUrl, String accessToken, String refreshToken) {
        return builder()
                .baseUrl(baseUrl)
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .build();
    }

    // ================================
    // Session
    // ================================

    /**
     * Installs the tokens issued by a login.
     */
    public void setTokens(TokenPair tokens) {
        tokenStore.store(tokens);
    }

    /**
     * Forgets the current session locally. The backend is not contacted.
     */
    public void logout() {
        tokenStore.clear();
        logger.debug("Session cleared");
    }

    public boolean isAuthenticated() {
        String access = tokenStore.getAccess();
        return access != null && !access.isEmpty();
    }

    public TokenStore getTokenStore() {
        return tokenStore;
    }

    public RefreshCoordinator getRefreshCoordinator() {
        return refreshCoordinator;
    }

    public PortalClientConfig getConfig() {
        return config;
    }

    // ================================
    // Typed requests
    // ================================

    public <T> T get(String path, Class<T> responseType) {
        return execute(RequestDescriptor.get(path), responseType);
    }

    public <T> T get(String path, TypeReference<T> responseType) {
        return execute(RequestDescriptor.get(path), responseType);
    }

    public <T> CompletableFuture<T> getAsync(String path, Class<T> responseType) {
        return CompletableFuture.supplyAsync(() -> get(path, responseType));
    }

    public <T> T post(String path, Object body, Class<T> responseType) {
        return execute(withJsonBody("POST", path, body), responseType);
    }

    public <T> T post(String path, Object body, TypeReference<T> responseType) {
        return execute(withJsonBody("POST", path, body), responseType);
    }

    public <T> CompletableFuture<T> postAsync(String path, Object body, Class<T> responseType) {
        return CompletableFuture.supplyAsync(() -> post(path, body, responseType));
    }

    public <T> T put(String path, Object body, Class<T> responseType) {
        return execute(withJsonBody("PUT", path, body), responseType);
    }

    public <T> T patch(String path, Object body, Class<T> responseType) {
        return execute(withJsonBody("PATCH", path, body), responseType);
    }

    public void delete(String path) {
        execute(RequestDescriptor.builder().method("DELETE").url(path).build(), Void.class);
    }

    /**
     * Sends a prepared request and maps a 2xx body onto {@code responseType}.
     */
    public <T> T execute(RequestDescriptor request, Class<T> responseType) {
        ApiResponse response = pipeline.sendChecked(request);
        if (responseType == Void.class || response.getBody().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(response.getBody(), responseType);
        } catch (JsonProcessingException e) {
            throw new PortalException("Failed to parse response of " + request.getMethod() + " " + request.getUrl(), e);
        }
    }

    public <T> T execute(RequestDescriptor request, TypeReference<T> responseType) {
        ApiResponse response = pipeline.sendChecked(request);
        if (response.getBody().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(response.getBody(), responseType);
        } catch (JsonProcessingException e) {
            throw new PortalException("Failed to parse response of " + request.getMethod() + " " + request.getUrl(), e);
        }
    }

    // ================================
    // Raw requests
    // ================================

    /**
     * Sends a prepared request; only a 401 that cannot be recovered is raised,
     * every other status is returned for the caller to interpret.
     */
    public ApiResponse send(RequestDescriptor request) {
        return pipeline.send(request);
    }

    public CompletableFuture<ApiResponse> sendAsync(RequestDescriptor request) {
        return CompletableFuture.supplyAsync(() -> send(request));
    }

    private RequestDescriptor withJsonBody(String method, String path, Object body) {
        RequestDescriptor.Builder builder = RequestDescriptor.builder().method(method).url(path);
        if (body != null) {
            try {
                builder.body(objectMapper.writeValueAsString(body));
            } catch (JsonProcessingException e) {
                throw new PortalException("Failed to encode request body for " + method + " " + path, e);
            }
        }
        return builder.build();
    }

    @Override
    public void close() {
        transport.close();
    }

    /**
     * Builder for creating PortalClient instances.
     */
    public static class Builder {
        private final PortalClientConfig.Builder configBuilder = PortalClientConfig.builder();
        private TokenStore tokenStore;
        private NotificationSink notificationSink;

        public Builder baseUrl(String baseUrl) {
            configBuilder.baseUrl(baseUrl);
            return this;
        }

        public Builder timeout(Duration timeout) {
            configBuilder.timeout(timeout);
            return this;
        }

        public Builder refreshPath(String refreshPath) {
            configBuilder.refreshPath(refreshPath);
            return this;
        }

        public Builder silentHeader(String silentHeader) {
            configBuilder.silentHeader(silentHeader);
            return this;
        }

        public Builder accessToken(String accessToken) {
            configBuilder.accessToken(accessToken);
            return this;
        }

        public Builder refreshToken(String refreshToken) {
            configBuilder.refreshToken(refreshToken);
            return this;
        }

        public Builder tokenStore(TokenStore tokenStore) {
            this.tokenStore = tokenStore;
            return this;
        }

        public Builder notificationSink(NotificationSink notificationSink) {
            this.notificationSink = notificationSink;
            return this;
        }

        public PortalClient build() {
            return new PortalClient(configBuilder.build(),
                    tokenStore != null ? tokenStore : new InMemoryTokenStore(),
                    notificationSink != null ? notificationSink : new LoggingNotificationSink());
        }
    }
}
