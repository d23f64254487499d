package com.ctfportal.sdk.auth;

import com.ctfportal.sdk.http.ApiResponse;
import com.ctfportal.sdk.http.RequestDescriptor;
import com.ctfportal.sdk.http.Transport;
import com.ctfportal.sdk.models.RefreshRequest;
import com.ctfportal.sdk.models.TokenPair;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Calls the refresh endpoint directly on the transport: {@code POST {refresh}}
 * answered by {@code {access, refresh?}}.
 *
 * <p>The exchange bypasses the request pipeline, so it never carries a bearer
 * token, is never retried and never produces a user notification.</p>
 */
public class HttpTokenRefresher implements TokenRefresher {

    private final Transport transport;
    private final ObjectMapper objectMapper;
    private final String refreshPath;

    public HttpTokenRefresher(Transport transport, ObjectMapper objectMapper, String refreshPath) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.refreshPath = refreshPath;
    }

    @Override
    public TokenPair refresh(String refreshToken) throws IOException {
        RequestDescriptor request = RequestDescriptor.post(refreshPath,
                objectMapper.writeValueAsString(new RefreshRequest(refreshToken)));

        ApiResponse response = transport.send(request);
        if (!response.isSuccessful()) {
            throw new RefreshException(RefreshException.Reason.EXCHANGE_FAILED,
                    "Refresh endpoint answered " + response.getStatusCode(), response.getStatusCode(), null);
        }

        TokenPair pair;
        try {
            pair = objectMapper.readValue(response.getBody(), TokenPair.class);
        } catch (JsonProcessingException e) {
            throw new RefreshException(RefreshException.Reason.EXCHANGE_FAILED,
                    "Refresh response is not a token pair", response.getStatusCode(), e);
        }

        if (pair == null || pair.getAccess() == null || pair.getAccess().isEmpty()) {
            throw new RefreshException(RefreshException.Reason.EXCHANGE_FAILED,
                    "Refresh response carried no access token", response.getStatusCode(), null);
        }
        return pair;
    }
}
