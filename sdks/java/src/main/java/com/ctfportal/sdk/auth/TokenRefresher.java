package com.ctfportal.sdk.auth;

import com.ctfportal.sdk.models.TokenPair;

import java.io.IOException;

/**
 * Performs the refresh-token exchange against the backend.
 */
@FunctionalInterface
public interface TokenRefresher {

    /**
     * Exchanges a refresh token for a new access token.
     *
     * @param refreshToken the current refresh token
     * @return the new pair; {@code refresh} is {@code null} when the backend did not rotate it
     * @throws IOException if the endpoint could not be reached
     * @throws RefreshException if the endpoint answered with anything other than a usable token
     */
    TokenPair refresh(String refreshToken) throws IOException;
}
