package com.ctfportal.sdk.auth;

import com.ctfportal.sdk.models.TokenPair;

/**
 * Holder for the current access/refresh token pair.
 *
 * <p>Implementations do no validation of token contents and must be safe to use
 * from concurrent request threads: every read sees a whole pair, never half of an
 * update.</p>
 */
public interface TokenStore {

    /**
     * Returns the current access token, or {@code null} if none is stored.
     */
    String getAccess();

    /**
     * Returns the current refresh token, or {@code null} if none is stored.
     */
    String getRefresh();

    void setAccess(String token);

    void setRefresh(String token);

    /**
     * Replaces both tokens in one atomic step.
     */
    void store(TokenPair pair);

    /**
     * Returns both tokens as read in one atomic step.
     */
    TokenPair snapshot();

    /**
     * Removes both tokens.
     */
    void clear();
}
