package com.ctfportal.sdk.auth;

import com.ctfportal.sdk.models.TokenPair;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-lifetime token store backed by a single atomic reference to an
 * immutable {@link TokenPair}.
 */
public class InMemoryTokenStore implements TokenStore {

    private static final TokenPair EMPTY = new TokenPair(null, null);

    private final AtomicReference<TokenPair> current = new AtomicReference<>(EMPTY);

    public InMemoryTokenStore() {}

    public InMemoryTokenStore(TokenPair initial) {
        if (initial != null) {
            current.set(initial);
        }
    }

    @Override
    public String getAccess() {
        return current.get().getAccess();
    }

    @Override
    public String getRefresh() {
        return current.get().getRefresh();
    }

    @Override
    public void setAccess(String token) {
        current.updateAndGet(pair -> pair.withAccess(token));
    }

    @Override
    public void setRefresh(String token) {
        current.updateAndGet(pair -> pair.withRefresh(token));
    }

    @Override
    public void store(TokenPair pair) {
        current.set(pair != null ? pair : EMPTY);
    }

    @Override
    public TokenPair snapshot() {
        return current.get();
    }

    @Override
    public void clear() {
        current.set(EMPTY);
    }
}
