package com.ctfportal.sdk.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Represents a pair of access and refresh tokens.
 *
 * <p>The refresh endpoint may omit {@code refresh} when it does not rotate the
 * refresh token.</p>
 */
public class TokenPair {

    @JsonProperty("access")
    private String access;

    @JsonProperty("refresh")
    private String refresh;

    // Default constructor for Jackson
    public TokenPair() {}

    public TokenPair(String access, String refresh) {
        this.access = access;
        this.refresh = refresh;
    }

    // Getters
    public String getAccess() {
        return access;
    }

    public String getRefresh() {
        return refresh;
    }

    public TokenPair withAccess(String access) {
        return new TokenPair(access, refresh);
    }

    public TokenPair withRefresh(String refresh) {
        return new TokenPair(access, refresh);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TokenPair that = (TokenPair) o;
        return Objects.equals(access, that.access) && Objects.equals(refresh, that.refresh);
    }

    @Override
    public int hashCode() {
        return Objects.hash(access, refresh);
    }

    @Override
    public String toString() {
        // Never print token values
        return "TokenPair{" +
                "access=" + (access != null ? "***" : "null") +
                ", refresh=" + (refresh != null ? "***" : "null") +
                '}';
    }
}
