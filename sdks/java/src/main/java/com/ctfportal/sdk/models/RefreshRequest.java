package com.ctfportal.sdk.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for the token refresh exchange.
 */
public class RefreshRequest {

    @JsonProperty("refresh")
    private String refresh;

    // Default constructor for Jackson
    public RefreshRequest() {}

    public RefreshRequest(String refresh) {
        this.refresh = refresh;
    }

    public String getRefresh() {
        return refresh;
    }

    public void setRefresh(String refresh) {
        this.refresh = refresh;
    }
}
