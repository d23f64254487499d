package com.ctfportal.sdk.auth;

/**
 * State of the shared token refresh.
 */
public enum RefreshState {
    IDLE,
    REFRESHING
}
