package com.ctfportal.sdk.http;

import com.ctfportal.sdk.errors.ErrorKind;

/**
 * Receives the user-facing message for a request that failed for good.
 *
 * <p>Called at most once per failed request and never for silent requests or for
 * the internal refresh exchange.</p>
 */
@FunctionalInterface
public interface NotificationSink {

    void notify(ErrorKind kind, String message);
}
