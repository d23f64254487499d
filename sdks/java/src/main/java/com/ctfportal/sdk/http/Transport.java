package com.ctfportal.sdk.http;

import java.io.IOException;

/**
 * Sends one request and returns the response, whatever its status.
 */
@FunctionalInterface
public interface Transport {

    /**
     * @throws IOException if no response was received (offline, DNS, timeout, cancelled call)
     */
    ApiResponse send(RequestDescriptor request) throws IOException;
}
