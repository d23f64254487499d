package com.ctfportal.sdk.http;

import com.ctfportal.sdk.auth.RefreshCoordinator;
import com.ctfportal.sdk.auth.RefreshException;
import com.ctfportal.sdk.auth.TokenStore;
import com.ctfportal.sdk.errors.ClassifiedError;
import com.ctfportal.sdk.errors.ErrorClassifier;
import com.ctfportal.sdk.errors.RawFailure;
import com.ctfportal.sdk.exceptions.AuthenticationException;
import com.ctfportal.sdk.exceptions.NotFoundException;
import com.ctfportal.sdk.exceptions.PortalException;
import com.ctfportal.sdk.exceptions.RateLimitException;
import com.ctfportal.sdk.exceptions.ServerException;
import com.ctfportal.sdk.exceptions.SessionExpiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CancellationException;

/**
 * Sends requests with the current bearer token and recovers from an expired one.
 *
 * <p>A 401 answer triggers one shared token refresh through the
 * {@link RefreshCoordinator}, after which the request is replayed exactly once
 * with the new token. Every terminal failure is classified, reported to the
 * {@link NotificationSink} once unless the request is silent, and thrown as a
 * {@link PortalException}.</p>
 */
public class RequestPipeline {

    private static final Logger logger = LoggerFactory.getLogger(RequestPipeline.class);
    private static final int UNAUTHORIZED = 401;

    private final Transport transport;
    private final TokenStore tokenStore;
    private final RefreshCoordinator refreshCoordinator;
    private final ErrorClassifier classifier;
    private final NotificationSink notificationSink;

    public RequestPipeline(Transport transport,
                           TokenStore tokenStore,
                           RefreshCoordinator refreshCoordinator,
                           ErrorClassifier classifier,
                           NotificationSink notificationSink) {
        this.transport = transport;
        this.tokenStore = tokenStore;
        this.refreshCoordinator = refreshCoordinator;
        this.classifier = classifier;
        this.notificationSink = notificationSink;
    }

    /**
     * Sends a request, refreshing the token and replaying once on 401.
     *
     * <p>Any response other than 401 is returned as is, whatever its status.</p>
     *
     * @throws SessionExpiredException if the token could not be refreshed
     * @throws AuthenticationException if the request is still unauthorized after the replay
     * @throws PortalException if no response was received
     */
    public ApiResponse send(RequestDescriptor request) {
        RequestDescriptor outgoing = authorize(request);
        ApiResponse response = transmit(outgoing);

        if (response.getStatusCode() != UNAUTHORIZED) {
            return response;
        }
        if (outgoing.isRetried()) {
            throw surface(classifier.classify(RawFailure.ofResponse(outgoing, response)), response, null);
        }

        RequestDescriptor replay = outgoing.markRetried();
        String freshToken;
        try {
            freshToken = refreshCoordinator.obtainFreshToken(outgoing.bearerToken());
        } catch (RefreshException e) {
            ClassifiedError error = classifier.sessionExpired(replay, response.getStatusCode());
            notifyUser(error);
            throw new SessionExpiredException(error, e);
        } catch (CancellationException e) {
            throw surface(classifier.classify(RawFailure.ofError(replay, e)), null, e);
        }

        logger.debug("Replaying {} {} with refreshed token", replay.getMethod(), replay.getUrl());
        ApiResponse replayed = transmit(replay.withBearer(freshToken));
        if (replayed.getStatusCode() == UNAUTHORIZED) {
            throw surface(classifier.classify(RawFailure.ofResponse(replay, replayed)), replayed, null);
        }
        return replayed;
    }

    /**
     * Like {@link #send}, but a final response outside 2xx is also a terminal failure.
     */
    public ApiResponse sendChecked(RequestDescriptor request) {
        ApiResponse response = send(request);
        if (!response.isSuccessful()) {
            throw surface(classifier.classify(RawFailure.ofResponse(request, response)), response, null);
        }
        return response;
    }

    private RequestDescriptor authorize(RequestDescriptor request) {
        String access = tokenStore.getAccess();
        if (access == null || access.isEmpty()) {
            return request;
        }
        return request.withBearer(access);
    }

    private ApiResponse transmit(RequestDescriptor request) {
        try {
            return transport.send(request);
        } catch (IOException e) {
            throw surface(classifier.classify(RawFailure.ofError(request, e)), null, e);
        }
    }

    private PortalException surface(ClassifiedError error, ApiResponse response, Throwable cause) {
        notifyUser(error);
        return toException(error, response, cause);
    }

    private void notifyUser(ClassifiedError error) {
        if (error.isSilent()) {
            logger.debug("Suppressed notification for silent request: {}", error);
            return;
        }
        try {
            notificationSink.notify(error.getKind(), error.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Notification sink failed for {}", error, e);
        }
    }

    private static PortalException toException(ClassifiedError error, ApiResponse response, Throwable cause) {
        switch (error.getKind()) {
            case UNAUTHORIZED:
                return new AuthenticationException(error, cause);
            case NOT_FOUND:
                return new NotFoundException(error);
            case RATE_LIMITED:
                return new RateLimitException(error,
                        response != null ? RateLimitException.parseRetryAfter(response.header("Retry-After")) : null);
            case SERVER_ERROR:
                return new ServerException(error);
            default:
                return new PortalException(error, cause);
        }
    }
}
