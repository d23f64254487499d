package com.ctfportal.sdk.auth;

import com.ctfportal.sdk.models.TokenPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-flight token refresh shared by every request of one client.
 *
 * <p>The first caller that finds the coordinator {@link RefreshState#IDLE} moves it
 * to {@link RefreshState#REFRESHING} and performs the one backend exchange. Callers
 * arriving meanwhile are queued as waiters and released in FIFO order with the same
 * token, or the same {@link RefreshException}, when the exchange completes. The
 * lock guards the state, the waiter queue and the token store writes made here; it
 * is never held during the exchange itself.</p>
 *
 * <p>If the leading caller is interrupted mid-exchange, only that caller fails with a
 * {@link CancellationException}. The stored tokens are kept and the queued callers
 * start over, one of them leading a new exchange.</p>
 */
public class RefreshCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(RefreshCoordinator.class);

    private final TokenStore tokenStore;
    private final TokenRefresher refresher;

    private final ReentrantLock lock = new ReentrantLock();
    // guarded by lock
    private RefreshState state = RefreshState.IDLE;
    // guarded by lock; empty whenever state is IDLE
    private final Deque<CompletableFuture<String>> waiters = new ArrayDeque<>();

    public RefreshCoordinator(TokenStore tokenStore, TokenRefresher refresher) {
        this.tokenStore = tokenStore;
        this.refresher = refresher;
    }

    /**
     * Obtains a new access token, performing or joining a refresh.
     *
     * @return the new access token
     * @throws RefreshException if no refresh token is stored or the exchange failed;
     *                          the token store is cleared in both cases
     * @throws CancellationException if the calling thread was interrupted while queued
     */
    public String obtainFreshToken() {
        return obtainFreshToken(null);
    }

    /**
     * Like {@link #obtainFreshToken()}, but when no refresh is running and the stored
     * access token already differs from {@code rejectedAccess}, that stored token is
     * returned without contacting the backend: another request refreshed it first.
     *
     * @param rejectedAccess the access token the failed request carried, or {@code null}
     */
    public String obtainFreshToken(String rejectedAccess) {
        CompletableFuture<String> waiter = null;
        String refreshToken = null;

        lock.lock();
        try {
            if (state == RefreshState.REFRESHING) {
                waiter = new CompletableFuture<>();
                waiters.addLast(waiter);
            } else {
                String currentAccess = tokenStore.getAccess();
                if (rejectedAccess != null && currentAccess != null && !currentAccess.equals(rejectedAccess)) {
                    logger.debug("Access token already replaced, skipping refresh");
                    return currentAccess;
                }

                refreshToken = tokenStore.getRefresh();
                if (refreshToken == null || refreshToken.isEmpty()) {
                    RefreshException missing = new RefreshException(RefreshException.Reason.NO_REFRESH_TOKEN,
                            "No refresh token available");
                    clearStore(missing);
                    logger.warn("No refresh token available, session cleared");
                    throw missing;
                }
                state = RefreshState.REFRESHING;
            }
        } finally {
            lock.unlock();
        }

        if (waiter != null) {
            return await(waiter, rejectedAccess);
        }
        return lead(refreshToken);
    }

    /**
     * Current state, for diagnostics.
     */
    public RefreshState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of callers queued behind the running refresh.
     */
    public int getPendingWaiters() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    List<CompletableFuture<String>> snapshotWaiters() {
        lock.lock();
        try {
            return new ArrayList<>(waiters);
        } finally {
            lock.unlock();
        }
    }

    private String lead(String refreshToken) {
        try {
            TokenPair result = refresher.refresh(refreshToken);
            if (result == null || result.getAccess() == null || result.getAccess().isEmpty()) {
                throw new RefreshException(RefreshException.Reason.EXCHANGE_FAILED,
                        "Refresh returned no access token");
            }

            String access = result.getAccess();
            boolean rotated = result.getRefresh() != null && !result.getRefresh().isEmpty();
            List<CompletableFuture<String>> released;

            lock.lock();
            try {
                tokenStore.store(new TokenPair(access, rotated ? result.getRefresh() : refreshToken));
                state = RefreshState.IDLE;
                released = drainWaiters();
            } finally {
                lock.unlock();
            }

            logger.info("Access token refreshed{}, releasing {} queued request(s)",
                    rotated ? " (refresh token rotated)" : "", released.size());
            for (CompletableFuture<String> waiter : released) {
                waiter.complete(access);
            }
            return access;
        } catch (RefreshException e) {
            throw fail(e);
        } catch (IOException | RuntimeException e) {
            if (isInterruption(e)) {
                throw abandon(e);
            }
            throw fail(new RefreshException(RefreshException.Reason.EXCHANGE_FAILED,
                    "Token refresh failed: " + e.getMessage(), e));
        } catch (Error e) {
            // Queued callers must not be left waiting
            fail(new RefreshException(RefreshException.Reason.EXCHANGE_FAILED, "Token refresh failed", e));
            throw e;
        }
    }

    private RefreshException fail(RefreshException failure) {
        List<CompletableFuture<String>> released;

        lock.lock();
        try {
            clearStore(failure);
            state = RefreshState.IDLE;
            released = drainWaiters();
        } finally {
            lock.unlock();
        }

        logger.warn("Token refresh failed ({}), session cleared, rejecting {} queued request(s)",
                failure.getReason(), released.size());
        for (CompletableFuture<String> waiter : released) {
            waiter.completeExceptionally(failure);
        }
        return failure;
    }

    private CancellationException abandon(Exception cause) {
        List<CompletableFuture<String>> released;

        lock.lock();
        try {
            state = RefreshState.IDLE;
            released = drainWaiters();
        } finally {
            lock.unlock();
        }

        logger.info("Token refresh abandoned by an interrupted caller, {} queued request(s) will retry",
                released.size());
        RefreshAbandonedException abandoned = new RefreshAbandonedException();
        for (CompletableFuture<String> waiter : released) {
            waiter.completeExceptionally(abandoned);
        }

        CancellationException cancelled = new CancellationException("Interrupted during token refresh");
        cancelled.initCause(cause);
        return cancelled;
    }

    // Caller holds the lock
    private void clearStore(RefreshException failure) {
        try {
            tokenStore.clear();
        } catch (RuntimeException e) {
            logger.warn("Failed to clear token store after refresh failure", e);
            failure.addSuppressed(e);
        }
    }

    private static boolean isInterruption(Throwable error) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        Throwable current = error;
        while (current != null && current.getCause() != current) {
            if (current instanceof InterruptedException) {
                return true;
            }
            if (current instanceof InterruptedIOException && !(current instanceof SocketTimeoutException)) {
                String msg = current.getMessage();
                return msg == null || !msg.toLowerCase(Locale.ROOT).contains("timeout");
            }
            current = current.getCause();
        }
        return false;
    }

    private List<CompletableFuture<String>> drainWaiters() {
        List<CompletableFuture<String>> drained = new ArrayList<>(waiters);
        waiters.clear();
        return drained;
    }

    private String await(CompletableFuture<String> waiter, String rejectedAccess) {
        try {
            return waiter.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // Completing an abandoned waiter later is a no-op
            waiter.cancel(false);
            throw new CancellationException("Interrupted while waiting for token refresh");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RefreshAbandonedException) {
                return obtainFreshToken(rejectedAccess);
            }
            if (cause instanceof RefreshException) {
                throw (RefreshException) cause;
            }
            throw new RefreshException(RefreshException.Reason.EXCHANGE_FAILED,
                    "Token refresh failed", cause);
        }
    }

    /**
     * Releases waiters whose leader was interrupted so they can start over.
     */
    private static final class RefreshAbandonedException extends RuntimeException {
        RefreshAbandonedException() {
            super("Token refresh abandoned", null, false, false);
        }
    }
}
