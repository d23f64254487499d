package com.ctfportal.sdk.http;

import com.ctfportal.sdk.auth.InMemoryTokenStore;
import com.ctfportal.sdk.auth.RefreshCoordinator;
import com.ctfportal.sdk.auth.RefreshException;
import com.ctfportal.sdk.auth.RefreshState;
import com.ctfportal.sdk.errors.ErrorClassifier;
import com.ctfportal.sdk.errors.ErrorKind;
import com.ctfportal.sdk.exceptions.AuthenticationException;
import com.ctfportal.sdk.exceptions.NotFoundException;
import com.ctfportal.sdk.exceptions.PortalException;
import com.ctfportal.sdk.exceptions.RateLimitException;
import com.ctfportal.sdk.exceptions.ServerException;
import com.ctfportal.sdk.exceptions.SessionExpiredException;
import com.ctfportal.sdk.models.TokenPair;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class RequestPipelineTest {

    private InMemoryTokenStore tokenStore;
    private List<String> notifications;
    private List<RequestDescriptor> sent;
    private AtomicInteger refreshCalls;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        tokenStore = new InMemoryTokenStore(new TokenPair("access1", "refresh1"));
        notifications = new CopyOnWriteArrayList<>();
        sent = new CopyOnWriteArrayList<>();
        refreshCalls = new AtomicInteger();
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RequestPipeline pipeline(Function<RequestDescriptor, ApiResponse> server, RefreshCoordinator coordinator) {
        Transport transport = request -> {
            sent.add(request);
            return server.apply(request);
        };
        return new RequestPipeline(transport, tokenStore, coordinator,
                new ErrorClassifier(new ObjectMapper()),
                (kind, message) -> notifications.add(kind + ": " + message));
    }

    private RefreshCoordinator refreshingTo(String newAccess) {
        return new RefreshCoordinator(tokenStore, token -> {
            refreshCalls.incrementAndGet();
            return new TokenPair(newAccess, null);
        });
    }

    /** Accepts only the given token; anything else is answered with 401. */
    private static Function<RequestDescriptor, ApiResponse> acceptingOnly(String token) {
        return request -> ("Bearer " + token).equals(request.header("Authorization"))
                ? new ApiResponse(200, "{\"ok\":true}")
                : new ApiResponse(401, "{\"detail\":\"Given token not valid for any token type\"}");
    }

    @Test
    void testAttachesBearerToken() {
        RequestPipeline pipeline = pipeline(acceptingOnly("access1"), refreshingTo("unused"));

        ApiResponse response = pipeline.send(RequestDescriptor.get("/dashboard/"));

        assertEquals(200, response.getStatusCode());
        assertEquals("Bearer access1", sent.get(0).header("Authorization"));
        assertEquals(0, refreshCalls.get());
    }

    @Test
    void testRequestWithoutTokenProceeds() {
        tokenStore.clear();
        RequestPipeline pipeline = pipeline(request -> new ApiResponse(200, "{}"), refreshingTo("unused"));

        pipeline.send(RequestDescriptor.post("/users/token/", "{}"));

        assertNull(sent.get(0).header("Authorization"));
    }

    @Test
    void testNonAuthStatusesAreReturnedAsIs() {
        RequestPipeline pipeline = pipeline(request -> new ApiResponse(500, "oops"), refreshingTo("unused"));

        ApiResponse response = pipeline.send(RequestDescriptor.get("/leaderboard/"));

        assertEquals(500, response.getStatusCode());
        assertEquals(1, sent.size());
        assertTrue(notifications.isEmpty());
    }

    @Test
    void testExpiredTokenIsRefreshedAndReplayed() {
        RequestPipeline pipeline = pipeline(acceptingOnly("access2"), refreshingTo("access2"));

        ApiResponse response = pipeline.send(RequestDescriptor.get("/practice/"));

        assertEquals(200, response.getStatusCode());
        assertEquals(1, refreshCalls.get());
        assertEquals(2, sent.size());
        assertFalse(sent.get(0).isRetried());
        assertTrue(sent.get(1).isRetried());
        assertEquals("Bearer access2", sent.get(1).header("Authorization"));
        assertEquals("access2", tokenStore.getAccess());
        assertTrue(notifications.isEmpty());
    }

    @Test
    void testReplayIsAttemptedOnlyOnce() {
        RequestPipeline pipeline = pipeline(request -> new ApiResponse(401, ""), refreshingTo("access2"));

        AuthenticationException ex = assertThrows(AuthenticationException.class,
                () -> pipeline.send(RequestDescriptor.get("/practice/")));

        assertFalse(ex instanceof SessionExpiredException);
        assertEquals(401, ex.getStatusCode());
        assertEquals(1, refreshCalls.get());
        assertEquals(2, sent.size());
        assertEquals(1, notifications.size());
    }

    @Test
    void testAlreadyRetriedRequestIsNotRefreshedAgain() {
        RequestPipeline pipeline = pipeline(request -> new ApiResponse(401, ""), refreshingTo("access2"));
        RequestDescriptor retried = RequestDescriptor.get("/practice/").markRetried();

        assertThrows(AuthenticationException.class, () -> pipeline.send(retried));

        assertEquals(0, refreshCalls.get());
        assertEquals(1, sent.size());
    }

    @Test
    void testMissingRefreshTokenEndsSession() {
        tokenStore.store(new TokenPair("access1", null));
        RequestPipeline pipeline = pipeline(acceptingOnly("access2"), refreshingTo("access2"));

        SessionExpiredException ex = assertThrows(SessionExpiredException.class,
                () -> pipeline.send(RequestDescriptor.get("/practice/")));

        assertEquals(RefreshException.Reason.NO_REFRESH_TOKEN, ex.getReason());
        assertEquals(ErrorKind.UNAUTHORIZED, ex.getKind());
        assertEquals(0, refreshCalls.get());
        assertNull(tokenStore.getAccess());
        assertNull(tokenStore.getRefresh());
        assertEquals(List.of("UNAUTHORIZED: Your session has expired. Please log in again."), notifications);
    }

    @Test
    void testFailedRefreshEndsSession() {
        RefreshCoordinator coordinator = new RefreshCoordinator(tokenStore, token -> {
            refreshCalls.incrementAndGet();
            throw new RefreshException(RefreshException.Reason.EXCHANGE_FAILED, "Refresh endpoint answered 401", 401, null);
        });
        RequestPipeline pipeline = pipeline(acceptingOnly("access2"), coordinator);

        SessionExpiredException ex = assertThrows(SessionExpiredException.class,
                () -> pipeline.send(RequestDescriptor.get("/practice/")));

        assertEquals(RefreshException.Reason.EXCHANGE_FAILED, ex.getReason());
        assertEquals(1, notifications.size());
        assertNull(tokenStore.getAccess());
        assertEquals(1, sent.size());
    }

    @Test
    void testInterruptedRefreshIsSilentAndKeepsSession() {
        RefreshCoordinator coordinator = new RefreshCoordinator(tokenStore, token -> {
            refreshCalls.incrementAndGet();
            throw new InterruptedIOException("interrupted");
        });
        RequestPipeline pipeline = pipeline(acceptingOnly("access2"), coordinator);

        PortalException ex = assertThrows(PortalException.class,
                () -> pipeline.send(RequestDescriptor.get("/practice/")));

        assertFalse(ex instanceof SessionExpiredException);
        assertTrue(ex.isCancelled());
        assertTrue(ex.isSilent());
        assertTrue(notifications.isEmpty());
        assertEquals(1, refreshCalls.get());
        assertEquals("access1", tokenStore.getAccess());
        assertEquals("refresh1", tokenStore.getRefresh());
    }

    @Test
    void testSilentRequestSuppressesNotification() {
        tokenStore.store(new TokenPair("access1", null));
        RequestPipeline pipeline = pipeline(acceptingOnly("access2"), refreshingTo("access2"));
        RequestDescriptor silent = RequestDescriptor.builder().url("/practice/").header("X-Silent-Error", "1").build();

        assertThrows(SessionExpiredException.class, () -> pipeline.send(silent));

        assertTrue(notifications.isEmpty());
    }

    @Test
    void testTransportFailureIsClassifiedAndNotified() {
        Transport offline = request -> {
            throw new ConnectException("Connection refused");
        };
        RequestPipeline offlinePipeline = new RequestPipeline(offline, tokenStore, refreshingTo("unused"),
                new ErrorClassifier(new ObjectMapper()), (kind, message) -> notifications.add(kind + ": " + message));

        PortalException ex = assertThrows(PortalException.class,
                () -> offlinePipeline.send(RequestDescriptor.get("/practice/")));

        assertEquals(ErrorKind.NETWORK, ex.getKind());
        assertInstanceOf(ConnectException.class, ex.getCause());
        assertEquals(1, notifications.size());
        assertTrue(notifications.get(0).startsWith("NETWORK: "));
    }

    @Test
    void testCancelledTransportIsSilent() {
        Transport cancelled = request -> {
            throw new IOException("Canceled");
        };
        RequestPipeline pipeline = new RequestPipeline(cancelled, tokenStore, refreshingTo("unused"),
                new ErrorClassifier(new ObjectMapper()), (kind, message) -> notifications.add(message));

        PortalException ex = assertThrows(PortalException.class,
                () -> pipeline.send(RequestDescriptor.get("/practice/")));

        assertTrue(ex.isCancelled());
        assertTrue(notifications.isEmpty());
    }

    @Test
    void testSendCheckedRaisesForStatus() {
        Map<String, ApiResponse> routes = Map.of(
                "/missing/", new ApiResponse(404, "{\"detail\":\"Not found.\"}"),
                "/busy/", new ApiResponse(429, Map.of("Retry-After", List.of("30")), ""),
                "/broken/", new ApiResponse(500, "<html><body>Server Error</body></html>"),
                "/denied/", new ApiResponse(403, ""));
        RequestPipeline pipeline = pipeline(request -> routes.get(request.getUrl()), refreshingTo("unused"));

        NotFoundException notFound = assertThrows(NotFoundException.class,
                () -> pipeline.sendChecked(RequestDescriptor.get("/missing/")));
        assertEquals("Not found.", notFound.getMessage());

        RateLimitException rateLimited = assertThrows(RateLimitException.class,
                () -> pipeline.sendChecked(RequestDescriptor.get("/busy/")));
        assertEquals(30L, rateLimited.getRetryAfter());

        ServerException server = assertThrows(ServerException.class,
                () -> pipeline.sendChecked(RequestDescriptor.get("/broken/")));
        assertEquals("Server error. Please try again in a bit.", server.getMessage());

        PortalException forbidden = assertThrows(PortalException.class,
                () -> pipeline.sendChecked(RequestDescriptor.get("/denied/")));
        assertTrue(forbidden.isForbidden());

        assertEquals(4, notifications.size());
    }

    @Test
    void testConcurrentUnauthorizedRequestsShareOneRefresh() throws Exception {
        int requests = 6;
        CountDownLatch release = new CountDownLatch(1);
        RefreshCoordinator[] holder = new RefreshCoordinator[1];
        RefreshCoordinator coordinator = new RefreshCoordinator(tokenStore, token -> {
            refreshCalls.incrementAndGet();
            waitUntil(() -> holder[0].getPendingWaiters() == requests - 1);
            awaitLatch(release);
            return new TokenPair("access2", null);
        });
        holder[0] = coordinator;
        RequestPipeline pipeline = pipeline(acceptingOnly("access2"), coordinator);

        List<Future<ApiResponse>> results = new ArrayList<>();
        for (int i = 0; i < requests; i++) {
            String url = "/challenge/" + i + "/";
            results.add(executor.submit(() -> pipeline.send(RequestDescriptor.get(url))));
        }
        release.countDown();

        for (Future<ApiResponse> result : results) {
            assertEquals(200, result.get(10, TimeUnit.SECONDS).getStatusCode());
        }
        assertEquals(1, refreshCalls.get());
        assertEquals(requests * 2, sent.size());
        long replayedWithNewToken = sent.stream()
                .filter(RequestDescriptor::isRetried)
                .filter(r -> "Bearer access2".equals(r.header("Authorization")))
                .count();
        assertEquals(requests, replayedWithNewToken);
        assertTrue(notifications.isEmpty());
        assertEquals(RefreshState.IDLE, coordinator.getState());
    }

    @Test
    void testTwoRequestsFailingTogetherAreBothReplayed() throws Exception {
        CountDownLatch bothRejected = new CountDownLatch(2);
        Function<RequestDescriptor, ApiResponse> server = request -> {
            if ("Bearer access2".equals(request.header("Authorization"))) {
                return new ApiResponse(200, "{}");
            }
            bothRejected.countDown();
            return new ApiResponse(401, "");
        };
        RefreshCoordinator coordinator = new RefreshCoordinator(tokenStore, token -> {
            refreshCalls.incrementAndGet();
            awaitLatch(bothRejected);
            return new TokenPair("access2", null);
        });
        RequestPipeline pipeline = pipeline(server, coordinator);

        Future<ApiResponse> a = executor.submit(() -> pipeline.send(RequestDescriptor.get("/a/")));
        Future<ApiResponse> b = executor.submit(() -> pipeline.send(RequestDescriptor.get("/b/")));

        assertEquals(200, a.get(10, TimeUnit.SECONDS).getStatusCode());
        assertEquals(200, b.get(10, TimeUnit.SECONDS).getStatusCode());
        assertEquals(1, refreshCalls.get());
        assertEquals(2, sent.stream().filter(r -> "Bearer access2".equals(r.header("Authorization"))).count());
        assertTrue(notifications.isEmpty());
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void waitUntil(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new IllegalStateException("condition not reached in time");
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
    }
}
