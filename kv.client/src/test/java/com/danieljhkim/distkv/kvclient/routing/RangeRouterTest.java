package com.danieljhkim.distkv.kvclient.routing;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.danieljhkim.distkv.kvclient.fake.ClusterFixture;
import com.danieljhkim.distkv.kvclient.retry.RetryPolicy;
import com.danieljhkim.distkv.kvcommon.api.GetRequest;
import com.danieljhkim.distkv.kvcommon.api.GetResponse;
import com.danieljhkim.distkv.kvcommon.api.NodeMethod;
import com.danieljhkim.distkv.kvcommon.api.PutRequest;
import com.danieljhkim.distkv.kvcommon.api.PutResponse;
import com.danieljhkim.distkv.kvcommon.api.ResponseError;
import com.danieljhkim.distkv.kvcommon.model.Key;
import com.danieljhkim.distkv.kvcommon.model.KeyPrefixes;
import com.danieljhkim.distkv.kvcommon.model.RangeLocations;
import com.danieljhkim.distkv.kvcommon.model.Replica;
import com.danieljhkim.distkv.kvcommon.model.Value;
import io.grpc.Status;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RangeRouterTest {

    private final ClusterFixture fixture = new ClusterFixture();
    private RangeRouter router;

    @AfterEach
    void tearDown() {
        if (router != null) {
            router.close();
        }
        fixture.close();
    }

    private RangeRouter router(RetryPolicy policy) {
        router = fixture.newRouter(policy);
        return router;
    }

    private static PutRequest put(String key, int value) {
        return new PutRequest(Key.of(key), new Value(new byte[] {(byte) value}, 1L));
    }

    @Test
    void routesToOwningRange() throws Exception {
        fixture.withStandardLayout();
        RangeRouter router = router(ClusterFixture.fastRetries());

        PutResponse put = router.route(Key.of("zebra"), NodeMethod.PUT, put("zebra", 7)).get(1, TimeUnit.SECONDS);
        GetResponse get = router.route(Key.of("zebra"), NodeMethod.GET, new GetRequest(Key.of("zebra")))
                .get(1, TimeUnit.SECONDS);

        assertFalse(put.hasError());
        assertArrayEquals(new byte[] {7}, get.getValue().getBytes());
        assertTrue(fixture.cluster.contactedAddresses().contains(ClusterFixture.address(3)));
        assertFalse(fixture.cluster.contactedAddresses().contains(ClusterFixture.address(2)));
    }

    @Test
    void transientFailuresRetriedUntilSuccess() throws Exception {
        fixture.withStandardLayout();
        RangeRouter router = router(ClusterFixture.fastRetries());
        router.route(Key.of("a"), NodeMethod.PUT, put("a", 1)).get(1, TimeUnit.SECONDS);
        fixture.cluster.failNext(NodeMethod.GET, 3, Status.Code.UNAVAILABLE);

        GetResponse response = router.route(Key.of("a"), NodeMethod.GET, new GetRequest(Key.of("a")))
                .get(2, TimeUnit.SECONDS);

        assertFalse(response.hasError());
        assertArrayEquals(new byte[] {1}, response.getValue().getBytes());
        assertEquals(4, fixture.cluster.callCount(NodeMethod.GET));
    }

    @Test
    void failedDispatchEvictsCachedRange() throws Exception {
        fixture.withStandardLayout();
        RangeRouter router = router(ClusterFixture.fastRetries());
        router.route(Key.of("a"), NodeMethod.PUT, put("a", 1)).get(1, TimeUnit.SECONDS);
        assertEquals(2, fixture.cluster.callCount(NodeMethod.INTERNAL_RANGE_LOOKUP));

        fixture.cluster.failNext(NodeMethod.GET, 1, Status.Code.UNAVAILABLE);
        router.route(Key.of("a"), NodeMethod.GET, new GetRequest(Key.of("a"))).get(1, TimeUnit.SECONDS);

        // second attempt re-resolved the range
        assertEquals(4, fixture.cluster.callCount(NodeMethod.INTERNAL_RANGE_LOOKUP));
    }

    @Test
    void rangeMoveIsPickedUpOnRetry() throws Exception {
        fixture.withStandardLayout();
        RangeRouter router = router(ClusterFixture.fastRetries());
        router.route(Key.of("a"), NodeMethod.PUT, put("a", 1)).get(1, TimeUnit.SECONDS);

        fixture.cluster.takeDown(ClusterFixture.address(2));
        fixture.cluster.putLocations(Key.make(KeyPrefixes.META2, ClusterFixture.SPLIT),
                RangeLocations.startingAt(Key.MIN, List.of(Replica.onNode(3))));

        GetResponse response = router.route(Key.of("a"), NodeMethod.GET, new GetRequest(Key.of("a")))
                .get(2, TimeUnit.SECONDS);

        assertFalse(response.hasError());
        assertEquals(List.of(Replica.onNode(3)), fixture.cache.lookup(Key.of("a")).orElseThrow().replicas());
    }

    @Test
    void movedRangeRejectionReroutes() throws Exception {
        fixture.withStandardLayout();
        RangeRouter router = router(ClusterFixture.fastRetries());
        router.route(Key.of("a"), NodeMethod.PUT, put("a", 1)).get(1, TimeUnit.SECONDS);

        fixture.cluster.putLocations(Key.make(KeyPrefixes.META2, ClusterFixture.SPLIT),
                RangeLocations.startingAt(Key.MIN, List.of(Replica.onNode(3))));
        fixture.cluster.rejectAt(ClusterFixture.address(2),
                new ResponseError(Status.Code.FAILED_PRECONDITION, "range not held by node 2", true));

        GetResponse response = router.route(Key.of("a"), NodeMethod.GET, new GetRequest(Key.of("a")))
                .get(2, TimeUnit.SECONDS);

        assertFalse(response.hasError());
        assertArrayEquals(new byte[] {1}, response.getValue().getBytes());
        assertEquals(List.of(Replica.onNode(3)), fixture.cache.lookup(Key.of("a")).orElseThrow().replicas());
    }

    @Test
    void nonRetryableNodeErrorIsReturnedAndEvicts() throws Exception {
        fixture.withStandardLayout();
        RangeRouter router = router(ClusterFixture.fastRetries());
        router.route(Key.of("a"), NodeMethod.PUT, put("a", 1)).get(1, TimeUnit.SECONDS);
        fixture.cluster.rejectAt(ClusterFixture.address(2),
                new ResponseError(Status.Code.PERMISSION_DENIED, "read denied", false));

        GetResponse response = router.route(Key.of("a"), NodeMethod.GET, new GetRequest(Key.of("a")))
                .get(1, TimeUnit.SECONDS);

        assertEquals(Status.Code.PERMISSION_DENIED, response.getError().getCode());
        assertEquals("read denied", response.getError().getMessage());
        assertEquals(1, fixture.cluster.callCount(NodeMethod.GET));
        assertTrue(fixture.cache.lookup(Key.of("a")).isEmpty());
    }

    @Test
    void openEndedEntriesDoNotShadowHigherRanges() throws Exception {
        fixture.withStandardLayout();
        fixture.cluster.omitLookupMetadataKeys();
        RangeRouter router = router(ClusterFixture.fastRetries());

        router.route(Key.of("a"), NodeMethod.GET, new GetRequest(Key.of("a"))).get(1, TimeUnit.SECONDS);
        router.route(Key.of("z"), NodeMethod.GET, new GetRequest(Key.of("z"))).get(1, TimeUnit.SECONDS);

        List<String> contacted = fixture.cluster.contactedAddresses();
        assertEquals(ClusterFixture.address(2), contacted.get(2));
        assertEquals(ClusterFixture.address(3), contacted.get(5));
    }

    @Test
    void terminalFailureEndsAfterOneAttempt() throws Exception {
        fixture.withStandardLayout();
        RangeRouter router = router(ClusterFixture.fastRetries());
        fixture.cluster.failNext(NodeMethod.GET, 1, Status.Code.PERMISSION_DENIED);

        GetResponse response = router.route(Key.of("a"), NodeMethod.GET, new GetRequest(Key.of("a")))
                .get(1, TimeUnit.SECONDS);

        assertTrue(response.hasError());
        assertEquals(Status.Code.PERMISSION_DENIED, response.getError().getCode());
        assertNull(response.getValue());
        assertEquals(1, fixture.cluster.callCount(NodeMethod.GET));
    }

    @Test
    void emptyReplicaSetIsTerminal() throws Exception {
        fixture.withStandardLayout();
        fixture.cluster.putLocations(Key.make(KeyPrefixes.META2, ClusterFixture.SPLIT),
                RangeLocations.startingAt(Key.MIN, List.of()));
        RangeRouter router = router(ClusterFixture.fastRetries());

        GetResponse response = router.route(Key.of("a"), NodeMethod.GET, new GetRequest(Key.of("a")))
                .get(1, TimeUnit.SECONDS);

        assertEquals(Status.Code.DATA_LOSS, response.getError().getCode());
        assertEquals(0, fixture.cluster.callCount(NodeMethod.GET));
    }

    @Test
    void waitsForFirstRangeGossip() throws Exception {
        RangeRouter router = router(ClusterFixture.fastRetries());

        CompletableFuture<GetResponse> pending =
                router.route(Key.of("a"), NodeMethod.GET, new GetRequest(Key.of("a")));
        Thread.sleep(50);
        assertFalse(pending.isDone());

        fixture.withStandardLayout();

        assertFalse(pending.get(2, TimeUnit.SECONDS).hasError());
    }

    @Test
    void attemptLimitEndsRetries() throws Exception {
        fixture.withStandardLayout();
        fixture.cluster.takeDown(ClusterFixture.address(2));
        RangeRouter router = router(RetryPolicy.builder().initialBackoffMs(1).maxBackoffMs(5).maxAttempts(3).build());

        GetResponse response = router.route(Key.of("a"), NodeMethod.GET, new GetRequest(Key.of("a")))
                .get(2, TimeUnit.SECONDS);

        assertEquals(Status.Code.UNAVAILABLE, response.getError().getCode());
        assertTrue(response.getError().isRetryable());
        assertEquals(3, fixture.cluster.callCount(NodeMethod.GET));
    }

    @Test
    void cancellationStopsRetryLoop() throws Exception {
        RangeRouter router = router(ClusterFixture.fastRetries());
        CompletableFuture<GetResponse> pending =
                router.route(Key.of("a"), NodeMethod.GET, new GetRequest(Key.of("a")));
        Thread.sleep(30);

        pending.cancel(false);
        fixture.withStandardLayout();
        Thread.sleep(100);

        assertTrue(pending.isCancelled());
        assertEquals(0, fixture.cluster.callCount(NodeMethod.INTERNAL_RANGE_LOOKUP));
    }

    @Test
    void concurrentRoutesEachCompleteOnce() throws Exception {
        fixture.withStandardLayout();
        RangeRouter router = router(ClusterFixture.fastRetries());
        fixture.cluster.failNext(NodeMethod.PUT, 10, Status.Code.UNAVAILABLE);

        List<CompletableFuture<PutResponse>> futures = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            String key = (i % 2 == 0 ? "a" : "z") + i;
            futures.add(router.route(Key.of(key), NodeMethod.PUT, put(key, i)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        for (CompletableFuture<PutResponse> future : futures) {
            assertFalse(future.get().hasError());
        }
        assertEquals(60, fixture.cluster.callCount(NodeMethod.PUT));
    }

    @Test
    void closedRouterRejectsWork() throws Exception {
        fixture.withStandardLayout();
        RangeRouter router = router(ClusterFixture.fastRetries());
        router.close();

        GetResponse response = router.route(Key.of("a"), NodeMethod.GET, new GetRequest(Key.of("a")))
                .get(1, TimeUnit.SECONDS);

        assertEquals(Status.Code.INTERNAL, response.getError().getCode());
    }
}
