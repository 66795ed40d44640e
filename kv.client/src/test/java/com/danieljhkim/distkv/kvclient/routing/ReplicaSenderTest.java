package com.danieljhkim.distkv.kvclient.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.danieljhkim.distkv.kvclient.cache.NodeFailureTracker;
import com.danieljhkim.distkv.kvclient.client.RpcOptions;
import com.danieljhkim.distkv.kvclient.fake.FakeCluster;
import com.danieljhkim.distkv.kvclient.fake.InMemoryGossip;
import com.danieljhkim.distkv.kvclient.gossip.NodeAddressResolver;
import com.danieljhkim.distkv.kvclient.retry.RetryPolicy;
import com.danieljhkim.distkv.kvcommon.api.GetRequest;
import com.danieljhkim.distkv.kvcommon.api.NodeMethod;
import com.danieljhkim.distkv.kvcommon.api.PutRequest;
import com.danieljhkim.distkv.kvcommon.exception.EmptyReplicaSetException;
import com.danieljhkim.distkv.kvcommon.exception.NoNodeAddressesException;
import com.danieljhkim.distkv.kvcommon.model.Key;
import com.danieljhkim.distkv.kvcommon.model.Replica;
import com.danieljhkim.distkv.kvcommon.model.Value;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ReplicaSenderTest {

    private static final Replica A = new Replica(1, 1);
    private static final Replica B = new Replica(2, 1);
    private static final Replica C = new Replica(3, 1);

    private final NodeFailureTracker tracker = new NodeFailureTracker(5000);
    private final FakeCluster cluster = new FakeCluster(tracker);
    private final InMemoryGossip gossip = new InMemoryGossip();
    private final ReplicaSender sender = new ReplicaSender(
            new NodeAddressResolver(gossip),
            cluster,
            tracker,
            new RpcOptions(Duration.ofMillis(50), Duration.ofSeconds(2)));

    @AfterEach
    void tearDown() {
        cluster.close();
    }

    @Test
    void sendsOnlyToDiscoverableReplicas() throws Exception {
        gossip.publishNode(2, "b:1");
        GetRequest request = new GetRequest(Key.of("k"));

        sender.send(List.of(A, B, C), NodeMethod.GET, request).get(1, TimeUnit.SECONDS);

        assertEquals(List.of("b:1"), cluster.contactedAddresses());
        assertEquals(B, cluster.receivedRequests().get(0).getReplica());
        assertNull(request.getReplica());
    }

    @Test
    void emptyReplicaSetIsTerminal() {
        gossip.publishNode(1, "a:1");

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> sender.send(List.of(), NodeMethod.GET, new GetRequest(Key.of("k"))).get());

        assertInstanceOf(EmptyReplicaSetException.class, e.getCause());
        assertFalse(RetryPolicy.defaults().isRetryable(e.getCause()));
        assertTrue(cluster.contactedAddresses().isEmpty());
    }

    @Test
    void noAddressesIsRetryable() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> sender.send(List.of(A, B), NodeMethod.GET, new GetRequest(Key.of("k"))).get());

        assertInstanceOf(NoNodeAddressesException.class, e.getCause());
        assertTrue(RetryPolicy.defaults().isRetryable(e.getCause()));
    }

    @Test
    void recentlyFailedReplicaTriedLast() throws Exception {
        gossip.publishNode(1, "a:1").publishNode(2, "b:1");
        tracker.recordFailure("a:1");

        sender.send(List.of(A, B), NodeMethod.PUT, new PutRequest(Key.of("k"), new Value(new byte[] {1}, 1L)))
                .get(1, TimeUnit.SECONDS);

        assertEquals(List.of("b:1"), cluster.contactedAddresses());
    }

    @Test
    void failsOverToNextReplica() throws Exception {
        gossip.publishNode(1, "a:1").publishNode(2, "b:1");
        cluster.takeDown("a:1");

        sender.send(List.of(A, B), NodeMethod.GET, new GetRequest(Key.of("k"))).get(1, TimeUnit.SECONDS);

        assertEquals(List.of("a:1", "b:1"), cluster.contactedAddresses());
        assertEquals(A, cluster.receivedRequests().get(0).getReplica());
        assertEquals(B, cluster.receivedRequests().get(1).getReplica());
        assertTrue(tracker.isRecentlyFailed("a:1"));
    }
}
