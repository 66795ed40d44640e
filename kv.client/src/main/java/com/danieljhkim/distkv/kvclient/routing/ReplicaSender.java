package com.danieljhkim.distkv.kvclient.routing;

import com.danieljhkim.distkv.kvclient.cache.NodeFailureTracker;
import com.danieljhkim.distkv.kvclient.client.RpcOptions;
import com.danieljhkim.distkv.kvclient.client.RpcTransport;
import com.danieljhkim.distkv.kvclient.gossip.NodeAddressResolver;
import com.danieljhkim.distkv.kvcommon.api.KvRequest;
import com.danieljhkim.distkv.kvcommon.api.KvResponse;
import com.danieljhkim.distkv.kvcommon.api.NodeMethod;
import com.danieljhkim.distkv.kvcommon.exception.EmptyReplicaSetException;
import com.danieljhkim.distkv.kvcommon.exception.NoNodeAddressesException;
import com.danieljhkim.distkv.kvcommon.exception.NodeAddressNotFoundException;
import com.danieljhkim.distkv.kvcommon.model.Replica;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Dispatches one operation to the replicas of a range, requiring a single
 * success.
 *
 * <p>
 * Replicas whose node address is not gossiped are skipped, so the fan-out
 * covers whatever subset is currently discoverable. Each target receives its
 * own copy of the request stamped with the replica it addresses.
 */
public class ReplicaSender {

	private static final Logger logger = LoggerFactory.getLogger(ReplicaSender.class);

	private final NodeAddressResolver addressResolver;
	private final RpcTransport transport;
	private final NodeFailureTracker failureTracker;
	private final RpcOptions options;

	public ReplicaSender(
			NodeAddressResolver addressResolver,
			RpcTransport transport,
			NodeFailureTracker failureTracker,
			RpcOptions options) {
		this.addressResolver = addressResolver;
		this.transport = transport;
		this.failureTracker = failureTracker;
		this.options = options;
	}

	/**
	 * Sends {@code request} to the discoverable replicas.
	 *
	 * @return a future failing with {@link EmptyReplicaSetException} (terminal)
	 *         when {@code replicas} is empty, with {@link NoNodeAddressesException}
	 *         (retryable) when no replica address is known, and otherwise
	 *         completing as the transport call does
	 */
	public <Q extends KvRequest<Q>, R extends KvResponse> CompletableFuture<R> send(
			List<Replica> replicas, NodeMethod<Q, R> method, Q request) {
		if (replicas == null || replicas.isEmpty()) {
			return CompletableFuture.failedFuture(
					new EmptyReplicaSetException(method.getFullName() + ": replica set is empty"));
		}

		Map<String, Replica> replicaByAddress = new LinkedHashMap<>();
		for (Replica replica : replicas) {
			String address;
			try {
				address = addressResolver.resolve(replica.nodeId());
			} catch (NodeAddressNotFoundException e) {
				logger.debug("node {} address is not gossiped", replica.nodeId());
				continue;
			}
			Replica previous = replicaByAddress.putIfAbsent(address, replica);
			if (previous != null) {
				logger.debug("Replicas {} and {} share address {}; sending to {}", previous, replica, address, previous);
			}
		}
		if (replicaByAddress.isEmpty()) {
			return CompletableFuture.failedFuture(new NoNodeAddressesException(
					method.getFullName() + ": no replica node addresses available via gossip"));
		}

		Map<String, Q> requests = new LinkedHashMap<>();
		for (String address : failureTracker.orderByHealth(new ArrayList<>(replicaByAddress.keySet()))) {
			requests.put(address, request.withReplica(replicaByAddress.get(address)));
		}

		try {
			return transport.send(requests, method, options);
		} catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}
	}
}
