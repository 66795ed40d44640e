package com.danieljhkim.distkv.kvclient.client;

import com.danieljhkim.distkv.kvcommon.api.KvRequest;
import com.danieljhkim.distkv.kvcommon.api.KvResponse;
import com.danieljhkim.distkv.kvcommon.api.NodeMethod;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Sends one logical RPC to a set of storage node addresses, requiring one of
 * them to succeed.
 */
public interface RpcTransport extends AutoCloseable {

	/**
	 * @param requests
	 *            per-address requests, each already stamped with the replica it
	 *            addresses; iteration order is the order candidates are tried
	 * @return a future completed with the first successful response, or
	 *         exceptionally (typically with an
	 *         {@link com.danieljhkim.distkv.kvcommon.exception.RpcFailureException})
	 *         when no candidate succeeded
	 */
	<Q extends KvRequest<Q>, R extends KvResponse> CompletableFuture<R> send(
			Map<String, Q> requests, NodeMethod<Q, R> method, RpcOptions options);

	@Override
	default void close() {
	}
}
