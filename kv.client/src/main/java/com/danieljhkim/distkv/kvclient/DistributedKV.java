package com.danieljhkim.distkv.kvclient;

import com.danieljhkim.distkv.kvclient.cache.NodeFailureTracker;
import com.danieljhkim.distkv.kvclient.cache.RangeLocationCache;
import com.danieljhkim.distkv.kvclient.client.GrpcRpcTransport;
import com.danieljhkim.distkv.kvclient.client.NodeConnectionPool;
import com.danieljhkim.distkv.kvclient.client.RpcOptions;
import com.danieljhkim.distkv.kvclient.client.RpcTransport;
import com.danieljhkim.distkv.kvclient.gossip.GossipClient;
import com.danieljhkim.distkv.kvclient.gossip.NodeAddressResolver;
import com.danieljhkim.distkv.kvclient.retry.RetryPolicy;
import com.danieljhkim.distkv.kvclient.routing.RangeMetadataResolver;
import com.danieljhkim.distkv.kvclient.routing.RangeRouter;
import com.danieljhkim.distkv.kvclient.routing.ReplicaSender;
import com.danieljhkim.distkv.kvcommon.api.AccumulateTSRequest;
import com.danieljhkim.distkv.kvcommon.api.AccumulateTSResponse;
import com.danieljhkim.distkv.kvcommon.api.ContainsRequest;
import com.danieljhkim.distkv.kvcommon.api.ContainsResponse;
import com.danieljhkim.distkv.kvcommon.api.DeleteRangeRequest;
import com.danieljhkim.distkv.kvcommon.api.DeleteRangeResponse;
import com.danieljhkim.distkv.kvcommon.api.DeleteRequest;
import com.danieljhkim.distkv.kvcommon.api.DeleteResponse;
import com.danieljhkim.distkv.kvcommon.api.EndTransactionRequest;
import com.danieljhkim.distkv.kvcommon.api.EndTransactionResponse;
import com.danieljhkim.distkv.kvcommon.api.EnqueueMessageRequest;
import com.danieljhkim.distkv.kvcommon.api.EnqueueMessageResponse;
import com.danieljhkim.distkv.kvcommon.api.EnqueueUpdateRequest;
import com.danieljhkim.distkv.kvcommon.api.EnqueueUpdateResponse;
import com.danieljhkim.distkv.kvcommon.api.GetRequest;
import com.danieljhkim.distkv.kvcommon.api.GetResponse;
import com.danieljhkim.distkv.kvcommon.api.IncrementRequest;
import com.danieljhkim.distkv.kvcommon.api.IncrementResponse;
import com.danieljhkim.distkv.kvcommon.api.KvRequest;
import com.danieljhkim.distkv.kvcommon.api.KvResponse;
import com.danieljhkim.distkv.kvcommon.api.NodeMethod;
import com.danieljhkim.distkv.kvcommon.api.PutRequest;
import com.danieljhkim.distkv.kvcommon.api.PutResponse;
import com.danieljhkim.distkv.kvcommon.api.ReapQueueRequest;
import com.danieljhkim.distkv.kvcommon.api.ReapQueueResponse;
import com.danieljhkim.distkv.kvcommon.api.ResponseError;
import com.danieljhkim.distkv.kvcommon.api.ScanRequest;
import com.danieljhkim.distkv.kvcommon.api.ScanResponse;
import com.danieljhkim.distkv.kvcommon.config.AppConfig;
import com.danieljhkim.distkv.kvcommon.config.ConfigLoader;
import com.danieljhkim.distkv.kvcommon.exception.InvalidRequestException;
import com.danieljhkim.distkv.kvcommon.exception.KvException;
import com.danieljhkim.distkv.kvcommon.exception.OperationNotSupportedException;
import com.danieljhkim.distkv.kvcommon.model.Key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * {@link DistKV} over a range-partitioned cluster.
 *
 * <p>
 * Each call looks up the replicas of the range holding its routing key (via
 * the range cache, or the two-level range metadata) and sends the operation to
 * one of them, retrying through topology changes. Operations spanning several
 * keys are routed by a single key and must not cross a range boundary.
 */
public class DistributedKV implements DistKV, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(DistributedKV.class);

	private final RangeRouter router;
	private final RpcTransport ownedTransport;

	public DistributedKV(RangeRouter router) {
		this(router, null);
	}

	private DistributedKV(RangeRouter router, RpcTransport ownedTransport) {
		this.router = router;
		this.ownedTransport = ownedTransport;
	}

	/**
	 * Creates a gRPC client configured from {@link ConfigLoader#load()}.
	 *
	 * @throws IOException
	 *             if the configuration cannot be found or read
	 */
	public static DistributedKV create(GossipClient gossip) throws IOException {
		return create(gossip, ConfigLoader.load());
	}

	/**
	 * Creates a client that reaches storage nodes over gRPC.
	 */
	public static DistributedKV create(GossipClient gossip, AppConfig config) {
		AppConfig.TransportConfig transportConfig = config.getTransport();
		NodeFailureTracker failureTracker = new NodeFailureTracker(transportConfig.getNodeFailureTtlMs());
		GrpcRpcTransport transport = new GrpcRpcTransport(new NodeConnectionPool(), failureTracker);
		return new DistributedKV(buildRouter(gossip, transport, failureTracker, config), transport);
	}

	/**
	 * Creates a client on a caller-owned transport, which is not closed with the
	 * client.
	 */
	public static DistributedKV create(GossipClient gossip, RpcTransport transport, AppConfig config) {
		NodeFailureTracker failureTracker = new NodeFailureTracker(config.getTransport().getNodeFailureTtlMs());
		return new DistributedKV(buildRouter(gossip, transport, failureTracker, config), null);
	}

	private static RangeRouter buildRouter(
			GossipClient gossip, RpcTransport transport, NodeFailureTracker failureTracker, AppConfig config) {
		RpcOptions options = new RpcOptions(
				Duration.ofMillis(config.getTransport().getSendNextTimeoutMs()),
				Duration.ofMillis(config.getTransport().getRpcTimeoutMs()));
		RangeLocationCache cache = new RangeLocationCache(config.getRangeCache().getCapacity());
		ReplicaSender sender = new ReplicaSender(new NodeAddressResolver(gossip), transport, failureTracker, options);
		RangeMetadataResolver resolver = new RangeMetadataResolver(gossip, sender, cache);
		return new RangeRouter(
				resolver,
				sender,
				cache,
				RetryPolicy.fromConfig(config.getRouter()),
				config.getRouter().getSchedulerThreads());
	}

	@Override
	public CompletableFuture<ContainsResponse> contains(ContainsRequest args) {
		return route(args.getKey(), NodeMethod.CONTAINS, args);
	}

	@Override
	public CompletableFuture<GetResponse> get(GetRequest args) {
		return route(args.getKey(), NodeMethod.GET, args);
	}

	@Override
	public CompletableFuture<PutResponse> put(PutRequest args) {
		return route(args.getKey(), NodeMethod.PUT, args);
	}

	@Override
	public CompletableFuture<IncrementResponse> increment(IncrementRequest args) {
		return route(args.getKey(), NodeMethod.INCREMENT, args);
	}

	@Override
	public CompletableFuture<DeleteResponse> delete(DeleteRequest args) {
		return route(args.getKey(), NodeMethod.DELETE, args);
	}

	@Override
	public CompletableFuture<DeleteRangeResponse> deleteRange(DeleteRangeRequest args) {
		// TODO: split [startKey, endKey) across the ranges it spans
		return route(args.getStartKey(), NodeMethod.DELETE_RANGE, args);
	}

	@Override
	public CompletableFuture<ScanResponse> scan(ScanRequest args) {
		return unsupported(NodeMethod.SCAN);
	}

	@Override
	public CompletableFuture<EndTransactionResponse> endTransaction(EndTransactionRequest args) {
		if (args.getKeys() == null || args.getKeys().isEmpty()) {
			return failed(NodeMethod.END_TRANSACTION,
					new InvalidRequestException("EndTransaction requires at least one key"));
		}
		return route(args.getKeys().get(0), NodeMethod.END_TRANSACTION, args);
	}

	@Override
	public CompletableFuture<AccumulateTSResponse> accumulateTS(AccumulateTSRequest args) {
		return route(args.getKey(), NodeMethod.ACCUMULATE_TS, args);
	}

	@Override
	public CompletableFuture<ReapQueueResponse> reapQueue(ReapQueueRequest args) {
		return route(args.getInbox(), NodeMethod.REAP_QUEUE, args);
	}

	@Override
	public CompletableFuture<EnqueueUpdateResponse> enqueueUpdate(EnqueueUpdateRequest args) {
		// queued updates belong under system-reserved keys that are not allocated yet
		return unsupported(NodeMethod.ENQUEUE_UPDATE);
	}

	@Override
	public CompletableFuture<EnqueueMessageResponse> enqueueMessage(EnqueueMessageRequest args) {
		return route(args.getInbox(), NodeMethod.ENQUEUE_MESSAGE, args);
	}

	private <Q extends KvRequest<Q>, R extends KvResponse> CompletableFuture<R> route(
			Key key, NodeMethod<Q, R> method, Q args) {
		if (key == null) {
			return failed(method, new InvalidRequestException(method.getFullName() + ": routing key is missing"));
		}
		return router.route(key, method, args);
	}

	private static <R extends KvResponse> CompletableFuture<R> unsupported(NodeMethod<?, R> method) {
		logger.warn("{} was called but is not supported by the distributed client", method);
		return failed(method, new OperationNotSupportedException(method.getName()));
	}

	private static <R extends KvResponse> CompletableFuture<R> failed(NodeMethod<?, R> method, KvException error) {
		R response = method.newResponse();
		response.setError(ResponseError.from(error));
		return CompletableFuture.completedFuture(response);
	}

	@Override
	public void close() {
		router.close();
		if (ownedTransport != null) {
			ownedTransport.close();
		}
	}
}
