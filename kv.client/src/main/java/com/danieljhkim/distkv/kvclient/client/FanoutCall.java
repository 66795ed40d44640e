package com.danieljhkim.distkv.kvclient.client;

import com.danieljhkim.distkv.kvclient.cache.NodeFailureTracker;
import com.danieljhkim.distkv.kvclient.retry.RetryPolicy;
import com.danieljhkim.distkv.kvcommon.exception.KvException;
import com.danieljhkim.distkv.kvcommon.exception.NoNodeAddressesException;
import com.danieljhkim.distkv.kvcommon.exception.RpcFailureException;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One RPC fanned out over candidate addresses until a single success.
 *
 * <p>
 * The first candidate is sent immediately. While no reply has arrived, the next
 * candidate is sent every {@code sendNextTimeout}; a failed reply moves on to
 * the next candidate at once. The call completes with the first successful
 * reply, fails with the last error once every candidate has failed, and fails
 * with DEADLINE_EXCEEDED when the overall timeout elapses. Replies arriving
 * after completion are ignored.
 *
 * @param <Q>
 *            request type
 * @param <R>
 *            response type
 */
public final class FanoutCall<Q, R> {

	private static final Logger logger = LoggerFactory.getLogger(FanoutCall.class);

	/**
	 * Sends a request to a single address.
	 */
	@FunctionalInterface
	public interface Invoker<Q, R> {
		CompletableFuture<R> invoke(String address, Q request);
	}

	private final String method;
	private final List<Map.Entry<String, Q>> candidates;
	private final Invoker<Q, R> invoker;
	private final RpcOptions options;
	private final ScheduledExecutorService scheduler;
	private final NodeFailureTracker failureTracker;
	private final CompletableFuture<R> result = new CompletableFuture<>();

	// guarded by this
	private int nextIndex;
	private int failures;

	public FanoutCall(
			String method,
			List<Map.Entry<String, Q>> candidates,
			Invoker<Q, R> invoker,
			RpcOptions options,
			ScheduledExecutorService scheduler,
			NodeFailureTracker failureTracker) {
		this.method = method;
		this.candidates = List.copyOf(candidates);
		this.invoker = invoker;
		this.options = options;
		this.scheduler = scheduler;
		this.failureTracker = failureTracker;
	}

	public CompletableFuture<R> start() {
		if (candidates.isEmpty()) {
			result.completeExceptionally(new NoNodeAddressesException(method + ": no candidate addresses"));
			return result;
		}
		ScheduledFuture<?> deadline = scheduler.schedule(
				() -> result.completeExceptionally(new RpcFailureException(
						Status.Code.DEADLINE_EXCEEDED,
						method + ": no successful reply within " + options.timeout().toMillis() + "ms")),
				options.timeout().toMillis(),
				TimeUnit.MILLISECONDS);
		result.whenComplete((r, e) -> deadline.cancel(false));

		sendNext();
		return result;
	}

	private void sendNext() {
		Map.Entry<String, Q> target;
		int sentIndex;
		synchronized (this) {
			if (result.isDone() || nextIndex >= candidates.size()) {
				return;
			}
			sentIndex = nextIndex++;
			target = candidates.get(sentIndex);
		}

		String address = target.getKey();
		logger.debug("Sending {} to {} (candidate {}/{})", method, address, sentIndex + 1, candidates.size());
		CompletableFuture<R> reply;
		try {
			reply = invoker.invoke(address, target.getValue());
		} catch (RuntimeException e) {
			reply = CompletableFuture.failedFuture(e);
		}
		reply.whenComplete((response, error) -> onReply(address, response, error));

		if (sentIndex + 1 < candidates.size()) {
			scheduler.schedule(
					() -> sendNextIfStalled(sentIndex + 1),
					options.sendNextTimeout().toMillis(),
					TimeUnit.MILLISECONDS);
		}
	}

	/** Sends the next candidate unless a failure already advanced past it. */
	private void sendNextIfStalled(int expectedIndex) {
		synchronized (this) {
			if (nextIndex != expectedIndex) {
				return;
			}
		}
		sendNext();
	}

	private void onReply(String address, R response, Throwable error) {
		if (error == null) {
			failureTracker.clearFailure(address);
			result.complete(response);
			return;
		}

		Throwable cause = RetryPolicy.unwrap(error);
		failureTracker.recordFailure(address);
		logger.debug("{} to {} failed: {}", method, address, cause.getMessage());

		boolean exhausted;
		synchronized (this) {
			failures++;
			exhausted = failures >= candidates.size();
		}
		if (exhausted) {
			result.completeExceptionally(toFailure(cause));
		} else {
			sendNext();
		}
	}

	private KvException toFailure(Throwable cause) {
		if (cause instanceof KvException kv) {
			return kv;
		}
		if (cause instanceof StatusRuntimeException sre) {
			return RpcFailureException.fromStatus(sre.getStatus(), method);
		}
		return new RpcFailureException(Status.Code.UNKNOWN, method + ": " + cause.getMessage(), cause);
	}
}
