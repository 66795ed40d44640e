package com.danieljhkim.distkv.kvclient.routing;

import com.danieljhkim.distkv.kvclient.cache.RangeLocationCache;
import com.danieljhkim.distkv.kvclient.retry.RetryPolicy;
import com.danieljhkim.distkv.kvcommon.api.KvRequest;
import com.danieljhkim.distkv.kvcommon.api.KvResponse;
import com.danieljhkim.distkv.kvcommon.api.NodeMethod;
import com.danieljhkim.distkv.kvcommon.api.ResponseError;
import com.danieljhkim.distkv.kvcommon.model.Key;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes operations to the replicas owning their key, asynchronously.
 *
 * <p>
 * {@link #route} returns at once. The operation then runs on the router's
 * scheduler: resolve the key's range, dispatch to its replicas, and on a
 * retryable failure back off and start over. Retries continue until success,
 * a terminal failure, or the policy's attempt limit (none by default). Backoff
 * is a scheduled task; no thread blocks while waiting.
 *
 * <p>
 * The returned future is completed exactly once: with the node's response, or
 * with a response of the operation's type whose error slot describes the
 * terminal failure. It is never completed exceptionally by the router. A
 * caller that cancels the future stops the retry loop at its next step.
 */
public class RangeRouter implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(RangeRouter.class);

	private final RangeMetadataResolver resolver;
	private final ReplicaSender sender;
	private final RangeLocationCache cache;
	private final RetryPolicy retryPolicy;
	private final ScheduledExecutorService scheduler;
	private final boolean ownsScheduler;

	public RangeRouter(
			RangeMetadataResolver resolver,
			ReplicaSender sender,
			RangeLocationCache cache,
			RetryPolicy retryPolicy,
			int schedulerThreads) {
		this(resolver, sender, cache, retryPolicy, newScheduler(schedulerThreads), true);
	}

	public RangeRouter(
			RangeMetadataResolver resolver,
			ReplicaSender sender,
			RangeLocationCache cache,
			RetryPolicy retryPolicy,
			ScheduledExecutorService scheduler) {
		this(resolver, sender, cache, retryPolicy, scheduler, false);
	}

	private RangeRouter(
			RangeMetadataResolver resolver,
			ReplicaSender sender,
			RangeLocationCache cache,
			RetryPolicy retryPolicy,
			ScheduledExecutorService scheduler,
			boolean ownsScheduler) {
		this.resolver = resolver;
		this.sender = sender;
		this.cache = cache;
		this.retryPolicy = retryPolicy;
		this.scheduler = scheduler;
		this.ownsScheduler = ownsScheduler;
	}

	private static ScheduledExecutorService newScheduler(int threads) {
		AtomicInteger counter = new AtomicInteger();
		return Executors.newScheduledThreadPool(threads, r -> {
			Thread t = new Thread(r, "range-router-" + counter.incrementAndGet());
			t.setDaemon(true);
			return t;
		});
	}

	/**
	 * Routes {@code request} to the range containing {@code key}.
	 *
	 * @return a future receiving exactly one response
	 */
	public <Q extends KvRequest<Q>, R extends KvResponse> CompletableFuture<R> route(
			Key key, NodeMethod<Q, R> method, Q request) {
		RouteTask<Q, R> task = new RouteTask<>(key, method, request);
		try {
			scheduler.execute(task::attempt);
		} catch (RejectedExecutionException e) {
			task.fail(new IllegalStateException("router is closed", e));
		}
		return task.result;
	}

	@Override
	public void close() {
		if (ownsScheduler) {
			scheduler.shutdownNow();
		}
	}

	private final class RouteTask<Q extends KvRequest<Q>, R extends KvResponse> {

		private final Key key;
		private final NodeMethod<Q, R> method;
		private final Q request;
		private final CompletableFuture<R> result = new CompletableFuture<>();

		private volatile RouteState state = RouteState.PENDING;
		private volatile int attempts;

		private RouteTask(Key key, NodeMethod<Q, R> method, Q request) {
			this.key = key;
			this.method = method;
			this.request = request;
		}

		private void attempt() {
			if (result.isDone()) {
				logger.debug("{} for key {} abandoned after {} attempts", method, key, attempts);
				return;
			}
			attempts++;
			transition(RouteState.RESOLVING);

			CompletableFuture<R> reply;
			try {
				reply = resolver.resolveRange(key).thenCompose(locations -> {
					transition(RouteState.DISPATCHING);
					return sender.send(locations.replicas(), method, request);
				});
			} catch (RuntimeException e) {
				reply = CompletableFuture.failedFuture(e);
			}
			reply.whenComplete(this::onAttemptComplete);
		}

		private void onAttemptComplete(R response, Throwable error) {
			if (error == null && !response.hasError()) {
				transition(RouteState.SUCCEEDED);
				result.complete(response);
				return;
			}
			if (error == null) {
				onNodeError(response);
				return;
			}

			Throwable cause = RetryPolicy.unwrap(error);
			if (state == RouteState.DISPATCHING) {
				// the cached replicas may be stale; re-resolve on the next attempt
				cache.evict(key);
			}
			if (!retryPolicy.isRetryable(cause) || !retryPolicy.hasAttemptsLeft(attempts)) {
				logger.debug("{} for key {} failed terminally after {} attempts: {}",
						method, key, attempts, cause.toString());
				fail(cause);
				return;
			}
			scheduleRetry(cause);
		}

		/**
		 * A node answered with its error slot set. The node may no longer hold the
		 * range, so the cached range is dropped either way. The response is handed
		 * to the caller unless the node marked the error retryable.
		 */
		private void onNodeError(R response) {
			cache.evict(key);
			ResponseError nodeError = response.getError();
			if (!nodeError.isRetryable() || !retryPolicy.hasAttemptsLeft(attempts)) {
				logger.debug("{} for key {} rejected by node after {} attempts: {}",
						method, key, attempts, nodeError);
				transition(RouteState.FAILED);
				result.complete(response);
				return;
			}
			scheduleRetry(nodeError.toException());
		}

		private void scheduleRetry(Throwable cause) {
			long backoffMs = retryPolicy.calculateBackoff(attempts);
			logger.warn("failed to invoke {} for key {} (attempt {}), retrying in {}ms: {}",
					method, key, attempts, backoffMs, cause.getMessage());
			transition(RouteState.RETRYING);
			try {
				scheduler.schedule(this::attempt, backoffMs, TimeUnit.MILLISECONDS);
			} catch (RejectedExecutionException e) {
				fail(new IllegalStateException("router closed while retrying " + method, cause));
			}
		}

		private void fail(Throwable cause) {
			transition(RouteState.FAILED);
			R response = method.newResponse();
			response.setError(ResponseError.from(cause));
			result.complete(response);
		}

		private void transition(RouteState next) {
			logger.trace("{} for key {}: {} -> {}", method, key, state, next);
			state = next;
		}
	}
}
