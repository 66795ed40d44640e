package com.danieljhkim.distkv.kvclient.client;

import com.danieljhkim.distkv.kvclient.cache.NodeFailureTracker;
import com.danieljhkim.distkv.kvcommon.api.KvRequest;
import com.danieljhkim.distkv.kvcommon.api.KvResponse;
import com.danieljhkim.distkv.kvcommon.api.NodeMethod;
import com.danieljhkim.distkv.kvcommon.exception.RpcFailureException;
import com.danieljhkim.distkv.kvcommon.grpc.JsonMarshaller;

import io.grpc.CallOptions;
import io.grpc.ClientCall;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link RpcTransport} over gRPC.
 *
 * <p>
 * Method descriptors are derived from the {@link NodeMethod} table and carry
 * JSON payloads, so no generated stubs are needed. Each candidate call gets the
 * full RPC timeout as its deadline; {@link FanoutCall} handles candidate
 * selection.
 *
 * <p>
 * Thread-safety: This class is thread-safe.
 */
@Slf4j
public class GrpcRpcTransport implements RpcTransport {

	private final NodeConnectionPool connectionPool;
	private final NodeFailureTracker failureTracker;
	private final ScheduledExecutorService scheduler;
	private final Map<String, MethodDescriptor<?, ?>> descriptors = new ConcurrentHashMap<>();

	public GrpcRpcTransport(NodeConnectionPool connectionPool, NodeFailureTracker failureTracker) {
		this.connectionPool = connectionPool;
		this.failureTracker = failureTracker;
		this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "grpc-transport-timer");
			t.setDaemon(true);
			return t;
		});
	}

	/**
	 * Builds the gRPC method descriptor for a node method. Servers register
	 * handlers under the same descriptor.
	 */
	public static <Q extends KvRequest<Q>, R extends KvResponse> MethodDescriptor<Q, R> descriptorFor(
			NodeMethod<Q, R> method) {
		return MethodDescriptor.<Q, R>newBuilder()
				.setType(MethodDescriptor.MethodType.UNARY)
				.setFullMethodName(MethodDescriptor.generateFullMethodName(NodeMethod.SERVICE_NAME, method.getName()))
				.setRequestMarshaller(JsonMarshaller.of(method.getRequestType()))
				.setResponseMarshaller(JsonMarshaller.of(method.getResponseType()))
				.build();
	}

	@Override
	public <Q extends KvRequest<Q>, R extends KvResponse> CompletableFuture<R> send(
			Map<String, Q> requests, NodeMethod<Q, R> method, RpcOptions options) {
		MethodDescriptor<Q, R> descriptor = descriptor(method);
		FanoutCall<Q, R> call = new FanoutCall<>(
				method.getFullName(),
				new ArrayList<>(requests.entrySet()),
				(address, request) -> unaryCall(address, descriptor, request, options.timeout()),
				options,
				scheduler,
				failureTracker);
		return call.start();
	}

	@SuppressWarnings("unchecked")
	private <Q extends KvRequest<Q>, R extends KvResponse> MethodDescriptor<Q, R> descriptor(NodeMethod<Q, R> method) {
		return (MethodDescriptor<Q, R>) descriptors.computeIfAbsent(method.getFullName(), name -> descriptorFor(method));
	}

	private <Q, R> CompletableFuture<R> unaryCall(
			String address, MethodDescriptor<Q, R> descriptor, Q request, Duration timeout) {
		CompletableFuture<R> future = new CompletableFuture<>();
		ClientCall<Q, R> call = connectionPool.getChannel(address)
				.newCall(descriptor, CallOptions.DEFAULT.withDeadlineAfter(timeout.toMillis(), TimeUnit.MILLISECONDS));

		ClientCalls.asyncUnaryCall(call, request, new StreamObserver<R>() {
			@Override
			public void onNext(R value) {
				future.complete(value);
			}

			@Override
			public void onError(Throwable t) {
				Status status = Status.fromThrowable(t);
				log.debug("{} to {} failed with {}", descriptor.getFullMethodName(), address, status.getCode());
				future.completeExceptionally(RpcFailureException.fromStatus(status, address));
			}

			@Override
			public void onCompleted() {
				if (!future.isDone()) {
					future.completeExceptionally(
							new RpcFailureException(Status.Code.INTERNAL, address + ": call completed without a response"));
				}
			}
		});
		return future;
	}

	@Override
	public void close() {
		scheduler.shutdownNow();
		connectionPool.closeAll();
	}
}
