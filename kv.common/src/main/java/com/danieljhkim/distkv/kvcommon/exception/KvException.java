package com.danieljhkim.distkv.kvcommon.exception;

import io.grpc.Status;

/**
 * Base exception for all distkv domain exceptions.
 * Each subclass maps to a specific gRPC status code and states whether the
 * operation that raised it may succeed if attempted again.
 */
public abstract class KvException extends RuntimeException {

	protected KvException(String message) {
		super(message);
	}

	protected KvException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * Returns the gRPC status code for this exception.
	 */
	public abstract Status.Code getGrpcStatusCode();

	/**
	 * Whether the failed operation may succeed on a later attempt, possibly after
	 * backoff. Non-retryable exceptions end a routing attempt loop.
	 */
	public boolean isRetryable() {
		return false;
	}

	/**
	 * Builds the gRPC Status for this exception.
	 */
	public Status toGrpcStatus() {
		return Status.fromCode(getGrpcStatusCode())
				.withDescription(getMessage())
				.withCause(getCause());
	}
}
