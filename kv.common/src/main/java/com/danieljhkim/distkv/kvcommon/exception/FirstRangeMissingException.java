package com.danieljhkim.distkv.kvcommon.exception;

import io.grpc.Status;

/**
 * Thrown when the first range locations have not been gossiped yet, which is
 * the case for a node that has not joined the gossip network. Retryable.
 */
public class FirstRangeMissingException extends KvException {

	public FirstRangeMissingException(String message) {
		super(message);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.UNAVAILABLE;
	}

	@Override
	public boolean isRetryable() {
		return true;
	}
}
