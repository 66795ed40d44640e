package com.danieljhkim.distkv.kvcommon.exception;

import io.grpc.Status;

/**
 * Thrown when none of the nodes in a replica set have an address available via
 * gossip. Retryable: addresses appear as gossip converges.
 */
public class NoNodeAddressesException extends KvException {

	public NoNodeAddressesException(String message) {
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
