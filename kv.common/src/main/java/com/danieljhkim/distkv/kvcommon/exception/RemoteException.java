package com.danieljhkim.distkv.kvcommon.exception;

import io.grpc.Status;

/**
 * An error reported by a storage node in a response's error slot, rebuilt on
 * the client side with the classification the node gave it.
 */
public class RemoteException extends KvException {

	private final Status.Code code;
	private final boolean retryable;

	public RemoteException(Status.Code code, String message, boolean retryable) {
		super(message);
		this.code = code;
		this.retryable = retryable;
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return code;
	}

	@Override
	public boolean isRetryable() {
		return retryable;
	}
}
