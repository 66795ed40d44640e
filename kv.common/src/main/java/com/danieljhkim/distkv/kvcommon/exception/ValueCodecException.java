package com.danieljhkim.distkv.kvcommon.exception;

import io.grpc.Status;

/**
 * Exception thrown when a stored value cannot be encoded to or decoded from
 * its typed form. Maps to gRPC INTERNAL.
 */
public class ValueCodecException extends KvException {

	public ValueCodecException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.INTERNAL;
	}
}
