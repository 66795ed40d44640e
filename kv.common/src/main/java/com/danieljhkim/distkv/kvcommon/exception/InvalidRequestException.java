package com.danieljhkim.distkv.kvcommon.exception;

import io.grpc.Status;

/**
 * Exception thrown when a request is invalid (e.g., missing routing key, malformed data).
 * Maps to gRPC INVALID_ARGUMENT.
 */
public class InvalidRequestException extends KvException {

	public InvalidRequestException(String message) {
		super(message);
	}

	public InvalidRequestException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.INVALID_ARGUMENT;
	}
}
