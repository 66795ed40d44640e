package com.danieljhkim.distkv.kvcommon.exception;

import io.grpc.Status;

/**
 * Thrown for operations the client does not route yet. Maps to gRPC UNIMPLEMENTED.
 */
public class OperationNotSupportedException extends KvException {

	public OperationNotSupportedException(String operation) {
		super(operation + " is not supported by the distributed client");
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.UNIMPLEMENTED;
	}
}
