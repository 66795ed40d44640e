package com.danieljhkim.distkv.kvcommon.exception;

import io.grpc.Status;

/**
 * Thrown when an operation is dispatched to an empty replica set. Range
 * metadata never legitimately lists zero replicas, so this signals corrupt
 * metadata or cache state and is not retried.
 */
public class EmptyReplicaSetException extends KvException {

	public EmptyReplicaSetException(String message) {
		super(message);
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.DATA_LOSS;
	}
}
