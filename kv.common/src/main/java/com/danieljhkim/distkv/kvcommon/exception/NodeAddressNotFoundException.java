package com.danieljhkim.distkv.kvcommon.exception;

import io.grpc.Status;

/**
 * Thrown when a node's address is not (yet) published via gossip.
 */
public class NodeAddressNotFoundException extends KvException {

	private final int nodeId;

	public NodeAddressNotFoundException(int nodeId) {
		super("Unable to look up address for node: " + nodeId);
		this.nodeId = nodeId;
	}

	public int getNodeId() {
		return nodeId;
	}

	@Override
	public Status.Code getGrpcStatusCode() {
		return Status.Code.NOT_FOUND;
	}
}
