package com.danieljhkim.distkv.kvcommon.model;

/**
 * One copy of a range, hosted by a store on a storage node.
 *
 * @param nodeId
 *            the node hosting the replica
 * @param storeId
 *            the store within that node, 0 when unspecified
 */
public record Replica(int nodeId, int storeId) {

	public static Replica onNode(int nodeId) {
		return new Replica(nodeId, 0);
	}
}
