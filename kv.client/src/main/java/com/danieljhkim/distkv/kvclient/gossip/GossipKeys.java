package com.danieljhkim.distkv.kvclient.gossip;

/**
 * Well-known gossip keys consumed by the routing layer.
 */
public final class GossipKeys {

	/** Locations of the first range, which holds the level-1 metadata. */
	public static final String FIRST_RANGE = "first-range";

	private static final String NODE_ID_PREFIX = "node:";

	private GossipKeys() {
	}

	/**
	 * Key under which a node gossips its "host:port" address.
	 */
	public static String nodeIdKey(int nodeId) {
		return NODE_ID_PREFIX + nodeId;
	}
}
