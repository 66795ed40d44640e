package com.danieljhkim.distkv.kvclient.gossip;

import com.danieljhkim.distkv.kvcommon.exception.NodeAddressNotFoundException;

import java.util.Objects;

/**
 * Maps node IDs to network addresses using gossiped node descriptors.
 * Every call reads live gossip state.
 */
public class NodeAddressResolver {

	private final GossipClient gossip;

	public NodeAddressResolver(GossipClient gossip) {
		this.gossip = Objects.requireNonNull(gossip, "gossip cannot be null");
	}

	/**
	 * @return the node's "host:port" address
	 * @throws NodeAddressNotFoundException
	 *             if the node has not gossiped its address or it has not reached
	 *             this node yet
	 */
	public String resolve(int nodeId) {
		return gossip.getInfo(GossipKeys.nodeIdKey(nodeId), String.class)
				.filter(address -> !address.isEmpty())
				.orElseThrow(() -> new NodeAddressNotFoundException(nodeId));
	}
}
