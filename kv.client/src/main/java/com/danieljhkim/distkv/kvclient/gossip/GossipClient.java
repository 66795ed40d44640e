package com.danieljhkim.distkv.kvclient.gossip;

import java.util.Optional;

/**
 * Read-only view of the gossip network.
 *
 * <p>
 * Gossip publishes eventually-consistent facts: node addresses and the
 * locations of the first range. Implementations must be thread-safe. The
 * routing layer never writes to gossip.
 */
public interface GossipClient {

	/**
	 * Returns the value currently gossiped under {@code key}.
	 *
	 * @return the value, or empty when the key is unknown or has not propagated to
	 *         this node yet
	 * @throws ClassCastException
	 *             if the value is not of the requested type
	 */
	<T> Optional<T> getInfo(String key, Class<T> type);
}
