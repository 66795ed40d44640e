package com.danieljhkim.distkv.kvclient.client;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Manages gRPC connections to storage nodes.
 * Creates channels on-demand and caches them by node address.
 */
public class NodeConnectionPool {

	private static final Logger logger = LoggerFactory.getLogger(NodeConnectionPool.class);

	private final Map<String, ManagedChannel> channels = new ConcurrentHashMap<>();
	private final Function<String, ManagedChannel> channelFactory;

	public NodeConnectionPool() {
		this(NodeConnectionPool::plaintextChannel);
	}

	/**
	 * @param channelFactory
	 *            builds a channel for a node address
	 */
	public NodeConnectionPool(Function<String, ManagedChannel> channelFactory) {
		this.channelFactory = channelFactory;
	}

	/**
	 * Gets the channel for the given node address, creating it if needed.
	 *
	 * @param nodeAddress
	 *            The node address in "host:port" format
	 */
	public ManagedChannel getChannel(String nodeAddress) {
		return channels.computeIfAbsent(nodeAddress, addr -> {
			logger.info("Creating gRPC channel to storage node: {}", addr);
			return channelFactory.apply(addr);
		});
	}

	private static ManagedChannel plaintextChannel(String address) {
		return ManagedChannelBuilder.forTarget(address)
				.usePlaintext()
				.build();
	}

	/**
	 * Closes all channels gracefully.
	 */
	public void closeAll() {
		logger.info("Closing all node connections");
		for (Map.Entry<String, ManagedChannel> entry : channels.entrySet()) {
			try {
				if (!entry.getValue().shutdown().awaitTermination(5, TimeUnit.SECONDS)) {
					entry.getValue().shutdownNow();
				}
				logger.debug("Closed channel to {}", entry.getKey());
			} catch (InterruptedException e) {
				logger.warn("Interrupted while closing channel to {}", entry.getKey());
				entry.getValue().shutdownNow();
				Thread.currentThread().interrupt();
			}
		}
		channels.clear();
	}

	/**
	 * Removes a specific node from the pool (e.g., after it left the cluster).
	 */
	public void removeNode(String nodeAddress) {
		ManagedChannel channel = channels.remove(nodeAddress);
		if (channel != null) {
			logger.info("Removing node from pool: {}", nodeAddress);
			channel.shutdownNow();
		}
	}

	public int size() {
		return channels.size();
	}
}
