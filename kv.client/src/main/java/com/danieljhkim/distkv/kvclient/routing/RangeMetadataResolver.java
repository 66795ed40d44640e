package com.danieljhkim.distkv.kvclient.routing;

import com.danieljhkim.distkv.kvclient.cache.RangeLocationCache;
import com.danieljhkim.distkv.kvclient.gossip.GossipClient;
import com.danieljhkim.distkv.kvclient.gossip.GossipKeys;
import com.danieljhkim.distkv.kvcommon.api.InternalRangeLookupRequest;
import com.danieljhkim.distkv.kvcommon.api.InternalRangeLookupResponse;
import com.danieljhkim.distkv.kvcommon.api.NodeMethod;
import com.danieljhkim.distkv.kvcommon.exception.FirstRangeMissingException;
import com.danieljhkim.distkv.kvcommon.exception.RemoteException;
import com.danieljhkim.distkv.kvcommon.model.Key;
import com.danieljhkim.distkv.kvcommon.model.KeyPrefixes;
import com.danieljhkim.distkv.kvcommon.model.RangeLocations;
import com.danieljhkim.distkv.kvcommon.model.Replica;

import io.grpc.Status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves a key to the replicas of the range containing it.
 *
 * <p>
 * Range metadata is a two-level index stored as ordinary data. The first range,
 * whose locations are gossiped, holds level-1 entries pointing at the ranges
 * holding level-2 entries; level-2 entries point at user ranges. Resolving an
 * uncached key therefore takes exactly two lookups:
 *
 * <pre>
 *   gossip(first-range) -> lookup(meta1 + key) -> lookup(meta2 + key) -> replicas
 * </pre>
 *
 * <p>
 * Failures propagate unchanged; the resolver does not retry.
 */
public class RangeMetadataResolver {

	private static final Logger logger = LoggerFactory.getLogger(RangeMetadataResolver.class);

	private final GossipClient gossip;
	private final ReplicaSender sender;
	private final RangeLocationCache cache;

	public RangeMetadataResolver(GossipClient gossip, ReplicaSender sender, RangeLocationCache cache) {
		this.gossip = gossip;
		this.sender = sender;
		this.cache = cache;
	}

	/**
	 * Resolves the range containing {@code key}, consulting the range cache first
	 * and caching the result of a metadata lookup.
	 */
	public CompletableFuture<RangeLocations> resolveRange(Key key) {
		Optional<RangeLocations> cached = cache.lookup(key);
		if (cached.isPresent()) {
			logger.trace("Range cache hit for key {}", key);
			return CompletableFuture.completedFuture(cached.get());
		}

		return lookupFirstLevel(key)
				.thenCompose(metaRange -> lookup(metaRange.replicas(), KeyPrefixes.META2, key))
				.thenApply(locations -> {
					if (locations.endKey() != null && locations.contains(key)) {
						cache.put(locations);
					} else {
						// an unbounded entry would shadow every higher range in the cache
						logger.debug("Not caching range of key {} with unknown end: {}", key, locations);
					}
					logger.debug("Resolved key {} to range [{}, {}) on {}",
							key, locations.startKey(), locations.endKey(), locations.replicas());
					return locations;
				});
	}

	/**
	 * Looks up the level-1 entry for {@code key} among the first range replicas,
	 * yielding the locations of the level-2 range that indexes it.
	 */
	CompletableFuture<RangeLocations> lookupFirstLevel(Key key) {
		Optional<RangeLocations> firstRange = gossip.getInfo(GossipKeys.FIRST_RANGE, RangeLocations.class);
		if (firstRange.isEmpty()) {
			return CompletableFuture.failedFuture(
					new FirstRangeMissingException("first range locations have not been gossiped"));
		}
		return lookup(firstRange.get().replicas(), KeyPrefixes.META1, key);
	}

	private CompletableFuture<RangeLocations> lookup(List<Replica> replicas, Key prefix, Key key) {
		Key metadataKey = Key.make(prefix, key);
		InternalRangeLookupRequest request = new InternalRangeLookupRequest(metadataKey);
		return sender.send(replicas, NodeMethod.INTERNAL_RANGE_LOOKUP, request)
				.thenApply(reply -> locationsOf(reply, prefix, metadataKey));
	}

	/**
	 * Extracts the locations from a lookup reply. A stored entry without an end
	 * key is bounded by the metadata key it was found under.
	 */
	private static RangeLocations locationsOf(InternalRangeLookupResponse reply, Key prefix, Key metadataKey) {
		if (reply.hasError()) {
			throw reply.getError().toException();
		}
		RangeLocations locations = reply.getLocations();
		if (locations == null) {
			throw new RemoteException(Status.Code.NOT_FOUND, "no range metadata found for " + metadataKey, false);
		}
		Key entryKey = reply.getMetadataKey();
		if (locations.endKey() == null && entryKey != null && entryKey.hasPrefix(prefix)) {
			locations = locations.withEndKey(entryKey.stripPrefix(prefix));
		}
		return locations;
	}
}
