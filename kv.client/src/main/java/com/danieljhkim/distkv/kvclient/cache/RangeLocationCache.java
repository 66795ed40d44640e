package com.danieljhkim.distkv.kvclient.cache;

import com.danieljhkim.distkv.kvcommon.model.Key;
import com.danieljhkim.distkv.kvcommon.model.RangeLocations;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Bounded least-recently-used cache of resolved range locations.
 *
 * <p>
 * Entries are indexed by range end key, so the range containing a key is the
 * entry with the smallest end key strictly greater than it. An entry stays
 * until evicted for capacity, replaced by an overlapping range, or invalidated
 * after a failed dispatch; callers must tolerate stale entries.
 *
 * <p>
 * Thread-safety: all methods synchronize on the cache.
 */
public class RangeLocationCache {

	private static final Logger logger = LoggerFactory.getLogger(RangeLocationCache.class);

	private final int capacity;
	private final TreeMap<Key, RangeLocations> byBoundary = new TreeMap<>();
	/** Same entries in access order; the first entry is the eldest. */
	private final LinkedHashMap<Key, RangeLocations> recency = new LinkedHashMap<>(16, 0.75f, true);

	public RangeLocationCache(int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("capacity must be positive: " + capacity);
		}
		this.capacity = capacity;
	}

	/**
	 * Finds the cached range containing {@code key} and marks it recently used.
	 */
	public synchronized Optional<RangeLocations> lookup(Key key) {
		Map.Entry<Key, RangeLocations> entry = byBoundary.higherEntry(key);
		if (entry == null || !entry.getValue().contains(key)) {
			return Optional.empty();
		}
		recency.get(entry.getKey());
		return Optional.of(entry.getValue());
	}

	/**
	 * Caches a range, replacing any cached ranges it overlaps.
	 */
	public synchronized void put(RangeLocations locations) {
		Key boundary = locations.boundary();
		Iterator<Map.Entry<Key, RangeLocations>> it =
				byBoundary.tailMap(locations.startKey(), false).entrySet().iterator();
		while (it.hasNext()) {
			Map.Entry<Key, RangeLocations> existing = it.next();
			if (existing.getValue().startKey().compareTo(boundary) >= 0) {
				break;
			}
			it.remove();
			recency.remove(existing.getKey());
		}

		byBoundary.put(boundary, locations);
		recency.put(boundary, locations);

		while (recency.size() > capacity) {
			Key eldest = recency.keySet().iterator().next();
			recency.remove(eldest);
			byBoundary.remove(eldest);
			logger.debug("Evicted range ending at {} from range cache", eldest);
		}
	}

	/**
	 * Drops the cached range containing {@code key}, if any.
	 *
	 * @return true if an entry was removed
	 */
	public synchronized boolean evict(Key key) {
		Map.Entry<Key, RangeLocations> entry = byBoundary.higherEntry(key);
		if (entry == null || !entry.getValue().contains(key)) {
			return false;
		}
		byBoundary.remove(entry.getKey());
		recency.remove(entry.getKey());
		logger.debug("Invalidated cached range [{}, {}) for key {}",
				entry.getValue().startKey(), entry.getKey(), key);
		return true;
	}

	public synchronized int size() {
		return byBoundary.size();
	}

	public int getCapacity() {
		return capacity;
	}

	public synchronized void clear() {
		byBoundary.clear();
		recency.clear();
	}
}
