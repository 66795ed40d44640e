package com.danieljhkim.distkv.kvcommon.model;

import java.util.List;
import java.util.Objects;

/**
 * Where a contiguous key range lives: the replicas holding [startKey, endKey).
 *
 * <p>
 * A null {@code endKey} means the range is open ended.
 */
public record RangeLocations(Key startKey, Key endKey, List<Replica> replicas) {

	public RangeLocations {
		Objects.requireNonNull(startKey, "startKey cannot be null");
		replicas = replicas == null ? List.of() : List.copyOf(replicas);
	}

	/**
	 * Locations as written to metadata, where the end key is implied by the
	 * metadata key the entry is stored under.
	 */
	public static RangeLocations startingAt(Key startKey, List<Replica> replicas) {
		return new RangeLocations(startKey, null, replicas);
	}

	public boolean contains(Key key) {
		return startKey.compareTo(key) <= 0 && (endKey == null || key.compareTo(endKey) < 0);
	}

	/**
	 * The key this range is indexed by: its end key, or {@link Key#MAX} when open
	 * ended.
	 */
	public Key boundary() {
		return endKey != null ? endKey : Key.MAX;
	}

	public RangeLocations withEndKey(Key endKey) {
		return new RangeLocations(startKey, endKey, replicas);
	}
}
