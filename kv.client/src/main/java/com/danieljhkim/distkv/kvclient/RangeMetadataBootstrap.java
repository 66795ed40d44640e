package com.danieljhkim.distkv.kvclient;

import com.danieljhkim.distkv.kvcommon.exception.InvalidRequestException;
import com.danieljhkim.distkv.kvcommon.model.Key;
import com.danieljhkim.distkv.kvcommon.model.KeyPrefixes;
import com.danieljhkim.distkv.kvcommon.model.RangeLocations;
import com.danieljhkim.distkv.kvcommon.model.RangeMetadata;
import com.danieljhkim.distkv.kvcommon.model.Replica;
import com.danieljhkim.distkv.kvcommon.model.config.AcctConfig;
import com.danieljhkim.distkv.kvcommon.model.config.PermConfig;
import com.danieljhkim.distkv.kvcommon.model.config.Permission;
import com.danieljhkim.distkv.kvcommon.model.config.ZoneConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Writes the routing metadata and default configs of a new or changed cluster.
 */
public final class RangeMetadataBootstrap {

	private static final Logger logger = LoggerFactory.getLogger(RangeMetadataBootstrap.class);

	static final long DEFAULT_RANGE_MIN_BYTES = 1L << 20;
	static final long DEFAULT_RANGE_MAX_BYTES = 64L << 20;

	private RangeMetadataBootstrap() {
	}

	/**
	 * Points the whole key space at a single replica: one level-1 and one level-2
	 * entry, both ending at {@link Key#MAX}.
	 */
	public static void bootstrapRangeLocations(DistKV db, Replica replica) {
		RangeLocations locations = RangeLocations.startingAt(Key.MIN, List.of(replica));
		TypedValues.put(db, Key.make(KeyPrefixes.META1, Key.MAX), locations);
		TypedValues.put(db, Key.make(KeyPrefixes.META2, Key.MAX), locations);
		logger.info("Bootstrapped range locations on {}", replica);
	}

	/**
	 * Writes the default accounting, permission and zone configs at the root of
	 * each config prefix.
	 */
	public static void bootstrapConfigs(DistKV db) {
		TypedValues.put(db, Key.make(KeyPrefixes.CONFIG_ACCOUNTING, Key.MIN), new AcctConfig());

		Permission everyone = new Permission(List.of(""), true, true, 1.0);
		TypedValues.put(db, Key.make(KeyPrefixes.CONFIG_PERMISSION, Key.MIN), new PermConfig(List.of(everyone)));

		ZoneConfig zone = new ZoneConfig(
				Map.of("", List.of("HDD", "HDD", "HDD")),
				DEFAULT_RANGE_MIN_BYTES,
				DEFAULT_RANGE_MAX_BYTES);
		TypedValues.put(db, Key.make(KeyPrefixes.CONFIG_ZONE, Key.MIN), zone);
		logger.info("Bootstrapped default configs");
	}

	/**
	 * Publishes new locations for the range described by {@code meta}.
	 *
	 * <p>
	 * A user range is addressed by a level-2 entry at its end key. A range of the
	 * level-2 metadata itself is addressed by a level-1 entry. Locations of the
	 * level-1 range travel through gossip and are rejected here. The written
	 * locations carry the range's end key.
	 */
	public static void updateRangeLocations(DistKV db, RangeMetadata meta, RangeLocations locations) {
		Key endKey = meta.endKey();
		if (endKey.hasPrefix(KeyPrefixes.META1)) {
			throw new InvalidRequestException("Level-1 range locations are gossiped, not stored: " + endKey);
		}
		Key metaKey;
		if (endKey.hasPrefix(KeyPrefixes.META2)) {
			metaKey = Key.make(KeyPrefixes.META1, endKey.stripPrefix(KeyPrefixes.META2));
		} else {
			metaKey = Key.make(KeyPrefixes.META2, endKey);
		}
		TypedValues.put(db, metaKey, locations.withEndKey(endKey));
		logger.debug("Updated range locations at {}", metaKey);
	}
}
