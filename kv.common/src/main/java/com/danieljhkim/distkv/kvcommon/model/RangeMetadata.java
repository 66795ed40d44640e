package com.danieljhkim.distkv.kvcommon.model;

import java.util.Objects;

/**
 * Boundaries of a range whose routing metadata is being written.
 */
public record RangeMetadata(Key startKey, Key endKey) {

	public RangeMetadata {
		Objects.requireNonNull(startKey, "startKey cannot be null");
		Objects.requireNonNull(endKey, "endKey cannot be null");
	}
}
