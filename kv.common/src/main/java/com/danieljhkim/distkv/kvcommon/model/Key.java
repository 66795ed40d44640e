package com.danieljhkim.distkv.kvcommon.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable key in the distributed key space.
 *
 * <p>
 * Keys are ordered by unsigned lexicographic comparison of their bytes, which
 * is the order ranges are partitioned by. On the wire a key is a base64 string.
 */
public final class Key implements Comparable<Key> {

	/** The smallest possible key. */
	public static final Key MIN = new Key(new byte[0]);

	/** Sentinel greater than every user and metadata key. */
	public static final Key MAX = new Key(new byte[] {(byte) 0xff, (byte) 0xff});

	private final byte[] bytes;

	private Key(byte[] bytes) {
		this.bytes = bytes;
	}

	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public static Key of(byte[] bytes) {
		Objects.requireNonNull(bytes, "bytes cannot be null");
		return new Key(bytes.clone());
	}

	public static Key of(String key) {
		return new Key(key.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Concatenates a prefix and a suffix into a new key.
	 */
	public static Key make(Key prefix, Key suffix) {
		byte[] joined = Arrays.copyOf(prefix.bytes, prefix.bytes.length + suffix.bytes.length);
		System.arraycopy(suffix.bytes, 0, joined, prefix.bytes.length, suffix.bytes.length);
		return new Key(joined);
	}

	@JsonValue
	public byte[] toBytes() {
		return bytes.clone();
	}

	public int length() {
		return bytes.length;
	}

	public boolean hasPrefix(Key prefix) {
		if (prefix.bytes.length > bytes.length) {
			return false;
		}
		return Arrays.equals(bytes, 0, prefix.bytes.length, prefix.bytes, 0, prefix.bytes.length);
	}

	/**
	 * Returns this key without the given prefix.
	 *
	 * @throws IllegalArgumentException
	 *             if the key does not start with the prefix
	 */
	public Key stripPrefix(Key prefix) {
		if (!hasPrefix(prefix)) {
			throw new IllegalArgumentException("Key " + this + " does not start with " + prefix);
		}
		return new Key(Arrays.copyOfRange(bytes, prefix.bytes.length, bytes.length));
	}

	@Override
	public int compareTo(Key other) {
		return Arrays.compareUnsigned(bytes, other.bytes);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Key)) {
			return false;
		}
		return Arrays.equals(bytes, ((Key) o).bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("\"");
		for (byte b : bytes) {
			int c = b & 0xff;
			if (c >= 0x20 && c < 0x7f) {
				sb.append((char) c);
			} else {
				sb.append(String.format("\\x%02x", c));
			}
		}
		return sb.append('"').toString();
	}
}
