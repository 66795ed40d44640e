package com.danieljhkim.distkv.kvcommon.model;

/**
 * Reserved key prefixes for system data stored alongside user data.
 */
public final class KeyPrefixes {

	/** Level-1 range metadata, keyed by the (unprefixed) end key of a level-2 range. */
	public static final Key META1 = Key.of("\u0000\u0000meta1");

	/** Level-2 range metadata, keyed by the end key of a user range. */
	public static final Key META2 = Key.of("\u0000\u0000meta2");

	public static final Key CONFIG_ACCOUNTING = Key.of("\u0000acct");
	public static final Key CONFIG_PERMISSION = Key.of("\u0000perm");
	public static final Key CONFIG_ZONE = Key.of("\u0000zone");

	private KeyPrefixes() {
	}
}
