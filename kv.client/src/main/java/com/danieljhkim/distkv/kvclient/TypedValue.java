package com.danieljhkim.distkv.kvclient;

/**
 * A decoded value together with the timestamp it was written at.
 */
public record TypedValue<T>(T value, long timestamp) {
}
