package com.danieljhkim.distkv.kvclient;

import com.danieljhkim.distkv.kvcommon.api.GetRequest;
import com.danieljhkim.distkv.kvcommon.api.GetResponse;
import com.danieljhkim.distkv.kvcommon.api.PutRequest;
import com.danieljhkim.distkv.kvcommon.api.PutResponse;
import com.danieljhkim.distkv.kvcommon.exception.ValueCodecException;
import com.danieljhkim.distkv.kvcommon.grpc.JsonMarshaller;
import com.danieljhkim.distkv.kvcommon.model.Key;
import com.danieljhkim.distkv.kvcommon.model.Value;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

/**
 * Blocking helpers that store and load Java objects as JSON encoded values.
 */
public final class TypedValues {

	private TypedValues() {
	}

	/**
	 * Reads the value at {@code key} and decodes it into {@code type}.
	 *
	 * @return empty when no value is stored at the key
	 * @throws RuntimeException
	 *             the exception carried by the response error, if any
	 */
	public static <T> Optional<TypedValue<T>> get(DistKV db, Key key, Class<T> type) {
		GetResponse reply = db.get(new GetRequest(key)).join();
		if (reply.hasError()) {
			throw reply.getError().toException();
		}
		Value value = reply.getValue();
		if (value == null || value.isEmpty()) {
			return Optional.empty();
		}
		try {
			T decoded = JsonMarshaller.mapper().readValue(value.getBytes(), type);
			return Optional.of(new TypedValue<>(decoded, value.getTimestamp()));
		} catch (IOException e) {
			throw new ValueCodecException("Failed to decode value at " + key + " as " + type.getSimpleName(), e);
		}
	}

	/**
	 * Encodes {@code object} and writes it to {@code key}, stamped with the
	 * current wall time.
	 */
	public static void put(DistKV db, Key key, Object object) {
		byte[] bytes;
		try {
			bytes = JsonMarshaller.mapper().writeValueAsBytes(object);
		} catch (JsonProcessingException e) {
			throw new ValueCodecException("Failed to encode value for " + key, e);
		}
		PutResponse reply = db.put(new PutRequest(key, new Value(bytes, nowNanos()))).join();
		if (reply.hasError()) {
			throw reply.getError().toException();
		}
	}

	static long nowNanos() {
		Instant now = Instant.now();
		return now.getEpochSecond() * 1_000_000_000L + now.getNano();
	}
}
