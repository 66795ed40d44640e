package com.danieljhkim.distkv.kvcommon.grpc;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.grpc.MethodDescriptor;
import io.grpc.Status;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * gRPC marshaller that encodes messages as JSON with Jackson.
 *
 * <p>
 * Lets the client speak to storage nodes without generated protobuf stubs:
 * method descriptors are built at runtime from the node method table.
 */
public final class JsonMarshaller<T> implements MethodDescriptor.Marshaller<T> {

	private static final ObjectMapper MAPPER = new ObjectMapper()
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

	private final Class<T> type;

	private JsonMarshaller(Class<T> type) {
		this.type = type;
	}

	public static <T> JsonMarshaller<T> of(Class<T> type) {
		return new JsonMarshaller<>(type);
	}

	/**
	 * The mapper shared by wire encoding and typed value encoding.
	 */
	public static ObjectMapper mapper() {
		return MAPPER;
	}

	@Override
	public InputStream stream(T value) {
		try {
			return new ByteArrayInputStream(MAPPER.writeValueAsBytes(value));
		} catch (IOException e) {
			throw Status.INTERNAL
					.withDescription("Failed to encode " + type.getSimpleName())
					.withCause(e)
					.asRuntimeException();
		}
	}

	@Override
	public T parse(InputStream stream) {
		try (stream) {
			return MAPPER.readValue(stream, type);
		} catch (IOException e) {
			throw Status.INTERNAL
					.withDescription("Failed to decode " + type.getSimpleName())
					.withCause(e)
					.asRuntimeException();
		}
	}
}
