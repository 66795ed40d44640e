package com.danieljhkim.distkv.kvclient.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeouts for one fan-out RPC.
 *
 * @param sendNextTimeout
 *            how long to wait on outstanding candidates before also sending to
 *            the next one
 * @param timeout
 *            overall deadline of the call, after which it fails with
 *            DEADLINE_EXCEEDED
 */
public record RpcOptions(Duration sendNextTimeout, Duration timeout) {

	public static final Duration DEFAULT_SEND_NEXT_TIMEOUT = Duration.ofSeconds(1);
	public static final Duration DEFAULT_RPC_TIMEOUT = Duration.ofSeconds(15);

	public RpcOptions {
		Objects.requireNonNull(sendNextTimeout, "sendNextTimeout cannot be null");
		Objects.requireNonNull(timeout, "timeout cannot be null");
		if (sendNextTimeout.isNegative() || timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeouts must be positive");
		}
	}

	public static RpcOptions defaults() {
		return new RpcOptions(DEFAULT_SEND_NEXT_TIMEOUT, DEFAULT_RPC_TIMEOUT);
	}
}
