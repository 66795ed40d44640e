package com.danieljhkim.distkv.kvclient.routing;

/**
 * Lifecycle of one routed operation.
 *
 * <pre>
 * PENDING -> RESOLVING -> DISPATCHING -> SUCCEEDED
 *                ^            |      \-> FAILED
 *                |            v
 *                +------- RETRYING
 * </pre>
 *
 * RESOLVING can also fail or move to RETRYING directly.
 */
public enum RouteState {
	PENDING,
	RESOLVING,
	DISPATCHING,
	RETRYING,
	SUCCEEDED,
	FAILED;

	public boolean isTerminal() {
		return this == SUCCEEDED || this == FAILED;
	}
}
