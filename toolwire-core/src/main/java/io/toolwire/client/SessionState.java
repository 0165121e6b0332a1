/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.client;

/**
 * Connection state of a {@link McpAsyncClient}.
 *
 * <p>
 * A client starts {@link #DISCONNECTED}, moves through {@link #CONNECTING} and
 * {@link #HANDSHAKING} to {@link #READY}, and returns to {@link #DISCONNECTED} when it
 * is disconnected or gives up reconnecting.
 */
public enum SessionState {

	/**
	 * No transport. Calls fail immediately.
	 */
	DISCONNECTED,

	/**
	 * A transport is being opened.
	 */
	CONNECTING,

	/**
	 * The transport is open and the {@code initialize} request is outstanding.
	 */
	HANDSHAKING,

	/**
	 * Handshake completed, calls are sent straight away.
	 */
	READY,

	/**
	 * Still connected but at least one heartbeat went unanswered.
	 */
	DEGRADED,

	/**
	 * The connection was lost and a new one is being attempted after a backoff delay.
	 */
	RECONNECTING;

	/**
	 * Whether calls can be sent in this state.
	 * @return {@code true} for {@link #READY} and {@link #DEGRADED}
	 */
	public boolean isConnected() {
		return this == READY || this == DEGRADED;
	}

}
