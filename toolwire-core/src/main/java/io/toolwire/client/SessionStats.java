/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.client;

import java.time.Duration;
import java.time.Instant;

/**
 * A point-in-time view of a client's connection.
 *
 * @param state the state when the snapshot was taken
 * @param connectedAt when the current connection finished its handshake, {@code null}
 * while not connected
 * @param uptime how long the current connection has been up, {@code null} while not
 * connected
 * @param reconnectAttempts reconnect attempts since the last successful handshake
 */
public record SessionStats(SessionState state, Instant connectedAt, Duration uptime, int reconnectAttempts) {

	static SessionStats of(SessionState state, Instant connectedAt, int reconnectAttempts) {
		Duration uptime = (connectedAt != null) ? Duration.between(connectedAt, Instant.now()) : null;
		return new SessionStats(state, connectedAt, uptime, reconnectAttempts);
	}

	public boolean isConnected() {
		return this.connectedAt != null;
	}

}
