/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.client;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.toolwire.spec.McpSchema;

/**
 * Lifecycle callbacks of a {@link McpAsyncClient}. Callbacks run on whichever thread
 * drove the transition and must not block.
 *
 * @see McpClient.AsyncSpec#connectionObserver(McpConnectionObserver)
 */
public interface McpConnectionObserver {

	/**
	 * An observer that logs every event through SLF4J.
	 */
	McpConnectionObserver LOGGING = new McpConnectionObserver() {

		private static final Logger logger = LoggerFactory.getLogger(McpConnectionObserver.class);

		@Override
		public void onStateChange(SessionState previous, SessionState current) {
			logger.debug("Client state {} -> {}", previous, current);
		}

		@Override
		public void onConnected(McpSchema.InitializeResult initializeResult) {
			logger.info("Connected to {} using protocol {}", initializeResult.serverInfo(),
					initializeResult.protocolVersion());
		}

		@Override
		public void onConnectionLost(Throwable cause) {
			logger.warn("Connection lost: {}", (cause != null) ? cause.getMessage() : "closed by peer");
		}

		@Override
		public void onReconnectAttempt(int attempt, Duration delay) {
			logger.warn("Reconnect attempt {} in {}ms", attempt, delay.toMillis());
		}

		@Override
		public void onReconnectFailed(int attempts, Throwable cause) {
			logger.error("Giving up after {} reconnect attempt(s): {}", attempts,
					(cause != null) ? cause.getMessage() : "no cause");
		}

	};

	default void onStateChange(SessionState previous, SessionState current) {
	}

	/**
	 * The handshake of a new connection completed.
	 * @param initializeResult what the server answered
	 */
	default void onConnected(McpSchema.InitializeResult initializeResult) {
	}

	/**
	 * An established connection ended without {@link McpAsyncClient#disconnect()}.
	 * @param cause the transport failure, or {@code null} when the peer closed
	 */
	default void onConnectionLost(Throwable cause) {
	}

	/**
	 * A reconnect attempt was scheduled.
	 * @param attempt the 1-based attempt number
	 * @param delay how long until it starts
	 */
	default void onReconnectAttempt(int attempt, Duration delay) {
	}

	/**
	 * The client stopped reconnecting and is now {@link SessionState#DISCONNECTED}.
	 * @param attempts the number of attempts made
	 * @param cause the last failure
	 */
	default void onReconnectFailed(int attempts, Throwable cause) {
	}

}
