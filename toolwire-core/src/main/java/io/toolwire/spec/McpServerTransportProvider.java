/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.spec;

import reactor.core.publisher.Mono;

/**
 * A listening carrier that hands out one independent {@link McpTransport} per accepted
 * peer.
 */
public interface McpServerTransportProvider {

	/**
	 * Waits for the next peer. May be called repeatedly for the lifetime of the provider.
	 * @return a {@link Mono} emitting the transport of the accepted peer, erroring with
	 * {@link McpTransportException} when the listener fails, or completing empty once the
	 * provider has been closed
	 */
	Mono<McpTransport> acceptPeer();

	/**
	 * Stops accepting peers and releases the listener asynchronously. Transports already
	 * handed out are not affected.
	 * @return a {@link Mono} that completes when the listener has been closed
	 */
	Mono<Void> closeGracefully();

	default void close() {
		this.closeGracefully().subscribe();
	}

}
