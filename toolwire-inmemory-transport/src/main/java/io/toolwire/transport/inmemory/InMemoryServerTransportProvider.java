/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.transport.inmemory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import io.toolwire.spec.McpServerTransportProvider;
import io.toolwire.spec.McpTransport;
import io.toolwire.spec.McpTransportException;

/**
 * The listening side of in-process connections. Peers are offered by an
 * {@link InMemoryClientTransportProvider} and handed out by {@link #acceptPeer()} in the
 * order they connected.
 */
public class InMemoryServerTransportProvider implements McpServerTransportProvider {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryServerTransportProvider.class);

	private static final McpTransport CLOSED = InMemoryTransport.pair("closed").serverEnd();

	private final BlockingQueue<McpTransport> pendingPeers = new LinkedBlockingQueue<>();

	private volatile boolean closing;

	void offer(InMemoryTransport serverEnd) {
		if (this.closing) {
			throw new McpTransportException("Connection refused: server provider is closed");
		}
		this.pendingPeers.add(serverEnd);
	}

	@Override
	public Mono<McpTransport> acceptPeer() {
		return Mono.<McpTransport>defer(() -> {
			if (this.closing) {
				return Mono.empty();
			}
			try {
				McpTransport peer = this.pendingPeers.take();
				if (peer == CLOSED) {
					// let other waiting acceptors see it as well
					this.pendingPeers.add(CLOSED);
					return Mono.empty();
				}
				logger.debug("Accepted peer {}", peer);
				return Mono.just(peer);
			}
			catch (InterruptedException e) {
				// the acceptor was cancelled
				Thread.currentThread().interrupt();
				logger.debug("Interrupted while accepting a peer");
				return Mono.empty();
			}
		}).subscribeOn(Schedulers.boundedElastic());
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			if (this.closing) {
				return;
			}
			this.closing = true;
			this.pendingPeers.add(CLOSED);
		});
	}

	public boolean isClosing() {
		return this.closing;
	}

}
