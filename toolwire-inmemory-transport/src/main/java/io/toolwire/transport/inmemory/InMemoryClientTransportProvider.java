/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.transport.inmemory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import io.toolwire.spec.McpClientTransportProvider;
import io.toolwire.spec.McpTransport;
import io.toolwire.spec.McpTransportException;
import io.toolwire.util.Assert;

/**
 * Connects to an {@link InMemoryServerTransportProvider}. Each {@link #connect()} creates
 * a new {@link InMemoryTransport} pair, hands the server end to the server provider and
 * emits the client end.
 *
 * <p>
 * The provider keeps every client end it created so tests can inject faults, and can be
 * told to refuse connections to simulate an unreachable server.
 */
public class InMemoryClientTransportProvider implements McpClientTransportProvider {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryClientTransportProvider.class);

	private final InMemoryServerTransportProvider serverProvider;

	private final List<InMemoryTransport> connections = new CopyOnWriteArrayList<>();

	private final AtomicInteger attempts = new AtomicInteger();

	private volatile boolean refusing;

	private volatile boolean mutingNewConnections;

	public InMemoryClientTransportProvider(InMemoryServerTransportProvider serverProvider) {
		Assert.notNull(serverProvider, "serverProvider must not be null");
		this.serverProvider = serverProvider;
	}

	@Override
	public Mono<McpTransport> connect() {
		return Mono.<McpTransport>fromCallable(() -> {
			int attempt = this.attempts.incrementAndGet();
			if (this.refusing) {
				throw new McpTransportException("Connection refused (attempt " + attempt + ")");
			}
			InMemoryTransport.Pair pair = InMemoryTransport.pair("in-memory-" + attempt);
			if (this.mutingNewConnections) {
				pair.clientEnd().setMuted(true);
			}
			this.serverProvider.offer(pair.serverEnd());
			this.connections.add(pair.clientEnd());
			logger.debug("Opened {}", pair.clientEnd());
			return pair.clientEnd();
		});
	}

	/**
	 * Makes later {@link #connect()} calls fail with {@link McpTransportException}.
	 * @param refusing whether to refuse connections
	 */
	public void setRefusing(boolean refusing) {
		this.refusing = refusing;
	}

	/**
	 * Makes later connections open with a muted client end. The server reads what the
	 * client sends but none of its answers arrive, so the handshake goes unanswered.
	 * Connections that are already open keep their current setting.
	 * @param muting whether new client ends start muted
	 */
	public void setMutingNewConnections(boolean muting) {
		this.mutingNewConnections = muting;
	}

	/**
	 * The client end of the most recent connection.
	 * @return the latest client end
	 * @throws IllegalStateException if no connection was made yet
	 */
	public InMemoryTransport lastConnection() {
		if (this.connections.isEmpty()) {
			throw new IllegalStateException("No connection was made yet");
		}
		return this.connections.get(this.connections.size() - 1);
	}

	public List<InMemoryTransport> getConnections() {
		return List.copyOf(this.connections);
	}

	/**
	 * The number of {@link #connect()} calls, refused ones included.
	 * @return the attempt count
	 */
	public int getConnectAttempts() {
		return this.attempts.get();
	}

}
