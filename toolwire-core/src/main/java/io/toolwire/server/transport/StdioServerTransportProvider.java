/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.server.transport;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import io.toolwire.spec.McpServerTransportProvider;
import io.toolwire.spec.McpTransport;
import io.toolwire.transport.StreamTransport;
import io.toolwire.util.Assert;

/**
 * Serves a single peer over the process's standard input and output, one JSON payload
 * per line. The first {@link #acceptPeer()} yields the stdio transport; later calls
 * complete empty once the provider is closed.
 *
 * @author Christian Tzolov
 */
public class StdioServerTransportProvider implements McpServerTransportProvider {

	private static final Logger logger = LoggerFactory.getLogger(StdioServerTransportProvider.class);

	private final InputStream inputStream;

	private final OutputStream outputStream;

	private final AtomicBoolean accepted = new AtomicBoolean();

	private final Sinks.One<Void> closed = Sinks.one();

	/**
	 * Creates a provider that serves over {@link System#in} and {@link System#out}.
	 */
	public StdioServerTransportProvider() {
		this(System.in, System.out);
	}

	/**
	 * Creates a provider that serves over the given streams.
	 * @param inputStream the stream the peer writes to
	 * @param outputStream the stream the peer reads from
	 */
	public StdioServerTransportProvider(InputStream inputStream, OutputStream outputStream) {
		Assert.notNull(inputStream, "The InputStream can not be null");
		Assert.notNull(outputStream, "The OutputStream can not be null");
		this.inputStream = inputStream;
		this.outputStream = outputStream;
	}

	@Override
	public Mono<McpTransport> acceptPeer() {
		return Mono.defer(() -> {
			if (this.accepted.compareAndSet(false, true)) {
				logger.info("Serving peer over stdio");
				return Mono.just(new StreamTransport("stdio-server", this.inputStream, this.outputStream, () -> {
				}));
			}
			return this.closed.asMono().then(Mono.empty());
		});
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> this.closed.tryEmitEmpty());
	}

}
