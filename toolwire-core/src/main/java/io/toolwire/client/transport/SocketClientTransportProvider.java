/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.client.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import io.toolwire.spec.McpClientTransportProvider;
import io.toolwire.spec.McpTransport;
import io.toolwire.spec.McpTransportException;
import io.toolwire.transport.StreamTransport;
import io.toolwire.util.Assert;

/**
 * Opens a fresh TCP connection per {@link #connect()}.
 */
public class SocketClientTransportProvider implements McpClientTransportProvider {

	private static final Logger logger = LoggerFactory.getLogger(SocketClientTransportProvider.class);

	private final String host;

	private final int port;

	private final Duration connectTimeout;

	public SocketClientTransportProvider(String host, int port) {
		this(host, port, Duration.ofSeconds(10));
	}

	public SocketClientTransportProvider(String host, int port, Duration connectTimeout) {
		Assert.hasText(host, "host must not be empty");
		Assert.notNull(connectTimeout, "connectTimeout must not be null");
		this.host = host;
		this.port = port;
		this.connectTimeout = connectTimeout;
	}

	@Override
	public Mono<McpTransport> connect() {
		return Mono.<McpTransport>fromCallable(() -> {
			Socket socket = new Socket();
			try {
				socket.connect(new InetSocketAddress(this.host, this.port), (int) this.connectTimeout.toMillis());
				socket.setTcpNoDelay(true);
			}
			catch (IOException e) {
				socket.close();
				throw e;
			}
			logger.debug("Connected to {}:{}", this.host, this.port);
			return new StreamTransport("socket-client-" + socket.getLocalPort(), socket.getInputStream(),
					socket.getOutputStream(), () -> {
						try {
							socket.close();
						}
						catch (IOException e) {
							logger.debug("Error closing socket", e);
						}
					});
		})
			.subscribeOn(Schedulers.boundedElastic())
			.onErrorMap(IOException.class,
					e -> new McpTransportException("Failed to connect to " + this.host + ":" + this.port, e));
	}

}
