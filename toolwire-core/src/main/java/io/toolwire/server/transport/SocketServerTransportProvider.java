/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.server.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import io.toolwire.spec.McpServerTransportProvider;
import io.toolwire.spec.McpTransport;
import io.toolwire.spec.McpTransportException;
import io.toolwire.transport.StreamTransport;
import io.toolwire.util.Assert;

/**
 * Accepts full-duplex TCP peers. Each accepted socket becomes an independent
 * newline-delimited {@link StreamTransport}.
 */
public class SocketServerTransportProvider implements McpServerTransportProvider {

	private static final Logger logger = LoggerFactory.getLogger(SocketServerTransportProvider.class);

	private final ServerSocket serverSocket;

	private volatile boolean closing;

	/**
	 * Binds a listener on all interfaces.
	 * @param port the port to listen on, or {@code 0} for an ephemeral port
	 * @throws McpTransportException if the port cannot be bound
	 */
	public SocketServerTransportProvider(int port) {
		this(new InetSocketAddress(port));
	}

	/**
	 * Binds a listener on the given address.
	 * @param address the address to listen on
	 * @throws McpTransportException if the address cannot be bound
	 */
	public SocketServerTransportProvider(InetSocketAddress address) {
		Assert.notNull(address, "address must not be null");
		try {
			this.serverSocket = new ServerSocket();
			this.serverSocket.setReuseAddress(true);
			this.serverSocket.bind(address);
		}
		catch (IOException e) {
			throw new McpTransportException("Failed to bind " + address, e);
		}
		logger.info("Listening on {}", this.serverSocket.getLocalSocketAddress());
	}

	/**
	 * The port actually bound, useful when listening on an ephemeral port.
	 * @return the local port
	 */
	public int getPort() {
		return this.serverSocket.getLocalPort();
	}

	@Override
	public Mono<McpTransport> acceptPeer() {
		return Mono.<McpTransport>defer(() -> {
			if (this.closing) {
				return Mono.empty();
			}
			try {
				Socket socket = this.serverSocket.accept();
				socket.setTcpNoDelay(true);
				logger.info("Accepted peer {}", socket.getRemoteSocketAddress());
				return Mono.just(new StreamTransport("socket-" + socket.getPort(), socket.getInputStream(),
						socket.getOutputStream(), () -> closeQuietly(socket)));
			}
			catch (IOException e) {
				if (this.closing) {
					return Mono.empty();
				}
				return Mono.error(new McpTransportException("Failed to accept peer", e));
			}
		}).subscribeOn(Schedulers.boundedElastic());
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			this.closing = true;
			try {
				this.serverSocket.close();
			}
			catch (IOException e) {
				logger.warn("Error closing listener", e);
			}
		});
	}

	private static void closeQuietly(Socket socket) {
		try {
			socket.close();
		}
		catch (IOException e) {
			logger.debug("Error closing socket", e);
		}
	}

}
