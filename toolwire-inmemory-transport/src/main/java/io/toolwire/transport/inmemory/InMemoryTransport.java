/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.transport.inmemory;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import io.toolwire.spec.McpTransport;
import io.toolwire.spec.McpTransportException;
import io.toolwire.util.Assert;

/**
 * One end of an in-process connection. Frames sent on one end are received, in order,
 * on the other. Ends are created in pairs with {@link #pair(String)}.
 *
 * <p>
 * Besides the {@link McpTransport} contract, an end can simulate carrier faults:
 * {@link #fail(Throwable)} tears the connection down with an error on both ends, and
 * {@link #setMuted(boolean)} silently drops the frames addressed to this end.
 */
public final class InMemoryTransport implements McpTransport {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryTransport.class);

	private final String name;

	// shared by both ends so every emission into either inbound sink is serialized
	private final Object lock;

	private final AtomicBoolean closed;

	private final Sinks.Many<String> inbound = Sinks.many().unicast().onBackpressureBuffer();

	private volatile boolean muted;

	private InMemoryTransport peer;

	private InMemoryTransport(String name, Object lock, AtomicBoolean closed) {
		this.name = name;
		this.lock = lock;
		this.closed = closed;
	}

	/**
	 * Creates two connected ends.
	 * @param name a name used in log messages
	 * @return the connected ends
	 */
	public static Pair pair(String name) {
		Assert.hasText(name, "name must not be empty");
		Object lock = new Object();
		AtomicBoolean closed = new AtomicBoolean();
		InMemoryTransport clientEnd = new InMemoryTransport(name + "-client", lock, closed);
		InMemoryTransport serverEnd = new InMemoryTransport(name + "-server", lock, closed);
		clientEnd.peer = serverEnd;
		serverEnd.peer = clientEnd;
		return new Pair(clientEnd, serverEnd);
	}

	@Override
	public Mono<Void> send(String frame) {
		Assert.notNull(frame, "frame must not be null");
		return Mono.defer(() -> {
			Sinks.EmitResult result;
			synchronized (this.lock) {
				if (this.closed.get()) {
					return Mono.error(new McpTransportException("Transport " + this.name + " is closed"));
				}
				if (this.peer.muted) {
					logger.debug("[{}] Dropping frame for muted peer", this.name);
					return Mono.empty();
				}
				result = this.peer.inbound.tryEmitNext(frame);
			}
			if (result.isFailure()) {
				return Mono.error(new McpTransportException("Transport " + this.name + " failed to deliver: " + result));
			}
			return Mono.empty();
		});
	}

	@Override
	public Flux<String> receive() {
		return this.inbound.asFlux();
	}

	/**
	 * Closes the connection. Both ends see their inbound frames complete.
	 */
	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			synchronized (this.lock) {
				if (!this.closed.compareAndSet(false, true)) {
					return;
				}
				this.inbound.tryEmitComplete();
				this.peer.inbound.tryEmitComplete();
			}
			logger.debug("[{}] Closed", this.name);
		});
	}

	@Override
	public void close() {
		closeGracefully().block();
	}

	/**
	 * Simulates a carrier failure. Both ends see their inbound frames error with a
	 * {@link McpTransportException}, and every later send fails.
	 * @param cause the simulated failure
	 */
	public void fail(Throwable cause) {
		synchronized (this.lock) {
			if (!this.closed.compareAndSet(false, true)) {
				return;
			}
			this.inbound.tryEmitError(new McpTransportException("Transport " + this.name + " failed", cause));
			this.peer.inbound
				.tryEmitError(new McpTransportException("Transport " + this.peer.name + " failed", cause));
		}
		logger.debug("[{}] Failed: {}", this.name, (cause != null) ? cause.getMessage() : null);
	}

	/**
	 * While muted, frames sent to this end are accepted by the sender and dropped, as if
	 * the peer had stopped reading.
	 * @param muted whether to drop inbound frames
	 */
	public void setMuted(boolean muted) {
		this.muted = muted;
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	public String getName() {
		return this.name;
	}

	@Override
	public String toString() {
		return "InMemoryTransport[" + this.name + "]";
	}

	/**
	 * The two ends of one in-memory connection.
	 *
	 * @param clientEnd the end handed to the client
	 * @param serverEnd the end handed to the server
	 */
	public record Pair(InMemoryTransport clientEnd, InMemoryTransport serverEnd) {
	}

}
