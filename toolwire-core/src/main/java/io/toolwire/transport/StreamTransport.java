/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import io.toolwire.spec.McpTransport;
import io.toolwire.spec.McpTransportException;
import io.toolwire.util.Assert;

/**
 * A {@link McpTransport} over a pair of byte streams, framing each payload as one line of
 * UTF-8 text terminated by {@code '\n'}.
 *
 * <p>
 * A dedicated daemon thread reads lines from the input stream and publishes them through
 * {@link #receive()}. Writes are serialized on a single outbound thread and additionally
 * guarded by a lock, so a frame is never interleaved with another one. End of input
 * completes {@link #receive()}; a read failure errors it with
 * {@link McpTransportException}.
 *
 * @author Christian Tzolov
 */
public class StreamTransport implements McpTransport {

	private static final Logger logger = LoggerFactory.getLogger(StreamTransport.class);

	private static final Sinks.EmitFailureHandler EMIT_RETRY = Sinks.EmitFailureHandler
		.busyLooping(Duration.ofSeconds(1));

	private final String name;

	private final InputStream inputStream;

	private final OutputStream outputStream;

	private final Runnable closer;

	private final Sinks.Many<String> inboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private final Scheduler inboundScheduler;

	private final Scheduler outboundScheduler;

	private final Object writeLock = new Object();

	private final AtomicBoolean readerStarted = new AtomicBoolean();

	private final AtomicBoolean closing = new AtomicBoolean();

	/**
	 * Creates a transport over the given streams.
	 * @param name a short label used in thread names and log messages
	 * @param inputStream the stream inbound frames are read from
	 * @param outputStream the stream outbound frames are written to
	 * @param closer releases the underlying carrier (socket, process) when the transport
	 * is closed; invoked at most once
	 */
	public StreamTransport(String name, InputStream inputStream, OutputStream outputStream, Runnable closer) {
		Assert.hasText(name, "name must not be empty");
		Assert.notNull(inputStream, "inputStream must not be null");
		Assert.notNull(outputStream, "outputStream must not be null");
		Assert.notNull(closer, "closer must not be null");
		this.name = name;
		this.inputStream = inputStream;
		this.outputStream = outputStream;
		this.closer = closer;
		this.inboundScheduler = Schedulers.newSingle("toolwire-" + name + "-inbound", true);
		this.outboundScheduler = Schedulers.newSingle("toolwire-" + name + "-outbound", true);
	}

	@Override
	public Mono<Void> send(String frame) {
		return Mono.<Void>fromRunnable(() -> write(frame))
			.subscribeOn(this.outboundScheduler)
			.onErrorMap(RejectedExecutionException.class,
					e -> new McpTransportException("Transport " + this.name + " is closed", e));
	}

	@Override
	public Flux<String> receive() {
		return this.inboundSink.asFlux().doOnSubscribe(subscription -> startReading());
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.<Void>fromRunnable(this::doClose).subscribeOn(Schedulers.boundedElastic());
	}

	@Override
	public void close() {
		doClose();
	}

	public boolean isClosed() {
		return this.closing.get();
	}

	private void write(String frame) {
		if (this.closing.get()) {
			throw new McpTransportException("Transport " + this.name + " is closed");
		}
		if (frame.indexOf('\n') >= 0 || frame.indexOf('\r') >= 0) {
			throw new McpTransportException("Frame must not contain line breaks");
		}
		byte[] bytes = frame.getBytes(StandardCharsets.UTF_8);
		synchronized (this.writeLock) {
			try {
				this.outputStream.write(bytes);
				this.outputStream.write('\n');
				this.outputStream.flush();
			}
			catch (IOException e) {
				throw new McpTransportException("Error writing to " + this.name, e);
			}
		}
		logger.debug("[{}] sent: {}", this.name, frame);
	}

	private void startReading() {
		if (!this.readerStarted.compareAndSet(false, true)) {
			return;
		}
		this.inboundScheduler.schedule(() -> {
			try (BufferedReader reader = new BufferedReader(
					new InputStreamReader(this.inputStream, StandardCharsets.UTF_8))) {
				String line;
				while (!this.closing.get() && (line = reader.readLine()) != null) {
					if (line.isBlank()) {
						continue;
					}
					logger.debug("[{}] received: {}", this.name, line);
					this.inboundSink.emitNext(line, EMIT_RETRY);
				}
				logger.debug("[{}] end of input", this.name);
				this.inboundSink.emitComplete(EMIT_RETRY);
			}
			catch (IOException e) {
				if (this.closing.get()) {
					logger.debug("[{}] stream closed during shutdown", this.name);
					this.inboundSink.emitComplete(EMIT_RETRY);
				}
				else {
					logger.error("[{}] error reading input", this.name, e);
					this.inboundSink.emitError(new McpTransportException("Error reading from " + this.name, e),
							EMIT_RETRY);
				}
			}
		});
	}

	private void doClose() {
		if (!this.closing.compareAndSet(false, true)) {
			return;
		}
		logger.debug("[{}] closing", this.name);
		this.inboundSink.emitComplete(EMIT_RETRY);
		try {
			this.closer.run();
		}
		catch (RuntimeException e) {
			logger.warn("[{}] error releasing carrier", this.name, e);
		}
		this.outboundScheduler.dispose();
		this.inboundScheduler.dispose();
	}

}
