/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.transport;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import io.toolwire.spec.McpTransportException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StreamTransport} over in-memory byte streams.
 *
 * @author Christian Tzolov
 */
class StreamTransportTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private final ByteArrayOutputStream output = new ByteArrayOutputStream();

	private final AtomicInteger closerCalls = new AtomicInteger();

	private StreamTransport transport;

	@AfterEach
	void tearDown() {
		if (this.transport != null) {
			this.transport.close();
		}
	}

	private StreamTransport createTransport(InputStream input) {
		this.transport = new StreamTransport("test", input, this.output, this.closerCalls::incrementAndGet);
		return this.transport;
	}

	private static InputStream input(String text) {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	void framesAreWrittenAsNewlineTerminatedLines() {
		createTransport(input(""));

		StepVerifier.create(this.transport.send("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":1}"))
			.verifyComplete();
		StepVerifier.create(this.transport.send("{\"jsonrpc\":\"2.0\",\"result\":{},\"id\":1}")).verifyComplete();

		assertThat(this.output.toString(StandardCharsets.UTF_8))
			.isEqualTo("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":1}\n{\"jsonrpc\":\"2.0\",\"result\":{},\"id\":1}\n");
	}

	@Test
	void inboundLinesArePublishedInOrderSkippingBlankLines() {
		createTransport(input("first\n\n   \nsecond\nthird\n"));

		StepVerifier.create(this.transport.receive())
			.expectNext("first", "second", "third")
			.expectComplete()
			.verify(TIMEOUT);
	}

	@Test
	void framesAreDecodedAsUtf8() {
		createTransport(input("{\"text\":\"héllo ✓\"}\n"));

		StepVerifier.create(this.transport.receive())
			.expectNext("{\"text\":\"héllo ✓\"}")
			.expectComplete()
			.verify(TIMEOUT);
	}

	@Test
	void frameWithLineBreakIsRejected() {
		createTransport(input(""));

		StepVerifier.create(this.transport.send("{\"a\":\n1}"))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpTransportException.class)
				.hasMessageContaining("line breaks"))
			.verify(TIMEOUT);
		assertThat(this.output.size()).isZero();
	}

	@Test
	void readFailureErrorsTheInboundStream() {
		InputStream failing = new InputStream() {
			@Override
			public int read() throws IOException {
				throw new IOException("Connection reset by peer");
			}
		};
		createTransport(failing);

		StepVerifier.create(this.transport.receive())
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpTransportException.class)
				.hasMessage("Error reading from test")
				.hasRootCauseMessage("Connection reset by peer"))
			.verify(TIMEOUT);
	}

	@Test
	void closeReleasesTheCarrierOnceAndCompletesReceive() {
		createTransport(new InputStream() {
			@Override
			public int read() {
				// idle peer: blocks until the reader thread is interrupted
				try {
					Thread.sleep(Long.MAX_VALUE);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return -1;
			}
		});

		StepVerifier.create(this.transport.receive())
			.then(() -> this.transport.closeGracefully().block(TIMEOUT))
			.expectComplete()
			.verify(TIMEOUT);
		this.transport.closeGracefully().block(TIMEOUT);

		assertThat(this.transport.isClosed()).isTrue();
		assertThat(this.closerCalls).hasValue(1);
	}

	@Test
	void sendAfterCloseFails() {
		createTransport(input(""));
		this.transport.close();

		StepVerifier.create(this.transport.send("{}"))
			.expectError(McpTransportException.class)
			.verify(TIMEOUT);
	}

	@Test
	void concurrentSendsAreNotInterleaved() {
		createTransport(input(""));
		String payload = "{\"data\":\"" + "x".repeat(2048) + "\"}";

		StepVerifier.create(Flux.range(0, 64).flatMap(i -> this.transport.send(payload), 16))
			.expectComplete()
			.verify(TIMEOUT);

		String[] lines = this.output.toString(StandardCharsets.UTF_8).split("\n");
		assertThat(lines).hasSize(64).containsOnly(payload);
	}

}
