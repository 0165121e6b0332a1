/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.client;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import io.toolwire.MockMcpTransport;
import io.toolwire.spec.McpError;
import io.toolwire.spec.McpSchema;
import io.toolwire.spec.McpSchema.JSONRPCNotification;
import io.toolwire.spec.McpSchema.JSONRPCRequest;
import io.toolwire.spec.McpSchema.JSONRPCResponse;
import io.toolwire.spec.McpTransport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link McpAsyncClient} against a server played by a
 * {@link MockMcpTransport}.
 */
class McpAsyncClientTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private static final Map<String, Object> SERVER_INFO = Map.of("name", "mock-server", "version", "1.0.0");

	private final MockMcpTransport transport = new MockMcpTransport();

	private McpAsyncClient client;

	@AfterEach
	void tearDown() {
		if (this.client != null) {
			this.client.closeGracefully().block(TIMEOUT);
		}
	}

	private McpClient.AsyncSpec prepareClient() {
		return McpClient.async(() -> Mono.<McpTransport>just(this.transport))
			.requestTimeout(TIMEOUT)
			.heartbeatInterval(Duration.ZERO)
			.reconnectPolicy(ReconnectPolicy.disabled());
	}

	private JSONRPCRequest awaitSentRequest(String method) {
		return await().atMost(TIMEOUT)
			.until(() -> this.transport.getSentPayloads()
				.stream()
				.filter(JSONRPCRequest.class::isInstance)
				.map(JSONRPCRequest.class::cast)
				.filter(request -> method.equals(request.method()))
				.findFirst()
				.orElse(null), request -> request != null);
	}

	private void connect(McpClient.AsyncSpec spec, Map<String, Object> initializeResult) {
		this.client = spec.build();
		StepVerifier.create(this.client.connect()).then(() -> {
			JSONRPCRequest initialize = awaitSentRequest(McpSchema.METHOD_INITIALIZE);
			this.transport.simulateIncomingMessage(JSONRPCResponse.success(initialize.id(), initializeResult));
		}).expectNextCount(1).expectComplete().verify(TIMEOUT);
	}

	@Test
	void serverWithoutCapabilitiesOffersNothing() {
		connect(prepareClient(),
				Map.of("protocolVersion", McpSchema.LATEST_PROTOCOL_VERSION, "serverInfo", SERVER_INFO));

		assertThat(this.client.getServerCapabilities()).isNull();
		StepVerifier.create(this.client.callTool(new McpSchema.CallToolRequest("echo", Map.of())))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class)
				.hasMessage("Server does not provide tools capability"))
			.verify(TIMEOUT);
		StepVerifier.create(this.client.listPrompts())
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class)
				.hasMessage("Server does not provide the prompts capability"))
			.verify(TIMEOUT);
		StepVerifier.create(this.client.setLoggingLevel(McpSchema.LoggingLevel.INFO))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class)
				.hasMessage("Server does not provide the logging capability"))
			.verify(TIMEOUT);
	}

	@Test
	void progressNotificationsReachEveryConsumer() {
		List<McpSchema.ProgressNotification> first = new CopyOnWriteArrayList<>();
		List<McpSchema.ProgressNotification> second = new CopyOnWriteArrayList<>();
		connect(prepareClient().progressConsumer(n -> Mono.fromRunnable(() -> first.add(n)))
			.progressConsumer(n -> Mono.fromRunnable(() -> second.add(n))),
				Map.of("protocolVersion", McpSchema.LATEST_PROTOCOL_VERSION, "capabilities", Map.of(), "serverInfo",
						SERVER_INFO));

		this.transport.simulateIncomingMessage(new JSONRPCNotification(McpSchema.METHOD_NOTIFICATION_PROGRESS,
				Map.of("progressToken", "import-1", "progress", 0.5, "total", 1.0, "message", "halfway")));
		this.transport.simulateIncomingMessage(new JSONRPCNotification(McpSchema.METHOD_NOTIFICATION_PROGRESS,
				Map.of("progressToken", "import-1", "progress", 3)));

		await().atMost(TIMEOUT).untilAsserted(() -> assertThat(second).hasSize(2));
		assertThat(first).containsExactly(new McpSchema.ProgressNotification("import-1", 0.5, 1.0, "halfway"),
				new McpSchema.ProgressNotification("import-1", 3.0, null));
	}

	@Test
	void statsFollowTheConnection() {
		SessionStats before = prepareClient().build().getStats();
		assertThat(before.state()).isEqualTo(SessionState.DISCONNECTED);
		assertThat(before.connectedAt()).isNull();
		assertThat(before.uptime()).isNull();
		assertThat(before.reconnectAttempts()).isZero();

		connect(prepareClient(), Map.of("protocolVersion", McpSchema.LATEST_PROTOCOL_VERSION, "capabilities",
				Map.of(), "serverInfo", SERVER_INFO));

		SessionStats connected = this.client.getStats();
		assertThat(connected.state()).isEqualTo(SessionState.READY);
		assertThat(connected.isConnected()).isTrue();
		assertThat(connected.uptime()).isGreaterThanOrEqualTo(Duration.ZERO);

		StepVerifier.create(this.client.disconnect()).verifyComplete();

		SessionStats after = this.client.getStats();
		assertThat(after.state()).isEqualTo(SessionState.DISCONNECTED);
		assertThat(after.isConnected()).isFalse();
		assertThat(after.uptime()).isNull();
	}

}
