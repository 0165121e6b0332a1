/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.transport.inmemory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import io.toolwire.client.McpAsyncClient;
import io.toolwire.client.McpClient;
import io.toolwire.client.McpSyncClient;
import io.toolwire.server.McpServer;
import io.toolwire.server.McpSyncServer;
import io.toolwire.spec.McpSchema;
import io.toolwire.spec.McpTransport;
import io.toolwire.spec.McpTransportException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class InMemoryTransportTests {

	private InMemoryServerTransportProvider serverProvider;

	private McpSyncServer server;

	@BeforeEach
	void createSyncServer() {
		this.serverProvider = new InMemoryServerTransportProvider();
		this.server = McpServer.sync(this.serverProvider)
			.tool(McpSchema.Tool.builder()
				.name("test-tool")
				.description("a test tool")
				.inputSchema(McpSchema.JsonSchema.emptyObject())
				.build(), (exchange, request) -> new McpSchema.CallToolResult("test-result", false))
			.build();
	}

	@AfterEach
	void closeServer() {
		this.server.closeGracefully();
	}

	@Test
	void shouldSendMessageFromSyncClientToServer() {
		InMemoryClientTransportProvider clientProvider = new InMemoryClientTransportProvider(this.serverProvider);

		try (McpSyncClient client = McpClient.sync(clientProvider).build()) {
			client.connect();

			McpSchema.ListToolsResult toolList = client.listTools();
			assertThat(toolList.tools()).hasSize(1);

			McpSchema.CallToolResult result = client.callTool(new McpSchema.CallToolRequest("test-tool", Map.of()));

			assertThat(result.content().get(0)).isInstanceOf(McpSchema.TextContent.class);
			assertThat(((McpSchema.TextContent) result.content().get(0)).text()).isEqualTo("test-result");
		}
	}

	@Test
	void shouldSendMessageFromAsyncClientToServer() {
		InMemoryClientTransportProvider clientProvider = new InMemoryClientTransportProvider(this.serverProvider);
		McpAsyncClient client = McpClient.async(clientProvider).build();

		StepVerifier.create(client.connect()
			.then(client.listTools())
			.doOnNext(toolList -> assertThat(toolList.tools()).hasSize(1))
			.then(client.callTool(new McpSchema.CallToolRequest("test-tool", Map.of()))))
			.assertNext(result -> assertThat(result.content()).containsExactly(new McpSchema.TextContent("test-result")))
			.verifyComplete();

		StepVerifier.create(client.closeGracefully()).verifyComplete();
	}

	@Test
	void framesArriveInOrderOnThePeer() {
		InMemoryTransport.Pair pair = InMemoryTransport.pair("order");

		StepVerifier.create(pair.serverEnd().receive().take(3))
			.then(() -> {
				pair.clientEnd().send("one").block();
				pair.clientEnd().send("two").block();
				pair.clientEnd().send("three").block();
			})
			.expectNext("one", "two", "three")
			.verifyComplete();
	}

	@Test
	void closingEitherEndCompletesBoth() {
		InMemoryTransport.Pair pair = InMemoryTransport.pair("close");

		pair.serverEnd().closeGracefully().block();

		StepVerifier.create(pair.clientEnd().receive()).verifyComplete();
		StepVerifier.create(pair.serverEnd().receive()).verifyComplete();
		assertThat(pair.clientEnd().isClosed()).isTrue();
		StepVerifier.create(pair.clientEnd().send("late")).expectError(McpTransportException.class).verify();
	}

	@Test
	void failErrorsBothEnds() {
		InMemoryTransport.Pair pair = InMemoryTransport.pair("fail");

		pair.clientEnd().fail(new IOException("Connection reset by peer"));

		StepVerifier.create(pair.clientEnd().receive())
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpTransportException.class)
				.hasRootCauseMessage("Connection reset by peer"))
			.verify(Duration.ofSeconds(1));
		StepVerifier.create(pair.serverEnd().receive()).expectError(McpTransportException.class).verify();
	}

	@Test
	void mutedEndDropsFramesButSenderSucceeds() {
		InMemoryTransport.Pair pair = InMemoryTransport.pair("muted");
		pair.clientEnd().setMuted(true);

		StepVerifier.create(pair.serverEnd().send("dropped")).verifyComplete();
		pair.clientEnd().setMuted(false);
		StepVerifier.create(pair.serverEnd().send("delivered")).verifyComplete();

		StepVerifier.create(pair.clientEnd().receive().take(1)).expectNext("delivered").verifyComplete();
	}

	@Test
	void refusingProviderFailsConnect() {
		InMemoryClientTransportProvider clientProvider = new InMemoryClientTransportProvider(this.serverProvider);
		clientProvider.setRefusing(true);

		StepVerifier.create(clientProvider.connect())
			.expectErrorMessage("Connection refused (attempt 1)")
			.verify(Duration.ofSeconds(1));
		assertThat(clientProvider.getConnections()).isEmpty();
		assertThat(clientProvider.getConnectAttempts()).isOne();
	}

	@Test
	void closedServerProviderStopsAcceptingAndRefusesPeers() {
		InMemoryServerTransportProvider provider = new InMemoryServerTransportProvider();
		InMemoryClientTransportProvider clientProvider = new InMemoryClientTransportProvider(provider);

		McpTransport clientEnd = clientProvider.connect().block();
		StepVerifier.create(provider.acceptPeer())
			.assertNext(peer -> assertThat(peer.toString()).isEqualTo("InMemoryTransport[in-memory-1-server]"))
			.verifyComplete();
		assertThat(clientEnd).isSameAs(clientProvider.lastConnection());

		provider.closeGracefully().block();

		StepVerifier.create(provider.acceptPeer()).verifyComplete();
		StepVerifier.create(provider.acceptPeer()).verifyComplete();
		StepVerifier.create(clientProvider.connect()).expectError(McpTransportException.class).verify();
		assertThat(provider.isClosing()).isTrue();
	}

}
