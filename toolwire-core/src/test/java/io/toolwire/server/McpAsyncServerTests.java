/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.server;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import io.toolwire.MockMcpTransport;
import io.toolwire.json.McpJsonMapper;
import io.toolwire.server.McpServerFeatures.AsyncResourceSpecification;
import io.toolwire.server.McpServerFeatures.AsyncToolSpecification;
import io.toolwire.spec.McpError;
import io.toolwire.spec.McpSchema;
import io.toolwire.spec.McpSchema.JSONRPCNotification;
import io.toolwire.spec.McpSchema.JSONRPCRequest;
import io.toolwire.spec.McpSchema.JSONRPCResponse;
import io.toolwire.spec.McpServerTransportProvider;
import io.toolwire.spec.McpTransport;
import io.toolwire.spec.McpTransportException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link McpAsyncServer} with a single peer connected through a
 * {@link MockMcpTransport}.
 *
 * @author Christian Tzolov
 */
class McpAsyncServerTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private static final String TEST_RESOURCE_URI = "test://resource";

	private final MockMcpTransport transport = new MockMcpTransport();

	private McpServerTransportProvider transportProvider;

	private McpAsyncServer server;

	@BeforeEach
	void setUp() {
		this.transportProvider = mock(McpServerTransportProvider.class);
		when(this.transportProvider.acceptPeer()).thenReturn(Mono.<McpTransport>just(this.transport), Mono.never());
		when(this.transportProvider.closeGracefully()).thenReturn(Mono.empty());
	}

	@AfterEach
	void tearDown() {
		if (this.server != null) {
			this.server.closeGracefully().block(TIMEOUT);
		}
	}

	private McpServer.AsyncSpecification prepareServer() {
		return McpServer.async(this.transportProvider).serverInfo("test-server", "1.0.0");
	}

	private static AsyncToolSpecification echoTool(String name) {
		return new AsyncToolSpecification(McpSchema.Tool.builder().name(name).description("Echoes its input").build(),
				(exchange, request) -> Mono
					.just(new McpSchema.CallToolResult(String.valueOf(request.arguments().get("text")), false)));
	}

	private static AsyncResourceSpecification textResource(String uri) {
		return new AsyncResourceSpecification(new McpSchema.Resource(uri, "test", null, "text/plain"),
				(exchange, request) -> Mono.just(new McpSchema.ReadResourceResult(
						List.of(new McpSchema.TextResourceContents(uri, "text/plain", "content")))));
	}

	private JSONRPCResponse initialize(String protocolVersion) {
		this.transport.simulateIncomingMessage(new JSONRPCRequest(McpSchema.METHOD_INITIALIZE, "init",
				Map.of("protocolVersion", protocolVersion, "capabilities", Map.of(), "clientInfo",
						Map.of("name", "test-client", "version", "1.0.0"))));
		return awaitResponse("init");
	}

	private JSONRPCResponse call(Object id, String method, Object params) {
		this.transport.simulateIncomingMessage(new JSONRPCRequest(method, id, params));
		return awaitResponse(id);
	}

	private JSONRPCResponse awaitResponse(Object id) {
		return await().atMost(TIMEOUT).until(() -> this.transport.findResponse(id), Objects::nonNull);
	}

	private List<JSONRPCNotification> sentNotifications(String method) {
		return this.transport.getSentPayloads()
			.stream()
			.filter(JSONRPCNotification.class::isInstance)
			.map(JSONRPCNotification.class::cast)
			.filter(notification -> method.equals(notification.method()))
			.toList();
	}

	@Test
	void duplicateToolsFailTheBuild() {
		McpServer.AsyncSpecification spec = prepareServer().tools(echoTool("echo"), echoTool("echo"));

		assertThatThrownBy(spec::build).isInstanceOf(McpDuplicateCapabilityException.class)
			.hasMessageContaining("echo");
	}

	@Test
	void acceptFailureDoesNotStopTheListener() {
		when(this.transportProvider.acceptPeer()).thenReturn(
				Mono.<McpTransport>error(new McpTransportException("Failed to accept peer")),
				Mono.<McpTransport>just(this.transport), Mono.never());
		this.server = prepareServer().build();

		JSONRPCResponse response = initialize(McpSchema.LATEST_PROTOCOL_VERSION);

		assertThat(response.hasError()).isFalse();
		assertThat(this.server.getActiveSessionCount()).isEqualTo(1);
		verify(this.transportProvider, atLeast(3)).acceptPeer();
	}

	@Test
	void unsupportedProtocolVersionIsAnsweredWithTheLatest() {
		this.server = prepareServer().build();

		JSONRPCResponse response = initialize("1999-01-01");

		assertThat(response.result()).asInstanceOf(InstanceOfAssertFactories.MAP)
			.containsEntry("protocolVersion", McpSchema.LATEST_PROTOCOL_VERSION);
		assertThat(this.server.getActiveSessionCount()).isEqualTo(1);
	}

	@Test
	void supportedOlderProtocolVersionIsAccepted() {
		this.server = prepareServer().build();

		JSONRPCResponse response = initialize(McpSchema.PROTOCOL_VERSION_2024_11_05);

		assertThat(response.result()).asInstanceOf(InstanceOfAssertFactories.MAP)
			.containsEntry("protocolVersion", McpSchema.PROTOCOL_VERSION_2024_11_05);
	}

	@Test
	void toolCallIsRoutedByName() {
		this.server = prepareServer().tools(echoTool("echo")).build();
		initialize(McpSchema.LATEST_PROTOCOL_VERSION);

		JSONRPCResponse found = call(1, McpSchema.METHOD_TOOLS_CALL,
				Map.of("name", "echo", "arguments", Map.of("text", "hi")));
		JSONRPCResponse missing = call(2, McpSchema.METHOD_TOOLS_CALL, Map.of("name", "nope"));

		assertThat(found.hasError()).isFalse();
		assertThat(found.result().toString()).contains("hi");
		assertThat(missing.error().code()).isEqualTo(McpSchema.ErrorCodes.TOOL_NOT_FOUND);
		assertThat(missing.error().message()).isEqualTo("tool not found: nope");
	}

	@Test
	void toolsListReturnsRegistrationOrder() {
		this.server = prepareServer().tools(echoTool("b"), echoTool("a")).build();
		initialize(McpSchema.LATEST_PROTOCOL_VERSION);

		JSONRPCResponse response = call(3, McpSchema.METHOD_TOOLS_LIST, null);

		McpSchema.ListToolsResult result = McpJsonMapper.getDefault()
			.convertValue(response.result(), McpSchema.ListToolsResult.class);
		assertThat(result.tools()).extracting(McpSchema.Tool::name).containsExactly("b", "a");
	}

	@Test
	void addToolNotifiesInitializedPeers() {
		this.server = prepareServer().build();
		initialize(McpSchema.LATEST_PROTOCOL_VERSION);

		StepVerifier.create(this.server.addTool(echoTool("late"))).verifyComplete();

		await().atMost(TIMEOUT)
			.untilAsserted(() -> assertThat(sentNotifications(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED))
				.hasSize(1));
		assertThat(call(4, McpSchema.METHOD_TOOLS_CALL, Map.of("name", "late", "arguments", Map.of("text", "x")))
			.hasError()).isFalse();
	}

	@Test
	void disabledToolIsHiddenAndRejected() {
		this.server = prepareServer().tools(echoTool("echo"), echoTool("other")).build();
		initialize(McpSchema.LATEST_PROTOCOL_VERSION);

		StepVerifier.create(this.server.disableTool("echo")).verifyComplete();

		assertThat(this.server.isToolEnabled("echo")).isFalse();
		McpSchema.ListToolsResult listed = McpJsonMapper.getDefault()
			.convertValue(call(20, McpSchema.METHOD_TOOLS_LIST, null).result(), McpSchema.ListToolsResult.class);
		assertThat(listed.tools()).extracting(McpSchema.Tool::name).containsExactly("other");

		JSONRPCResponse rejected = call(21, McpSchema.METHOD_TOOLS_CALL,
				Map.of("name", "echo", "arguments", Map.of("text", "hi")));
		assertThat(rejected.error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
		assertThat(rejected.error().message()).isEqualTo("Invalid params: tool 'echo' is disabled");
		await().atMost(TIMEOUT)
			.untilAsserted(() -> assertThat(sentNotifications(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED))
				.hasSize(1));
	}

	@Test
	void enabledToolIsCallableAgain() {
		this.server = prepareServer().tools(echoTool("echo")).build();
		initialize(McpSchema.LATEST_PROTOCOL_VERSION);
		StepVerifier.create(this.server.disableTool("echo")).verifyComplete();

		StepVerifier.create(this.server.enableTool("echo")).verifyComplete();

		JSONRPCResponse response = call(22, McpSchema.METHOD_TOOLS_CALL,
				Map.of("name", "echo", "arguments", Map.of("text", "back")));
		assertThat(response.hasError()).isFalse();
		assertThat(response.result().toString()).contains("back");
		await().atMost(TIMEOUT)
			.untilAsserted(() -> assertThat(sentNotifications(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED))
				.hasSize(2));
	}

	@Test
	void togglingToAStateAlreadyHeldSendsNoNotification() {
		this.server = prepareServer().tools(echoTool("echo")).build();
		initialize(McpSchema.LATEST_PROTOCOL_VERSION);

		StepVerifier.create(this.server.enableTool("echo")).verifyComplete();

		assertThat(sentNotifications(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED)).isEmpty();
	}

	@Test
	void disablingAnUnknownToolFailsWithToolNotFound() {
		this.server = prepareServer().build();

		StepVerifier.create(this.server.disableTool("ghost"))
			.expectErrorSatisfies(error -> assertThat(((McpError) error).getCode())
				.isEqualTo(McpSchema.ErrorCodes.TOOL_NOT_FOUND))
			.verify(TIMEOUT);
	}

	@Test
	void addingADuplicateToolFails() {
		this.server = prepareServer().tools(echoTool("echo")).build();

		StepVerifier.create(this.server.addTool(echoTool("echo")))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class)
				.hasMessage("Tool with name 'echo' already exists"))
			.verify(TIMEOUT);
	}

	@Test
	void removingAnUnknownToolFailsWithToolNotFound() {
		this.server = prepareServer().build();

		StepVerifier.create(this.server.removeTool("ghost"))
			.expectErrorSatisfies(error -> assertThat(((McpError) error).getCode())
				.isEqualTo(McpSchema.ErrorCodes.TOOL_NOT_FOUND))
			.verify(TIMEOUT);
	}

	@Test
	void serverWithoutToolCapabilityDoesNotServeTools() {
		this.server = prepareServer().capabilities(McpSchema.ServerCapabilities.builder().logging().build()).build();
		initialize(McpSchema.LATEST_PROTOCOL_VERSION);

		assertThat(call(5, McpSchema.METHOD_TOOLS_LIST, null).error().code())
			.isEqualTo(McpSchema.ErrorCodes.METHOD_NOT_FOUND);
		StepVerifier.create(this.server.addTool(echoTool("echo")))
			.expectErrorMessage("Server must be configured with tool capabilities")
			.verify(TIMEOUT);
	}

	@Test
	void resourceUpdatesReachOnlySubscribedPeers() {
		this.server = prepareServer().resources(textResource(TEST_RESOURCE_URI), textResource("test://other"))
			.build();
		initialize(McpSchema.LATEST_PROTOCOL_VERSION);
		assertThat(call(6, McpSchema.METHOD_RESOURCES_SUBSCRIBE, Map.of("uri", TEST_RESOURCE_URI)).hasError())
			.isFalse();

		StepVerifier.create(this.server.notifyResourcesUpdated("test://other")).verifyComplete();
		StepVerifier.create(this.server.notifyResourcesUpdated(TEST_RESOURCE_URI)).verifyComplete();

		List<JSONRPCNotification> updates = sentNotifications(McpSchema.METHOD_NOTIFICATION_RESOURCES_UPDATED);
		assertThat(updates).hasSize(1);
		assertThat(updates.get(0).params()).asInstanceOf(InstanceOfAssertFactories.MAP)
			.containsEntry("uri", TEST_RESOURCE_URI);
	}

	@Test
	void subscribingToAnUnknownResourceFails() {
		this.server = prepareServer().build();
		initialize(McpSchema.LATEST_PROTOCOL_VERSION);

		JSONRPCResponse response = call(7, McpSchema.METHOD_RESOURCES_SUBSCRIBE, Map.of("uri", "test://missing"));

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.RESOURCE_NOT_FOUND);
		assertThat(response.error().data()).isEqualTo(Map.of("uri", "test://missing"));
	}

	@Test
	void loggingNotificationsHonourThePeerLevel() {
		this.server = prepareServer().build();
		initialize(McpSchema.LATEST_PROTOCOL_VERSION);
		assertThat(call(8, McpSchema.METHOD_LOGGING_SET_LEVEL, Map.of("level", "warning")).hasError()).isFalse();

		StepVerifier
			.create(this.server.loggingNotification(
					new McpSchema.LoggingMessageNotification(McpSchema.LoggingLevel.INFO, "test", "quiet")))
			.verifyComplete();
		StepVerifier
			.create(this.server.loggingNotification(
					new McpSchema.LoggingMessageNotification(McpSchema.LoggingLevel.ERROR, "test", "loud")))
			.verifyComplete();

		List<JSONRPCNotification> messages = sentNotifications(McpSchema.METHOD_NOTIFICATION_MESSAGE);
		assertThat(messages).hasSize(1);
		assertThat(messages.get(0).params()).asInstanceOf(InstanceOfAssertFactories.MAP)
			.containsEntry("level", "error")
			.containsEntry("data", "loud");
	}

	@Test
	void notificationsSkipPeersStillInHandshake() {
		this.server = prepareServer().build();
		await().atMost(TIMEOUT).until(() -> this.server.getActiveSessionCount() == 1);

		StepVerifier.create(this.server.notifyToolsListChanged()).verifyComplete();

		assertThat(this.transport.getSentFrames()).isEmpty();
	}

	@Test
	void closeGracefullyClosesSessionsAndMayBeRepeated() {
		this.server = prepareServer().build();
		initialize(McpSchema.LATEST_PROTOCOL_VERSION);

		StepVerifier.create(this.server.closeGracefully()).verifyComplete();
		StepVerifier.create(this.server.closeGracefully()).verifyComplete();

		assertThat(this.transport.isClosed()).isTrue();
		verify(this.transportProvider, atLeastOnce()).closeGracefully();
		await().atMost(TIMEOUT).until(() -> this.server.getActiveSessionCount() == 0);
	}

}
