/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.server;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import io.toolwire.json.McpJsonMapper;
import io.toolwire.json.TypeRef;
import io.toolwire.server.McpServerFeatures.AsyncPromptSpecification;
import io.toolwire.server.McpServerFeatures.AsyncResourceSpecification;
import io.toolwire.server.McpServerFeatures.AsyncToolSpecification;
import io.toolwire.spec.McpError;
import io.toolwire.spec.McpMessageCodec;
import io.toolwire.spec.McpSchema;
import io.toolwire.spec.McpSchema.LoggingMessageNotification;
import io.toolwire.spec.McpServerSession;
import io.toolwire.spec.McpServerTransportProvider;
import io.toolwire.spec.McpTransport;

/**
 * The asynchronous server. Accepts peers from a {@link McpServerTransportProvider} for
 * as long as it runs, serving each one with its own {@link McpServerSession}, and
 * exposes the tools, resources and prompts of its {@link McpCapabilityRegistry} to all of
 * them.
 *
 * <p>
 * Capabilities may be added and removed while peers are connected. When the matching
 * capability is flagged {@code listChanged}, every initialized peer is sent the
 * corresponding {@code list_changed} notification.
 *
 * <p>
 * Instances are created with {@link McpServer#async(McpServerTransportProvider)} and
 * start accepting peers immediately.
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 * @see McpServer
 * @see McpSchema
 */
public class McpAsyncServer {

	private static final Logger logger = LoggerFactory.getLogger(McpAsyncServer.class);

	private static final Duration ACCEPT_RETRY_DELAY = Duration.ofMillis(100);

	private static final TypeRef<McpSchema.CallToolRequest> CALL_TOOL_REQUEST_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.GetPromptRequest> GET_PROMPT_REQUEST_TYPE_REF = new TypeRef<>() {
	};

	private final McpServerTransportProvider transportProvider;

	private final McpMessageCodec codec;

	private final McpSchema.ServerCapabilities serverCapabilities;

	private final McpSchema.Implementation serverInfo;

	private final String instructions;

	private final Duration requestTimeout;

	private final int maxConcurrentRequests;

	private final int maxProtocolViolations;

	private final McpCapabilityRegistry registry = new McpCapabilityRegistry();

	private final Map<String, McpServerSession> sessions = new ConcurrentHashMap<>();

	private final Map<String, McpServerSession.RequestHandler<?>> requestHandlers;

	private final Map<String, McpServerSession.NotificationHandler> notificationHandlers;

	private final AtomicBoolean closing = new AtomicBoolean();

	private final Disposable acceptLoop;

	private List<String> protocolVersions = McpSchema.SUPPORTED_PROTOCOL_VERSIONS;

	McpAsyncServer(McpServerTransportProvider transportProvider, McpJsonMapper jsonMapper,
			McpServerFeatures.Async features, Duration requestTimeout, int maxConcurrentRequests,
			int maxProtocolViolations) {
		this.transportProvider = transportProvider;
		this.codec = new McpMessageCodec(jsonMapper);
		this.serverInfo = features.serverInfo();
		this.serverCapabilities = features.serverCapabilities();
		this.instructions = features.instructions();
		this.requestTimeout = requestTimeout;
		this.maxConcurrentRequests = maxConcurrentRequests;
		this.maxProtocolViolations = maxProtocolViolations;

		features.tools().forEach(this.registry::register);
		features.resources().forEach(this.registry::register);
		features.prompts().forEach(this.registry::register);

		Map<String, McpServerSession.RequestHandler<?>> requestHandlers = new HashMap<>();

		// Ping MUST respond with an empty data, but not NULL response.
		requestHandlers.put(McpSchema.METHOD_PING, (exchange, params) -> Mono.just(Map.of()));

		if (this.serverCapabilities.tools() != null) {
			requestHandlers.put(McpSchema.METHOD_TOOLS_LIST, toolsListRequestHandler());
			requestHandlers.put(McpSchema.METHOD_TOOLS_CALL, toolsCallRequestHandler());
		}

		if (this.serverCapabilities.resources() != null) {
			requestHandlers.put(McpSchema.METHOD_RESOURCES_LIST, resourcesListRequestHandler());
			requestHandlers.put(McpSchema.METHOD_RESOURCES_READ, resourcesReadRequestHandler());
			if (Boolean.TRUE.equals(this.serverCapabilities.resources().subscribe())) {
				requestHandlers.put(McpSchema.METHOD_RESOURCES_SUBSCRIBE, resourcesSubscribeRequestHandler());
				requestHandlers.put(McpSchema.METHOD_RESOURCES_UNSUBSCRIBE, resourcesUnsubscribeRequestHandler());
			}
		}

		if (this.serverCapabilities.prompts() != null) {
			requestHandlers.put(McpSchema.METHOD_PROMPT_LIST, promptsListRequestHandler());
			requestHandlers.put(McpSchema.METHOD_PROMPT_GET, promptsGetRequestHandler());
		}

		if (this.serverCapabilities.logging() != null) {
			requestHandlers.put(McpSchema.METHOD_LOGGING_SET_LEVEL, setLoggerRequestHandler());
		}
		this.requestHandlers = Map.copyOf(requestHandlers);

		Map<String, McpServerSession.NotificationHandler> notificationHandlers = new HashMap<>();
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_INITIALIZED, (exchange, params) -> Mono
			.fromRunnable(() -> logger.info("Session {} initialized by {}", exchange.getSessionId(),
					exchange.getClientInfo())));
		this.notificationHandlers = Map.copyOf(notificationHandlers);

		this.acceptLoop = Mono.defer(this.transportProvider::acceptPeer)
			.map(Optional::of)
			.defaultIfEmpty(Optional.empty())
			.repeat()
			.takeWhile(Optional::isPresent)
			.map(Optional::get)
			.retryWhen(Retry.fixedDelay(Long.MAX_VALUE, ACCEPT_RETRY_DELAY)
				.filter(error -> !this.closing.get())
				.doBeforeRetry(signal -> logger.warn("Server {} failed to accept a peer, retrying in {}",
						this.serverInfo.name(), ACCEPT_RETRY_DELAY, signal.failure())))
			.subscribe(this::startSession, error -> {
				if (!this.closing.get()) {
					logger.error("Server {} stopped accepting peers", this.serverInfo.name(), error);
				}
			}, () -> logger.info("Server {} stopped accepting peers", this.serverInfo.name()));
	}

	// ---------------------------------------
	// Lifecycle Management
	// ---------------------------------------

	private void startSession(McpTransport transport) {
		McpServerSession session = new McpServerSession(UUID.randomUUID().toString(), transport, this.codec,
				this.requestTimeout, this.maxConcurrentRequests, this.maxProtocolViolations,
				Schedulers.boundedElastic(), this::asyncInitializeRequestHandler, this.requestHandlers,
				this.notificationHandlers);
		if (this.closing.get()) {
			session.close();
			return;
		}
		this.sessions.put(session.getId(), session);
		logger.info("Server {} accepted peer, session {}", this.serverInfo.name(), session.getId());
		session.serve().doFinally(signal -> this.sessions.remove(session.getId())).subscribe();
	}

	private Mono<McpSchema.InitializeResult> asyncInitializeRequestHandler(
			McpSchema.InitializeRequest initializeRequest) {
		return Mono.defer(() -> {
			// The server MUST respond with the highest protocol version it supports if
			// it does not support the requested (e.g. Client) version.
			String serverProtocolVersion = this.protocolVersions.get(this.protocolVersions.size() - 1);

			if (this.protocolVersions.contains(initializeRequest.protocolVersion())) {
				serverProtocolVersion = initializeRequest.protocolVersion();
			}
			else {
				logger.warn(
						"Client requested unsupported protocol version: {}, so the server will suggest the {} version instead",
						initializeRequest.protocolVersion(), serverProtocolVersion);
			}

			return Mono.just(new McpSchema.InitializeResult(serverProtocolVersion, this.serverCapabilities,
					this.serverInfo, this.instructions));
		});
	}

	public McpSchema.ServerCapabilities getServerCapabilities() {
		return this.serverCapabilities;
	}

	public McpSchema.Implementation getServerInfo() {
		return this.serverInfo;
	}

	/**
	 * The number of peers currently connected.
	 * @return the number of live sessions
	 */
	public int getActiveSessionCount() {
		return this.sessions.size();
	}

	/**
	 * Stops accepting peers, then closes every live session.
	 * @return a {@link Mono} that completes once the listener and all sessions are closed
	 */
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			this.closing.set(true);
			this.acceptLoop.dispose();
			return this.transportProvider.closeGracefully()
				.then(Flux.fromIterable(this.sessions.values())
					.flatMap(session -> session.closeGracefully().onErrorResume(error -> {
						logger.warn("Failed to close session {}", session.getId(), error);
						return Mono.empty();
					}))
					.then());
		});
	}

	public void close() {
		this.closing.set(true);
		this.acceptLoop.dispose();
		this.transportProvider.close();
		this.sessions.values().forEach(McpServerSession::close);
	}

	/**
	 * This method is package-private and used for test only. Should not be called by user
	 * code.
	 * @param protocolVersions the protocol versions the server accepts, latest last
	 */
	void setProtocolVersions(List<String> protocolVersions) {
		this.protocolVersions = List.copyOf(protocolVersions);
	}

	private Mono<Void> notifyClients(String method, Object params, Predicate<McpServerSession> filter) {
		return Flux.fromIterable(this.sessions.values())
			.filter(session -> session.getState() == McpServerSession.State.SERVING)
			.filter(filter)
			.flatMap(session -> session.sendNotification(method, params).onErrorResume(error -> {
				logger.warn("Failed to send {} to session {}: {}", method, session.getId(), error.getMessage());
				return Mono.empty();
			}))
			.then();
	}

	// ---------------------------------------
	// Tool Management
	// ---------------------------------------

	/**
	 * Add a new tool specification at runtime.
	 * @param toolSpecification The tool specification to add
	 * @return Mono that completes when clients have been notified of the change
	 */
	public Mono<Void> addTool(AsyncToolSpecification toolSpecification) {
		if (toolSpecification == null) {
			return Mono.error(invalid("Tool specification must not be null"));
		}
		if (this.serverCapabilities.tools() == null) {
			return Mono.error(invalid("Server must be configured with tool capabilities"));
		}
		return Mono.defer(() -> {
			try {
				this.registry.register(toolSpecification);
			}
			catch (McpDuplicateCapabilityException e) {
				return Mono.error(invalid("Tool with name '" + toolSpecification.name() + "' already exists"));
			}
			logger.debug("Added tool handler: {}", toolSpecification.name());
			if (Boolean.TRUE.equals(this.serverCapabilities.tools().listChanged())) {
				return notifyToolsListChanged();
			}
			return Mono.empty();
		});
	}

	/**
	 * Remove a tool at runtime. Calls already dispatched to it run to completion.
	 * @param toolName The name of the tool to remove
	 * @return Mono that completes when clients have been notified of the change
	 */
	public Mono<Void> removeTool(String toolName) {
		if (toolName == null) {
			return Mono.error(invalid("Tool name must not be null"));
		}
		if (this.serverCapabilities.tools() == null) {
			return Mono.error(invalid("Server must be configured with tool capabilities"));
		}
		return Mono.defer(() -> {
			if (!this.registry.unregister(CapabilityNamespace.TOOLS, toolName)) {
				return Mono.error(McpError.TOOL_NOT_FOUND.apply(toolName));
			}
			logger.debug("Removed tool handler: {}", toolName);
			if (Boolean.TRUE.equals(this.serverCapabilities.tools().listChanged())) {
				return notifyToolsListChanged();
			}
			return Mono.empty();
		});
	}

	/**
	 * Hide a tool from {@code tools/list} and reject calls to it, without removing it.
	 * Calls already dispatched to it run to completion.
	 * @param toolName The name of the tool to disable
	 * @return Mono that completes when clients have been notified of the change
	 */
	public Mono<Void> disableTool(String toolName) {
		return setToolEnabled(toolName, false);
	}

	/**
	 * Make a disabled tool listed and callable again.
	 * @param toolName The name of the tool to enable
	 * @return Mono that completes when clients have been notified of the change
	 */
	public Mono<Void> enableTool(String toolName) {
		return setToolEnabled(toolName, true);
	}

	public boolean isToolEnabled(String toolName) {
		return this.registry.isEnabled(CapabilityNamespace.TOOLS, toolName);
	}

	private Mono<Void> setToolEnabled(String toolName, boolean enabled) {
		if (toolName == null) {
			return Mono.error(invalid("Tool name must not be null"));
		}
		if (this.serverCapabilities.tools() == null) {
			return Mono.error(invalid("Server must be configured with tool capabilities"));
		}
		return Mono.defer(() -> {
			if (this.registry.isEnabled(CapabilityNamespace.TOOLS, toolName) == enabled
					&& this.registry.getTool(toolName).isPresent()) {
				return Mono.empty();
			}
			if (!this.registry.setEnabled(CapabilityNamespace.TOOLS, toolName, enabled)) {
				return Mono.error(McpError.TOOL_NOT_FOUND.apply(toolName));
			}
			logger.info("{} tool: {}", enabled ? "Enabled" : "Disabled", toolName);
			if (Boolean.TRUE.equals(this.serverCapabilities.tools().listChanged())) {
				return notifyToolsListChanged();
			}
			return Mono.empty();
		});
	}

	public Mono<Void> notifyToolsListChanged() {
		return notifyClients(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED, null, session -> true);
	}

	private McpServerSession.RequestHandler<McpSchema.ListToolsResult> toolsListRequestHandler() {
		return (exchange, params) -> {
			List<McpSchema.Tool> tools = this.registry.listEnabledTools()
				.stream()
				.map(AsyncToolSpecification::tool)
				.toList();
			return Mono.just(new McpSchema.ListToolsResult(tools, null));
		};
	}

	private McpServerSession.RequestHandler<McpSchema.CallToolResult> toolsCallRequestHandler() {
		return (exchange, params) -> {
			McpSchema.CallToolRequest callToolRequest = this.codec.unmarshal(params, CALL_TOOL_REQUEST_TYPE_REF);
			if (callToolRequest == null || callToolRequest.name() == null) {
				return Mono.error(McpError.INVALID_PARAMS.apply("tools/call requires a tool name"));
			}
			return this.registry.getTool(callToolRequest.name())
				.map(tool -> this.registry.isEnabled(CapabilityNamespace.TOOLS, tool.name())
						? tool.callHandler().apply(exchange, callToolRequest)
						: Mono.<McpSchema.CallToolResult>error(
								McpError.INVALID_PARAMS.apply("tool '" + tool.name() + "' is disabled")))
				.orElseGet(() -> Mono.error(McpError.TOOL_NOT_FOUND.apply(callToolRequest.name())));
		};
	}

	// ---------------------------------------
	// Resource Management
	// ---------------------------------------

	/**
	 * Add a new resource at runtime.
	 * @param resourceSpecification The resource specification to add
	 * @return Mono that completes when clients have been notified of the change
	 */
	public Mono<Void> addResource(AsyncResourceSpecification resourceSpecification) {
		if (resourceSpecification == null) {
			return Mono.error(invalid("Resource must not be null"));
		}
		if (this.serverCapabilities.resources() == null) {
			return Mono.error(invalid("Server must be configured with resource capabilities"));
		}
		return Mono.defer(() -> {
			try {
				this.registry.register(resourceSpecification);
			}
			catch (McpDuplicateCapabilityException e) {
				return Mono
					.error(invalid("Resource with URI '" + resourceSpecification.name() + "' already exists"));
			}
			logger.debug("Added resource handler: {}", resourceSpecification.name());
			if (Boolean.TRUE.equals(this.serverCapabilities.resources().listChanged())) {
				return notifyResourcesListChanged();
			}
			return Mono.empty();
		});
	}

	/**
	 * Remove a resource at runtime.
	 * @param resourceUri The URI of the resource to remove
	 * @return Mono that completes when clients have been notified of the change
	 */
	public Mono<Void> removeResource(String resourceUri) {
		if (resourceUri == null) {
			return Mono.error(invalid("Resource URI must not be null"));
		}
		if (this.serverCapabilities.resources() == null) {
			return Mono.error(invalid("Server must be configured with resource capabilities"));
		}
		return Mono.defer(() -> {
			if (!this.registry.unregister(CapabilityNamespace.RESOURCES, resourceUri)) {
				return Mono.error(McpError.RESOURCE_NOT_FOUND.apply(resourceUri));
			}
			logger.debug("Removed resource handler: {}", resourceUri);
			if (Boolean.TRUE.equals(this.serverCapabilities.resources().listChanged())) {
				return notifyResourcesListChanged();
			}
			return Mono.empty();
		});
	}

	public Mono<Void> notifyResourcesListChanged() {
		return notifyClients(McpSchema.METHOD_NOTIFICATION_RESOURCES_LIST_CHANGED, null, session -> true);
	}

	/**
	 * Tells the peers subscribed to a resource that its contents changed.
	 * @param uri the URI of the changed resource
	 * @return Mono that completes when the subscribed clients have been notified
	 */
	public Mono<Void> notifyResourcesUpdated(String uri) {
		if (uri == null) {
			return Mono.error(invalid("Resource URI must not be null"));
		}
		return notifyClients(McpSchema.METHOD_NOTIFICATION_RESOURCES_UPDATED,
				new McpSchema.ResourcesUpdatedNotification(uri), session -> session.isSubscribed(uri));
	}

	private McpServerSession.RequestHandler<McpSchema.ListResourcesResult> resourcesListRequestHandler() {
		return (exchange, params) -> {
			List<McpSchema.Resource> resources = this.registry.listResources()
				.stream()
				.map(AsyncResourceSpecification::resource)
				.toList();
			return Mono.just(new McpSchema.ListResourcesResult(resources, null));
		};
	}

	private McpServerSession.RequestHandler<McpSchema.ReadResourceResult> resourcesReadRequestHandler() {
		return (exchange, params) -> {
			McpSchema.ReadResourceRequest resourceRequest = this.codec.unmarshal(params,
					McpSchema.ReadResourceRequest.class);
			if (resourceRequest == null || resourceRequest.uri() == null) {
				return Mono.error(McpError.INVALID_PARAMS.apply("resources/read requires a uri"));
			}
			return this.registry.getResource(resourceRequest.uri())
				.map(resource -> resource.readHandler().apply(exchange, resourceRequest))
				.orElseGet(() -> Mono.error(McpError.RESOURCE_NOT_FOUND.apply(resourceRequest.uri())));
		};
	}

	private McpServerSession.RequestHandler<Object> resourcesSubscribeRequestHandler() {
		return (exchange, params) -> {
			McpSchema.SubscribeRequest subscribeRequest = this.codec.unmarshal(params,
					McpSchema.SubscribeRequest.class);
			if (subscribeRequest == null || subscribeRequest.uri() == null) {
				return Mono.error(McpError.INVALID_PARAMS.apply("resources/subscribe requires a uri"));
			}
			if (this.registry.getResource(subscribeRequest.uri()).isEmpty()) {
				return Mono.error(McpError.RESOURCE_NOT_FOUND.apply(subscribeRequest.uri()));
			}
			exchange.getSession().subscribe(subscribeRequest.uri());
			logger.debug("Session {} subscribed to {}", exchange.getSessionId(), subscribeRequest.uri());
			return Mono.just(Map.of());
		};
	}

	private McpServerSession.RequestHandler<Object> resourcesUnsubscribeRequestHandler() {
		return (exchange, params) -> {
			McpSchema.UnsubscribeRequest unsubscribeRequest = this.codec.unmarshal(params,
					McpSchema.UnsubscribeRequest.class);
			if (unsubscribeRequest == null || unsubscribeRequest.uri() == null) {
				return Mono.error(McpError.INVALID_PARAMS.apply("resources/unsubscribe requires a uri"));
			}
			exchange.getSession().unsubscribe(unsubscribeRequest.uri());
			return Mono.just(Map.of());
		};
	}

	// ---------------------------------------
	// Prompt Management
	// ---------------------------------------

	/**
	 * Add a new prompt at runtime.
	 * @param promptSpecification The prompt specification to add
	 * @return Mono that completes when clients have been notified of the change
	 */
	public Mono<Void> addPrompt(AsyncPromptSpecification promptSpecification) {
		if (promptSpecification == null) {
			return Mono.error(invalid("Prompt specification must not be null"));
		}
		if (this.serverCapabilities.prompts() == null) {
			return Mono.error(invalid("Server must be configured with prompt capabilities"));
		}
		return Mono.defer(() -> {
			try {
				this.registry.register(promptSpecification);
			}
			catch (McpDuplicateCapabilityException e) {
				return Mono.error(invalid("Prompt with name '" + promptSpecification.name() + "' already exists"));
			}
			logger.debug("Added prompt handler: {}", promptSpecification.name());
			if (Boolean.TRUE.equals(this.serverCapabilities.prompts().listChanged())) {
				return notifyPromptsListChanged();
			}
			return Mono.empty();
		});
	}

	/**
	 * Remove a prompt at runtime.
	 * @param promptName The name of the prompt to remove
	 * @return Mono that completes when clients have been notified of the change
	 */
	public Mono<Void> removePrompt(String promptName) {
		if (promptName == null) {
			return Mono.error(invalid("Prompt name must not be null"));
		}
		if (this.serverCapabilities.prompts() == null) {
			return Mono.error(invalid("Server must be configured with prompt capabilities"));
		}
		return Mono.defer(() -> {
			if (!this.registry.unregister(CapabilityNamespace.PROMPTS, promptName)) {
				return Mono.error(McpError.PROMPT_NOT_FOUND.apply(promptName));
			}
			logger.debug("Removed prompt handler: {}", promptName);
			if (Boolean.TRUE.equals(this.serverCapabilities.prompts().listChanged())) {
				return notifyPromptsListChanged();
			}
			return Mono.empty();
		});
	}

	public Mono<Void> notifyPromptsListChanged() {
		return notifyClients(McpSchema.METHOD_NOTIFICATION_PROMPTS_LIST_CHANGED, null, session -> true);
	}

	private McpServerSession.RequestHandler<McpSchema.ListPromptsResult> promptsListRequestHandler() {
		return (exchange, params) -> {
			List<McpSchema.Prompt> prompts = this.registry.listPrompts()
				.stream()
				.map(AsyncPromptSpecification::prompt)
				.toList();
			return Mono.just(new McpSchema.ListPromptsResult(prompts, null));
		};
	}

	private McpServerSession.RequestHandler<McpSchema.GetPromptResult> promptsGetRequestHandler() {
		return (exchange, params) -> {
			McpSchema.GetPromptRequest promptRequest = this.codec.unmarshal(params, GET_PROMPT_REQUEST_TYPE_REF);
			if (promptRequest == null || promptRequest.name() == null) {
				return Mono.error(McpError.INVALID_PARAMS.apply("prompts/get requires a prompt name"));
			}
			return this.registry.getPrompt(promptRequest.name())
				.map(prompt -> prompt.promptHandler().apply(exchange, promptRequest))
				.orElseGet(() -> Mono.error(McpError.PROMPT_NOT_FOUND.apply(promptRequest.name())));
		};
	}

	// ---------------------------------------
	// Logging Management
	// ---------------------------------------

	/**
	 * Sends a log message to every initialized peer whose minimum level admits it.
	 * @param loggingMessageNotification The logging message to send
	 * @return A Mono that completes when the notification has been sent
	 */
	public Mono<Void> loggingNotification(LoggingMessageNotification loggingMessageNotification) {
		if (loggingMessageNotification == null || loggingMessageNotification.level() == null) {
			return Mono.error(invalid("Logging message must not be null"));
		}
		return notifyClients(McpSchema.METHOD_NOTIFICATION_MESSAGE, loggingMessageNotification,
				session -> session.isNotificationForLevelAllowed(loggingMessageNotification.level()));
	}

	private McpServerSession.RequestHandler<Object> setLoggerRequestHandler() {
		return (exchange, params) -> {
			McpSchema.SetLevelRequest setLevelRequest = this.codec.unmarshal(params, McpSchema.SetLevelRequest.class);
			if (setLevelRequest == null || setLevelRequest.level() == null) {
				return Mono.error(McpError.INVALID_PARAMS.apply("logging/setLevel requires a level"));
			}
			exchange.getSession().setMinLoggingLevel(setLevelRequest.level());
			logger.debug("Session {} set minimum logging level to {}", exchange.getSessionId(),
					setLevelRequest.level());
			return Mono.just(Map.of());
		};
	}

	private static McpError invalid(String message) {
		return McpError.builder(McpSchema.ErrorCodes.INVALID_REQUEST).message(message).build();
	}

}
