/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.client;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import io.toolwire.json.McpJsonMapper;
import io.toolwire.json.TypeRef;
import io.toolwire.spec.McpClientSession;
import io.toolwire.spec.McpClientSession.NotificationHandler;
import io.toolwire.spec.McpClientSession.RequestHandler;
import io.toolwire.spec.McpClientTransportProvider;
import io.toolwire.spec.McpConnectionLostException;
import io.toolwire.spec.McpError;
import io.toolwire.spec.McpMessageCodec;
import io.toolwire.spec.McpSchema;
import io.toolwire.spec.McpSchema.ClientCapabilities;
import io.toolwire.spec.McpSchema.CreateMessageRequest;
import io.toolwire.spec.McpSchema.CreateMessageResult;
import io.toolwire.spec.McpSchema.GetPromptRequest;
import io.toolwire.spec.McpSchema.GetPromptResult;
import io.toolwire.spec.McpSchema.ListPromptsResult;
import io.toolwire.spec.McpSchema.LoggingLevel;
import io.toolwire.spec.McpSchema.LoggingMessageNotification;
import io.toolwire.spec.McpSchema.PaginatedRequest;
import io.toolwire.spec.McpTimeoutException;
import io.toolwire.spec.McpTransportException;
import io.toolwire.util.Assert;

/**
 * The asynchronous client. Owns at most one connection at a time, obtained from a
 * {@link McpClientTransportProvider}, and keeps it alive.
 *
 * <p>
 * The client follows a lifecycle:
 * <ol>
 * <li>{@link #connect()} opens a transport and runs the handshake: {@code initialize},
 * protocol version check, {@code notifications/initialized}. The client is then
 * {@link SessionState#READY}.
 * <li>While connected, a heartbeat pings the server at a fixed interval. A missed ping
 * makes the client {@link SessionState#DEGRADED}; reaching the miss threshold is treated
 * as a lost connection.
 * <li>When the connection is lost, every outstanding call fails with
 * {@link McpConnectionLostException}, and the client reconnects with exponential backoff
 * as configured by its {@link ReconnectPolicy}, running a fresh handshake each time.
 * When the attempts are exhausted, the client is {@link SessionState#DISCONNECTED}.
 * <li>{@link #disconnect()} closes the connection and never triggers a reconnect.
 * </ol>
 *
 * <p>
 * Calls made while the client is connecting or reconnecting wait for the connection
 * within their own timeout. Calls made while it is disconnected fail immediately.
 *
 * @author Dariusz Jędrzejczyk
 * @author Christian Tzolov
 * @see McpClient
 * @see McpSchema
 * @see McpClientSession
 */
public class McpAsyncClient {

	private static final Logger logger = LoggerFactory.getLogger(McpAsyncClient.class);

	private static final TypeRef<Object> OBJECT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.InitializeResult> INITIALIZE_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.CallToolResult> CALL_TOOL_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.ListToolsResult> LIST_TOOLS_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.ListResourcesResult> LIST_RESOURCES_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.ReadResourceResult> READ_RESOURCE_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<ListPromptsResult> LIST_PROMPTS_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<GetPromptResult> GET_PROMPT_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private final McpClientTransportProvider transportProvider;

	private final McpMessageCodec codec;

	private final Settings settings;

	private final McpConnectionObserver observer;

	private final ClientCapabilities clientCapabilities;

	private final McpSchema.Implementation clientInfo;

	private final Map<String, McpSchema.Root> roots;

	private final Map<String, RequestHandler<?>> requestHandlers;

	private final Map<String, NotificationHandler> notificationHandlers;

	/**
	 * Guards every state transition together with the generation and session it belongs
	 * to.
	 */
	private final Object lifecycleLock = new Object();

	private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.DISCONNECTED);

	private final Sinks.Many<SessionState> stateSink = Sinks.many().replay().latest();

	/**
	 * Incremented by every {@link #connect()} and {@link #disconnect()}. Callbacks of an
	 * older generation are ignored.
	 */
	private final AtomicLong generation = new AtomicLong();

	private final AtomicInteger missedHeartbeats = new AtomicInteger();

	private final Disposable.Swap heartbeat = Disposables.swap();

	private final Disposable.Swap reconnect = Disposables.swap();

	private final Disposable.Swap connectionWatch = Disposables.swap();

	private volatile McpClientSession session;

	private volatile McpSchema.InitializeResult initializeResult;

	private volatile Instant connectedAt;

	private final AtomicInteger reconnectAttempts = new AtomicInteger();

	private List<String> protocolVersions = McpSchema.SUPPORTED_PROTOCOL_VERSIONS;

	McpAsyncClient(McpClientTransportProvider transportProvider, McpJsonMapper jsonMapper, Settings settings,
			McpClientFeatures.Async features, McpConnectionObserver observer) {

		Assert.notNull(transportProvider, "Transport provider must not be null");
		Assert.notNull(jsonMapper, "JsonMapper must not be null");
		Assert.notNull(settings, "Settings must not be null");
		Assert.notNull(features, "Features must not be null");
		Assert.notNull(observer, "Connection observer must not be null");

		this.transportProvider = transportProvider;
		this.codec = new McpMessageCodec(jsonMapper);
		this.settings = settings;
		this.observer = observer;
		this.clientInfo = features.clientInfo();
		this.clientCapabilities = features.clientCapabilities();
		this.roots = features.roots();
		this.stateSink.tryEmitNext(SessionState.DISCONNECTED);

		// Request Handlers
		Map<String, RequestHandler<?>> requestHandlers = new HashMap<>();

		// Ping MUST respond with an empty data, but not NULL response.
		requestHandlers.put(McpSchema.METHOD_PING, params -> Mono.just(Map.of()));

		if (this.clientCapabilities.roots() != null) {
			requestHandlers.put(McpSchema.METHOD_ROOTS_LIST, rootsListRequestHandler());
		}

		if (this.clientCapabilities.sampling() != null) {
			Assert.notNull(features.samplingHandler(),
					"Sampling handler must not be null when client capabilities include sampling");
			requestHandlers.put(McpSchema.METHOD_SAMPLING_CREATE_MESSAGE,
					samplingCreateMessageHandler(features.samplingHandler()));
		}
		this.requestHandlers = Map.copyOf(requestHandlers);

		// Notification Handlers
		Map<String, NotificationHandler> notificationHandlers = new HashMap<>();

		List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumersFinal = new ArrayList<>();
		toolsChangeConsumersFinal
			.add(notification -> Mono.fromRunnable(() -> logger.debug("Tools changed: {}", notification)));
		toolsChangeConsumersFinal.addAll(features.toolsChangeConsumers());
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED,
				asyncToolsChangeNotificationHandler(toolsChangeConsumersFinal));

		List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumersFinal = new ArrayList<>();
		resourcesChangeConsumersFinal
			.add(notification -> Mono.fromRunnable(() -> logger.debug("Resources changed: {}", notification)));
		resourcesChangeConsumersFinal.addAll(features.resourcesChangeConsumers());
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_RESOURCES_LIST_CHANGED,
				asyncResourcesChangeNotificationHandler(resourcesChangeConsumersFinal));

		List<Function<McpSchema.ResourcesUpdatedNotification, Mono<Void>>> resourcesUpdateConsumersFinal = new ArrayList<>();
		resourcesUpdateConsumersFinal
			.add(notification -> Mono.fromRunnable(() -> logger.debug("Resource updated: {}", notification)));
		resourcesUpdateConsumersFinal.addAll(features.resourcesUpdateConsumers());
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_RESOURCES_UPDATED,
				asyncResourcesUpdatedNotificationHandler(resourcesUpdateConsumersFinal));

		List<Function<List<McpSchema.Prompt>, Mono<Void>>> promptsChangeConsumersFinal = new ArrayList<>();
		promptsChangeConsumersFinal
			.add(notification -> Mono.fromRunnable(() -> logger.debug("Prompts changed: {}", notification)));
		promptsChangeConsumersFinal.addAll(features.promptsChangeConsumers());
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_PROMPTS_LIST_CHANGED,
				asyncPromptsChangeNotificationHandler(promptsChangeConsumersFinal));

		List<Function<LoggingMessageNotification, Mono<Void>>> loggingConsumersFinal = new ArrayList<>();
		loggingConsumersFinal.add(notification -> Mono.fromRunnable(() -> logger.debug("Logging: {}", notification)));
		loggingConsumersFinal.addAll(features.loggingConsumers());
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_MESSAGE,
				asyncLoggingNotificationHandler(loggingConsumersFinal));

		List<Function<McpSchema.ProgressNotification, Mono<Void>>> progressConsumersFinal = new ArrayList<>();
		progressConsumersFinal
			.add(notification -> Mono.fromRunnable(() -> logger.debug("Progress: {}", notification)));
		progressConsumersFinal.addAll(features.progressConsumers());
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_PROGRESS,
				asyncProgressNotificationHandler(progressConsumersFinal));

		this.notificationHandlers = Map.copyOf(notificationHandlers);
	}

	// --------------------------
	// State
	// --------------------------

	public SessionState getState() {
		return this.state.get();
	}

	/**
	 * The state of this client followed by each change. Late subscribers first receive
	 * the current state.
	 * @return the state stream
	 */
	public Flux<SessionState> stateChanges() {
		return this.stateSink.asFlux();
	}

	/**
	 * Connection statistics: when the current connection came up, its uptime and the
	 * reconnect attempts made since the last successful handshake.
	 * @return a snapshot of the statistics
	 */
	public SessionStats getStats() {
		synchronized (this.lifecycleLock) {
			return SessionStats.of(this.state.get(), this.connectedAt, this.reconnectAttempts.get());
		}
	}

	public boolean isConnected() {
		return this.state.get().isConnected();
	}

	/**
	 * Get the server capabilities of the current connection.
	 * @return The server capabilities, or {@code null} before the first handshake
	 */
	public McpSchema.ServerCapabilities getServerCapabilities() {
		McpSchema.InitializeResult result = this.initializeResult;
		return (result != null) ? result.capabilities() : null;
	}

	/**
	 * Get the server implementation information.
	 * @return The server implementation details, or {@code null} before the first
	 * handshake
	 */
	public McpSchema.Implementation getServerInfo() {
		McpSchema.InitializeResult result = this.initializeResult;
		return (result != null) ? result.serverInfo() : null;
	}

	public String getServerInstructions() {
		McpSchema.InitializeResult result = this.initializeResult;
		return (result != null) ? result.instructions() : null;
	}

	public ClientCapabilities getClientCapabilities() {
		return this.clientCapabilities;
	}

	public McpSchema.Implementation getClientInfo() {
		return this.clientInfo;
	}

	private void transition(SessionState next) {
		SessionState previous;
		synchronized (this.lifecycleLock) {
			previous = this.state.getAndSet(next);
			if (previous == next) {
				return;
			}
			this.stateSink.emitNext(next, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
		}
		this.observer.onStateChange(previous, next);
	}

	private boolean compareAndTransition(SessionState expected, SessionState next) {
		synchronized (this.lifecycleLock) {
			if (this.state.get() != expected) {
				return false;
			}
			transition(next);
			return true;
		}
	}

	// --------------------------
	// Connection lifecycle
	// --------------------------

	/**
	 * Opens a connection and runs the handshake. Does nothing beyond returning the
	 * current handshake result when already connected, and waits for the pending
	 * connection when one is being established.
	 * @return a {@link Mono} emitting the handshake result. Errors with
	 * {@link McpTransportException} when the server cannot be reached, with
	 * {@link McpTimeoutException} when the handshake is not answered within the
	 * connection timeout, and with {@link McpError} when the server rejects it. On error
	 * the client is left {@link SessionState#DISCONNECTED}.
	 */
	public Mono<McpSchema.InitializeResult> connect() {
		return Mono.defer(() -> {
			SessionState current = this.state.get();
			if (current.isConnected() && this.initializeResult != null) {
				return Mono.just(this.initializeResult);
			}
			long gen;
			synchronized (this.lifecycleLock) {
				if (!compareAndTransition(SessionState.DISCONNECTED, SessionState.CONNECTING)) {
					return awaitReady(this.settings.connectionTimeout()).map(session -> this.initializeResult);
				}
				gen = this.generation.incrementAndGet();
			}
			return establish(gen).doOnError(error -> {
				logger.warn("Failed to connect: {}", error.getMessage());
				synchronized (this.lifecycleLock) {
					if (this.generation.get() == gen) {
						transition(SessionState.DISCONNECTED);
					}
				}
			});
		});
	}

	private Mono<McpSchema.InitializeResult> establish(long gen) {
		return this.transportProvider.connect()
			.timeout(this.settings.connectionTimeout())
			.onErrorMap(TimeoutException.class, e -> new McpTransportException(
					"Could not connect within " + this.settings.connectionTimeout().toMillis() + "ms", e))
			.flatMap(transport -> {
				McpClientSession newSession = new McpClientSession(transport, this.codec,
						this.settings.requestTimeout(), this.requestHandlers, this.notificationHandlers);
				synchronized (this.lifecycleLock) {
					if (this.generation.get() != gen) {
						newSession.close();
						return Mono.error(new McpConnectionLostException("Connection attempt was superseded"));
					}
					transition(SessionState.HANDSHAKING);
				}
				return handshake(newSession).flatMap(result -> onConnected(gen, newSession, result))
					.doOnError(error -> newSession.close())
					.doOnCancel(newSession::close);
			});
	}

	private Mono<McpSchema.InitializeResult> handshake(McpClientSession newSession) {
		String latestVersion = this.protocolVersions.get(this.protocolVersions.size() - 1);

		McpSchema.InitializeRequest initializeRequest = new McpSchema.InitializeRequest(// @formatter:off
				latestVersion,
				this.clientCapabilities,
				this.clientInfo); // @formatter:on

		return newSession
			.sendRequest(McpSchema.METHOD_INITIALIZE, initializeRequest, INITIALIZE_RESULT_TYPE_REF,
					this.settings.connectionTimeout())
			.switchIfEmpty(Mono.error(() -> McpError.builder(McpSchema.ErrorCodes.INTERNAL_ERROR)
				.message("Server returned an empty initialize result")
				.build()))
			.flatMap(result -> {
				logger.info("Server response with Protocol: {}, Capabilities: {}, Info: {} and Instructions {}",
						result.protocolVersion(), result.capabilities(), result.serverInfo(), result.instructions());

				if (!this.protocolVersions.contains(result.protocolVersion())) {
					return Mono.error(McpError.builder(McpSchema.ErrorCodes.INVALID_REQUEST)
						.message("Unsupported protocol version from the server: " + result.protocolVersion())
						.build());
				}

				return newSession.sendNotification(McpSchema.METHOD_NOTIFICATION_INITIALIZED).thenReturn(result);
			});
	}

	private Mono<McpSchema.InitializeResult> onConnected(long gen, McpClientSession newSession,
			McpSchema.InitializeResult result) {
		synchronized (this.lifecycleLock) {
			if (this.generation.get() != gen) {
				return Mono.error(new McpConnectionLostException("Client was disconnected during the handshake"));
			}
			this.session = newSession;
			this.initializeResult = result;
			this.connectedAt = Instant.now();
			this.reconnectAttempts.set(0);
			this.missedHeartbeats.set(0);
			transition(SessionState.READY);
		}
		this.observer.onConnected(result);
		this.connectionWatch.update(newSession.onTermination()
			.subscribe(null, error -> onConnectionLost(gen, newSession, error),
					() -> onConnectionLost(gen, newSession, newSession.getTerminationCause())));
		startHeartbeat(gen, newSession);
		return Mono.just(result);
	}

	private void onConnectionLost(long gen, McpClientSession lost, Throwable cause) {
		synchronized (this.lifecycleLock) {
			if (this.generation.get() != gen || this.session != lost) {
				return;
			}
			this.session = null;
			this.connectedAt = null;
			this.heartbeat.update(Disposables.disposed());
		}
		lost.close();
		this.observer.onConnectionLost(cause);

		if (!this.settings.reconnectPolicy().autoReconnect()) {
			synchronized (this.lifecycleLock) {
				if (this.generation.get() != gen) {
					return;
				}
				transition(SessionState.DISCONNECTED);
			}
			this.observer.onReconnectFailed(0, cause);
			return;
		}

		synchronized (this.lifecycleLock) {
			if (this.generation.get() != gen) {
				return;
			}
			transition(SessionState.RECONNECTING);
		}
		scheduleReconnect(gen, 1, cause);
	}

	private void scheduleReconnect(long gen, int attempt, Throwable lastCause) {
		ReconnectPolicy policy = this.settings.reconnectPolicy();
		if (attempt > policy.maxAttempts()) {
			synchronized (this.lifecycleLock) {
				if (this.generation.get() != gen) {
					return;
				}
				transition(SessionState.DISCONNECTED);
			}
			this.observer.onReconnectFailed(attempt - 1, lastCause);
			return;
		}

		Duration delay = policy.delay(attempt);
		this.reconnectAttempts.set(attempt);
		this.observer.onReconnectAttempt(attempt, delay);

		this.reconnect.update(Mono.delay(delay).then(Mono.defer(() -> {
			if (!compareAndTransition(SessionState.RECONNECTING, SessionState.CONNECTING)
					|| this.generation.get() != gen) {
				return Mono.<McpSchema.InitializeResult>empty();
			}
			return establish(gen);
		})).subscribe(result -> logger.info("Reconnected on attempt {}", attempt), error -> {
			logger.warn("Reconnect attempt {} failed: {}", attempt, error.getMessage());
			synchronized (this.lifecycleLock) {
				if (this.generation.get() != gen) {
					return;
				}
				transition(SessionState.RECONNECTING);
			}
			scheduleReconnect(gen, attempt + 1, error);
		}));
	}

	/**
	 * Closes the connection and stops any heartbeat or pending reconnect. Outstanding
	 * calls fail with {@link McpConnectionLostException}. The client may be connected
	 * again afterwards.
	 * @return a {@link Mono} that completes once the transport is closed
	 */
	public Mono<Void> disconnect() {
		return Mono.defer(() -> {
			McpClientSession current;
			synchronized (this.lifecycleLock) {
				this.generation.incrementAndGet();
				this.reconnect.update(Disposables.disposed());
				this.heartbeat.update(Disposables.disposed());
				this.connectionWatch.update(Disposables.disposed());
				current = this.session;
				this.session = null;
				this.connectedAt = null;
				transition(SessionState.DISCONNECTED);
			}
			if (current == null) {
				return Mono.empty();
			}
			logger.info("Disconnecting from {}", getServerInfo());
			return current.closeGracefully();
		});
	}

	/**
	 * Gracefully closes the client connection.
	 * @return A Mono that completes when the connection is closed
	 */
	public Mono<Void> closeGracefully() {
		return disconnect();
	}

	/**
	 * Closes the client connection without waiting for the transport.
	 */
	public void close() {
		disconnect().subscribe(null, error -> logger.warn("Error while closing client: {}", error.getMessage()));
	}

	/**
	 * Waits until the client is connected.
	 * @param timeout how long to wait
	 * @return a {@link Mono} emitting the current session. Errors with
	 * {@link McpConnectionLostException} when the client is or becomes
	 * {@link SessionState#DISCONNECTED}, and with {@link McpTimeoutException} when the
	 * wait exceeds the timeout.
	 */
	Mono<McpClientSession> awaitReady(Duration timeout) {
		return Mono.defer(() -> {
			McpClientSession current = this.session;
			SessionState currentState = this.state.get();
			if (currentState.isConnected() && current != null) {
				return Mono.just(current);
			}
			if (currentState == SessionState.DISCONNECTED) {
				return Mono.error(new McpConnectionLostException("Client is disconnected"));
			}
			return this.stateSink.asFlux()
				.filter(s -> s.isConnected() || s == SessionState.DISCONNECTED)
				.next()
				.timeout(timeout, Mono.error(() -> new McpTimeoutException(null, "awaiting connection", timeout)))
				.flatMap(s -> {
					McpClientSession ready = this.session;
					if (s == SessionState.DISCONNECTED || ready == null) {
						return Mono.error(new McpConnectionLostException("Client is disconnected"));
					}
					return Mono.just(ready);
				});
		});
	}

	// --------------------------
	// Heartbeat
	// --------------------------

	private void startHeartbeat(long gen, McpClientSession connected) {
		Duration interval = this.settings.heartbeatInterval();
		if (interval.isZero()) {
			return;
		}
		this.heartbeat.update(Flux.interval(interval, interval)
			.onBackpressureDrop()
			.concatMap(tick -> heartbeatPing(connected))
			.subscribe(answered -> onHeartbeat(gen, connected, answered)));
	}

	/**
	 * @return {@code true} when the server answered, {@code false} on a miss, empty when
	 * the connection is already gone
	 */
	private Mono<Boolean> heartbeatPing(McpClientSession connected) {
		return connected
			.sendRequest(McpSchema.METHOD_PING, null, OBJECT_TYPE_REF, this.settings.heartbeatTimeout())
			.thenReturn(Boolean.TRUE)
			// any answer, even an error, proves the peer is alive
			.onErrorResume(McpError.class, e -> Mono.just(Boolean.TRUE))
			.onErrorResume(McpTimeoutException.class, e -> Mono.just(Boolean.FALSE))
			.onErrorResume(McpTransportException.class, e -> Mono.empty());
	}

	private void onHeartbeat(long gen, McpClientSession connected, boolean answered) {
		if (this.generation.get() != gen || this.session != connected) {
			return;
		}
		if (answered) {
			if (this.missedHeartbeats.getAndSet(0) > 0
					&& compareAndTransition(SessionState.DEGRADED, SessionState.READY)) {
				logger.info("Heartbeat answered again, connection recovered");
			}
			return;
		}

		int misses = this.missedHeartbeats.incrementAndGet();
		int threshold = this.settings.heartbeatMissThreshold();
		logger.warn("Heartbeat missed ({} of {})", misses, threshold);
		if (misses >= threshold) {
			onConnectionLost(gen, connected,
					new McpConnectionLostException("Server missed " + misses + " heartbeat(s)"));
		}
		else {
			compareAndTransition(SessionState.READY, SessionState.DEGRADED);
		}
	}

	// --------------------------
	// Basic Utilities
	// --------------------------

	/**
	 * Sends a ping request to the server.
	 * @return A Mono that completes with the server's ping response
	 */
	public Mono<Object> ping() {
		return withSession(McpSchema.METHOD_PING,
				(s, remaining) -> s.sendRequest(McpSchema.METHOD_PING, null, OBJECT_TYPE_REF, remaining));
	}

	/**
	 * Sends an arbitrary request with its own deadline. The deadline covers waiting for
	 * a connection as well as waiting for the response.
	 * @param <T> the result type
	 * @param method the request method
	 * @param params the request params, may be {@code null}
	 * @param typeRef the type the result is bound to
	 * @param timeout the deadline
	 * @return a {@link Mono} emitting the bound result. Errors with {@link McpError}
	 * when the server answers with an error, {@link McpTimeoutException} when the
	 * deadline passes, or {@link McpConnectionLostException} when the connection is lost
	 * first.
	 */
	public <T> Mono<T> invoke(String method, Object params, TypeRef<T> typeRef, Duration timeout) {
		Assert.hasText(method, "Method must not be empty");
		Assert.notNull(typeRef, "TypeRef must not be null");
		Assert.notNull(timeout, "Timeout must not be null");
		return withinDeadline(method, timeout, (s, remaining) -> s.sendRequest(method, params, typeRef, remaining));
	}

	private <T> Mono<T> withSession(String method, BiFunction<McpClientSession, Duration, Mono<T>> operation) {
		return withinDeadline(method, this.settings.requestTimeout(), operation);
	}

	/**
	 * Runs an operation under one deadline. The operation gets whatever is left of the
	 * timeout after waiting for a ready session.
	 */
	private <T> Mono<T> withinDeadline(String method, Duration timeout,
			BiFunction<McpClientSession, Duration, Mono<T>> operation) {
		return Mono.defer(() -> {
			long start = System.nanoTime();
			return awaitReady(timeout).flatMap(s -> {
				Duration remaining = timeout.minusNanos(System.nanoTime() - start);
				if (remaining.isNegative() || remaining.isZero()) {
					return Mono.error(new McpTimeoutException(null, method, timeout));
				}
				return operation.apply(s, remaining);
			});
		});
	}

	private McpSchema.ServerCapabilities serverCapabilities() {
		McpSchema.InitializeResult result = this.initializeResult;
		McpSchema.ServerCapabilities capabilities = (result != null) ? result.capabilities() : null;
		// a server may omit the capabilities object, which advertises nothing
		return (capabilities != null) ? capabilities : McpSchema.ServerCapabilities.builder().build();
	}

	private static McpError missingCapability(String message) {
		return McpError.builder(McpSchema.ErrorCodes.INVALID_REQUEST).message(message).build();
	}

	// --------------------------
	// Roots and sampling
	// --------------------------

	private RequestHandler<McpSchema.ListRootsResult> rootsListRequestHandler() {
		return params -> Mono.just(new McpSchema.ListRootsResult(List.copyOf(this.roots.values())));
	}

	private RequestHandler<CreateMessageResult> samplingCreateMessageHandler(
			Function<CreateMessageRequest, Mono<CreateMessageResult>> samplingHandler) {
		return params -> samplingHandler.apply(this.codec.unmarshal(params, CreateMessageRequest.class));
	}

	// --------------------------
	// Tools
	// --------------------------

	/**
	 * Calls a tool provided by the server.
	 * @param callToolRequest the tool name and its arguments
	 * @return A Mono that emits the tool execution result
	 * @see #listTools()
	 */
	public Mono<McpSchema.CallToolResult> callTool(McpSchema.CallToolRequest callToolRequest) {
		return withSession(McpSchema.METHOD_TOOLS_CALL, (s, remaining) -> {
			if (serverCapabilities().tools() == null) {
				return Mono.error(missingCapability("Server does not provide tools capability"));
			}
			return s.sendRequest(McpSchema.METHOD_TOOLS_CALL, callToolRequest, CALL_TOOL_RESULT_TYPE_REF, remaining);
		});
	}

	/**
	 * Retrieves the list of all tools provided by the server.
	 * @return A Mono that emits the list of tools result
	 */
	public Mono<McpSchema.ListToolsResult> listTools() {
		return withSession(McpSchema.METHOD_TOOLS_LIST, (s, remaining) -> {
			if (serverCapabilities().tools() == null) {
				return Mono.error(missingCapability("Server does not provide tools capability"));
			}
			return s.sendRequest(McpSchema.METHOD_TOOLS_LIST, new PaginatedRequest(null), LIST_TOOLS_RESULT_TYPE_REF,
					remaining);
		});
	}

	private NotificationHandler asyncToolsChangeNotificationHandler(
			List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumers) {
		return params -> this.listTools()
			.flatMap(listToolsResult -> Flux.fromIterable(toolsChangeConsumers)
				.flatMap(consumer -> consumer.apply(listToolsResult.tools()))
				.onErrorResume(error -> {
					logger.error("Error handling tools list change notification", error);
					return Mono.empty();
				})
				.then());
	}

	// --------------------------
	// Resources
	// --------------------------

	/**
	 * Retrieves the list of all resources provided by the server.
	 * @return A Mono that completes with the list of resources result
	 */
	public Mono<McpSchema.ListResourcesResult> listResources() {
		return withSession(McpSchema.METHOD_RESOURCES_LIST, (s, remaining) -> {
			if (serverCapabilities().resources() == null) {
				return Mono.error(missingCapability("Server does not provide the resources capability"));
			}
			return s.sendRequest(McpSchema.METHOD_RESOURCES_LIST, new PaginatedRequest(null),
					LIST_RESOURCES_RESULT_TYPE_REF, remaining);
		});
	}

	public Mono<McpSchema.ReadResourceResult> readResource(McpSchema.Resource resource) {
		return this.readResource(new McpSchema.ReadResourceRequest(resource.uri()));
	}

	/**
	 * Reads the content of the resource with the requested uri.
	 * @param readResourceRequest The request containing the URI of the resource to read
	 * @return A Mono that completes with the resource content
	 */
	public Mono<McpSchema.ReadResourceResult> readResource(McpSchema.ReadResourceRequest readResourceRequest) {
		return withSession(McpSchema.METHOD_RESOURCES_READ, (s, remaining) -> {
			if (serverCapabilities().resources() == null) {
				return Mono.error(missingCapability("Server does not provide the resources capability"));
			}
			return s.sendRequest(McpSchema.METHOD_RESOURCES_READ, readResourceRequest, READ_RESOURCE_RESULT_TYPE_REF,
					remaining);
		});
	}

	/**
	 * Subscribes to changes of a resource. Updates arrive through the consumers
	 * registered with {@link McpClient.AsyncSpec#resourcesUpdateConsumer(Function)}.
	 * Subscriptions belong to a connection and are not restored after a reconnect.
	 * @param subscribeRequest the uri to subscribe to
	 * @return A Mono that completes when the subscription is complete
	 */
	public Mono<Void> subscribeResource(McpSchema.SubscribeRequest subscribeRequest) {
		return withSession(McpSchema.METHOD_RESOURCES_SUBSCRIBE,
				(s, remaining) -> s.sendRequest(McpSchema.METHOD_RESOURCES_SUBSCRIBE, subscribeRequest, OBJECT_TYPE_REF,
						remaining))
			.then();
	}

	public Mono<Void> unsubscribeResource(McpSchema.UnsubscribeRequest unsubscribeRequest) {
		return withSession(McpSchema.METHOD_RESOURCES_UNSUBSCRIBE,
				(s, remaining) -> s.sendRequest(McpSchema.METHOD_RESOURCES_UNSUBSCRIBE, unsubscribeRequest,
						OBJECT_TYPE_REF, remaining))
			.then();
	}

	private NotificationHandler asyncResourcesChangeNotificationHandler(
			List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumers) {
		return params -> listResources().flatMap(listResourcesResult -> Flux.fromIterable(resourcesChangeConsumers)
			.flatMap(consumer -> consumer.apply(listResourcesResult.resources()))
			.onErrorResume(error -> {
				logger.error("Error handling resources list change notification", error);
				return Mono.empty();
			})
			.then());
	}

	private NotificationHandler asyncResourcesUpdatedNotificationHandler(
			List<Function<McpSchema.ResourcesUpdatedNotification, Mono<Void>>> resourcesUpdateConsumers) {
		return params -> {
			McpSchema.ResourcesUpdatedNotification notification = this.codec.unmarshal(params,
					McpSchema.ResourcesUpdatedNotification.class);
			return Flux.fromIterable(resourcesUpdateConsumers)
				.flatMap(consumer -> consumer.apply(notification))
				.then();
		};
	}

	// --------------------------
	// Prompts
	// --------------------------

	/**
	 * Retrieves the list of all prompts provided by the server.
	 * @return A Mono that completes with the list of prompts result
	 * @see #getPrompt(GetPromptRequest)
	 */
	public Mono<ListPromptsResult> listPrompts() {
		return withSession(McpSchema.METHOD_PROMPT_LIST, (s, remaining) -> {
			if (serverCapabilities().prompts() == null) {
				return Mono.error(missingCapability("Server does not provide the prompts capability"));
			}
			return s.sendRequest(McpSchema.METHOD_PROMPT_LIST, new PaginatedRequest(null),
					LIST_PROMPTS_RESULT_TYPE_REF, remaining);
		});
	}

	/**
	 * Renders a prompt with the given arguments.
	 * @param getPromptRequest the prompt name and its arguments
	 * @return A Mono that completes with the rendered prompt
	 * @see #listPrompts()
	 */
	public Mono<GetPromptResult> getPrompt(GetPromptRequest getPromptRequest) {
		return withSession(McpSchema.METHOD_PROMPT_GET, (s, remaining) -> {
			if (serverCapabilities().prompts() == null) {
				return Mono.error(missingCapability("Server does not provide the prompts capability"));
			}
			return s.sendRequest(McpSchema.METHOD_PROMPT_GET, getPromptRequest, GET_PROMPT_RESULT_TYPE_REF, remaining);
		});
	}

	private NotificationHandler asyncPromptsChangeNotificationHandler(
			List<Function<List<McpSchema.Prompt>, Mono<Void>>> promptsChangeConsumers) {
		return params -> listPrompts().flatMap(listPromptsResult -> Flux.fromIterable(promptsChangeConsumers)
			.flatMap(consumer -> consumer.apply(listPromptsResult.prompts()))
			.onErrorResume(error -> {
				logger.error("Error handling prompts list change notification", error);
				return Mono.empty();
			})
			.then());
	}

	// --------------------------
	// Logging
	// --------------------------

	private NotificationHandler asyncLoggingNotificationHandler(
			List<Function<LoggingMessageNotification, Mono<Void>>> loggingConsumers) {
		return params -> {
			LoggingMessageNotification loggingMessageNotification = this.codec.unmarshal(params,
					LoggingMessageNotification.class);

			return Flux.fromIterable(loggingConsumers)
				.flatMap(consumer -> consumer.apply(loggingMessageNotification))
				.then();
		};
	}

	private NotificationHandler asyncProgressNotificationHandler(
			List<Function<McpSchema.ProgressNotification, Mono<Void>>> progressConsumers) {
		return params -> {
			McpSchema.ProgressNotification progressNotification = this.codec.unmarshal(params,
					McpSchema.ProgressNotification.class);

			return Flux.fromIterable(progressConsumers)
				.flatMap(consumer -> consumer.apply(progressNotification))
				.then();
		};
	}

	/**
	 * Sets the minimum level of the log messages the server sends on the current
	 * connection.
	 * @param loggingLevel The minimum logging level to receive
	 * @return A Mono that completes when the server acknowledged the level
	 * @see McpSchema.LoggingLevel
	 */
	public Mono<Void> setLoggingLevel(LoggingLevel loggingLevel) {
		Assert.notNull(loggingLevel, "Logging level must not be null");
		return withSession(McpSchema.METHOD_LOGGING_SET_LEVEL, (s, remaining) -> {
			if (serverCapabilities().logging() == null) {
				return Mono.error(missingCapability("Server does not provide the logging capability"));
			}
			return s.sendRequest(McpSchema.METHOD_LOGGING_SET_LEVEL, new McpSchema.SetLevelRequest(loggingLevel),
					OBJECT_TYPE_REF, remaining);
		}).then();
	}

	/**
	 * This method is package-private and used for test only. Should not be called by user
	 * code.
	 * @param protocolVersions the Client supported protocol versions.
	 */
	void setProtocolVersions(List<String> protocolVersions) {
		this.protocolVersions = protocolVersions;
	}

	/**
	 * Connection tuning of a client.
	 *
	 * @param requestTimeout default deadline of a call
	 * @param connectionTimeout deadline for opening a transport and for the handshake
	 * @param heartbeatInterval time between heartbeat pings, zero to disable them
	 * @param heartbeatTimeout deadline of a single heartbeat ping
	 * @param heartbeatMissThreshold consecutive misses that count as a lost connection
	 * @param reconnectPolicy how to recover from a lost connection
	 */
	record Settings(Duration requestTimeout, Duration connectionTimeout, Duration heartbeatInterval,
			Duration heartbeatTimeout, int heartbeatMissThreshold, ReconnectPolicy reconnectPolicy) {

		Settings {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			Assert.notNull(connectionTimeout, "Connection timeout must not be null");
			Assert.notNull(heartbeatInterval, "Heartbeat interval must not be null");
			Assert.notNull(heartbeatTimeout, "Heartbeat timeout must not be null");
			Assert.notNull(reconnectPolicy, "Reconnect policy must not be null");
			Assert.isTrue(heartbeatMissThreshold > 0, "Heartbeat miss threshold must be positive");
		}
	}

}
