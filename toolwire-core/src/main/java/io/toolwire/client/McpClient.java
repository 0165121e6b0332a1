/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import reactor.core.publisher.Mono;

import io.toolwire.json.McpJsonMapper;
import io.toolwire.spec.McpClientTransportProvider;
import io.toolwire.spec.McpSchema;
import io.toolwire.spec.McpSchema.ClientCapabilities;
import io.toolwire.spec.McpSchema.CreateMessageRequest;
import io.toolwire.spec.McpSchema.CreateMessageResult;
import io.toolwire.spec.McpSchema.Implementation;
import io.toolwire.spec.McpSchema.Root;
import io.toolwire.util.Assert;

/**
 * Factory for clients. A client is configured with its identity, capabilities,
 * connection tuning and notification consumers, then created unconnected by
 * {@code build()}.
 *
 * <p>
 * Example of creating a basic asynchronous client: <pre>{@code
 * McpAsyncClient client = McpClient.async(transportProvider)
 *     .clientInfo(new McpSchema.Implementation("my-client", "1.0.0"))
 *     .requestTimeout(Duration.ofSeconds(10))
 *     .reconnectPolicy(ReconnectPolicy.builder().maxAttempts(3).build())
 *     .toolsChangeConsumer(tools -> Mono.fromRunnable(() -> refresh(tools)))
 *     .build();
 *
 * client.connect().block();
 * }</pre>
 *
 * <p>
 * Defaults: request timeout 30 seconds, connection timeout 10 seconds, a heartbeat every
 * 30 seconds answered within 5 seconds, the first miss counts as a lost connection, and
 * {@link ReconnectPolicy#defaults()}.
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 * @see McpAsyncClient
 * @see McpSyncClient
 */
public interface McpClient {

	Implementation DEFAULT_CLIENT_INFO = new Implementation("toolwire-client", "1.0.0");

	Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);

	Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

	Duration DEFAULT_HEARTBEAT_TIMEOUT = Duration.ofSeconds(5);

	int DEFAULT_HEARTBEAT_MISS_THRESHOLD = 1;

	/**
	 * Start building a synchronous client.
	 * @param transportProvider opens a fresh transport for every connection attempt
	 * @return a new builder
	 */
	static SyncSpec sync(McpClientTransportProvider transportProvider) {
		return new SyncSpec(transportProvider);
	}

	/**
	 * Start building an asynchronous client.
	 * @param transportProvider opens a fresh transport for every connection attempt
	 * @return a new builder
	 */
	static AsyncSpec async(McpClientTransportProvider transportProvider) {
		return new AsyncSpec(transportProvider);
	}

	/**
	 * Settings shared by the asynchronous and synchronous builders.
	 */
	abstract class BaseSpec<S extends BaseSpec<S>> {

		final McpClientTransportProvider transportProvider;

		McpJsonMapper jsonMapper;

		Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;

		Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;

		Duration heartbeatTimeout = DEFAULT_HEARTBEAT_TIMEOUT;

		int heartbeatMissThreshold = DEFAULT_HEARTBEAT_MISS_THRESHOLD;

		ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();

		McpConnectionObserver connectionObserver = McpConnectionObserver.LOGGING;

		ClientCapabilities capabilities;

		Implementation clientInfo = DEFAULT_CLIENT_INFO;

		final Map<String, Root> roots = new HashMap<>();

		BaseSpec(McpClientTransportProvider transportProvider) {
			Assert.notNull(transportProvider, "Transport provider must not be null");
			this.transportProvider = transportProvider;
		}

		abstract S self();

		/**
		 * Sets the JSON mapper used to encode and decode messages. Defaults to the mapper
		 * found on the classpath.
		 * @param jsonMapper The mapper to use. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public S jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "JsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return self();
		}

		/**
		 * Sets the default deadline of a call, covering the wait for a connection and
		 * the wait for the response.
		 * @param requestTimeout The request timeout. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public S requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return self();
		}

		/**
		 * Sets the deadline for opening a transport, and separately for the handshake.
		 * @param connectionTimeout The connection timeout. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public S connectionTimeout(Duration connectionTimeout) {
			Assert.notNull(connectionTimeout, "Connection timeout must not be null");
			this.connectionTimeout = connectionTimeout;
			return self();
		}

		/**
		 * Sets the time between heartbeat pings.
		 * @param heartbeatInterval The interval, {@link Duration#ZERO} to disable the
		 * heartbeat
		 * @return This builder instance for method chaining
		 */
		public S heartbeatInterval(Duration heartbeatInterval) {
			Assert.notNull(heartbeatInterval, "Heartbeat interval must not be null");
			Assert.isTrue(!heartbeatInterval.isNegative(), "Heartbeat interval must not be negative");
			this.heartbeatInterval = heartbeatInterval;
			return self();
		}

		public S heartbeatTimeout(Duration heartbeatTimeout) {
			Assert.notNull(heartbeatTimeout, "Heartbeat timeout must not be null");
			this.heartbeatTimeout = heartbeatTimeout;
			return self();
		}

		/**
		 * Sets how many consecutive heartbeats may go unanswered before the connection
		 * is treated as lost. Fewer misses make the client {@link SessionState#DEGRADED}.
		 * @param heartbeatMissThreshold The threshold, at least 1
		 * @return This builder instance for method chaining
		 */
		public S heartbeatMissThreshold(int heartbeatMissThreshold) {
			Assert.isTrue(heartbeatMissThreshold > 0, "Heartbeat miss threshold must be positive");
			this.heartbeatMissThreshold = heartbeatMissThreshold;
			return self();
		}

		public S reconnectPolicy(ReconnectPolicy reconnectPolicy) {
			Assert.notNull(reconnectPolicy, "Reconnect policy must not be null");
			this.reconnectPolicy = reconnectPolicy;
			return self();
		}

		/**
		 * Sets the observer notified of connection lifecycle events. Defaults to
		 * {@link McpConnectionObserver#LOGGING}.
		 * @param connectionObserver The observer. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public S connectionObserver(McpConnectionObserver connectionObserver) {
			Assert.notNull(connectionObserver, "Connection observer must not be null");
			this.connectionObserver = connectionObserver;
			return self();
		}

		/**
		 * Sets the capabilities advertised in the handshake. When not set, they are
		 * derived from the configured roots and sampling handler.
		 * @param capabilities The client capabilities. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public S capabilities(ClientCapabilities capabilities) {
			Assert.notNull(capabilities, "Capabilities must not be null");
			this.capabilities = capabilities;
			return self();
		}

		public S clientInfo(Implementation clientInfo) {
			Assert.notNull(clientInfo, "Client info must not be null");
			this.clientInfo = clientInfo;
			return self();
		}

		/**
		 * Adds the roots answered to the server's {@code roots/list} requests.
		 * @param roots The roots. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public S roots(List<Root> roots) {
			Assert.notNull(roots, "Roots must not be null");
			for (Root root : roots) {
				this.roots.put(root.uri(), root);
			}
			return self();
		}

		public S roots(Root... roots) {
			Assert.notNull(roots, "Roots must not be null");
			return roots(List.of(roots));
		}

		McpAsyncClient.Settings settings() {
			return new McpAsyncClient.Settings(this.requestTimeout, this.connectionTimeout, this.heartbeatInterval,
					this.heartbeatTimeout, this.heartbeatMissThreshold, this.reconnectPolicy);
		}

		McpJsonMapper resolveJsonMapper() {
			return (this.jsonMapper != null) ? this.jsonMapper : McpJsonMapper.getDefault();
		}

	}

	/**
	 * Asynchronous client specification.
	 */
	class AsyncSpec extends BaseSpec<AsyncSpec> {

		private final List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumers = new ArrayList<>();

		private final List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumers = new ArrayList<>();

		private final List<Function<McpSchema.ResourcesUpdatedNotification, Mono<Void>>> resourcesUpdateConsumers = new ArrayList<>();

		private final List<Function<List<McpSchema.Prompt>, Mono<Void>>> promptsChangeConsumers = new ArrayList<>();

		private final List<Function<McpSchema.LoggingMessageNotification, Mono<Void>>> loggingConsumers = new ArrayList<>();

		private final List<Function<McpSchema.ProgressNotification, Mono<Void>>> progressConsumers = new ArrayList<>();

		private Function<CreateMessageRequest, Mono<CreateMessageResult>> samplingHandler;

		private AsyncSpec(McpClientTransportProvider transportProvider) {
			super(transportProvider);
		}

		@Override
		AsyncSpec self() {
			return this;
		}

		/**
		 * Sets the handler answering the server's {@code sampling/createMessage}
		 * requests.
		 * @param samplingHandler The handler. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public AsyncSpec sampling(Function<CreateMessageRequest, Mono<CreateMessageResult>> samplingHandler) {
			Assert.notNull(samplingHandler, "Sampling handler must not be null");
			this.samplingHandler = samplingHandler;
			return this;
		}

		/**
		 * Adds a consumer called with the refreshed tool list after each
		 * {@code notifications/tools/list_changed}.
		 * @param toolsChangeConsumer The consumer. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public AsyncSpec toolsChangeConsumer(Function<List<McpSchema.Tool>, Mono<Void>> toolsChangeConsumer) {
			Assert.notNull(toolsChangeConsumer, "Tools change consumer must not be null");
			this.toolsChangeConsumers.add(toolsChangeConsumer);
			return this;
		}

		public AsyncSpec resourcesChangeConsumer(
				Function<List<McpSchema.Resource>, Mono<Void>> resourcesChangeConsumer) {
			Assert.notNull(resourcesChangeConsumer, "Resources change consumer must not be null");
			this.resourcesChangeConsumers.add(resourcesChangeConsumer);
			return this;
		}

		/**
		 * Adds a consumer called for each {@code notifications/resources/updated} about a
		 * subscribed resource.
		 * @param resourcesUpdateConsumer The consumer. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public AsyncSpec resourcesUpdateConsumer(
				Function<McpSchema.ResourcesUpdatedNotification, Mono<Void>> resourcesUpdateConsumer) {
			Assert.notNull(resourcesUpdateConsumer, "Resources update consumer must not be null");
			this.resourcesUpdateConsumers.add(resourcesUpdateConsumer);
			return this;
		}

		public AsyncSpec promptsChangeConsumer(Function<List<McpSchema.Prompt>, Mono<Void>> promptsChangeConsumer) {
			Assert.notNull(promptsChangeConsumer, "Prompts change consumer must not be null");
			this.promptsChangeConsumers.add(promptsChangeConsumer);
			return this;
		}

		public AsyncSpec loggingConsumer(
				Function<McpSchema.LoggingMessageNotification, Mono<Void>> loggingConsumer) {
			Assert.notNull(loggingConsumer, "Logging consumer must not be null");
			this.loggingConsumers.add(loggingConsumer);
			return this;
		}

		/**
		 * Adds a consumer called for each {@code notifications/progress} the server
		 * sends about a long-running request.
		 * @param progressConsumer The consumer. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public AsyncSpec progressConsumer(Function<McpSchema.ProgressNotification, Mono<Void>> progressConsumer) {
			Assert.notNull(progressConsumer, "Progress consumer must not be null");
			this.progressConsumers.add(progressConsumer);
			return this;
		}

		/**
		 * Creates the client. It is not connected yet.
		 * @return a new {@link McpAsyncClient}
		 */
		public McpAsyncClient build() {
			McpClientFeatures.Async features = new McpClientFeatures.Async(this.clientInfo, this.capabilities,
					this.roots, this.toolsChangeConsumers, this.resourcesChangeConsumers,
					this.resourcesUpdateConsumers, this.promptsChangeConsumers, this.loggingConsumers,
					this.progressConsumers, this.samplingHandler);
			return new McpAsyncClient(this.transportProvider, resolveJsonMapper(), settings(), features,
					this.connectionObserver);
		}

	}

	/**
	 * Synchronous client specification. Consumers and the sampling handler run on
	 * {@link reactor.core.scheduler.Schedulers#boundedElastic()}.
	 */
	class SyncSpec extends BaseSpec<SyncSpec> {

		private final List<Consumer<List<McpSchema.Tool>>> toolsChangeConsumers = new ArrayList<>();

		private final List<Consumer<List<McpSchema.Resource>>> resourcesChangeConsumers = new ArrayList<>();

		private final List<Consumer<McpSchema.ResourcesUpdatedNotification>> resourcesUpdateConsumers = new ArrayList<>();

		private final List<Consumer<List<McpSchema.Prompt>>> promptsChangeConsumers = new ArrayList<>();

		private final List<Consumer<McpSchema.LoggingMessageNotification>> loggingConsumers = new ArrayList<>();

		private final List<Consumer<McpSchema.ProgressNotification>> progressConsumers = new ArrayList<>();

		private Function<CreateMessageRequest, CreateMessageResult> samplingHandler;

		private SyncSpec(McpClientTransportProvider transportProvider) {
			super(transportProvider);
		}

		@Override
		SyncSpec self() {
			return this;
		}

		public SyncSpec sampling(Function<CreateMessageRequest, CreateMessageResult> samplingHandler) {
			Assert.notNull(samplingHandler, "Sampling handler must not be null");
			this.samplingHandler = samplingHandler;
			return this;
		}

		public SyncSpec toolsChangeConsumer(Consumer<List<McpSchema.Tool>> toolsChangeConsumer) {
			Assert.notNull(toolsChangeConsumer, "Tools change consumer must not be null");
			this.toolsChangeConsumers.add(toolsChangeConsumer);
			return this;
		}

		public SyncSpec resourcesChangeConsumer(Consumer<List<McpSchema.Resource>> resourcesChangeConsumer) {
			Assert.notNull(resourcesChangeConsumer, "Resources change consumer must not be null");
			this.resourcesChangeConsumers.add(resourcesChangeConsumer);
			return this;
		}

		public SyncSpec resourcesUpdateConsumer(
				Consumer<McpSchema.ResourcesUpdatedNotification> resourcesUpdateConsumer) {
			Assert.notNull(resourcesUpdateConsumer, "Resources update consumer must not be null");
			this.resourcesUpdateConsumers.add(resourcesUpdateConsumer);
			return this;
		}

		public SyncSpec promptsChangeConsumer(Consumer<List<McpSchema.Prompt>> promptsChangeConsumer) {
			Assert.notNull(promptsChangeConsumer, "Prompts change consumer must not be null");
			this.promptsChangeConsumers.add(promptsChangeConsumer);
			return this;
		}

		/**
		 * Adds a consumer for the log messages the server sends, for example a
		 * {@link Slf4jLoggingConsumer}.
		 * @param loggingConsumer The consumer. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public SyncSpec loggingConsumer(Consumer<McpSchema.LoggingMessageNotification> loggingConsumer) {
			Assert.notNull(loggingConsumer, "Logging consumer must not be null");
			this.loggingConsumers.add(loggingConsumer);
			return this;
		}

		public SyncSpec progressConsumer(Consumer<McpSchema.ProgressNotification> progressConsumer) {
			Assert.notNull(progressConsumer, "Progress consumer must not be null");
			this.progressConsumers.add(progressConsumer);
			return this;
		}

		/**
		 * Creates the client. It is not connected yet.
		 * @return a new {@link McpSyncClient}
		 */
		public McpSyncClient build() {
			McpClientFeatures.Sync syncFeatures = new McpClientFeatures.Sync(this.clientInfo, this.capabilities,
					this.roots, this.toolsChangeConsumers, this.resourcesChangeConsumers,
					this.resourcesUpdateConsumers, this.promptsChangeConsumers, this.loggingConsumers,
					this.progressConsumers, this.samplingHandler);
			return new McpSyncClient(new McpAsyncClient(this.transportProvider, resolveJsonMapper(), settings(),
					McpClientFeatures.Async.fromSync(syncFeatures), this.connectionObserver));
		}

	}

}
