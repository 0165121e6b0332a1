/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.server;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;

import reactor.core.publisher.Mono;

import io.toolwire.json.McpJsonMapper;
import io.toolwire.spec.McpSchema;
import io.toolwire.spec.McpSchema.CallToolResult;
import io.toolwire.spec.McpServerTransportProvider;
import io.toolwire.util.Assert;

/**
 * Factory for servers. A server is configured with its identity, advertised
 * capabilities, initial tools, resources and prompts, and the limits that apply to each
 * connected peer, then started by {@code build()}.
 *
 * <p>
 * Example of creating a basic asynchronous server: <pre>{@code
 * McpServer.async(transportProvider)
 *     .serverInfo("my-server", "1.0.0")
 *     .tool(Tool.builder().name("echo").description("Echoes its input").build(),
 *           (exchange, request) -> Mono.just(new CallToolResult(
 *               String.valueOf(request.arguments().get("msg")), false)))
 *     .build();
 * }</pre>
 *
 * <p>
 * Defaults: request timeout 30 seconds, at most 100 requests dispatched at once per
 * peer, protocol violations never close the connection, and all capabilities advertised
 * with {@code listChanged}.
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 * @see McpAsyncServer
 * @see McpSyncServer
 */
public interface McpServer {

	McpSchema.Implementation DEFAULT_SERVER_INFO = new McpSchema.Implementation("toolwire-server", "1.0.0");

	Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	int DEFAULT_MAX_CONCURRENT_REQUESTS = 100;

	/**
	 * Starts building a synchronous server whose handlers may block.
	 * @param transportProvider The transport layer implementation for MCP communication.
	 * @return A new instance of {@link SyncSpecification} for configuring the server.
	 */
	static SyncSpecification sync(McpServerTransportProvider transportProvider) {
		return new SyncSpecification(transportProvider);
	}

	/**
	 * Starts building an asynchronous server.
	 * @param transportProvider The transport layer implementation for MCP communication.
	 * @return A new instance of {@link AsyncSpecification} for configuring the server.
	 */
	static AsyncSpecification async(McpServerTransportProvider transportProvider) {
		return new AsyncSpecification(transportProvider);
	}

	/**
	 * Settings shared by the asynchronous and synchronous builders.
	 */
	abstract class BaseSpecification<S extends BaseSpecification<S>> {

		final McpServerTransportProvider transportProvider;

		McpJsonMapper jsonMapper;

		McpSchema.Implementation serverInfo = DEFAULT_SERVER_INFO;

		McpSchema.ServerCapabilities serverCapabilities;

		String instructions;

		Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		int maxConcurrentRequests = DEFAULT_MAX_CONCURRENT_REQUESTS;

		int maxProtocolViolations = 0;

		BaseSpecification(McpServerTransportProvider transportProvider) {
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
		 * Sets the server implementation information that will be shared with clients
		 * during connection initialization.
		 * @param serverInfo The server implementation details including name and version.
		 * Must not be null.
		 * @return This builder instance for method chaining
		 */
		public S serverInfo(McpSchema.Implementation serverInfo) {
			Assert.notNull(serverInfo, "Server info must not be null");
			this.serverInfo = serverInfo;
			return self();
		}

		public S serverInfo(String name, String version) {
			Assert.hasText(name, "Name must not be null or empty");
			Assert.hasText(version, "Version must not be null or empty");
			this.serverInfo = new McpSchema.Implementation(name, version);
			return self();
		}

		/**
		 * Sets the usage hints returned to clients in the handshake.
		 * @param instructions The instructions text, may be null
		 * @return This builder instance for method chaining
		 */
		public S instructions(String instructions) {
			this.instructions = instructions;
			return self();
		}

		/**
		 * Sets the capabilities advertised to clients. Only the methods of advertised
		 * capabilities are served.
		 * @param serverCapabilities The server capabilities configuration
		 * @return This builder instance for method chaining
		 */
		public S capabilities(McpSchema.ServerCapabilities serverCapabilities) {
			Assert.notNull(serverCapabilities, "Server capabilities must not be null");
			this.serverCapabilities = serverCapabilities;
			return self();
		}

		/**
		 * Sets the deadline for each request handler and for requests the server sends
		 * to its clients.
		 * @param requestTimeout The request timeout. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public S requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			Assert.isTrue(!requestTimeout.isNegative() && !requestTimeout.isZero(), "Request timeout must be positive");
			this.requestTimeout = requestTimeout;
			return self();
		}

		/**
		 * Limits the number of requests dispatched at once on a single connection.
		 * Further requests wait until a running one completes.
		 * @param maxConcurrentRequests The limit, at least 1
		 * @return This builder instance for method chaining
		 */
		public S maxConcurrentRequests(int maxConcurrentRequests) {
			Assert.isTrue(maxConcurrentRequests > 0, "maxConcurrentRequests must be positive");
			this.maxConcurrentRequests = maxConcurrentRequests;
			return self();
		}

		/**
		 * Closes a connection once its peer committed this many protocol violations:
		 * requests before the handshake, a repeated handshake or invalid messages.
		 * @param maxProtocolViolations The limit, {@code 0} to never close a connection for
		 * this reason
		 * @return This builder instance for method chaining
		 */
		public S maxProtocolViolations(int maxProtocolViolations) {
			Assert.isTrue(maxProtocolViolations >= 0, "maxProtocolViolations must not be negative");
			this.maxProtocolViolations = maxProtocolViolations;
			return self();
		}

		McpJsonMapper resolveJsonMapper() {
			return (this.jsonMapper != null) ? this.jsonMapper : McpJsonMapper.getDefault();
		}

	}

	/**
	 * Asynchronous server specification.
	 */
	class AsyncSpecification extends BaseSpecification<AsyncSpecification> {

		private final List<McpServerFeatures.AsyncToolSpecification> tools = new ArrayList<>();

		private final List<McpServerFeatures.AsyncResourceSpecification> resources = new ArrayList<>();

		private final List<McpServerFeatures.AsyncPromptSpecification> prompts = new ArrayList<>();

		private AsyncSpecification(McpServerTransportProvider transportProvider) {
			super(transportProvider);
		}

		@Override
		AsyncSpecification self() {
			return this;
		}

		/**
		 * Adds a single tool with its implementation handler to the server.
		 * @param tool The tool definition including name, description, and schema. Must
		 * not be null.
		 * @param handler The function that implements the tool's logic. Must not be null.
		 * @return This builder instance for method chaining
		 */
		public AsyncSpecification tool(McpSchema.Tool tool,
				BiFunction<McpAsyncServerExchange, McpSchema.CallToolRequest, Mono<CallToolResult>> handler) {
			this.tools.add(new McpServerFeatures.AsyncToolSpecification(tool, handler));
			return this;
		}

		public AsyncSpecification tools(List<McpServerFeatures.AsyncToolSpecification> toolSpecifications) {
			Assert.notNull(toolSpecifications, "Tool handlers list must not be null");
			this.tools.addAll(toolSpecifications);
			return this;
		}

		public AsyncSpecification tools(McpServerFeatures.AsyncToolSpecification... toolSpecifications) {
			Assert.notNull(toolSpecifications, "Tool handlers list must not be null");
			return tools(Arrays.asList(toolSpecifications));
		}

		public AsyncSpecification resources(
				List<McpServerFeatures.AsyncResourceSpecification> resourceSpecifications) {
			Assert.notNull(resourceSpecifications, "Resource handlers list must not be null");
			this.resources.addAll(resourceSpecifications);
			return this;
		}

		public AsyncSpecification resources(McpServerFeatures.AsyncResourceSpecification... resourceSpecifications) {
			Assert.notNull(resourceSpecifications, "Resource handlers list must not be null");
			return resources(Arrays.asList(resourceSpecifications));
		}

		public AsyncSpecification prompts(List<McpServerFeatures.AsyncPromptSpecification> promptSpecifications) {
			Assert.notNull(promptSpecifications, "Prompts list must not be null");
			this.prompts.addAll(promptSpecifications);
			return this;
		}

		public AsyncSpecification prompts(McpServerFeatures.AsyncPromptSpecification... promptSpecifications) {
			Assert.notNull(promptSpecifications, "Prompts list must not be null");
			return prompts(Arrays.asList(promptSpecifications));
		}

		/**
		 * Builds and starts the server.
		 * @return A new instance of {@link McpAsyncServer}, already accepting peers
		 * @throws McpDuplicateCapabilityException if two capabilities share a name in
		 * the same namespace
		 */
		public McpAsyncServer build() {
			McpServerFeatures.Async features = new McpServerFeatures.Async(this.serverInfo, this.serverCapabilities,
					this.tools, this.resources, this.prompts, this.instructions);
			return new McpAsyncServer(this.transportProvider, resolveJsonMapper(), features, this.requestTimeout,
					this.maxConcurrentRequests, this.maxProtocolViolations);
		}

	}

	/**
	 * Synchronous server specification. Handlers run on
	 * {@link reactor.core.scheduler.Schedulers#boundedElastic()}.
	 */
	class SyncSpecification extends BaseSpecification<SyncSpecification> {

		private final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

		private final List<McpServerFeatures.SyncResourceSpecification> resources = new ArrayList<>();

		private final List<McpServerFeatures.SyncPromptSpecification> prompts = new ArrayList<>();

		private SyncSpecification(McpServerTransportProvider transportProvider) {
			super(transportProvider);
		}

		@Override
		SyncSpecification self() {
			return this;
		}

		public SyncSpecification tool(McpSchema.Tool tool,
				BiFunction<McpSyncServerExchange, McpSchema.CallToolRequest, CallToolResult> handler) {
			Assert.notNull(tool, "Tool must not be null");
			Assert.notNull(handler, "Handler must not be null");
			this.tools.add(new McpServerFeatures.SyncToolSpecification(tool, handler));
			return this;
		}

		public SyncSpecification tools(McpServerFeatures.SyncToolSpecification... toolSpecifications) {
			Assert.notNull(toolSpecifications, "Tool handlers list must not be null");
			this.tools.addAll(Arrays.asList(toolSpecifications));
			return this;
		}

		public SyncSpecification resources(McpServerFeatures.SyncResourceSpecification... resourceSpecifications) {
			Assert.notNull(resourceSpecifications, "Resource handlers list must not be null");
			this.resources.addAll(Arrays.asList(resourceSpecifications));
			return this;
		}

		public SyncSpecification prompts(McpServerFeatures.SyncPromptSpecification... promptSpecifications) {
			Assert.notNull(promptSpecifications, "Prompts list must not be null");
			this.prompts.addAll(Arrays.asList(promptSpecifications));
			return this;
		}

		public McpSyncServer build() {
			McpServerFeatures.Async features = new McpServerFeatures.Async(this.serverInfo, this.serverCapabilities,
					this.tools.stream().map(McpServerFeatures.AsyncToolSpecification::fromSync).toList(),
					this.resources.stream().map(McpServerFeatures.AsyncResourceSpecification::fromSync).toList(),
					this.prompts.stream().map(McpServerFeatures.AsyncPromptSpecification::fromSync).toList(),
					this.instructions);
			return new McpSyncServer(new McpAsyncServer(this.transportProvider, resolveJsonMapper(), features,
					this.requestTimeout, this.maxConcurrentRequests, this.maxProtocolViolations));
		}

	}

}
