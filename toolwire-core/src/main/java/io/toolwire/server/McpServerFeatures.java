/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.server;

import java.util.List;
import java.util.function.BiFunction;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import io.toolwire.spec.McpSchema;
import io.toolwire.util.Assert;

/**
 * Capability specifications: a descriptor bound to the handler that serves it. Async
 * handlers return a {@link Mono}; sync handlers are adapted by running them on
 * {@link Schedulers#boundedElastic()}.
 *
 * @author Dariusz Jędrzejczyk
 * @author Jihoon Kim
 */
public final class McpServerFeatures {

	private McpServerFeatures() {
	}

	/**
	 * A registrable capability, stored by the {@link McpCapabilityRegistry} under
	 * {@link #name()} in {@link #namespace()}.
	 */
	public sealed interface CapabilitySpecification
			permits AsyncToolSpecification, AsyncResourceSpecification, AsyncPromptSpecification {

		CapabilityNamespace namespace();

		String name();

	}

	/**
	 * Specification of a tool with its asynchronous handler function.
	 *
	 * @param tool The tool definition including name, description, and input schema
	 * @param callHandler The function that implements the tool's logic. Cancelling the
	 * returned {@link Mono} is how a caller's {@code notifications/cancelled} or a handler
	 * timeout reaches the tool.
	 */
	public record AsyncToolSpecification(McpSchema.Tool tool,
			BiFunction<McpAsyncServerExchange, McpSchema.CallToolRequest, Mono<McpSchema.CallToolResult>> callHandler)
			implements
				CapabilitySpecification {

		public AsyncToolSpecification {
			Assert.notNull(tool, "Tool must not be null");
			Assert.notNull(callHandler, "Call handler function must not be null");
		}

		@Override
		public CapabilityNamespace namespace() {
			return CapabilityNamespace.TOOLS;
		}

		@Override
		public String name() {
			return this.tool.name();
		}

		public static AsyncToolSpecification fromSync(SyncToolSpecification tool) {
			return new AsyncToolSpecification(tool.tool(),
					(exchange, request) -> Mono
						.fromCallable(() -> tool.callHandler().apply(new McpSyncServerExchange(exchange), request))
						.subscribeOn(Schedulers.boundedElastic()));
		}
	}

	/**
	 * Specification of a resource with its asynchronous read handler.
	 *
	 * @param resource The resource definition; its URI is the registry key
	 * @param readHandler The function that produces the resource contents
	 */
	public record AsyncResourceSpecification(McpSchema.Resource resource,
			BiFunction<McpAsyncServerExchange, McpSchema.ReadResourceRequest, Mono<McpSchema.ReadResourceResult>> readHandler)
			implements
				CapabilitySpecification {

		public AsyncResourceSpecification {
			Assert.notNull(resource, "Resource must not be null");
			Assert.hasText(resource.uri(), "Resource uri must not be empty");
			Assert.notNull(readHandler, "Read handler function must not be null");
		}

		@Override
		public CapabilityNamespace namespace() {
			return CapabilityNamespace.RESOURCES;
		}

		@Override
		public String name() {
			return this.resource.uri();
		}

		public static AsyncResourceSpecification fromSync(SyncResourceSpecification resource) {
			return new AsyncResourceSpecification(resource.resource(),
					(exchange, request) -> Mono
						.fromCallable(() -> resource.readHandler().apply(new McpSyncServerExchange(exchange), request))
						.subscribeOn(Schedulers.boundedElastic()));
		}
	}

	/**
	 * Specification of a prompt template with its asynchronous handler.
	 *
	 * @param prompt The prompt definition including name and arguments
	 * @param promptHandler The function that renders the prompt
	 */
	public record AsyncPromptSpecification(McpSchema.Prompt prompt,
			BiFunction<McpAsyncServerExchange, McpSchema.GetPromptRequest, Mono<McpSchema.GetPromptResult>> promptHandler)
			implements
				CapabilitySpecification {

		public AsyncPromptSpecification {
			Assert.notNull(prompt, "Prompt must not be null");
			Assert.notNull(promptHandler, "Prompt handler function must not be null");
		}

		@Override
		public CapabilityNamespace namespace() {
			return CapabilityNamespace.PROMPTS;
		}

		@Override
		public String name() {
			return this.prompt.name();
		}

		public static AsyncPromptSpecification fromSync(SyncPromptSpecification prompt) {
			return new AsyncPromptSpecification(prompt.prompt(),
					(exchange, request) -> Mono
						.fromCallable(() -> prompt.promptHandler().apply(new McpSyncServerExchange(exchange), request))
						.subscribeOn(Schedulers.boundedElastic()));
		}
	}

	/**
	 * Specification of a tool with its synchronous handler function.
	 *
	 * @param tool The tool definition
	 * @param callHandler The blocking function that implements the tool's logic
	 */
	public record SyncToolSpecification(McpSchema.Tool tool,
			BiFunction<McpSyncServerExchange, McpSchema.CallToolRequest, McpSchema.CallToolResult> callHandler) {
	}

	public record SyncResourceSpecification(McpSchema.Resource resource,
			BiFunction<McpSyncServerExchange, McpSchema.ReadResourceRequest, McpSchema.ReadResourceResult> readHandler) {
	}

	public record SyncPromptSpecification(McpSchema.Prompt prompt,
			BiFunction<McpSyncServerExchange, McpSchema.GetPromptRequest, McpSchema.GetPromptResult> promptHandler) {
	}

	/**
	 * Asynchronous server features: identity, advertised capabilities and the initial
	 * capability set.
	 *
	 * @param serverInfo The server implementation details
	 * @param serverCapabilities The advertised capabilities
	 * @param tools The initial tools
	 * @param resources The initial resources
	 * @param prompts The initial prompts
	 * @param instructions Usage hints returned in the handshake
	 */
	record Async(McpSchema.Implementation serverInfo, McpSchema.ServerCapabilities serverCapabilities,
			List<AsyncToolSpecification> tools, List<AsyncResourceSpecification> resources,
			List<AsyncPromptSpecification> prompts, String instructions) {

		Async {
			Assert.notNull(serverInfo, "Server info must not be null");
			serverCapabilities = (serverCapabilities != null) ? serverCapabilities
					: McpSchema.ServerCapabilities.builder()
						.logging()
						.tools(true)
						.resources(true, true)
						.prompts(true)
						.build();
			tools = List.copyOf(tools);
			resources = List.copyOf(resources);
			prompts = List.copyOf(prompts);
		}
	}

}
