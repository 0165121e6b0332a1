/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.client;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.toolwire.json.TypeRef;
import io.toolwire.spec.McpSchema;
import io.toolwire.util.Assert;

/**
 * A synchronous client that wraps an {@link McpAsyncClient} and blocks on each of its
 * operations. Connection loss, timeouts and server errors surface as the same unchecked
 * exceptions the asynchronous client signals.
 *
 * @author Dariusz Jędrzejczyk
 * @author Christian Tzolov
 * @see McpClient
 * @see McpAsyncClient
 */
public class McpSyncClient implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(McpSyncClient.class);

	// TODO: this is a temporary solution to avoid blocking forever on a close that
	// never completes, make it configurable on the builder
	private static final long DEFAULT_CLOSE_TIMEOUT_MS = 10_000L;

	private final McpAsyncClient delegate;

	/**
	 * Create a new McpSyncClient with the given delegate.
	 * @param delegate the asynchronous kernel on top of which this synchronous client
	 * provides a blocking API.
	 */
	McpSyncClient(McpAsyncClient delegate) {
		Assert.notNull(delegate, "The delegate can not be null");
		this.delegate = delegate;
	}

	public McpSchema.InitializeResult connect() {
		return this.delegate.connect().block();
	}

	public SessionState getState() {
		return this.delegate.getState();
	}

	public SessionStats getStats() {
		return this.delegate.getStats();
	}

	public McpSchema.ServerCapabilities getServerCapabilities() {
		return this.delegate.getServerCapabilities();
	}

	public McpSchema.Implementation getServerInfo() {
		return this.delegate.getServerInfo();
	}

	public String getServerInstructions() {
		return this.delegate.getServerInstructions();
	}

	public McpSchema.ClientCapabilities getClientCapabilities() {
		return this.delegate.getClientCapabilities();
	}

	public McpSchema.Implementation getClientInfo() {
		return this.delegate.getClientInfo();
	}

	@Override
	public void close() {
		this.delegate.close();
	}

	public boolean closeGracefully() {
		try {
			this.delegate.closeGracefully().block(Duration.ofMillis(DEFAULT_CLOSE_TIMEOUT_MS));
		}
		catch (RuntimeException e) {
			logger.warn("Client didn't close within timeout of {} ms.", DEFAULT_CLOSE_TIMEOUT_MS, e);
			return false;
		}
		return true;
	}

	public void disconnect() {
		this.delegate.disconnect().block();
	}

	public Object ping() {
		return this.delegate.ping().block();
	}

	public <T> T invoke(String method, Object params, TypeRef<T> typeRef, Duration timeout) {
		return this.delegate.invoke(method, params, typeRef, timeout).block();
	}

	public McpSchema.CallToolResult callTool(McpSchema.CallToolRequest callToolRequest) {
		return this.delegate.callTool(callToolRequest).block();
	}

	public McpSchema.ListToolsResult listTools() {
		return this.delegate.listTools().block();
	}

	public McpSchema.ListResourcesResult listResources() {
		return this.delegate.listResources().block();
	}

	public McpSchema.ReadResourceResult readResource(McpSchema.Resource resource) {
		return this.delegate.readResource(resource).block();
	}

	public McpSchema.ReadResourceResult readResource(McpSchema.ReadResourceRequest readResourceRequest) {
		return this.delegate.readResource(readResourceRequest).block();
	}

	public void subscribeResource(McpSchema.SubscribeRequest subscribeRequest) {
		this.delegate.subscribeResource(subscribeRequest).block();
	}

	public void unsubscribeResource(McpSchema.UnsubscribeRequest unsubscribeRequest) {
		this.delegate.unsubscribeResource(unsubscribeRequest).block();
	}

	public McpSchema.ListPromptsResult listPrompts() {
		return this.delegate.listPrompts().block();
	}

	public McpSchema.GetPromptResult getPrompt(McpSchema.GetPromptRequest getPromptRequest) {
		return this.delegate.getPrompt(getPromptRequest).block();
	}

	public void setLoggingLevel(McpSchema.LoggingLevel loggingLevel) {
		this.delegate.setLoggingLevel(loggingLevel).block();
	}

	/**
	 * Get the underlying async client instance.
	 * @return The wrapped async client
	 */
	public McpAsyncClient getAsyncClient() {
		return this.delegate;
	}

}
