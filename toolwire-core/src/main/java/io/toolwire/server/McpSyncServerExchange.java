/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.server;

import io.toolwire.spec.McpSchema;
import io.toolwire.spec.McpSchema.LoggingMessageNotification;

/**
 * Represents a synchronous exchange with a connected client, for blocking handlers.
 *
 * @author Christian Tzolov
 */
public class McpSyncServerExchange {

	private final McpAsyncServerExchange exchange;

	/**
	 * Create a new synchronous exchange with the client using the provided asynchronous
	 * implementation as a delegate.
	 * @param exchange The asynchronous exchange to delegate to.
	 */
	public McpSyncServerExchange(McpAsyncServerExchange exchange) {
		this.exchange = exchange;
	}

	public McpSchema.ClientCapabilities getClientCapabilities() {
		return this.exchange.getClientCapabilities();
	}

	public McpSchema.Implementation getClientInfo() {
		return this.exchange.getClientInfo();
	}

	public String getSessionId() {
		return this.exchange.getSessionId();
	}

	public McpSchema.CreateMessageResult createMessage(McpSchema.CreateMessageRequest createMessageRequest) {
		return this.exchange.createMessage(createMessageRequest).block();
	}

	public McpSchema.ListRootsResult listRoots() {
		return this.exchange.listRoots().block();
	}

	public void loggingNotification(LoggingMessageNotification loggingMessageNotification) {
		this.exchange.loggingNotification(loggingMessageNotification).block();
	}

	public void progressNotification(McpSchema.ProgressNotification progressNotification) {
		this.exchange.progressNotification(progressNotification).block();
	}

	public Object ping() {
		return this.exchange.ping().block();
	}

}
