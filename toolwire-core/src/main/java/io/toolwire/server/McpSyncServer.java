/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.server;

import io.toolwire.spec.McpSchema;
import io.toolwire.spec.McpSchema.LoggingMessageNotification;
import io.toolwire.util.Assert;

/**
 * A synchronous facade over {@link McpAsyncServer}. Every operation blocks until its
 * asynchronous counterpart completes.
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 * @see McpAsyncServer
 */
public class McpSyncServer {

	private final McpAsyncServer asyncServer;

	/**
	 * Creates a new synchronous server that wraps the provided async server.
	 * @param asyncServer The async server to wrap
	 */
	public McpSyncServer(McpAsyncServer asyncServer) {
		Assert.notNull(asyncServer, "Async server must not be null");
		this.asyncServer = asyncServer;
	}

	public void addTool(McpServerFeatures.SyncToolSpecification toolSpecification) {
		this.asyncServer.addTool(McpServerFeatures.AsyncToolSpecification.fromSync(toolSpecification)).block();
	}

	public void removeTool(String toolName) {
		this.asyncServer.removeTool(toolName).block();
	}

	public void enableTool(String toolName) {
		this.asyncServer.enableTool(toolName).block();
	}

	public void disableTool(String toolName) {
		this.asyncServer.disableTool(toolName).block();
	}

	public boolean isToolEnabled(String toolName) {
		return this.asyncServer.isToolEnabled(toolName);
	}

	public void addResource(McpServerFeatures.SyncResourceSpecification resourceSpecification) {
		this.asyncServer.addResource(McpServerFeatures.AsyncResourceSpecification.fromSync(resourceSpecification))
			.block();
	}

	public void removeResource(String resourceUri) {
		this.asyncServer.removeResource(resourceUri).block();
	}

	public void addPrompt(McpServerFeatures.SyncPromptSpecification promptSpecification) {
		this.asyncServer.addPrompt(McpServerFeatures.AsyncPromptSpecification.fromSync(promptSpecification)).block();
	}

	public void removePrompt(String promptName) {
		this.asyncServer.removePrompt(promptName).block();
	}

	public void notifyToolsListChanged() {
		this.asyncServer.notifyToolsListChanged().block();
	}

	public void notifyResourcesListChanged() {
		this.asyncServer.notifyResourcesListChanged().block();
	}

	public void notifyResourcesUpdated(String uri) {
		this.asyncServer.notifyResourcesUpdated(uri).block();
	}

	public void notifyPromptsListChanged() {
		this.asyncServer.notifyPromptsListChanged().block();
	}

	public void loggingNotification(LoggingMessageNotification loggingMessageNotification) {
		this.asyncServer.loggingNotification(loggingMessageNotification).block();
	}

	public McpSchema.ServerCapabilities getServerCapabilities() {
		return this.asyncServer.getServerCapabilities();
	}

	public McpSchema.Implementation getServerInfo() {
		return this.asyncServer.getServerInfo();
	}

	public int getActiveSessionCount() {
		return this.asyncServer.getActiveSessionCount();
	}

	/**
	 * Close the server gracefully.
	 */
	public void closeGracefully() {
		this.asyncServer.closeGracefully().block();
	}

	/**
	 * Close the server immediately.
	 */
	public void close() {
		this.asyncServer.close();
	}

	/**
	 * Get the underlying async server instance.
	 * @return The wrapped async server
	 */
	public McpAsyncServer getAsyncServer() {
		return this.asyncServer;
	}

}
