/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.server;

import reactor.core.publisher.Mono;

import io.toolwire.json.TypeRef;
import io.toolwire.spec.McpError;
import io.toolwire.spec.McpSchema;
import io.toolwire.spec.McpSchema.LoggingMessageNotification;
import io.toolwire.spec.McpServerSession;

/**
 * Represents an asynchronous exchange with a connected client. Handlers receive one to
 * inspect the client and to call back into it.
 *
 * @author Dariusz Jędrzejczyk
 * @author Christian Tzolov
 */
public class McpAsyncServerExchange {

	private final McpServerSession session;

	private final McpSchema.ClientCapabilities clientCapabilities;

	private final McpSchema.Implementation clientInfo;

	private static final TypeRef<McpSchema.CreateMessageResult> CREATE_MESSAGE_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.ListRootsResult> LIST_ROOTS_RESULT_TYPE_REF = new TypeRef<>() {
	};

	private static final TypeRef<Object> OBJECT_TYPE_REF = new TypeRef<>() {
	};

	/**
	 * Create a new asynchronous exchange with the client.
	 * @param session The server session representing a 1-1 interaction.
	 * @param clientCapabilities The client capabilities that define the supported
	 * features and functionality.
	 * @param clientInfo The client implementation information.
	 */
	public McpAsyncServerExchange(McpServerSession session, McpSchema.ClientCapabilities clientCapabilities,
			McpSchema.Implementation clientInfo) {
		this.session = session;
		this.clientCapabilities = clientCapabilities;
		this.clientInfo = clientInfo;
	}

	/**
	 * Get the client capabilities that define the supported features and functionality.
	 * @return The client capabilities
	 */
	public McpSchema.ClientCapabilities getClientCapabilities() {
		return this.clientCapabilities;
	}

	/**
	 * Get the client implementation information.
	 * @return The client implementation details
	 */
	public McpSchema.Implementation getClientInfo() {
		return this.clientInfo;
	}

	public String getSessionId() {
		return this.session.getId();
	}

	McpServerSession getSession() {
		return this.session;
	}

	/**
	 * Asks the client to sample a language model. Only available when the client
	 * declared the sampling capability.
	 * @param createMessageRequest The request to create a new message
	 * @return A Mono that completes when the message has been created
	 */
	public Mono<McpSchema.CreateMessageResult> createMessage(McpSchema.CreateMessageRequest createMessageRequest) {
		if (this.clientCapabilities == null) {
			return Mono.error(notReady("Client must be initialized. Call the initialize method first!"));
		}
		if (this.clientCapabilities.sampling() == null) {
			return Mono.error(notReady("Client must be configured with sampling capabilities"));
		}
		return this.session.sendRequest(McpSchema.METHOD_SAMPLING_CREATE_MESSAGE, createMessageRequest,
				CREATE_MESSAGE_RESULT_TYPE_REF);
	}

	/**
	 * Retrieves the list of all roots provided by the client.
	 * @return A Mono that emits the list of roots result.
	 */
	public Mono<McpSchema.ListRootsResult> listRoots() {
		if (this.clientCapabilities == null) {
			return Mono.error(notReady("Client must be initialized. Call the initialize method first!"));
		}
		if (this.clientCapabilities.roots() == null) {
			return Mono.error(notReady("Client must be configured with roots capabilities"));
		}
		return this.session.sendRequest(McpSchema.METHOD_ROOTS_LIST, null, LIST_ROOTS_RESULT_TYPE_REF);
	}

	/**
	 * Send a logging message notification to this client. Messages below the minimum
	 * level the client set through {@code logging/setLevel} are not sent.
	 * @param loggingMessageNotification The logging message to send
	 * @return A Mono that completes when the notification has been sent
	 */
	public Mono<Void> loggingNotification(LoggingMessageNotification loggingMessageNotification) {
		if (loggingMessageNotification == null) {
			return Mono.error(McpError.INVALID_PARAMS.apply("Logging message must not be null"));
		}
		return Mono.defer(() -> {
			if (this.session.isNotificationForLevelAllowed(loggingMessageNotification.level())) {
				return this.session.sendNotification(McpSchema.METHOD_NOTIFICATION_MESSAGE, loggingMessageNotification);
			}
			return Mono.empty();
		});
	}

	/**
	 * Tells the client how far a long-running request has come.
	 * @param progressNotification The progress to report, carrying the token the client
	 * attached to its request
	 * @return A Mono that completes when the notification has been sent
	 */
	public Mono<Void> progressNotification(McpSchema.ProgressNotification progressNotification) {
		if (progressNotification == null) {
			return Mono.error(McpError.INVALID_PARAMS.apply("Progress notification must not be null"));
		}
		return this.session.sendNotification(McpSchema.METHOD_NOTIFICATION_PROGRESS, progressNotification);
	}

	/**
	 * Sends a ping request to the client.
	 * @return A Mono that completes with clients's ping response
	 */
	public Mono<Object> ping() {
		return this.session.sendRequest(McpSchema.METHOD_PING, null, OBJECT_TYPE_REF);
	}

	private static McpError notReady(String message) {
		return McpError.builder(McpSchema.ErrorCodes.INVALID_REQUEST).message(message).build();
	}

}
