/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.spec;

import io.toolwire.json.TypeRef;
import reactor.core.publisher.Mono;

/**
 * One side of a live connection, able to issue requests and notifications to the other
 * side. Implemented by {@link McpServerSession} for server-initiated traffic and by
 * {@link McpClientSession} for client-initiated traffic.
 *
 * @author Christian Tzolov
 * @author Dariusz Jędrzejczyk
 */
public interface McpSession {

	/**
	 * Sends a request to the counterparty and expects a response of type T.
	 * @param <T> the type of the expected response
	 * @param method the name of the method to be called on the counterparty
	 * @param requestParams the parameters to be sent with the request
	 * @param typeRef the type the response result is bound to
	 * @return a Mono emitting the bound result. Errors with {@link McpError} when the
	 * counterparty answered with an error response, {@link McpTimeoutException} when no
	 * response arrived in time and {@link McpConnectionLostException} when the connection
	 * was torn down first.
	 */
	<T> Mono<T> sendRequest(String method, Object requestParams, TypeRef<T> typeRef);

	/**
	 * Sends a notification without parameters.
	 * @param method the name of the notification method
	 * @return a Mono that completes when the notification has been sent
	 */
	default Mono<Void> sendNotification(String method) {
		return sendNotification(method, null);
	}

	/**
	 * Sends a notification with parameters. No response is expected.
	 * @param method the name of the notification method
	 * @param params parameters to be sent with the notification
	 * @return a Mono that completes when the notification has been sent
	 */
	Mono<Void> sendNotification(String method, Object params);

	/**
	 * Closes the session and releases any associated resources asynchronously.
	 * @return a {@link Mono} that completes when the session has been closed
	 */
	Mono<Void> closeGracefully();

	/**
	 * Closes the session and releases any associated resources.
	 */
	void close();

}
