/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.client;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import io.toolwire.spec.McpSchema;
import io.toolwire.util.Assert;
import io.toolwire.util.Utils;

/**
 * What a client offers to the server and how it reacts to server notifications.
 * Asynchronous consumers return a {@link Mono}; synchronous ones are adapted by running
 * them on {@link Schedulers#boundedElastic()}.
 *
 * @author Dariusz Jędrzejczyk
 */
class McpClientFeatures {

	/**
	 * Asynchronous client features.
	 *
	 * @param clientInfo the client implementation information
	 * @param clientCapabilities the capabilities advertised in the handshake
	 * @param roots the roots answered to {@code roots/list}, by uri
	 * @param toolsChangeConsumers called with the refreshed tool list
	 * @param resourcesChangeConsumers called with the refreshed resource list
	 * @param resourcesUpdateConsumers called for each {@code notifications/resources/updated}
	 * @param promptsChangeConsumers called with the refreshed prompt list
	 * @param loggingConsumers called for each {@code notifications/message}
	 * @param progressConsumers called for each {@code notifications/progress}
	 * @param samplingHandler answers {@code sampling/createMessage}
	 */
	record Async(McpSchema.Implementation clientInfo, McpSchema.ClientCapabilities clientCapabilities,
			Map<String, McpSchema.Root> roots, List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumers,
			List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumers,
			List<Function<McpSchema.ResourcesUpdatedNotification, Mono<Void>>> resourcesUpdateConsumers,
			List<Function<List<McpSchema.Prompt>, Mono<Void>>> promptsChangeConsumers,
			List<Function<McpSchema.LoggingMessageNotification, Mono<Void>>> loggingConsumers,
			List<Function<McpSchema.ProgressNotification, Mono<Void>>> progressConsumers,
			Function<McpSchema.CreateMessageRequest, Mono<McpSchema.CreateMessageResult>> samplingHandler) {

		Async {
			Assert.notNull(clientInfo, "Client info must not be null");
			clientCapabilities = (clientCapabilities != null) ? clientCapabilities
					: new McpSchema.ClientCapabilities(null,
							!Utils.isEmpty(roots) ? new McpSchema.ClientCapabilities.RootCapabilities(false) : null,
							samplingHandler != null ? new McpSchema.ClientCapabilities.Sampling() : null);
			roots = (roots != null) ? Map.copyOf(roots) : Map.of();
			toolsChangeConsumers = (toolsChangeConsumers != null) ? List.copyOf(toolsChangeConsumers) : List.of();
			resourcesChangeConsumers = (resourcesChangeConsumers != null) ? List.copyOf(resourcesChangeConsumers)
					: List.of();
			resourcesUpdateConsumers = (resourcesUpdateConsumers != null) ? List.copyOf(resourcesUpdateConsumers)
					: List.of();
			promptsChangeConsumers = (promptsChangeConsumers != null) ? List.copyOf(promptsChangeConsumers)
					: List.of();
			loggingConsumers = (loggingConsumers != null) ? List.copyOf(loggingConsumers) : List.of();
			progressConsumers = (progressConsumers != null) ? List.copyOf(progressConsumers) : List.of();
		}

		/**
		 * Adapts synchronous features, running every consumer and the sampling handler
		 * on {@link Schedulers#boundedElastic()}.
		 * @param syncSpec the synchronous features
		 * @return the asynchronous equivalent
		 */
		static Async fromSync(Sync syncSpec) {
			List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumers = new ArrayList<>();
			for (Consumer<List<McpSchema.Tool>> consumer : syncSpec.toolsChangeConsumers()) {
				toolsChangeConsumers.add(t -> Mono.<Void>fromRunnable(() -> consumer.accept(t))
					.subscribeOn(Schedulers.boundedElastic()));
			}

			List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumers = new ArrayList<>();
			for (Consumer<List<McpSchema.Resource>> consumer : syncSpec.resourcesChangeConsumers()) {
				resourcesChangeConsumers.add(r -> Mono.<Void>fromRunnable(() -> consumer.accept(r))
					.subscribeOn(Schedulers.boundedElastic()));
			}

			List<Function<McpSchema.ResourcesUpdatedNotification, Mono<Void>>> resourcesUpdateConsumers = new ArrayList<>();
			for (Consumer<McpSchema.ResourcesUpdatedNotification> consumer : syncSpec.resourcesUpdateConsumers()) {
				resourcesUpdateConsumers.add(u -> Mono.<Void>fromRunnable(() -> consumer.accept(u))
					.subscribeOn(Schedulers.boundedElastic()));
			}

			List<Function<List<McpSchema.Prompt>, Mono<Void>>> promptsChangeConsumers = new ArrayList<>();
			for (Consumer<List<McpSchema.Prompt>> consumer : syncSpec.promptsChangeConsumers()) {
				promptsChangeConsumers.add(p -> Mono.<Void>fromRunnable(() -> consumer.accept(p))
					.subscribeOn(Schedulers.boundedElastic()));
			}

			List<Function<McpSchema.LoggingMessageNotification, Mono<Void>>> loggingConsumers = new ArrayList<>();
			for (Consumer<McpSchema.LoggingMessageNotification> consumer : syncSpec.loggingConsumers()) {
				loggingConsumers.add(l -> Mono.<Void>fromRunnable(() -> consumer.accept(l))
					.subscribeOn(Schedulers.boundedElastic()));
			}

			List<Function<McpSchema.ProgressNotification, Mono<Void>>> progressConsumers = new ArrayList<>();
			for (Consumer<McpSchema.ProgressNotification> consumer : syncSpec.progressConsumers()) {
				progressConsumers.add(p -> Mono.<Void>fromRunnable(() -> consumer.accept(p))
					.subscribeOn(Schedulers.boundedElastic()));
			}

			Function<McpSchema.CreateMessageRequest, Mono<McpSchema.CreateMessageResult>> samplingHandler = (syncSpec
				.samplingHandler() != null)
					? r -> Mono.fromCallable(() -> syncSpec.samplingHandler().apply(r))
						.subscribeOn(Schedulers.boundedElastic())
					: null;

			return new Async(syncSpec.clientInfo(), syncSpec.clientCapabilities(), syncSpec.roots(),
					toolsChangeConsumers, resourcesChangeConsumers, resourcesUpdateConsumers, promptsChangeConsumers,
					loggingConsumers, progressConsumers, samplingHandler);
		}
	}

	/**
	 * Synchronous client features.
	 *
	 * @param clientInfo the client implementation information
	 * @param clientCapabilities the capabilities advertised in the handshake
	 * @param roots the roots answered to {@code roots/list}, by uri
	 * @param toolsChangeConsumers called with the refreshed tool list
	 * @param resourcesChangeConsumers called with the refreshed resource list
	 * @param resourcesUpdateConsumers called for each {@code notifications/resources/updated}
	 * @param promptsChangeConsumers called with the refreshed prompt list
	 * @param loggingConsumers called for each {@code notifications/message}
	 * @param progressConsumers called for each {@code notifications/progress}
	 * @param samplingHandler answers {@code sampling/createMessage}
	 */
	record Sync(McpSchema.Implementation clientInfo, McpSchema.ClientCapabilities clientCapabilities,
			Map<String, McpSchema.Root> roots, List<Consumer<List<McpSchema.Tool>>> toolsChangeConsumers,
			List<Consumer<List<McpSchema.Resource>>> resourcesChangeConsumers,
			List<Consumer<McpSchema.ResourcesUpdatedNotification>> resourcesUpdateConsumers,
			List<Consumer<List<McpSchema.Prompt>>> promptsChangeConsumers,
			List<Consumer<McpSchema.LoggingMessageNotification>> loggingConsumers,
			List<Consumer<McpSchema.ProgressNotification>> progressConsumers,
			Function<McpSchema.CreateMessageRequest, McpSchema.CreateMessageResult> samplingHandler) {

		Sync {
			Assert.notNull(clientInfo, "Client info must not be null");
			roots = (roots != null) ? new HashMap<>(roots) : Map.of();
			toolsChangeConsumers = (toolsChangeConsumers != null) ? List.copyOf(toolsChangeConsumers) : List.of();
			resourcesChangeConsumers = (resourcesChangeConsumers != null) ? List.copyOf(resourcesChangeConsumers)
					: List.of();
			resourcesUpdateConsumers = (resourcesUpdateConsumers != null) ? List.copyOf(resourcesUpdateConsumers)
					: List.of();
			promptsChangeConsumers = (promptsChangeConsumers != null) ? List.copyOf(promptsChangeConsumers)
					: List.of();
			loggingConsumers = (loggingConsumers != null) ? List.copyOf(loggingConsumers) : List.of();
			progressConsumers = (progressConsumers != null) ? List.copyOf(progressConsumers) : List.of();
		}
	}

}
