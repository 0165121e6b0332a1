/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.client.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import io.toolwire.spec.McpClientTransportProvider;
import io.toolwire.spec.McpTransport;
import io.toolwire.spec.McpTransportException;
import io.toolwire.transport.StreamTransport;
import io.toolwire.util.Assert;

/**
 * Launches a server process per {@link #connect()} and talks to it over its standard
 * input and output. The process's standard error is drained and logged. Closing the
 * transport terminates the process.
 *
 * @author Christian Tzolov
 */
public class StdioClientTransportProvider implements McpClientTransportProvider {

	private static final Logger logger = LoggerFactory.getLogger(StdioClientTransportProvider.class);

	private final ServerParameters params;

	public StdioClientTransportProvider(ServerParameters params) {
		Assert.notNull(params, "The params can not be null");
		this.params = params;
	}

	@Override
	public Mono<McpTransport> connect() {
		return Mono.<McpTransport>fromCallable(() -> {
			List<String> command = new ArrayList<>();
			command.add(this.params.command());
			command.addAll(this.params.args());

			ProcessBuilder processBuilder = new ProcessBuilder(command);
			processBuilder.environment().putAll(this.params.env());
			processBuilder.redirectErrorStream(false);

			Process process = processBuilder.start();
			logger.info("Started server process {} (pid {})", this.params.command(), process.pid());
			drainErrorStream(process);

			return new StreamTransport("stdio-client-" + process.pid(), process.getInputStream(),
					process.getOutputStream(), () -> terminate(process));
		})
			.subscribeOn(Schedulers.boundedElastic())
			.onErrorMap(IOException.class,
					e -> new McpTransportException("Failed to start process " + this.params.command(), e));
	}

	private void drainErrorStream(Process process) {
		Thread drainer = new Thread(() -> {
			try (BufferedReader reader = new BufferedReader(
					new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
				String line;
				while ((line = reader.readLine()) != null) {
					logger.info("[server stderr] {}", line);
				}
			}
			catch (IOException e) {
				logger.debug("Error stream of pid {} closed", process.pid(), e);
			}
		}, "toolwire-stderr-" + process.pid());
		drainer.setDaemon(true);
		drainer.start();
	}

	private static void terminate(Process process) {
		process.destroy();
		try {
			if (!process.waitFor(2, TimeUnit.SECONDS)) {
				logger.warn("Process {} did not exit, killing it", process.pid());
				process.destroyForcibly();
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			process.destroyForcibly();
		}
	}

}
