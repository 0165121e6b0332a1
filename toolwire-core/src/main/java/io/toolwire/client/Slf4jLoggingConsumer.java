/*
 * Copyright 2025 the original author or authors.
 */

package io.toolwire.client;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import io.toolwire.spec.McpSchema;
import io.toolwire.spec.McpSchema.LoggingMessageNotification;

/**
 * Logs the {@code notifications/message} a server sends through SLF4J, using the
 * server's logger name as the key {@code logger}.
 *
 * <p>
 * Use this with {@link McpClient.SyncSpec#loggingConsumer(Consumer)}.
 */
public class Slf4jLoggingConsumer implements Consumer<McpSchema.LoggingMessageNotification> {

	private static final Logger LOG = LoggerFactory.getLogger(Slf4jLoggingConsumer.class);

	@Override
	public void accept(LoggingMessageNotification notification) {
		if (notification.logger() == null) {
			LOG.atLevel(convert(notification.level())).log(notification.data());
		}
		else {
			LOG.atLevel(convert(notification.level()))
				.setMessage(notification.data())
				.addKeyValue("logger", notification.logger())
				.log();
		}
	}

	static Level convert(McpSchema.LoggingLevel level) {
		if (level == null) {
			return Level.INFO;
		}
		return switch (level) {
			case DEBUG -> Level.DEBUG;
			case INFO, NOTICE -> Level.INFO;
			case WARNING -> Level.WARN;
			case ERROR, CRITICAL, ALERT, EMERGENCY -> Level.ERROR;
		};
	}

}
