/*
 * Copyright 2024-2025 the original author or authors.
 */

package io.toolwire.client.transport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.toolwire.util.Assert;

/**
 * Command line and environment of a server process launched over stdio.
 *
 * @param command the executable
 * @param args the arguments
 * @param env extra environment variables, added to the inherited environment
 * @author Christian Tzolov
 */
public record ServerParameters(String command, List<String> args, Map<String, String> env) {

	public ServerParameters {
		Assert.hasText(command, "The command can not be empty");
		args = List.copyOf(args != null ? args : List.of());
		env = Map.copyOf(env != null ? env : Map.of());
	}

	public static Builder builder(String command) {
		return new Builder(command);
	}

	public static class Builder {

		private final String command;

		private final List<String> args = new ArrayList<>();

		private final Map<String, String> env = new HashMap<>();

		private Builder(String command) {
			this.command = command;
		}

		public Builder args(String... args) {
			Assert.notNull(args, "args must not be null");
			this.args.addAll(Arrays.asList(args));
			return this;
		}

		public Builder args(List<String> args) {
			Assert.notNull(args, "args must not be null");
			this.args.addAll(args);
			return this;
		}

		public Builder addEnvVar(String key, String value) {
			Assert.notNull(key, "key must not be null");
			Assert.notNull(value, "value must not be null");
			this.env.put(key, value);
			return this;
		}

		public ServerParameters build() {
			return new ServerParameters(this.command, this.args, this.env);
		}

	}

}
