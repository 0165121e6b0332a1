/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.client;

import java.time.Duration;

import io.toolwire.util.Assert;

/**
 * How a client recovers from an involuntary connection loss. Attempt {@code n} (1-based)
 * is made after {@code min(initialDelay * multiplier^(n-1), maxDelay)}; once
 * {@code maxAttempts} attempts have failed the client stops and goes
 * {@link SessionState#DISCONNECTED}.
 *
 * @param autoReconnect whether to reconnect at all
 * @param maxAttempts number of attempts before giving up, at least 1
 * @param initialDelay delay before the first attempt
 * @param maxDelay upper bound of any delay
 * @param multiplier growth factor between consecutive delays, at least 1
 */
public record ReconnectPolicy(boolean autoReconnect, int maxAttempts, Duration initialDelay, Duration maxDelay,
		double multiplier) {

	public ReconnectPolicy {
		Assert.isTrue(maxAttempts > 0, "maxAttempts must be positive");
		Assert.notNull(initialDelay, "initialDelay must not be null");
		Assert.notNull(maxDelay, "maxDelay must not be null");
		Assert.isTrue(!initialDelay.isNegative(), "initialDelay must not be negative");
		Assert.isTrue(maxDelay.compareTo(initialDelay) >= 0, "maxDelay must not be less than initialDelay");
		Assert.isTrue(multiplier >= 1.0, "multiplier must be at least 1");
	}

	/**
	 * Five attempts, starting at one second and doubling up to thirty seconds.
	 * @return the default policy
	 */
	public static ReconnectPolicy defaults() {
		return builder().build();
	}

	/**
	 * A policy that never reconnects.
	 * @return the disabled policy
	 */
	public static ReconnectPolicy disabled() {
		return builder().autoReconnect(false).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * The delay before the given attempt.
	 * @param attempt the 1-based attempt number
	 * @return the backoff delay, never more than {@link #maxDelay()}
	 */
	public Duration delay(int attempt) {
		Assert.isTrue(attempt > 0, "attempt must be positive");
		double millis = this.initialDelay.toMillis() * Math.pow(this.multiplier, attempt - 1);
		if (millis >= this.maxDelay.toMillis()) {
			return this.maxDelay;
		}
		return Duration.ofMillis((long) millis);
	}

	public static class Builder {

		private boolean autoReconnect = true;

		private int maxAttempts = 5;

		private Duration initialDelay = Duration.ofSeconds(1);

		private Duration maxDelay = Duration.ofSeconds(30);

		private double multiplier = 2.0;

		private Builder() {
		}

		public Builder autoReconnect(boolean autoReconnect) {
			this.autoReconnect = autoReconnect;
			return this;
		}

		public Builder maxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
			return this;
		}

		public Builder initialDelay(Duration initialDelay) {
			this.initialDelay = initialDelay;
			return this;
		}

		public Builder maxDelay(Duration maxDelay) {
			this.maxDelay = maxDelay;
			return this;
		}

		public Builder multiplier(double multiplier) {
			this.multiplier = multiplier;
			return this;
		}

		public ReconnectPolicy build() {
			return new ReconnectPolicy(this.autoReconnect, this.maxAttempts, this.initialDelay, this.maxDelay,
					this.multiplier);
		}

	}

}
