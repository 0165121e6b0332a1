/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.toolwire.util;

import java.util.Collection;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 *
 * @author Christian Tzolov
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null} and not blank
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Return {@code true} if the supplied Collection is {@code null} or empty.
	 * @param collection the Collection to check
	 * @return whether the given Collection is empty
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * Return {@code true} if the supplied Map is {@code null} or empty.
	 * @param map the Map to check
	 * @return whether the given Map is empty
	 */
	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * Whether the value is usable as a request identifier: a string or an integral
	 * number.
	 * @param id the candidate identifier
	 * @return {@code true} for {@link String}, {@link Integer} and {@link Long} values
	 */
	public static boolean isValidRequestId(@Nullable Object id) {
		return id instanceof String || id instanceof Integer || id instanceof Long;
	}

	/**
	 * Widens an {@link Integer} request id to {@link Long} so that an id compares equal
	 * however it was produced. Other values are returned as is.
	 * @param id the request id, may be {@code null}
	 * @return the canonical form of the id
	 */
	public static Object normalizeRequestId(@Nullable Object id) {
		return (id instanceof Integer number) ? Long.valueOf(number.longValue()) : id;
	}

}
