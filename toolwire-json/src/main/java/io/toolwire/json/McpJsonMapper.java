/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.json;

import java.io.IOException;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Abstraction for JSON serialization/deserialization that keeps the protocol engine
 * independent of a specific JSON library. The Jackson 2 binding lives in the
 * {@code toolwire-json-jackson2} module.
 */
public interface McpJsonMapper {

	/**
	 * Deserialize JSON string into a target type.
	 * @param content JSON as String
	 * @param type target class
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(String content, Class<T> type) throws IOException;

	/**
	 * Deserialize JSON bytes into a target type.
	 * @param content JSON as bytes
	 * @param type target class
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(byte[] content, Class<T> type) throws IOException;

	/**
	 * Deserialize JSON string into a parameterized target type.
	 * @param content JSON as String
	 * @param type parameterized type reference
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(String content, TypeRef<T> type) throws IOException;

	/**
	 * Convert a value to a given type, used to bind untyped params and results to the
	 * schema records.
	 * @param fromValue source value
	 * @param type target class
	 * @return converted value
	 * @param <T> generic type
	 * @throws IllegalArgumentException if the value cannot be converted
	 */
	<T> T convertValue(Object fromValue, Class<T> type);

	/**
	 * Convert a value to a given parameterized type.
	 * @param fromValue source value
	 * @param type target type reference
	 * @return converted value
	 * @param <T> generic type
	 * @throws IllegalArgumentException if the value cannot be converted
	 */
	<T> T convertValue(Object fromValue, TypeRef<T> type);

	/**
	 * Serialize an object to JSON string.
	 * @param value object to serialize
	 * @return JSON as String
	 * @throws IOException on serialization errors
	 */
	String writeValueAsString(Object value) throws IOException;

	/**
	 * Serialize an object to JSON bytes.
	 * @param value object to serialize
	 * @return JSON as bytes
	 * @throws IOException on serialization errors
	 */
	byte[] writeValueAsBytes(Object value) throws IOException;

	/**
	 * Returns the shared default mapper, resolving it on first use.
	 * @return the default {@link McpJsonMapper}
	 * @throws IllegalStateException if no implementation exists on the classpath
	 */
	static McpJsonMapper getDefault() {
		return DefaultHolder.INSTANCE;
	}

	/**
	 * Resolves a new {@link McpJsonMapper} from the first {@link McpJsonMapperSupplier}
	 * that {@link ServiceLoader} finds.
	 * @return a new {@link McpJsonMapper}
	 * @throws IllegalStateException if no implementation exists on the classpath, or
	 * every discovered supplier failed
	 */
	static McpJsonMapper createDefault() {
		AtomicReference<IllegalStateException> ex = new AtomicReference<>();
		return ServiceLoader.load(McpJsonMapperSupplier.class).stream().flatMap(provider -> {
			try {
				return Stream.ofNullable(provider.get().get());
			}
			catch (Exception e) {
				ex.updateAndGet(existing -> {
					if (existing == null) {
						return new IllegalStateException("Failed to initialize default McpJsonMapper", e);
					}
					existing.addSuppressed(e);
					return existing;
				});
				return Stream.empty();
			}
		}).findFirst().orElseThrow(() -> {
			if (ex.get() != null) {
				return ex.get();
			}
			return new IllegalStateException("No default McpJsonMapper implementation found");
		});
	}

	/**
	 * Lazily initialized default instance.
	 */
	final class DefaultHolder {

		private static final McpJsonMapper INSTANCE = createDefault();

		private DefaultHolder() {
		}

	}

}
