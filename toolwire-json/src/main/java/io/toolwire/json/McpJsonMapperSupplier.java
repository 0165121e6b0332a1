/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.json;

import java.util.function.Supplier;

/**
 * Service provider interface used to discover a {@link McpJsonMapper} implementation
 * through {@link java.util.ServiceLoader}.
 */
public interface McpJsonMapperSupplier extends Supplier<McpJsonMapper> {

}
