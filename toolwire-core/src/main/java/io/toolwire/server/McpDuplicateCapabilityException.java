/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.server;

/**
 * Thrown when a capability is registered under a name its namespace already holds.
 */
public class McpDuplicateCapabilityException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final CapabilityNamespace namespace;

	private final String name;

	public McpDuplicateCapabilityException(CapabilityNamespace namespace, String name) {
		super(namespace.name().toLowerCase() + " already contains '" + name + "'");
		this.namespace = namespace;
		this.name = name;
	}

	public CapabilityNamespace getNamespace() {
		return this.namespace;
	}

	public String getName() {
		return this.name;
	}

}
