/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.server;

/**
 * The independent namespaces a server exposes capabilities in. A name may repeat across
 * namespaces but not within one.
 */
public enum CapabilityNamespace {

	/**
	 * Tools, keyed by tool name.
	 */
	TOOLS,

	/**
	 * Resources, keyed by URI.
	 */
	RESOURCES,

	/**
	 * Prompts, keyed by prompt name.
	 */
	PROMPTS

}
