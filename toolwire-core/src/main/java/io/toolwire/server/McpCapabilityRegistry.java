/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.server;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.toolwire.server.McpServerFeatures.AsyncPromptSpecification;
import io.toolwire.server.McpServerFeatures.AsyncResourceSpecification;
import io.toolwire.server.McpServerFeatures.AsyncToolSpecification;
import io.toolwire.server.McpServerFeatures.CapabilitySpecification;
import io.toolwire.util.Assert;

/**
 * The tools, resources and prompts a server exposes, one table per
 * {@link CapabilityNamespace}. Listing returns entries in registration order. An entry
 * can be disabled without being removed; it keeps its place and comes back where it was
 * when enabled again. Many
 * readers may look up capabilities while a writer registers or removes one; a lookup
 * never observes a half-applied change.
 *
 * @author Christian Tzolov
 */
public class McpCapabilityRegistry {

	private static final Logger logger = LoggerFactory.getLogger(McpCapabilityRegistry.class);

	private final ReadWriteLock lock = new ReentrantReadWriteLock();

	private final Map<CapabilityNamespace, Map<String, CapabilitySpecification>> tables = new EnumMap<>(
			CapabilityNamespace.class);

	private final Map<CapabilityNamespace, Set<String>> disabled = new EnumMap<>(CapabilityNamespace.class);

	public McpCapabilityRegistry() {
		for (CapabilityNamespace namespace : CapabilityNamespace.values()) {
			this.tables.put(namespace, new LinkedHashMap<>());
			this.disabled.put(namespace, new HashSet<>());
		}
	}

	/**
	 * Adds a capability under its name.
	 * @param specification the capability to add
	 * @throws McpDuplicateCapabilityException if the namespace already holds the name
	 */
	public void register(CapabilitySpecification specification) {
		Assert.notNull(specification, "Capability specification must not be null");
		Assert.hasText(specification.name(), "Capability name must not be empty");

		this.lock.writeLock().lock();
		try {
			Map<String, CapabilitySpecification> table = this.tables.get(specification.namespace());
			if (table.containsKey(specification.name())) {
				throw new McpDuplicateCapabilityException(specification.namespace(), specification.name());
			}
			table.put(specification.name(), specification);
		}
		finally {
			this.lock.writeLock().unlock();
		}
		logger.debug("Registered {} '{}'", specification.namespace(), specification.name());
	}

	/**
	 * Removes a capability.
	 * @param namespace the namespace to remove from
	 * @param name the capability name
	 * @return {@code true} if the capability was present
	 */
	public boolean unregister(CapabilityNamespace namespace, String name) {
		Assert.notNull(namespace, "namespace must not be null");
		this.lock.writeLock().lock();
		try {
			this.disabled.get(namespace).remove(name);
			return this.tables.get(namespace).remove(name) != null;
		}
		finally {
			this.lock.writeLock().unlock();
		}
	}

	/**
	 * Enables or disables a registered capability.
	 * @param namespace the namespace of the capability
	 * @param name the capability name
	 * @param enabled the new state
	 * @return {@code false} if no such capability is registered
	 */
	public boolean setEnabled(CapabilityNamespace namespace, String name, boolean enabled) {
		Assert.notNull(namespace, "namespace must not be null");
		this.lock.writeLock().lock();
		try {
			if (name == null || !this.tables.get(namespace).containsKey(name)) {
				return false;
			}
			if (enabled) {
				this.disabled.get(namespace).remove(name);
			}
			else {
				this.disabled.get(namespace).add(name);
			}
		}
		finally {
			this.lock.writeLock().unlock();
		}
		logger.debug("{} {} '{}'", enabled ? "Enabled" : "Disabled", namespace, name);
		return true;
	}

	/**
	 * Whether a capability is registered and not disabled.
	 * @param namespace the namespace of the capability
	 * @param name the capability name
	 * @return {@code true} if the capability can be used
	 */
	public boolean isEnabled(CapabilityNamespace namespace, String name) {
		Assert.notNull(namespace, "namespace must not be null");
		this.lock.readLock().lock();
		try {
			return name != null && this.tables.get(namespace).containsKey(name)
					&& !this.disabled.get(namespace).contains(name);
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

	public Optional<CapabilitySpecification> get(CapabilityNamespace namespace, String name) {
		Assert.notNull(namespace, "namespace must not be null");
		if (name == null) {
			return Optional.empty();
		}
		this.lock.readLock().lock();
		try {
			return Optional.ofNullable(this.tables.get(namespace).get(name));
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

	/**
	 * Snapshot of a namespace in registration order.
	 * @param namespace the namespace to list
	 * @return an immutable copy of the registered capabilities
	 */
	public List<CapabilitySpecification> list(CapabilityNamespace namespace) {
		Assert.notNull(namespace, "namespace must not be null");
		this.lock.readLock().lock();
		try {
			return List.copyOf(this.tables.get(namespace).values());
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

	/**
	 * Snapshot of the enabled entries of a namespace in registration order.
	 * @param namespace the namespace to list
	 * @return an immutable copy of the enabled capabilities
	 */
	public List<CapabilitySpecification> listEnabled(CapabilityNamespace namespace) {
		Assert.notNull(namespace, "namespace must not be null");
		this.lock.readLock().lock();
		try {
			Set<String> off = this.disabled.get(namespace);
			return this.tables.get(namespace)
				.values()
				.stream()
				.filter(entry -> !off.contains(entry.name()))
				.toList();
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

	public Optional<AsyncToolSpecification> getTool(String name) {
		return get(CapabilityNamespace.TOOLS, name).map(AsyncToolSpecification.class::cast);
	}

	public Optional<AsyncResourceSpecification> getResource(String uri) {
		return get(CapabilityNamespace.RESOURCES, uri).map(AsyncResourceSpecification.class::cast);
	}

	public Optional<AsyncPromptSpecification> getPrompt(String name) {
		return get(CapabilityNamespace.PROMPTS, name).map(AsyncPromptSpecification.class::cast);
	}

	public List<AsyncToolSpecification> listTools() {
		return typed(CapabilityNamespace.TOOLS, AsyncToolSpecification.class);
	}

	public List<AsyncToolSpecification> listEnabledTools() {
		return listEnabled(CapabilityNamespace.TOOLS).stream().map(AsyncToolSpecification.class::cast).toList();
	}

	public List<AsyncResourceSpecification> listResources() {
		return typed(CapabilityNamespace.RESOURCES, AsyncResourceSpecification.class);
	}

	public List<AsyncPromptSpecification> listPrompts() {
		return typed(CapabilityNamespace.PROMPTS, AsyncPromptSpecification.class);
	}

	private <T extends CapabilitySpecification> List<T> typed(CapabilityNamespace namespace, Class<T> type) {
		List<CapabilitySpecification> entries = list(namespace);
		List<T> result = new ArrayList<>(entries.size());
		for (CapabilitySpecification entry : entries) {
			result.add(type.cast(entry));
		}
		return result;
	}

}
