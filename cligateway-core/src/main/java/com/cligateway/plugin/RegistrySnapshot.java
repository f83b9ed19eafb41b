/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.cligateway.util.Assert;

/**
 * Immutable result of one registry scan. A qualified tool name resolves to exactly one
 * (plugin, command) pair for the lifetime of the snapshot.
 */
public final class RegistrySnapshot {

	private static final RegistrySnapshot EMPTY = new RegistrySnapshot(List.of(), Instant.EPOCH);

	private final List<Plugin> plugins;

	private final Map<String, ToolBinding> bindings;

	private final Instant scannedAt;

	private RegistrySnapshot(List<Plugin> plugins, Instant scannedAt) {
		this.plugins = List.copyOf(plugins);
		this.scannedAt = scannedAt;
		Map<String, ToolBinding> byName = new LinkedHashMap<>();
		Set<String> pluginNames = new HashSet<>();
		for (Plugin plugin : this.plugins) {
			if (!pluginNames.add(plugin.name())) {
				throw new IllegalArgumentException("Duplicate plugin name: " + plugin.name());
			}
			for (Command command : plugin.commands()) {
				ToolBinding binding = new ToolBinding(plugin, command);
				if (byName.putIfAbsent(binding.qualifiedName(), binding) != null) {
					throw new IllegalArgumentException("Duplicate tool name: " + binding.qualifiedName());
				}
			}
		}
		this.bindings = Collections.unmodifiableMap(byName);
	}

	public static RegistrySnapshot empty() {
		return EMPTY;
	}

	/**
	 * @param plugins plugins whose names are pairwise distinct
	 * @return a new snapshot stamped with the current time
	 * @throws IllegalArgumentException if two plugins share a name
	 */
	public static RegistrySnapshot of(List<Plugin> plugins) {
		Assert.notNull(plugins, "Plugins must not be null");
		return new RegistrySnapshot(plugins, Instant.now());
	}

	public List<Plugin> plugins() {
		return this.plugins;
	}

	public Optional<ToolBinding> lookup(String qualifiedName) {
		return Optional.ofNullable(this.bindings.get(qualifiedName));
	}

	public Map<String, ToolBinding> bindings() {
		return this.bindings;
	}

	public int pluginCount() {
		return this.plugins.size();
	}

	public Instant scannedAt() {
		return this.scannedAt;
	}

}
