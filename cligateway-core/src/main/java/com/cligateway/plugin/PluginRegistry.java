/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import com.cligateway.error.GatewayException;
import com.cligateway.error.IntrospectionException;
import com.cligateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the set of introspected plugins.
 *
 * <p>
 * A scan introspects every candidate of the plugins directory and publishes the outcome
 * as a new {@link RegistrySnapshot} in a single reference swap. Readers always see a
 * complete snapshot, and lookups never wait for a scan in progress. Scans themselves are
 * serialized.
 * </p>
 *
 * <p>
 * One bad plugin never fails a scan: introspection failures exclude that plugin, and a
 * plugin whose tool names are already taken by an earlier plugin is dropped.
 * </p>
 */
public class PluginRegistry {

	private static final Logger logger = LoggerFactory.getLogger(PluginRegistry.class);

	private final PluginLocator locator;

	private final PluginIntrospector introspector;

	private final AtomicReference<RegistrySnapshot> current = new AtomicReference<>(RegistrySnapshot.empty());

	private final ReentrantLock scanLock = new ReentrantLock();

	public PluginRegistry(PluginLocator locator, PluginIntrospector introspector) {
		Assert.notNull(locator, "Locator must not be null");
		Assert.notNull(introspector, "Introspector must not be null");
		this.locator = locator;
		this.introspector = introspector;
	}

	/**
	 * Rebuilds the registry from a plugins directory and publishes the result.
	 * @param directory the plugins directory; a missing directory yields an empty
	 * registry
	 * @return the published snapshot
	 * @throws GatewayException if the directory exists but cannot be listed
	 */
	public RegistrySnapshot scan(Path directory) {
		Assert.notNull(directory, "Plugins directory must not be null");
		this.scanLock.lock();
		try {
			RegistrySnapshot snapshot = RegistrySnapshot.of(discover(directory));
			this.current.set(snapshot);
			logger.info("Plugin scan of {} registered {} plugin(s) with {} tool(s)", directory,
					snapshot.pluginCount(), snapshot.bindings().size());
			return snapshot;
		}
		finally {
			this.scanLock.unlock();
		}
	}

	private List<Plugin> discover(Path directory) {
		if (!Files.isDirectory(directory)) {
			logger.warn("Plugins directory {} does not exist, no plugins registered", directory);
			return List.of();
		}

		List<PluginLocator.Candidate> candidates;
		try {
			candidates = this.locator.locate(directory);
		}
		catch (IOException e) {
			throw new GatewayException("Failed to list plugins directory " + directory, e);
		}

		List<Plugin> plugins = new ArrayList<>();
		Set<String> pluginNames = new HashSet<>();
		Set<String> toolNames = new HashSet<>();
		for (PluginLocator.Candidate candidate : candidates) {
			Plugin plugin;
			try {
				plugin = this.introspector.introspect(candidate);
			}
			catch (IntrospectionException e) {
				logger.warn("Excluding plugin '{}': {}", candidate.name(), e.getMessage());
				continue;
			}
			catch (RuntimeException e) {
				logger.warn("Excluding plugin '{}' after unexpected introspection failure", candidate.name(), e);
				continue;
			}

			if (pluginNames.contains(plugin.name())) {
				logger.warn("Dropping plugin '{}' at {}: a plugin with that name is already registered",
						plugin.name(), plugin.executablePath());
				continue;
			}
			List<String> names = plugin.commands().stream().map(plugin::qualifiedName).toList();
			List<String> taken = names.stream().filter(toolNames::contains).toList();
			if (!taken.isEmpty()) {
				logger.warn("Dropping plugin '{}' at {}: tool name(s) {} already registered", plugin.name(),
						plugin.executablePath(), taken);
				continue;
			}
			pluginNames.add(plugin.name());
			toolNames.addAll(names);
			plugins.add(plugin);
		}
		return plugins;
	}

	/**
	 * @return the snapshot published by the last scan
	 */
	public RegistrySnapshot snapshot() {
		return this.current.get();
	}

	public Optional<ToolBinding> lookup(String qualifiedName) {
		if (qualifiedName == null) {
			return Optional.empty();
		}
		return this.current.get().lookup(qualifiedName);
	}

	/**
	 * @return the number of plugins in the current snapshot
	 */
	public int count() {
		return this.current.get().pluginCount();
	}

}
