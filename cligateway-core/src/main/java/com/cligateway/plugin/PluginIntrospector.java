/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

import com.cligateway.error.IntrospectionException;

/**
 * Discovers the commands and parameters a plugin executable declares, without running
 * any of its business commands.
 */
@FunctionalInterface
public interface PluginIntrospector {

	/**
	 * Introspects one plugin.
	 * @param candidate the located plugin entry point
	 * @return the plugin with its declared commands
	 * @throws IntrospectionException if the executable is missing, cannot be run, or its
	 * declared surface cannot be parsed
	 */
	Plugin introspect(PluginLocator.Candidate candidate) throws IntrospectionException;

}
