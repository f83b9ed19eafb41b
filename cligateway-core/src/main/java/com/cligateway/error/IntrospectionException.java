/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.error;

/**
 * Raised when a plugin cannot be introspected: the executable is missing or not
 * runnable, times out, or declares no parsable command surface. The registry excludes
 * the plugin and continues scanning.
 */
public class IntrospectionException extends GatewayException {

	private final String pluginName;

	public IntrospectionException(String pluginName, String message) {
		super(message);
		this.pluginName = pluginName;
	}

	public IntrospectionException(String pluginName, String message, Throwable cause) {
		super(message, cause);
		this.pluginName = pluginName;
	}

	public String getPluginName() {
		return this.pluginName;
	}

}
