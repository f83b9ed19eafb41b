/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.error;

/**
 * Raised when a plugin process cannot be started or awaited. The dispatcher reports it
 * as {@link GatewayErrorCodes#INTERNAL_ERROR} for the affected call only.
 */
public class PluginExecutionException extends GatewayException {

	public PluginExecutionException(String message) {
		super(message);
	}

	public PluginExecutionException(String message, Throwable cause) {
		super(message, cause);
	}

}
