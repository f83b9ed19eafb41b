/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.error;

/**
 * Base class of all exceptions raised by the gateway.
 */
public class GatewayException extends RuntimeException {

	public GatewayException(String message) {
		super(message);
	}

	public GatewayException(String message, Throwable cause) {
		super(message, cause);
	}

}
