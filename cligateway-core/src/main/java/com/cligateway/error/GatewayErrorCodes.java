/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.error;

/**
 * JSON-RPC 2.0 error codes returned by the gateway.
 *
 * <p>
 * Protocol errors (malformed envelope, unknown tool) and execution errors (plugin
 * failure, timeout, crash) are both reported through these codes inside the JSON-RPC
 * {@code error} member; the HTTP status stays 200.
 * </p>
 */
public final class GatewayErrorCodes {

	private GatewayErrorCodes() {
	}

	/** Invalid JSON was received. */
	public static final int PARSE_ERROR = -32700;

	/** The JSON sent is not a valid request envelope. */
	public static final int INVALID_REQUEST = -32600;

	/** The requested tool does not exist in the current manifest. */
	public static final int METHOD_NOT_FOUND = -32601;

	/** Malformed {@code params} for the requested method. */
	public static final int INVALID_PARAMS = -32602;

	/** Plugin-reported failure or execution failure. */
	public static final int INTERNAL_ERROR = -32603;

	/**
	 * Returns a human-readable description for an error code.
	 * @param code the JSON-RPC error code
	 * @return the description, or "Unknown error" for unrecognized codes
	 */
	public static String getDescription(int code) {
		return switch (code) {
			case PARSE_ERROR -> "Parse error";
			case INVALID_REQUEST -> "Invalid Request";
			case METHOD_NOT_FOUND -> "Method not found";
			case INVALID_PARAMS -> "Invalid params";
			case INTERNAL_ERROR -> "Internal error";
			default -> "Unknown error";
		};
	}

}
