/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.error;

import com.cligateway.spec.GatewaySchema;

/**
 * A failure that is reported to the caller as a JSON-RPC error object.
 */
public class GatewayProtocolException extends GatewayException {

	private final int code;

	private final String errorMessage;

	private final Object data;

	public GatewayProtocolException(GatewaySchema.JSONRPCError error) {
		this(error.code(), error.message(), error.data());
	}

	public GatewayProtocolException(int code, String message) {
		this(code, message, null);
	}

	public GatewayProtocolException(int code, String message, Object data) {
		super("JSON-RPC error " + code + ": " + message);
		this.code = code;
		this.errorMessage = message;
		this.data = data;
	}

	public int getCode() {
		return this.code;
	}

	public Object getData() {
		return this.data;
	}

	/**
	 * Converts this exception into the error member of a JSON-RPC response. The message
	 * is passed through without the code prefix used by {@link #getMessage()}.
	 * @return the JSON-RPC error
	 */
	public GatewaySchema.JSONRPCError toJsonRpcError() {
		return new GatewaySchema.JSONRPCError(this.code, this.errorMessage, this.data);
	}

	public boolean isInvalidRequest() {
		return this.code == GatewayErrorCodes.INVALID_REQUEST;
	}

	public boolean isMethodNotFound() {
		return this.code == GatewayErrorCodes.METHOD_NOT_FOUND;
	}

	public boolean isInvalidParams() {
		return this.code == GatewayErrorCodes.INVALID_PARAMS;
	}

	public boolean isInternalError() {
		return this.code == GatewayErrorCodes.INTERNAL_ERROR;
	}

}
