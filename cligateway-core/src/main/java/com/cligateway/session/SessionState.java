/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.session;

/**
 * Lifecycle of a streaming session. Transitions only move forward:
 * {@code ACTIVE -> CLOSING -> CLOSED}.
 */
public enum SessionState {

	/** Receiving the manifest and subsequent events. */
	ACTIVE,

	/** A write failed or the client went away; no further pushes are attempted. */
	CLOSING,

	/** Terminal. The session has been removed from the live set. */
	CLOSED

}
