/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.session;

import com.cligateway.spec.GatewaySchema.JSONRPCMessage;
import reactor.core.publisher.Flux;

/**
 * What the transport gets back when a stream connects: the session id to hand to the
 * client and the session's event stream. The transport never sees the session itself.
 */
public final class SessionHandle {

	private final GatewaySession session;

	private final SessionManager manager;

	SessionHandle(GatewaySession session, SessionManager manager) {
		this.session = session;
		this.manager = manager;
	}

	public String sessionId() {
		return this.session.id();
	}

	/**
	 * @return the session's events, starting with the manifest; completes once the
	 * session is closed. Can be subscribed to only once.
	 */
	public Flux<JSONRPCMessage> events() {
		return this.session.events();
	}

	public SessionState state() {
		return this.session.state();
	}

	/**
	 * Signals that the client closed the stream.
	 */
	public void close() {
		this.manager.close(sessionId());
	}

}
