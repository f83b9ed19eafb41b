/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.session;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import com.cligateway.spec.GatewaySchema.JSONRPCMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Server-side state of one streaming connection: identity, lifecycle state and a bounded
 * event channel.
 *
 * <p>
 * Events emitted before the transport subscribes are buffered, so the manifest pushed at
 * open time is always the first event the client reads. Emission and completion are
 * serialized on the session itself; the channel is a unicast sink and accepts a single
 * producer at a time.
 * </p>
 */
final class GatewaySession {

	private static final Logger logger = LoggerFactory.getLogger(GatewaySession.class);

	private final String id;

	private final Instant createdAt;

	private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.ACTIVE);

	private final Sinks.Many<JSONRPCMessage> sink;

	GatewaySession(String id, int bufferSize) {
		this.id = id;
		this.createdAt = Instant.now();
		this.sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<JSONRPCMessage>get(bufferSize).get());
	}

	String id() {
		return this.id;
	}

	Instant createdAt() {
		return this.createdAt;
	}

	SessionState state() {
		return this.state.get();
	}

	/**
	 * Offers an event to the channel. A rejected emission (buffer overflow, cancelled or
	 * terminated channel) moves the session to {@link SessionState#CLOSING}.
	 * @return true if the event was accepted
	 */
	synchronized boolean emit(JSONRPCMessage event) {
		if (this.state.get() != SessionState.ACTIVE) {
			return false;
		}
		Sinks.EmitResult result = this.sink.tryEmitNext(event);
		if (result.isFailure()) {
			logger.warn("Push to session {} failed ({}), closing session", this.id, result);
			markClosing();
			return false;
		}
		return true;
	}

	/**
	 * The event stream handed to the transport. Cancelling it, or an error on it, is
	 * treated as a disconnect.
	 */
	Flux<JSONRPCMessage> events() {
		return this.sink.asFlux().doOnCancel(this::markClosing).doOnError(e -> markClosing());
	}

	boolean markClosing() {
		boolean changed = this.state.compareAndSet(SessionState.ACTIVE, SessionState.CLOSING);
		if (changed) {
			logger.debug("Session {} is closing", this.id);
		}
		return changed;
	}

	/**
	 * Moves the session to its terminal state and completes the channel.
	 */
	synchronized void markClosed() {
		SessionState previous = this.state.getAndSet(SessionState.CLOSED);
		if (previous != SessionState.CLOSED) {
			this.sink.tryEmitComplete();
		}
	}

}
