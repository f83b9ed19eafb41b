/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import com.cligateway.spec.GatewaySchema.JSONRPCMessage;
import com.cligateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Keyed registry of live streaming sessions.
 *
 * <p>
 * Sessions are held in a {@link ConcurrentHashMap}; no lock is held while an event is
 * emitted, so a stalled client never stalls another session. Disconnected sessions move
 * to {@link SessionState#CLOSING} and are reclaimed by a reap loop that runs every
 * {@code reapInterval} on a daemon scheduler owned by this manager.
 * </p>
 */
public class SessionManager {

	private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

	public static final Duration DEFAULT_REAP_INTERVAL = Duration.ofMillis(100);

	public static final int DEFAULT_BUFFER_SIZE = 256;

	private final Function<String, JSONRPCMessage> firstEvent;

	private final Duration reapInterval;

	private final int bufferSize;

	private final Map<String, GatewaySession> sessions = new ConcurrentHashMap<>();

	private final Scheduler reaperScheduler;

	private volatile Disposable reaper;

	/**
	 * @param firstEvent produces the first event of a new session from its id; called at
	 * open time so it reflects the state current at connection
	 * @param reapInterval interval of the reap loop
	 * @param bufferSize per-session event buffer
	 */
	public SessionManager(Function<String, JSONRPCMessage> firstEvent, Duration reapInterval, int bufferSize) {
		Assert.notNull(firstEvent, "First event function must not be null");
		Assert.notNull(reapInterval, "Reap interval must not be null");
		Assert.isTrue(!reapInterval.isNegative() && !reapInterval.isZero(), "Reap interval must be positive");
		Assert.isTrue(bufferSize > 0, "Buffer size must be positive");
		this.firstEvent = firstEvent;
		this.reapInterval = reapInterval;
		this.bufferSize = bufferSize;
		AtomicInteger threadCount = new AtomicInteger();
		this.reaperScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "cligateway-reaper-" + threadCount.incrementAndGet());
			t.setDaemon(true);
			return t;
		}), "cligateway-reaper");
	}

	/**
	 * Opens a session. The first event is emitted before the session becomes visible to
	 * {@link #push} and {@link #broadcast}, so it always precedes every other event.
	 */
	public SessionHandle open() {
		GatewaySession session = new GatewaySession(UUID.randomUUID().toString(), this.bufferSize);
		session.emit(this.firstEvent.apply(session.id()));
		this.sessions.put(session.id(), session);
		logger.info("Opened session {} ({} live)", session.id(), this.sessions.size());
		return new SessionHandle(session, this);
	}

	/**
	 * Best-effort delivery to one session.
	 * @return false if the session is unknown or no longer active, or the push failed
	 */
	public boolean push(String sessionId, JSONRPCMessage event) {
		Assert.notNull(event, "Event must not be null");
		GatewaySession session = sessionId != null ? this.sessions.get(sessionId) : null;
		if (session == null) {
			logger.debug("Dropping push to unknown session {}", sessionId);
			return false;
		}
		return session.emit(event);
	}

	/**
	 * Pushes an event to every active session.
	 * @return the number of sessions that accepted it
	 */
	public int broadcast(JSONRPCMessage event) {
		Assert.notNull(event, "Event must not be null");
		int delivered = 0;
		for (GatewaySession session : this.sessions.values()) {
			if (session.emit(event)) {
				delivered++;
			}
		}
		return delivered;
	}

	/**
	 * Marks a session as closing; the reap loop reclaims it.
	 */
	public void close(String sessionId) {
		GatewaySession session = sessionId != null ? this.sessions.get(sessionId) : null;
		if (session != null && session.markClosing()) {
			logger.debug("Session {} closed by client", sessionId);
		}
	}

	/**
	 * @return the number of sessions not yet closed
	 */
	public int liveCount() {
		return this.sessions.size();
	}

	public SessionState state(String sessionId) {
		GatewaySession session = this.sessions.get(sessionId);
		return session != null ? session.state() : SessionState.CLOSED;
	}

	/**
	 * Starts the reap loop. Calling it again while running has no effect.
	 */
	public synchronized void start() {
		if (this.reaper != null && !this.reaper.isDisposed()) {
			return;
		}
		this.reaper = Flux.interval(this.reapInterval, this.reaperScheduler)
			.subscribe(tick -> reap(), error -> logger.error("Session reap loop failed", error));
		logger.debug("Session reap loop started, interval {} ms", this.reapInterval.toMillis());
	}

	/**
	 * Reclaims every closing session.
	 * @return the number of sessions reclaimed
	 */
	public int reap() {
		List<GatewaySession> closing = new ArrayList<>();
		for (GatewaySession session : this.sessions.values()) {
			if (session.state() == SessionState.CLOSING) {
				closing.add(session);
			}
		}
		for (GatewaySession session : closing) {
			if (this.sessions.remove(session.id(), session)) {
				session.markClosed();
				logger.info("Reclaimed session {} ({} live)", session.id(), this.sessions.size());
			}
		}
		return closing.size();
	}

	/**
	 * Stops the reap loop and closes every live session.
	 */
	public synchronized void stop() {
		if (this.reaper != null) {
			this.reaper.dispose();
			this.reaper = null;
		}
		for (GatewaySession session : new ArrayList<>(this.sessions.values())) {
			this.sessions.remove(session.id(), session);
			session.markClosed();
		}
		logger.debug("Session manager stopped");
	}

	/**
	 * Stops the manager and releases the reaper thread.
	 */
	public void dispose() {
		stop();
		this.reaperScheduler.dispose();
	}

}
