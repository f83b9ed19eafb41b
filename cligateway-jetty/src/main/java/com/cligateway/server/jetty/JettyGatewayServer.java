/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.server.jetty;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import com.cligateway.PluginGateway;
import com.cligateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Embedded Jetty server exposing a {@link PluginGateway} over HTTP.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>{@code GET /health}: plugin and live session counts</li>
 * <li>{@code GET /sse}: opens a session and streams its events as Server-Sent Events,
 * starting with the tool manifest</li>
 * <li>{@code POST /message}: a JSON-RPC request; answered with status 200 even for
 * protocol errors</li>
 * </ul>
 *
 * <p>
 * The server runs on daemon threads. Its lifecycle is independent of the gateway's:
 * start the gateway first and close it after stopping the server.
 * </p>
 */
public class JettyGatewayServer {

	private static final Logger logger = LoggerFactory.getLogger(JettyGatewayServer.class);

	public static final int DEFAULT_PORT = 8080;

	public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofMillis(500);

	private final PluginGateway gateway;

	private final int port;

	private final Duration heartbeatInterval;

	private final McpJsonMapper jsonMapper;

	private final AtomicBoolean isStarted = new AtomicBoolean(false);

	private final Scheduler heartbeatScheduler;

	private final Scheduler streamScheduler;

	private Server server;

	private ServerConnector connector;

	private JettyGatewayServer(Builder builder) {
		this.gateway = builder.gateway;
		this.port = builder.port;
		this.heartbeatInterval = builder.heartbeatInterval;
		this.jsonMapper = builder.jsonMapper != null ? builder.jsonMapper : McpJsonMapper.getDefault();
		AtomicInteger heartbeatThreads = new AtomicInteger();
		this.heartbeatScheduler = Schedulers.fromExecutorService(Executors.newScheduledThreadPool(1, r -> {
			Thread t = new Thread(r, "cligateway-sse-" + heartbeatThreads.incrementAndGet());
			t.setDaemon(true);
			return t;
		}), "cligateway-sse");
		AtomicInteger streamThreads = new AtomicInteger();
		this.streamScheduler = Schedulers.fromExecutorService(Executors.newCachedThreadPool(r -> {
			Thread t = new Thread(r, "cligateway-stream-" + streamThreads.incrementAndGet());
			t.setDaemon(true);
			return t;
		}), "cligateway-stream");
	}

	public static Builder builder(PluginGateway gateway) {
		return new Builder(gateway);
	}

	/**
	 * Starts listening.
	 * @return completes once the connector is bound
	 */
	public Mono<Void> start() {
		if (!this.isStarted.compareAndSet(false, true)) {
			return Mono.error(new IllegalStateException("Already started"));
		}
		return Mono.fromCallable(() -> {
			QueuedThreadPool threadPool = new QueuedThreadPool();
			threadPool.setName("cligateway-http");
			threadPool.setDaemon(true);

			this.server = new Server(threadPool);
			this.connector = new ServerConnector(this.server);
			this.connector.setPort(this.port);
			this.server.addConnector(this.connector);
			this.server.setHandler(new GatewayRequestHandler(this.gateway, this.jsonMapper, this.heartbeatInterval,
					this.heartbeatScheduler, this.streamScheduler));
			this.server.start();

			logger.info("Gateway HTTP server listening on port {}", getPort());
			return null;
		}).then();
	}

	/**
	 * Stops the server. Open event streams are cut off.
	 */
	public Mono<Void> stop() {
		return Mono.fromRunnable(() -> {
			if (this.server != null) {
				try {
					this.server.stop();
				}
				catch (Exception e) {
					logger.warn("Error stopping HTTP server", e);
				}
			}
			this.heartbeatScheduler.dispose();
			this.streamScheduler.dispose();
			logger.info("Gateway HTTP server stopped");
		});
	}

	/**
	 * @return the bound port once started, otherwise the configured one (0 means an
	 * ephemeral port is chosen at start)
	 */
	public int getPort() {
		ServerConnector bound = this.connector;
		return bound != null && bound.getLocalPort() > 0 ? bound.getLocalPort() : this.port;
	}

	/**
	 * Builder for {@link JettyGatewayServer}.
	 */
	public static final class Builder {

		private final PluginGateway gateway;

		private int port = DEFAULT_PORT;

		private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;

		private McpJsonMapper jsonMapper;

		private Builder(PluginGateway gateway) {
			Assert.notNull(gateway, "Gateway must not be null");
			this.gateway = gateway;
		}

		/**
		 * Sets the port to listen on; 0 picks an ephemeral port.
		 * @param port The port
		 * @return This builder for chaining
		 */
		public Builder port(int port) {
			Assert.isTrue(port >= 0 && port <= 65535, "Port must be between 0 and 65535");
			this.port = port;
			return this;
		}

		/**
		 * Sets how often an idle event stream carries a keepalive comment.
		 * @param interval The heartbeat interval
		 * @return This builder for chaining
		 */
		public Builder heartbeatInterval(Duration interval) {
			Assert.notNull(interval, "Heartbeat interval must not be null");
			Assert.isTrue(!interval.isNegative() && !interval.isZero(), "Heartbeat interval must be positive");
			this.heartbeatInterval = interval;
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			this.jsonMapper = jsonMapper;
			return this;
		}

		public JettyGatewayServer build() {
			return new JettyGatewayServer(this);
		}

	}

}
