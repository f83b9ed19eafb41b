/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import com.cligateway.dispatch.ToolDispatcher;
import com.cligateway.manifest.Manifest;
import com.cligateway.manifest.ToolManifestBuilder;
import com.cligateway.plugin.HelpOutputIntrospector;
import com.cligateway.plugin.PluginIntrospector;
import com.cligateway.plugin.PluginLocator;
import com.cligateway.plugin.PluginRegistry;
import com.cligateway.plugin.RegistrySnapshot;
import com.cligateway.process.PluginProcessRunner;
import com.cligateway.process.ProcessInvocation;
import com.cligateway.session.SessionHandle;
import com.cligateway.session.SessionManager;
import com.cligateway.spec.GatewaySchema;
import com.cligateway.spec.GatewaySchema.JSONRPCMessage;
import com.cligateway.spec.GatewaySchema.JSONRPCNotification;
import com.cligateway.spec.GatewaySchema.JSONRPCResponse;
import com.cligateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Entry point of the gateway. Composes the plugin registry, the session manager and the
 * tool dispatcher behind the two operations an HTTP transport needs:
 * {@link #onStreamConnect()} for {@code GET /sse} and {@link #onMessage(String)} for
 * {@code POST /message}.
 *
 * <p>
 * Example usage:
 * </p>
 * <pre>{@code
 * PluginGateway gateway = PluginGateway.builder(Path.of("plugins"))
 *     .executionTimeout(Duration.ofSeconds(30))
 *     .build();
 * gateway.start().block();
 *
 * SessionHandle session = gateway.onStreamConnect();
 * session.events().subscribe(event -> send(event));
 *
 * JSONRPCResponse response = gateway.onMessage(requestBody).block();
 * }</pre>
 *
 * <p>
 * The gateway owns the registry lifecycle (initial scan on {@link #start()}, rebuild on
 * {@link #rescan()}) and the session reap loop (started on {@link #start()}, stopped on
 * {@link #closeGracefully()}).
 * </p>
 */
public class PluginGateway implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(PluginGateway.class);

	private final Path pluginsDirectory;

	private final PluginRegistry registry;

	private final ToolManifestBuilder manifestBuilder = new ToolManifestBuilder();

	private final AtomicReference<CachedManifest> manifestCache = new AtomicReference<>();

	private final SessionManager sessionManager;

	private final ToolDispatcher dispatcher;

	private final PluginProcessRunner processRunner;

	private final AtomicBoolean started = new AtomicBoolean(false);

	private final AtomicBoolean closed = new AtomicBoolean(false);

	private PluginGateway(Builder builder) {
		this.pluginsDirectory = builder.pluginsDirectory;
		this.processRunner = new PluginProcessRunner();
		PluginIntrospector introspector = builder.introspector != null ? builder.introspector
				: HelpOutputIntrospector.builder()
					.processRunner(this.processRunner)
					.helpTimeout(builder.introspectionTimeout)
					.build();
		this.registry = new PluginRegistry(builder.locator, introspector);
		McpJsonMapper jsonMapper = builder.jsonMapper != null ? builder.jsonMapper : McpJsonMapper.getDefault();
		this.sessionManager = new SessionManager(this::manifestNotification, builder.reapInterval,
				builder.sessionBufferSize);
		this.dispatcher = new ToolDispatcher(this.registry, this::currentManifest, this.processRunner, jsonMapper,
				builder.executionTimeout, builder.outputByteLimit);
	}

	public static Builder builder(Path pluginsDirectory) {
		return new Builder(pluginsDirectory);
	}

	/**
	 * Performs the initial plugin scan and starts the session reap loop.
	 * @return completes once the registry is populated
	 */
	public Mono<Void> start() {
		return Mono.fromRunnable(() -> {
			if (this.closed.get()) {
				throw new IllegalStateException("Gateway is closed");
			}
			if (!this.started.compareAndSet(false, true)) {
				throw new IllegalStateException("Gateway already started");
			}
			this.registry.scan(this.pluginsDirectory);
			this.sessionManager.start();
			logger.info("Gateway started with {} plugin(s) from {}", this.registry.count(), this.pluginsDirectory);
		});
	}

	/**
	 * Rebuilds the registry from the plugins directory and pushes the new manifest to
	 * every live session as a {@code notifications/tools/list_changed} event.
	 * @return the new manifest
	 */
	public Mono<Manifest> rescan() {
		return Mono.fromCallable(() -> {
			this.registry.scan(this.pluginsDirectory);
			Manifest manifest = currentManifest();
			int delivered = this.sessionManager.broadcast(new JSONRPCNotification(
					GatewaySchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED,
					new GatewaySchema.ToolsManifest(null, manifest.tools())));
			logger.info("Rescan published {} tool(s) to {} session(s)", manifest.size(), delivered);
			return manifest;
		});
	}

	public HealthStatus health() {
		return HealthStatus.ok(this.registry.count(), this.sessionManager.liveCount());
	}

	/**
	 * Opens a session for a new streaming connection. The first event of the returned
	 * handle is the manifest current at this moment.
	 */
	public SessionHandle onStreamConnect() {
		return this.sessionManager.open();
	}

	/**
	 * Handles a posted message body. Always completes with exactly one response.
	 */
	public Mono<JSONRPCResponse> onMessage(String body) {
		return this.dispatcher.dispatch(body);
	}

	public Mono<JSONRPCResponse> onMessage(JSONRPCMessage message) {
		return this.dispatcher.dispatch(message);
	}

	/**
	 * @return the manifest derived from the current registry snapshot
	 */
	public Manifest currentManifest() {
		RegistrySnapshot snapshot = this.registry.snapshot();
		CachedManifest cached = this.manifestCache.get();
		if (cached != null && cached.snapshot() == snapshot) {
			return cached.manifest();
		}
		Manifest manifest = this.manifestBuilder.build(snapshot);
		this.manifestCache.set(new CachedManifest(snapshot, manifest));
		return manifest;
	}

	public SessionManager sessions() {
		return this.sessionManager;
	}

	public PluginRegistry registry() {
		return this.registry;
	}

	private JSONRPCMessage manifestNotification(String sessionId) {
		return new JSONRPCNotification(GatewaySchema.METHOD_NOTIFICATION_TOOLS_MANIFEST,
				new GatewaySchema.ToolsManifest(sessionId, currentManifest().tools()));
	}

	/**
	 * Stops the reap loop, closes every session and releases the worker threads.
	 */
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			if (!this.closed.compareAndSet(false, true)) {
				return;
			}
			this.sessionManager.dispose();
			this.dispatcher.close();
			this.processRunner.close();
			logger.info("Gateway closed");
		});
	}

	@Override
	public void close() {
		closeGracefully().block();
	}

	private record CachedManifest(RegistrySnapshot snapshot, Manifest manifest) {
	}

	/**
	 * Builder for {@link PluginGateway}.
	 */
	public static final class Builder {

		private final Path pluginsDirectory;

		private PluginLocator locator = PluginLocator.defaults();

		private PluginIntrospector introspector;

		private Duration executionTimeout = ProcessInvocation.DEFAULT_TIMEOUT;

		private Duration introspectionTimeout = HelpOutputIntrospector.DEFAULT_TIMEOUT;

		private Duration reapInterval = SessionManager.DEFAULT_REAP_INTERVAL;

		private int sessionBufferSize = SessionManager.DEFAULT_BUFFER_SIZE;

		private long outputByteLimit = ProcessInvocation.DEFAULT_OUTPUT_BYTE_LIMIT;

		private McpJsonMapper jsonMapper;

		private Builder(Path pluginsDirectory) {
			Assert.notNull(pluginsDirectory, "Plugins directory must not be null");
			this.pluginsDirectory = pluginsDirectory;
		}

		/**
		 * Sets how candidate plugins are found in the plugins directory.
		 * @param locator The plugin locator
		 * @return This builder for chaining
		 */
		public Builder locator(PluginLocator locator) {
			Assert.notNull(locator, "Locator must not be null");
			this.locator = locator;
			return this;
		}

		/**
		 * Replaces the default help-output introspector. When set,
		 * {@link #introspectionTimeout(Duration)} is ignored.
		 * @param introspector The introspector
		 * @return This builder for chaining
		 */
		public Builder introspector(PluginIntrospector introspector) {
			this.introspector = introspector;
			return this;
		}

		/**
		 * Sets the limit after which a tool call's process is killed.
		 * @param timeout The execution timeout
		 * @return This builder for chaining
		 */
		public Builder executionTimeout(Duration timeout) {
			Assert.notNull(timeout, "Timeout must not be null");
			Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "Timeout must be positive");
			this.executionTimeout = timeout;
			return this;
		}

		public Builder introspectionTimeout(Duration timeout) {
			Assert.notNull(timeout, "Timeout must not be null");
			Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "Timeout must be positive");
			this.introspectionTimeout = timeout;
			return this;
		}

		public Builder reapInterval(Duration interval) {
			Assert.notNull(interval, "Interval must not be null");
			Assert.isTrue(!interval.isNegative() && !interval.isZero(), "Interval must be positive");
			this.reapInterval = interval;
			return this;
		}

		public Builder sessionBufferSize(int bufferSize) {
			Assert.isTrue(bufferSize > 0, "Buffer size must be positive");
			this.sessionBufferSize = bufferSize;
			return this;
		}

		public Builder outputByteLimit(long limit) {
			Assert.isTrue(limit > 0, "Output byte limit must be positive");
			this.outputByteLimit = limit;
			return this;
		}

		/**
		 * Sets the JSON mapper. Defaults to {@link McpJsonMapper#getDefault()}.
		 * @param jsonMapper The JsonMapper to use
		 * @return This builder for chaining
		 */
		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			this.jsonMapper = jsonMapper;
			return this;
		}

		public PluginGateway build() {
			return new PluginGateway(this);
		}

	}

}
