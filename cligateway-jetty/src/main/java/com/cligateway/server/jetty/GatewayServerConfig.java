/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.server.jetty;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Settings of the standalone gateway server.
 *
 * <p>
 * Values are resolved per key, later sources overriding earlier ones:
 * {@code cligateway.properties} on the classpath, system properties prefixed with
 * {@code cligateway.}, then environment variables prefixed with {@code CLIGATEWAY_}
 * ({@code plugins.dir} becomes {@code CLIGATEWAY_PLUGINS_DIR}).
 * </p>
 *
 * @param port HTTP port
 * @param pluginsDirectory Directory scanned for plugins
 * @param executionTimeout Limit for one tool call
 * @param introspectionTimeout Limit for one help invocation during discovery
 * @param heartbeatInterval Keepalive interval of event streams
 * @param reapInterval Interval of the session reap loop
 */
public record GatewayServerConfig(
		int port,
		Path pluginsDirectory,
		Duration executionTimeout,
		Duration introspectionTimeout,
		Duration heartbeatInterval,
		Duration reapInterval
) {

	public static final String RESOURCE_NAME = "cligateway.properties";

	static final String PREFIX = "cligateway.";

	static final String ENV_PREFIX = "CLIGATEWAY_";

	static final String PORT = "port";

	static final String PLUGINS_DIR = "plugins.dir";

	static final String EXECUTION_TIMEOUT = "execution.timeout";

	static final String INTROSPECTION_TIMEOUT = "introspection.timeout";

	static final String HEARTBEAT_INTERVAL = "heartbeat.interval";

	static final String REAP_INTERVAL = "reap.interval";

	/**
	 * Loads the configuration from the classpath resource, system properties and the
	 * environment.
	 */
	public static GatewayServerConfig load() {
		Properties resource = new Properties();
		try (InputStream in = GatewayServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
			if (in != null) {
				resource.load(in);
			}
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to read " + RESOURCE_NAME, e);
		}
		return from(resource, System.getProperties(), System.getenv());
	}

	/**
	 * @param defaults un-prefixed keys, as read from {@code cligateway.properties}
	 * @param systemProperties properties whose {@code cligateway.} keys override the
	 * defaults
	 * @param environment variables whose {@code CLIGATEWAY_} keys override both
	 */
	public static GatewayServerConfig from(Properties defaults, Properties systemProperties,
			Map<String, String> environment) {
		Resolver resolver = new Resolver(defaults, systemProperties, environment);
		return new GatewayServerConfig(
				resolver.integer(PORT, JettyGatewayServer.DEFAULT_PORT),
				Path.of(resolver.string(PLUGINS_DIR, "./plugins")),
				Duration.ofSeconds(resolver.integer(EXECUTION_TIMEOUT, 30)),
				Duration.ofSeconds(resolver.integer(INTROSPECTION_TIMEOUT, 10)),
				Duration.ofMillis(resolver.integer(HEARTBEAT_INTERVAL, 500)),
				Duration.ofMillis(resolver.integer(REAP_INTERVAL, 100)));
	}

	private record Resolver(Properties defaults, Properties systemProperties, Map<String, String> environment) {

		String string(String key, String fallback) {
			String envValue = this.environment.get(ENV_PREFIX + key.replace('.', '_').toUpperCase(Locale.ROOT));
			if (envValue != null && !envValue.isBlank()) {
				return envValue.trim();
			}
			String systemValue = this.systemProperties.getProperty(PREFIX + key);
			if (systemValue != null && !systemValue.isBlank()) {
				return systemValue.trim();
			}
			String defaultValue = this.defaults.getProperty(key);
			return defaultValue != null && !defaultValue.isBlank() ? defaultValue.trim() : fallback;
		}

		int integer(String key, int fallback) {
			String value = string(key, null);
			if (value == null) {
				return fallback;
			}
			try {
				return Integer.parseInt(value);
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException("Configuration key '" + key + "' must be an integer: " + value, e);
			}
		}

	}

}
