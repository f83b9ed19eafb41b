/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.server.jetty;

import java.util.concurrent.CountDownLatch;

import com.cligateway.PluginGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standalone launcher: scans the plugins directory, then serves the gateway until the JVM
 * is asked to shut down.
 *
 * @see GatewayServerConfig
 */
public final class GatewayApplication {

	private static final Logger logger = LoggerFactory.getLogger(GatewayApplication.class);

	private GatewayApplication() {
	}

	public static void main(String[] args) throws InterruptedException {
		GatewayServerConfig config = GatewayServerConfig.load();
		logger.info("Starting gateway: plugins {}, port {}", config.pluginsDirectory().toAbsolutePath(),
				config.port());

		PluginGateway gateway = PluginGateway.builder(config.pluginsDirectory())
			.executionTimeout(config.executionTimeout())
			.introspectionTimeout(config.introspectionTimeout())
			.reapInterval(config.reapInterval())
			.build();
		gateway.start().block();

		JettyGatewayServer server = JettyGatewayServer.builder(gateway)
			.port(config.port())
			.heartbeatInterval(config.heartbeatInterval())
			.build();
		server.start().block();

		CountDownLatch stopped = new CountDownLatch(1);
		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			logger.info("Shutting down gateway");
			server.stop().block();
			gateway.close();
			stopped.countDown();
		}, "cligateway-shutdown"));
		stopped.await();
	}

}
