/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.server.jetty;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import com.cligateway.PluginGateway;
import com.cligateway.session.SessionHandle;
import com.cligateway.spec.GatewaySchema.JSONRPCMessage;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.io.Content;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.BufferUtil;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * Routes {@code /health}, {@code /sse} and {@code /message} to the gateway.
 *
 * <p>
 * An SSE response stays open for the lifetime of its session. Frames are written one at a
 * time, each write waiting for the previous one to complete; a failed write (the client
 * went away) closes the session. Heartbeat comments are interleaved so that a vanished
 * client is noticed even when no events flow.
 * </p>
 */
class GatewayRequestHandler extends Handler.Abstract {

	private static final Logger logger = LoggerFactory.getLogger(GatewayRequestHandler.class);

	static final String HEALTH_PATH = "/health";

	static final String SSE_PATH = "/sse";

	static final String MESSAGE_PATH = "/message";

	static final String KEEPALIVE_FRAME = ": keepalive\n\n";

	private static final String JSON_CONTENT_TYPE = "application/json";

	private static final String EVENT_STREAM_CONTENT_TYPE = "text/event-stream";

	private final PluginGateway gateway;

	private final McpJsonMapper jsonMapper;

	private final Duration heartbeatInterval;

	private final Scheduler heartbeatScheduler;

	private final Scheduler streamScheduler;

	GatewayRequestHandler(PluginGateway gateway, McpJsonMapper jsonMapper, Duration heartbeatInterval,
			Scheduler heartbeatScheduler, Scheduler streamScheduler) {
		this.gateway = gateway;
		this.jsonMapper = jsonMapper;
		this.heartbeatInterval = heartbeatInterval;
		this.heartbeatScheduler = heartbeatScheduler;
		this.streamScheduler = streamScheduler;
	}

	@Override
	public boolean handle(Request request, Response response, Callback callback) throws Exception {
		String path = Request.getPathInContext(request);
		String method = request.getMethod();
		switch (path) {
			case HEALTH_PATH:
				if (!HttpMethod.GET.is(method)) {
					return methodNotAllowed(request, response, callback, HttpMethod.GET);
				}
				writeJson(response, callback, toJson(this.gateway.health()));
				return true;
			case SSE_PATH:
				if (!HttpMethod.GET.is(method)) {
					return methodNotAllowed(request, response, callback, HttpMethod.GET);
				}
				stream(request, response, callback);
				return true;
			case MESSAGE_PATH:
				if (!HttpMethod.POST.is(method)) {
					return methodNotAllowed(request, response, callback, HttpMethod.POST);
				}
				message(request, response, callback);
				return true;
			default:
				Response.writeError(request, response, callback, HttpStatus.NOT_FOUND_404);
				return true;
		}
	}

	private void message(Request request, Response response, Callback callback) throws IOException {
		String body = Content.Source.asString(request);
		logger.debug("POST {} body: {}", MESSAGE_PATH, body);
		this.gateway.onMessage(body)
			.flatMap(reply -> Mono.fromCallable(() -> toJson(reply)))
			.subscribe(json -> writeJson(response, callback, json), error -> {
				logger.error("Failed to answer message", error);
				Response.writeError(request, response, callback, error);
			});
	}

	private void stream(Request request, Response response, Callback callback) {
		SessionHandle session = this.gateway.onStreamConnect();
		response.setStatus(HttpStatus.OK_200);
		response.getHeaders().put(HttpHeader.CONTENT_TYPE, EVENT_STREAM_CONTENT_TYPE);
		response.getHeaders().put(HttpHeader.CACHE_CONTROL, "no-cache");

		Sinks.One<Boolean> eventsDone = Sinks.one();
		Flux<String> events = session.events()
			.map(this::eventFrame)
			.doFinally(signal -> eventsDone.tryEmitValue(Boolean.TRUE));
		Flux<String> heartbeats = Flux.interval(this.heartbeatInterval, this.heartbeatInterval, this.heartbeatScheduler)
			.map(tick -> KEEPALIVE_FRAME)
			.takeUntilOther(eventsDone.asMono());

		Flux.merge(events, heartbeats)
			.publishOn(this.streamScheduler)
			.concatMap(frame -> write(response, frame), 1)
			.subscribe(null, error -> {
				logger.debug("Event stream of session {} ended: {}", session.sessionId(), error.toString());
				session.close();
				callback.failed(error);
			}, () -> response.write(true, BufferUtil.EMPTY_BUFFER, callback));
	}

	private String eventFrame(JSONRPCMessage event) {
		return "data: " + toJson(event) + "\n\n";
	}

	private static Mono<Void> write(Response response, String frame) {
		ByteBuffer buffer = ByteBuffer.wrap(frame.getBytes(StandardCharsets.UTF_8));
		return Mono.create(sink -> response.write(false, buffer, Callback.from(sink::success, sink::error)));
	}

	private static void writeJson(Response response, Callback callback, String json) {
		response.setStatus(HttpStatus.OK_200);
		response.getHeaders().put(HttpHeader.CONTENT_TYPE, JSON_CONTENT_TYPE);
		Content.Sink.write(response, true, json, callback);
	}

	private static boolean methodNotAllowed(Request request, Response response, Callback callback,
			HttpMethod allowed) {
		logger.debug("{} {} rejected, only {} is allowed", request.getMethod(), Request.getPathInContext(request),
				allowed);
		response.setStatus(HttpStatus.METHOD_NOT_ALLOWED_405);
		response.getHeaders().put(HttpHeader.ALLOW, allowed.asString());
		response.getHeaders().put(HttpHeader.CONTENT_TYPE, "text/plain");
		Content.Sink.write(response, true, "Method Not Allowed", callback);
		return true;
	}

	private String toJson(Object value) {
		try {
			return this.jsonMapper.writeValueAsString(value);
		}
		catch (Exception e) {
			throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
		}
	}

}
