/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.dispatch;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import com.cligateway.error.GatewayErrorCodes;
import com.cligateway.error.GatewayProtocolException;
import com.cligateway.manifest.Manifest;
import com.cligateway.plugin.PluginRegistry;
import com.cligateway.plugin.ToolBinding;
import com.cligateway.process.PluginProcessRunner;
import com.cligateway.process.ProcessInvocation;
import com.cligateway.spec.GatewaySchema;
import com.cligateway.spec.GatewaySchema.JSONRPCMessage;
import com.cligateway.spec.GatewaySchema.JSONRPCRequest;
import com.cligateway.spec.GatewaySchema.JSONRPCResponse;
import com.cligateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Resolves JSON-RPC requests against the plugin registry and runs the matching plugin
 * command as a subprocess.
 *
 * <p>
 * Every request yields exactly one response. Protocol errors, execution failures and
 * unexpected exceptions are all turned into JSON-RPC error responses; nothing is
 * propagated to the caller as an error signal.
 * </p>
 *
 * <p>
 * Subprocesses run on a daemon cached pool owned by the dispatcher, one thread per
 * in-flight call, so concurrent calls to the same tool run in parallel.
 * </p>
 */
public class ToolDispatcher implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ToolDispatcher.class);

	private final PluginRegistry registry;

	private final Supplier<Manifest> manifest;

	private final PluginProcessRunner processRunner;

	private final McpJsonMapper jsonMapper;

	private final ArgumentTranslator argumentTranslator;

	private final PluginOutputMapper outputMapper;

	private final Duration executionTimeout;

	private final long outputByteLimit;

	private final Scheduler dispatchScheduler;

	/**
	 * @param registry resolves tool names
	 * @param manifest the current manifest, served by {@code tools/list}
	 * @param processRunner runs plugin processes
	 * @param jsonMapper reads request bodies and plugin output
	 * @param executionTimeout limit after which a plugin process is killed
	 * @param outputByteLimit bytes captured per output stream
	 */
	public ToolDispatcher(PluginRegistry registry, Supplier<Manifest> manifest, PluginProcessRunner processRunner,
			McpJsonMapper jsonMapper, Duration executionTimeout, long outputByteLimit) {
		Assert.notNull(registry, "Registry must not be null");
		Assert.notNull(manifest, "Manifest supplier must not be null");
		Assert.notNull(processRunner, "Process runner must not be null");
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		Assert.notNull(executionTimeout, "Execution timeout must not be null");
		this.registry = registry;
		this.manifest = manifest;
		this.processRunner = processRunner;
		this.jsonMapper = jsonMapper;
		this.argumentTranslator = new ArgumentTranslator(jsonMapper);
		this.outputMapper = new PluginOutputMapper(jsonMapper);
		this.executionTimeout = executionTimeout;
		this.outputByteLimit = outputByteLimit;
		AtomicInteger threadCount = new AtomicInteger();
		this.dispatchScheduler = Schedulers.fromExecutorService(Executors.newCachedThreadPool(r -> {
			Thread t = new Thread(r, "cligateway-dispatch-" + threadCount.incrementAndGet());
			t.setDaemon(true);
			return t;
		}), "cligateway-dispatch");
	}

	/**
	 * Dispatches a raw request body.
	 * @param body the JSON text posted by the client
	 * @return the response; a body that is not JSON yields a parse error and a body that
	 * is not a JSON-RPC object (including {@code null}) an invalid request, both with a
	 * null id
	 */
	public Mono<JSONRPCResponse> dispatch(String body) {
		return Mono.defer(() -> decodeAndDispatch(body)).onErrorResume(e -> {
			logger.warn("Failed to handle request body", e);
			return Mono.just(JSONRPCResponse.failure(null, GatewayErrorCodes.INTERNAL_ERROR,
					e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
		});
	}

	private Mono<JSONRPCResponse> decodeAndDispatch(String body) {
		JSONRPCMessage message;
		try {
			message = GatewaySchema.deserializeJsonRpcMessage(this.jsonMapper, body == null ? "" : body);
		}
		catch (IOException e) {
			logger.debug("Rejecting unparsable request body: {}", e.getMessage());
			return Mono.just(JSONRPCResponse.failure(null, GatewayErrorCodes.PARSE_ERROR,
					GatewayErrorCodes.getDescription(GatewayErrorCodes.PARSE_ERROR) + ": " + e.getMessage()));
		}
		catch (IllegalArgumentException e) {
			logger.debug("Rejecting request body: {}", e.getMessage());
			return Mono.just(JSONRPCResponse.failure(null, GatewayErrorCodes.INVALID_REQUEST,
					"Message must be a JSON-RPC request object"));
		}
		return dispatch(message);
	}

	/**
	 * Dispatches a decoded message. Only requests are accepted.
	 */
	public Mono<JSONRPCResponse> dispatch(JSONRPCMessage message) {
		if (!(message instanceof JSONRPCRequest request)) {
			return Mono.just(JSONRPCResponse.failure(null, GatewayErrorCodes.INVALID_REQUEST,
					"Expected a request carrying an id"));
		}
		Object id = request.id();
		return Mono.defer(() -> route(request))
			.onErrorResume(GatewayProtocolException.class,
					e -> Mono.just(JSONRPCResponse.failure(id, e.getCode(), e.toJsonRpcError().message())))
			.onErrorResume(e -> {
				logger.warn("Request {} ({}) failed", id, request.method(), e);
				return Mono.just(JSONRPCResponse.failure(id, GatewayErrorCodes.INTERNAL_ERROR,
						e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
			});
	}

	private Mono<JSONRPCResponse> route(JSONRPCRequest request) {
		if (!GatewaySchema.JSONRPC_VERSION.equals(request.jsonrpc())) {
			throw new GatewayProtocolException(GatewayErrorCodes.INVALID_REQUEST,
					"Unsupported jsonrpc version: " + request.jsonrpc());
		}
		if (request.id() == null) {
			throw new GatewayProtocolException(GatewayErrorCodes.INVALID_REQUEST, "Request id must not be null");
		}
		if (request.method() == null || request.method().isBlank()) {
			throw new GatewayProtocolException(GatewayErrorCodes.INVALID_REQUEST, "Request method is missing");
		}

		switch (request.method()) {
			case GatewaySchema.METHOD_TOOLS_CALL:
				return callTool(request);
			case GatewaySchema.METHOD_TOOLS_LIST:
				return Mono.just(JSONRPCResponse.success(request.id(),
						new GatewaySchema.ListToolsResult(this.manifest.get().tools())));
			case GatewaySchema.METHOD_PING:
				return Mono.just(JSONRPCResponse.success(request.id(), Map.of()));
			default:
				throw new GatewayProtocolException(GatewayErrorCodes.INVALID_REQUEST,
						"Unsupported method: " + request.method());
		}
	}

	private Mono<JSONRPCResponse> callTool(JSONRPCRequest request) {
		GatewaySchema.CallToolRequest call = callParams(request.params());
		ToolBinding binding = this.registry.lookup(call.name())
			.orElseThrow(() -> new GatewayProtocolException(GatewayErrorCodes.METHOD_NOT_FOUND,
					"Tool not found: " + call.name()));

		List<String> command = new ArrayList<>(binding.plugin().launchCommand());
		command.add(binding.command().name());
		try {
			command.addAll(this.argumentTranslator.translate(binding.command(), call.arguments()));
		}
		catch (IllegalArgumentException e) {
			throw new GatewayProtocolException(GatewayErrorCodes.INVALID_PARAMS, e.getMessage());
		}

		ProcessInvocation invocation = ProcessInvocation.of(command)
			.workingDirectory(binding.plugin().workingDirectory())
			.withTimeout(this.executionTimeout)
			.outputByteLimit(this.outputByteLimit);
		logger.debug("Calling {} (request {}): {}", call.name(), request.id(), command);

		return Mono.fromCallable(() -> this.processRunner.run(invocation))
			.subscribeOn(this.dispatchScheduler)
			.map(result -> this.outputMapper.map(request.id(), call.name(), result));
	}

	private static GatewaySchema.CallToolRequest callParams(Object params) {
		if (!(params instanceof Map<?, ?> map)) {
			throw new GatewayProtocolException(GatewayErrorCodes.INVALID_PARAMS, "Params must be an object");
		}
		if (!(map.get("name") instanceof String name) || name.isBlank()) {
			throw new GatewayProtocolException(GatewayErrorCodes.INVALID_PARAMS, "Params must carry a tool name");
		}
		Object arguments = map.get("arguments");
		if (arguments == null) {
			return new GatewaySchema.CallToolRequest(name, Map.of());
		}
		if (!(arguments instanceof Map<?, ?> values)) {
			throw new GatewayProtocolException(GatewayErrorCodes.INVALID_PARAMS, "Arguments must be an object");
		}
		Map<String, Object> copy = new LinkedHashMap<>();
		values.forEach((key, value) -> copy.put(String.valueOf(key), value));
		return new GatewaySchema.CallToolRequest(name, copy);
	}

	@Override
	public void close() {
		this.dispatchScheduler.dispose();
	}

}
