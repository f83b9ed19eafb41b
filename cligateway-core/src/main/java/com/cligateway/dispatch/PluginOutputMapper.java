/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.dispatch;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.cligateway.error.GatewayErrorCodes;
import com.cligateway.process.ProcessResult;
import com.cligateway.spec.GatewaySchema;
import com.cligateway.spec.GatewaySchema.JSONRPCResponse;
import com.cligateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;

/**
 * Maps the captured output of a plugin process to a JSON-RPC response.
 *
 * <p>
 * A plugin reports through one JSON object on standard output. An object with an
 * {@code error} key is a plugin-reported failure whatever the exit code. Otherwise a
 * non-zero exit, a timeout or output that is not a JSON object is an execution failure.
 * All failures use {@link GatewayErrorCodes#INTERNAL_ERROR}.
 * </p>
 */
public class PluginOutputMapper {

	private static final TypeRef<HashMap<String, Object>> MAP_TYPE_REF = new TypeRef<>() {
	};

	static final int STDERR_EXCERPT_LENGTH = 500;

	private final McpJsonMapper jsonMapper;

	public PluginOutputMapper(McpJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		this.jsonMapper = jsonMapper;
	}

	public JSONRPCResponse map(Object requestId, String toolName, ProcessResult result) {
		Assert.notNull(result, "Process result must not be null");
		if (result.timedOut()) {
			return failure(requestId, "Tool '" + toolName + "' timed out after " + result.elapsed().toMillis() + " ms");
		}

		ParsedOutput parsed = parse(result.stdout());
		Map<String, Object> output = parsed.object();
		if (output != null && output.containsKey("error")) {
			return failure(requestId, errorText(output.get("error")));
		}
		if (result.exitCode() != 0) {
			return failure(requestId,
					"Tool '" + toolName + "' exited with code " + result.exitCode() + stderrExcerpt(result));
		}
		if (output == null) {
			return failure(requestId, "Tool '" + toolName + "' produced unparsable output: " + parsed.problem());
		}

		Object value = output.containsKey("result") ? output.get("result") : output;
		GatewaySchema.CallToolResult callResult = new GatewaySchema.CallToolResult(
				List.of(new GatewaySchema.TextContent(text(value))));
		return JSONRPCResponse.success(requestId, callResult);
	}

	/**
	 * Reads the whole output as a JSON object, or failing that, its last non-blank line.
	 */
	ParsedOutput parse(String stdout) {
		if (stdout == null || stdout.isBlank()) {
			return ParsedOutput.failed("no output");
		}
		ParsedOutput whole = readObject(stdout.strip());
		if (whole.object() != null) {
			return whole;
		}
		List<String> lines = stdout.strip().lines().filter(l -> !l.isBlank()).toList();
		if (lines.size() < 2) {
			return whole;
		}
		ParsedOutput last = readObject(lines.get(lines.size() - 1).strip());
		return last.object() != null ? last : whole;
	}

	private ParsedOutput readObject(String text) {
		if (!text.startsWith("{")) {
			return ParsedOutput.failed("expected a JSON object but got '" + excerpt(text) + "'");
		}
		try {
			return new ParsedOutput(this.jsonMapper.readValue(text, MAP_TYPE_REF), null);
		}
		catch (Exception e) {
			return ParsedOutput.failed(e.getMessage());
		}
	}

	/**
	 * @param object the parsed object, or null
	 * @param problem why parsing failed, when {@code object} is null
	 */
	record ParsedOutput(Map<String, Object> object, String problem) {

		static ParsedOutput failed(String problem) {
			return new ParsedOutput(null, problem);
		}

	}

	private String errorText(Object error) {
		if (error instanceof Map<?, ?> details && details.get("message") instanceof String message) {
			return message;
		}
		return error == null ? "Plugin reported an error" : text(error);
	}

	private String text(Object value) {
		if (value instanceof String string) {
			return string;
		}
		try {
			return this.jsonMapper.writeValueAsString(value);
		}
		catch (Exception e) {
			return String.valueOf(value);
		}
	}

	private static String stderrExcerpt(ProcessResult result) {
		String stderr = result.stderr().strip();
		return stderr.isEmpty() ? "" : ": " + excerpt(stderr);
	}

	private static String excerpt(String text) {
		return text.length() > STDERR_EXCERPT_LENGTH ? text.substring(0, STDERR_EXCERPT_LENGTH) + "..." : text;
	}

	private static JSONRPCResponse failure(Object requestId, String message) {
		return JSONRPCResponse.failure(requestId, GatewayErrorCodes.INTERNAL_ERROR, message);
	}

}
