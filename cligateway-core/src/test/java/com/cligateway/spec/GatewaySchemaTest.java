/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.spec;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GatewaySchema} message decoding and wire shape.
 */
class GatewaySchemaTest {

	private final McpJsonMapper jsonMapper = McpJsonMapper.getDefault();

	private final ObjectMapper objectMapper = new ObjectMapper();

	@Test
	void deserializesToolCallRequest() throws IOException {
		String json = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
				+ "\"params\":{\"name\":\"p.cmd\",\"arguments\":{\"param\":\"v\"}}}";

		GatewaySchema.JSONRPCMessage message = GatewaySchema.deserializeJsonRpcMessage(jsonMapper, json);

		assertThat(message).isInstanceOf(GatewaySchema.JSONRPCRequest.class);
		GatewaySchema.JSONRPCRequest request = (GatewaySchema.JSONRPCRequest) message;
		assertThat(request.id()).isEqualTo(1);
		assertThat(request.method()).isEqualTo(GatewaySchema.METHOD_TOOLS_CALL);
		assertThat(request.params()).isInstanceOf(Map.class);
	}

	@Test
	void messageWithoutIdIsNotification() throws IOException {
		GatewaySchema.JSONRPCMessage message = GatewaySchema.deserializeJsonRpcMessage(jsonMapper,
				"{\"jsonrpc\":\"2.0\",\"method\":\"ping\"}");

		assertThat(message).isInstanceOf(GatewaySchema.JSONRPCNotification.class);
	}

	@Test
	void messageWithResultIsResponse() throws IOException {
		GatewaySchema.JSONRPCMessage message = GatewaySchema.deserializeJsonRpcMessage(jsonMapper,
				"{\"jsonrpc\":\"2.0\",\"id\":\"a\",\"result\":{}}");

		assertThat(message).isInstanceOf(GatewaySchema.JSONRPCResponse.class);
	}

	@Test
	void unrecognizedShapeIsRejected() {
		assertThatThrownBy(() -> GatewaySchema.deserializeJsonRpcMessage(jsonMapper, "{\"jsonrpc\":\"2.0\"}"))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void jsonNullIsRejectedAsShape() {
		assertThatThrownBy(() -> GatewaySchema.deserializeJsonRpcMessage(jsonMapper, "null"))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("must be a JSON object");
	}

	@Test
	void nonObjectJsonIsRejectedAsShape() {
		assertThatThrownBy(() -> GatewaySchema.deserializeJsonRpcMessage(jsonMapper, "[1, 2]"))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> GatewaySchema.deserializeJsonRpcMessage(jsonMapper, "42"))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void invalidJsonIsRejected() {
		assertThatThrownBy(() -> GatewaySchema.deserializeJsonRpcMessage(jsonMapper, "not json"))
			.isInstanceOf(IOException.class);
	}

	@Test
	void failureResponseCarriesNullIdAndNoResult() throws IOException {
		GatewaySchema.JSONRPCResponse response = GatewaySchema.JSONRPCResponse.failure(null, -32700, "Parse error");

		JsonNode node = objectMapper.readTree(jsonMapper.writeValueAsString(response));

		assertThat(node.has("id")).isTrue();
		assertThat(node.get("id").isNull()).isTrue();
		assertThat(node.has("result")).isFalse();
		assertThat(node.get("error").get("code").asInt()).isEqualTo(-32700);
		assertThat(node.get("error").has("data")).isFalse();
	}

	@Test
	void successResponseHasNoError() throws IOException {
		GatewaySchema.CallToolResult result = new GatewaySchema.CallToolResult(
				List.of(new GatewaySchema.TextContent("done")));

		JsonNode node = objectMapper
			.readTree(jsonMapper.writeValueAsString(GatewaySchema.JSONRPCResponse.success(7, result)));

		assertThat(node.get("jsonrpc").asText()).isEqualTo("2.0");
		assertThat(node.get("id").asInt()).isEqualTo(7);
		assertThat(node.has("error")).isFalse();
		assertThat(node.get("result").get("content").get(0).get("type").asText()).isEqualTo("text");
		assertThat(node.get("result").get("content").get(0).get("text").asText()).isEqualTo("done");
	}

	@Test
	void toolSchemaShape() throws IOException {
		GatewaySchema.Tool tool = new GatewaySchema.Tool("p.cmd", "Run",
				new GatewaySchema.JsonSchema(Map.of("param", Map.of("type", "string")), List.of("param")));

		JsonNode node = objectMapper.readTree(jsonMapper.writeValueAsString(tool));

		assertThat(node.get("inputSchema").get("type").asText()).isEqualTo("object");
		assertThat(node.get("inputSchema").get("properties").get("param").get("type").asText()).isEqualTo("string");
		assertThat(node.get("inputSchema").get("required").get(0).asText()).isEqualTo("param");
	}

}
