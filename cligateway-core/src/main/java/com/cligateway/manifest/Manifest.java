/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.manifest;

import java.util.List;
import java.util.Optional;

import com.cligateway.spec.GatewaySchema;

/**
 * The tool list derived from one registry snapshot, ordered by plugin name then command
 * name.
 */
public record Manifest(List<GatewaySchema.Tool> tools) {

	private static final Manifest EMPTY = new Manifest(List.of());

	public Manifest {
		tools = tools == null ? List.of() : List.copyOf(tools);
	}

	public static Manifest empty() {
		return EMPTY;
	}

	public Optional<GatewaySchema.Tool> findTool(String name) {
		return this.tools.stream().filter(t -> t.name().equals(name)).findFirst();
	}

	public int size() {
		return this.tools.size();
	}

}
