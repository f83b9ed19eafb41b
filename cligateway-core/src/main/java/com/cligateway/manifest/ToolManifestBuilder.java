/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.manifest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cligateway.plugin.Command;
import com.cligateway.plugin.Parameter;
import com.cligateway.plugin.Plugin;
import com.cligateway.plugin.RegistrySnapshot;
import com.cligateway.spec.GatewaySchema;
import com.cligateway.util.Assert;

/**
 * Projects a registry snapshot into tool descriptors. Pure: the same snapshot always
 * yields the same manifest, and every command yields exactly one tool.
 */
public class ToolManifestBuilder {

	private static final Comparator<Plugin> BY_NAME = Comparator.comparing(Plugin::name);

	public Manifest build(RegistrySnapshot snapshot) {
		Assert.notNull(snapshot, "Snapshot must not be null");
		List<GatewaySchema.Tool> tools = new ArrayList<>();
		snapshot.plugins().stream().sorted(BY_NAME).forEach(plugin -> plugin.commands()
			.stream()
			.sorted(Comparator.comparing(Command::name))
			.forEach(command -> tools.add(toTool(plugin, command))));
		return new Manifest(tools);
	}

	GatewaySchema.Tool toTool(Plugin plugin, Command command) {
		Map<String, Map<String, Object>> properties = new LinkedHashMap<>();
		List<String> required = new ArrayList<>();
		for (Parameter parameter : command.parameters()) {
			properties.put(parameter.name(), propertySchema(parameter));
			if (parameter.required()) {
				required.add(parameter.name());
			}
		}
		return new GatewaySchema.Tool(plugin.qualifiedName(command), description(plugin, command),
				new GatewaySchema.JsonSchema(properties, required));
	}

	private static String description(Plugin plugin, Command command) {
		if (command.description() != null && !command.description().isBlank()) {
			return command.description();
		}
		return "Run '" + command.name() + "' of plugin '" + plugin.name() + "'";
	}

	// Unknown types stay unconstrained: an empty schema accepts any value.
	private static Map<String, Object> propertySchema(Parameter parameter) {
		Map<String, Object> schema = new LinkedHashMap<>();
		if (parameter.type().jsonType() == null) {
			return schema;
		}
		schema.put("type", parameter.type().jsonType());
		if (parameter.description() != null) {
			schema.put("description", parameter.description());
		}
		if (parameter.defaultValue() != null) {
			schema.put("default", parameter.defaultValue());
		}
		if (!parameter.choices().isEmpty()) {
			schema.put("enum", parameter.choices());
		}
		return schema;
	}

}
