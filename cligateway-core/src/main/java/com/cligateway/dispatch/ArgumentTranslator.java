/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.dispatch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.cligateway.plugin.Command;
import com.cligateway.plugin.Parameter;
import com.cligateway.plugin.ParameterType;
import com.cligateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;

/**
 * Turns a tool call's argument map into command-line arguments for the plugin.
 *
 * <p>
 * Positional parameters come first, in declaration order. Every other argument becomes an
 * option: {@code --name value}, or just {@code --name} for a flag set to {@code true}. A
 * flag set to {@code false} and any {@code null} value are omitted. A declared flag also
 * takes the text {@code "true"}/{@code "false"} or a number, zero meaning unset. Collections repeat
 * their elements after the option and nested objects are passed as JSON text. Keys the
 * plugin never declared are passed through as {@code --key}.
 * </p>
 */
public class ArgumentTranslator {

	private final McpJsonMapper jsonMapper;

	public ArgumentTranslator(McpJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		this.jsonMapper = jsonMapper;
	}

	public List<String> translate(Command command, Map<String, Object> arguments) {
		Assert.notNull(command, "Command must not be null");
		List<String> argv = new ArrayList<>();
		if (arguments == null || arguments.isEmpty()) {
			return argv;
		}

		Set<String> consumed = new HashSet<>();
		for (Parameter parameter : command.parameters()) {
			if (!parameter.isPositional()) {
				continue;
			}
			for (Map.Entry<String, Object> entry : arguments.entrySet()) {
				if (command.findParameter(entry.getKey()).filter(parameter::equals).isPresent()) {
					consumed.add(entry.getKey());
					appendValues(argv, entry.getValue());
				}
			}
		}

		for (Map.Entry<String, Object> entry : arguments.entrySet()) {
			if (consumed.contains(entry.getKey()) || entry.getValue() == null) {
				continue;
			}
			Optional<Parameter> parameter = command.findParameter(entry.getKey());
			String option = parameter.map(Parameter::option).orElse("--" + entry.getKey());
			Object value = flagValue(parameter, entry.getValue());
			if (value instanceof Boolean flag && isSwitch(parameter)) {
				if (flag) {
					argv.add(option);
				}
				continue;
			}
			argv.add(option);
			appendValues(argv, value);
		}
		return argv;
	}

	// A declared flag also accepts "true"/"false" text and 0/1 style numbers.
	private static Object flagValue(Optional<Parameter> parameter, Object value) {
		if (parameter.isEmpty() || parameter.get().type() != ParameterType.FLAG) {
			return value;
		}
		if (value instanceof String text) {
			if ("true".equalsIgnoreCase(text.trim())) {
				return Boolean.TRUE;
			}
			if ("false".equalsIgnoreCase(text.trim())) {
				return Boolean.FALSE;
			}
		}
		if (value instanceof Number number) {
			return number.doubleValue() != 0;
		}
		return value;
	}

	// Unknown options given a boolean are treated as switches too.
	private static boolean isSwitch(Optional<Parameter> parameter) {
		return parameter.map(p -> p.type() != ParameterType.BOOLEAN).orElse(true);
	}

	private void appendValues(List<String> argv, Object value) {
		if (value == null) {
			return;
		}
		if (value instanceof Collection<?> values) {
			for (Object element : values) {
				if (element != null) {
					argv.add(render(element));
				}
			}
			return;
		}
		argv.add(render(value));
	}

	private String render(Object value) {
		if (value instanceof String text) {
			return text;
		}
		if (value instanceof Number || value instanceof Boolean) {
			return String.valueOf(value);
		}
		try {
			return this.jsonMapper.writeValueAsString(value);
		}
		catch (Exception e) {
			throw new IllegalArgumentException("Argument value cannot be serialized: " + value, e);
		}
	}

}
