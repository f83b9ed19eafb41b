/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

import java.util.List;

import com.cligateway.util.Assert;

/**
 * One declared argument of a plugin command.
 *
 * @param name Argument name as exposed in the tool's input schema
 * @param type Value type
 * @param required Whether the plugin declares the argument mandatory
 * @param defaultValue Declared default, or null
 * @param description Help text, or null
 * @param option Command-line spelling such as {@code --param}; null for a positional
 * argument
 * @param choices Allowed values, empty when unrestricted
 */
public record Parameter(
		String name,
		ParameterType type,
		boolean required,
		Object defaultValue,
		String description,
		String option,
		List<String> choices
) {

	public Parameter {
		Assert.hasText(name, "Parameter name must not be empty");
		type = type == null ? ParameterType.ANY : type;
		choices = choices == null ? List.of() : List.copyOf(choices);
	}

	public static Parameter option(String name, String option, ParameterType type, boolean required) {
		return new Parameter(name, type, required, null, null, option, List.of());
	}

	public static Parameter positional(String name, String description) {
		return new Parameter(name, ParameterType.STRING, true, null, description, null, List.of());
	}

	public boolean isPositional() {
		return this.option == null;
	}

}
