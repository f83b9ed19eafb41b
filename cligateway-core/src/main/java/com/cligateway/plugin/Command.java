/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

import java.util.List;
import java.util.Optional;

import com.cligateway.util.Assert;

/**
 * A subcommand declared by a plugin. Immutable once introspected.
 *
 * @param name Dash-case command name, unique within its plugin
 * @param description Help text, or null
 * @param parameters Declared parameters in declaration order
 */
public record Command(String name, String description, List<Parameter> parameters) {

	public Command {
		Assert.hasText(name, "Command name must not be empty");
		parameters = parameters == null ? List.of() : List.copyOf(parameters);
	}

	/**
	 * Finds the parameter an argument key refers to. The key matches a parameter name
	 * exactly, or after replacing underscores with dashes ({@code dry_run} matches
	 * {@code dry-run}).
	 * @param key argument key supplied by a caller
	 * @return the matching parameter, if any
	 */
	public Optional<Parameter> findParameter(String key) {
		for (Parameter parameter : this.parameters) {
			if (parameter.name().equals(key)) {
				return Optional.of(parameter);
			}
		}
		String dashed = key.replace('_', '-');
		return this.parameters.stream().filter(p -> p.name().replace('_', '-').equals(dashed)).findFirst();
	}

}
