/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

/**
 * Kind of value a command parameter accepts.
 */
public enum ParameterType {

	STRING("string"),

	NUMBER("number"),

	BOOLEAN("boolean"),

	/** An option that takes no value; present means true. */
	FLAG("boolean"),

	/** Type could not be determined; any JSON value is accepted. */
	ANY(null);

	private final String jsonType;

	ParameterType(String jsonType) {
		this.jsonType = jsonType;
	}

	/**
	 * @return the JSON Schema type name, or null for {@link #ANY}
	 */
	public String jsonType() {
		return this.jsonType;
	}

}
