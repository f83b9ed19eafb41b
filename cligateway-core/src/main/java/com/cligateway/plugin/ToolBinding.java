/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

/**
 * The (plugin, command) pair a qualified tool name resolves to.
 */
public record ToolBinding(Plugin plugin, Command command) {

	public String qualifiedName() {
		return this.plugin.qualifiedName(this.command);
	}

}
