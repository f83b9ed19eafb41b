/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.cligateway.util.Assert;

/**
 * An introspected plugin. Owned by the {@link PluginRegistry}; a rescan replaces every
 * plugin instead of mutating one.
 *
 * @param name Unique plugin name, derived from its directory name or file stem
 * @param executablePath The plugin's entry executable
 * @param launchCommand Prefix used to run it, e.g. {@code [/p/cli]} or
 * {@code [python3, /p/cli.py]}
 * @param commands Declared commands in declaration order
 */
public record Plugin(String name, Path executablePath, List<String> launchCommand, List<Command> commands) {

	public Plugin {
		Assert.hasText(name, "Plugin name must not be empty");
		Assert.notNull(executablePath, "Executable path must not be null");
		Assert.notEmpty(launchCommand, "Launch command must not be empty");
		launchCommand = List.copyOf(launchCommand);
		commands = commands == null ? List.of() : List.copyOf(commands);
	}

	public Optional<Command> findCommand(String commandName) {
		return this.commands.stream().filter(c -> c.name().equals(commandName)).findFirst();
	}

	/**
	 * @param command one of this plugin's commands
	 * @return the tool name, {@code plugin.command}
	 */
	public String qualifiedName(Command command) {
		return this.name + "." + command.name();
	}

	/**
	 * @return the directory plugin processes are started in
	 */
	public Path workingDirectory() {
		Path parent = this.executablePath.toAbsolutePath().getParent();
		return parent != null ? parent : this.executablePath.toAbsolutePath();
	}

}
