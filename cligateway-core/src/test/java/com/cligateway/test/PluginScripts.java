/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes POSIX {@code sh} plugins that answer {@code --help} the way an argparse program
 * does and run a shell snippet per command.
 */
public final class PluginScripts {

	private PluginScripts() {
	}

	public static Builder plugin(String name) {
		return new Builder(name);
	}

	/**
	 * {@code workflow_test_plugin} with {@code workflow-command --param PARAM}.
	 */
	public static Path workflowPlugin(Path pluginsDir) throws IOException {
		return plugin("workflow_test_plugin").description("Workflow test plugin")
			.command("workflow-command", "Run the workflow command", List.of("[--param PARAM]"),
					List.of("  --param PARAM  Parameter for workflow"),
					String.join("\n", "param=default", "while [ $# -gt 0 ]; do", "  case \"$1\" in",
							"    --param) param=\"$2\"; shift 2 ;;", "    *) shift ;;", "  esac", "done",
							"printf '{\"result\": \"Workflow executed with param: %s\"}\\n' \"$param\""))
			.writeTo(pluginsDir);
	}

	/**
	 * A plugin whose {@code test-command} reports {@code "<name> executed successfully"}.
	 */
	public static Path successPlugin(Path pluginsDir, String name) throws IOException {
		return plugin(name).description(name)
			.command("test-command", "Run the test command",
					"echo '{\"result\": \"" + name + " executed successfully\"}'")
			.writeTo(pluginsDir);
	}

	/**
	 * {@code error_plugin} whose {@code error-command} reports a handled failure and exits 0.
	 */
	public static Path errorPlugin(Path pluginsDir) throws IOException {
		return plugin("error_plugin").description("Error test plugin")
			.command("error-command", "Run the error command", "echo '{\"error\": \"This is a test error\"}'")
			.writeTo(pluginsDir);
	}

	/**
	 * A plugin whose {@code concurrent-command} sleeps before answering.
	 */
	public static Path sleepingPlugin(Path pluginsDir, String name, String sleepSeconds) throws IOException {
		return plugin(name).description("Concurrent test plugin")
			.command("concurrent-command", "Run the concurrent command",
					"sleep " + sleepSeconds + "\necho '{\"result\": \"Concurrent execution completed\"}'")
			.writeTo(pluginsDir);
	}

	/**
	 * Writes an executable file.
	 */
	public static Path writeExecutable(Path file, String content) throws IOException {
		Files.createDirectories(file.getParent());
		Files.writeString(file, content);
		Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
		return file;
	}

	public static final class Builder {

		private final String name;

		private String description;

		private final List<CommandScript> commands = new ArrayList<>();

		private Builder(String name) {
			this.name = name;
			this.description = name;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder command(String command, String help, String body) {
			return command(command, help, List.of(), List.of(), body);
		}

		/**
		 * @param usage usage fragments following {@code [-h]}, e.g. {@code [--param PARAM]}
		 * @param optionLines lines of the {@code options:} section after {@code -h}
		 * @param body shell snippet run with the command's arguments in {@code $@}
		 */
		public Builder command(String command, String help, List<String> usage, List<String> optionLines,
				String body) {
			this.commands.add(new CommandScript(command, help, usage, optionLines, body));
			return this;
		}

		/**
		 * Writes {@code <pluginsDir>/<name>/cli}.
		 * @return the script path
		 */
		public Path writeTo(Path pluginsDir) throws IOException {
			return writeExecutable(pluginsDir.resolve(this.name).resolve("cli"), script());
		}

		public String script() {
			List<String> names = this.commands.stream().map(CommandScript::name).toList();
			String choices = "{" + String.join(",", names) + "}";

			List<String> lines = new ArrayList<>();
			lines.add("#!/bin/sh");
			lines.add("if [ $# -eq 0 ] || [ \"$1\" = \"--help\" ] || [ \"$1\" = \"-h\" ]; then");
			lines.add("cat <<'HELP'");
			lines.add("usage: cli [-h] " + choices + " ...");
			lines.add("");
			lines.add(this.description);
			lines.add("");
			lines.add("positional arguments:");
			lines.add("  " + choices + "  Available commands");
			for (CommandScript command : this.commands) {
				lines.add("    " + command.name() + "  " + command.help());
			}
			lines.add("");
			lines.add("options:");
			lines.add("  -h, --help  show this help message and exit");
			lines.add("HELP");
			lines.add("exit 0");
			lines.add("fi");
			lines.add("cmd=\"$1\"");
			lines.add("shift");
			lines.add("case \"$cmd\" in");
			for (CommandScript command : this.commands) {
				lines.add(command.name() + ")");
				lines.add("if [ \"$1\" = \"--help\" ]; then");
				lines.add("cat <<'HELP'");
				lines.add(("usage: cli " + command.name() + " [-h] " + String.join(" ", command.usage())).trim());
				lines.add("");
				lines.add("options:");
				lines.add("  -h, --help  show this help message and exit");
				lines.addAll(command.optionLines());
				lines.add("HELP");
				lines.add("exit 0");
				lines.add("fi");
				lines.add(command.body());
				lines.add(";;");
			}
			lines.add("*)");
			lines.add("echo '{\"error\": \"Unknown command\"}'");
			lines.add("exit 1");
			lines.add(";;");
			lines.add("esac");
			return String.join("\n", lines) + "\n";
		}

	}

	private record CommandScript(String name, String help, List<String> usage, List<String> optionLines,
			String body) {
	}

}
