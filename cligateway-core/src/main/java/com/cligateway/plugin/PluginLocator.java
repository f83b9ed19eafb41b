/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import com.cligateway.util.Assert;

/**
 * Finds candidate plugin executables in a plugins directory.
 *
 * <p>
 * Two layouts are recognized:
 * <ul>
 * <li>a subdirectory holding an entry script ({@code cli}, {@code cli.py}, ...); the
 * plugin is named after the subdirectory</li>
 * <li>an executable file placed directly in the plugins directory; the plugin is named
 * after the file stem</li>
 * </ul>
 * Entries are visited in lexical order so that scans are deterministic. Hidden entries
 * (starting with a dot) are ignored.
 *
 * <p>
 * Executable files run directly. A non-executable script whose extension has a
 * configured interpreter runs through it ({@code .py} with {@code python3}, {@code .sh}
 * with {@code sh}). Anything else is reported with an empty launch command and rejected
 * at introspection.
 */
public final class PluginLocator {

	public static final List<String> DEFAULT_ENTRY_NAMES = List.of("cli", "cli.py", "cli.sh", "main", "main.py",
			"main.sh");

	private final List<String> entryNames;

	private final Map<String, String> interpreters;

	private PluginLocator(List<String> entryNames, Map<String, String> interpreters) {
		this.entryNames = List.copyOf(entryNames);
		this.interpreters = Map.copyOf(interpreters);
	}

	public static PluginLocator defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * A discovered plugin entry point, not yet introspected.
	 *
	 * @param name Plugin name
	 * @param executablePath Entry executable
	 * @param launchCommand How to run it; empty when it is neither executable nor handled
	 * by an interpreter
	 */
	public record Candidate(String name, Path executablePath, List<String> launchCommand) {

		public Candidate {
			launchCommand = launchCommand == null ? List.of() : List.copyOf(launchCommand);
		}

		public boolean isRunnable() {
			return !this.launchCommand.isEmpty();
		}

	}

	/**
	 * Lists the candidate plugins in a directory.
	 * @param directory the plugins directory
	 * @return candidates in lexical order of their directory entry
	 * @throws IOException if the directory cannot be listed
	 */
	public List<Candidate> locate(Path directory) throws IOException {
		Assert.notNull(directory, "Plugins directory must not be null");
		List<Path> entries;
		try (Stream<Path> stream = Files.list(directory)) {
			entries = stream.filter(p -> !p.getFileName().toString().startsWith("."))
				.sorted(Comparator.comparing(p -> p.getFileName().toString()))
				.toList();
		}

		List<Candidate> candidates = new ArrayList<>();
		for (Path entry : entries) {
			if (Files.isDirectory(entry)) {
				findEntryScript(entry).ifPresent(script -> candidates
					.add(new Candidate(entry.getFileName().toString(), script, launchCommand(script))));
			}
			else if (Files.isRegularFile(entry) && isLaunchable(entry)) {
				candidates.add(new Candidate(stem(entry), entry, launchCommand(entry)));
			}
		}
		return candidates;
	}

	/**
	 * Resolves how a plugin file is started.
	 * @param executable the plugin's entry file
	 * @return the command prefix, or an empty list if the file cannot be run
	 */
	public List<String> launchCommand(Path executable) {
		String path = executable.toAbsolutePath().toString();
		if (Files.isExecutable(executable)) {
			return List.of(path);
		}
		String interpreter = this.interpreters.get(extension(executable));
		if (interpreter != null) {
			return List.of(interpreter, path);
		}
		return List.of();
	}

	private Optional<Path> findEntryScript(Path pluginDirectory) {
		for (String entryName : this.entryNames) {
			Path candidate = pluginDirectory.resolve(entryName);
			if (Files.isRegularFile(candidate)) {
				return Optional.of(candidate);
			}
		}
		return Optional.empty();
	}

	private boolean isLaunchable(Path file) {
		return Files.isExecutable(file) || this.interpreters.containsKey(extension(file));
	}

	private static String stem(Path file) {
		String fileName = file.getFileName().toString();
		int dot = fileName.lastIndexOf('.');
		return dot > 0 ? fileName.substring(0, dot) : fileName;
	}

	private static String extension(Path file) {
		String fileName = file.getFileName().toString();
		int dot = fileName.lastIndexOf('.');
		return dot > 0 ? fileName.substring(dot) : "";
	}

	/**
	 * Builder for {@link PluginLocator}.
	 */
	public static final class Builder {

		private List<String> entryNames = DEFAULT_ENTRY_NAMES;

		private final Map<String, String> interpreters = new LinkedHashMap<>();

		private Builder() {
			this.interpreters.put(".py", "python3");
			this.interpreters.put(".sh", "sh");
		}

		/**
		 * Sets the entry script names looked up inside plugin subdirectories, in order of
		 * preference.
		 * @param names entry names
		 * @return This builder for chaining
		 */
		public Builder entryNames(List<String> names) {
			Assert.notEmpty(names, "Entry names must not be empty");
			this.entryNames = List.copyOf(names);
			return this;
		}

		/**
		 * Maps a file extension to the interpreter used for non-executable scripts.
		 * @param extension extension including the dot, e.g. {@code .rb}
		 * @param interpreter interpreter command, e.g. {@code ruby}
		 * @return This builder for chaining
		 */
		public Builder interpreter(String extension, String interpreter) {
			Assert.isTrue(extension != null && extension.startsWith("."), "Extension must start with a dot");
			Assert.hasText(interpreter, "Interpreter must not be empty");
			this.interpreters.put(extension, interpreter);
			return this;
		}

		public PluginLocator build() {
			return new PluginLocator(this.entryNames, this.interpreters);
		}

	}

}
