/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.cligateway.test.PluginScripts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PluginLocator}.
 */
@EnabledOnOs({ OS.LINUX, OS.MAC })
class PluginLocatorTest {

	@TempDir
	Path pluginsDir;

	private final PluginLocator locator = PluginLocator.defaults();

	@Test
	void subdirectoryWithEntryScriptIsNamedAfterDirectory() throws IOException {
		Path script = PluginScripts.writeExecutable(pluginsDir.resolve("alpha").resolve("cli"), "#!/bin/sh\n");

		List<PluginLocator.Candidate> candidates = locator.locate(pluginsDir);

		assertThat(candidates).hasSize(1);
		assertThat(candidates.get(0).name()).isEqualTo("alpha");
		assertThat(candidates.get(0).executablePath()).isEqualTo(script);
		assertThat(candidates.get(0).launchCommand()).containsExactly(script.toAbsolutePath().toString());
		assertThat(candidates.get(0).isRunnable()).isTrue();
	}

	@Test
	void firstEntryNameWins() throws IOException {
		Path dir = pluginsDir.resolve("alpha");
		PluginScripts.writeExecutable(dir.resolve("main"), "#!/bin/sh\n");
		Path cli = PluginScripts.writeExecutable(dir.resolve("cli"), "#!/bin/sh\n");

		assertThat(locator.locate(pluginsDir)).singleElement()
			.extracting(PluginLocator.Candidate::executablePath)
			.isEqualTo(cli);
	}

	@Test
	void nonExecutablePythonScriptRunsThroughInterpreter() throws IOException {
		Path dir = Files.createDirectories(pluginsDir.resolve("beta"));
		Path script = Files.writeString(dir.resolve("cli.py"), "print('hi')\n");

		PluginLocator.Candidate candidate = locator.locate(pluginsDir).get(0);

		assertThat(candidate.launchCommand()).containsExactly("python3", script.toAbsolutePath().toString());
	}

	@Test
	void nonExecutableFileWithoutInterpreterIsNotRunnable() throws IOException {
		Path dir = Files.createDirectories(pluginsDir.resolve("gamma"));
		Files.writeString(dir.resolve("cli"), "data\n");

		PluginLocator.Candidate candidate = locator.locate(pluginsDir).get(0);

		assertThat(candidate.isRunnable()).isFalse();
		assertThat(candidate.launchCommand()).isEmpty();
	}

	@Test
	void topLevelExecutableIsNamedAfterStem() throws IOException {
		PluginScripts.writeExecutable(pluginsDir.resolve("tool.sh"), "#!/bin/sh\n");
		Files.writeString(pluginsDir.resolve("README.md"), "docs\n");

		assertThat(locator.locate(pluginsDir)).extracting(PluginLocator.Candidate::name).containsExactly("tool");
	}

	@Test
	void candidatesAreSortedAndHiddenEntriesIgnored() throws IOException {
		PluginScripts.writeExecutable(pluginsDir.resolve("zeta").resolve("cli"), "#!/bin/sh\n");
		PluginScripts.writeExecutable(pluginsDir.resolve("alpha").resolve("cli"), "#!/bin/sh\n");
		PluginScripts.writeExecutable(pluginsDir.resolve(".hidden").resolve("cli"), "#!/bin/sh\n");
		Files.createDirectories(pluginsDir.resolve("empty"));

		assertThat(locator.locate(pluginsDir)).extracting(PluginLocator.Candidate::name)
			.containsExactly("alpha", "zeta");
	}

	@Test
	void customInterpreter() throws IOException {
		Path dir = Files.createDirectories(pluginsDir.resolve("ruby"));
		Path script = Files.writeString(dir.resolve("main.rb"), "puts 1\n");
		PluginLocator custom = PluginLocator.builder().entryNames(List.of("main.rb")).interpreter(".rb", "ruby").build();

		assertThat(custom.locate(pluginsDir).get(0).launchCommand()).containsExactly("ruby",
				script.toAbsolutePath().toString());
	}

}
