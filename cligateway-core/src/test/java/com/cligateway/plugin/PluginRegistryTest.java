/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.cligateway.error.IntrospectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PluginRegistry} with a stub introspector, so that no process is run.
 */
class PluginRegistryTest {

	@TempDir
	Path pluginsDir;

	private final Map<String, Plugin> declared = new ConcurrentHashMap<>();

	private final List<String> introspected = new ArrayList<>();

	private final PluginIntrospector stubIntrospector = candidate -> {
		this.introspected.add(candidate.name());
		Plugin plugin = this.declared.get(candidate.name());
		if (plugin == null) {
			throw new IntrospectionException(candidate.name(), "no help output");
		}
		return plugin;
	};

	private PluginRegistry registry;

	private ListAppender<ILoggingEvent> listAppender;

	private Logger registryLogger;

	@BeforeEach
	void setUp() {
		this.registry = new PluginRegistry(PluginLocator.builder().interpreter(".txt", "cat").build(),
				this.stubIntrospector);

		this.registryLogger = (Logger) LoggerFactory.getLogger(PluginRegistry.class);
		this.listAppender = new ListAppender<>();
		this.listAppender.start();
		this.registryLogger.addAppender(this.listAppender);
	}

	@AfterEach
	void tearDown() {
		this.registryLogger.detachAppender(this.listAppender);
		this.listAppender.stop();
	}

	private void candidate(String fileName) throws IOException {
		Files.writeString(this.pluginsDir.resolve(fileName), "x\n");
	}

	private void declare(String candidateName, String pluginName, String... commands) {
		List<Command> list = new ArrayList<>();
		for (String command : commands) {
			list.add(new Command(command, null, List.of()));
		}
		this.declared.put(candidateName,
				new Plugin(pluginName, this.pluginsDir.resolve(candidateName + ".txt"), List.of("cat"), list));
	}

	@Test
	void emptyBeforeFirstScan() {
		assertThat(registry.count()).isZero();
		assertThat(registry.snapshot().plugins()).isEmpty();
		assertThat(registry.lookup("a.b")).isEmpty();
	}

	@Test
	void scanRegistersEveryValidPlugin() throws IOException {
		candidate("plugin_a.txt");
		candidate("plugin_b.txt");
		declare("plugin_a", "plugin_a", "test-command");
		declare("plugin_b", "plugin_b", "test-command", "other");

		RegistrySnapshot snapshot = registry.scan(pluginsDir);

		assertThat(snapshot.pluginCount()).isEqualTo(2);
		assertThat(registry.count()).isEqualTo(2);
		assertThat(registry.snapshot()).isSameAs(snapshot);
		assertThat(snapshot.bindings()).containsOnlyKeys("plugin_a.test-command", "plugin_b.test-command",
				"plugin_b.other");
		ToolBinding binding = registry.lookup("plugin_b.other").orElseThrow();
		assertThat(binding.plugin().name()).isEqualTo("plugin_b");
		assertThat(binding.command().name()).isEqualTo("other");
	}

	@Test
	void failedIntrospectionExcludesOnlyThatPlugin() throws IOException {
		candidate("broken.txt");
		candidate("good.txt");
		declare("good", "good", "run");

		registry.scan(pluginsDir);

		assertThat(introspected).containsExactly("broken", "good");
		assertThat(registry.count()).isEqualTo(1);
		assertThat(registry.lookup("good.run")).isPresent();
		assertThat(listAppender.list).anySatisfy(event -> {
			assertThat(event.getLevel()).isEqualTo(Level.WARN);
			assertThat(event.getFormattedMessage()).contains("broken").contains("no help output");
		});
	}

	@Test
	void unexpectedIntrospectionFailureIsIsolated() throws IOException {
		candidate("a.txt");
		candidate("b.txt");
		declare("b", "b", "run");
		PluginRegistry throwing = new PluginRegistry(PluginLocator.builder().interpreter(".txt", "cat").build(),
				candidate -> {
					if (candidate.name().equals("a")) {
						throw new IllegalStateException("boom");
					}
					return this.declared.get(candidate.name());
				});

		throwing.scan(pluginsDir);

		assertThat(throwing.count()).isEqualTo(1);
	}

	@Test
	void duplicateToolNameKeepsFirstPlugin() throws IOException {
		candidate("first.txt");
		candidate("second.txt");
		declare("first", "shared", "run");
		declare("second", "shared", "run");

		registry.scan(pluginsDir);

		assertThat(registry.count()).isEqualTo(1);
		assertThat(registry.lookup("shared.run").orElseThrow().plugin().executablePath())
			.isEqualTo(pluginsDir.resolve("first.txt"));
		assertThat(listAppender.list).anySatisfy(event -> {
			assertThat(event.getLevel()).isEqualTo(Level.WARN);
			assertThat(event.getFormattedMessage()).contains("'shared'").contains("second.txt");
		});
	}

	@Test
	void duplicatePluginNameKeepsFirstEvenWithDistinctCommands() throws IOException {
		candidate("foo.txt");
		candidate("foo_copy.txt");
		declare("foo", "foo", "alpha");
		declare("foo_copy", "foo", "beta");

		RegistrySnapshot snapshot = registry.scan(pluginsDir);

		assertThat(snapshot.pluginCount()).isEqualTo(1);
		assertThat(registry.count()).isEqualTo(1);
		assertThat(snapshot.plugins()).extracting(Plugin::name).containsExactly("foo");
		assertThat(snapshot.bindings()).containsOnlyKeys("foo.alpha");
		assertThat(registry.lookup("foo.beta")).isEmpty();
		assertThat(listAppender.list).anySatisfy(event -> {
			assertThat(event.getLevel()).isEqualTo(Level.WARN);
			assertThat(event.getFormattedMessage()).contains("Dropping plugin 'foo'")
				.contains("already registered");
		});
	}

	@Test
	void snapshotRejectsDuplicatePluginNames() {
		Plugin first = new Plugin("foo", pluginsDir.resolve("a"), List.of("a"),
				List.of(new Command("alpha", null, List.of())));
		Plugin second = new Plugin("foo", pluginsDir.resolve("b"), List.of("b"),
				List.of(new Command("beta", null, List.of())));

		assertThatThrownBy(() -> RegistrySnapshot.of(List.of(first, second)))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("Duplicate plugin name: foo");
	}

	@Test
	void rescanReplacesSnapshotWholesale() throws IOException {
		candidate("one.txt");
		declare("one", "one", "run");
		RegistrySnapshot before = registry.scan(pluginsDir);

		Files.delete(pluginsDir.resolve("one.txt"));
		candidate("two.txt");
		declare("two", "two", "run");
		RegistrySnapshot after = registry.scan(pluginsDir);

		assertThat(before.lookup("one.run")).isPresent();
		assertThat(after.lookup("one.run")).isEmpty();
		assertThat(registry.lookup("two.run")).isPresent();
		assertThat(after.scannedAt()).isAfterOrEqualTo(before.scannedAt());
	}

	@Test
	void missingDirectoryYieldsEmptyRegistry() {
		RegistrySnapshot snapshot = registry.scan(pluginsDir.resolve("does-not-exist"));

		assertThat(snapshot.plugins()).isEmpty();
		assertThat(registry.count()).isZero();
		assertThat(listAppender.list).anySatisfy(event -> assertThat(event.getLevel()).isEqualTo(Level.WARN));
	}

	@Test
	void lookupOfNullIsEmpty() {
		assertThat(registry.lookup(null)).isEmpty();
	}

}
