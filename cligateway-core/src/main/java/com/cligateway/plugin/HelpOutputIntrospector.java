/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cligateway.error.IntrospectionException;
import com.cligateway.error.PluginExecutionException;
import com.cligateway.process.PluginProcessRunner;
import com.cligateway.process.ProcessInvocation;
import com.cligateway.process.ProcessResult;
import com.cligateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Introspects plugins by reading their {@code --help} output.
 *
 * <p>
 * Runs {@code <plugin> --help} to list the commands, then {@code <plugin> <command> --help}
 * for each command to learn its parameters. Only help invocations are ever issued during
 * discovery.
 * </p>
 *
 * @see ArgparseHelpParser
 */
public class HelpOutputIntrospector implements PluginIntrospector {

	private static final Logger logger = LoggerFactory.getLogger(HelpOutputIntrospector.class);

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

	private static final String HELP_FLAG = "--help";

	private final PluginProcessRunner processRunner;

	private final Duration helpTimeout;

	private final ArgparseHelpParser parser = new ArgparseHelpParser();

	public HelpOutputIntrospector(PluginProcessRunner processRunner) {
		this(processRunner, DEFAULT_TIMEOUT);
	}

	public HelpOutputIntrospector(PluginProcessRunner processRunner, Duration helpTimeout) {
		Assert.notNull(processRunner, "Process runner must not be null");
		Assert.notNull(helpTimeout, "Help timeout must not be null");
		this.processRunner = processRunner;
		this.helpTimeout = helpTimeout;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Plugin introspect(PluginLocator.Candidate candidate) {
		Assert.notNull(candidate, "Candidate must not be null");
		String name = candidate.name();
		if (!Files.isRegularFile(candidate.executablePath())) {
			throw new IntrospectionException(name, "Plugin executable not found: " + candidate.executablePath());
		}
		if (!candidate.isRunnable()) {
			throw new IntrospectionException(name,
					"Plugin executable is not executable and has no interpreter: " + candidate.executablePath());
		}

		List<ArgparseHelpParser.CommandEntry> entries = this.parser.parseCommands(help(candidate, List.of(HELP_FLAG)));
		if (entries.isEmpty()) {
			throw new IntrospectionException(name, "Plugin '" + name + "' declares no commands in its help output");
		}

		Map<String, Command> commands = new LinkedHashMap<>();
		for (ArgparseHelpParser.CommandEntry entry : entries) {
			if (commands.containsKey(entry.name())) {
				continue;
			}
			List<Parameter> parameters = this.parser
				.parseParameters(help(candidate, List.of(entry.name(), HELP_FLAG)));
			commands.put(entry.name(), new Command(entry.name(), entry.description(), parameters));
		}

		logger.debug("Introspected plugin '{}': commands {}", name, commands.keySet());
		return new Plugin(name, candidate.executablePath(), candidate.launchCommand(),
				new ArrayList<>(commands.values()));
	}

	private String help(PluginLocator.Candidate candidate, List<String> args) {
		List<String> command = new ArrayList<>(candidate.launchCommand());
		command.addAll(args);
		ProcessInvocation invocation = ProcessInvocation.of(command)
			.workingDirectory(candidate.executablePath().toAbsolutePath().getParent())
			.withTimeout(this.helpTimeout);

		ProcessResult result;
		try {
			result = this.processRunner.run(invocation);
		}
		catch (PluginExecutionException e) {
			throw new IntrospectionException(candidate.name(), e.getMessage(), e);
		}
		if (result.timedOut()) {
			throw new IntrospectionException(candidate.name(),
					"Help invocation " + args + " timed out after " + this.helpTimeout.toMillis() + " ms");
		}
		if (result.stdout().isBlank()) {
			throw new IntrospectionException(candidate.name(), "Help invocation " + args
					+ " produced no output (exit code " + result.exitCode() + ")" + stderrSuffix(result));
		}
		return result.stdout();
	}

	private static String stderrSuffix(ProcessResult result) {
		String stderr = result.stderr().strip();
		if (stderr.isEmpty()) {
			return "";
		}
		return ": " + (stderr.length() > 200 ? stderr.substring(0, 200) + "..." : stderr);
	}

	/**
	 * Builder for {@link HelpOutputIntrospector}.
	 */
	public static final class Builder {

		private PluginProcessRunner processRunner;

		private Duration timeout = DEFAULT_TIMEOUT;

		private Builder() {
		}

		/**
		 * Sets the runner used for help invocations. Defaults to a new
		 * {@link PluginProcessRunner}.
		 */
		public Builder processRunner(PluginProcessRunner processRunner) {
			this.processRunner = processRunner;
			return this;
		}

		/**
		 * Sets the timeout applied to each help invocation.
		 */
		public Builder helpTimeout(Duration timeout) {
			Assert.notNull(timeout, "Timeout must not be null");
			Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "Timeout must be positive");
			this.timeout = timeout;
			return this;
		}

		public HelpOutputIntrospector build() {
			PluginProcessRunner runner = this.processRunner != null ? this.processRunner : new PluginProcessRunner();
			return new HelpOutputIntrospector(runner, this.timeout);
		}

	}

}
