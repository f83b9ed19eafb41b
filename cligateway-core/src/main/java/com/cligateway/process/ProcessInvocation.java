/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.cligateway.util.Assert;

/**
 * A single subprocess execution request.
 *
 * <p>
 * Example usage:
 * <pre>{@code
 * ProcessInvocation invocation = ProcessInvocation.of("/plugins/weather/cli", "forecast", "--city", "Oslo")
 *     .workingDirectory(Path.of("/plugins/weather"))
 *     .withTimeout(Duration.ofSeconds(30))
 *     .outputByteLimit(64 * 1024);
 * }</pre>
 *
 * @param command The executable followed by its arguments
 * @param workingDirectory The working directory (null to inherit the gateway's)
 * @param environment Extra environment variables (empty for none)
 * @param timeout Maximum wall-clock time before the process is killed
 * @param outputByteLimit Maximum bytes captured per output stream; the rest is drained
 * and discarded
 * @see PluginProcessRunner
 */
public record ProcessInvocation(
		List<String> command,
		Path workingDirectory,
		Map<String, String> environment,
		Duration timeout,
		long outputByteLimit
) {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	public static final long DEFAULT_OUTPUT_BYTE_LIMIT = 1024 * 1024;

	public ProcessInvocation {
		Assert.notEmpty(command, "Command must not be empty");
		Assert.notNull(timeout, "Timeout must not be null");
		Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "Timeout must be positive");
		Assert.isTrue(outputByteLimit > 0, "Output byte limit must be positive");
		command = List.copyOf(command);
		environment = environment == null ? Map.of() : Map.copyOf(environment);
	}

	/**
	 * Creates an invocation from an executable and its arguments with default timeout
	 * and output limit.
	 * @param commandAndArgs The executable followed by its arguments
	 * @return A new invocation
	 */
	public static ProcessInvocation of(String... commandAndArgs) {
		if (commandAndArgs == null || commandAndArgs.length == 0) {
			throw new IllegalArgumentException("At least one argument (the executable) is required");
		}
		return of(Arrays.asList(commandAndArgs));
	}

	public static ProcessInvocation of(List<String> commandAndArgs) {
		return new ProcessInvocation(commandAndArgs, null, Map.of(), DEFAULT_TIMEOUT, DEFAULT_OUTPUT_BYTE_LIMIT);
	}

	public ProcessInvocation workingDirectory(Path directory) {
		return new ProcessInvocation(command, directory, environment, timeout, outputByteLimit);
	}

	public ProcessInvocation environment(Map<String, String> env) {
		return new ProcessInvocation(command, workingDirectory, env, timeout, outputByteLimit);
	}

	public ProcessInvocation withTimeout(Duration limit) {
		return new ProcessInvocation(command, workingDirectory, environment, limit, outputByteLimit);
	}

	public ProcessInvocation outputByteLimit(long limit) {
		return new ProcessInvocation(command, workingDirectory, environment, timeout, limit);
	}

	/**
	 * Returns the executable, i.e. the first element of {@link #command()}.
	 * @return the executable
	 */
	public String executable() {
		return command.get(0);
	}

}
