/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.process;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import com.cligateway.error.PluginExecutionException;
import com.cligateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs plugin executables as child processes and captures their output.
 *
 * <p>
 * Each {@link #run(ProcessInvocation)} call owns its process: nothing is shared between
 * calls except the daemon pool that drains the output pipes, so any number of calls may
 * run at the same time. Standard output and standard error are drained concurrently so
 * a chatty child can never block on a full pipe.
 * </p>
 */
public class PluginProcessRunner implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(PluginProcessRunner.class);

	/** How long to wait for the output pipes to close once the process is gone. */
	private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

	private final ExecutorService streamExecutor;

	public PluginProcessRunner() {
		AtomicInteger counter = new AtomicInteger();
		this.streamExecutor = Executors.newCachedThreadPool(r -> {
			Thread t = new Thread(r, "cligateway-process-io-" + counter.incrementAndGet());
			t.setDaemon(true);
			return t;
		});
	}

	/**
	 * Starts the process, waits for it to exit or time out, and returns what it wrote.
	 * @param invocation what to run
	 * @return the captured result; a timed-out process is killed and reported through
	 * {@link ProcessResult#timedOut()}
	 * @throws PluginExecutionException if the process cannot be started or the calling
	 * thread is interrupted while waiting
	 */
	public ProcessResult run(ProcessInvocation invocation) {
		Assert.notNull(invocation, "Invocation must not be null");

		ProcessBuilder builder = new ProcessBuilder(invocation.command());
		if (invocation.workingDirectory() != null) {
			builder.directory(invocation.workingDirectory().toFile());
		}
		builder.environment().putAll(invocation.environment());

		long startNanos = System.nanoTime();
		Process process;
		try {
			process = builder.start();
		}
		catch (IOException e) {
			throw new PluginExecutionException(
					"Failed to start '" + invocation.executable() + "': " + e.getMessage(), e);
		}
		logger.debug("Started pid {}: {}", process.pid(), invocation.command());

		try {
			process.getOutputStream().close();
		}
		catch (IOException e) {
			logger.debug("Could not close stdin of pid {}", process.pid(), e);
		}

		long limit = invocation.outputByteLimit();
		Future<String> stdout = this.streamExecutor.submit(() -> capture(process.getInputStream(), limit));
		Future<String> stderr = this.streamExecutor.submit(() -> capture(process.getErrorStream(), limit));

		boolean timedOut = false;
		try {
			if (!process.waitFor(invocation.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
				timedOut = true;
				logger.warn("Process {} exceeded {} ms, killing it", invocation.executable(),
						invocation.timeout().toMillis());
				kill(process);
			}
		}
		catch (InterruptedException e) {
			kill(process);
			Thread.currentThread().interrupt();
			throw new PluginExecutionException("Interrupted while waiting for '" + invocation.executable() + "'", e);
		}

		Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
		int exitCode = timedOut ? -1 : process.exitValue();
		String out = collect(stdout, "stdout", process);
		String err = collect(stderr, "stderr", process);
		logger.debug("Process {} finished: exit={}, timedOut={}, elapsed={} ms", process.pid(), exitCode, timedOut,
				elapsed.toMillis());
		return new ProcessResult(out, err, exitCode, timedOut, elapsed);
	}

	private static void kill(Process process) {
		process.descendants().forEach(ProcessHandle::destroyForcibly);
		process.destroyForcibly();
		try {
			process.waitFor(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	private static String capture(InputStream stream, long limit) throws IOException {
		ByteArrayOutputStream captured = new ByteArrayOutputStream();
		byte[] buffer = new byte[8192];
		boolean truncated = false;
		try (InputStream in = stream) {
			int read;
			while ((read = in.read(buffer)) != -1) {
				long room = limit - captured.size();
				if (room < read) {
					truncated = true;
				}
				if (room > 0) {
					captured.write(buffer, 0, (int) Math.min(room, read));
				}
			}
		}
		if (!truncated) {
			return captured.toString(StandardCharsets.UTF_8);
		}
		byte[] bytes = captured.toByteArray();
		return new String(bytes, 0, completeUtf8Length(bytes, bytes.length), StandardCharsets.UTF_8);
	}

	/**
	 * Length of the prefix that does not end inside a multi-byte UTF-8 sequence.
	 */
	static int completeUtf8Length(byte[] bytes, int length) {
		int lead = length - 1;
		int continuations = 0;
		while (lead >= 0 && continuations < 3 && (bytes[lead] & 0xC0) == 0x80) {
			lead--;
			continuations++;
		}
		if (lead < 0) {
			return length;
		}
		int b = bytes[lead] & 0xFF;
		int expected = (b >= 0xF0) ? 4 : (b >= 0xE0) ? 3 : (b >= 0xC0) ? 2 : 1;
		return (continuations + 1 < expected) ? lead : length;
	}

	private static String collect(Future<String> output, String streamName, Process process) {
		try {
			return output.get(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException e) {
			// a grandchild may still hold the pipe open
			output.cancel(true);
			logger.warn("Gave up draining {} of pid {}", streamName, process.pid());
			return "";
		}
		catch (ExecutionException e) {
			logger.warn("Failed reading {} of pid {}", streamName, process.pid(), e.getCause());
			return "";
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PluginExecutionException("Interrupted while reading " + streamName, e);
		}
	}

	@Override
	public void close() {
		this.streamExecutor.shutdownNow();
	}

}
