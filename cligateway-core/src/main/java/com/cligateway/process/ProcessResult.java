/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.process;

import java.time.Duration;

/**
 * Captured outcome of a finished (or killed) subprocess.
 *
 * @param stdout Captured standard output, decoded as UTF-8
 * @param stderr Captured standard error, decoded as UTF-8
 * @param exitCode The exit code; -1 when the process was killed on timeout
 * @param timedOut Whether the process was killed because it exceeded its timeout
 * @param elapsed Wall-clock time between start and exit
 */
public record ProcessResult(
		String stdout,
		String stderr,
		int exitCode,
		boolean timedOut,
		Duration elapsed
) {

	/**
	 * Returns true if the process completed successfully (exit code 0).
	 * @return true if exit code is 0 and the process did not time out
	 */
	public boolean success() {
		return exitCode == 0 && !timedOut;
	}

}
