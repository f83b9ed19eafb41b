/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Health accounting reported by {@code GET /health}.
 *
 * @param status Always "ok" while the gateway answers
 * @param plugins Number of registered plugins
 * @param sessions Number of sessions not yet closed
 */
public record HealthStatus(@JsonProperty("status") String status, @JsonProperty("plugins") int plugins,
		@JsonProperty("sessions") int sessions) {

	public static HealthStatus ok(int plugins, int sessions) {
		return new HealthStatus("ok", plugins, sessions);
	}

}
