/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.util;

import java.util.Collection;

/**
 * Argument assertions used by builders and constructors. Failures surface as
 * {@link IllegalArgumentException}.
 */
public final class Assert {

	private Assert() {
	}

	public static void notNull(Object object, String message) {
		if (object == null) {
			throw new IllegalArgumentException(message);
		}
	}

	public static void hasText(String text, String message) {
		if (text == null || text.isBlank()) {
			throw new IllegalArgumentException(message);
		}
	}

	public static void isTrue(boolean expression, String message) {
		if (!expression) {
			throw new IllegalArgumentException(message);
		}
	}

	public static void notEmpty(Collection<?> collection, String message) {
		if (collection == null || collection.isEmpty()) {
			throw new IllegalArgumentException(message);
		}
	}

}
