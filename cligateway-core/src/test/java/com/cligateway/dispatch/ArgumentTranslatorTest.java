/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.dispatch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cligateway.plugin.Command;
import com.cligateway.plugin.Parameter;
import com.cligateway.plugin.ParameterType;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ArgumentTranslator}.
 */
class ArgumentTranslatorTest {

	private final ArgumentTranslator translator = new ArgumentTranslator(McpJsonMapper.getDefault());

	private final Command command = new Command("run", null,
			List.of(Parameter.positional("source", "File"), Parameter.option("param", "--param", ParameterType.STRING, false),
					Parameter.option("dry-run", "--dry-run", ParameterType.FLAG, false),
					Parameter.option("count", "-n", ParameterType.NUMBER, false),
					Parameter.option("enabled", "--enabled", ParameterType.BOOLEAN, false)));

	private static Map<String, Object> args(Object... keyValues) {
		Map<String, Object> map = new LinkedHashMap<>();
		for (int i = 0; i < keyValues.length; i += 2) {
			map.put((String) keyValues[i], keyValues[i + 1]);
		}
		return map;
	}

	@Test
	void emptyArgumentsGiveNoArgv() {
		assertThat(translator.translate(command, Map.of())).isEmpty();
		assertThat(translator.translate(command, null)).isEmpty();
	}

	@Test
	void optionWithValue() {
		assertThat(translator.translate(command, args("param", "test_value"))).containsExactly("--param",
				"test_value");
	}

	@Test
	void positionalsComeFirst() {
		assertThat(translator.translate(command, args("param", "v", "source", "a.txt"))).containsExactly("a.txt",
				"--param", "v");
	}

	@Test
	void flagsAreSwitches() {
		assertThat(translator.translate(command, args("dry-run", true))).containsExactly("--dry-run");
		assertThat(translator.translate(command, args("dry-run", false))).isEmpty();
	}

	@Test
	void flagsAcceptTextAndNumbers() {
		assertThat(translator.translate(command, args("dry-run", "true"))).containsExactly("--dry-run");
		assertThat(translator.translate(command, args("dry-run", "TRUE"))).containsExactly("--dry-run");
		assertThat(translator.translate(command, args("dry-run", "false"))).isEmpty();
		assertThat(translator.translate(command, args("dry-run", 1))).containsExactly("--dry-run");
		assertThat(translator.translate(command, args("dry-run", 0))).isEmpty();
	}

	@Test
	void textBooleansStayValuesForNonFlags() {
		assertThat(translator.translate(command, args("param", "true"))).containsExactly("--param", "true");
		assertThat(translator.translate(command, args("enabled", "false"))).containsExactly("--enabled", "false");
	}

	@Test
	void underscoreKeyMatchesDashedParameter() {
		assertThat(translator.translate(command, args("dry_run", true))).containsExactly("--dry-run");
	}

	@Test
	void booleanTypedParameterTakesValue() {
		assertThat(translator.translate(command, args("enabled", false))).containsExactly("--enabled", "false");
	}

	@Test
	void declaredSpellingIsUsed() {
		assertThat(translator.translate(command, args("count", 3))).containsExactly("-n", "3");
	}

	@Test
	void nullValuesAreSkipped() {
		assertThat(translator.translate(command, args("param", null))).isEmpty();
	}

	@Test
	void collectionsRepeatValues() {
		assertThat(translator.translate(command, args("param", List.of("a", "b")))).containsExactly("--param", "a",
				"b");
	}

	@Test
	void nestedObjectsArePassedAsJson() {
		List<String> argv = translator.translate(command, args("param", Map.of("k", 1)));

		assertThat(argv).containsExactly("--param", "{\"k\":1}");
	}

	@Test
	void unknownKeysArePassedThrough() {
		assertThat(translator.translate(command, args("extra", "x", "verbose", true))).containsExactly("--extra", "x",
				"--verbose");
	}

}
