/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.cligateway.plugin;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the help text printed by argparse-style command-line programs.
 *
 * <p>
 * The top-level help yields the command list, read from the {@code {a,b,c}} choice group
 * of the usage line or, failing that, from a section whose title mentions commands
 * (such as an {@code Available commands:} epilog). The help of a single command yields
 * its parameters:
 * <ul>
 * <li>an option without metavar is a {@link ParameterType#FLAG}</li>
 * <li>a {@code {x,y}} metavar restricts the value to those choices</li>
 * <li>numeric metavars ({@code N}, {@code INT}, {@code FLOAT}, ...) give
 * {@link ParameterType#NUMBER}, every other metavar {@link ParameterType#STRING}</li>
 * <li>{@code (default: X)} in the help text sets the default</li>
 * <li>an option written outside square brackets in the usage line is required</li>
 * <li>entries of the {@code positional arguments:} section are required positionals</li>
 * </ul>
 */
public final class ArgparseHelpParser {

	private static final Pattern DEFAULT_VALUE = Pattern.compile("\\(default:\\s*([^)]*)\\)");

	private static final Pattern COMMAND_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");

	private static final Pattern OPTION_SEPARATOR = Pattern.compile(",\\s+(?=-)");

	private static final Set<String> NUMERIC_METAVARS = Set.of("N", "NUM", "NUMBER", "INT", "INTEGER", "FLOAT",
			"COUNT", "SECONDS", "PORT", "LIMIT");

	private static final Set<String> HELP_OPTIONS = Set.of("-h", "--help");

	/** Lines indented this far or more continue the previous entry's help text. */
	private static final int CONTINUATION_INDENT = 8;

	private static final String POSITIONAL_SECTION = "positional arguments";

	/**
	 * A command listed in a program's top-level help.
	 */
	public record CommandEntry(String name, String description) {
	}

	/**
	 * Extracts the commands declared in a program's top-level help.
	 * @param helpText output of {@code program --help}
	 * @return the commands in declaration order, empty if none are declared
	 */
	public List<CommandEntry> parseCommands(String helpText) {
		List<String> lines = helpText.lines().toList();
		List<String> choices = subcommandChoices(usageTokens(lines));

		Map<String, String> descriptions = new HashMap<>();
		List<CommandEntry> listed = new ArrayList<>();
		sections(lines).forEach((title, body) -> {
			boolean commandSection = title.contains("command");
			if (!commandSection && !title.equals(POSITIONAL_SECTION)) {
				return;
			}
			for (Entry entry : entries(body)) {
				if (!COMMAND_NAME.matcher(entry.spec()).matches()) {
					continue;
				}
				descriptions.putIfAbsent(entry.spec(), entry.help());
				if (commandSection && listed.stream().noneMatch(c -> c.name().equals(entry.spec()))) {
					listed.add(new CommandEntry(entry.spec(), entry.help()));
				}
			}
		});

		if (choices.isEmpty()) {
			return listed;
		}
		return choices.stream().map(name -> new CommandEntry(name, descriptions.get(name))).toList();
	}

	/**
	 * Extracts the parameters declared in the help of a single command.
	 * @param commandHelp output of {@code program <command> --help}
	 * @return parameters in declaration order, positionals first
	 */
	public List<Parameter> parseParameters(String commandHelp) {
		List<String> lines = commandHelp.lines().toList();
		Set<String> requiredOptions = requiredOptions(usageTokens(lines));

		Map<String, Parameter> positionals = new LinkedHashMap<>();
		Map<String, Parameter> options = new LinkedHashMap<>();
		sections(lines).forEach((title, body) -> {
			for (Entry entry : entries(body)) {
				if (entry.spec().startsWith("-")) {
					Parameter option = parseOption(entry, requiredOptions);
					if (option != null) {
						options.putIfAbsent(option.name(), option);
					}
				}
				else if (title.equals(POSITIONAL_SECTION) && !entry.spec().startsWith("{")) {
					String name = entry.spec().split("\\s+")[0];
					positionals.putIfAbsent(name, Parameter.positional(name, entry.help()));
				}
			}
		});

		List<Parameter> parameters = new ArrayList<>(positionals.values());
		options.values().stream().filter(o -> !positionals.containsKey(o.name())).forEach(parameters::add);
		return parameters;
	}

	private Parameter parseOption(Entry entry, Set<String> requiredOptions) {
		String chosenFlag = null;
		String metavar = null;
		boolean required = false;
		for (String form : OPTION_SEPARATOR.split(entry.spec())) {
			String[] parts = form.trim().split("\\s+", 2);
			String flag = parts[0];
			if (HELP_OPTIONS.contains(flag)) {
				return null;
			}
			if (chosenFlag == null || (!chosenFlag.startsWith("--") && flag.startsWith("--"))) {
				chosenFlag = flag;
			}
			if (parts.length > 1 && metavar == null) {
				metavar = parts[1].trim();
			}
			required |= requiredOptions.contains(flag);
		}
		if (chosenFlag == null) {
			return null;
		}
		String name = chosenFlag.replaceFirst("^-+", "");
		if (name.isEmpty()) {
			return null;
		}

		ParameterType type;
		List<String> choices = List.of();
		if (metavar == null) {
			type = ParameterType.FLAG;
		}
		else if (metavar.startsWith("{") && metavar.contains("}")) {
			type = ParameterType.STRING;
			choices = Arrays.stream(metavar.substring(1, metavar.indexOf('}')).split(","))
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.toList();
		}
		else if (NUMERIC_METAVARS.contains(metavar.toUpperCase(Locale.ROOT))) {
			type = ParameterType.NUMBER;
		}
		else {
			type = ParameterType.STRING;
		}

		String help = entry.help();
		Object defaultValue = type == ParameterType.FLAG ? null : defaultValue(help, type);
		return new Parameter(name, type, required, defaultValue, help, chosenFlag, choices);
	}

	private static Object defaultValue(String help, ParameterType type) {
		if (help == null) {
			return null;
		}
		Matcher matcher = DEFAULT_VALUE.matcher(help);
		if (!matcher.find()) {
			return null;
		}
		String raw = matcher.group(1).trim();
		if (raw.isEmpty() || raw.equals("None")) {
			return null;
		}
		if (type == ParameterType.NUMBER) {
			try {
				return Long.parseLong(raw);
			}
			catch (NumberFormatException notLong) {
				try {
					return Double.parseDouble(raw);
				}
				catch (NumberFormatException notDouble) {
					return raw;
				}
			}
		}
		return raw;
	}

	// ---------------------------
	// Usage line
	// ---------------------------

	private record UsageToken(String text, int depth) {
	}

	private static List<UsageToken> usageTokens(List<String> lines) {
		StringBuilder usage = new StringBuilder();
		boolean inUsage = false;
		for (String line : lines) {
			if (!inUsage) {
				if (line.stripLeading().toLowerCase(Locale.ROOT).startsWith("usage:")) {
					inUsage = true;
					usage.append(line.stripLeading().substring("usage:".length()));
				}
			}
			else if (!line.isBlank() && Character.isWhitespace(line.charAt(0))) {
				usage.append(' ').append(line.trim());
			}
			else {
				break;
			}
		}

		List<UsageToken> tokens = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		int depth = 0;
		String text = usage.toString();
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '{') {
				int end = text.indexOf('}', i);
				if (end < 0) {
					end = text.length() - 1;
				}
				current.append(text, i, end + 1);
				i = end;
			}
			else if (c == '[' || c == '(' || c == ']' || c == ')' || c == '|' || Character.isWhitespace(c)) {
				flush(current, depth, tokens);
				if (c == '[' || c == '(') {
					depth++;
				}
				else if (c == ']' || c == ')') {
					depth = Math.max(0, depth - 1);
				}
			}
			else {
				current.append(c);
			}
		}
		flush(current, depth, tokens);
		return tokens;
	}

	private static void flush(StringBuilder current, int depth, List<UsageToken> tokens) {
		if (current.length() > 0) {
			tokens.add(new UsageToken(current.toString(), depth));
			current.setLength(0);
		}
	}

	private static List<String> subcommandChoices(List<UsageToken> tokens) {
		for (int i = 0; i < tokens.size(); i++) {
			UsageToken token = tokens.get(i);
			if (token.depth() != 0 || !token.text().startsWith("{") || !token.text().endsWith("}")) {
				continue;
			}
			UsageToken previous = i > 0 ? tokens.get(i - 1) : null;
			boolean optionValue = previous != null && previous.depth() == 0 && previous.text().startsWith("-");
			if (optionValue) {
				continue;
			}
			String inner = token.text().substring(1, token.text().length() - 1);
			return Arrays.stream(inner.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
		}
		return List.of();
	}

	private static Set<String> requiredOptions(List<UsageToken> tokens) {
		Set<String> required = new HashSet<>();
		for (UsageToken token : tokens) {
			if (token.depth() == 0 && token.text().startsWith("-") && !HELP_OPTIONS.contains(token.text())) {
				required.add(token.text());
			}
		}
		return required;
	}

	// ---------------------------
	// Sections
	// ---------------------------

	private record Entry(String spec, String help, int indent) {
	}

	private static Map<String, List<String>> sections(List<String> lines) {
		Map<String, List<String>> sections = new LinkedHashMap<>();
		List<String> current = null;
		for (String line : lines) {
			if (isSectionTitle(line)) {
				String title = line.trim();
				title = title.substring(0, title.length() - 1).trim().toLowerCase(Locale.ROOT);
				current = sections.computeIfAbsent(title, t -> new ArrayList<>());
			}
			else if (current != null) {
				current.add(line);
			}
		}
		return sections;
	}

	private static boolean isSectionTitle(String line) {
		if (line.isBlank() || Character.isWhitespace(line.charAt(0))) {
			return false;
		}
		String trimmed = line.trim();
		return trimmed.endsWith(":") && !trimmed.toLowerCase(Locale.ROOT).startsWith("usage:");
	}

	private static List<Entry> entries(List<String> body) {
		List<Entry> entries = new ArrayList<>();
		for (String line : body) {
			if (line.isBlank()) {
				continue;
			}
			int indent = indentOf(line);
			String trimmed = line.trim();
			Entry last = entries.isEmpty() ? null : entries.get(entries.size() - 1);
			if (last != null && indent >= CONTINUATION_INDENT && indent > last.indent()) {
				String help = last.help() == null ? trimmed : last.help() + " " + trimmed;
				entries.set(entries.size() - 1, new Entry(last.spec(), help, last.indent()));
				continue;
			}
			int gap = trimmed.indexOf("  ");
			if (gap < 0) {
				entries.add(new Entry(trimmed, null, indent));
			}
			else {
				entries.add(new Entry(trimmed.substring(0, gap), trimmed.substring(gap).trim(), indent));
			}
		}
		return entries;
	}

	private static int indentOf(String line) {
		int indent = 0;
		while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) {
			indent++;
		}
		return indent;
	}

}
