////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.luafmt.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.luafmt.syntax.LuaDialect;

/**
 * Builds a {@link FormatterConfig} from a JSON object. Keys may be written in
 * camelCase ({@code columnWidth}) or snake_case ({@code column_width}); enum
 * values accept both {@code AutoPreferDouble} and {@code AUTO_PREFER_DOUBLE}
 * spellings. Unknown keys are rejected. Missing keys keep their defaults.
 */
public final class ConfigParser {

	private static final Logger logger = LoggerFactory.getLogger(ConfigParser.class);

	private static final String COLUMN_WIDTH_OPTION = "columnWidth";
	private static final String LINE_ENDINGS_OPTION = "lineEndings";
	private static final String INDENT_TYPE_OPTION = "indentType";
	private static final String INDENT_WIDTH_OPTION = "indentWidth";
	private static final String QUOTE_STYLE_OPTION = "quoteStyle";
	private static final String NO_CALL_PARENTHESES_OPTION = "noCallParentheses";
	private static final String TABLE_SEPARATORS_OPTION = "tableSeparators";
	private static final String EXTRA_SEP_AT_TABLE_END_OPTION = "extraSepAtTableEnd";
	private static final String EXTRA_SPACES_INSIDE_TABLE_OPTION = "extraSpacesInsideTable";
	private static final String EXTRA_SPACE_IN_EMPTY_TABLE_OPTION = "extraSpaceInEmptyTable";
	private static final String SYNTAX_OPTION = "syntax";

	private static final Map<String, String> OPTIONS_BY_NORMALIZED_KEY = Map.ofEntries(
			entry(COLUMN_WIDTH_OPTION),
			entry(LINE_ENDINGS_OPTION),
			entry(INDENT_TYPE_OPTION),
			entry(INDENT_WIDTH_OPTION),
			entry(QUOTE_STYLE_OPTION),
			entry(NO_CALL_PARENTHESES_OPTION),
			entry(TABLE_SEPARATORS_OPTION),
			entry(EXTRA_SEP_AT_TABLE_END_OPTION),
			entry(EXTRA_SPACES_INSIDE_TABLE_OPTION),
			entry(EXTRA_SPACE_IN_EMPTY_TABLE_OPTION),
			entry(SYNTAX_OPTION));

	private ConfigParser() {
	}

	private static Map.Entry<String, String> entry(String option) {
		return Map.entry(normalize(option), option);
	}

	public static FormatterConfig parse(String json) {
		JsonElement element;
		try {
			element = JsonParser.parseString(json);
		} catch (JsonParseException e) {
			throw new ConfigException("Malformed configuration document: " + e.getMessage(), e);
		}
		return parse(element);
	}

	public static FormatterConfig parse(Path file) throws IOException {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			FormatterConfig config = parse(JsonParser.parseReader(reader));
			logger.info("Loaded formatter configuration from {}", file);
			return config;
		} catch (JsonParseException e) {
			throw new ConfigException("Malformed configuration file " + file + ": " + e.getMessage(), e);
		}
	}

	public static FormatterConfig parse(JsonElement element) {
		if (element == null || element.isJsonNull()) {
			return new FormatterConfig();
		}
		if (!element.isJsonObject()) {
			throw new ConfigException("Configuration must be a JSON object", (Throwable) null);
		}
		JsonObject opts = element.getAsJsonObject();
		FormatterConfig config = new FormatterConfig();
		for (Map.Entry<String, JsonElement> entry : opts.entrySet()) {
			String option = OPTIONS_BY_NORMALIZED_KEY.get(normalize(entry.getKey()));
			if (option == null) {
				throw new ConfigException(entry.getKey(), "unknown option");
			}
			config = apply(config, option, entry.getKey(), entry.getValue());
		}
		logger.debug("Parsed formatter configuration: {}", config);
		return config;
	}

	private static FormatterConfig apply(FormatterConfig config, String option, String key, JsonElement value) {
		switch (option) {
			case COLUMN_WIDTH_OPTION:
				return config.withColumnWidth(positiveInt(key, value));
			case LINE_ENDINGS_OPTION:
				return config.withLineEndings(enumValue(LineEndings.class, key, value));
			case INDENT_TYPE_OPTION:
				return config.withIndentType(enumValue(IndentType.class, key, value));
			case INDENT_WIDTH_OPTION:
				return config.withIndentWidth(positiveInt(key, value));
			case QUOTE_STYLE_OPTION:
				return config.withQuoteStyle(enumValue(QuoteStyle.class, key, value));
			case NO_CALL_PARENTHESES_OPTION:
				return config.withNoCallParentheses(bool(key, value));
			case TABLE_SEPARATORS_OPTION:
				return config.withTableSeparators(enumValue(TableSeparators.class, key, value));
			case EXTRA_SEP_AT_TABLE_END_OPTION:
				return config.withExtraSepAtTableEnd(bool(key, value));
			case EXTRA_SPACES_INSIDE_TABLE_OPTION:
				return config.withExtraSpacesInsideTable(bool(key, value));
			case EXTRA_SPACE_IN_EMPTY_TABLE_OPTION:
				return config.withExtraSpaceInEmptyTable(bool(key, value));
			case SYNTAX_OPTION:
				return config.withSyntax(enumValue(LuaDialect.class, key, value));
			default:
				throw new IllegalStateException("unhandled option " + option);
		}
	}

	private static int positiveInt(String key, JsonElement value) {
		JsonPrimitive primitive = primitive(key, value);
		if (!primitive.isNumber()) {
			throw new ConfigException(key, "expected a number but got " + value);
		}
		int result;
		try {
			result = primitive.getAsInt();
		} catch (NumberFormatException e) {
			throw new ConfigException(key, "expected an integer but got " + value);
		}
		if (result <= 0) {
			throw new ConfigException(key, "expected a positive integer but got " + result);
		}
		return result;
	}

	private static boolean bool(String key, JsonElement value) {
		JsonPrimitive primitive = primitive(key, value);
		if (!primitive.isBoolean()) {
			throw new ConfigException(key, "expected a boolean but got " + value);
		}
		return primitive.getAsBoolean();
	}

	private static <E extends Enum<E>> E enumValue(Class<E> type, String key, JsonElement value) {
		JsonPrimitive primitive = primitive(key, value);
		if (!primitive.isString()) {
			throw new ConfigException(key, "expected a string but got " + value);
		}
		String wanted = normalize(primitive.getAsString());
		for (E constant : type.getEnumConstants()) {
			if (normalize(constant.name()).equals(wanted)) {
				return constant;
			}
		}
		throw new ConfigException(key, "unknown value '" + primitive.getAsString() + "'");
	}

	private static JsonPrimitive primitive(String key, JsonElement value) {
		if (value == null || !value.isJsonPrimitive()) {
			throw new ConfigException(key, "expected a primitive value but got " + value);
		}
		return value.getAsJsonPrimitive();
	}

	private static String normalize(String name) {
		return name.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
	}
}
