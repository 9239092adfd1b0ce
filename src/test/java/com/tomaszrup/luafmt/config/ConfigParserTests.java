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

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonNull;
import com.tomaszrup.luafmt.syntax.LuaDialect;

/**
 * Unit tests for {@link ConfigParser}.
 */
class ConfigParserTests {

	// ------------------------------------------------------------------
	// Defaults
	// ------------------------------------------------------------------

	@Test
	void testEmptyObjectGivesDefaults() {
		Assertions.assertEquals(new FormatterConfig(), ConfigParser.parse("{}"));
	}

	@Test
	void testNullGivesDefaults() {
		Assertions.assertEquals(new FormatterConfig(), ConfigParser.parse(JsonNull.INSTANCE));
		Assertions.assertEquals(new FormatterConfig(), ConfigParser.parse("null"));
	}

	@Test
	void testDefaultValues() {
		FormatterConfig config = new FormatterConfig();
		Assertions.assertEquals(120, config.getColumnWidth());
		Assertions.assertEquals(LineEndings.UNIX, config.getLineEndings());
		Assertions.assertEquals(IndentType.TABS, config.getIndentType());
		Assertions.assertEquals(4, config.getIndentWidth());
		Assertions.assertEquals(QuoteStyle.AUTO_PREFER_DOUBLE, config.getQuoteStyle());
		Assertions.assertFalse(config.isNoCallParentheses());
		Assertions.assertEquals(TableSeparators.COMMA, config.getTableSeparators());
		Assertions.assertFalse(config.isExtraSepAtTableEnd());
		Assertions.assertTrue(config.isExtraSpacesInsideTable());
		Assertions.assertFalse(config.isExtraSpaceInEmptyTable());
		Assertions.assertEquals(LuaDialect.ALL, config.getSyntax());
	}

	// ------------------------------------------------------------------
	// Keys and values
	// ------------------------------------------------------------------

	@Test
	void testCamelCaseKeys() {
		FormatterConfig config = ConfigParser.parse("{\"columnWidth\": 80, \"indentType\": \"Spaces\", "
				+ "\"indentWidth\": 2, \"noCallParentheses\": true, \"syntax\": \"Luau\"}");
		Assertions.assertEquals(80, config.getColumnWidth());
		Assertions.assertEquals(IndentType.SPACES, config.getIndentType());
		Assertions.assertEquals(2, config.getIndentWidth());
		Assertions.assertTrue(config.isNoCallParentheses());
		Assertions.assertEquals(LuaDialect.LUAU, config.getSyntax());
	}

	@Test
	void testSnakeCaseKeys() {
		FormatterConfig config = ConfigParser.parse("{\"column_width\": 100, \"line_endings\": \"Windows\", "
				+ "\"quote_style\": \"ForceSingle\", \"table_separators\": \"SEMICOLON\", "
				+ "\"extra_sep_at_table_end\": true, \"extra_spaces_inside_table\": false, "
				+ "\"extra_space_in_empty_table\": true}");
		Assertions.assertEquals(100, config.getColumnWidth());
		Assertions.assertEquals(LineEndings.WINDOWS, config.getLineEndings());
		Assertions.assertEquals(QuoteStyle.FORCE_SINGLE, config.getQuoteStyle());
		Assertions.assertEquals(TableSeparators.SEMICOLON, config.getTableSeparators());
		Assertions.assertTrue(config.isExtraSepAtTableEnd());
		Assertions.assertFalse(config.isExtraSpacesInsideTable());
		Assertions.assertTrue(config.isExtraSpaceInEmptyTable());
	}

	@Test
	void testEnumSpellings() {
		Assertions.assertEquals(QuoteStyle.AUTO_PREFER_SINGLE,
				ConfigParser.parse("{\"quoteStyle\": \"AutoPreferSingle\"}").getQuoteStyle());
		Assertions.assertEquals(QuoteStyle.AUTO_PREFER_SINGLE,
				ConfigParser.parse("{\"quoteStyle\": \"AUTO_PREFER_SINGLE\"}").getQuoteStyle());
		Assertions.assertEquals(LuaDialect.LUA52, ConfigParser.parse("{\"syntax\": \"lua52\"}").getSyntax());
	}

	@Test
	void testParseFile(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("luafmt.json");
		Files.write(file, "{\"columnWidth\": 60}".getBytes(StandardCharsets.UTF_8));
		Assertions.assertEquals(60, ConfigParser.parse(file).getColumnWidth());
	}

	// ------------------------------------------------------------------
	// Errors
	// ------------------------------------------------------------------

	@Test
	void testUnknownKey() {
		ConfigException e = Assertions.assertThrows(ConfigException.class,
				() -> ConfigParser.parse("{\"columnWidht\": 80}"));
		Assertions.assertEquals("columnWidht", e.getKey());
	}

	@Test
	void testWrongValueType() {
		ConfigException e = Assertions.assertThrows(ConfigException.class,
				() -> ConfigParser.parse("{\"column_width\": \"wide\"}"));
		Assertions.assertEquals("column_width", e.getKey());
	}

	@Test
	void testNonPositiveWidth() {
		Assertions.assertThrows(ConfigException.class, () -> ConfigParser.parse("{\"indentWidth\": 0}"));
	}

	@Test
	void testBooleanExpected() {
		Assertions.assertThrows(ConfigException.class, () -> ConfigParser.parse("{\"noCallParentheses\": 1}"));
	}

	@Test
	void testUnknownEnumValue() {
		ConfigException e = Assertions.assertThrows(ConfigException.class,
				() -> ConfigParser.parse("{\"syntax\": \"Lua99\"}"));
		Assertions.assertTrue(e.getMessage().contains("Lua99"), e.getMessage());
	}

	@Test
	void testObjectValueRejected() {
		Assertions.assertThrows(ConfigException.class, () -> ConfigParser.parse("{\"syntax\": {}}"));
	}

	@Test
	void testNotAnObject() {
		ConfigException e = Assertions.assertThrows(ConfigException.class, () -> ConfigParser.parse("[1, 2]"));
		Assertions.assertNull(e.getKey());
	}

	@Test
	void testMalformedDocument() {
		ConfigException e = Assertions.assertThrows(ConfigException.class, () -> ConfigParser.parse("{"));
		Assertions.assertNull(e.getKey());
		Assertions.assertNotNull(e.getCause());
	}
}
