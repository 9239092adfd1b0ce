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
package com.tomaszrup.luafmt.formatter;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.luafmt.config.FormatterConfig;
import com.tomaszrup.luafmt.syntax.CstPrinter;
import com.tomaszrup.luafmt.syntax.LuaParser;
import com.tomaszrup.luafmt.syntax.ParseException;
import com.tomaszrup.luafmt.syntax.ast.Ast;
import com.tomaszrup.luafmt.config.TableSeparators;

class TableFormatterTests {

	private static String format(String source) throws ParseException {
		return format(source, new FormatterConfig());
	}

	private static String format(String source, FormatterConfig config) throws ParseException {
		Ast ast = LuaParser.parse(source, config.getSyntax());
		return CstPrinter.print(CodeFormatter.format(ast, config, null));
	}

	// ------------------------------------------------------------------
	// Single line
	// ------------------------------------------------------------------

	@Test
	void testEmptyTable() throws Exception {
		Assertions.assertEquals("t = {}\n", format("t = { }"));
	}

	@Test
	void testEmptyTableWithExtraSpace() throws Exception {
		FormatterConfig config = new FormatterConfig().withExtraSpaceInEmptyTable(true);
		Assertions.assertEquals("t = { }\n", format("t = {}", config));
	}

	@Test
	void testSeparatorsAreNormalized() throws Exception {
		Assertions.assertEquals("t = { 1, 2, 3 }\n", format("t = {1;2;3;}"));
	}

	@Test
	void testSemicolonSeparatorsWithTrailingSeparator() throws Exception {
		FormatterConfig config = new FormatterConfig().withTableSeparators(TableSeparators.SEMICOLON)
				.withExtraSepAtTableEnd(true);
		Assertions.assertEquals("t = { 1; 2; }\n", format("t = {1,2}", config));
	}

	@Test
	void testNoSpacesInsideTable() throws Exception {
		FormatterConfig config = new FormatterConfig().withExtraSpacesInsideTable(false);
		Assertions.assertEquals("t = {1, 2}\n", format("t = { 1 , 2 }", config));
	}

	@Test
	void testKeyedFields() throws Exception {
		Assertions.assertEquals("t = { a = 1, [\"b\"] = 2 }\n", format("t = {a=1,['b']=2}"));
	}

	// ------------------------------------------------------------------
	// Multi line
	// ------------------------------------------------------------------

	@Test
	void testCommentExpandsTable() throws Exception {
		Assertions.assertEquals("t = {\n\ta = 1, -- one\n\tb = 2,\n}\n", format("t = { a = 1, -- one\n b = 2 }"));
	}

	@Test
	void testTooWideTableExpands() throws Exception {
		FormatterConfig config = new FormatterConfig().withColumnWidth(20);
		Assertions.assertEquals("local t = {\n\talpha = 1,\n\tbeta = 2,\n}\n",
				format("local t = { alpha = 1, beta = 2 }", config));
	}
}
