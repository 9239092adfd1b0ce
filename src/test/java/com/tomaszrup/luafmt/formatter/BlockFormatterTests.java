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

/**
 * Statement separation inside blocks: semicolons, blank lines and the
 * comments at the end of the file.
 */
class BlockFormatterTests {

	private static String format(String source) throws ParseException {
		return format(source, new FormatterConfig());
	}

	private static String format(String source, FormatterConfig config) throws ParseException {
		Ast ast = LuaParser.parse(source, config.getSyntax());
		return CstPrinter.print(CodeFormatter.format(ast, config, null));
	}

	// ------------------------------------------------------------------
	// Semicolons
	// ------------------------------------------------------------------

	@Test
	void testRedundantSemicolonsAreRemoved() throws Exception {
		Assertions.assertEquals("a = 1\nb = 2\n", format("a = 1; b = 2;"));
	}

	@Test
	void testSemicolonBeforeParenthesizedStatementIsKept() throws Exception {
		Assertions.assertEquals("a = f;\n(g)()\n", format("a = f;\n(g)()"));
	}

	@Test
	void testCommentAfterRemovedSemicolonIsKept() throws Exception {
		Assertions.assertEquals("a = 1 -- note\nb = 2\n", format("a = 1; -- note\nb = 2"));
	}

	// ------------------------------------------------------------------
	// Blank lines
	// ------------------------------------------------------------------

	@Test
	void testBlankLinesCollapseToOne() throws Exception {
		Assertions.assertEquals("a = 1\n\nb = 2\n", format("a = 1\n\n\n\nb = 2"));
	}

	@Test
	void testBlankLineAtBlockStartIsRemoved() throws Exception {
		Assertions.assertEquals("do\n\tx()\nend\n", format("do\n\n\tx()\nend"));
	}

	@Test
	void testBlankLineBeforeCommentIsKept() throws Exception {
		Assertions.assertEquals("a = 1\n\n-- c\nb = 2\n", format("a = 1\n\n-- c\nb = 2"));
	}

	@Test
	void testBlankLineAfterLeadingCommentIsKept() throws Exception {
		Assertions.assertEquals("-- c\n\nb = 2\n", format("-- c\n\nb = 2"));
	}

	@Test
	void testCommentsInsideBlockAreIndented() throws Exception {
		Assertions.assertEquals("do\n\t-- inside\n\tx()\nend\n", format("do\n-- inside\nx()\nend"));
	}

	// ------------------------------------------------------------------
	// End of file
	// ------------------------------------------------------------------

	@Test
	void testTrailingCommentBlockIsKept() throws Exception {
		Assertions.assertEquals("x = 1\n\n-- trailing\n", format("x = 1\n\n-- trailing\n"));
	}

	@Test
	void testTrailingCommentGetsNewline() throws Exception {
		Assertions.assertEquals("x = 1\n-- trailing\n", format("x = 1\n-- trailing"));
	}

	@Test
	void testCommentOnlyFile() throws Exception {
		Assertions.assertEquals("-- only\n", format("-- only"));
	}

	@Test
	void testEmptyFile() throws Exception {
		Assertions.assertEquals("", format(""));
	}

	@Test
	void testWhitespaceOnlyFile() throws Exception {
		Assertions.assertEquals("", format("  \n\n\t"));
	}
}
