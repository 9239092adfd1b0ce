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
 * Function declarations, anonymous functions and call arguments.
 */
class FunctionFormatterTests {

	private static String format(String source) throws ParseException {
		return format(source, new FormatterConfig());
	}

	private static String format(String source, FormatterConfig config) throws ParseException {
		Ast ast = LuaParser.parse(source, config.getSyntax());
		return CstPrinter.print(CodeFormatter.format(ast, config, null));
	}

	// ------------------------------------------------------------------
	// Declarations
	// ------------------------------------------------------------------

	@Test
	void testLocalFunction() throws Exception {
		Assertions.assertEquals("local function f(a, b)\n\treturn a + b\nend\n",
				format("local function f(a,b) return a+b end"));
	}

	@Test
	void testEmptyFunctionStaysOnOneLine() throws Exception {
		Assertions.assertEquals("function M.new:init() end\n", format("function M.new:init() end"));
	}

	@Test
	void testVarargParameter() throws Exception {
		Assertions.assertEquals("function f(a, ...)\n\treturn ...\nend\n", format("function f(a,...) return ... end"));
	}

	// ------------------------------------------------------------------
	// Anonymous functions
	// ------------------------------------------------------------------

	@Test
	void testEmptyAnonymousFunction() throws Exception {
		Assertions.assertEquals("f = function() end\n", format("f = function ( ) end"));
	}

	@Test
	void testAnonymousFunctionBody() throws Exception {
		Assertions.assertEquals("f = function()\n\treturn 1\nend\n", format("f = function() return 1 end"));
	}

	@Test
	void testFunctionArgumentBody() throws Exception {
		Assertions.assertEquals("pcall(function()\n\tx()\nend)\n", format("pcall(function() x() end)"));
	}

	@Test
	void testNestedFunctionArgumentIndentation() throws Exception {
		Assertions.assertEquals("do\n\tf(function()\n\t\tx()\n\tend)\nend\n", format("do f(function() x() end) end"));
	}

	// ------------------------------------------------------------------
	// Call arguments
	// ------------------------------------------------------------------

	@Test
	void testArgumentsAreSpaced() throws Exception {
		Assertions.assertEquals("print(a, b, c)\n", format("print ( a,b , c )"));
	}

	@Test
	void testLongArgumentListBreaksOnePerLine() throws Exception {
		FormatterConfig config = new FormatterConfig().withColumnWidth(30);
		Assertions.assertEquals("call(\n\targument_one,\n\targument_two,\n\targument_three\n)\n",
				format("call(argument_one, argument_two, argument_three)", config));
	}

	@Test
	void testCommentBetweenArgumentsBreaksOnePerLine() throws Exception {
		Assertions.assertEquals("f(\n\ta, -- first\n\tb\n)\n", format("f(a, -- first\nb)"));
	}

	@Test
	void testStringArgumentGetsParentheses() throws Exception {
		Assertions.assertEquals("f(\"x\")\n", format("f 'x'"));
	}

	@Test
	void testTableArgumentGetsParentheses() throws Exception {
		Assertions.assertEquals("f({ 1, 2 })\n", format("f{1,2}"));
	}

	@Test
	void testNoCallParenthesesDropsThemForSingleString() throws Exception {
		FormatterConfig config = new FormatterConfig().withNoCallParentheses(true);
		Assertions.assertEquals("f \"x\"\n", format("f('x')", config));
	}

	@Test
	void testNoCallParenthesesDropsThemForSingleTable() throws Exception {
		FormatterConfig config = new FormatterConfig().withNoCallParentheses(true);
		Assertions.assertEquals("f {}\n", format("f({})", config));
	}

	@Test
	void testNoCallParenthesesKeepsThemForSeveralArguments() throws Exception {
		FormatterConfig config = new FormatterConfig().withNoCallParentheses(true);
		Assertions.assertEquals("f(\"a\", \"b\")\n", format("f(\"a\", \"b\")", config));
	}
}
