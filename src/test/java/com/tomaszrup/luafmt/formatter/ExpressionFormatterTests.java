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
import com.tomaszrup.luafmt.syntax.ast.ReturnStmt;

class ExpressionFormatterTests {

	private static String format(String source) throws ParseException {
		return format(source, new FormatterConfig());
	}

	private static String format(String source, FormatterConfig config) throws ParseException {
		Ast ast = LuaParser.parse(source, config.getSyntax());
		return CstPrinter.print(CodeFormatter.format(ast, config, null));
	}

	// ------------------------------------------------------------------
	// Operators
	// ------------------------------------------------------------------

	@Test
	void testBinaryOperatorsAreSpaced() throws Exception {
		Assertions.assertEquals("x = a + b * c\n", format("x=a+b*c"));
	}

	@Test
	void testConcatenationIsSpaced() throws Exception {
		Assertions.assertEquals("x = a .. b\n", format("x=a..b"));
	}

	@Test
	void testDoubleNegationKeepsSpace() throws Exception {
		Assertions.assertEquals("x = - -y\n", format("x = - -y"));
	}

	@Test
	void testNotIsFollowedBySingleSpace() throws Exception {
		Assertions.assertEquals("x = not y\n", format("x = not   y"));
	}

	@Test
	void testLengthOperatorIsTight() throws Exception {
		Assertions.assertEquals("x = #t\n", format("x = # t"));
	}

	@Test
	void testExpressionParenthesesAreKept() throws Exception {
		Assertions.assertEquals("x = (a + b) * c\n", format("x = ( a+b )*c"));
	}

	// ------------------------------------------------------------------
	// Suffixes
	// ------------------------------------------------------------------

	@Test
	void testMethodCallIsTight() throws Exception {
		Assertions.assertEquals("obj:method(1)\n", format("obj : method ( 1 )"));
	}

	@Test
	void testIndexingIsTight() throws Exception {
		Assertions.assertEquals("x = t[1].y\n", format("x = t [ 1 ] . y"));
	}

	// ------------------------------------------------------------------
	// Values
	// ------------------------------------------------------------------

	@Test
	void testStringsAreRequoted() throws Exception {
		Assertions.assertEquals("x = \"a\"\n", format("x = 'a'"));
	}

	@Test
	void testLongStringsAreUntouched() throws Exception {
		Assertions.assertEquals("x = [[ a 'b' ]]\n", format("x = [[ a 'b' ]]"));
	}

	@Test
	void testNumbersAreUntouched() throws Exception {
		Assertions.assertEquals("x = 0xFF + 1e10\n", format("x=0xFF+1e10"));
	}

	// ------------------------------------------------------------------
	// Hanging
	// ------------------------------------------------------------------

	@Test
	void testAssignmentValueHangsAtOperators() throws Exception {
		FormatterConfig config = new FormatterConfig().withColumnWidth(40);
		Assertions.assertEquals("local total = first_value\n\t+ second_value\n\t+ third_value\n",
				format("local total = first_value + second_value + third_value", config));
	}

	@Test
	void testHangIsNotAppliedWhenLineFits() throws Exception {
		Assertions.assertEquals("local total = first_value + second_value + third_value\n",
				format("local total = first_value + second_value + third_value"));
	}

	@Test
	void testIsHangable() throws Exception {
		Ast ast = LuaParser.parse("return (a + b), c");
		ReturnStmt returnStmt = (ReturnStmt) ast.getBlock().getStmts().get(0);
		Assertions.assertTrue(ExpressionFormatter.isHangable(returnStmt.getValues().values().get(0)));
		Assertions.assertFalse(ExpressionFormatter.isHangable(returnStmt.getValues().values().get(1)));
	}
}
