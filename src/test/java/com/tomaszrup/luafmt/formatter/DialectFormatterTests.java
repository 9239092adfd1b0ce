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
import com.tomaszrup.luafmt.syntax.LuaDialect;

/**
 * Constructs that only some dialects accept: labels, {@code continue},
 * compound assignment and type annotations.
 */
class DialectFormatterTests {

	private static String format(String source) throws ParseException {
		return format(source, new FormatterConfig());
	}

	private static String format(String source, FormatterConfig config) throws ParseException {
		Ast ast = LuaParser.parse(source, config.getSyntax());
		return CstPrinter.print(CodeFormatter.format(ast, config, null));
	}

	private static String formatLuau(String source) throws ParseException {
		return format(source, new FormatterConfig().withSyntax(LuaDialect.LUAU));
	}

	@Test
	void testGotoAndLabel() throws Exception {
		FormatterConfig config = new FormatterConfig().withSyntax(LuaDialect.LUA52);
		Assertions.assertEquals("goto done\n::done::\n", format("goto   done\n::  done  ::", config));
	}

	@Test
	void testContinue() throws Exception {
		Assertions.assertEquals("while true do\n\tcontinue\nend\n", formatLuau("while true do continue end"));
	}

	@Test
	void testCompoundAssignment() throws Exception {
		Assertions.assertEquals("x += 1\n", formatLuau("x+=1"));
	}

	@Test
	void testConcatCompoundAssignment() throws Exception {
		Assertions.assertEquals("s ..= \"a\"\n", formatLuau("s ..= 'a'"));
	}

	// ------------------------------------------------------------------
	// Types
	// ------------------------------------------------------------------

	@Test
	void testTypeDeclarationWithTable() throws Exception {
		Assertions.assertEquals("type Point = { x: number, y: number }\n",
				formatLuau("type  Point={x:number,y:number}"));
	}

	@Test
	void testExportedGenericFunctionType() throws Exception {
		Assertions.assertEquals("export type Fn<T> = (T) -> T\n", formatLuau("export type Fn<T>=(T)->T"));
	}

	@Test
	void testUnionType() throws Exception {
		Assertions.assertEquals("type T = string | nil\n", formatLuau("type T = string|nil"));
	}

	@Test
	void testTypeofIsUntouched() throws Exception {
		Assertions.assertEquals("type T = typeof(x)\n", formatLuau("type T = typeof(x)"));
	}

	@Test
	void testOptionalLocalAnnotation() throws Exception {
		Assertions.assertEquals("local x: number? = 1\n", formatLuau("local x:number?=1"));
	}

	@Test
	void testTypeAssertion() throws Exception {
		Assertions.assertEquals("local y = x :: any\n", formatLuau("local y = x::any"));
	}

	@Test
	void testAnnotatedFunction() throws Exception {
		Assertions.assertEquals("local function f(a: number, b: string): boolean\n\treturn true\nend\n",
				formatLuau("local function f(a:number,b:string):boolean return true end"));
	}

	@Test
	void testTypeKeywordIsContextual() throws Exception {
		Assertions.assertEquals("type = 1\n", format("type=1"));
	}
}
