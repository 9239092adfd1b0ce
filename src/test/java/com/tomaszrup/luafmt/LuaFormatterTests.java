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
package com.tomaszrup.luafmt;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.tomaszrup.luafmt.config.FormatRange;
import com.tomaszrup.luafmt.config.FormatterConfig;
import com.tomaszrup.luafmt.syntax.LuaDialect;
import com.tomaszrup.luafmt.syntax.LuaParser;
import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.Tokens;
import com.tomaszrup.luafmt.syntax.Trivia;
import com.tomaszrup.luafmt.syntax.ast.Ast;
import com.tomaszrup.luafmt.verify.VerificationResult;

class LuaFormatterTests {

	private static String readExample(String name) throws IOException {
		try (InputStream in = LuaFormatterTests.class.getResourceAsStream("/format-examples/" + name)) {
			Assertions.assertNotNull(in, "missing example " + name);
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

	private static String formatOrFail(String code) {
		FormatResult result = LuaFormatter.formatCode(code, new FormatterConfig(), null, OutputVerification.FULL);
		Assertions.assertTrue(result.isSuccess(), result.toString());
		return result.getFormattedText();
	}

	private static List<String> comments(String code) throws Exception {
		List<String> comments = new ArrayList<>();
		for (Token token : Tokens.collect(LuaParser.parse(code))) {
			for (Trivia piece : token.getLeadingTrivia()) {
				if (piece.isComment()) {
					comments.add(piece.getText());
				}
			}
			for (Trivia piece : token.getTrailingTrivia()) {
				if (piece.isComment()) {
					comments.add(piece.getText());
				}
			}
		}
		Collections.sort(comments);
		return comments;
	}

	// ------------------------------------------------------------------
	// formatCode
	// ------------------------------------------------------------------

	@Test
	void testFormatCodeSuccess() {
		FormatResult result = LuaFormatter.formatCode("if x then y() end", new FormatterConfig(), null,
				OutputVerification.FULL);
		Assertions.assertTrue(result.isSuccess());
		Assertions.assertEquals("if x then\n\ty()\nend\n", result.getFormattedText());
		Assertions.assertNull(result.getError());
		Assertions.assertNull(result.getMessage());
	}

	@Test
	void testFormatCodeParseError() {
		FormatResult result = LuaFormatter.formatCode("local = 1", new FormatterConfig(), null,
				OutputVerification.FULL);
		Assertions.assertFalse(result.isSuccess());
		Assertions.assertNull(result.getFormattedText());
		Assertions.assertEquals(FormatError.PARSE_ERROR, result.getError());
		Assertions.assertTrue(result.getMessage().startsWith("error parsing: "), result.getMessage());
		Assertions.assertTrue(result.getMessage().contains("line 1"), result.getMessage());
	}

	@Test
	void testFormatCodeRespectsDialect() {
		FormatterConfig config = new FormatterConfig().withSyntax(LuaDialect.LUA51);
		FormatResult result = LuaFormatter.formatCode("x += 1", config, null, OutputVerification.NONE);
		Assertions.assertEquals(FormatError.PARSE_ERROR, result.getError());
	}

	@Test
	void testFormatCodeWithRange() {
		FormatResult result = LuaFormatter.formatCode("a  =  1\nb  =  2\nc  =  3\n", new FormatterConfig(),
				FormatRange.from(8, 14), OutputVerification.FULL);
		Assertions.assertEquals("a  =  1\nb = 2\nc  =  3\n", result.getFormattedText());
	}

	@Test
	void testRangeOffsetsCountCharsNotBytes() {
		String source = "s  =  '\u00e9\u00e9\u00e9\u00e9\u00e9\u00e9\u00e9\u00e9'\nb  =  2\nc  =  3\n";
		int start = source.indexOf('b');
		int end = source.indexOf('c') - 1;
		FormatResult result = LuaFormatter.formatCode(source, new FormatterConfig(), FormatRange.from(start, end),
				OutputVerification.FULL);
		Assertions.assertEquals(
				"s  =  '\u00e9\u00e9\u00e9\u00e9\u00e9\u00e9\u00e9\u00e9'\nb = 2\nc  =  3\n",
				result.getFormattedText());
	}

	@Test
	void testFormatCodeWithoutVerification() {
		FormatResult result = LuaFormatter.formatCode("x=1", new FormatterConfig(), null, OutputVerification.NONE);
		Assertions.assertEquals("x = 1\n", result.getFormattedText());
	}

	@Test
	void testEmptyInput() {
		Assertions.assertEquals("", formatOrFail(""));
	}

	@Test
	void testVerifyFormattedTree() throws Exception {
		Ast input = LuaParser.parse("if (a) then f 'x' end");
		VerificationResult result = LuaFormatter.verify(input, "if a then\n\tf(\"x\")\nend\n", new FormatterConfig());
		Assertions.assertTrue(result.isOk(), result.toString());
	}

	// ------------------------------------------------------------------
	// FormatError
	// ------------------------------------------------------------------

	@Test
	void testDescribeParseError() {
		Assertions.assertEquals("error parsing: unexpected symbol at line 1, column 7",
				FormatError.PARSE_ERROR.describe("unexpected symbol at line 1, column 7"));
	}

	@Test
	void testDescribeAstError() {
		String message = FormatError.VERIFICATION_AST_ERROR.describe("details");
		Assertions.assertTrue(message.startsWith("INTERNAL ERROR: Output AST generated a syntax error."), message);
		Assertions.assertTrue(message.endsWith("details"), message);
	}

	@Test
	void testDescribeAstDifference() {
		Assertions.assertTrue(FormatError.VERIFICATION_AST_DIFFERENCE.describe(null)
				.startsWith("INTERNAL WARNING: Output AST may be different to input AST."));
	}

	@Test
	void testFailureToString() {
		FormatResult result = FormatResult.failure(FormatError.PARSE_ERROR, "oops");
		Assertions.assertEquals("FormatResult{error parsing: oops}", result.toString());
	}

	@Test
	void testStringWithSkipWhitespaceEscapeIsKept() {
		String output = formatOrFail("local s = 'first \\z\n      second'\n");
		Assertions.assertEquals("local s = \"first \\z\n      second\"\n", output);
	}

	@Test
	void testDeeplyNestedInputIsReportedAsParseError() {
		String source = "do ".repeat(3000) + "end ".repeat(3000);
		FormatResult result = LuaFormatter.formatCode(source, new FormatterConfig(), null, OutputVerification.FULL);
		Assertions.assertFalse(result.isSuccess());
		Assertions.assertEquals(FormatError.PARSE_ERROR, result.getError());
		Assertions.assertTrue(result.getMessage().contains("too many nested levels"), result.getMessage());
	}

	@Test
	void testNestingBelowLimitIsFormatted() {
		String source = "do ".repeat(150) + "x=1" + " end".repeat(150);
		String output = formatOrFail(source);
		Assertions.assertTrue(output.startsWith("do\n\tdo\n\t\tdo\n"), output);
		Assertions.assertTrue(output.contains("\tx = 1\n"), output);
	}

	// ------------------------------------------------------------------
	// Examples
	// ------------------------------------------------------------------

	@ParameterizedTest
	@ValueSource(strings = { "module.lua", "messy.lua", "luau.lua", "comments.lua" })
	void testExampleIsIdempotent(String name) throws Exception {
		String once = formatOrFail(readExample(name));
		Assertions.assertEquals(once, formatOrFail(once));
	}

	@ParameterizedTest
	@ValueSource(strings = { "module.lua", "messy.lua", "luau.lua", "comments.lua" })
	void testExampleKeepsEveryComment(String name) throws Exception {
		String source = readExample(name);
		Assertions.assertEquals(comments(source), comments(formatOrFail(source)));
	}

	@Test
	void testMessyExample() throws Exception {
		String output = formatOrFail(readExample("messy.lua"));
		Assertions.assertTrue(output.startsWith("local a, b = 1, 2\nlocal t = { 1, 2, 3 }\n"), output);
		Assertions.assertTrue(output.contains("if a == b then\n\tprint(\"same\")\nelse\n\tprint(\"different\")\nend\n"),
				output);
		Assertions.assertTrue(output.contains("end\n\nwhile a < 10 do\n"), output);
		Assertions.assertTrue(output.contains("\t-- show each element\n\tprint(t[i])\n"), output);
		Assertions.assertTrue(output.contains("print(f(1, 2, 3))\n"), output);
		Assertions.assertFalse(output.contains(";"), output);
	}

	@Test
	void testModuleExampleIsAlreadyFormatted() throws Exception {
		String source = readExample("module.lua");
		source = source.replace("'untitled'", "\"untitled\"");
		Assertions.assertEquals(source, formatOrFail(source));
	}
}
