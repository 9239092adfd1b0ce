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
package com.tomaszrup.luafmt.verify;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.luafmt.syntax.LuaDialect;
import com.tomaszrup.luafmt.syntax.LuaParser;
import com.tomaszrup.luafmt.syntax.ParseException;

class AstVerifierTests {

	private static VerificationResult compare(String original, String output, EquivalencePolicy policy)
			throws ParseException {
		return AstVerifier.compare(LuaParser.parse(original), LuaParser.parse(output), policy);
	}

	private static VerificationResult compare(String original, String output) throws ParseException {
		return compare(original, output, EquivalencePolicy.defaults());
	}

	// ------------------------------------------------------------------
	// verify
	// ------------------------------------------------------------------

	@Test
	void testVerifyIdenticalText() throws Exception {
		String source = "local x = 1\nprint(x)\n";
		VerificationResult result = AstVerifier.verify(LuaParser.parse(source), source, LuaDialect.ALL,
				EquivalencePolicy.defaults());
		Assertions.assertTrue(result.isOk());
		Assertions.assertNull(result.getDetails());
	}

	@Test
	void testVerifyUnparsableOutput() throws Exception {
		VerificationResult result = AstVerifier.verify(LuaParser.parse("x = 1"), "x = ", LuaDialect.ALL,
				EquivalencePolicy.defaults());
		Assertions.assertEquals(VerificationResult.Status.REPARSE_FAULT, result.getStatus());
		Assertions.assertNotNull(result.getDetails());
	}

	@Test
	void testVerifyUsesDialect() throws Exception {
		String source = "x += 1";
		VerificationResult result = AstVerifier.verify(LuaParser.parse(source, LuaDialect.LUAU), source,
				LuaDialect.LUA51, EquivalencePolicy.defaults());
		Assertions.assertEquals(VerificationResult.Status.REPARSE_FAULT, result.getStatus());
	}

	// ------------------------------------------------------------------
	// Real differences
	// ------------------------------------------------------------------

	@Test
	void testDifferentStatementCount() throws Exception {
		VerificationResult result = compare("a = 1\nb = 2", "a = 1");
		Assertions.assertEquals(VerificationResult.Status.SEMANTIC_DIFFERENCE, result.getStatus());
		Assertions.assertNotNull(result.getDetails());
	}

	@Test
	void testDifferentOperator() throws Exception {
		Assertions.assertFalse(compare("x = a + b", "x = a - b").isOk());
	}

	@Test
	void testDifferentValue() throws Exception {
		Assertions.assertFalse(compare("x=1", "x=2").isOk());
	}

	@Test
	void testDroppedExpressionParentheses() throws Exception {
		Assertions.assertFalse(compare("x = (a + b) * c", "x = a + b * c").isOk());
	}

	// ------------------------------------------------------------------
	// Cosmetic differences
	// ------------------------------------------------------------------

	@Test
	void testWhitespaceAndCommentsAreIgnored() throws Exception {
		Assertions.assertTrue(compare("x=1 -- one", "x   =   1 --[[ another ]]", EquivalencePolicy.strict()).isOk());
	}

	@Test
	void testConditionParentheses() throws Exception {
		Assertions.assertTrue(compare("if (a) then end", "if a then end").isOk());
		Assertions.assertFalse(compare("if (a) then end", "if a then end", EquivalencePolicy.strict()).isOk());
	}

	@Test
	void testCallParentheses() throws Exception {
		Assertions.assertTrue(compare("f('x')", "f 'x'").isOk());
		Assertions.assertFalse(compare("f('x')", "f 'x'", EquivalencePolicy.strict()).isOk());
	}

	@Test
	void testCallParenthesesWithQuoteChange() throws Exception {
		Assertions.assertTrue(compare("f('x')", "f \"x\"").isOk());
	}

	@Test
	void testTableSeparators() throws Exception {
		Assertions.assertTrue(compare("t = {1;2;}", "t = { 1, 2 }").isOk());
		Assertions.assertFalse(compare("t = {1;2;}", "t = { 1, 2 }", EquivalencePolicy.strict()).isOk());
	}

	@Test
	void testStringQuotes() throws Exception {
		Assertions.assertTrue(compare("x = 'a'", "x = \"a\"").isOk());
		Assertions.assertFalse(compare("x = 'a'", "x = \"a\"", EquivalencePolicy.strict()).isOk());
	}

	@Test
	void testSingleFlagCanBeDisabled() throws Exception {
		EquivalencePolicy policy = EquivalencePolicy.defaults().withNormalizeStringQuotes(false);
		Assertions.assertFalse(compare("x = 'a'", "x = \"a\"", policy).isOk());
		Assertions.assertTrue(compare("if (a) then end", "if a then end", policy).isOk());
	}

	// ------------------------------------------------------------------
	// EquivalencePolicy
	// ------------------------------------------------------------------

	@Test
	void testPolicyPresets() {
		EquivalencePolicy defaults = EquivalencePolicy.defaults();
		Assertions.assertTrue(defaults.isIgnoreConditionParentheses());
		Assertions.assertTrue(defaults.isNormalizeStringQuotes());
		Assertions.assertTrue(defaults.isIgnoreCallParentheses());
		Assertions.assertTrue(defaults.isIgnoreSeparators());
		EquivalencePolicy strict = EquivalencePolicy.strict();
		Assertions.assertFalse(strict.isIgnoreConditionParentheses());
		Assertions.assertFalse(strict.isNormalizeStringQuotes());
		Assertions.assertFalse(strict.isIgnoreCallParentheses());
		Assertions.assertFalse(strict.isIgnoreSeparators());
	}
}
