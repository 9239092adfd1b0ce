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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.luafmt.syntax.CstPrinter;
import com.tomaszrup.luafmt.syntax.LuaParser;
import com.tomaszrup.luafmt.syntax.ParseException;
import com.tomaszrup.luafmt.syntax.Trivia;
import com.tomaszrup.luafmt.syntax.ast.AssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.BinaryExpression;
import com.tomaszrup.luafmt.syntax.ast.Expression;

/**
 * Unit tests for the token mappers of {@link GeneralFormatter}.
 */
class GeneralFormatterTests {

	private static Expression firstValue(String source) throws ParseException {
		AssignmentStmt stmt = (AssignmentStmt) LuaParser.parse(source).getBlock().getStmts().get(0);
		return stmt.getValues().get(0);
	}

	// ------------------------------------------------------------------
	// Node edges
	// ------------------------------------------------------------------

	@Test
	void testLeadingSpaceTouchesOnlyFirstToken() throws Exception {
		Expression value = firstValue("x =a+b");
		Expression spaced = value.mapTokens(GeneralFormatter.leadingSpace(value));
		Assertions.assertTrue(spaced instanceof BinaryExpression);
		Assertions.assertEquals(" a+b", CstPrinter.print(spaced));
	}

	@Test
	void testOnLastTokenTouchesOnlyLastToken() throws Exception {
		Expression value = firstValue("x = a + a");
		Expression mapped = value.mapTokens(GeneralFormatter.onLastToken(value, token -> token.withText("b")));
		Assertions.assertEquals("a + b", CstPrinter.print(mapped));
	}

	@Test
	void testTakeTrailingCommentsMovesComment() throws Exception {
		Expression value = firstValue("x = a + b -- note\n");
		List<Trivia> moved = new ArrayList<>();
		Expression stripped = value.mapTokens(GeneralFormatter.takeTrailingComments(value, moved));
		Assertions.assertEquals("a + b", CstPrinter.print(stripped));
		Assertions.assertEquals(1, moved.size());
		Assertions.assertEquals("-- note", moved.get(0).getText());
	}
}
