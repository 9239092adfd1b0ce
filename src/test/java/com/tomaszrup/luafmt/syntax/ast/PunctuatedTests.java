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
package com.tomaszrup.luafmt.syntax.ast;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.luafmt.syntax.CstPrinter;
import com.tomaszrup.luafmt.syntax.LuaParser;
import com.tomaszrup.luafmt.syntax.SyntaxNode;
import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.TokenType;

class PunctuatedTests {

	private static Token rename(Token token) {
		return token.getType() == TokenType.IDENTIFIER ? token.withText(token.getText().toUpperCase()) : token;
	}

	@Test
	void testMapTokensKeepsValueType() throws Exception {
		ReturnStmt stmt = (ReturnStmt) LuaParser.parse("return a, b.c").getBlock().getStmts().get(0);
		Punctuated<Expression> mapped = stmt.getValues().mapTokens(PunctuatedTests::rename, Expression::mapTokens);
		Expression second = mapped.get(1);
		Assertions.assertEquals("B.C", CstPrinter.print(second));
		Assertions.assertEquals(",", mapped.getPairs().get(0).getSeparator().getText());
	}

	@Test
	void testMapTokensThroughSyntaxNode() throws Exception {
		ReturnStmt stmt = (ReturnStmt) LuaParser.parse("return a, b").getBlock().getStmts().get(0);
		Punctuated<SyntaxNode> mapped = stmt.getValues().mapTokens(PunctuatedTests::rename);
		Assertions.assertEquals("A, B", CstPrinter.print(mapped));
	}

	@Test
	void testOwnerRebuildsWithMappedValues() throws Exception {
		Ast ast = LuaParser.parse("local t = { x = y, [z] = 1 }\n");
		Ast mapped = ast.mapTokens(PunctuatedTests::rename);
		Assertions.assertEquals("local T = { X = Y, [Z] = 1 }\n", CstPrinter.print(mapped));
	}
}
