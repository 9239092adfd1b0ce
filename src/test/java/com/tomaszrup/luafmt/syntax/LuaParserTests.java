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
package com.tomaszrup.luafmt.syntax;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.luafmt.syntax.ast.AssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.Ast;
import com.tomaszrup.luafmt.syntax.ast.BinaryExpression;
import com.tomaszrup.luafmt.syntax.ast.Expression;
import com.tomaszrup.luafmt.syntax.ast.FunctionArgs;
import com.tomaszrup.luafmt.syntax.ast.FunctionCallStmt;
import com.tomaszrup.luafmt.syntax.ast.GenericForStmt;
import com.tomaszrup.luafmt.syntax.ast.IfStmt;
import com.tomaszrup.luafmt.syntax.ast.LocalAssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.NumericForStmt;
import com.tomaszrup.luafmt.syntax.ast.ParenthesesExpression;
import com.tomaszrup.luafmt.syntax.ast.Stmt;
import com.tomaszrup.luafmt.syntax.ast.StmtKind;
import com.tomaszrup.luafmt.syntax.ast.TypeDeclarationStmt;
import com.tomaszrup.luafmt.syntax.ast.UnaryExpression;

/**
 * Unit tests for {@link LuaParser}: statement kinds, operator precedence,
 * dialect gating and syntax errors.
 */
class LuaParserTests {

	private static List<StmtKind> kinds(Ast ast) {
		List<StmtKind> kinds = new ArrayList<>();
		for (Stmt stmt : ast.getBlock().getStmts()) {
			kinds.add(stmt.getKind());
		}
		return kinds;
	}

	private static Expression firstValue(String source) throws ParseException {
		AssignmentStmt assignment = (AssignmentStmt) LuaParser.parse(source).getBlock().getStmts().get(0);
		return assignment.getValues().get(0);
	}

	// ------------------------------------------------------------------
	// Statements
	// ------------------------------------------------------------------

	@Test
	void testCoreStatementKinds() throws Exception {
		String source = "a = 1\n"
				+ "local b\n"
				+ "f()\n"
				+ "do end\n"
				+ "while a do break end\n"
				+ "repeat until a\n"
				+ "if a then end\n"
				+ "for i = 1, 2 do end\n"
				+ "for k, v in pairs(t) do end\n"
				+ "function m.n:o() end\n"
				+ "local function p() end\n"
				+ "return a\n";
		List<StmtKind> expected = List.of(StmtKind.ASSIGNMENT, StmtKind.LOCAL_ASSIGNMENT, StmtKind.FUNCTION_CALL,
				StmtKind.DO, StmtKind.WHILE, StmtKind.REPEAT, StmtKind.IF, StmtKind.NUMERIC_FOR,
				StmtKind.GENERIC_FOR, StmtKind.FUNCTION_DECLARATION, StmtKind.LOCAL_FUNCTION, StmtKind.RETURN);
		Assertions.assertEquals(expected, kinds(LuaParser.parse(source)));
	}

	@Test
	void testIfWithElseIfAndElse() throws Exception {
		IfStmt ifStmt = (IfStmt) LuaParser.parse("if a then x() elseif b then y() elseif c then else z() end")
				.getBlock().getStmts().get(0);
		Assertions.assertEquals(2, ifStmt.getElseIfs().size());
		Assertions.assertNotNull(ifStmt.getElseToken());
		Assertions.assertEquals(1, ifStmt.getElseBlock().getStmts().size());
		Assertions.assertTrue(ifStmt.getElseIfs().get(1).getBlock().isEmpty());
	}

	@Test
	void testNumericForWithStep() throws Exception {
		NumericForStmt forStmt = (NumericForStmt) LuaParser.parse("for i = 10, 1, -1 do end").getBlock().getStmts()
				.get(0);
		Assertions.assertEquals("i", forStmt.getIndex().getText());
		Assertions.assertNotNull(forStmt.getStepComma());
		Assertions.assertTrue(forStmt.getStep() instanceof UnaryExpression);
	}

	@Test
	void testGenericForNamesAndExpressions() throws Exception {
		GenericForStmt forStmt = (GenericForStmt) LuaParser.parse("for k, v in next, t, nil do end").getBlock()
				.getStmts().get(0);
		Assertions.assertEquals(2, forStmt.getNames().size());
		Assertions.assertEquals(3, forStmt.getExpressions().size());
		Assertions.assertEquals(2, forStmt.getTypeSpecifiers().size());
		Assertions.assertNull(forStmt.getTypeSpecifiers().get(0));
	}

	@Test
	void testSemicolonsAreKeptOnBlockItems() throws Exception {
		Ast ast = LuaParser.parse("a = 1; b = 2");
		Assertions.assertNotNull(ast.getBlock().getItems().get(0).getSemicolon());
		Assertions.assertNull(ast.getBlock().getItems().get(1).getSemicolon());
	}

	@Test
	void testCallArgumentForms() throws Exception {
		Ast ast = LuaParser.parse("f 'a'\nf { 1 }\nf(1, 2)");
		List<FunctionArgs.Kind> argKinds = new ArrayList<>();
		for (Stmt stmt : ast.getBlock().getStmts()) {
			FunctionCallStmt call = (FunctionCallStmt) stmt;
			argKinds.add(((com.tomaszrup.luafmt.syntax.ast.CallSuffix) call.getCall().getSuffixes().get(0))
					.getArgs().getKind());
		}
		Assertions.assertEquals(List.of(FunctionArgs.Kind.STRING, FunctionArgs.Kind.TABLE,
				FunctionArgs.Kind.PARENTHESES), argKinds);
	}

	@Test
	void testReturnMustBeLastStatement() {
		Assertions.assertThrows(ParseException.class, () -> LuaParser.parse("return 1\nx = 2"));
	}

	@Test
	void testReturnWithSemicolon() throws Exception {
		Ast ast = LuaParser.parse("return 1;");
		Assertions.assertEquals(List.of(StmtKind.RETURN), kinds(ast));
		Assertions.assertNotNull(ast.getBlock().getItems().get(0).getSemicolon());
	}

	// ------------------------------------------------------------------
	// Expressions
	// ------------------------------------------------------------------

	@Test
	void testMultiplicationBindsTighterThanAddition() throws Exception {
		BinaryExpression sum = (BinaryExpression) firstValue("x = a + b * c");
		Assertions.assertEquals("+", sum.getOperator().getText());
		Assertions.assertEquals("*", ((BinaryExpression) sum.getRhs()).getOperator().getText());
	}

	@Test
	void testConcatenationIsRightAssociative() throws Exception {
		BinaryExpression concat = (BinaryExpression) firstValue("x = a .. b .. c");
		Assertions.assertFalse(concat.getLhs() instanceof BinaryExpression);
		Assertions.assertTrue(concat.getRhs() instanceof BinaryExpression);
	}

	@Test
	void testSubtractionIsLeftAssociative() throws Exception {
		BinaryExpression difference = (BinaryExpression) firstValue("x = a - b - c");
		Assertions.assertTrue(difference.getLhs() instanceof BinaryExpression);
		Assertions.assertFalse(difference.getRhs() instanceof BinaryExpression);
	}

	@Test
	void testUnaryBindsTighterThanComparison() throws Exception {
		BinaryExpression comparison = (BinaryExpression) firstValue("x = not a == b");
		Assertions.assertEquals("==", comparison.getOperator().getText());
		Assertions.assertTrue(comparison.getLhs() instanceof UnaryExpression);
	}

	@Test
	void testPowerBindsTighterThanUnaryMinus() throws Exception {
		UnaryExpression negation = (UnaryExpression) firstValue("x = -a ^ 2");
		Assertions.assertTrue(negation.getOperand() instanceof BinaryExpression);
	}

	@Test
	void testParenthesesAreKept() throws Exception {
		ParenthesesExpression parentheses = (ParenthesesExpression) firstValue("x = ((a))");
		Assertions.assertTrue(parentheses.getInner() instanceof ParenthesesExpression);
	}

	@Test
	void testBinaryPriority() {
		Assertions.assertArrayEquals(new int[] {5, 4}, LuaParser.binaryPriority(Token.symbol("..")));
		Assertions.assertArrayEquals(new int[] {1, 1}, LuaParser.binaryPriority(Token.keyword("or")));
		Assertions.assertNull(LuaParser.binaryPriority(Token.symbol("=")));
	}

	// ------------------------------------------------------------------
	// Dialects
	// ------------------------------------------------------------------

	@Test
	void testGotoAndLabelInLua52() throws Exception {
		Ast ast = LuaParser.parse("goto done\n::done::", LuaDialect.LUA52);
		Assertions.assertEquals(List.of(StmtKind.GOTO, StmtKind.LABEL), kinds(ast));
	}

	@Test
	void testGotoRejectedInLua51() {
		Assertions.assertThrows(ParseException.class, () -> LuaParser.parse("goto done", LuaDialect.LUA51));
	}

	@Test
	void testGotoAsVariableInLua51() throws Exception {
		Ast ast = LuaParser.parse("goto = 1", LuaDialect.LUA51);
		Assertions.assertEquals(List.of(StmtKind.ASSIGNMENT), kinds(ast));
	}

	@Test
	void testContinueInLuau() throws Exception {
		Ast ast = LuaParser.parse("while true do continue end", LuaDialect.LUAU);
		Stmt loop = ast.getBlock().getStmts().get(0);
		Assertions.assertEquals(StmtKind.CONTINUE,
				((com.tomaszrup.luafmt.syntax.ast.WhileStmt) loop).getBlock().getStmts().get(0).getKind());
	}

	@Test
	void testContinueAsCalleeInLuau() throws Exception {
		Ast ast = LuaParser.parse("continue(1)\ncontinue = 2", LuaDialect.LUAU);
		Assertions.assertEquals(List.of(StmtKind.FUNCTION_CALL, StmtKind.ASSIGNMENT), kinds(ast));
	}

	@Test
	void testCompoundAssignment() throws Exception {
		Ast ast = LuaParser.parse("x += 1\nt.n ..= 's'", LuaDialect.LUAU);
		Assertions.assertEquals(List.of(StmtKind.COMPOUND_ASSIGNMENT, StmtKind.COMPOUND_ASSIGNMENT), kinds(ast));
	}

	@Test
	void testCompoundAssignmentRejectedInLua51() {
		ParseException e = Assertions.assertThrows(ParseException.class,
				() -> LuaParser.parse("x += 1", LuaDialect.LUA51));
		Assertions.assertTrue(e.getMessage().contains("compound assignment"));
	}

	@Test
	void testTypeDeclarations() throws Exception {
		Ast ast = LuaParser.parse("type Point = { x: number, y: number }\nexport type List<T> = { T }",
				LuaDialect.LUAU);
		Assertions.assertEquals(List.of(StmtKind.TYPE_DECLARATION, StmtKind.TYPE_DECLARATION), kinds(ast));
		TypeDeclarationStmt exported = (TypeDeclarationStmt) ast.getBlock().getStmts().get(1);
		Assertions.assertNotNull(exported.getExportToken());
		Assertions.assertNotNull(exported.getGenerics());
	}

	@Test
	void testTypeAsVariableName() throws Exception {
		Ast ast = LuaParser.parse("local type = 1\ntype = 2", LuaDialect.LUAU);
		Assertions.assertEquals(List.of(StmtKind.LOCAL_ASSIGNMENT, StmtKind.ASSIGNMENT), kinds(ast));
	}

	@Test
	void testTypeAnnotations() throws Exception {
		Ast ast = LuaParser.parse("local x: number?, y: string | nil = 1, nil\n"
				+ "local function f<T>(a: T, ...: any): (T, number) return a, 1 end", LuaDialect.LUAU);
		LocalAssignmentStmt local = (LocalAssignmentStmt) ast.getBlock().getStmts().get(0);
		Assertions.assertNotNull(local.getTypeSpecifiers().get(0));
		Assertions.assertNotNull(local.getTypeSpecifiers().get(1));
		Assertions.assertEquals(StmtKind.LOCAL_FUNCTION, ast.getBlock().getStmts().get(1).getKind());
	}

	@Test
	void testTypeAnnotationsRejectedInLua51() {
		Assertions.assertThrows(ParseException.class, () -> LuaParser.parse("local x: number = 1",
				LuaDialect.LUA51));
	}

	// ------------------------------------------------------------------
	// Errors
	// ------------------------------------------------------------------

	@Test
	void testMissingEnd() {
		Assertions.assertThrows(ParseException.class, () -> LuaParser.parse("if x then y()"));
	}

	@Test
	void testExpressionIsNotAStatement() {
		ParseException e = Assertions.assertThrows(ParseException.class, () -> LuaParser.parse("x"));
		Assertions.assertTrue(e.getMessage().startsWith("syntax error"));
	}

	@Test
	void testCannotAssignToCall() {
		Assertions.assertThrows(ParseException.class, () -> LuaParser.parse("f() = 1"));
	}

	@Test
	void testStrayEndAtTopLevel() {
		Assertions.assertThrows(ParseException.class, () -> LuaParser.parse("x = 1 end"));
	}

	@Test
	void testDeeplyNestedBlocksAreRejected() {
		String source = "do ".repeat(250) + "end ".repeat(250);
		ParseException e = Assertions.assertThrows(ParseException.class, () -> LuaParser.parse(source));
		Assertions.assertTrue(e.getMessage().contains("too many nested levels"));
	}

	@Test
	void testDeeplyNestedParenthesesAreRejected() {
		String source = "x = " + "(".repeat(300) + "1" + ")".repeat(300);
		ParseException e = Assertions.assertThrows(ParseException.class, () -> LuaParser.parse(source));
		Assertions.assertTrue(e.getMessage().contains("too many nested levels"));
	}

	@Test
	void testLongOperatorChainIsRejected() {
		String source = "x = 1" + " + 1".repeat(300);
		Assertions.assertThrows(ParseException.class, () -> LuaParser.parse(source));
	}

	@Test
	void testModerateNestingIsAccepted() throws Exception {
		String source = "do ".repeat(100) + "x = " + "(".repeat(50) + "1" + ")".repeat(50) + " end".repeat(100);
		Ast ast = LuaParser.parse(source);
		Assertions.assertEquals(1, ast.getBlock().getStmts().size());
	}
}
