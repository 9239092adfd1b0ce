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
import java.util.Collections;
import java.util.List;

import com.tomaszrup.luafmt.syntax.CstPrinter;
import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.Tokens;
import com.tomaszrup.luafmt.syntax.Trivia;
import com.tomaszrup.luafmt.syntax.ast.AssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.Block;
import com.tomaszrup.luafmt.syntax.ast.BreakStmt;
import com.tomaszrup.luafmt.syntax.ast.CompoundAssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.ContinueStmt;
import com.tomaszrup.luafmt.syntax.ast.DoStmt;
import com.tomaszrup.luafmt.syntax.ast.ElseIf;
import com.tomaszrup.luafmt.syntax.ast.Expression;
import com.tomaszrup.luafmt.syntax.ast.FunctionCallStmt;
import com.tomaszrup.luafmt.syntax.ast.FunctionDeclarationStmt;
import com.tomaszrup.luafmt.syntax.ast.GenericForStmt;
import com.tomaszrup.luafmt.syntax.ast.GotoStmt;
import com.tomaszrup.luafmt.syntax.ast.IfStmt;
import com.tomaszrup.luafmt.syntax.ast.LabelStmt;
import com.tomaszrup.luafmt.syntax.ast.LocalAssignmentStmt;
import com.tomaszrup.luafmt.syntax.ast.LocalFunctionStmt;
import com.tomaszrup.luafmt.syntax.ast.NumericForStmt;
import com.tomaszrup.luafmt.syntax.ast.ParenthesesExpression;
import com.tomaszrup.luafmt.syntax.ast.Punctuated;
import com.tomaszrup.luafmt.syntax.ast.RepeatStmt;
import com.tomaszrup.luafmt.syntax.ast.ReturnStmt;
import com.tomaszrup.luafmt.syntax.ast.Stmt;
import com.tomaszrup.luafmt.syntax.ast.TypeDeclarationStmt;
import com.tomaszrup.luafmt.syntax.ast.TypeSpecifier;
import com.tomaszrup.luafmt.syntax.ast.WhileStmt;

/**
 * Formats a single statement. Every formatted statement starts with its
 * leading comments and indentation and ends with a newline; nested blocks
 * are indented one level deeper.
 *
 * <p>Conditional headers ({@code if}, {@code elseif}, {@code while}) are
 * printed on one line unless the line would overflow or a comment sits
 * inside the header. In that case the condition moves to its own,
 * additionally indented line(s):</p>
 *
 * <pre>
 * if
 *     first_condition
 *     and second_condition
 * then
 * </pre>
 */
public final class StatementFormatter {

	private StatementFormatter() {
	}

	public static Stmt formatStmt(FormatContext ctx, Stmt stmt, Shape shape) {
		if (!ctx.shouldFormatNode(stmt)) {
			return RangeBlockFormatter.formatStmt(ctx, stmt, shape);
		}
		Stmt formatted;
		switch (stmt.getKind()) {
			case ASSIGNMENT:
				formatted = AssignmentFormatter.formatAssignment(ctx, (AssignmentStmt) stmt, shape);
				break;
			case LOCAL_ASSIGNMENT:
				formatted = AssignmentFormatter.formatLocalAssignment(ctx, (LocalAssignmentStmt) stmt, shape);
				break;
			case FUNCTION_CALL:
				formatted = FunctionFormatter.formatFunctionCall(ctx, (FunctionCallStmt) stmt, shape);
				break;
			case DO:
				formatted = formatDo(ctx, (DoStmt) stmt, shape);
				break;
			case WHILE:
				formatted = formatWhile(ctx, (WhileStmt) stmt, shape);
				break;
			case REPEAT:
				formatted = formatRepeat(ctx, (RepeatStmt) stmt, shape);
				break;
			case IF:
				formatted = formatIf(ctx, (IfStmt) stmt, shape);
				break;
			case NUMERIC_FOR:
				formatted = formatNumericFor(ctx, (NumericForStmt) stmt, shape);
				break;
			case GENERIC_FOR:
				formatted = formatGenericFor(ctx, (GenericForStmt) stmt, shape);
				break;
			case FUNCTION_DECLARATION:
				formatted = FunctionFormatter.formatFunctionDeclaration(ctx, (FunctionDeclarationStmt) stmt, shape);
				break;
			case LOCAL_FUNCTION:
				formatted = FunctionFormatter.formatLocalFunction(ctx, (LocalFunctionStmt) stmt, shape);
				break;
			case RETURN:
				formatted = AssignmentFormatter.formatReturn(ctx, (ReturnStmt) stmt, shape);
				break;
			case BREAK:
				formatted = new BreakStmt(GeneralFormatter.formatToken(((BreakStmt) stmt).getBreakToken()));
				break;
			case GOTO:
				formatted = formatGoto((GotoStmt) stmt);
				break;
			case LABEL:
				formatted = formatLabel((LabelStmt) stmt);
				break;
			case CONTINUE:
				formatted = new ContinueStmt(GeneralFormatter.formatToken(((ContinueStmt) stmt).getContinueToken()));
				break;
			case COMPOUND_ASSIGNMENT:
				formatted = AssignmentFormatter.formatCompoundAssignment(ctx, (CompoundAssignmentStmt) stmt, shape);
				break;
			case TYPE_DECLARATION:
				formatted = DialectFormatter.formatTypeDeclaration(ctx, (TypeDeclarationStmt) stmt, shape);
				break;
			default:
				throw new IllegalStateException("unknown node " + stmt.getKind());
		}
		return finish(ctx, stmt, formatted, shape);
	}

	/**
	 * Gives the statement its line: leading comments and indentation before
	 * the first token, a newline after the last one.
	 */
	private static Stmt finish(FormatContext ctx, Stmt original, Stmt formatted, Shape shape) {
		String indent = ctx.indent(shape);
		Stmt withLeading = formatted.mapTokens(
				GeneralFormatter.lineLeading(ctx, formatted, Tokens.first(original), indent, indent));
		return withLeading.mapTokens(GeneralFormatter.trailingNewline(ctx, withLeading));
	}

	// ------------------------------------------------------------------
	// Conditions
	// ------------------------------------------------------------------

	/**
	 * Strips parentheses wrapping a whole condition, as long as they carry no
	 * comments.
	 */
	static Expression removeConditionParentheses(Expression condition) {
		Expression current = condition;
		while (current instanceof ParenthesesExpression) {
			ParenthesesExpression parentheses = (ParenthesesExpression) current;
			if (TriviaUtil.tokenHasComments(parentheses.getOpen())
					|| TriviaUtil.tokenHasComments(parentheses.getClose())) {
				break;
			}
			current = parentheses.getInner();
		}
		return current;
	}

	private static final class ConditionHeader {

		private final Token keyword;
		private final Expression condition;
		private final Token trailingKeyword;

		ConditionHeader(Token keyword, Expression condition, Token trailingKeyword) {
			this.keyword = keyword;
			this.condition = condition;
			this.trailingKeyword = trailingKeyword;
		}
	}

	/**
	 * Formats {@code keyword condition trailingKeyword}. The trailing keyword
	 * is returned without its final newline.
	 */
	private static ConditionHeader formatConditionHeader(FormatContext ctx, Token keyword, Expression condition,
			Token trailingKeyword, Shape shape) {
		Expression stripped = removeConditionParentheses(condition);
		Shape conditionShape = shape.add(keyword.getText().length() + 1);
		Expression singleCondition = ExpressionFormatter.format(ctx, stripped, conditionShape);
		boolean hang = TriviaUtil.tokenHasTrailingComments(keyword)
				|| TriviaUtil.tokenHasLeadingComments(trailingKeyword)
				|| TriviaUtil.containsComments(stripped)
				|| conditionShape.take(CstPrinter.printTrimmed(singleCondition))
						.add(trailingKeyword.getText().length() + 1).overBudget();
		if (!hang) {
			return new ConditionHeader(GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(keyword)),
					singleCondition,
					GeneralFormatter.withLeadingSpace(GeneralFormatter.formatToken(trailingKeyword)));
		}

		Shape hangShape = shape.reset().incrementAdditionalIndent();
		String indent = ctx.indent(hangShape);
		Expression hungCondition = ExpressionFormatter.hang(ctx, stripped, hangShape, hangShape);
		hungCondition = hungCondition.mapTokens(
				GeneralFormatter.lineLeading(ctx, hungCondition, Tokens.first(stripped), indent, indent));
		hungCondition = hungCondition.mapTokens(GeneralFormatter.trailingNewline(ctx, hungCondition));
		return new ConditionHeader(GeneralFormatter.withTrailingNewline(ctx, GeneralFormatter.formatToken(keyword)),
				hungCondition, GeneralFormatter.formatEndToken(ctx, trailingKeyword, shape));
	}

	// ------------------------------------------------------------------
	// Block statements
	// ------------------------------------------------------------------

	private static IfStmt formatIf(FormatContext ctx, IfStmt ifStmt, Shape shape) {
		if ((ifStmt.getElseToken() == null) != (ifStmt.getElseBlock() == null)) {
			throw new IllegalStateException("else token and else block must be present together");
		}
		Shape blockShape = shape.incrementBlockIndent();
		ConditionHeader header = formatConditionHeader(ctx, ifStmt.getIfToken(), ifStmt.getCondition(),
				ifStmt.getThenToken(), shape);
		Block block = BlockFormatter.formatBlock(ctx, ifStmt.getBlock(), blockShape);

		List<ElseIf> elseIfs = new ArrayList<>();
		for (ElseIf elseIf : ifStmt.getElseIfs()) {
			ConditionHeader elseIfHeader = formatConditionHeader(ctx, elseIf.getElseIfToken(),
					elseIf.getCondition(), elseIf.getThenToken(), shape);
			Token elseIfToken = elseIfHeader.keyword.withLeadingTrivia(GeneralFormatter.lineLeadingTrivia(ctx,
					elseIf.getElseIfToken().getLeadingTrivia(), ctx.indent(blockShape), ctx.indent(shape)));
			elseIfs.add(new ElseIf(elseIfToken, elseIfHeader.condition,
					GeneralFormatter.withTrailingNewline(ctx, elseIfHeader.trailingKeyword),
					BlockFormatter.formatBlock(ctx, elseIf.getBlock(), blockShape)));
		}

		Token elseToken = null;
		Block elseBlock = null;
		if (ifStmt.getElseToken() != null) {
			elseToken = GeneralFormatter.withTrailingNewline(ctx,
					GeneralFormatter.formatEndToken(ctx, ifStmt.getElseToken(), shape));
			elseBlock = BlockFormatter.formatBlock(ctx, ifStmt.getElseBlock(), blockShape);
		}

		return new IfStmt(header.keyword, header.condition,
				GeneralFormatter.withTrailingNewline(ctx, header.trailingKeyword), block, elseIfs, elseToken,
				elseBlock, GeneralFormatter.formatEndToken(ctx, ifStmt.getEndToken(), shape));
	}

	private static WhileStmt formatWhile(FormatContext ctx, WhileStmt whileStmt, Shape shape) {
		ConditionHeader header = formatConditionHeader(ctx, whileStmt.getWhileToken(), whileStmt.getCondition(),
				whileStmt.getDoToken(), shape);
		Block block = BlockFormatter.formatBlock(ctx, whileStmt.getBlock(), shape.incrementBlockIndent());
		return new WhileStmt(header.keyword, header.condition,
				GeneralFormatter.withTrailingNewline(ctx, header.trailingKeyword), block,
				GeneralFormatter.formatEndToken(ctx, whileStmt.getEndToken(), shape));
	}

	private static RepeatStmt formatRepeat(FormatContext ctx, RepeatStmt repeat, Shape shape) {
		Token repeatToken = GeneralFormatter.withTrailingNewline(ctx,
				GeneralFormatter.formatToken(repeat.getRepeatToken()));
		Block block = BlockFormatter.formatBlock(ctx, repeat.getBlock(), shape.incrementBlockIndent());
		Token until = GeneralFormatter.withTrailingSpace(
				GeneralFormatter.formatEndToken(ctx, repeat.getUntilToken(), shape));

		Expression condition = removeConditionParentheses(repeat.getCondition());
		Shape conditionShape = shape.add(6);
		Expression formatted = ExpressionFormatter.format(ctx, condition, conditionShape);
		if (ExpressionFormatter.isHangable(condition)
				&& (conditionShape.takeFirstLine(CstPrinter.printTrimmed(formatted)).overBudget()
						|| TriviaUtil.containsInlineComments(condition))) {
			formatted = ExpressionFormatter.hang(ctx, condition, conditionShape, shape.incrementAdditionalIndent());
		}
		return new RepeatStmt(repeatToken, block, until, formatted);
	}

	private static DoStmt formatDo(FormatContext ctx, DoStmt doStmt, Shape shape) {
		Token doToken = GeneralFormatter.withTrailingNewline(ctx, GeneralFormatter.formatToken(doStmt.getDoToken()));
		Block block = BlockFormatter.formatBlock(ctx, doStmt.getBlock(), shape.incrementBlockIndent());
		return new DoStmt(doToken, block, GeneralFormatter.formatEndToken(ctx, doStmt.getEndToken(), shape));
	}

	private static NumericForStmt formatNumericFor(FormatContext ctx, NumericForStmt forStmt, Shape shape) {
		if ((forStmt.getStepComma() == null) != (forStmt.getStep() == null)) {
			throw new IllegalStateException("step comma and step must be present together");
		}
		Token forToken = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(forStmt.getForToken()));
		Token index = GeneralFormatter.formatToken(forStmt.getIndex());
		Shape current = shape.add(4 + index.getText().length());
		TypeSpecifier indexType = DialectFormatter.formatTypeSpecifier(ctx, forStmt.getIndexType(), current);
		if (indexType != null) {
			current = current.take(CstPrinter.print(indexType));
		}
		Token equals = GeneralFormatter.formatSpaced(forStmt.getEquals());
		Expression start = ExpressionFormatter.format(ctx, forStmt.getStart(), current.add(3));
		current = current.add(3).take(CstPrinter.print(start));
		Token endComma = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(forStmt.getEndComma()));
		Expression end = ExpressionFormatter.format(ctx, forStmt.getEnd(), current.add(2));
		current = current.add(2).take(CstPrinter.print(end));
		Token stepComma = null;
		Expression step = null;
		if (forStmt.getStep() != null) {
			stepComma = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(forStmt.getStepComma()));
			step = ExpressionFormatter.format(ctx, forStmt.getStep(), current.add(2));
		}
		Token doToken = GeneralFormatter.withTrailingNewline(ctx,
				GeneralFormatter.withLeadingSpace(GeneralFormatter.formatToken(forStmt.getDoToken())));
		Block block = BlockFormatter.formatBlock(ctx, forStmt.getBlock(), shape.incrementBlockIndent());
		return new NumericForStmt(forToken, index, indexType, equals, start, endComma, end, stepComma, step, doToken,
				block, GeneralFormatter.formatEndToken(ctx, forStmt.getEndToken(), shape));
	}

	/**
	 * Formats {@code for names in expressions do}. Comments inside the header
	 * move after {@code do} so the header stays on one line.
	 */
	private static GenericForStmt formatGenericFor(FormatContext ctx, GenericForStmt forStmt, Shape shape) {
		List<Trivia> moved = new ArrayList<>();
		Token forToken = forStmt.getForToken();
		moved.addAll(TriviaUtil.comments(forToken.getTrailingTrivia()));
		forToken = GeneralFormatter.withTrailingSpace(forToken.withTrailingTrivia(Collections.emptyList()));

		Shape current = shape.add(4);
		List<Punctuated.Pair<Token>> names = new ArrayList<>();
		List<TypeSpecifier> types = new ArrayList<>();
		List<Punctuated.Pair<Token>> originalNames = forStmt.getNames().getPairs();
		for (int i = 0; i < originalNames.size(); i++) {
			Punctuated.Pair<Token> pair = originalNames.get(i);
			Token name = stripComments(pair.getValue(), moved);
			current = current.add(name.getText().length());
			TypeSpecifier type = DialectFormatter.formatTypeSpecifier(ctx, forStmt.getTypeSpecifiers().get(i),
					current);
			if (type != null) {
				current = current.take(CstPrinter.print(type));
			}
			Token separator = null;
			if (pair.getSeparator() != null) {
				separator = GeneralFormatter.withTrailingSpace(stripComments(pair.getSeparator(), moved));
				current = current.add(2);
			}
			names.add(new Punctuated.Pair<>(name, separator));
			types.add(type);
		}

		Token in = GeneralFormatter.formatSpaced(stripComments(forStmt.getInToken(), moved));
		current = current.add(4);
		List<Punctuated.Pair<Expression>> expressions = new ArrayList<>();
		for (Punctuated.Pair<Expression> pair : forStmt.getExpressions().getPairs()) {
			Expression value = ExpressionFormatter.format(ctx, pair.getValue(), current);
			moved.addAll(TriviaUtil.comments(Tokens.first(value).getLeadingTrivia()));
			value = value.mapTokens(GeneralFormatter.onFirstToken(value,
					token -> token.withLeadingTrivia(Collections.emptyList())));
			value = value.mapTokens(GeneralFormatter.takeTrailingComments(value, moved));
			current = current.take(CstPrinter.print(value));
			Token separator = null;
			if (pair.getSeparator() != null) {
				separator = GeneralFormatter.withTrailingSpace(stripComments(pair.getSeparator(), moved));
				current = current.add(2);
			}
			expressions.add(new Punctuated.Pair<>(value, separator));
		}

		Token doToken = forStmt.getDoToken();
		moved.addAll(TriviaUtil.comments(doToken.getLeadingTrivia()));
		moved.addAll(TriviaUtil.comments(doToken.getTrailingTrivia()));
		List<Trivia> doTrailing = GeneralFormatter.spaced(moved);
		doTrailing.add(ctx.newlineTrivia());
		doToken = GeneralFormatter.withLeadingSpace(doToken.withTrivia(Collections.emptyList(), doTrailing));

		Block block = BlockFormatter.formatBlock(ctx, forStmt.getBlock(), shape.incrementBlockIndent());
		return new GenericForStmt(forToken, new Punctuated<>(names), types, in, new Punctuated<>(expressions),
				doToken, block, GeneralFormatter.formatEndToken(ctx, forStmt.getEndToken(), shape));
	}

	private static Token stripComments(Token token, List<Trivia> moved) {
		moved.addAll(TriviaUtil.comments(token.getLeadingTrivia()));
		moved.addAll(TriviaUtil.comments(token.getTrailingTrivia()));
		return token.withoutTrivia();
	}

	// ------------------------------------------------------------------
	// Jumps
	// ------------------------------------------------------------------

	private static GotoStmt formatGoto(GotoStmt gotoStmt) {
		Token gotoToken = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(gotoStmt.getGotoToken()));
		return new GotoStmt(gotoToken, GeneralFormatter.formatToken(gotoStmt.getLabel()));
	}

	private static LabelStmt formatLabel(LabelStmt label) {
		return new LabelStmt(GeneralFormatter.formatToken(label.getLeftColons()),
				GeneralFormatter.formatToken(label.getName()), GeneralFormatter.formatToken(label.getRightColons()));
	}
}
