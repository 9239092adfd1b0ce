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

import com.tomaszrup.luafmt.syntax.CstPrinter;
import com.tomaszrup.luafmt.syntax.LuaParser;
import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.TokenType;
import com.tomaszrup.luafmt.syntax.Trivia;
import com.tomaszrup.luafmt.syntax.ast.BinaryExpression;
import com.tomaszrup.luafmt.syntax.ast.CallSuffix;
import com.tomaszrup.luafmt.syntax.ast.Expression;
import com.tomaszrup.luafmt.syntax.ast.FunctionExpression;
import com.tomaszrup.luafmt.syntax.ast.IndexSuffix;
import com.tomaszrup.luafmt.syntax.ast.ParenthesesExpression;
import com.tomaszrup.luafmt.syntax.ast.Punctuated;
import com.tomaszrup.luafmt.syntax.ast.Suffix;
import com.tomaszrup.luafmt.syntax.ast.SuffixedExpression;
import com.tomaszrup.luafmt.syntax.ast.TableConstructor;
import com.tomaszrup.luafmt.syntax.ast.TokenExpression;
import com.tomaszrup.luafmt.syntax.ast.TypeAssertionExpression;
import com.tomaszrup.luafmt.syntax.ast.UnaryExpression;

/**
 * Formats expressions. {@link #format} lays an expression out on one line
 * wherever it can (calls, tables and functions still expand on their own
 * when they do not fit); {@link #hang} additionally breaks binary operator
 * chains onto continuation lines.
 */
public final class ExpressionFormatter {

	private ExpressionFormatter() {
	}

	public static Expression format(FormatContext ctx, Expression expression, Shape shape) {
		switch (expression.getKind()) {
			case BINARY:
				return formatBinary(ctx, (BinaryExpression) expression, shape);
			case UNARY:
				return formatUnary(ctx, (UnaryExpression) expression, shape);
			case PARENTHESES:
				return formatParentheses(ctx, (ParenthesesExpression) expression, shape);
			case FUNCTION:
				return FunctionFormatter.formatFunctionExpression(ctx, (FunctionExpression) expression, shape);
			case TABLE:
				return TableFormatter.formatTable(ctx, (TableConstructor) expression, shape);
			case VALUE:
				return formatValue(ctx, (TokenExpression) expression);
			case SUFFIXED:
				return formatSuffixed(ctx, (SuffixedExpression) expression, shape);
			case TYPE_ASSERTION:
				return DialectFormatter.formatTypeAssertion(ctx, (TypeAssertionExpression) expression, shape);
			default:
				throw new IllegalStateException("unknown node " + expression.getKind());
		}
	}

	/**
	 * Formats the expression, breaking binary chains at their lowest-precedence
	 * operators. Continuation lines start with the operator, indented at
	 * {@code hangShape}.
	 */
	public static Expression hang(FormatContext ctx, Expression expression, Shape shape, Shape hangShape) {
		if (expression instanceof BinaryExpression) {
			return hangBinary(ctx, (BinaryExpression) expression, shape, hangShape);
		}
		if (expression instanceof ParenthesesExpression) {
			ParenthesesExpression parentheses = (ParenthesesExpression) expression;
			if (isHangable(parentheses.getInner())) {
				Token open = GeneralFormatter.formatToken(parentheses.getOpen());
				Expression inner = hang(ctx, parentheses.getInner(), shape.add(1), hangShape);
				Token close = GeneralFormatter.formatToken(parentheses.getClose());
				return new ParenthesesExpression(open, inner, close);
			}
		}
		return format(ctx, expression, shape);
	}

	/**
	 * Whether {@link #hang} can lay the expression out differently from
	 * {@link #format}.
	 */
	public static boolean isHangable(Expression expression) {
		if (expression instanceof BinaryExpression) {
			return true;
		}
		return expression instanceof ParenthesesExpression
				&& isHangable(((ParenthesesExpression) expression).getInner());
	}

	private static Expression hangBinary(FormatContext ctx, BinaryExpression binary, Shape shape, Shape hangShape) {
		int precedence = LuaParser.binaryPriority(binary.getOperator())[0];
		Expression lhs = hangChainOperand(ctx, binary.getLhs(), precedence, shape, hangShape);

		Token operator = binary.getOperator();
		List<Trivia> leading = new ArrayList<>();
		List<Trivia> comments = GeneralFormatter.inlineLeadingTrivia(operator.getLeadingTrivia());
		if (!comments.isEmpty()) {
			leading.add(Trivia.whitespace(" "));
			leading.addAll(comments);
		}
		leading.add(ctx.newlineTrivia());
		leading.add(ctx.indentTrivia(hangShape));
		Token newOperator = GeneralFormatter.withTrailingSpace(
				operator.withTrivia(leading, GeneralFormatter.trailingComments(operator.getTrailingTrivia())));

		Shape rhsShape = hangShape.reset().add(operator.getText().length() + 1);
		Expression rhs = hangChainOperand(ctx, binary.getRhs(), precedence, rhsShape, hangShape);
		return new BinaryExpression(lhs, newOperator, rhs);
	}

	private static Expression hangChainOperand(FormatContext ctx, Expression operand, int precedence, Shape shape,
			Shape hangShape) {
		if (operand instanceof BinaryExpression
				&& LuaParser.binaryPriority(((BinaryExpression) operand).getOperator())[0] == precedence) {
			return hangBinary(ctx, (BinaryExpression) operand, shape, hangShape);
		}
		Expression formatted = format(ctx, operand, shape);
		if (isHangable(operand) && shape.takeFirstLine(CstPrinter.printTrimmed(formatted)).overBudget()) {
			return hang(ctx, operand, shape, hangShape.incrementAdditionalIndent());
		}
		return formatted;
	}

	private static Expression formatBinary(FormatContext ctx, BinaryExpression binary, Shape shape) {
		Expression lhs = format(ctx, binary.getLhs(), shape);
		Token operator = GeneralFormatter.formatSpaced(binary.getOperator());
		Shape rhsShape = shape.take(CstPrinter.print(lhs)).add(operator.getText().length() + 2);
		Expression rhs = format(ctx, binary.getRhs(), rhsShape);
		return new BinaryExpression(lhs, operator, rhs);
	}

	private static Expression formatUnary(FormatContext ctx, UnaryExpression unary, Shape shape) {
		Token operator = GeneralFormatter.formatToken(unary.getOperator());
		Expression operand = format(ctx, unary.getOperand(), shape.add(operator.getText().length() + 1));
		if (operator.is("not") || (operator.is("-") && CstPrinter.print(operand).startsWith("-"))) {
			operator = GeneralFormatter.withTrailingSpace(operator);
		}
		return new UnaryExpression(operator, operand);
	}

	private static Expression formatParentheses(FormatContext ctx, ParenthesesExpression parentheses, Shape shape) {
		Token open = GeneralFormatter.formatToken(parentheses.getOpen());
		Expression inner = format(ctx, parentheses.getInner(), shape.add(1));
		Token close = GeneralFormatter.formatToken(parentheses.getClose());
		return new ParenthesesExpression(open, inner, close);
	}

	static TokenExpression formatValue(FormatContext ctx, TokenExpression value) {
		return new TokenExpression(formatValueToken(ctx, value.getToken()));
	}

	static Token formatValueToken(FormatContext ctx, Token token) {
		Token formatted = GeneralFormatter.formatToken(token);
		if (token.getType() == TokenType.STRING) {
			return formatted.withText(StringLiterals.requote(token.getText(), ctx.getConfig().getQuoteStyle()));
		}
		return formatted;
	}

	private static Expression formatSuffixed(FormatContext ctx, SuffixedExpression suffixed, Shape shape) {
		Expression prefix = format(ctx, suffixed.getPrefix(), shape);
		Shape current = shape.take(CstPrinter.print(prefix));
		List<Suffix> suffixes = new ArrayList<>();
		for (Suffix suffix : suffixed.getSuffixes()) {
			Suffix formatted = formatSuffix(ctx, suffix, current);
			suffixes.add(formatted);
			current = current.take(CstPrinter.print(formatted));
		}
		return new SuffixedExpression(prefix, suffixes);
	}

	private static Suffix formatSuffix(FormatContext ctx, Suffix suffix, Shape shape) {
		if (suffix instanceof IndexSuffix) {
			IndexSuffix index = (IndexSuffix) suffix;
			if (index.isDot()) {
				return IndexSuffix.dot(GeneralFormatter.formatToken(index.getDot()),
						GeneralFormatter.formatToken(index.getName()));
			}
			Token open = GeneralFormatter.formatToken(index.getOpenBracket());
			Expression key = format(ctx, index.getKey(), shape.add(1));
			return IndexSuffix.brackets(open, key, GeneralFormatter.formatToken(index.getCloseBracket()));
		}
		CallSuffix call = (CallSuffix) suffix;
		if (call.isMethodCall()) {
			Token colon = GeneralFormatter.formatToken(call.getColon());
			Token name = GeneralFormatter.formatToken(call.getMethodName());
			Shape argsShape = shape.add(1 + name.getText().length());
			return new CallSuffix(colon, name, FunctionFormatter.formatArgs(ctx, call.getArgs(), argsShape));
		}
		return new CallSuffix(null, null, FunctionFormatter.formatArgs(ctx, call.getArgs(), shape));
	}

	// ------------------------------------------------------------------
	// Expression lists
	// ------------------------------------------------------------------

	/**
	 * Formats a comma separated list on one line: {@code a, b, c}.
	 */
	static Punctuated<Expression> formatList(FormatContext ctx, Punctuated<Expression> list, Shape shape) {
		List<Punctuated.Pair<Expression>> pairs = new ArrayList<>();
		Shape current = shape;
		for (Punctuated.Pair<Expression> pair : list.getPairs()) {
			Expression value = format(ctx, pair.getValue(), current);
			Token separator = null;
			if (pair.getSeparator() != null) {
				separator = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(pair.getSeparator()));
			}
			pairs.add(new Punctuated.Pair<>(value, separator));
			current = current.take(CstPrinter.print(value)).add(2);
		}
		return new Punctuated<>(pairs);
	}

	/**
	 * Formats a comma separated list, hanging every element that can hang.
	 */
	static Punctuated<Expression> hangList(FormatContext ctx, Punctuated<Expression> list, Shape shape,
			Shape hangShape) {
		List<Punctuated.Pair<Expression>> pairs = new ArrayList<>();
		Shape current = shape;
		for (Punctuated.Pair<Expression> pair : list.getPairs()) {
			Expression value = hang(ctx, pair.getValue(), current, hangShape);
			Token separator = null;
			if (pair.getSeparator() != null) {
				separator = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(pair.getSeparator()));
			}
			pairs.add(new Punctuated.Pair<>(value, separator));
			current = current.take(CstPrinter.print(value)).add(2);
		}
		return new Punctuated<>(pairs);
	}

	static boolean anyHangable(Punctuated<Expression> list) {
		for (Expression value : list.values()) {
			if (isHangable(value)) {
				return true;
			}
		}
		return false;
	}
}
