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
import com.tomaszrup.luafmt.syntax.TokenType;
import com.tomaszrup.luafmt.syntax.Tokens;
import com.tomaszrup.luafmt.syntax.Trivia;
import com.tomaszrup.luafmt.syntax.ast.Block;
import com.tomaszrup.luafmt.syntax.ast.Expression;
import com.tomaszrup.luafmt.syntax.ast.FunctionArgs;
import com.tomaszrup.luafmt.syntax.ast.FunctionBody;
import com.tomaszrup.luafmt.syntax.ast.FunctionCallStmt;
import com.tomaszrup.luafmt.syntax.ast.FunctionDeclarationStmt;
import com.tomaszrup.luafmt.syntax.ast.FunctionExpression;
import com.tomaszrup.luafmt.syntax.ast.FunctionName;
import com.tomaszrup.luafmt.syntax.ast.GenericDeclaration;
import com.tomaszrup.luafmt.syntax.ast.LocalFunctionStmt;
import com.tomaszrup.luafmt.syntax.ast.Parameter;
import com.tomaszrup.luafmt.syntax.ast.Punctuated;
import com.tomaszrup.luafmt.syntax.ast.SuffixedExpression;
import com.tomaszrup.luafmt.syntax.ast.TableConstructor;
import com.tomaszrup.luafmt.syntax.ast.TokenExpression;
import com.tomaszrup.luafmt.syntax.ast.TypeSpecifier;

/**
 * Formats call arguments, function bodies and the statements built on them.
 */
final class FunctionFormatter {

	private FunctionFormatter() {
	}

	// ------------------------------------------------------------------
	// Call arguments
	// ------------------------------------------------------------------

	/**
	 * Formats call arguments starting at {@code shape}, which points just after
	 * the callee.
	 */
	static FunctionArgs formatArgs(FormatContext ctx, FunctionArgs args, Shape shape) {
		boolean omitParentheses = ctx.getConfig().isNoCallParentheses();
		switch (args.getKind()) {
			case STRING: {
				Token string = ExpressionFormatter.formatValueToken(ctx, args.getString());
				if (omitParentheses) {
					return FunctionArgs.string(GeneralFormatter.withLeadingSpace(string));
				}
				return wrapInParentheses(new TokenExpression(string));
			}
			case TABLE: {
				TableConstructor table = TableFormatter.formatTable(ctx, args.getTable(), shape.add(1));
				if (omitParentheses) {
					return FunctionArgs.table(table.mapTokens(GeneralFormatter.leadingSpace(table)));
				}
				return wrapInParentheses(table);
			}
			case PARENTHESES:
				return formatParenthesizedArgs(ctx, args, shape);
			default:
				throw new IllegalStateException("unknown node " + args.getKind());
		}
	}

	private static FunctionArgs wrapInParentheses(Expression argument) {
		List<Trivia> moved = new ArrayList<>();
		Expression inner = argument.mapTokens(GeneralFormatter.takeTrailingComments(argument, moved));
		Token close = Token.symbol(")").withTrailingTrivia(GeneralFormatter.spaced(moved));
		return FunctionArgs.parentheses(Token.symbol("("), single(inner), close);
	}

	private static FunctionArgs formatParenthesizedArgs(FormatContext ctx, FunctionArgs args, Shape shape) {
		Token open = args.getOpenParen();
		Token close = args.getCloseParen();
		Punctuated<Expression> arguments = args.getArguments();
		boolean parenthesesHaveComments = TriviaUtil.tokenHasComments(open) || TriviaUtil.tokenHasComments(close);

		if (arguments.size() == 1 && !parenthesesHaveComments) {
			Expression only = arguments.get(0);
			if (ctx.getConfig().isNoCallParentheses()) {
				if (only instanceof TokenExpression
						&& ((TokenExpression) only).getToken().getType() == TokenType.STRING) {
					Token string = ExpressionFormatter.formatValueToken(ctx, ((TokenExpression) only).getToken());
					return FunctionArgs.string(GeneralFormatter.withLeadingSpace(string));
				}
				if (only instanceof TableConstructor) {
					TableConstructor table = TableFormatter.formatTable(ctx, (TableConstructor) only, shape.add(1));
					return FunctionArgs.table(table.mapTokens(GeneralFormatter.leadingSpace(table)));
				}
			}
			if (only instanceof TableConstructor || only instanceof FunctionExpression) {
				Expression hugged = ExpressionFormatter.format(ctx, only, shape.add(1));
				return FunctionArgs.parentheses(GeneralFormatter.formatToken(open), single(hugged),
						GeneralFormatter.formatToken(close));
			}
		}

		FunctionArgs singleLine = FunctionArgs.parentheses(GeneralFormatter.formatToken(open),
				ExpressionFormatter.formatList(ctx, arguments, shape.add(1)), GeneralFormatter.formatToken(close));
		boolean expand = !arguments.isEmpty() && (TriviaUtil.tokenHasTrailingComments(open)
				|| TriviaUtil.tokenHasLeadingComments(close)
				|| TriviaUtil.hasEdgeComments(arguments)
				|| shape.takeFirstLine(CstPrinter.printTrimmed(singleLine)).overBudget());
		if (!expand) {
			return singleLine;
		}

		Shape argShape = shape.reset().incrementAdditionalIndent();
		List<Expression> formatted = new ArrayList<>();
		for (Expression argument : arguments.values()) {
			Expression value = ExpressionFormatter.format(ctx, argument, argShape);
			if (ExpressionFormatter.isHangable(argument)
					&& argShape.takeFirstLine(CstPrinter.printTrimmed(value)).overBudget()) {
				value = ExpressionFormatter.hang(ctx, argument, argShape, argShape.incrementAdditionalIndent());
			}
			formatted.add(value);
		}
		Token newOpen = GeneralFormatter.withTrailingNewline(ctx, GeneralFormatter.formatToken(open));
		Punctuated<Expression> list = GeneralFormatter.layoutOnePerLine(ctx, arguments, formatted,
				Expression::mapTokens, argShape, null, false);
		return FunctionArgs.parentheses(newOpen, list, GeneralFormatter.formatEndToken(ctx, close, shape));
	}

	private static Punctuated<Expression> single(Expression expression) {
		return new Punctuated<>(Collections.singletonList(new Punctuated.Pair<Expression>(expression, null)));
	}

	// ------------------------------------------------------------------
	// Function bodies
	// ------------------------------------------------------------------

	/**
	 * Formats {@code <T>(params): R block end}. {@code shape} points at the
	 * generics or opening parenthesis; the block is indented one level deeper
	 * than the line the shape belongs to.
	 */
	static FunctionBody formatBody(FormatContext ctx, FunctionBody body, Shape shape) {
		Shape current = shape;
		GenericDeclaration generics = DialectFormatter.formatGenerics(ctx, body.getGenerics(), current);
		if (generics != null) {
			current = current.take(CstPrinter.print(generics));
		}

		Token open = body.getOpenParen();
		Token close = body.getCloseParen();
		Punctuated<Parameter> parameters = body.getParameters();
		Punctuated<Parameter> singleLine = formatParameters(ctx, parameters, current.add(1));
		boolean expand = !parameters.isEmpty() && (TriviaUtil.tokenHasTrailingComments(open)
				|| TriviaUtil.tokenHasLeadingComments(close)
				|| TriviaUtil.hasEdgeComments(parameters)
				|| current.takeFirstLine("(" + CstPrinter.print(singleLine) + ")").overBudget());

		Token newOpen;
		Punctuated<Parameter> newParameters;
		Token newClose;
		if (expand) {
			Shape parameterShape = shape.reset().incrementAdditionalIndent();
			newOpen = GeneralFormatter.withTrailingNewline(ctx, GeneralFormatter.formatToken(open));
			List<Parameter> formatted = new ArrayList<>();
			for (Parameter parameter : parameters.values()) {
				formatted.add(formatParameter(ctx, parameter, parameterShape));
			}
			newParameters = GeneralFormatter.layoutOnePerLine(ctx, parameters, formatted, Parameter::mapTokens,
					parameterShape, null, false);
			newClose = GeneralFormatter.formatEndToken(ctx, close, shape);
		} else {
			newOpen = GeneralFormatter.formatToken(open);
			newParameters = singleLine;
			newClose = GeneralFormatter.formatToken(close);
		}

		TypeSpecifier returnType = DialectFormatter.formatTypeSpecifier(ctx, body.getReturnType(),
				current.add(2).take(CstPrinter.print(singleLine)));
		Token end = body.getEndToken();
		Token lastHeaderToken = body.getReturnType() != null ? Tokens.last(body.getReturnType()) : close;
		if (body.getBlock().isEmpty() && !TriviaUtil.tokenHasComments(end)
				&& !TriviaUtil.tokenHasTrailingComments(lastHeaderToken)) {
			return new FunctionBody(generics, newOpen, newParameters, newClose, returnType, body.getBlock(),
					GeneralFormatter.withLeadingSpace(GeneralFormatter.formatToken(end)));
		}

		if (returnType != null) {
			returnType = returnType.mapTokens(GeneralFormatter.trailingNewline(ctx, returnType));
		} else {
			newClose = GeneralFormatter.withTrailingNewline(ctx, newClose);
		}
		Block block = BlockFormatter.formatBlock(ctx, body.getBlock(), shape.nestedBlock());
		return new FunctionBody(generics, newOpen, newParameters, newClose, returnType, block,
				GeneralFormatter.formatEndToken(ctx, end, shape));
	}

	private static Punctuated<Parameter> formatParameters(FormatContext ctx, Punctuated<Parameter> parameters,
			Shape shape) {
		List<Punctuated.Pair<Parameter>> pairs = new ArrayList<>();
		Shape current = shape;
		for (Punctuated.Pair<Parameter> pair : parameters.getPairs()) {
			Parameter parameter = formatParameter(ctx, pair.getValue(), current);
			Token separator = null;
			if (pair.getSeparator() != null) {
				separator = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(pair.getSeparator()));
			}
			pairs.add(new Punctuated.Pair<>(parameter, separator));
			current = current.take(CstPrinter.print(parameter)).add(2);
		}
		return new Punctuated<>(pairs);
	}

	private static Parameter formatParameter(FormatContext ctx, Parameter parameter, Shape shape) {
		Token name = GeneralFormatter.formatToken(parameter.getName());
		TypeSpecifier type = DialectFormatter.formatTypeSpecifier(ctx, parameter.getType(),
				shape.add(name.getText().length()));
		return new Parameter(name, type);
	}

	// ------------------------------------------------------------------
	// Function expressions and statements
	// ------------------------------------------------------------------

	static FunctionExpression formatFunctionExpression(FormatContext ctx, FunctionExpression function, Shape shape) {
		Token functionToken = GeneralFormatter.formatToken(function.getFunctionToken());
		return new FunctionExpression(functionToken, formatBody(ctx, function.getBody(), shape.add(8)));
	}

	static FunctionDeclarationStmt formatFunctionDeclaration(FormatContext ctx, FunctionDeclarationStmt declaration,
			Shape shape) {
		Token functionToken = GeneralFormatter
				.withTrailingSpace(GeneralFormatter.formatToken(declaration.getFunctionToken()));
		FunctionName name = formatFunctionName(declaration.getName());
		Shape bodyShape = shape.add(9).take(CstPrinter.print(name));
		return new FunctionDeclarationStmt(functionToken, name, formatBody(ctx, declaration.getBody(), bodyShape));
	}

	private static FunctionName formatFunctionName(FunctionName name) {
		List<Punctuated.Pair<Token>> pairs = new ArrayList<>();
		for (Punctuated.Pair<Token> pair : name.getNames().getPairs()) {
			Token separator = pair.getSeparator() != null ? GeneralFormatter.formatToken(pair.getSeparator()) : null;
			pairs.add(new Punctuated.Pair<>(GeneralFormatter.formatToken(pair.getValue()), separator));
		}
		Token colon = name.getColon() != null ? GeneralFormatter.formatToken(name.getColon()) : null;
		Token methodName = name.getMethodName() != null ? GeneralFormatter.formatToken(name.getMethodName()) : null;
		return new FunctionName(new Punctuated<>(pairs), colon, methodName);
	}

	static LocalFunctionStmt formatLocalFunction(FormatContext ctx, LocalFunctionStmt function, Shape shape) {
		Token local = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(function.getLocalToken()));
		Token functionToken = GeneralFormatter
				.withTrailingSpace(GeneralFormatter.formatToken(function.getFunctionToken()));
		Token name = GeneralFormatter.formatToken(function.getName());
		Shape bodyShape = shape.add(15 + name.getText().length());
		return new LocalFunctionStmt(local, functionToken, name, formatBody(ctx, function.getBody(), bodyShape));
	}

	static FunctionCallStmt formatFunctionCall(FormatContext ctx, FunctionCallStmt call, Shape shape) {
		return new FunctionCallStmt((SuffixedExpression) ExpressionFormatter.format(ctx, call.getCall(), shape));
	}
}
