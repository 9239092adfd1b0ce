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

import com.tomaszrup.luafmt.config.FormatterConfig;
import com.tomaszrup.luafmt.syntax.CstPrinter;
import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.ast.Expression;
import com.tomaszrup.luafmt.syntax.ast.Punctuated;
import com.tomaszrup.luafmt.syntax.ast.TableConstructor;
import com.tomaszrup.luafmt.syntax.ast.TableField;

/**
 * Formats table constructors, either on one line ({@code { a, b }}) or with
 * one field per line.
 */
final class TableFormatter {

	private TableFormatter() {
	}

	static TableConstructor formatTable(FormatContext ctx, TableConstructor table, Shape shape) {
		FormatterConfig config = ctx.getConfig();
		Token open = table.getOpen();
		Token close = table.getClose();
		Punctuated<TableField> fields = table.getFields();

		if (fields.isEmpty()) {
			if (TriviaUtil.tokenHasTrailingComments(open) || TriviaUtil.tokenHasLeadingComments(close)) {
				return new TableConstructor(GeneralFormatter.withTrailingNewline(ctx, GeneralFormatter.formatToken(open)),
						fields, GeneralFormatter.formatEndToken(ctx, close, shape));
			}
			Token newOpen = GeneralFormatter.formatToken(open);
			if (config.isExtraSpaceInEmptyTable()) {
				newOpen = GeneralFormatter.withTrailingSpace(newOpen);
			}
			return new TableConstructor(newOpen, fields, GeneralFormatter.formatToken(close));
		}

		TableConstructor singleLine = formatSingleLine(ctx, table, shape);
		String text = CstPrinter.printTrimmed(singleLine);
		boolean expand = TriviaUtil.tokenHasTrailingComments(open)
				|| TriviaUtil.tokenHasLeadingComments(close)
				|| TriviaUtil.hasEdgeComments(fields)
				|| text.indexOf('\n') >= 0
				|| shape.takeFirstLine(text).overBudget();
		if (!expand) {
			return singleLine;
		}
		return formatExpanded(ctx, table, shape);
	}

	private static TableConstructor formatSingleLine(FormatContext ctx, TableConstructor table, Shape shape) {
		FormatterConfig config = ctx.getConfig();
		String separatorText = config.getTableSeparators().getSymbol();
		boolean padding = config.isExtraSpacesInsideTable();

		Token open = GeneralFormatter.formatToken(table.getOpen());
		if (padding) {
			open = GeneralFormatter.withTrailingSpace(open);
		}
		List<Punctuated.Pair<TableField>> pairs = new ArrayList<>();
		List<Punctuated.Pair<TableField>> original = table.getFields().getPairs();
		Shape current = shape.add(padding ? 2 : 1);
		for (int i = 0; i < original.size(); i++) {
			Punctuated.Pair<TableField> pair = original.get(i);
			TableField field = formatField(ctx, pair.getValue(), current);
			current = current.take(CstPrinter.print(field));
			boolean last = i == original.size() - 1;
			Token separator = null;
			if (!last) {
				separator = GeneralFormatter.withTrailingSpace(GeneralFormatter.formatToken(pair.getSeparator(),
						separatorText));
				current = current.add(2);
			} else if (config.isExtraSepAtTableEnd()) {
				separator = pair.getSeparator() != null
						? GeneralFormatter.formatToken(pair.getSeparator(), separatorText)
						: Token.symbol(separatorText);
			}
			pairs.add(new Punctuated.Pair<>(field, separator));
		}
		Token close = GeneralFormatter.formatToken(table.getClose());
		if (padding) {
			close = GeneralFormatter.withLeadingSpace(close);
		}
		return new TableConstructor(open, new Punctuated<>(pairs), close);
	}

	private static TableConstructor formatExpanded(FormatContext ctx, TableConstructor table, Shape shape) {
		Shape fieldShape = shape.reset().incrementAdditionalIndent();
		List<TableField> formatted = new ArrayList<>();
		for (TableField field : table.getFields().values()) {
			TableField value = formatField(ctx, field, fieldShape);
			if (ExpressionFormatter.isHangable(field.getValue())
					&& fieldShape.takeFirstLine(CstPrinter.printTrimmed(value)).overBudget()) {
				value = hangField(ctx, field, fieldShape);
			}
			formatted.add(value);
		}
		Token open = GeneralFormatter.withTrailingNewline(ctx, GeneralFormatter.formatToken(table.getOpen()));
		Punctuated<TableField> fields = GeneralFormatter.layoutOnePerLine(ctx, table.getFields(), formatted,
				TableField::mapTokens, fieldShape, ctx.getConfig().getTableSeparators().getSymbol(), true);
		return new TableConstructor(open, fields, GeneralFormatter.formatEndToken(ctx, table.getClose(), shape));
	}

	private static TableField formatField(FormatContext ctx, TableField field, Shape shape) {
		switch (field.getKind()) {
			case NAME_KEY: {
				Token name = GeneralFormatter.formatToken(field.getName());
				Token equals = GeneralFormatter.formatSpaced(field.getEquals());
				Expression value = ExpressionFormatter.format(ctx, field.getValue(),
						shape.add(name.getText().length() + 3));
				return TableField.nameKey(name, equals, value);
			}
			case EXPRESSION_KEY: {
				Token openBracket = GeneralFormatter.formatToken(field.getOpenBracket());
				Expression key = ExpressionFormatter.format(ctx, field.getKey(), shape.add(1));
				Token closeBracket = GeneralFormatter.formatToken(field.getCloseBracket());
				Token equals = GeneralFormatter.formatSpaced(field.getEquals());
				Shape valueShape = shape.add(1).take(CstPrinter.print(key)).add(4);
				Expression value = ExpressionFormatter.format(ctx, field.getValue(), valueShape);
				return TableField.expressionKey(openBracket, key, closeBracket, equals, value);
			}
			case NO_KEY:
				return TableField.noKey(ExpressionFormatter.format(ctx, field.getValue(), shape));
			default:
				throw new IllegalStateException("unknown node " + field.getKind());
		}
	}

	private static TableField hangField(FormatContext ctx, TableField field, Shape shape) {
		TableField formatted = formatField(ctx, field, shape);
		String text = CstPrinter.print(formatted);
		String prefix = text.substring(0, text.length() - CstPrinter.print(formatted.getValue()).length());
		Shape valueShape = shape.add(shape.width(prefix));
		Expression value = ExpressionFormatter.hang(ctx, field.getValue(), valueShape,
				shape.incrementAdditionalIndent());
		switch (formatted.getKind()) {
			case NAME_KEY:
				return TableField.nameKey(formatted.getName(), formatted.getEquals(), value);
			case EXPRESSION_KEY:
				return TableField.expressionKey(formatted.getOpenBracket(), formatted.getKey(),
						formatted.getCloseBracket(), formatted.getEquals(), value);
			default:
				return TableField.noKey(value);
		}
	}
}
