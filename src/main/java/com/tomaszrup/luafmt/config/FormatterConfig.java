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
package com.tomaszrup.luafmt.config;

import java.util.Objects;

import com.tomaszrup.luafmt.syntax.LuaDialect;

/**
 * Immutable set of formatting knobs. The no-argument constructor yields the
 * defaults; each {@code withX} method returns a modified copy.
 */
public final class FormatterConfig {

	public static final int DEFAULT_COLUMN_WIDTH = 120;
	public static final int DEFAULT_INDENT_WIDTH = 4;

	private final int columnWidth;
	private final LineEndings lineEndings;
	private final IndentType indentType;
	private final int indentWidth;
	private final QuoteStyle quoteStyle;
	private final boolean noCallParentheses;
	private final TableSeparators tableSeparators;
	private final boolean extraSepAtTableEnd;
	private final boolean extraSpacesInsideTable;
	private final boolean extraSpaceInEmptyTable;
	private final LuaDialect syntax;

	public FormatterConfig() {
		this(DEFAULT_COLUMN_WIDTH, LineEndings.UNIX, IndentType.TABS, DEFAULT_INDENT_WIDTH,
				QuoteStyle.AUTO_PREFER_DOUBLE, false, TableSeparators.COMMA, false, true, false, LuaDialect.ALL);
	}

	private FormatterConfig(int columnWidth, LineEndings lineEndings, IndentType indentType, int indentWidth,
			QuoteStyle quoteStyle, boolean noCallParentheses, TableSeparators tableSeparators,
			boolean extraSepAtTableEnd, boolean extraSpacesInsideTable, boolean extraSpaceInEmptyTable,
			LuaDialect syntax) {
		if (columnWidth <= 0) {
			throw new IllegalArgumentException("column width must be positive: " + columnWidth);
		}
		if (indentWidth <= 0) {
			throw new IllegalArgumentException("indent width must be positive: " + indentWidth);
		}
		this.columnWidth = columnWidth;
		this.lineEndings = Objects.requireNonNull(lineEndings, "lineEndings");
		this.indentType = Objects.requireNonNull(indentType, "indentType");
		this.indentWidth = indentWidth;
		this.quoteStyle = Objects.requireNonNull(quoteStyle, "quoteStyle");
		this.noCallParentheses = noCallParentheses;
		this.tableSeparators = Objects.requireNonNull(tableSeparators, "tableSeparators");
		this.extraSepAtTableEnd = extraSepAtTableEnd;
		this.extraSpacesInsideTable = extraSpacesInsideTable;
		this.extraSpaceInEmptyTable = extraSpaceInEmptyTable;
		this.syntax = Objects.requireNonNull(syntax, "syntax");
	}

	public int getColumnWidth() {
		return columnWidth;
	}

	public LineEndings getLineEndings() {
		return lineEndings;
	}

	public IndentType getIndentType() {
		return indentType;
	}

	public int getIndentWidth() {
		return indentWidth;
	}

	public QuoteStyle getQuoteStyle() {
		return quoteStyle;
	}

	public boolean isNoCallParentheses() {
		return noCallParentheses;
	}

	public TableSeparators getTableSeparators() {
		return tableSeparators;
	}

	public boolean isExtraSepAtTableEnd() {
		return extraSepAtTableEnd;
	}

	public boolean isExtraSpacesInsideTable() {
		return extraSpacesInsideTable;
	}

	public boolean isExtraSpaceInEmptyTable() {
		return extraSpaceInEmptyTable;
	}

	/** The dialect whose syntax the parser accepts. */
	public LuaDialect getSyntax() {
		return syntax;
	}

	public FormatterConfig withColumnWidth(int value) {
		return new FormatterConfig(value, lineEndings, indentType, indentWidth, quoteStyle, noCallParentheses,
				tableSeparators, extraSepAtTableEnd, extraSpacesInsideTable, extraSpaceInEmptyTable, syntax);
	}

	public FormatterConfig withLineEndings(LineEndings value) {
		return new FormatterConfig(columnWidth, value, indentType, indentWidth, quoteStyle, noCallParentheses,
				tableSeparators, extraSepAtTableEnd, extraSpacesInsideTable, extraSpaceInEmptyTable, syntax);
	}

	public FormatterConfig withIndentType(IndentType value) {
		return new FormatterConfig(columnWidth, lineEndings, value, indentWidth, quoteStyle, noCallParentheses,
				tableSeparators, extraSepAtTableEnd, extraSpacesInsideTable, extraSpaceInEmptyTable, syntax);
	}

	public FormatterConfig withIndentWidth(int value) {
		return new FormatterConfig(columnWidth, lineEndings, indentType, value, quoteStyle, noCallParentheses,
				tableSeparators, extraSepAtTableEnd, extraSpacesInsideTable, extraSpaceInEmptyTable, syntax);
	}

	public FormatterConfig withQuoteStyle(QuoteStyle value) {
		return new FormatterConfig(columnWidth, lineEndings, indentType, indentWidth, value, noCallParentheses,
				tableSeparators, extraSepAtTableEnd, extraSpacesInsideTable, extraSpaceInEmptyTable, syntax);
	}

	public FormatterConfig withNoCallParentheses(boolean value) {
		return new FormatterConfig(columnWidth, lineEndings, indentType, indentWidth, quoteStyle, value,
				tableSeparators, extraSepAtTableEnd, extraSpacesInsideTable, extraSpaceInEmptyTable, syntax);
	}

	public FormatterConfig withTableSeparators(TableSeparators value) {
		return new FormatterConfig(columnWidth, lineEndings, indentType, indentWidth, quoteStyle, noCallParentheses,
				value, extraSepAtTableEnd, extraSpacesInsideTable, extraSpaceInEmptyTable, syntax);
	}

	public FormatterConfig withExtraSepAtTableEnd(boolean value) {
		return new FormatterConfig(columnWidth, lineEndings, indentType, indentWidth, quoteStyle, noCallParentheses,
				tableSeparators, value, extraSpacesInsideTable, extraSpaceInEmptyTable, syntax);
	}

	public FormatterConfig withExtraSpacesInsideTable(boolean value) {
		return new FormatterConfig(columnWidth, lineEndings, indentType, indentWidth, quoteStyle, noCallParentheses,
				tableSeparators, extraSepAtTableEnd, value, extraSpaceInEmptyTable, syntax);
	}

	public FormatterConfig withExtraSpaceInEmptyTable(boolean value) {
		return new FormatterConfig(columnWidth, lineEndings, indentType, indentWidth, quoteStyle, noCallParentheses,
				tableSeparators, extraSepAtTableEnd, extraSpacesInsideTable, value, syntax);
	}

	public FormatterConfig withSyntax(LuaDialect value) {
		return new FormatterConfig(columnWidth, lineEndings, indentType, indentWidth, quoteStyle, noCallParentheses,
				tableSeparators, extraSepAtTableEnd, extraSpacesInsideTable, extraSpaceInEmptyTable, value);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FormatterConfig)) {
			return false;
		}
		FormatterConfig other = (FormatterConfig) o;
		return columnWidth == other.columnWidth
				&& lineEndings == other.lineEndings
				&& indentType == other.indentType
				&& indentWidth == other.indentWidth
				&& quoteStyle == other.quoteStyle
				&& noCallParentheses == other.noCallParentheses
				&& tableSeparators == other.tableSeparators
				&& extraSepAtTableEnd == other.extraSepAtTableEnd
				&& extraSpacesInsideTable == other.extraSpacesInsideTable
				&& extraSpaceInEmptyTable == other.extraSpaceInEmptyTable
				&& syntax == other.syntax;
	}

	@Override
	public int hashCode() {
		return Objects.hash(columnWidth, lineEndings, indentType, indentWidth, quoteStyle, noCallParentheses,
				tableSeparators, extraSepAtTableEnd, extraSpacesInsideTable, extraSpaceInEmptyTable, syntax);
	}

	@Override
	public String toString() {
		return "FormatterConfig{columnWidth=" + columnWidth
				+ ", lineEndings=" + lineEndings
				+ ", indentType=" + indentType
				+ ", indentWidth=" + indentWidth
				+ ", quoteStyle=" + quoteStyle
				+ ", noCallParentheses=" + noCallParentheses
				+ ", tableSeparators=" + tableSeparators
				+ ", extraSepAtTableEnd=" + extraSepAtTableEnd
				+ ", extraSpacesInsideTable=" + extraSpacesInsideTable
				+ ", extraSpaceInEmptyTable=" + extraSpaceInEmptyTable
				+ ", syntax=" + syntax + "}";
	}
}
