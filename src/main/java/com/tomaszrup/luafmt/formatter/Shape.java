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

import com.tomaszrup.luafmt.config.FormatterConfig;

/**
 * The horizontal budget available at a point in the output: the block
 * indentation level, extra hanging indentation, and the width already used
 * on the current line after the indentation.
 *
 * <p>A shape is over budget when the indentation width plus the offset
 * exceeds the configured column width. Tabs count as {@code indentWidth}
 * columns.</p>
 */
public final class Shape {

	private final int indentLevel;
	private final int additionalIndent;
	private final int offset;
	private final int columnWidth;
	private final int indentWidth;

	Shape(int indentLevel, int additionalIndent, int offset, int columnWidth, int indentWidth) {
		this.indentLevel = indentLevel;
		this.additionalIndent = additionalIndent;
		this.offset = offset;
		this.columnWidth = columnWidth;
		this.indentWidth = indentWidth;
	}

	public static Shape from(FormatterConfig config) {
		return new Shape(0, 0, 0, config.getColumnWidth(), config.getIndentWidth());
	}

	public int getIndentLevel() {
		return indentLevel;
	}

	public int getAdditionalIndent() {
		return additionalIndent;
	}

	public int getOffset() {
		return offset;
	}

	public int getColumnWidth() {
		return columnWidth;
	}

	/** Number of indentation units at the start of a line in this shape. */
	public int totalIndentLevel() {
		return indentLevel + additionalIndent;
	}

	public int indentColumns() {
		return totalIndentLevel() * indentWidth;
	}

	public int usedWidth() {
		return indentColumns() + offset;
	}

	public boolean overBudget() {
		return usedWidth() > columnWidth;
	}

	/** Same indentation, at the start of a fresh line. */
	public Shape reset() {
		return new Shape(indentLevel, additionalIndent, 0, columnWidth, indentWidth);
	}

	public Shape incrementBlockIndent() {
		return new Shape(indentLevel + 1, additionalIndent, offset, columnWidth, indentWidth);
	}

	public Shape incrementAdditionalIndent() {
		return new Shape(indentLevel, additionalIndent + 1, offset, columnWidth, indentWidth);
	}

	/**
	 * Shape for the statements of a block opened on a line of this shape:
	 * hanging indentation folds into the block level.
	 */
	public Shape nestedBlock() {
		return new Shape(totalIndentLevel() + 1, 0, 0, columnWidth, indentWidth);
	}

	public Shape add(int width) {
		return new Shape(indentLevel, additionalIndent, offset + width, columnWidth, indentWidth);
	}

	/**
	 * Advances past {@code text}. When it spans several lines the offset
	 * becomes the width of its last line beyond the indentation.
	 */
	public Shape take(String text) {
		int newline = text.lastIndexOf('\n');
		if (newline < 0) {
			return add(width(text));
		}
		int last = width(text.substring(newline + 1));
		return new Shape(indentLevel, additionalIndent, Math.max(0, last - indentColumns()), columnWidth,
				indentWidth);
	}

	public Shape takeFirstLine(String text) {
		int newline = text.indexOf('\n');
		return add(width(newline < 0 ? text : text.substring(0, newline)));
	}

	/** Display width of a single line, counting tabs as one indentation unit. */
	public int width(String line) {
		int width = 0;
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if (c == '\t') {
				width += indentWidth;
			} else if (c != '\r') {
				width++;
			}
		}
		return width;
	}

	@Override
	public String toString() {
		return "Shape{indent=" + indentLevel + "+" + additionalIndent + ", offset=" + offset + "}";
	}
}
