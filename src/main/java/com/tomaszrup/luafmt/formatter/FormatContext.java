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

import com.tomaszrup.luafmt.config.FormatRange;
import com.tomaszrup.luafmt.config.FormatterConfig;
import com.tomaszrup.luafmt.config.IndentType;
import com.tomaszrup.luafmt.syntax.SyntaxNode;
import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.Tokens;
import com.tomaszrup.luafmt.syntax.Trivia;

/**
 * Read-only state shared by every formatter during one run: the
 * configuration and the optional range limiting which statements change.
 */
public final class FormatContext {

	private final FormatterConfig config;
	private final FormatRange range;
	private final String indentUnit;
	private final String newline;

	public FormatContext(FormatterConfig config, FormatRange range) {
		this.config = config;
		this.range = range;
		this.indentUnit = config.getIndentType() == IndentType.TABS
				? "\t"
				: " ".repeat(config.getIndentWidth());
		this.newline = config.getLineEndings().getNewline();
	}

	public FormatterConfig getConfig() {
		return config;
	}

	public FormatRange getRange() {
		return range;
	}

	/**
	 * Whether the node lies entirely inside the formatting range. Trivia is
	 * ignored: only the first and last significant token count.
	 */
	public boolean shouldFormatNode(SyntaxNode node) {
		if (range == null) {
			return true;
		}
		Token first = Tokens.first(node);
		Token last = Tokens.last(node);
		if (first == null || first.isSynthetic() || last.isSynthetic()) {
			return true;
		}
		return range.covers(first.getStartOffset(), last.getEndOffset());
	}

	/**
	 * Whether trailing file comments should be reformatted: only when the
	 * range is open-ended or reaches the end of the input.
	 */
	public boolean shouldFormatEof(Token eof) {
		return range == null || range.getEnd() == null || range.getEnd() >= eof.getStartOffset() - 1;
	}

	public String indentUnit() {
		return indentUnit;
	}

	public String indent(Shape shape) {
		return indentUnit.repeat(shape.totalIndentLevel());
	}

	public Trivia indentTrivia(Shape shape) {
		return Trivia.whitespace(indent(shape));
	}

	public String newline() {
		return newline;
	}

	public Trivia newlineTrivia() {
		return Trivia.whitespace(newline);
	}
}
