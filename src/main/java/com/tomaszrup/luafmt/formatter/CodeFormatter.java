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

import com.tomaszrup.luafmt.config.FormatRange;
import com.tomaszrup.luafmt.config.FormatterConfig;
import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.Trivia;
import com.tomaszrup.luafmt.syntax.ast.Ast;
import com.tomaszrup.luafmt.syntax.ast.Block;

/**
 * Formats a whole file: the top-level block, the comments at the end of the
 * file, and finally the line-comment repair pass.
 */
public final class CodeFormatter {

	private CodeFormatter() {
	}

	public static Ast format(Ast ast, FormatterConfig config, FormatRange range) {
		FormatContext ctx = new FormatContext(config, range);
		Block block = BlockFormatter.formatBlock(ctx, ast.getBlock(), Shape.from(config));
		Token eof = ast.getEof();
		if (ctx.shouldFormatEof(eof)) {
			eof = formatEof(ctx, eof, !block.isEmpty());
		}
		return LineCommentGuard.apply(ctx, new Ast(block, eof));
	}

	/**
	 * Puts each end-of-file comment on its own line. One blank line is kept
	 * where the source had one, except before the first comment of an
	 * otherwise empty file.
	 */
	private static Token formatEof(FormatContext ctx, Token eof, boolean hasCode) {
		List<Trivia> leading = new ArrayList<>();
		int newlines = 0;
		boolean first = true;
		for (Trivia piece : eof.getLeadingTrivia()) {
			if (piece.isWhitespace()) {
				newlines += TriviaUtil.countNewlines(piece.getText());
				continue;
			}
			boolean blankLine = first ? hasCode && newlines >= 1 : newlines >= 2;
			if (blankLine) {
				leading.add(ctx.newlineTrivia());
			}
			leading.add(piece);
			leading.add(ctx.newlineTrivia());
			newlines = 0;
			first = false;
		}
		return eof.withTrivia(leading, eof.getTrailingTrivia());
	}
}
