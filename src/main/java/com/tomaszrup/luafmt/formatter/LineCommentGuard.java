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
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.TokenType;
import com.tomaszrup.luafmt.syntax.Tokens;
import com.tomaszrup.luafmt.syntax.Trivia;
import com.tomaszrup.luafmt.syntax.TriviaKind;
import com.tomaszrup.luafmt.syntax.ast.Ast;

/**
 * Final pass over the formatted tree: a single-line comment must always be
 * followed by a line break. Where formatting placed code (or another
 * comment) after one on the same line, a newline is inserted, continuing at
 * the comment line's indentation plus one level.
 */
final class LineCommentGuard {

	private final FormatContext ctx;
	private final StringBuilder line = new StringBuilder();
	private boolean pendingBreak;
	private String breakIndent = "";

	private LineCommentGuard(FormatContext ctx) {
		this.ctx = ctx;
	}

	static Ast apply(FormatContext ctx, Ast ast) {
		return new LineCommentGuard(ctx).rewrite(ast);
	}

	private Ast rewrite(Ast ast) {
		Map<Token, Token> replacements = new IdentityHashMap<>();
		for (Token token : Tokens.collect(ast)) {
			Token rewritten = rewrite(token);
			if (rewritten != token) {
				replacements.put(token, rewritten);
			}
		}
		if (replacements.isEmpty()) {
			return ast;
		}
		return ast.mapTokens(token -> replacements.getOrDefault(token, token));
	}

	private Token rewrite(Token token) {
		boolean changed = false;
		List<Trivia> leading = new ArrayList<>();
		changed |= process(token.getLeadingTrivia(), leading);
		if (pendingBreak) {
			leading.add(ctx.newlineTrivia());
			if (token.getType() != TokenType.EOF) {
				addIndent(leading);
			}
			pendingBreak = false;
			changed = true;
		}
		track(token.getText());
		List<Trivia> trailing = new ArrayList<>();
		changed |= process(token.getTrailingTrivia(), trailing);
		if (!changed) {
			return token;
		}
		return token.withTrivia(leading, trailing);
	}

	/**
	 * Copies {@code pieces} into {@code out}, repairing comment lines.
	 * Returns whether anything changed.
	 */
	private boolean process(List<Trivia> pieces, List<Trivia> out) {
		boolean changed = false;
		for (Trivia piece : pieces) {
			if (pendingBreak) {
				if (piece.isWhitespace() && !piece.containsNewline()) {
					changed = true;
					continue;
				}
				if (piece.isComment()) {
					out.add(ctx.newlineTrivia());
					addIndent(out);
					changed = true;
				}
				pendingBreak = false;
			}
			out.add(piece);
			track(piece.getText());
			if (piece.getKind() == TriviaKind.SINGLE_LINE_COMMENT) {
				pendingBreak = true;
				breakIndent = lineIndent() + ctx.indentUnit();
			}
		}
		return changed;
	}

	private void addIndent(List<Trivia> out) {
		out.add(Trivia.whitespace(breakIndent));
		line.setLength(0);
		line.append(breakIndent);
	}

	private void track(String text) {
		int newline = text.lastIndexOf('\n');
		if (newline < 0) {
			line.append(text);
		} else {
			line.setLength(0);
			line.append(text, newline + 1, text.length());
		}
	}

	private String lineIndent() {
		int end = 0;
		while (end < line.length() && (line.charAt(end) == ' ' || line.charAt(end) == '\t')) {
			end++;
		}
		return line.substring(0, end);
	}
}
