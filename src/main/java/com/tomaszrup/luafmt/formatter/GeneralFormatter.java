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
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

import com.tomaszrup.luafmt.syntax.SyntaxNode;
import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.Tokens;
import com.tomaszrup.luafmt.syntax.Trivia;
import com.tomaszrup.luafmt.syntax.TriviaKind;
import com.tomaszrup.luafmt.syntax.ast.Punctuated;

/**
 * Token-level formatting: whitespace is discarded, comments are kept and
 * re-laid out, and spacing is added explicitly by the callers.
 */
final class GeneralFormatter {

	private static final Trivia SPACE = Trivia.whitespace(" ");

	private GeneralFormatter() {
	}

	/**
	 * Formats a token in the middle of a line. Leading comments stay in front
	 * of it; trailing comments follow it after a single space.
	 */
	static Token formatToken(Token token) {
		return token.withTrivia(inlineLeadingTrivia(token.getLeadingTrivia()),
				trailingComments(token.getTrailingTrivia()));
	}

	/**
	 * Formats a token in the middle of a line and replaces its text, used for
	 * separators and quote normalization.
	 */
	static Token formatToken(Token token, String text) {
		return formatToken(token).withText(text);
	}

	/** {@code formatToken} with a space on both sides. */
	static Token formatSpaced(Token token) {
		return withTrailingSpace(withLeadingSpace(formatToken(token)));
	}

	/**
	 * Formats a token that closes a block ({@code end}, {@code else},
	 * {@code until}, ...). Its leading comments belong to the block it closes,
	 * so they are indented one level deeper than the token.
	 */
	static Token formatEndToken(FormatContext ctx, Token token, Shape shape) {
		return token.withTrivia(
				lineLeadingTrivia(ctx, token.getLeadingTrivia(), ctx.indent(shape.nestedBlock()), ctx.indent(shape)),
				trailingComments(token.getTrailingTrivia()));
	}

	static List<Trivia> inlineLeadingTrivia(List<Trivia> original) {
		List<Trivia> result = new ArrayList<>();
		for (Trivia piece : original) {
			if (piece.getKind() == TriviaKind.MULTI_LINE_COMMENT) {
				result.add(piece);
				result.add(SPACE);
			} else if (piece.getKind() == TriviaKind.SINGLE_LINE_COMMENT) {
				result.add(piece);
			}
		}
		return result;
	}

	static List<Trivia> trailingComments(List<Trivia> original) {
		List<Trivia> result = new ArrayList<>();
		for (Trivia piece : original) {
			if (piece.isComment()) {
				result.add(SPACE);
				result.add(piece);
			}
		}
		return result;
	}

	/**
	 * Lays out leading comments of a token that begins a line. Each comment
	 * goes on its own line at {@code commentIndent}; a multi-line comment that
	 * shared a line with the token stays on that line. One blank line between
	 * comments, or between the last comment and the token, is preserved.
	 */
	static List<Trivia> lineLeadingTrivia(FormatContext ctx, List<Trivia> original, String commentIndent,
			String tokenIndent) {
		List<Trivia> result = new ArrayList<>();
		boolean atLineStart = true;
		boolean seenComment = false;
		int newlines = 0;
		for (int i = 0; i < original.size(); i++) {
			Trivia piece = original.get(i);
			if (piece.isWhitespace()) {
				newlines += TriviaUtil.countNewlines(piece.getText());
				continue;
			}
			if (seenComment && atLineStart && newlines >= 2) {
				result.add(ctx.newlineTrivia());
			}
			if (atLineStart) {
				addIndent(result, commentIndent);
			}
			result.add(piece);
			if (piece.getKind() == TriviaKind.SINGLE_LINE_COMMENT || followedByNewline(original, i)) {
				result.add(ctx.newlineTrivia());
				atLineStart = true;
			} else {
				result.add(SPACE);
				atLineStart = false;
			}
			seenComment = true;
			newlines = 0;
		}
		if (seenComment && atLineStart && newlines >= 2) {
			result.add(ctx.newlineTrivia());
		}
		if (atLineStart) {
			addIndent(result, tokenIndent);
		}
		return result;
	}

	private static boolean followedByNewline(List<Trivia> trivia, int index) {
		for (int i = index + 1; i < trivia.size(); i++) {
			Trivia piece = trivia.get(i);
			if (piece.isComment()) {
				return false;
			}
			if (piece.containsNewline()) {
				return true;
			}
		}
		return false;
	}

	private static void addIndent(List<Trivia> result, String indent) {
		if (!indent.isEmpty()) {
			result.add(Trivia.whitespace(indent));
		}
	}

	static Token withLeadingSpace(Token token) {
		return prependLeading(token, Collections.singletonList(SPACE));
	}

	static Token withTrailingSpace(Token token) {
		return appendTrailing(token, Collections.singletonList(SPACE));
	}

	static Token withTrailingNewline(FormatContext ctx, Token token) {
		return appendTrailing(token, Collections.singletonList(ctx.newlineTrivia()));
	}

	static Token prependLeading(Token token, List<Trivia> trivia) {
		List<Trivia> leading = new ArrayList<>(trivia);
		leading.addAll(token.getLeadingTrivia());
		return token.withLeadingTrivia(leading);
	}

	static Token appendTrailing(Token token, List<Trivia> trivia) {
		List<Trivia> trailing = new ArrayList<>(token.getTrailingTrivia());
		trailing.addAll(trivia);
		return token.withTrailingTrivia(trailing);
	}

	// ------------------------------------------------------------------
	// Node edges
	// ------------------------------------------------------------------

	// Each helper below returns a token mapper for the node's own mapTokens,
	// so callers keep their static type: node.mapTokens(leadingSpace(node)).

	/** Applies {@code mapper} to the first token of {@code node} only. */
	static UnaryOperator<Token> onFirstToken(SyntaxNode node, UnaryOperator<Token> mapper) {
		Token first = Tokens.first(node);
		return token -> token == first ? mapper.apply(token) : token;
	}

	/** Applies {@code mapper} to the last token of {@code node} only. */
	static UnaryOperator<Token> onLastToken(SyntaxNode node, UnaryOperator<Token> mapper) {
		Token last = Tokens.last(node);
		return token -> token == last ? mapper.apply(token) : token;
	}

	static UnaryOperator<Token> leadingSpace(SyntaxNode node) {
		return onFirstToken(node, GeneralFormatter::withLeadingSpace);
	}

	static UnaryOperator<Token> trailingNewline(FormatContext ctx, SyntaxNode node) {
		return onLastToken(node, token -> withTrailingNewline(ctx, token));
	}

	/**
	 * Re-lays out the leading comments of a node that starts a line, using the
	 * leading trivia of {@code originalFirst} as the source of comments.
	 */
	static UnaryOperator<Token> lineLeading(FormatContext ctx, SyntaxNode node, Token originalFirst,
			String commentIndent, String tokenIndent) {
		List<Trivia> leading = lineLeadingTrivia(ctx, originalFirst.getLeadingTrivia(), commentIndent, tokenIndent);
		return onFirstToken(node, token -> token.withLeadingTrivia(leading));
	}

	/**
	 * Clears the trailing trivia of the node's last token. Its comments are
	 * added to {@code removed} right away.
	 */
	static UnaryOperator<Token> takeTrailingComments(SyntaxNode node, List<Trivia> removed) {
		Token last = Tokens.last(node);
		if (last != null) {
			removed.addAll(TriviaUtil.comments(last.getTrailingTrivia()));
		}
		return onLastToken(node, token -> token.withTrailingTrivia(Collections.emptyList()));
	}

	// ------------------------------------------------------------------
	// Lists laid out one element per line
	// ------------------------------------------------------------------

	/**
	 * Puts every element of {@code original} on its own line at
	 * {@code itemShape}, using the already formatted values. Comments trailing
	 * an element move after its separator, and every line ends with a newline.
	 *
	 * @param rebuild the element type's {@code mapTokens}
	 * @param separatorText replacement separator text, or {@code null} to keep
	 *                      the original one
	 * @param trailingSeparator whether the last element gets a separator too
	 */
	static <T extends SyntaxNode> Punctuated<T> layoutOnePerLine(FormatContext ctx, Punctuated<T> original,
			List<T> formatted, BiFunction<T, UnaryOperator<Token>, T> rebuild, Shape itemShape,
			String separatorText, boolean trailingSeparator) {
		String indent = ctx.indent(itemShape);
		List<Punctuated.Pair<T>> pairs = new ArrayList<>();
		for (int i = 0; i < formatted.size(); i++) {
			Punctuated.Pair<T> pair = original.getPairs().get(i);
			T value = formatted.get(i);
			value = rebuild.apply(value, lineLeading(ctx, value, Tokens.first(pair.getValue()), indent, indent));
			List<Trivia> moved = new ArrayList<>();
			value = rebuild.apply(value, takeTrailingComments(value, moved));
			boolean last = i == formatted.size() - 1;
			Token separator = pair.getSeparator();
			if (separator == null && (!last || trailingSeparator)) {
				separator = Token.symbol(separatorText != null ? separatorText : ",");
			}
			if (separator == null) {
				List<Trivia> trailing = spaced(moved);
				trailing.add(ctx.newlineTrivia());
				value = rebuild.apply(value, onLastToken(value, token -> token.withTrailingTrivia(trailing)));
				pairs.add(new Punctuated.Pair<>(value, null));
				continue;
			}
			moved.addAll(TriviaUtil.comments(separator.getLeadingTrivia()));
			moved.addAll(TriviaUtil.comments(separator.getTrailingTrivia()));
			List<Trivia> trailing = spaced(moved);
			trailing.add(ctx.newlineTrivia());
			String text = separatorText != null ? separatorText : separator.getText();
			pairs.add(new Punctuated.Pair<>(value,
					separator.withText(text).withTrivia(Collections.emptyList(), trailing)));
		}
		return new Punctuated<>(pairs);
	}

	/** Each comment preceded by a single space. */
	static List<Trivia> spaced(List<Trivia> comments) {
		List<Trivia> result = new ArrayList<>();
		for (Trivia comment : comments) {
			result.add(SPACE);
			result.add(comment);
		}
		return result;
	}
}
