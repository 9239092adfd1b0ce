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

import com.tomaszrup.luafmt.syntax.SyntaxNode;
import com.tomaszrup.luafmt.syntax.Token;
import com.tomaszrup.luafmt.syntax.Tokens;
import com.tomaszrup.luafmt.syntax.Trivia;
import com.tomaszrup.luafmt.syntax.ast.Punctuated;

/**
 * Queries about the comments attached to tokens and nodes.
 */
public final class TriviaUtil {

	private TriviaUtil() {
	}

	public static List<Trivia> comments(List<Trivia> trivia) {
		List<Trivia> comments = new ArrayList<>();
		for (Trivia piece : trivia) {
			if (piece.isComment()) {
				comments.add(piece);
			}
		}
		return comments;
	}

	public static boolean hasComments(List<Trivia> trivia) {
		for (Trivia piece : trivia) {
			if (piece.isComment()) {
				return true;
			}
		}
		return false;
	}

	public static boolean tokenHasLeadingComments(Token token) {
		return token != null && hasComments(token.getLeadingTrivia());
	}

	public static boolean tokenHasTrailingComments(Token token) {
		return token != null && hasComments(token.getTrailingTrivia());
	}

	public static boolean tokenHasComments(Token token) {
		return tokenHasLeadingComments(token) || tokenHasTrailingComments(token);
	}

	public static boolean containsComments(SyntaxNode node) {
		if (node == null) {
			return false;
		}
		for (Token token : Tokens.collect(node)) {
			if (tokenHasComments(token)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Whether the node has comments anywhere except before its first token
	 * and after its last token.
	 */
	public static boolean containsInlineComments(SyntaxNode node) {
		if (node == null) {
			return false;
		}
		List<Token> tokens = Tokens.collect(node);
		for (int i = 0; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			if (i > 0 && tokenHasLeadingComments(token)) {
				return true;
			}
			if (i < tokens.size() - 1 && tokenHasTrailingComments(token)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Whether the leading trivia starts with a line break before any comment,
	 * meaning the original source had a blank line before the token.
	 */
	public static boolean hasBlankLineBefore(Token token) {
		for (Trivia piece : token.getLeadingTrivia()) {
			if (piece.isComment()) {
				return false;
			}
			if (piece.containsNewline()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Whether any element of the list has comments before or after it, or on
	 * its separator.
	 */
	public static boolean hasEdgeComments(Punctuated<?> list) {
		for (Punctuated.Pair<?> pair : list.getPairs()) {
			if (tokenHasLeadingComments(Tokens.first(pair.getValue()))
					|| tokenHasTrailingComments(Tokens.last(pair.getValue()))
					|| tokenHasComments(pair.getSeparator())) {
				return true;
			}
		}
		return false;
	}

	static int countNewlines(String text) {
		int count = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				count++;
			}
		}
		return count;
	}
}
