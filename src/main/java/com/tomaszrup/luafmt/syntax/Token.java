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
package com.tomaszrup.luafmt.syntax;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A significant lexical token with the trivia attached on either side.
 *
 * <p>Offsets are character indices into the parsed source; tokens created by
 * the formatter carry {@code -1} for both.</p>
 */
public final class Token implements SyntaxNode {

	private final TokenType type;
	private final String text;
	private final List<Trivia> leadingTrivia;
	private final List<Trivia> trailingTrivia;
	private final int startOffset;
	private final int endOffset;

	public Token(TokenType type, String text, List<Trivia> leadingTrivia, List<Trivia> trailingTrivia,
			int startOffset, int endOffset) {
		this.type = Objects.requireNonNull(type, "type");
		this.text = Objects.requireNonNull(text, "text");
		this.leadingTrivia = List.copyOf(leadingTrivia);
		this.trailingTrivia = List.copyOf(trailingTrivia);
		this.startOffset = startOffset;
		this.endOffset = endOffset;
	}

	/**
	 * Creates a token that does not originate from parsed source.
	 */
	public static Token synthetic(TokenType type, String text) {
		return new Token(type, text, Collections.emptyList(), Collections.emptyList(), -1, -1);
	}

	public static Token symbol(String text) {
		return synthetic(TokenType.SYMBOL, text);
	}

	public static Token keyword(String text) {
		return synthetic(TokenType.KEYWORD, text);
	}

	public TokenType getType() {
		return type;
	}

	public String getText() {
		return text;
	}

	public List<Trivia> getLeadingTrivia() {
		return leadingTrivia;
	}

	public List<Trivia> getTrailingTrivia() {
		return trailingTrivia;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public boolean isSynthetic() {
		return startOffset < 0;
	}

	/**
	 * Whether this token is a keyword or symbol with the given text.
	 */
	public boolean is(String value) {
		return (type == TokenType.KEYWORD || type == TokenType.SYMBOL) && text.equals(value);
	}

	public boolean isIdentifier(String value) {
		return type == TokenType.IDENTIFIER && text.equals(value);
	}

	public Token withText(String newText) {
		return new Token(type, newText, leadingTrivia, trailingTrivia, startOffset, endOffset);
	}

	public Token withLeadingTrivia(List<Trivia> trivia) {
		return new Token(type, text, trivia, trailingTrivia, startOffset, endOffset);
	}

	public Token withTrailingTrivia(List<Trivia> trivia) {
		return new Token(type, text, leadingTrivia, trivia, startOffset, endOffset);
	}

	public Token withTrivia(List<Trivia> leading, List<Trivia> trailing) {
		return new Token(type, text, leading, trailing, startOffset, endOffset);
	}

	public Token withoutTrivia() {
		return withTrivia(Collections.emptyList(), Collections.emptyList());
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.visitToken(this);
	}

	@Override
	public Token mapTokens(UnaryOperator<Token> mapper) {
		return mapper.apply(this);
	}

	@Override
	public String toString() {
		return type + "(" + text + ")@" + startOffset;
	}
}
