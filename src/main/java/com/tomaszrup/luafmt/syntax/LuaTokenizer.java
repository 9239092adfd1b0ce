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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits source text into tokens, keeping every whitespace and comment
 * character as trivia so that printing the tokens back reproduces the input.
 *
 * <p>Trivia following a token up to and including the first line break is
 * attached to that token as trailing trivia; everything else is attached to
 * the next token as leading trivia. Whatever follows the last token ends up
 * on the {@link TokenType#EOF} token.</p>
 */
public final class LuaTokenizer {

	static final Set<String> KEYWORDS = Set.of(
			"and", "break", "do", "else", "elseif", "end", "false", "for", "function", "if", "in",
			"local", "nil", "not", "or", "repeat", "return", "then", "true", "until", "while");

	// longest first
	private static final String[] SYMBOLS = {
			"...", "..=",
			"..", "==", "~=", "<=", ">=", "::", "->", "+=", "-=", "*=", "/=", "%=", "^=",
			"+", "-", "*", "/", "%", "^", "#", "<", ">", "=", "(", ")", "{", "}", "[", "]",
			";", ":", ",", ".", "?", "|", "&"
	};

	private final String source;
	private int pos;

	public LuaTokenizer(String source) {
		this.source = source;
	}

	public static List<Token> tokenize(String source) throws ParseException {
		return new LuaTokenizer(source).run();
	}

	private List<Token> run() throws ParseException {
		List<Token> tokens = new ArrayList<>();
		List<Object> pieces = new ArrayList<>();
		while (pos < source.length()) {
			pieces.add(nextPiece());
		}

		List<Trivia> pending = new ArrayList<>();
		int i = 0;
		while (i < pieces.size()) {
			Object piece = pieces.get(i++);
			if (piece instanceof Trivia) {
				pending.add((Trivia) piece);
				continue;
			}
			RawToken raw = (RawToken) piece;
			List<Trivia> trailing = new ArrayList<>();
			while (i < pieces.size() && pieces.get(i) instanceof Trivia) {
				Trivia trivia = (Trivia) pieces.get(i);
				trailing.add(trivia);
				i++;
				if (trivia.containsNewline()
						|| (trivia.getKind() == TriviaKind.MULTI_LINE_COMMENT && trivia.getText().indexOf('\n') >= 0)) {
					break;
				}
			}
			tokens.add(new Token(raw.type, raw.text, pending, trailing, raw.start, raw.end));
			pending = new ArrayList<>();
		}
		tokens.add(new Token(TokenType.EOF, "", pending, new ArrayList<>(), source.length(), source.length()));
		return tokens;
	}

	private static final class RawToken {
		private final TokenType type;
		private final String text;
		private final int start;
		private final int end;

		private RawToken(TokenType type, String text, int start, int end) {
			this.type = type;
			this.text = text;
			this.start = start;
			this.end = end;
		}
	}

	private Object nextPiece() throws ParseException {
		char c = source.charAt(pos);
		int start = pos;
		if (isWhitespace(c)) {
			return readWhitespace();
		}
		if (c == '-' && peek(1) == '-') {
			return readComment();
		}
		if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
			readNumber();
			return raw(TokenType.NUMBER, start);
		}
		if (c == '"' || c == '\'') {
			readQuotedString(c);
			return raw(TokenType.STRING, start);
		}
		if (c == '[') {
			int level = longBracketLevel(pos);
			if (level >= 0) {
				readLongBracket(level, "unterminated long string");
				return raw(TokenType.STRING, start);
			}
		}
		if (isIdentifierStart(c)) {
			while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
				pos++;
			}
			String word = source.substring(start, pos);
			return raw(KEYWORDS.contains(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER, start);
		}
		for (String symbol : SYMBOLS) {
			if (source.startsWith(symbol, pos)) {
				pos += symbol.length();
				return raw(TokenType.SYMBOL, start);
			}
		}
		throw error("unexpected character '" + c + "'", start);
	}

	private RawToken raw(TokenType type, int start) {
		return new RawToken(type, source.substring(start, pos), start, pos);
	}

	private Trivia readWhitespace() {
		int start = pos;
		while (pos < source.length()) {
			char c = source.charAt(pos);
			if (c == '\n') {
				pos++;
				break;
			}
			if (c == '\r' && peek(1) == '\n') {
				pos += 2;
				break;
			}
			if (!isWhitespace(c)) {
				break;
			}
			pos++;
		}
		return Trivia.whitespace(source.substring(start, pos));
	}

	private Trivia readComment() throws ParseException {
		int start = pos;
		pos += 2;
		if (pos < source.length() && source.charAt(pos) == '[') {
			int level = longBracketLevel(pos);
			if (level >= 0) {
				readLongBracket(level, "unterminated comment");
				return new Trivia(TriviaKind.MULTI_LINE_COMMENT, source.substring(start, pos));
			}
		}
		while (pos < source.length() && source.charAt(pos) != '\n') {
			if (source.charAt(pos) == '\r' && peek(1) == '\n') {
				break;
			}
			pos++;
		}
		return new Trivia(TriviaKind.SINGLE_LINE_COMMENT, source.substring(start, pos));
	}

	/**
	 * Returns the number of {@code =} signs of a long bracket opening at
	 * {@code at}, or -1 when there is none.
	 */
	private int longBracketLevel(int at) {
		if (at >= source.length() || source.charAt(at) != '[') {
			return -1;
		}
		int i = at + 1;
		int level = 0;
		while (i < source.length() && source.charAt(i) == '=') {
			level++;
			i++;
		}
		if (i < source.length() && source.charAt(i) == '[') {
			return level;
		}
		return -1;
	}

	private void readLongBracket(int level, String unterminatedMessage) throws ParseException {
		int start = pos;
		StringBuilder close = new StringBuilder("]");
		for (int i = 0; i < level; i++) {
			close.append('=');
		}
		close.append(']');
		int end = source.indexOf(close.toString(), pos + level + 2);
		if (end < 0) {
			throw error(unterminatedMessage, start);
		}
		pos = end + close.length();
	}

	private void readQuotedString(char quote) throws ParseException {
		int start = pos;
		pos++;
		while (true) {
			if (pos >= source.length()) {
				throw error("unterminated string", start);
			}
			char c = source.charAt(pos);
			if (c == quote) {
				pos++;
				return;
			}
			if (c == '\n' || c == '\r') {
				throw error("unterminated string", start);
			}
			if (c == '\\') {
				if (peek(1) == '\r' && peek(2) == '\n') {
					pos += 3;
				} else if (peek(1) == 'z') {
					// \z skips the following whitespace, line breaks included
					pos += 2;
					while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
						pos++;
					}
				} else {
					pos += 2;
				}
				continue;
			}
			pos++;
		}
	}

	private void readNumber() {
		if (source.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
			pos += 2;
			while (pos < source.length() && (isHexDigit(source.charAt(pos)) || source.charAt(pos) == '_'
					|| source.charAt(pos) == '.')) {
				pos++;
			}
			readExponent('p', 'P');
			return;
		}
		if (source.charAt(pos) == '0' && (peek(1) == 'b' || peek(1) == 'B')) {
			pos += 2;
			while (pos < source.length() && (source.charAt(pos) == '0' || source.charAt(pos) == '1'
					|| source.charAt(pos) == '_')) {
				pos++;
			}
			return;
		}
		while (pos < source.length() && (isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
			pos++;
		}
		if (pos < source.length() && source.charAt(pos) == '.' && peek(1) != '.') {
			pos++;
			while (pos < source.length() && (isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
				pos++;
			}
		}
		readExponent('e', 'E');
	}

	private void readExponent(char lower, char upper) {
		if (pos < source.length() && (source.charAt(pos) == lower || source.charAt(pos) == upper)) {
			int save = pos;
			pos++;
			if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
				pos++;
			}
			if (pos >= source.length() || !isDigit(source.charAt(pos))) {
				pos = save;
				return;
			}
			while (pos < source.length() && isDigit(source.charAt(pos))) {
				pos++;
			}
		}
	}

	private char peek(int ahead) {
		int at = pos + ahead;
		return at < source.length() ? source.charAt(at) : '\0';
	}

	private ParseException error(String message, int offset) {
		int line = 1;
		int column = 1;
		for (int i = 0; i < offset && i < source.length(); i++) {
			if (source.charAt(i) == '\n') {
				line++;
				column = 1;
			} else {
				column++;
			}
		}
		return new ParseException(message, offset, line, column);
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f' || c == '\u000B';
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isHexDigit(char c) {
		return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
	}

	private static boolean isIdentifierStart(char c) {
		return c == '_' || Character.isLetter(c);
	}

	private static boolean isIdentifierPart(char c) {
		return c == '_' || Character.isLetterOrDigit(c);
	}
}
