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

import com.tomaszrup.luafmt.config.QuoteStyle;

/**
 * Quote handling for short string literals. Long bracket strings are never
 * touched.
 */
public final class StringLiterals {

	private StringLiterals() {
	}

	public static boolean isLongString(String literal) {
		return literal.startsWith("[");
	}

	/**
	 * Rewrites a short string literal to use the quote chosen by {@code style},
	 * escaping that quote inside the body and unescaping the other one.
	 */
	public static String requote(String literal, QuoteStyle style) {
		if (isLongString(literal) || literal.length() < 2) {
			return literal;
		}
		String body = literal.substring(1, literal.length() - 1);
		char target = targetQuote(body, style);
		StringBuilder builder = new StringBuilder(literal.length() + 2);
		builder.append(target);
		for (int i = 0; i < body.length(); i++) {
			char c = body.charAt(i);
			if (c == '\\' && i + 1 < body.length()) {
				char next = body.charAt(i + 1);
				if ((next == '\'' || next == '"') && next != target) {
					builder.append(next);
				} else {
					builder.append(c).append(next);
				}
				i++;
			} else if (c == target) {
				builder.append('\\').append(c);
			} else {
				builder.append(c);
			}
		}
		builder.append(target);
		return builder.toString();
	}

	/**
	 * The literal's content with quote escapes resolved, so that
	 * {@code 'it\'s'} and {@code "it's"} compare equal. Other escapes are
	 * left as written.
	 */
	public static String canonicalContent(String literal) {
		if (isLongString(literal) || literal.length() < 2) {
			return literal;
		}
		String body = literal.substring(1, literal.length() - 1);
		StringBuilder builder = new StringBuilder(body.length());
		for (int i = 0; i < body.length(); i++) {
			char c = body.charAt(i);
			if (c == '\\' && i + 1 < body.length()) {
				char next = body.charAt(i + 1);
				if (next != '\'' && next != '"') {
					builder.append(c);
				}
				builder.append(next);
				i++;
			} else {
				builder.append(c);
			}
		}
		return builder.toString();
	}

	private static char targetQuote(String body, QuoteStyle style) {
		int doubles = 0;
		int singles = 0;
		for (int i = 0; i < body.length(); i++) {
			char c = body.charAt(i);
			if (c == '\\' && i + 1 < body.length()) {
				c = body.charAt(++i);
			}
			if (c == '"') {
				doubles++;
			} else if (c == '\'') {
				singles++;
			}
		}
		switch (style) {
			case FORCE_DOUBLE:
				return '"';
			case FORCE_SINGLE:
				return '\'';
			case AUTO_PREFER_SINGLE:
				return singles > doubles ? '"' : '\'';
			case AUTO_PREFER_DOUBLE:
			default:
				return doubles > singles ? '\'' : '"';
		}
	}
}
