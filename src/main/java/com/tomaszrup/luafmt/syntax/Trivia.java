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

import java.util.Objects;

/**
 * A single piece of whitespace or comment text attached to a {@link Token}.
 */
public final class Trivia {

	private final TriviaKind kind;
	private final String text;

	public Trivia(TriviaKind kind, String text) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.text = Objects.requireNonNull(text, "text");
	}

	public static Trivia whitespace(String text) {
		return new Trivia(TriviaKind.WHITESPACE, text);
	}

	public TriviaKind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	public boolean isComment() {
		return kind != TriviaKind.WHITESPACE;
	}

	public boolean isWhitespace() {
		return kind == TriviaKind.WHITESPACE;
	}

	/**
	 * Whether this is whitespace that ends (or contains) a line break.
	 */
	public boolean containsNewline() {
		return kind == TriviaKind.WHITESPACE && text.indexOf('\n') >= 0;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Trivia)) {
			return false;
		}
		Trivia other = (Trivia) o;
		return kind == other.kind && text.equals(other.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text);
	}

	@Override
	public String toString() {
		return kind + "(" + text.replace("\n", "\\n") + ")";
	}
}
