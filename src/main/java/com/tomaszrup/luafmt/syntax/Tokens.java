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

/**
 * Token-level queries over any {@link SyntaxNode}.
 */
public final class Tokens {

	private Tokens() {
	}

	public static List<Token> collect(SyntaxNode node) {
		List<Token> tokens = new ArrayList<>();
		node.accept(new SyntaxVisitor() {
			@Override
			public void visitToken(Token token) {
				tokens.add(token);
			}
		});
		return tokens;
	}

	/**
	 * First token of the node in source order, or {@code null} for an empty node.
	 */
	public static Token first(SyntaxNode node) {
		Token[] found = new Token[1];
		node.accept(new SyntaxVisitor() {
			@Override
			public void visitToken(Token token) {
				if (found[0] == null) {
					found[0] = token;
				}
			}
		});
		return found[0];
	}

	/**
	 * Last token of the node in source order, or {@code null} for an empty node.
	 */
	public static Token last(SyntaxNode node) {
		Token[] found = new Token[1];
		node.accept(new SyntaxVisitor() {
			@Override
			public void visitToken(Token token) {
				found[0] = token;
			}
		});
		return found[0];
	}
}
