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

import java.util.List;

/**
 * Renders syntax back to text by concatenating every token with its trivia
 * in source order.
 */
public final class CstPrinter {

	private CstPrinter() {
	}

	public static String print(SyntaxNode node) {
		StringBuilder builder = new StringBuilder();
		node.accept(new SyntaxVisitor() {
			@Override
			public void visitToken(Token token) {
				appendToken(builder, token, true, true);
			}
		});
		return builder.toString();
	}

	/**
	 * Prints the node without the leading trivia of its first token and the
	 * trailing trivia of its last token.
	 */
	public static String printTrimmed(SyntaxNode node) {
		List<Token> tokens = Tokens.collect(node);
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < tokens.size(); i++) {
			appendToken(builder, tokens.get(i), i > 0, i < tokens.size() - 1);
		}
		return builder.toString();
	}

	private static void appendToken(StringBuilder builder, Token token, boolean leading, boolean trailing) {
		if (leading) {
			appendTrivia(builder, token.getLeadingTrivia());
		}
		builder.append(token.getText());
		if (trailing) {
			appendTrivia(builder, token.getTrailingTrivia());
		}
	}

	private static void appendTrivia(StringBuilder builder, List<Trivia> trivia) {
		for (Trivia piece : trivia) {
			builder.append(piece.getText());
		}
	}
}
