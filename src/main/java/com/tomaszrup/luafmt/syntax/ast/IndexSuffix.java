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
package com.tomaszrup.luafmt.syntax.ast;

import java.util.function.UnaryOperator;

import com.tomaszrup.luafmt.syntax.SyntaxVisitor;
import com.tomaszrup.luafmt.syntax.Token;

/**
 * {@code .name} or {@code [expression]}.
 */
public final class IndexSuffix extends Suffix {

	private final Token dot;
	private final Token name;
	private final Token openBracket;
	private final Expression key;
	private final Token closeBracket;

	private IndexSuffix(Token dot, Token name, Token openBracket, Expression key, Token closeBracket) {
		this.dot = dot;
		this.name = name;
		this.openBracket = openBracket;
		this.key = key;
		this.closeBracket = closeBracket;
	}

	public static IndexSuffix dot(Token dot, Token name) {
		return new IndexSuffix(dot, name, null, null, null);
	}

	public static IndexSuffix brackets(Token openBracket, Expression key, Token closeBracket) {
		return new IndexSuffix(null, null, openBracket, key, closeBracket);
	}

	public boolean isDot() {
		return dot != null;
	}

	public Token getDot() {
		return dot;
	}

	public Token getName() {
		return name;
	}

	public Token getOpenBracket() {
		return openBracket;
	}

	public Expression getKey() {
		return key;
	}

	public Token getCloseBracket() {
		return closeBracket;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, dot, name, openBracket, key, closeBracket);
		visitor.exitNode(this);
	}

	@Override
	public IndexSuffix mapTokens(UnaryOperator<Token> mapper) {
		Token newDot = Nodes.map(dot, mapper);
		Token newName = Nodes.map(name, mapper);
		Token newOpen = Nodes.map(openBracket, mapper);
		Expression newKey = Nodes.map(key, mapper, Expression::mapTokens);
		Token newClose = Nodes.map(closeBracket, mapper);
		return new IndexSuffix(newDot, newName, newOpen, newKey, newClose);
	}
}
