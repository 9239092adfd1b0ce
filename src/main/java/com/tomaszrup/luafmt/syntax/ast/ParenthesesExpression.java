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

public final class ParenthesesExpression extends Expression {

	private final Token open;
	private final Expression inner;
	private final Token close;

	public ParenthesesExpression(Token open, Expression inner, Token close) {
		this.open = open;
		this.inner = inner;
		this.close = close;
	}

	@Override
	public ExpressionKind getKind() {
		return ExpressionKind.PARENTHESES;
	}

	public Token getOpen() {
		return open;
	}

	public Expression getInner() {
		return inner;
	}

	public Token getClose() {
		return close;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, open, inner, close);
		visitor.exitNode(this);
	}

	@Override
	public ParenthesesExpression mapTokens(UnaryOperator<Token> mapper) {
		Token newOpen = Nodes.map(open, mapper);
		Expression newInner = Nodes.map(inner, mapper, Expression::mapTokens);
		Token newClose = Nodes.map(close, mapper);
		return new ParenthesesExpression(newOpen, newInner, newClose);
	}
}
