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
 * A name, literal ({@code nil}, booleans, numbers, strings) or {@code ...}.
 */
public final class TokenExpression extends Expression {

	private final Token token;

	public TokenExpression(Token token) {
		this.token = token;
	}

	@Override
	public ExpressionKind getKind() {
		return ExpressionKind.VALUE;
	}

	public Token getToken() {
		return token;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, token);
		visitor.exitNode(this);
	}

	@Override
	public TokenExpression mapTokens(UnaryOperator<Token> mapper) {
		return new TokenExpression(Nodes.map(token, mapper));
	}
}
