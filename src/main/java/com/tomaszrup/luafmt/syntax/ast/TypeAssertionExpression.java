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
 * {@code expression :: Type}
 */
public final class TypeAssertionExpression extends Expression {

	private final Expression expression;
	private final Token doubleColon;
	private final TypeInfo type;

	public TypeAssertionExpression(Expression expression, Token doubleColon, TypeInfo type) {
		this.expression = expression;
		this.doubleColon = doubleColon;
		this.type = type;
	}

	@Override
	public ExpressionKind getKind() {
		return ExpressionKind.TYPE_ASSERTION;
	}

	public Expression getExpression() {
		return expression;
	}

	public Token getDoubleColon() {
		return doubleColon;
	}

	public TypeInfo getType() {
		return type;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, expression, doubleColon, type);
		visitor.exitNode(this);
	}

	@Override
	public TypeAssertionExpression mapTokens(UnaryOperator<Token> mapper) {
		Expression newExpression = Nodes.map(expression, mapper, Expression::mapTokens);
		Token newColon = Nodes.map(doubleColon, mapper);
		TypeInfo newType = Nodes.map(type, mapper, TypeInfo::mapTokens);
		return new TypeAssertionExpression(newExpression, newColon, newType);
	}
}
