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

public final class BinaryExpression extends Expression {

	private final Expression lhs;
	private final Token operator;
	private final Expression rhs;

	public BinaryExpression(Expression lhs, Token operator, Expression rhs) {
		this.lhs = lhs;
		this.operator = operator;
		this.rhs = rhs;
	}

	@Override
	public ExpressionKind getKind() {
		return ExpressionKind.BINARY;
	}

	public Expression getLhs() {
		return lhs;
	}

	public Token getOperator() {
		return operator;
	}

	public Expression getRhs() {
		return rhs;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, lhs, operator, rhs);
		visitor.exitNode(this);
	}

	@Override
	public BinaryExpression mapTokens(UnaryOperator<Token> mapper) {
		Expression newLhs = Nodes.map(lhs, mapper, Expression::mapTokens);
		Token newOperator = Nodes.map(operator, mapper);
		Expression newRhs = Nodes.map(rhs, mapper, Expression::mapTokens);
		return new BinaryExpression(newLhs, newOperator, newRhs);
	}
}
