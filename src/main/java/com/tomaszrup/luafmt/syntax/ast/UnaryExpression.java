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
 * {@code not x}, {@code -x} or {@code #x}.
 */
public final class UnaryExpression extends Expression {

	private final Token operator;
	private final Expression operand;

	public UnaryExpression(Token operator, Expression operand) {
		this.operator = operator;
		this.operand = operand;
	}

	@Override
	public ExpressionKind getKind() {
		return ExpressionKind.UNARY;
	}

	public Token getOperator() {
		return operator;
	}

	public Expression getOperand() {
		return operand;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, operator, operand);
		visitor.exitNode(this);
	}

	@Override
	public UnaryExpression mapTokens(UnaryOperator<Token> mapper) {
		Token newOperator = Nodes.map(operator, mapper);
		Expression newOperand = Nodes.map(operand, mapper, Expression::mapTokens);
		return new UnaryExpression(newOperator, newOperand);
	}
}
