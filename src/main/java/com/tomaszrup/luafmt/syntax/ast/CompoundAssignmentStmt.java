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
 * {@code target op= value}, e.g. {@code count += 1}.
 */
public final class CompoundAssignmentStmt extends Stmt {

	private final Expression target;
	private final Token operator;
	private final Expression value;

	public CompoundAssignmentStmt(Expression target, Token operator, Expression value) {
		this.target = target;
		this.operator = operator;
		this.value = value;
	}

	@Override
	public StmtKind getKind() {
		return StmtKind.COMPOUND_ASSIGNMENT;
	}

	public Expression getTarget() {
		return target;
	}

	public Token getOperator() {
		return operator;
	}

	public Expression getValue() {
		return value;
	}

	@Override
	public void accept(SyntaxVisitor visitor) {
		visitor.enterNode(this);
		Nodes.visit(visitor, target, operator, value);
		visitor.exitNode(this);
	}

	@Override
	public CompoundAssignmentStmt mapTokens(UnaryOperator<Token> mapper) {
		Expression newTarget = Nodes.map(target, mapper, Expression::mapTokens);
		Token newOperator = Nodes.map(operator, mapper);
		Expression newValue = Nodes.map(value, mapper, Expression::mapTokens);
		return new CompoundAssignmentStmt(newTarget, newOperator, newValue);
	}
}
